/*
 * Copyright (c) 2023, Sirix Contributors
 *
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *     * Redistributions of source code must retain the above copyright
 *       notice, this list of conditions and the following disclaimer.
 *     * Redistributions in binary form must reproduce the above copyright
 *       notice, this list of conditions and the following disclaimer in the
 *       documentation and/or other materials provided with the distribution.
 *     * Neither the name of the <organization> nor the
 *       names of its contributors may be used to endorse or promote products
 *       derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
 * ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
 * WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
 * DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
 * DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
 * (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
 * LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
 * ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
 * SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.xaccel.service.xml.shredder;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import io.xaccel.access.IndexConfiguration;
import io.xaccel.exception.XAccelIOException;
import io.xaccel.node.NodeRecord;
import io.xaccel.utils.LogWrapper;
import org.checkerframework.checker.nullness.qual.Nullable;

import javax.xml.namespace.QName;
import javax.xml.stream.XMLEventReader;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.events.Attribute;
import javax.xml.stream.events.StartElement;
import javax.xml.stream.events.XMLEvent;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Shreds a DBLP extract into the edge model {@code bib -> venue -> year -> publication -> field}.
 *
 * <p>
 * Publications are the {@code article} and {@code inproceedings} children of the document element.
 * They are grouped by venue, classified by the prefix of their {@code key} attribute, and by the text
 * of their {@code year} field, both in order of first appearance. Other children, such as
 * {@code proceedings}, and publications which can't be classified or have no year are skipped. Ids
 * are assigned in document order of the resulting tree, starting at {@code 1}.
 * </p>
 */
public final class DblpEdgeModelShredder {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = LogWrapper.of(DblpEdgeModelShredder.class);

  /** Type of the root node. */
  public static final String BIB = "bib";

  /** Type of venue nodes. */
  public static final String VENUE = "venue";

  /** Type of year nodes. */
  public static final String YEAR = "year";

  private static final QName KEY = new QName("key");

  /** Element names of publications. */
  private static final ImmutableSet<String> PUBLICATIONS = ImmutableSet.of("article", "inproceedings");

  /** Tags of publication children which are not turned into nodes. */
  private final ImmutableSet<String> skippedFields;

  /**
   * Constructor.
   *
   * @param skippedFields tags of publication children which are not turned into nodes
   */
  public DblpEdgeModelShredder(final Set<String> skippedFields) {
    this.skippedFields = ImmutableSet.copyOf(skippedFields);
  }

  /**
   * Create a shredder using the skipped fields of a configuration.
   *
   * @param config the configuration
   * @return the shredder
   */
  public static DblpEdgeModelShredder of(final IndexConfiguration config) {
    return new DblpEdgeModelShredder(config.getSkippedFields());
  }

  /**
   * Classify a DBLP key.
   *
   * @param key the publication key, for instance {@code journals/pvldb/SchmittKAMM23}
   * @return the venue, {@code sigmod}, {@code vldb} or {@code icde}
   */
  public static Optional<String> classifyVenue(final String key) {
    if (key.startsWith("conf/sigmod") || key.startsWith("journals/pacmmod")) {
      return Optional.of("sigmod");
    }
    if (key.startsWith("conf/vldb") || key.startsWith("journals/pvldb")) {
      return Optional.of("vldb");
    }
    if (key.startsWith("conf/icde")) {
      return Optional.of("icde");
    }
    return Optional.empty();
  }

  /**
   * Short key of a publication, the last segment of its key.
   *
   * @param key the publication key
   * @return the short key
   */
  public static String shortKey(final String key) {
    return key.substring(key.lastIndexOf('/') + 1);
  }

  /**
   * Shred a file.
   *
   * @param file the DBLP XML file
   * @return node records in document order
   * @throws XAccelIOException if the file can't be read or isn't well-formed
   */
  public List<NodeRecord> shred(final Path file) throws XAccelIOException {
    requireNonNull(file);
    try (final InputStream in = Files.newInputStream(file)) {
      return shred(in);
    } catch (final IOException e) {
      throw new XAccelIOException(e);
    }
  }

  /**
   * Shred a stream. The stream is not closed.
   *
   * @param in the DBLP XML input
   * @return node records in document order
   * @throws XAccelIOException if the input isn't well-formed
   */
  public List<NodeRecord> shred(final InputStream in) throws XAccelIOException {
    final long start = System.nanoTime();
    final Map<String, Map<String, List<Publication>>> venues = new LinkedHashMap<>();
    final XMLEventReader reader = XmlNodeStreamReader.createReader(in);
    int skipped = 0;
    try {
      int depth = 0;
      while (reader.hasNext()) {
        final XMLEvent event = reader.nextEvent();
        if (event.isStartElement()) {
          depth++;
          if (depth == 2) {
            final StartElement element = event.asStartElement();
            final Publication publication = readPublication(reader, element);
            depth--;
            if (!PUBLICATIONS.contains(publication.tag)) {
              skipped++;
              continue;
            }
            final Attribute key = element.getAttributeByName(KEY);
            final Optional<String> venue = key == null ? Optional.empty() : classifyVenue(key.getValue());
            if (venue.isEmpty() || publication.year == null) {
              skipped++;
              continue;
            }
            venues.computeIfAbsent(venue.get(), v -> new LinkedHashMap<>())
                  .computeIfAbsent(publication.year, y -> new ArrayList<>())
                  .add(publication);
          }
        } else if (event.isEndElement()) {
          depth--;
        }
      }
      reader.close();
    } catch (final XMLStreamException e) {
      throw new XAccelIOException(e);
    }
    if (skipped > 0) {
      LOGWRAPPER.debug("Skipped {} elements which are no publications or have no venue or year.", skipped);
    }
    final List<NodeRecord> records = toRecords(venues);
    LOGWRAPPER.infoElapsed("Shredded {} venues into {} nodes, took {} ms.", start, venues.size(), records.size());
    return records;
  }

  /** Reads a publication element up to and including its end tag. */
  private Publication readPublication(final XMLEventReader reader, final StartElement element)
      throws XMLStreamException {
    final Publication publication = new Publication(element);
    Field field = null;
    int depth = 0;
    while (reader.hasNext()) {
      final XMLEvent event = reader.nextEvent();
      if (event.isStartElement()) {
        depth++;
        if (depth == 1) {
          field = new Field(event.asStartElement());
        }
      } else if (event.isCharacters()) {
        if (field != null) {
          field.text.append(event.asCharacters().getData());
        }
      } else if (event.isEndElement()) {
        if (depth == 0) {
          return publication;
        }
        depth--;
        if (depth == 0 && field != null) {
          final String text = field.text.toString().trim();
          if (YEAR.equals(field.tag) && publication.year == null && !text.isEmpty()) {
            publication.year = text;
          }
          if (!skippedFields.contains(field.tag)) {
            publication.fields.add(field);
          }
          field = null;
        }
      }
    }
    throw new XMLStreamException("Unexpected end of document inside publication " + publication.tag + ".");
  }

  private static List<NodeRecord> toRecords(final Map<String, Map<String, List<Publication>>> venues) {
    final List<NodeRecord> records = new ArrayList<>();
    long nextId = 1;
    final long bibId = nextId++;
    records.add(NodeRecord.builder(bibId, BIB).build());
    for (final Map.Entry<String, Map<String, List<Publication>>> venue : venues.entrySet()) {
      final long venueId = nextId++;
      records.add(NodeRecord.builder(venueId, VENUE).parent(bibId).text(venue.getKey()).build());
      for (final Map.Entry<String, List<Publication>> year : venue.getValue().entrySet()) {
        final long yearId = nextId++;
        records.add(NodeRecord.builder(yearId, YEAR)
                              .parent(venueId)
                              .text(year.getKey())
                              .semanticId(venue.getKey() + "_" + year.getKey())
                              .build());
        for (final Publication publication : year.getValue()) {
          final long publicationId = nextId++;
          final String key = publication.attributes.get(KEY.getLocalPart()).iterator().next();
          records.add(NodeRecord.builder(publicationId, publication.tag)
                                .parent(yearId)
                                .semanticId(shortKey(key))
                                .attributes(publication.attributes)
                                .build());
          for (final Field field : publication.fields) {
            final String text = field.text.toString().trim();
            records.add(NodeRecord.builder(nextId++, field.tag)
                                  .parent(publicationId)
                                  .text(text.isEmpty() ? null : text)
                                  .attributes(field.attributes)
                                  .build());
          }
        }
      }
    }
    return records;
  }

  private static ImmutableSetMultimap<String, String> attributesOf(final StartElement element) {
    final ImmutableSetMultimap.Builder<String, String> attributes = ImmutableSetMultimap.builder();
    for (final Iterator<Attribute> it = element.getAttributes(); it.hasNext(); ) {
      final Attribute attribute = it.next();
      attributes.put(attribute.getName().getLocalPart(), attribute.getValue());
    }
    return attributes.build();
  }

  private static final class Publication {
    private final String tag;

    private final ImmutableSetMultimap<String, String> attributes;

    private final List<Field> fields = new ArrayList<>();

    private @Nullable String year;

    private Publication(final StartElement element) {
      this.tag = element.getName().getLocalPart();
      this.attributes = attributesOf(element);
    }
  }

  private static final class Field {
    private final String tag;

    private final ImmutableSetMultimap<String, String> attributes;

    private final StringBuilder text = new StringBuilder();

    private Field(final StartElement element) {
      this.tag = element.getName().getLocalPart();
      this.attributes = attributesOf(element);
    }
  }
}

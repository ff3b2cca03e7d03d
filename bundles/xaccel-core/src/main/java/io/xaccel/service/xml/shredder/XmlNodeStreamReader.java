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

import io.xaccel.exception.XAccelIOException;
import io.xaccel.node.NodeRecord;
import io.xaccel.utils.LogWrapper;
import org.checkerframework.checker.nullness.qual.Nullable;

import javax.xml.namespace.QName;
import javax.xml.stream.XMLEventReader;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.events.Attribute;
import javax.xml.stream.events.StartElement;
import javax.xml.stream.events.XMLEvent;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Maps an XML document onto {@link NodeRecord}s. Every element becomes a node typed by its local
 * name, its attributes become node attributes and its own trimmed character data becomes the node
 * text. Ids are assigned in document order starting at {@code 1}.
 *
 * <p>
 * If a semantic id attribute is configured, the value of that attribute becomes the semantic id of
 * the element.
 * </p>
 */
public final class XmlNodeStreamReader {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = LogWrapper.of(XmlNodeStreamReader.class);

  /** Attribute whose value is used as semantic id, if any. */
  private final @Nullable String semanticIdAttribute;

  /**
   * Constructor.
   *
   * @param semanticIdAttribute name of the attribute to use as semantic id, or {@code null}
   */
  public XmlNodeStreamReader(final @Nullable String semanticIdAttribute) {
    this.semanticIdAttribute = semanticIdAttribute;
  }

  /**
   * Constructor, no semantic ids.
   */
  public XmlNodeStreamReader() {
    this(null);
  }

  /**
   * Read a file.
   *
   * @param file the XML file
   * @return node records in document order
   * @throws XAccelIOException if the file can't be read or isn't well-formed
   */
  public List<NodeRecord> read(final Path file) throws XAccelIOException {
    requireNonNull(file);
    final long start = System.nanoTime();
    try (final InputStream in = Files.newInputStream(file)) {
      final List<NodeRecord> records = read(in);
      LOGWRAPPER.infoElapsed("Read {} nodes from {}, took {} ms.", start, records.size(), file);
      return records;
    } catch (final IOException e) {
      throw new XAccelIOException(e);
    }
  }

  /**
   * Read a stream. The stream is not closed.
   *
   * @param in the XML input
   * @return node records in document order
   * @throws XAccelIOException if the input isn't well-formed
   */
  public List<NodeRecord> read(final InputStream in) throws XAccelIOException {
    final XMLEventReader reader = createReader(in);
    final List<NodeRecord.Builder> builders = new ArrayList<>();
    final Deque<OpenElement> open = new ArrayDeque<>();
    long nextId = 1;
    try {
      while (reader.hasNext()) {
        final XMLEvent event = reader.nextEvent();
        switch (event.getEventType()) {
          case XMLEvent.START_ELEMENT -> {
            final StartElement element = event.asStartElement();
            final NodeRecord.Builder builder = NodeRecord.builder(nextId, element.getName().getLocalPart());
            final OpenElement parent = open.peek();
            if (parent != null) {
              builder.parent(parent.id);
            }
            copyAttributes(element, builder);
            if (semanticIdAttribute != null) {
              final Attribute semanticId = element.getAttributeByName(new QName(semanticIdAttribute));
              if (semanticId != null) {
                builder.semanticId(semanticId.getValue());
              }
            }
            builders.add(builder);
            open.push(new OpenElement(nextId, builder));
            nextId++;
          }
          case XMLEvent.CHARACTERS, XMLEvent.CDATA -> {
            final OpenElement current = open.peek();
            if (current != null) {
              current.text.append(event.asCharacters().getData());
            }
          }
          case XMLEvent.END_ELEMENT -> {
            final OpenElement closed = open.pop();
            final String text = closed.text.toString().trim();
            closed.builder.text(text.isEmpty() ? null : text);
          }
          default -> {
            // Comments, processing instructions and the document events carry no nodes.
          }
        }
      }
      reader.close();
    } catch (final XMLStreamException e) {
      throw new XAccelIOException(e);
    }

    final List<NodeRecord> records = new ArrayList<>(builders.size());
    for (final NodeRecord.Builder builder : builders) {
      records.add(builder.build());
    }
    return records;
  }

  /**
   * Create a new {@link XMLEventReader} instance on a stream. DTDs and external entities are not
   * processed. ISO 8859-1 named character entities are resolved by an
   * {@link EntityResolvingInputStream} instead.
   *
   * @param in the input stream
   * @return an {@link XMLEventReader}
   * @throws XAccelIOException if creating the xml event reader fails
   */
  static XMLEventReader createReader(final InputStream in) throws XAccelIOException {
    requireNonNull(in);
    final XMLInputFactory factory = XMLInputFactory.newInstance();
    setProperties(factory);
    try {
      return factory.createXMLEventReader(new EntityResolvingInputStream(in));
    } catch (final XMLStreamException e) {
      throw new XAccelIOException(e);
    }
  }

  private static void setProperties(final XMLInputFactory factory) {
    factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
    factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    factory.setProperty(XMLInputFactory.IS_REPLACING_ENTITY_REFERENCES, true);
    factory.setProperty(XMLInputFactory.IS_COALESCING, true);
  }

  private static void copyAttributes(final StartElement element, final NodeRecord.Builder builder) {
    for (final Iterator<Attribute> it = element.getAttributes(); it.hasNext(); ) {
      final Attribute attribute = it.next();
      builder.attribute(attribute.getName().getLocalPart(), attribute.getValue());
    }
  }

  private static final class OpenElement {
    private final long id;

    private final NodeRecord.Builder builder;

    private final StringBuilder text = new StringBuilder();

    private OpenElement(final long id, final NodeRecord.Builder builder) {
      this.id = id;
      this.builder = builder;
    }
  }
}

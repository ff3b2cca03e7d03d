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
import io.xaccel.access.AccelIndex;
import io.xaccel.axis.AxisKind;
import io.xaccel.exception.StructuralException;
import io.xaccel.exception.XAccelIOException;
import io.xaccel.node.NodeRecord;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests the {@link XmlNodeStreamReader}.
 */
public final class XmlNodeStreamReaderTest {

  private static final String DOCUMENT = "<?xml version=\"1.0\"?>\n"
      + "<p:a xmlns:p=\"ns\" id=\"root\">\n"
      + "  <!-- comment -->\n"
      + "  <b id=\"first\" lang=\"en\">  one  </b>\n"
      + "  <c><d>two</d><e><![CDATA[three]]></e></c>\n"
      + "  <b id=\"second\"/>\n"
      + "</p:a>";

  @Test
  public void testRead() throws XAccelIOException {
    final List<NodeRecord> records = read(new XmlNodeStreamReader("id"), DOCUMENT);
    assertEquals(6, records.size());

    final NodeRecord root = records.get(0);
    assertEquals(1, root.getId());
    assertEquals("a", root.getType());
    assertFalse(root.hasParent());
    assertNull(root.getText());
    assertEquals("root", root.getSemanticId());

    final NodeRecord first = records.get(1);
    assertEquals(2, first.getId());
    assertEquals(1, first.getParentId());
    assertEquals("one", first.getText());
    assertEquals("first", first.getSemanticId());
    assertEquals(ImmutableSet.of("en"), first.getAttributes().get("lang"));

    assertEquals("two", records.get(3).getText());
    assertEquals(3, records.get(3).getParentId());
    assertEquals("three", records.get(4).getText());
    assertEquals("second", records.get(5).getSemanticId());
    assertNull(records.get(5).getText());
  }

  @Test
  public void testWithoutSemanticIds() throws XAccelIOException {
    final List<NodeRecord> records = read(new XmlNodeStreamReader(), DOCUMENT);
    for (final NodeRecord record : records) {
      assertNull(record.getSemanticId());
    }
  }

  @Test
  public void testIndexOverGenericDocument() throws XAccelIOException, StructuralException {
    final AccelIndex index = AccelIndex.build(read(new XmlNodeStreamReader("id"), DOCUMENT));
    assertEquals(LongArrayList.wrap(new long[] { 2L, 3L, 4L, 5L, 6L }), index.axisKeys(1L, AxisKind.DESCENDANT));
    assertEquals(LongArrayList.wrap(new long[] { 3L, 6L }),
        index.axisKeys(index.lookup("first").orElseThrow().getId(), AxisKind.FOLLOWING_SIBLING));
  }

  @Test
  public void testNamedCharacterEntities() throws XAccelIOException {
    final List<NodeRecord> records = read(new XmlNodeStreamReader("id"),
        "<a id=\"Sch&auml;ler\"><b>H&uuml;tter &amp; Ko&ccedil; &#246; &lt;x&gt;</b><c>R&D &unknownish</c></a>");
    assertEquals("Schäler", records.get(0).getSemanticId());
    assertEquals("Hütter & Koç ö <x>", records.get(1).getText());
    assertEquals("R&D &unknownish", records.get(2).getText());
  }

  @Test
  public void testLatin1Document() throws XAccelIOException {
    final String xml = "<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?><a><b>M\u00fcller &szlig;</b></a>";
    final List<NodeRecord> records =
        new XmlNodeStreamReader().read(new ByteArrayInputStream(xml.getBytes(StandardCharsets.ISO_8859_1)));
    assertEquals("Müller ß", records.get(1).getText());
  }

  @Test
  public void testUndeclaredEntity() {
    assertThrows(XAccelIOException.class, () -> read(new XmlNodeStreamReader(), "<a>&notAnEntity;</a>"));
  }

  @Test
  public void testMalformed() {
    assertThrows(XAccelIOException.class, () -> read(new XmlNodeStreamReader(), "<a><b></a>"));
  }

  private static List<NodeRecord> read(final XmlNodeStreamReader reader, final String xml) throws XAccelIOException {
    return reader.read(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
  }
}

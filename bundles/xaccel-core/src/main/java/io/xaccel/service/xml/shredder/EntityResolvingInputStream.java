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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;
import java.nio.charset.StandardCharsets;

import static java.util.Objects.requireNonNull;

/**
 * Rewrites the ISO 8859-1 named character entities used by DBLP ({@code &uuml;}, {@code &eacute;},
 * ...) into numeric character references, so that documents using them can be parsed without
 * loading their DTD. A {@code &} which doesn't start a reference is escaped as {@code &amp;}.
 * Predefined XML entities, numeric references and unknown names are passed through unchanged.
 *
 * <p>
 * The rewriting works on bytes and is only correct for ASCII compatible encodings such as UTF-8
 * and ISO 8859-1.
 * </p>
 */
final class EntityResolvingInputStream extends InputStream {

  /** Longest entity name which is recognized. */
  private static final int MAX_NAME_LENGTH = 32;

  private static final ImmutableSet<String> PREDEFINED = ImmutableSet.of("amp", "lt", "gt", "quot", "apos");

  /** Entity names of the code points 160 to 255. */
  private static final String[] LATIN1 = { "nbsp", "iexcl", "cent", "pound", "curren", "yen", "brvbar", "sect",
      "uml", "copy", "ordf", "laquo", "not", "shy", "reg", "macr", "deg", "plusmn", "sup2", "sup3", "acute",
      "micro", "para", "middot", "cedil", "sup1", "ordm", "raquo", "frac14", "frac12", "frac34", "iquest",
      "Agrave", "Aacute", "Acirc", "Atilde", "Auml", "Aring", "AElig", "Ccedil", "Egrave", "Eacute", "Ecirc",
      "Euml", "Igrave", "Iacute", "Icirc", "Iuml", "ETH", "Ntilde", "Ograve", "Oacute", "Ocirc", "Otilde", "Ouml",
      "times", "Oslash", "Ugrave", "Uacute", "Ucirc", "Uuml", "Yacute", "THORN", "szlig", "agrave", "aacute",
      "acirc", "atilde", "auml", "aring", "aelig", "ccedil", "egrave", "eacute", "ecirc", "euml", "igrave",
      "iacute", "icirc", "iuml", "eth", "ntilde", "ograve", "oacute", "ocirc", "otilde", "ouml", "divide",
      "oslash", "ugrave", "uacute", "ucirc", "uuml", "yacute", "thorn", "yuml" };

  /** Entity name to code point. */
  static final ImmutableMap<String, Integer> ENTITIES;

  static {
    final ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
    for (int i = 0; i < LATIN1.length; i++) {
      builder.put(LATIN1[i], 160 + i);
    }
    ENTITIES = builder.build();
  }

  private final PushbackInputStream in;

  /** Bytes of a rewritten reference which haven't been returned yet. */
  private byte[] pending = new byte[0];

  private int pendingPos;

  /**
   * Constructor.
   *
   * @param in the underlying stream
   */
  EntityResolvingInputStream(final InputStream in) {
    this.in = new PushbackInputStream(requireNonNull(in), 1);
  }

  @Override
  public int read() throws IOException {
    if (pendingPos < pending.length) {
      return pending[pendingPos++] & 0xFF;
    }
    final int b = in.read();
    if (b != '&') {
      return b;
    }
    setPending(reference());
    return read();
  }

  @Override
  public int read(final byte[] buffer, final int off, final int len) throws IOException {
    if (len == 0) {
      return 0;
    }
    int count = 0;
    while (count < len) {
      if (count > 0 && pendingPos == pending.length && in.available() == 0) {
        break;
      }
      final int b = read();
      if (b == -1) {
        break;
      }
      buffer[off + count++] = (byte) b;
    }
    return count == 0 ? -1 : count;
  }

  @Override
  public int available() throws IOException {
    return pending.length - pendingPos + in.available();
  }

  @Override
  public void close() throws IOException {
    in.close();
  }

  /** Reads what follows a {@code &} and returns its replacement, the {@code &} included. */
  private String reference() throws IOException {
    final StringBuilder name = new StringBuilder();
    int b = in.read();
    while (isNameByte(b) && name.length() < MAX_NAME_LENGTH) {
      name.append((char) b);
      b = in.read();
    }
    if (b == ';' && name.length() > 0) {
      final String entity = name.toString();
      final Integer codePoint = entity.charAt(0) == '#' || PREDEFINED.contains(entity) ? null : ENTITIES.get(entity);
      return codePoint == null ? "&" + entity + ";" : "&#" + codePoint + ";";
    }
    if (b != -1) {
      in.unread(b);
    }
    return "&amp;" + name;
  }

  private void setPending(final String replacement) {
    pending = replacement.getBytes(StandardCharsets.US_ASCII);
    pendingPos = 0;
  }

  private static boolean isNameByte(final int b) {
    return (b >= 'a' && b <= 'z') || (b >= 'A' && b <= 'Z') || (b >= '0' && b <= '9') || b == '#';
  }
}

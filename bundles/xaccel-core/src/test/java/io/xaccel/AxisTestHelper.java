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

package io.xaccel;

import io.xaccel.api.Axis;

import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Checks the conventions every axis has to follow.
 */
public final class AxisTestHelper {

  private AxisTestHelper() {
    throw new AssertionError("May never be instantiated!");
  }

  public static void testAxisConventions(final Axis axis, final long[] expectedKeys) {
    final long startKey = axis.getStartKey();

    final long[] keys = new long[expectedKeys.length];
    int offset = 0;
    while (axis.hasNext()) {
      // Peeking doesn't consume.
      final long peeked = axis.peek();
      final long key = axis.nextLong();
      assertEquals(peeked, key);
      assertTrue(offset < expectedKeys.length, "More keys than expected.");
      keys[offset++] = key;
    }
    assertEquals(expectedKeys.length, offset);

    // Exhausted axes stay exhausted.
    assertFalse(axis.hasNext());
    assertThrows(NoSuchElementException.class, axis::nextLong);

    assertEquals(startKey, axis.getStartKey());
    assertArrayEquals(expectedKeys, keys);

    // Same results after a reset to the same context node.
    axis.reset(startKey);
    final long[] again = new long[expectedKeys.length];
    offset = 0;
    while (axis.hasNext()) {
      assertTrue(offset < expectedKeys.length, "More keys than expected after reset.");
      again[offset++] = axis.nextLong();
    }
    assertArrayEquals(expectedKeys, again);
  }
}

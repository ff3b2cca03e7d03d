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

package io.xaccel.axis;

import io.xaccel.AxisTestHelper;
import io.xaccel.XAccelTestHelper;
import io.xaccel.exception.NodeNotFoundException;
import io.xaccel.tree.TreeModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests the axes walking parent and child links on the toy document.
 */
public final class AdjacencyAxisTest {

  private TreeModel tree;

  @BeforeEach
  public void setUp() {
    tree = XAccelTestHelper.toyTreeModel();
  }

  @Test
  public void testAncestorAxis() {
    AxisTestHelper.testAxisConventions(new AncestorAxis(tree, XAccelTestHelper.SCHMITT_FIRST_AUTHOR),
        new long[] { 1L, 2L, 3L, 4L });
    AxisTestHelper.testAxisConventions(new AncestorAxis(tree, XAccelTestHelper.SCHMITT_FIRST_AUTHOR, IncludeSelf.YES),
        new long[] { 1L, 2L, 3L, 4L, 5L });
    AxisTestHelper.testAxisConventions(new AncestorAxis(tree, XAccelTestHelper.BIB), new long[] {});
    AxisTestHelper.testAxisConventions(new AncestorAxis(tree, XAccelTestHelper.BIB, IncludeSelf.YES),
        new long[] { 1L });
  }

  @Test
  public void testDescendantAxis() {
    AxisTestHelper.testAxisConventions(new DescendantAxis(tree, XAccelTestHelper.VLDB_2023),
        LongStream.rangeClosed(4, 31).toArray());
    AxisTestHelper.testAxisConventions(new DescendantAxis(tree, XAccelTestHelper.VLDB_2023, IncludeSelf.YES),
        LongStream.rangeClosed(3, 31).toArray());
    AxisTestHelper.testAxisConventions(new DescendantAxis(tree, XAccelTestHelper.BIB),
        LongStream.rangeClosed(2, 61).toArray());
    AxisTestHelper.testAxisConventions(new DescendantAxis(tree, XAccelTestHelper.SCHMITT_URL), new long[] {});
  }

  @Test
  public void testFollowingSiblingAxis() {
    AxisTestHelper.testAxisConventions(new FollowingSiblingAxis(tree, XAccelTestHelper.SCHMITT),
        new long[] { XAccelTestHelper.SCHALER });
    AxisTestHelper.testAxisConventions(new FollowingSiblingAxis(tree, XAccelTestHelper.SCHALER), new long[] {});
    AxisTestHelper.testAxisConventions(new FollowingSiblingAxis(tree, XAccelTestHelper.VLDB),
        new long[] { XAccelTestHelper.SIGMOD });
    AxisTestHelper.testAxisConventions(new FollowingSiblingAxis(tree, 16L), new long[] { 17L, 18L });
    AxisTestHelper.testAxisConventions(new FollowingSiblingAxis(tree, XAccelTestHelper.BIB), new long[] {});
  }

  @Test
  public void testPrecedingSiblingAxis() {
    AxisTestHelper.testAxisConventions(new PrecedingSiblingAxis(tree, XAccelTestHelper.SCHALER),
        new long[] { XAccelTestHelper.SCHMITT });
    AxisTestHelper.testAxisConventions(new PrecedingSiblingAxis(tree, XAccelTestHelper.SCHMITT), new long[] {});
    AxisTestHelper.testAxisConventions(new PrecedingSiblingAxis(tree, 8L), new long[] { 5L, 6L, 7L });
    AxisTestHelper.testAxisConventions(new PrecedingSiblingAxis(tree, XAccelTestHelper.BIB), new long[] {});
  }

  @Test
  public void testResetToOtherContextNode() {
    final AncestorAxis axis = new AncestorAxis(tree, XAccelTestHelper.SCHMITT);
    axis.reset(XAccelTestHelper.HUTTER);
    AxisTestHelper.testAxisConventions(axis, new long[] { 1L, 32L, 33L });
  }

  @Test
  public void testUnknownContextNode() {
    final NodeNotFoundException e =
        assertThrows(NodeNotFoundException.class, () -> new DescendantAxis(tree, 4711L));
    assertEquals(4711L, e.getNodeId());
  }

  @Test
  public void testAxisKindNames() {
    for (final AxisKind kind : AxisKind.values()) {
      assertEquals(kind, AxisKind.fromName(kind.getName()));
    }
    assertEquals(AxisKind.FOLLOWING_SIBLING, AxisKind.fromName("following-sibling"));
    assertThrows(IllegalArgumentException.class, () -> AxisKind.fromName("parent"));
  }
}

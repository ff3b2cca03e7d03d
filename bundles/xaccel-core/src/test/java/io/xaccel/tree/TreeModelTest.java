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

package io.xaccel.tree;

import io.xaccel.XAccelTestHelper;
import io.xaccel.exception.StructuralException;
import io.xaccel.node.NodeRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests building a {@link TreeModel} from a node stream.
 */
public final class TreeModelTest {

  @Test
  public void testToyExample() {
    final TreeModel tree = XAccelTestHelper.toyTreeModel();
    assertEquals(XAccelTestHelper.TOY_EXAMPLE_SIZE, tree.size());
    assertEquals(XAccelTestHelper.BIB, tree.getId(tree.getRootIndex()));

    final int schmitt = tree.getIndex(XAccelTestHelper.SCHMITT);
    assertEquals(14, tree.getChildren(schmitt).size());
    assertEquals(0, tree.getChildPosition(schmitt));
    assertEquals(XAccelTestHelper.VLDB_2023, tree.getId(tree.getParentIndex(schmitt)));

    final int schaler = tree.getIndex(XAccelTestHelper.SCHALER);
    assertEquals(12, tree.getChildren(schaler).size());
    assertEquals(1, tree.getChildPosition(schaler));

    assertEquals(TreeModel.NO_PARENT, tree.getParentIndex(tree.getRootIndex()));
    assertEquals(TreeModel.NOT_FOUND, tree.getIndex(4711));
  }

  @Test
  public void testSemanticIds() {
    final TreeModel tree = XAccelTestHelper.toyTreeModel();
    assertEquals(XAccelTestHelper.SCHMITT, tree.getId(tree.getIndexBySemanticId("SchmittKAMM23")));
    assertEquals(XAccelTestHelper.VLDB_2023, tree.getId(tree.getIndexBySemanticId("vldb_2023")));
    assertEquals(XAccelTestHelper.SIGMOD_2023, tree.getId(tree.getIndexBySemanticId("sigmod_2023")));
    assertEquals(TreeModel.NOT_FOUND, tree.getIndexBySemanticId("icde_2023"));
  }

  @Test
  public void testDuplicateSemanticIdKeepsFirst() throws StructuralException {
    final TreeModel tree = TreeModel.of(List.of(NodeRecord.builder(1, "r").build(),
        NodeRecord.builder(2, "a").parent(1).semanticId("x").build(),
        NodeRecord.builder(3, "b").parent(1).semanticId("x").build()));
    assertEquals(2, tree.getId(tree.getIndexBySemanticId("x")));
  }

  @Test
  public void testChildrenFollowStreamOrder() throws StructuralException {
    final TreeModel tree = TreeModel.of(List.of(NodeRecord.builder(10, "r").build(),
        NodeRecord.builder(30, "a").parent(10).build(),
        NodeRecord.builder(20, "b").parent(10).build()));
    final int root = tree.getRootIndex();
    assertEquals(30, tree.getId(tree.getChildren(root).getInt(0)));
    assertEquals(20, tree.getId(tree.getChildren(root).getInt(1)));
  }

  @Test
  public void testSingleNode() throws StructuralException {
    final TreeModel tree = TreeModel.of(List.of(NodeRecord.builder(1, "r").build()));
    assertEquals(1, tree.size());
    assertTrue(tree.getChildren(tree.getRootIndex()).isEmpty());
  }

  @Test
  public void testEmptyStream() {
    final StructuralException e = assertThrows(StructuralException.class, () -> TreeModel.of(List.of()));
    assertEquals(StructuralException.Kind.NO_ROOT, e.getKind());
  }

  @Test
  public void testDuplicateId() {
    final StructuralException e = assertThrows(StructuralException.class,
        () -> TreeModel.of(List.of(NodeRecord.builder(1, "r").build(), NodeRecord.builder(1, "a").parent(1).build())));
    assertEquals(StructuralException.Kind.DUPLICATE_ID, e.getKind());
  }

  @Test
  public void testMultipleRoots() {
    final StructuralException e = assertThrows(StructuralException.class,
        () -> TreeModel.of(List.of(NodeRecord.builder(1, "r").build(), NodeRecord.builder(2, "s").build())));
    assertEquals(StructuralException.Kind.MULTIPLE_ROOTS, e.getKind());
  }

  @Test
  public void testDanglingParent() {
    final StructuralException e = assertThrows(StructuralException.class,
        () -> TreeModel.of(List.of(NodeRecord.builder(1, "r").build(), NodeRecord.builder(2, "a").parent(7).build())));
    assertEquals(StructuralException.Kind.DANGLING_PARENT, e.getKind());
  }

  @Test
  public void testEveryNodeHasParent() {
    final StructuralException e = assertThrows(StructuralException.class,
        () -> TreeModel.of(List.of(NodeRecord.builder(1, "a").parent(2).build(),
            NodeRecord.builder(2, "b").parent(1).build())));
    assertEquals(StructuralException.Kind.NO_ROOT, e.getKind());
  }
}

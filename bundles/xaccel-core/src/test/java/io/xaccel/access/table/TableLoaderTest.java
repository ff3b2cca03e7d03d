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

package io.xaccel.access.table;

import io.xaccel.XAccelTestHelper;
import io.xaccel.exception.StructuralException;
import io.xaccel.numbering.Numbering;
import io.xaccel.numbering.NumberingAssigner;
import io.xaccel.settings.Fixed;
import io.xaccel.tree.TreeModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests exporting a tree into its relational shapes and loading it back.
 */
public final class TableLoaderTest {

  private TreeModel tree;

  private Numbering numbering;

  @BeforeEach
  public void setUp() throws StructuralException {
    tree = XAccelTestHelper.toyTreeModel();
    numbering = new NumberingAssigner(1).assign(tree);
  }

  @Test
  public void testExportedShapes() {
    final AdjacencyTables adjacency = TableExporter.toAdjacency(tree);
    assertEquals(XAccelTestHelper.TOY_EXAMPLE_SIZE, adjacency.nodes().size());
    assertEquals(56, adjacency.content().size());
    assertEquals(8, adjacency.attributes().size());

    final AdjacencyRow root = adjacency.nodes().get(0);
    assertEquals(Fixed.NULL_NODE_KEY.getStandardProperty(), root.parentId());
    final AdjacencyRow schaler = adjacency.nodes().get((int) XAccelTestHelper.SCHALER - 1);
    assertEquals(new AdjacencyRow(XAccelTestHelper.SCHALER, XAccelTestHelper.VLDB_2023, 1, "article", "SchalerHS23"),
        schaler);

    final IntervalTables interval = TableExporter.toInterval(tree, numbering);
    final AccelRow schmitt = interval.accel().get((int) XAccelTestHelper.SCHMITT - 1);
    assertEquals(new AccelRow(XAccelTestHelper.SCHMITT, 4, 15, XAccelTestHelper.VLDB_2023, "article", "SchmittKAMM23",
        3, 15), schmitt);
    assertEquals(new ContentRow(XAccelTestHelper.VLDB, "vldb"), interval.content().get(0));
  }

  @Test
  public void testAdjacencyRoundTripInAnyRowOrder() throws StructuralException {
    final AdjacencyTables exported = TableExporter.toAdjacency(tree);
    final List<AdjacencyRow> shuffled = new ArrayList<>(exported.nodes());
    Collections.shuffle(shuffled, new Random(1));
    final TreeModel loaded =
        TableLoader.fromAdjacency(new AdjacencyTables(shuffled, exported.content(), exported.attributes()));

    assertEquals(numbering.getMaxRank(), new NumberingAssigner(1).assign(loaded).getMaxRank());
    assertSameTree(tree, loaded);
  }

  @Test
  public void testIntervalRoundTrip() throws StructuralException {
    final IntervalTables exported = TableExporter.toInterval(tree, numbering);
    final List<AccelRow> reversed = new ArrayList<>(exported.accel());
    Collections.reverse(reversed);
    final TreeModel loaded =
        TableLoader.fromInterval(new IntervalTables(reversed, exported.content(), exported.attributes()));
    assertSameTree(tree, loaded);
  }

  @Test
  public void testIntervalRoundTripOriginZero() throws StructuralException {
    final Numbering zero = new NumberingAssigner(0).assign(tree);
    assertSameTree(tree, TableLoader.fromInterval(TableExporter.toInterval(tree, zero)));
  }

  @Test
  public void testCorruptedNumbering() {
    final IntervalTables exported = TableExporter.toInterval(tree, numbering);
    final List<AccelRow> rows = new ArrayList<>(exported.accel());
    final AccelRow schaler = rows.get((int) XAccelTestHelper.SCHALER - 1);
    rows.set((int) XAccelTestHelper.SCHALER - 1, new AccelRow(schaler.id(), schaler.pre(), schaler.post() + 1,
        schaler.parentId(), schaler.type(), schaler.semanticId(), schaler.level(), schaler.subtreeSize()));

    final StructuralException e = assertThrows(StructuralException.class,
        () -> TableLoader.fromInterval(new IntervalTables(rows, exported.content(), exported.attributes())));
    assertEquals(StructuralException.Kind.NUMBERING_MISMATCH, e.getKind());
  }

  @Test
  public void testDanglingParentRow() {
    final AdjacencyTables tables =
        new AdjacencyTables(List.of(new AdjacencyRow(1, Fixed.NULL_NODE_KEY.getStandardProperty(), 0, "r", null),
            new AdjacencyRow(2, 5, 0, "a", null)), List.of(), List.of());
    final StructuralException e = assertThrows(StructuralException.class, () -> TableLoader.fromAdjacency(tables));
    assertEquals(StructuralException.Kind.DANGLING_PARENT, e.getKind());
  }

  @Test
  public void testDuplicateSiblingPosition() {
    final AdjacencyTables tables =
        new AdjacencyTables(List.of(new AdjacencyRow(1, Fixed.NULL_NODE_KEY.getStandardProperty(), 0, "r", null),
            new AdjacencyRow(2, 1, 0, "a", null), new AdjacencyRow(3, 1, 1, "b", null),
            new AdjacencyRow(4, 1, 1, "c", null)), List.of(), List.of());
    final StructuralException e = assertThrows(StructuralException.class, () -> TableLoader.fromAdjacency(tables));
    assertEquals(StructuralException.Kind.DUPLICATE_POSITION, e.getKind());
  }

  @Test
  public void testSamePositionBelowDifferentParents() throws StructuralException {
    final AdjacencyTables tables =
        new AdjacencyTables(List.of(new AdjacencyRow(1, Fixed.NULL_NODE_KEY.getStandardProperty(), 0, "r", null),
            new AdjacencyRow(2, 1, 0, "a", null), new AdjacencyRow(3, 2, 0, "b", null)), List.of(), List.of());
    assertEquals(3, TableLoader.fromAdjacency(tables).size());
  }

  private static void assertSameTree(final TreeModel expected, final TreeModel actual) {
    assertEquals(expected.size(), actual.size());
    assertEquals(expected.getId(expected.getRootIndex()), actual.getId(actual.getRootIndex()));
    for (int i = 0; i < expected.size(); i++) {
      final long id = expected.getId(i);
      final int j = actual.getIndex(id);
      assertEquals(expected.getRecord(i), actual.getRecord(j));
      assertEquals(expected.getChildPosition(i), actual.getChildPosition(j));
    }
  }
}

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

package io.xaccel.access;

import io.xaccel.XAccelTestHelper;
import io.xaccel.api.NodeRef;
import io.xaccel.axis.AxisKind;
import io.xaccel.exception.NodeNotFoundException;
import io.xaccel.exception.StructuralException;
import io.xaccel.node.NodeRecord;
import io.xaccel.tree.TreeModel;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests the {@link AccelIndex} facade.
 */
public final class AccelIndexTest {

  private List<NodeRecord> toyExample;

  @BeforeEach
  public void setUp() {
    toyExample = XAccelTestHelper.toyExample();
  }

  @ParameterizedTest
  @EnumSource(BackendKind.class)
  public void testToyExample(final BackendKind backend) throws StructuralException {
    final AccelIndex index = AccelIndex.build(toyExample, IndexConfiguration.builder().backend(backend).build());
    assertEquals(backend, index.getEvaluator().getBackendKind());

    assertEquals(LongArrayList.wrap(new long[] { 1L, 2L, 3L, 4L }),
        index.axisKeys(XAccelTestHelper.SCHMITT_FIRST_AUTHOR, AxisKind.ANCESTOR));
    assertEquals(LongArrayList.wrap(LongStream.rangeClosed(4, 31).toArray()),
        index.axisKeys(XAccelTestHelper.VLDB_2023, AxisKind.DESCENDANT));
    assertEquals(LongArrayList.wrap(new long[] { XAccelTestHelper.SCHALER }),
        index.axisKeys(XAccelTestHelper.SCHMITT, AxisKind.FOLLOWING_SIBLING));
    assertEquals(LongArrayList.wrap(new long[] { XAccelTestHelper.SCHMITT }),
        index.axisKeys(XAccelTestHelper.SCHALER, AxisKind.PRECEDING_SIBLING));

    final List<NodeRef> ancestors = index.axis(XAccelTestHelper.SCHMITT_FIRST_AUTHOR, AxisKind.ANCESTOR);
    assertEquals(List.of("bib", "venue", "year", "article"),
        ancestors.stream().map(NodeRef::getType).collect(Collectors.toList()));
    assertEquals("vldb", ancestors.get(1).getText());
    assertEquals("2023", ancestors.get(2).getText());
    assertEquals("SchmittKAMM23", ancestors.get(3).getSemanticId());
  }

  @Test
  public void testRootAndLeafEdgeCases() throws StructuralException {
    final AccelIndex index = AccelIndex.build(toyExample);
    for (final AxisKind kind : new AxisKind[] { AxisKind.ANCESTOR, AxisKind.FOLLOWING_SIBLING,
        AxisKind.PRECEDING_SIBLING }) {
      assertTrue(index.axisKeys(XAccelTestHelper.BIB, kind).isEmpty(), kind.getName());
    }
    assertEquals(XAccelTestHelper.TOY_EXAMPLE_SIZE - 1, index.axisKeys(XAccelTestHelper.BIB, AxisKind.DESCENDANT).size());
    assertTrue(index.axisKeys(XAccelTestHelper.SCHALER_STREAM, AxisKind.DESCENDANT).isEmpty());
    assertTrue(index.axisKeys(XAccelTestHelper.SCHALER_STREAM, AxisKind.FOLLOWING_SIBLING).isEmpty());
  }

  @Test
  public void testSingleNodeTree() throws StructuralException {
    final AccelIndex index = AccelIndex.build(List.of(NodeRecord.builder(9, "only").build()));
    for (final AxisKind kind : AxisKind.values()) {
      assertTrue(index.axisKeys(9, kind).isEmpty());
    }
    assertEquals(1, index.getRoot().getPre());
    assertEquals(1, index.getRoot().getPost());
  }

  @Test
  public void testUnknownContextNode() throws StructuralException {
    final AccelIndex index = AccelIndex.build(toyExample);
    for (final AxisKind kind : AxisKind.values()) {
      final NodeNotFoundException e = assertThrows(NodeNotFoundException.class, () -> index.axis(4711L, kind));
      assertEquals(4711L, e.getNodeId());
    }
    assertThrows(NodeNotFoundException.class, () -> index.getNode(0L));
  }

  @Test
  public void testLookup() throws StructuralException {
    final AccelIndex index = AccelIndex.build(toyExample);
    final Optional<NodeRef> schmitt = index.lookup("SchmittKAMM23");
    assertTrue(schmitt.isPresent());
    assertEquals(XAccelTestHelper.SCHMITT, schmitt.get().getId());
    assertEquals("journals/pvldb/SchmittKAMM23", schmitt.get().getAttributes().get("key").iterator().next());
    assertEquals(XAccelTestHelper.SIGMOD_2022, index.lookup("sigmod_2022").orElseThrow().getId());
    assertEquals(XAccelTestHelper.THIEL, index.lookup("ThielKAHMS23").orElseThrow().getId());
    assertFalse(index.lookup("icde_2023").isPresent());
  }

  @Test
  public void testNodeRef() throws StructuralException {
    final AccelIndex index = AccelIndex.build(toyExample);
    final NodeRef node = index.getNode(XAccelTestHelper.SCHALER);
    assertEquals(XAccelTestHelper.VLDB_2023, node.getParentId());
    assertEquals(19, node.getPre());
    assertEquals(28, node.getPost());
    assertEquals(3, node.getLevel());
    assertFalse(index.getRoot().hasParent());
    assertEquals("Daniel Ulrich Schmitt", index.getNode(XAccelTestHelper.SCHMITT_FIRST_AUTHOR).getText());
  }

  @Test
  public void testOriginZero() throws StructuralException {
    final AccelIndex index = AccelIndex.build(toyExample, IndexConfiguration.builder().numberingOrigin(0).build());
    assertEquals(0, index.getRoot().getPre());
    assertEquals(XAccelTestHelper.TOY_EXAMPLE_SIZE - 1, index.getRoot().getPost());
    assertEquals(LongArrayList.wrap(new long[] { 1L, 2L, 3L, 4L }),
        index.axisKeys(XAccelTestHelper.SCHMITT_FIRST_AUTHOR, AxisKind.ANCESTOR));
  }

  @Test
  public void testIdsStableAcrossRebuilds() throws StructuralException {
    final AccelIndex first = AccelIndex.build(toyExample);
    final AccelIndex second = AccelIndex.build(XAccelTestHelper.toyExample());
    assertEquals(first.getNumbering(), second.getNumbering());
    assertEquals(first.lookup("SchalerHS23").orElseThrow().getId(), second.lookup("SchalerHS23").orElseThrow().getId());
  }

  @Test
  public void testDepthEqualsAncestorCount() throws StructuralException {
    final AccelIndex index = AccelIndex.build(XAccelTestHelper.randomTree(400, 11));
    final TreeModel tree = index.getTreeModel();
    for (int i = 0; i < tree.size(); i++) {
      int depth = 0;
      for (int node = tree.getParentIndex(i); node != TreeModel.NO_PARENT; node = tree.getParentIndex(node)) {
        depth++;
      }
      final long id = tree.getId(i);
      assertEquals(depth, index.axisKeys(id, AxisKind.ANCESTOR).size());
      assertEquals(depth, index.getNode(id).getLevel());
    }
  }

  @Test
  public void testSiblingSymmetry() throws StructuralException {
    final AccelIndex index = AccelIndex.build(XAccelTestHelper.randomTree(300, 5));
    final TreeModel tree = index.getTreeModel();
    for (int i = 0; i < tree.size(); i++) {
      final long v = tree.getId(i);
      for (final long w : index.axisKeys(v, AxisKind.FOLLOWING_SIBLING)) {
        assertTrue(index.axisKeys(w, AxisKind.PRECEDING_SIBLING).contains(v));
      }
      final LongList descendants = index.axisKeys(v, AxisKind.DESCENDANT);
      for (final long d : descendants) {
        assertTrue(index.axisKeys(d, AxisKind.ANCESTOR).contains(v));
      }
    }
  }

  @Test
  public void testConcurrentQueries() throws Exception {
    final AccelIndex index = AccelIndex.build(XAccelTestHelper.randomTree(500, 3));
    final LongList expected = index.axisKeys(1L, AxisKind.DESCENDANT);
    final ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      final List<Future<LongList>> futures = new ArrayList<>();
      for (int i = 0; i < 16; i++) {
        futures.add(executor.submit(() -> index.axisKeys(1L, AxisKind.DESCENDANT)));
      }
      for (final Future<LongList> future : futures) {
        assertEquals(expected, future.get());
      }
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  public void testStatistics() throws StructuralException {
    final IndexStatistics statistics = AccelIndex.build(toyExample).getStatistics();
    assertEquals(61, statistics.getNodeCount());
    assertEquals(56, statistics.getTextNodeCount());
    assertEquals(8, statistics.getAttributeCount());
    assertEquals(51, statistics.getLeafCount());
    assertEquals(4, statistics.getMaxDepth());
    assertEquals(14, statistics.getMaxFanOut());
  }

  @Test
  public void testVerifyOnBuild() throws StructuralException {
    final AccelIndex index = AccelIndex.build(XAccelTestHelper.randomTree(250, 8),
        IndexConfiguration.builder().backend(BackendKind.INTERVAL).verifyOnBuild(true).windowPruning(false).build());
    assertTrue(index.verify().isSuccess());
    assertSame(index.getIntervalBackend(), index.getEvaluator());
  }

  @Test
  public void testStructuralErrorsPropagate() {
    final List<NodeRecord> cyclic = List.of(NodeRecord.builder(1, "r").build(),
        NodeRecord.builder(2, "a").parent(3).build(), NodeRecord.builder(3, "b").parent(2).build());
    final StructuralException e = assertThrows(StructuralException.class, () -> AccelIndex.build(cyclic));
    assertEquals(StructuralException.Kind.CYCLE, e.getKind());
  }
}

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

package io.xaccel.verify;

import io.xaccel.XAccelTestHelper;
import io.xaccel.access.AdjacencyBackend;
import io.xaccel.access.BackendKind;
import io.xaccel.api.AxisEvaluator;
import io.xaccel.axis.AxisKind;
import io.xaccel.exception.EquivalenceMismatchException;
import io.xaccel.exception.StructuralException;
import io.xaccel.numbering.Numbering;
import io.xaccel.numbering.NumberingAssigner;
import io.xaccel.tree.TreeModel;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests the {@link EquivalenceVerifier}.
 */
public final class EquivalenceVerifierTest {

  @ParameterizedTest
  @ValueSource(ints = { 10, 50, 120, 500 })
  public void testRandomTreesAgree(final int size) throws StructuralException {
    final TreeModel tree = TreeModel.of(XAccelTestHelper.randomTree(size, size * 31L));
    final Numbering numbering = new NumberingAssigner(1).assign(tree);
    for (final boolean pruning : new boolean[] { true, false }) {
      final VerificationResult result = EquivalenceVerifier.of(tree, numbering, pruning).verify(100, 42L);
      assertTrue(result.isSuccess(), result.getMismatches().toString());
      assertTrue(result.getCheckedContextNodes() > 0);
      result.orElseThrow();
    }
  }

  @Test
  public void testToyExampleAgrees() throws StructuralException {
    final TreeModel tree = XAccelTestHelper.toyTreeModel();
    final Numbering numbering = new NumberingAssigner(1).assign(tree);
    final EquivalenceVerifier verifier = EquivalenceVerifier.of(tree, numbering, true);
    final LongArrayList all = new LongArrayList();
    for (int i = 0; i < tree.size(); i++) {
      all.add(tree.getId(i));
    }
    final VerificationResult result = verifier.verify(all);
    assertTrue(result.isSuccess());
    assertEquals(XAccelTestHelper.TOY_EXAMPLE_SIZE, result.getCheckedContextNodes());
    assertTrue(verifier.checkNumbering().isEmpty());
  }

  @Test
  public void testContextNodeSelection() throws StructuralException {
    final TreeModel tree = XAccelTestHelper.toyTreeModel();
    final Numbering numbering = new NumberingAssigner(1).assign(tree);
    final EquivalenceVerifier verifier = EquivalenceVerifier.of(tree, numbering, true);

    final LongList selected = verifier.selectContextNodes(0, 42L);
    assertEquals(XAccelTestHelper.BIB, selected.getLong(0));
    // First leaf, also the first deepest node.
    assertTrue(selected.contains(XAccelTestHelper.SCHMITT_FIRST_AUTHOR));
    // Only child.
    assertTrue(selected.contains(XAccelTestHelper.VLDB_2023));
    // Child with siblings on both sides.
    assertTrue(selected.contains(XAccelTestHelper.SCHMITT_FIRST_AUTHOR + 1));
    assertEquals(4, selected.size());

    assertEquals(verifier.selectContextNodes(20, 7L), verifier.selectContextNodes(20, 7L));
  }

  @Test
  public void testFaultyCandidateIsDetected() throws StructuralException {
    final TreeModel tree = XAccelTestHelper.toyTreeModel();
    final Numbering numbering = new NumberingAssigner(1).assign(tree);
    final AdjacencyBackend reference = new AdjacencyBackend(tree);

    // Drops the last node of every non-empty result.
    final AxisEvaluator candidate = mock(AxisEvaluator.class);
    when(candidate.getBackendKind()).thenReturn(BackendKind.INTERVAL);
    when(candidate.keys(anyLong(), any(AxisKind.class))).thenAnswer(invocation -> {
      final LongList keys = reference.keys(invocation.<Long>getArgument(0), invocation.<AxisKind>getArgument(1));
      if (!keys.isEmpty()) {
        keys.removeLong(keys.size() - 1);
      }
      return keys;
    });

    final VerificationResult result =
        new EquivalenceVerifier(tree, numbering, reference, candidate).verify(LongArrayList.wrap(new long[] { 1L }));
    assertFalse(result.isSuccess());
    final Mismatch mismatch = result.getMismatches().get(0);
    assertEquals(Mismatch.Kind.MISSING, mismatch.kind());
    assertEquals(AxisKind.DESCENDANT, mismatch.axis());
    assertEquals(61L, mismatch.nodeId());

    final EquivalenceMismatchException e = assertThrows(EquivalenceMismatchException.class, result::orElseThrow);
    assertEquals(result.getMismatches(), e.getMismatches());
  }

  @Test
  public void testUnorderedCandidateIsDetected() throws StructuralException {
    final TreeModel tree = XAccelTestHelper.toyTreeModel();
    final Numbering numbering = new NumberingAssigner(1).assign(tree);
    final AdjacencyBackend reference = new AdjacencyBackend(tree);

    final AxisEvaluator candidate = mock(AxisEvaluator.class);
    when(candidate.keys(anyLong(), any(AxisKind.class))).thenAnswer(invocation -> {
      final LongList keys = reference.keys(invocation.<Long>getArgument(0), invocation.<AxisKind>getArgument(1));
      final LongList reversed = new LongArrayList(keys.size());
      for (int i = keys.size() - 1; i >= 0; i--) {
        reversed.add(keys.getLong(i));
      }
      return reversed;
    });

    final VerificationResult result = new EquivalenceVerifier(tree, numbering, reference, candidate).verify(
        LongArrayList.wrap(new long[] { XAccelTestHelper.SCHMITT_FIRST_AUTHOR }));
    assertFalse(result.isSuccess());
    assertTrue(result.getMismatches().stream().allMatch(m -> m.kind() == Mismatch.Kind.ORDER));
    assertTrue(result.getMismatches().stream().anyMatch(m -> m.axis() == AxisKind.ANCESTOR));
  }
}

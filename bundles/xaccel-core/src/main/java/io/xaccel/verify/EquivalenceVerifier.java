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

import io.xaccel.access.AdjacencyBackend;
import io.xaccel.access.IntervalBackend;
import io.xaccel.api.AxisEvaluator;
import io.xaccel.axis.AxisKind;
import io.xaccel.numbering.Numbering;
import io.xaccel.tree.TreeModel;
import io.xaccel.utils.LogWrapper;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongCollection;
import it.unimi.dsi.fastutil.longs.LongLinkedOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Cross-checks a candidate backend against a reference backend. For every selected context node
 * all four axes are evaluated by both; the reported node sets must be equal and the candidate's
 * output must be in document order. The numbering is checked node by node against the tree as
 * well.
 *
 * <p>
 * Any mismatch is a defect of the numbering or of the candidate's axis evaluation.
 * </p>
 */
public final class EquivalenceVerifier {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = LogWrapper.of(EquivalenceVerifier.class);

  private final TreeModel tree;

  private final Numbering numbering;

  private final AxisEvaluator reference;

  private final AxisEvaluator candidate;

  private final DocumentOrder documentOrder;

  /**
   * Constructor.
   *
   * @param tree the tree both backends read from
   * @param numbering the numbering of the tree
   * @param reference the backend taken as ground truth
   * @param candidate the backend under test
   */
  public EquivalenceVerifier(final TreeModel tree, final Numbering numbering, final AxisEvaluator reference,
      final AxisEvaluator candidate) {
    this.tree = requireNonNull(tree);
    this.numbering = requireNonNull(numbering);
    this.reference = requireNonNull(reference);
    this.candidate = requireNonNull(candidate);
    checkArgument(tree.size() == numbering.size(), "Numbering does not belong to the tree.");
    documentOrder = new DocumentOrder(tree);
  }

  /**
   * Create a verifier checking the interval backend against the adjacency backend.
   *
   * @param tree the tree
   * @param numbering its numbering
   * @param windowPruning pruning setting of the interval backend
   * @return the verifier
   */
  public static EquivalenceVerifier of(final TreeModel tree, final Numbering numbering,
      final boolean windowPruning) {
    return new EquivalenceVerifier(tree, numbering, new AdjacencyBackend(tree),
        new IntervalBackend(tree, numbering, windowPruning));
  }

  /**
   * Verify on the representative context nodes plus a random sample.
   *
   * @param sampleSize number of randomly drawn context nodes
   * @param seed seed of the random sample
   * @return the verification result
   */
  public VerificationResult verify(final int sampleSize, final long seed) {
    return verify(selectContextNodes(sampleSize, seed));
  }

  /**
   * Verify on the given context nodes.
   *
   * @param contextNodeIds ids of the context nodes
   * @return the verification result
   */
  public VerificationResult verify(final LongCollection contextNodeIds) {
    final long start = System.nanoTime();
    final List<Mismatch> mismatches = new ArrayList<>(checkNumbering());
    final LongSet distinct = new LongLinkedOpenHashSet(contextNodeIds);
    for (final long contextNodeId : distinct) {
      for (final AxisKind axis : AxisKind.values()) {
        compare(contextNodeId, axis, mismatches);
      }
    }

    if (mismatches.isEmpty()) {
      LOGWRAPPER.infoElapsed("Backends {} and {} agree on {} context nodes, took {} ms.", start,
          reference.getBackendKind(), candidate.getBackendKind(), distinct.size());
    } else {
      LOGWRAPPER.error("Backends {} and {} disagree: {} mismatch(es) on {} context nodes.",
          reference.getBackendKind(), candidate.getBackendKind(), mismatches.size(), distinct.size());
      // Details at error level are logged once the mismatches are raised.
      if (LOGWRAPPER.isDebugEnabled()) {
        for (final Mismatch mismatch : mismatches) {
          LOGWRAPPER.debug("  {}", mismatch);
        }
      }
    }
    return new VerificationResult(mismatches, distinct.size());
  }

  /**
   * Select context nodes: the root, a leaf, a node without siblings, a node with preceding and
   * following siblings and a deepest node, each if the tree has one, followed by
   * {@code sampleSize} randomly drawn nodes. Duplicates are dropped.
   *
   * @param sampleSize number of randomly drawn nodes
   * @param seed seed of the random generator
   * @return ids of the context nodes
   */
  public LongList selectContextNodes(final int sampleSize, final long seed) {
    checkArgument(sampleSize >= 0, "Sample size must be >= 0!");
    final int size = tree.size();
    final LongLinkedOpenHashSet selected = new LongLinkedOpenHashSet();
    selected.add(tree.getId(tree.getRootIndex()));

    int leaf = -1;
    int onlyChild = -1;
    int middleChild = -1;
    int deepest = tree.getRootIndex();
    int maxDepth = 0;
    for (int i = 0; i < size; i++) {
      if (leaf == -1 && tree.getChildren(i).isEmpty()) {
        leaf = i;
      }
      final int parent = tree.getParentIndex(i);
      if (parent != TreeModel.NO_PARENT) {
        final int siblings = tree.getChildren(parent).size();
        final int position = tree.getChildPosition(i);
        if (onlyChild == -1 && siblings == 1) {
          onlyChild = i;
        }
        if (middleChild == -1 && position > 0 && position < siblings - 1) {
          middleChild = i;
        }
      }
      final int depth = depthByParentWalk(i);
      if (depth > maxDepth) {
        maxDepth = depth;
        deepest = i;
      }
    }
    for (final int index : new int[] { leaf, onlyChild, middleChild, deepest }) {
      if (index != -1) {
        selected.add(tree.getId(index));
      }
    }

    final Random random = new Random(seed);
    for (int i = 0; i < sampleSize; i++) {
      selected.add(tree.getId(random.nextInt(size)));
    }
    return new LongArrayList(selected);
  }

  /**
   * Check every node's ranks against its parent and children: the parent's interval encloses the
   * node's, the level is one more than the parent's and the subtree size sums up. Together with
   * dense ranks this implies the containment invariants for all pairs of nodes.
   *
   * @return the numbering violations
   */
  public List<Mismatch> checkNumbering() {
    final List<Mismatch> mismatches = new ArrayList<>();
    final int size = tree.size();
    final int origin = numbering.getOrigin();
    final boolean[] preSeen = new boolean[size];
    final boolean[] postSeen = new boolean[size];

    for (int i = 0; i < size; i++) {
      final long id = tree.getId(i);
      final int pre = numbering.getPre(i);
      final int post = numbering.getPost(i);
      if (pre < origin || pre >= origin + size || preSeen[pre - origin]) {
        mismatches.add(numberingMismatch(id, "pre rank " + pre + " is out of range or taken twice"));
      } else {
        preSeen[pre - origin] = true;
      }
      if (post < origin || post >= origin + size || postSeen[post - origin]) {
        mismatches.add(numberingMismatch(id, "post rank " + post + " is out of range or taken twice"));
      } else {
        postSeen[post - origin] = true;
      }

      final int parent = tree.getParentIndex(i);
      if (parent != TreeModel.NO_PARENT) {
        if (!(numbering.getPre(parent) < pre && numbering.getPost(parent) > post)) {
          mismatches.add(numberingMismatch(id, "interval not enclosed by the parent's interval"));
        }
        if (numbering.getLevel(i) != numbering.getLevel(parent) + 1) {
          mismatches.add(numberingMismatch(id, "level " + numbering.getLevel(i) + " below parent level "
              + numbering.getLevel(parent)));
        }
      } else if (numbering.getLevel(i) != 0) {
        mismatches.add(numberingMismatch(id, "root level is " + numbering.getLevel(i)));
      }

      final IntList children = tree.getChildren(i);
      int expectedSize = 1;
      int previousPre = pre;
      for (int c = 0, n = children.size(); c < n; c++) {
        final int child = children.getInt(c);
        expectedSize += numbering.getSubtreeSize(child);
        if (numbering.getPre(child) <= previousPre) {
          mismatches.add(numberingMismatch(tree.getId(child), "pre rank contradicts sibling order"));
        }
        previousPre = numbering.getPre(child);
      }
      if (numbering.getSubtreeSize(i) != expectedSize) {
        mismatches.add(numberingMismatch(id, "subtree size " + numbering.getSubtreeSize(i) + " != " + expectedSize));
      }
    }
    return mismatches;
  }

  private void compare(final long contextNodeId, final AxisKind axis, final List<Mismatch> mismatches) {
    final LongList expected = reference.keys(contextNodeId, axis);
    final LongList actual = candidate.keys(contextNodeId, axis);

    final LongSet expectedSet = new LongOpenHashSet(expected);
    final LongSet actualSet = new LongOpenHashSet(actual.size());
    for (final long id : actual) {
      if (!actualSet.add(id)) {
        mismatches.add(new Mismatch(Mismatch.Kind.UNEXPECTED, contextNodeId, axis, id, "reported twice"));
      } else if (!expectedSet.contains(id)) {
        mismatches.add(new Mismatch(Mismatch.Kind.UNEXPECTED, contextNodeId, axis, id, "not on the reference axis"));
      }
    }
    for (final long id : expected) {
      if (!actualSet.contains(id)) {
        mismatches.add(new Mismatch(Mismatch.Kind.MISSING, contextNodeId, axis, id, "missing on the checked axis"));
      }
    }

    final IntArrayList positions = new IntArrayList(actual.size());
    for (final long id : actual) {
      final int index = tree.getIndex(id);
      if (index != TreeModel.NOT_FOUND) {
        positions.add(index);
      }
    }
    for (int i = 1; i < positions.size(); i++) {
      if (numbering.getPre(positions.getInt(i - 1)) >= numbering.getPre(positions.getInt(i))) {
        mismatches.add(new Mismatch(Mismatch.Kind.ORDER, contextNodeId, axis, tree.getId(positions.getInt(i)),
            "not reported in ascending pre order"));
      }
    }
    positions.sort((final int a, final int b) -> Integer.compare(numbering.getPre(a), numbering.getPre(b)));
    for (int i = 1; i < positions.size(); i++) {
      if (documentOrder.compare(positions.getInt(i - 1), positions.getInt(i)) > 0) {
        mismatches.add(new Mismatch(Mismatch.Kind.ORDER, contextNodeId, axis, tree.getId(positions.getInt(i)),
            "pre order contradicts document order"));
      }
    }
  }

  private int depthByParentWalk(final int index) {
    int depth = 0;
    for (int node = tree.getParentIndex(index); node != TreeModel.NO_PARENT; node = tree.getParentIndex(node)) {
      depth++;
    }
    return depth;
  }

  private static Mismatch numberingMismatch(final long nodeId, final String detail) {
    return new Mismatch(Mismatch.Kind.NUMBERING, nodeId, null, nodeId, detail);
  }
}

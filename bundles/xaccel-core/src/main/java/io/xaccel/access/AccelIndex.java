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

import com.google.common.base.MoreObjects;
import io.xaccel.api.Axis;
import io.xaccel.api.AxisEvaluator;
import io.xaccel.api.NodeRef;
import io.xaccel.axis.AxisKind;
import io.xaccel.exception.NodeNotFoundException;
import io.xaccel.exception.StructuralException;
import io.xaccel.node.IndexedNode;
import io.xaccel.node.NodeRecord;
import io.xaccel.numbering.Numbering;
import io.xaccel.numbering.NumberingAssigner;
import io.xaccel.tree.TreeModel;
import io.xaccel.utils.LogWrapper;
import io.xaccel.verify.EquivalenceVerifier;
import io.xaccel.verify.VerificationResult;
import it.unimi.dsi.fastutil.longs.LongList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A built, immutable axis index over one document. Axis queries are answered by the backend chosen
 * in the {@link IndexConfiguration}; the other backend stays available for verification.
 *
 * <p>
 * Once published an index never changes, any number of threads may query it without locking. A
 * changed document needs a new index.
 * </p>
 */
public final class AccelIndex {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = LogWrapper.of(AccelIndex.class);

  private final TreeModel tree;

  private final Numbering numbering;

  private final IndexConfiguration config;

  private final AdjacencyBackend adjacencyBackend;

  private final IntervalBackend intervalBackend;

  /** The backend answering queries. */
  private final AxisEvaluator evaluator;

  private AccelIndex(final TreeModel tree, final Numbering numbering, final IndexConfiguration config) {
    this.tree = tree;
    this.numbering = numbering;
    this.config = config;
    adjacencyBackend = new AdjacencyBackend(tree);
    intervalBackend = new IntervalBackend(tree, numbering, config.isWindowPruning());
    evaluator = switch (config.getBackendKind()) {
      case ADJACENCY -> adjacencyBackend;
      case INTERVAL -> intervalBackend;
    };
  }

  /**
   * Build an index from a node stream with the default configuration.
   *
   * @param records the records in document order
   * @return the index
   * @throws StructuralException if the records do not form a tree
   */
  public static AccelIndex build(final Iterable<NodeRecord> records) throws StructuralException {
    return build(records, IndexConfiguration.defaults());
  }

  /**
   * Build an index from a node stream.
   *
   * @param records the records in document order
   * @param config the configuration
   * @return the index
   * @throws StructuralException if the records do not form a tree
   * @throws io.xaccel.exception.EquivalenceMismatchException if verification on build is enabled and
   *         fails
   */
  public static AccelIndex build(final Iterable<NodeRecord> records, final IndexConfiguration config)
      throws StructuralException {
    return build(TreeModel.of(requireNonNull(records)), config);
  }

  /**
   * Build an index over a tree model.
   *
   * @param tree the tree model
   * @param config the configuration
   * @return the index
   * @throws StructuralException if the tree structure is invalid
   * @throws io.xaccel.exception.EquivalenceMismatchException if verification on build is enabled and
   *         fails
   */
  public static AccelIndex build(final TreeModel tree, final IndexConfiguration config) throws StructuralException {
    requireNonNull(tree);
    requireNonNull(config);
    final long start = System.nanoTime();

    final Numbering numbering = new NumberingAssigner(config.getNumberingOrigin()).assign(tree);
    final AccelIndex index = new AccelIndex(tree, numbering, config);

    LOGWRAPPER.infoElapsed("Index over {} nodes built, ranks {}..{}, backend {}, took {} ms.", start, tree.size(),
        numbering.getOrigin(), numbering.getMaxRank(), config.getBackendKind());

    if (config.isVerifyOnBuild()) {
      index.verify().orElseThrow();
    }
    return index;
  }

  /**
   * Evaluate an axis.
   *
   * @param contextNodeId id of the context node
   * @param kind the axis
   * @return the nodes on the axis in document order
   * @throws NodeNotFoundException if the context node is unknown
   */
  public List<NodeRef> axis(final long contextNodeId, final AxisKind kind) {
    final Axis axis = evaluator.axis(contextNodeId, kind);
    final List<NodeRef> result = new ArrayList<>();
    while (axis.hasNext()) {
      result.add(nodeAt(tree.getIndex(axis.nextLong())));
    }
    return result;
  }

  /**
   * Evaluate an axis, returning ids only.
   *
   * @param contextNodeId id of the context node
   * @param kind the axis
   * @return the ids of the nodes on the axis in document order
   * @throws NodeNotFoundException if the context node is unknown
   */
  public LongList axisKeys(final long contextNodeId, final AxisKind kind) {
    return evaluator.keys(contextNodeId, kind);
  }

  /**
   * Find a node by its semantic id.
   *
   * @param semanticId the semantic id
   * @return the node or an empty optional if no node carries the semantic id
   */
  public Optional<NodeRef> lookup(final String semanticId) {
    final int index = tree.getIndexBySemanticId(semanticId);
    return index == TreeModel.NOT_FOUND ? Optional.empty() : Optional.of(nodeAt(index));
  }

  /**
   * Get a node by id.
   *
   * @param id the node id
   * @return the node
   * @throws NodeNotFoundException if the id is unknown
   */
  public NodeRef getNode(final long id) {
    final int index = tree.getIndex(id);
    if (index == TreeModel.NOT_FOUND) {
      throw new NodeNotFoundException(id);
    }
    return nodeAt(index);
  }

  public NodeRef getRoot() {
    return nodeAt(tree.getRootIndex());
  }

  /**
   * Cross-check the interval backend against the adjacency backend on the representative context
   * nodes and the configured random sample.
   *
   * @return the verification result
   */
  public VerificationResult verify() {
    return new EquivalenceVerifier(tree, numbering, adjacencyBackend, intervalBackend).verify(
        config.getVerificationSampleSize(), config.getVerificationSeed());
  }

  public IndexStatistics getStatistics() {
    return IndexStatistics.of(tree, numbering);
  }

  /**
   * Get the backend answering the queries of this index.
   *
   * @return the selected backend
   */
  public AxisEvaluator getEvaluator() {
    return evaluator;
  }

  public AdjacencyBackend getAdjacencyBackend() {
    return adjacencyBackend;
  }

  public IntervalBackend getIntervalBackend() {
    return intervalBackend;
  }

  public TreeModel getTreeModel() {
    return tree;
  }

  public Numbering getNumbering() {
    return numbering;
  }

  public IndexConfiguration getConfiguration() {
    return config;
  }

  private NodeRef nodeAt(final int index) {
    return new IndexedNode(tree, numbering, index);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("tree", tree).add("backend", config.getBackendKind()).toString();
  }
}

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

import io.xaccel.api.Axis;
import io.xaccel.api.AxisEvaluator;
import io.xaccel.axis.AxisKind;
import io.xaccel.axis.interval.IntervalAncestorAxis;
import io.xaccel.axis.interval.IntervalDescendantAxis;
import io.xaccel.axis.interval.IntervalFollowingSiblingAxis;
import io.xaccel.axis.interval.IntervalPrecedingSiblingAxis;
import io.xaccel.numbering.Numbering;
import io.xaccel.tree.TreeModel;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Answers axis queries by comparing the {@code (pre, post, parent)} triple of candidates with the
 * one of the context node.
 */
public final class IntervalBackend implements AxisEvaluator {

  private final TreeModel tree;

  private final Numbering numbering;

  private final boolean windowPruning;

  /**
   * Constructor.
   *
   * @param tree the tree
   * @param numbering numbering of {@code tree}
   * @param windowPruning narrow the scanned pre-order range by level and subtree size
   */
  public IntervalBackend(final TreeModel tree, final Numbering numbering, final boolean windowPruning) {
    this.tree = requireNonNull(tree);
    this.numbering = requireNonNull(numbering);
    checkArgument(tree.size() == numbering.size(), "Numbering does not belong to the tree.");
    this.windowPruning = windowPruning;
  }

  @Override
  public Axis axis(final long contextNodeId, final AxisKind kind) {
    return switch (requireNonNull(kind)) {
      case ANCESTOR -> new IntervalAncestorAxis(tree, numbering, contextNodeId, windowPruning);
      case DESCENDANT -> new IntervalDescendantAxis(tree, numbering, contextNodeId, windowPruning);
      case FOLLOWING_SIBLING -> new IntervalFollowingSiblingAxis(tree, numbering, contextNodeId, windowPruning);
      case PRECEDING_SIBLING -> new IntervalPrecedingSiblingAxis(tree, numbering, contextNodeId, windowPruning);
    };
  }

  public Numbering getNumbering() {
    return numbering;
  }

  public boolean isWindowPruning() {
    return windowPruning;
  }

  @Override
  public TreeModel getTreeModel() {
    return tree;
  }

  @Override
  public BackendKind getBackendKind() {
    return BackendKind.INTERVAL;
  }
}

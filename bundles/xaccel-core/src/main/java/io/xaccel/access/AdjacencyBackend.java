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
import io.xaccel.axis.AncestorAxis;
import io.xaccel.axis.AxisKind;
import io.xaccel.axis.DescendantAxis;
import io.xaccel.axis.FollowingSiblingAxis;
import io.xaccel.axis.PrecedingSiblingAxis;
import io.xaccel.tree.TreeModel;

import static java.util.Objects.requireNonNull;

/**
 * Answers axis queries from parent/child edges only, by explicit closure. It never looks at the
 * traversal numbering and serves as the reference the interval backend is checked against.
 */
public final class AdjacencyBackend implements AxisEvaluator {

  private final TreeModel tree;

  public AdjacencyBackend(final TreeModel tree) {
    this.tree = requireNonNull(tree);
  }

  @Override
  public Axis axis(final long contextNodeId, final AxisKind kind) {
    return switch (requireNonNull(kind)) {
      case ANCESTOR -> new AncestorAxis(tree, contextNodeId);
      case DESCENDANT -> new DescendantAxis(tree, contextNodeId);
      case FOLLOWING_SIBLING -> new FollowingSiblingAxis(tree, contextNodeId);
      case PRECEDING_SIBLING -> new PrecedingSiblingAxis(tree, contextNodeId);
    };
  }

  @Override
  public TreeModel getTreeModel() {
    return tree;
  }

  @Override
  public BackendKind getBackendKind() {
    return BackendKind.ADJACENCY;
  }
}

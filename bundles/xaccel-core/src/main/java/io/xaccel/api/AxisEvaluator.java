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

package io.xaccel.api;

import io.xaccel.access.BackendKind;
import io.xaccel.axis.AxisKind;
import io.xaccel.tree.TreeModel;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;

/**
 * Answers the primitive structural axes for context nodes of one immutable tree. Implementations
 * are interchangeable: for every context node and axis they return the same node set in document
 * order.
 */
public interface AxisEvaluator {

  /**
   * Create an axis over the nodes on {@code kind} relative to the context node.
   *
   * @param contextNodeId id of the context node
   * @param kind the axis
   * @return a new axis
   * @throws io.xaccel.exception.NodeNotFoundException if the context node is unknown
   */
  Axis axis(long contextNodeId, AxisKind kind);

  /**
   * Evaluate an axis eagerly.
   *
   * @param contextNodeId id of the context node
   * @param kind the axis
   * @return the node ids in document order
   * @throws io.xaccel.exception.NodeNotFoundException if the context node is unknown
   */
  default LongList keys(final long contextNodeId, final AxisKind kind) {
    final LongList result = new LongArrayList();
    final Axis axis = axis(contextNodeId, kind);
    while (axis.hasNext()) {
      result.add(axis.nextLong());
    }
    return result;
  }

  /**
   * Get the tree the evaluator reads from.
   *
   * @return the tree model
   */
  TreeModel getTreeModel();

  BackendKind getBackendKind();
}

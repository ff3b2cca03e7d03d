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

import io.xaccel.tree.TreeModel;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.checkerframework.checker.index.qual.NonNegative;

/**
 * <h1>PrecedingSiblingAxis</h1>
 *
 * <p>
 * Iterate over all preceding siblings of a given node, that is the part of the parent's child list
 * before the node. Self is not included. Note that the axis conforms to the XPath specification and
 * returns nodes in document order.
 * </p>
 */
public final class PrecedingSiblingAxis extends AbstractAxis {

  /** The child list of the parent. */
  private IntList siblings;

  /** Position of the next sibling to report. */
  private int cursor;

  /** Position of the context node in the child list. */
  private int end;

  /**
   * Constructor initializing internal state.
   *
   * @param tree the tree to iterate over
   * @param nodeKey id of the context node
   */
  public PrecedingSiblingAxis(final TreeModel tree, final long nodeKey) {
    super(tree, nodeKey, IncludeSelf.NO);
  }

  @Override
  public void reset(final @NonNegative long nodeKey) {
    super.reset(nodeKey);
    final int parent = tree.getParentIndex(getStartIndex());
    siblings = parent == TreeModel.NO_PARENT ? IntLists.emptyList() : tree.getChildren(parent);
    end = parent == TreeModel.NO_PARENT ? 0 : tree.getChildPosition(getStartIndex());
    cursor = 0;
  }

  @Override
  protected long nextKey() {
    if (cursor < end) {
      return keyOf(siblings.getInt(cursor++));
    }
    return done();
  }
}

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
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.checkerframework.checker.index.qual.NonNegative;

/**
 * <p>
 * Iterate over all descendants starting at a given node (in preorder) by enumerating children,
 * children of children and so on. Self might or might not be included.
 * </p>
 */
public final class DescendantAxis extends AbstractAxis {

  /** Stack of positions still to visit, next in document order on top. */
  private IntArrayList stack;

  /**
   * Constructor initializing internal state.
   *
   * @param tree the tree to iterate over
   * @param nodeKey id of the context node
   */
  public DescendantAxis(final TreeModel tree, final long nodeKey) {
    super(tree, nodeKey, IncludeSelf.NO);
  }

  /**
   * Constructor initializing internal state.
   *
   * @param tree the tree to iterate over
   * @param nodeKey id of the context node
   * @param includeSelf determines if current node is included or not
   */
  public DescendantAxis(final TreeModel tree, final long nodeKey, final IncludeSelf includeSelf) {
    super(tree, nodeKey, includeSelf);
  }

  @Override
  public void reset(final @NonNegative long nodeKey) {
    super.reset(nodeKey);
    stack = null;
  }

  @Override
  protected long nextKey() {
    if (stack == null) {
      stack = new IntArrayList();
      if (isSelfIncluded()) {
        stack.push(getStartIndex());
      } else {
        pushChildren(getStartIndex());
      }
    }

    if (stack.isEmpty()) {
      return done();
    }

    final int next = stack.popInt();
    pushChildren(next);
    return keyOf(next);
  }

  private void pushChildren(final int index) {
    final IntList children = tree.getChildren(index);
    for (int i = children.size() - 1; i >= 0; i--) {
      stack.push(children.getInt(i));
    }
  }
}

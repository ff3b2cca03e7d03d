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
import org.checkerframework.checker.index.qual.NonNegative;

/**
 * <h1>AncestorAxis</h1>
 *
 * <p>
 * Iterate over all ancestors of a given node by following the parent links up to the root. Results
 * are reported root first. Self is not included by default.
 * </p>
 */
public final class AncestorAxis extends AbstractAxis {

  /** Ancestor chain, nearest ancestor first. */
  private IntArrayList chain;

  /** Position in the chain of the next ancestor to report. */
  private int cursor;

  /** Determines if self has been reported. */
  private boolean selfDone;

  /**
   * Constructor initializing internal state.
   *
   * @param tree the tree to iterate over
   * @param nodeKey id of the context node
   */
  public AncestorAxis(final TreeModel tree, final long nodeKey) {
    super(tree, nodeKey, IncludeSelf.NO);
  }

  /**
   * Constructor initializing internal state.
   *
   * @param tree the tree to iterate over
   * @param nodeKey id of the context node
   * @param includeSelf Is self included?
   */
  public AncestorAxis(final TreeModel tree, final long nodeKey, final IncludeSelf includeSelf) {
    super(tree, nodeKey, includeSelf);
  }

  @Override
  public void reset(final @NonNegative long nodeKey) {
    super.reset(nodeKey);
    chain = null;
    selfDone = false;
  }

  @Override
  protected long nextKey() {
    if (chain == null) {
      chain = new IntArrayList();
      for (int parent = tree.getParentIndex(getStartIndex()); parent != TreeModel.NO_PARENT;
          parent = tree.getParentIndex(parent)) {
        chain.add(parent);
      }
      cursor = chain.size() - 1;
    }

    if (cursor >= 0) {
      return keyOf(chain.getInt(cursor--));
    }

    if (isSelfIncluded() && !selfDone) {
      selfDone = true;
      return getStartKey();
    }

    return done();
  }
}

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

package io.xaccel.axis.interval;

import io.xaccel.axis.IncludeSelf;
import io.xaccel.numbering.Numbering;
import io.xaccel.tree.TreeModel;
import org.checkerframework.checker.index.qual.NonNegative;

/**
 * Following-sibling axis over the interval encoding: {@code u} follows {@code v} as a sibling iff
 * {@code parent(u) = parent(v)} and {@code pre(u) > pre(v)}.
 *
 * <p>
 * With window pruning the scan jumps over whole subtrees: the next sibling, if any, has the
 * pre-order rank {@code pre(v) + size(v)}.
 * </p>
 */
public final class IntervalFollowingSiblingAxis extends AbstractIntervalAxis {

  /** Next pre-order rank to test. */
  private int rank;

  private boolean first;

  public IntervalFollowingSiblingAxis(final TreeModel tree, final Numbering numbering, final long nodeKey,
      final boolean windowPruning) {
    super(tree, numbering, nodeKey, IncludeSelf.NO, windowPruning);
  }

  @Override
  public void reset(final @NonNegative long nodeKey) {
    super.reset(nodeKey);
    first = true;
  }

  @Override
  protected long nextKey() {
    final int context = getStartIndex();
    final int contextParent = parent(context);
    if (contextParent == TreeModel.NO_PARENT) {
      return done();
    }

    if (first) {
      first = false;
      rank = isWindowPruning() ? pre(context) + numbering().getSubtreeSize(context) : pre(context) + 1;
    }

    final int maxRank = numbering().getMaxRank();
    while (rank <= maxRank) {
      final int candidate = atPre(rank);
      if (parent(candidate) == contextParent) {
        rank += isWindowPruning() ? numbering().getSubtreeSize(candidate) : 1;
        return keyOf(candidate);
      }
      if (isWindowPruning()) {
        // Left the subtree of the parent.
        return done();
      }
      rank++;
    }

    return done();
  }
}

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
 * Descendant axis over the interval encoding: {@code u} is a descendant of {@code v} iff
 * {@code pre(u) > pre(v)} and {@code post(u) < post(v)}.
 *
 * <p>
 * Descendants occupy the contiguous pre-order range {@code (pre(v), pre(v) + size(v))}, which
 * bounds the scan if window pruning is enabled.
 * </p>
 */
public final class IntervalDescendantAxis extends AbstractIntervalAxis {

  /** Next pre-order rank to test. */
  private int rank;

  /** Last pre-order rank to test. */
  private int lastRank;

  private boolean first;

  public IntervalDescendantAxis(final TreeModel tree, final Numbering numbering, final long nodeKey,
      final boolean windowPruning) {
    this(tree, numbering, nodeKey, IncludeSelf.NO, windowPruning);
  }

  public IntervalDescendantAxis(final TreeModel tree, final Numbering numbering, final long nodeKey,
      final IncludeSelf includeSelf, final boolean windowPruning) {
    super(tree, numbering, nodeKey, includeSelf, windowPruning);
  }

  @Override
  public void reset(final @NonNegative long nodeKey) {
    super.reset(nodeKey);
    first = true;
  }

  @Override
  protected long nextKey() {
    final int context = getStartIndex();
    if (first) {
      first = false;
      rank = pre(context) + 1;
      lastRank = isWindowPruning()
          ? pre(context) + numbering().getSubtreeSize(context) - 1
          : numbering().getMaxRank();
      if (isSelfIncluded()) {
        return getStartKey();
      }
    }

    final int contextPost = post(context);
    while (rank <= lastRank) {
      final int candidate = atPre(rank++);
      if (post(candidate) < contextPost) {
        return keyOf(candidate);
      }
    }

    return done();
  }
}

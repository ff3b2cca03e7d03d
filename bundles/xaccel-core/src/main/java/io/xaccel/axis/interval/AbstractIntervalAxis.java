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

import io.xaccel.axis.AbstractAxis;
import io.xaccel.axis.IncludeSelf;
import io.xaccel.numbering.Numbering;
import io.xaccel.tree.TreeModel;

import static java.util.Objects.requireNonNull;

/**
 * Base of the axes which decide membership by comparing pre-order rank, post-order rank and parent
 * of a candidate with those of the context node. Candidates are scanned in pre-order, so results
 * come out in document order.
 *
 * <p>
 * With window pruning enabled the scanned pre-order range is narrowed by means of the level and the
 * subtree size of the nodes. The membership test itself is the same either way.
 * </p>
 */
abstract class AbstractIntervalAxis extends AbstractAxis {

  /** The numbering of {@link #tree}. */
  private final Numbering numbering;

  /** Narrow the scan window? */
  private final boolean windowPruning;

  AbstractIntervalAxis(final TreeModel tree, final Numbering numbering, final long nodeKey,
      final IncludeSelf includeSelf, final boolean windowPruning) {
    super(tree, nodeKey, includeSelf);
    this.numbering = requireNonNull(numbering);
    this.windowPruning = windowPruning;
  }

  protected final Numbering numbering() {
    return numbering;
  }

  protected final boolean isWindowPruning() {
    return windowPruning;
  }

  protected final int pre(final int index) {
    return numbering.getPre(index);
  }

  protected final int post(final int index) {
    return numbering.getPost(index);
  }

  protected final int parent(final int index) {
    return tree.getParentIndex(index);
  }

  /**
   * Arena position of the node with the given pre-order rank.
   */
  protected final int atPre(final int preRank) {
    return numbering.getIndexByPre(preRank);
  }
}

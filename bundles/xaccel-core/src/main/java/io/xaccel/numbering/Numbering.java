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

package io.xaccel.numbering;

import com.google.common.base.MoreObjects;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;

/**
 * Immutable traversal numbering of one tree: pre-order and post-order rank, depth and subtree size
 * per arena position, plus the inverse mapping from pre-order rank to arena position.
 */
public final class Numbering {

  private final int origin;

  private final int[] pre;

  private final int[] post;

  private final int[] level;

  private final int[] subtreeSize;

  /** Arena position by {@code pre - origin}. */
  private final int[] byPre;

  Numbering(final int origin, final int[] pre, final int[] post, final int[] level, final int[] subtreeSize) {
    this.origin = origin;
    this.pre = pre;
    this.post = post;
    this.level = level;
    this.subtreeSize = subtreeSize;
    byPre = new int[pre.length];
    for (int i = 0; i < pre.length; i++) {
      byPre[pre[i] - origin] = i;
    }
  }

  /**
   * Get the value of the first rank, {@code 0} or {@code 1}.
   *
   * @return the numbering origin
   */
  public int getOrigin() {
    return origin;
  }

  public int size() {
    return pre.length;
  }

  public int getPre(final @NonNegative int index) {
    return pre[index];
  }

  public int getPost(final @NonNegative int index) {
    return post[index];
  }

  /**
   * Get the depth of a node, the root has level {@code 0}.
   *
   * @param index arena position
   * @return the level
   */
  public int getLevel(final @NonNegative int index) {
    return level[index];
  }

  /**
   * Get the number of nodes in the subtree of a node, including the node itself.
   *
   * @param index arena position
   * @return the subtree size
   */
  public int getSubtreeSize(final @NonNegative int index) {
    return subtreeSize[index];
  }

  /**
   * Get the arena position of the node with the given pre-order rank.
   *
   * @param preRank pre-order rank in {@code origin..origin+size()-1}
   * @return the arena position
   */
  public int getIndexByPre(final int preRank) {
    return byPre[preRank - origin];
  }

  /**
   * Get the largest assigned rank.
   *
   * @return {@code origin + size() - 1}
   */
  public int getMaxRank() {
    return origin + pre.length - 1;
  }

  @Override
  public boolean equals(final @Nullable Object obj) {
    if (!(obj instanceof Numbering other)) {
      return false;
    }
    return origin == other.origin && Arrays.equals(pre, other.pre) && Arrays.equals(post, other.post)
        && Arrays.equals(level, other.level) && Arrays.equals(subtreeSize, other.subtreeSize);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * origin + Arrays.hashCode(pre)) + Arrays.hashCode(post);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("origin", origin).add("size", pre.length).toString();
  }
}

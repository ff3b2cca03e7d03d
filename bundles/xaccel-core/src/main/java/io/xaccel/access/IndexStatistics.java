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

import com.google.common.base.MoreObjects;
import io.xaccel.node.NodeRecord;
import io.xaccel.numbering.Numbering;
import io.xaccel.tree.TreeModel;

/**
 * Summary figures of a built index.
 */
public final class IndexStatistics {

  private final int nodeCount;

  private final int textNodeCount;

  private final int attributeCount;

  private final int leafCount;

  private final int maxDepth;

  private final int maxFanOut;

  private IndexStatistics(final int nodeCount, final int textNodeCount, final int attributeCount,
      final int leafCount, final int maxDepth, final int maxFanOut) {
    this.nodeCount = nodeCount;
    this.textNodeCount = textNodeCount;
    this.attributeCount = attributeCount;
    this.leafCount = leafCount;
    this.maxDepth = maxDepth;
    this.maxFanOut = maxFanOut;
  }

  /**
   * Compute the statistics of a numbered tree.
   *
   * @param tree the tree
   * @param numbering its numbering
   * @return the statistics
   */
  public static IndexStatistics of(final TreeModel tree, final Numbering numbering) {
    int textNodes = 0;
    int attributes = 0;
    int leaves = 0;
    int maxDepth = 0;
    int maxFanOut = 0;
    for (int i = 0, size = tree.size(); i < size; i++) {
      final NodeRecord record = tree.getRecord(i);
      final String text = record.getText();
      if (text != null && !text.isBlank()) {
        textNodes++;
      }
      attributes += record.getAttributes().size();
      final int fanOut = tree.getChildren(i).size();
      if (fanOut == 0) {
        leaves++;
      }
      maxFanOut = Math.max(maxFanOut, fanOut);
      maxDepth = Math.max(maxDepth, numbering.getLevel(i));
    }
    return new IndexStatistics(tree.size(), textNodes, attributes, leaves, maxDepth, maxFanOut);
  }

  public int getNodeCount() {
    return nodeCount;
  }

  /**
   * Get the number of nodes carrying non-blank text.
   *
   * @return text node count
   */
  public int getTextNodeCount() {
    return textNodeCount;
  }

  public int getAttributeCount() {
    return attributeCount;
  }

  public int getLeafCount() {
    return leafCount;
  }

  public int getMaxDepth() {
    return maxDepth;
  }

  public int getMaxFanOut() {
    return maxFanOut;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("nodes", nodeCount)
                      .add("textNodes", textNodeCount)
                      .add("attributes", attributeCount)
                      .add("leaves", leafCount)
                      .add("maxDepth", maxDepth)
                      .add("maxFanOut", maxFanOut)
                      .toString();
  }
}

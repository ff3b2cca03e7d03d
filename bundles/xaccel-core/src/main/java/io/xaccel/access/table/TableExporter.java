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

package io.xaccel.access.table;

import io.xaccel.node.NodeRecord;
import io.xaccel.numbering.Numbering;
import io.xaccel.tree.TreeModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Flattens a tree into its relational shapes. Rows are emitted in document order; text rows are
 * only emitted for non-blank text.
 */
public final class TableExporter {

  private TableExporter() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Export the adjacency shape.
   *
   * @param tree the tree
   * @return the tables
   */
  public static AdjacencyTables toAdjacency(final TreeModel tree) {
    final List<AdjacencyRow> nodes = new ArrayList<>(tree.size());
    final List<ContentRow> content = new ArrayList<>();
    final List<AttributeRow> attributes = new ArrayList<>();
    for (int i = 0, size = tree.size(); i < size; i++) {
      final NodeRecord record = tree.getRecord(i);
      nodes.add(new AdjacencyRow(record.getId(), record.getParentId(), tree.getChildPosition(i), record.getType(),
          record.getSemanticId()));
      addSideRows(record, content, attributes);
    }
    return new AdjacencyTables(nodes, content, attributes);
  }

  /**
   * Export the interval shape, rows sorted by pre-order rank.
   *
   * @param tree the tree
   * @param numbering its numbering
   * @return the tables
   */
  public static IntervalTables toInterval(final TreeModel tree, final Numbering numbering) {
    checkArgument(tree.size() == numbering.size(), "Numbering does not belong to the tree.");
    final List<AccelRow> accel = new ArrayList<>(tree.size());
    final List<ContentRow> content = new ArrayList<>();
    final List<AttributeRow> attributes = new ArrayList<>();
    for (int rank = numbering.getOrigin(); rank <= numbering.getMaxRank(); rank++) {
      final int index = numbering.getIndexByPre(rank);
      final NodeRecord record = tree.getRecord(index);
      accel.add(new AccelRow(record.getId(), numbering.getPre(index), numbering.getPost(index), record.getParentId(),
          record.getType(), record.getSemanticId(), numbering.getLevel(index), numbering.getSubtreeSize(index)));
      addSideRows(record, content, attributes);
    }
    return new IntervalTables(accel, content, attributes);
  }

  private static void addSideRows(final NodeRecord record, final List<ContentRow> content,
      final List<AttributeRow> attributes) {
    final String text = record.getText();
    if (text != null && !text.isBlank()) {
      content.add(new ContentRow(record.getId(), text));
    }
    for (final Map.Entry<String, String> attribute : record.getAttributes().entries()) {
      attributes.add(new AttributeRow(record.getId(), attribute.getKey(), attribute.getValue()));
    }
  }
}

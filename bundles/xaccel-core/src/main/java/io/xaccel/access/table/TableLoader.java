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

import com.google.common.collect.ImmutableSetMultimap;
import io.xaccel.exception.StructuralException;
import io.xaccel.node.NodeRecord;
import io.xaccel.numbering.Numbering;
import io.xaccel.numbering.NumberingAssigner;
import io.xaccel.settings.Fixed;
import io.xaccel.tree.TreeModel;
import io.xaccel.utils.LogWrapper;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reconstructs a {@link TreeModel} from one of the relational shapes. Rows may come in any order.
 * Loading the interval shape re-derives the numbering and rejects stored ranks which differ from it.
 */
public final class TableLoader {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = LogWrapper.of(TableLoader.class);

  private TableLoader() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Load the adjacency shape. Siblings are ordered by their position column.
   *
   * @param tables the tables
   * @return the tree model
   * @throws StructuralException if the rows do not form a tree or two siblings share a position
   */
  public static TreeModel fromAdjacency(final AdjacencyTables tables) throws StructuralException {
    final List<AdjacencyRow> rows = new ArrayList<>(tables.nodes());
    // Stable, so only the relative order of siblings changes.
    rows.sort(Comparator.comparingInt(AdjacencyRow::position));

    final Long2ObjectMap<IntSet> positions = new Long2ObjectOpenHashMap<>();
    for (final AdjacencyRow row : rows) {
      if (!positions.computeIfAbsent(row.parentId(), id -> new IntOpenHashSet()).add(row.position())) {
        throw new StructuralException(StructuralException.Kind.DUPLICATE_POSITION,
            "Node %d has position %d, which a sibling below parent %d already has.", row.id(), row.position(),
            row.parentId());
      }
    }

    final SideTables side = SideTables.of(tables.content(), tables.attributes());
    final TreeModel.Builder builder = new TreeModel.Builder();
    for (final AdjacencyRow row : rows) {
      builder.add(toRecord(row.id(), row.parentId(), row.type(), row.semanticId(), side));
    }
    final TreeModel tree = builder.build();
    LOGWRAPPER.debug("Loaded {} nodes from the adjacency shape.", tree.size());
    return tree;
  }

  /**
   * Load the interval shape and validate the stored numbering.
   *
   * @param tables the tables
   * @return the tree model
   * @throws StructuralException if the rows do not form a tree or the stored ranks differ from the
   *         derived ones
   */
  public static TreeModel fromInterval(final IntervalTables tables) throws StructuralException {
    if (tables.accel().isEmpty()) {
      throw new StructuralException(StructuralException.Kind.NO_ROOT, "No rows.");
    }
    final List<AccelRow> rows = new ArrayList<>(tables.accel());
    rows.sort(Comparator.comparingInt(AccelRow::pre));

    final SideTables side = SideTables.of(tables.content(), tables.attributes());
    final TreeModel.Builder builder = new TreeModel.Builder();
    for (final AccelRow row : rows) {
      builder.add(toRecord(row.id(), row.parentId(), row.type(), row.semanticId(), side));
    }
    final TreeModel tree = builder.build();

    final int origin = rows.get(0).pre();
    if (origin != 0 && origin != 1) {
      throw new StructuralException(StructuralException.Kind.NUMBERING_MISMATCH,
          "Smallest pre rank is %d, expected 0 or 1.", origin);
    }
    final Numbering derived = new NumberingAssigner(origin).assign(tree);
    for (final AccelRow row : rows) {
      final int index = tree.getIndex(row.id());
      if (derived.getPre(index) != row.pre() || derived.getPost(index) != row.post()
          || derived.getLevel(index) != row.level() || derived.getSubtreeSize(index) != row.subtreeSize()) {
        throw new StructuralException(StructuralException.Kind.NUMBERING_MISMATCH,
            "Stored ranks of node %d (pre=%d, post=%d, level=%d, size=%d) differ from derived ones "
                + "(pre=%d, post=%d, level=%d, size=%d).",
            row.id(), row.pre(), row.post(), row.level(), row.subtreeSize(), derived.getPre(index),
            derived.getPost(index), derived.getLevel(index), derived.getSubtreeSize(index));
      }
    }
    LOGWRAPPER.debug("Loaded and validated {} nodes from the interval shape.", tree.size());
    return tree;
  }

  private static NodeRecord toRecord(final long id, final long parentId, final String type,
      final String semanticId, final SideTables side) {
    final NodeRecord.Builder builder =
        NodeRecord.builder(id, type).text(side.text.get(id)).semanticId(semanticId);
    if (parentId != Fixed.NULL_NODE_KEY.getStandardProperty()) {
      builder.parent(parentId);
    }
    final ImmutableSetMultimap<String, String> attributes = side.attributes.get(id);
    if (attributes != null) {
      builder.attributes(attributes);
    }
    return builder.build();
  }

  /** Text and attributes keyed by node id. */
  private static final class SideTables {

    private final Long2ObjectMap<String> text;

    private final Long2ObjectMap<ImmutableSetMultimap<String, String>> attributes;

    private SideTables(final Long2ObjectMap<String> text,
        final Long2ObjectMap<ImmutableSetMultimap<String, String>> attributes) {
      this.text = text;
      this.attributes = attributes;
    }

    static SideTables of(final List<ContentRow> content, final List<AttributeRow> attributeRows) {
      final Long2ObjectMap<String> text = new Long2ObjectOpenHashMap<>(content.size());
      for (final ContentRow row : content) {
        text.put(row.id(), row.text());
      }
      final Long2ObjectMap<ImmutableSetMultimap.Builder<String, String>> builders = new Long2ObjectOpenHashMap<>();
      for (final AttributeRow row : attributeRows) {
        builders.computeIfAbsent(row.id(), id -> ImmutableSetMultimap.builder()).put(row.name(), row.value());
      }
      final Long2ObjectMap<ImmutableSetMultimap<String, String>> attributes =
          new Long2ObjectOpenHashMap<>(builders.size());
      for (final Long2ObjectMap.Entry<ImmutableSetMultimap.Builder<String, String>> entry
          : builders.long2ObjectEntrySet()) {
        attributes.put(entry.getLongKey(), entry.getValue().build());
      }
      return new SideTables(text, attributes);
    }
  }
}

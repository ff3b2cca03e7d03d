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

package io.xaccel.tree;

import com.google.common.base.MoreObjects;
import io.xaccel.exception.StructuralException;
import io.xaccel.node.NodeRecord;
import io.xaccel.utils.LogWrapper;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.longs.Long2IntMap;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.checkerframework.checker.index.qual.NonNegative;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkElementIndex;
import static java.util.Objects.requireNonNull;

/**
 * In-memory representation of a finalized node set. Nodes live in a flat arena indexed by their
 * position in the input stream; parent and children are stored as arena positions.
 *
 * <p>
 * A model is immutable once built and may be shared between threads.
 * </p>
 */
public final class TreeModel implements TreeStructure {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(TreeModel.class));

  /** Parent position of the root. */
  public static final int NO_PARENT = -1;

  /** Returned by {@link #getIndex(long)} for unknown ids. */
  public static final int NOT_FOUND = -1;

  private final NodeRecord[] records;

  private final int[] parents;

  private final IntList[] children;

  /** Position of each node inside its parent's child list. */
  private final int[] childPositions;

  private final Long2IntMap idToIndex;

  private final Object2IntMap<String> semanticIdToIndex;

  private final int rootIndex;

  private TreeModel(final NodeRecord[] records, final int[] parents, final IntList[] children,
      final int[] childPositions, final Long2IntMap idToIndex, final Object2IntMap<String> semanticIdToIndex,
      final int rootIndex) {
    this.records = records;
    this.parents = parents;
    this.children = children;
    this.childPositions = childPositions;
    this.idToIndex = idToIndex;
    this.semanticIdToIndex = semanticIdToIndex;
    this.rootIndex = rootIndex;
  }

  /**
   * Build a tree model from a fully materialized node stream.
   *
   * @param records records in document order
   * @return the tree model
   * @throws StructuralException if ids are duplicated, a parent is unknown or the stream does not
   *         contain exactly one root
   */
  public static TreeModel of(final Iterable<NodeRecord> records) throws StructuralException {
    final Builder builder = new Builder();
    for (final NodeRecord record : records) {
      builder.add(record);
    }
    return builder.build();
  }

  @Override
  public int size() {
    return records.length;
  }

  @Override
  public int getRootIndex() {
    return rootIndex;
  }

  @Override
  public IntList getChildren(final @NonNegative int index) {
    return children[index];
  }

  /**
   * Get the parent position of a node.
   *
   * @param index arena position
   * @return the parent position or {@link #NO_PARENT}
   */
  public int getParentIndex(final @NonNegative int index) {
    return parents[index];
  }

  /**
   * Get the position of a node inside the child list of its parent.
   *
   * @param index arena position
   * @return the child position, {@code 0} for the root
   */
  public int getChildPosition(final @NonNegative int index) {
    return childPositions[index];
  }

  public NodeRecord getRecord(final @NonNegative int index) {
    checkElementIndex(index, records.length);
    return records[index];
  }

  public long getId(final @NonNegative int index) {
    return records[index].getId();
  }

  /**
   * Resolve a node id.
   *
   * @param id the node id
   * @return the arena position or {@link #NOT_FOUND}
   */
  public int getIndex(final long id) {
    return idToIndex.get(id);
  }

  /**
   * Resolve a semantic id. If several nodes share a semantic id, the first one in document order is
   * returned.
   *
   * @param semanticId the semantic id
   * @return the arena position or {@link #NOT_FOUND}
   */
  public int getIndexBySemanticId(final String semanticId) {
    return semanticIdToIndex.getInt(requireNonNull(semanticId));
  }

  /**
   * Get the records in stream order.
   *
   * @return the records
   */
  public List<NodeRecord> getRecords() {
    return List.of(records);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("size", records.length).add("root", records[rootIndex].getId()).toString();
  }

  /**
   * Builder to build a {@link TreeModel} from a node stream.
   */
  public static final class Builder {

    private final List<NodeRecord> records = new ArrayList<>();

    /**
     * Append the next record of the stream.
     *
     * @param record the record
     * @return this builder instance
     */
    public Builder add(final NodeRecord record) {
      records.add(requireNonNull(record));
      return this;
    }

    /**
     * Build the model.
     *
     * @return the tree model
     * @throws StructuralException if the stream violates the tree invariants
     */
    public TreeModel build() throws StructuralException {
      final int size = records.size();
      if (size == 0) {
        throw new StructuralException(StructuralException.Kind.NO_ROOT, "Empty node stream.");
      }

      final NodeRecord[] nodes = records.toArray(new NodeRecord[0]);
      final Long2IntMap idToIndex = new Long2IntOpenHashMap(size);
      idToIndex.defaultReturnValue(NOT_FOUND);
      final Object2IntMap<String> semanticIdToIndex = new Object2IntOpenHashMap<>();
      semanticIdToIndex.defaultReturnValue(NOT_FOUND);

      for (int i = 0; i < size; i++) {
        final NodeRecord node = nodes[i];
        if (idToIndex.put(node.getId(), i) != NOT_FOUND) {
          throw new StructuralException(StructuralException.Kind.DUPLICATE_ID, "Id %d occurs more than once.",
              node.getId());
        }
        final String semanticId = node.getSemanticId();
        if (semanticId != null) {
          if (semanticIdToIndex.containsKey(semanticId)) {
            LOGWRAPPER.warn("Semantic id '{}' of node {} already bound to node {}, keeping the first.", semanticId,
                node.getId(), nodes[semanticIdToIndex.getInt(semanticId)].getId());
          } else {
            semanticIdToIndex.put(semanticId, i);
          }
        }
      }

      final int[] parents = new int[size];
      final int[] childPositions = new int[size];
      final IntArrayList[] children = new IntArrayList[size];
      for (int i = 0; i < size; i++) {
        children[i] = new IntArrayList();
      }

      int rootIndex = NO_PARENT;
      for (int i = 0; i < size; i++) {
        final NodeRecord node = nodes[i];
        if (!node.hasParent()) {
          if (rootIndex != NO_PARENT) {
            throw new StructuralException(StructuralException.Kind.MULTIPLE_ROOTS,
                "Nodes %d and %d both have no parent.", nodes[rootIndex].getId(), node.getId());
          }
          rootIndex = i;
          parents[i] = NO_PARENT;
          continue;
        }
        final int parentIndex = idToIndex.get(node.getParentId());
        if (parentIndex == NOT_FOUND) {
          throw new StructuralException(StructuralException.Kind.DANGLING_PARENT,
              "Parent %d of node %d is not part of the stream.", node.getParentId(), node.getId());
        }
        parents[i] = parentIndex;
        childPositions[i] = children[parentIndex].size();
        children[parentIndex].add(i);
      }

      if (rootIndex == NO_PARENT) {
        throw new StructuralException(StructuralException.Kind.NO_ROOT, "Every node of the stream has a parent.");
      }

      final IntList[] frozen = new IntList[size];
      for (int i = 0; i < size; i++) {
        children[i].trim();
        frozen[i] = IntLists.unmodifiable(children[i]);
      }

      LOGWRAPPER.debug("Tree model with {} nodes built, root id {}.", size, nodes[rootIndex].getId());
      return new TreeModel(nodes, parents, frozen, childPositions, idToIndex, semanticIdToIndex, rootIndex);
    }
  }
}

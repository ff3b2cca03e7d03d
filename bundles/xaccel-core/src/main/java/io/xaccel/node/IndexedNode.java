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

package io.xaccel.node;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSetMultimap;
import io.xaccel.api.NodeRef;
import io.xaccel.numbering.Numbering;
import io.xaccel.settings.Fixed;
import io.xaccel.tree.TreeModel;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * {@link NodeRef} backed by one arena position of a tree and its numbering.
 */
public final class IndexedNode implements NodeRef {

  private final TreeModel tree;

  private final Numbering numbering;

  private final int index;

  /**
   * Constructor.
   *
   * @param tree the tree
   * @param numbering numbering of the tree
   * @param index arena position
   */
  public IndexedNode(final TreeModel tree, final Numbering numbering, final @NonNegative int index) {
    this.tree = requireNonNull(tree);
    this.numbering = requireNonNull(numbering);
    this.index = index;
  }

  private NodeRecord record() {
    return tree.getRecord(index);
  }

  @Override
  public long getId() {
    return record().getId();
  }

  @Override
  public String getType() {
    return record().getType();
  }

  @Override
  public @Nullable String getText() {
    return record().getText();
  }

  @Override
  public @Nullable String getSemanticId() {
    return record().getSemanticId();
  }

  @Override
  public ImmutableSetMultimap<String, String> getAttributes() {
    return record().getAttributes();
  }

  @Override
  public boolean hasParent() {
    return tree.getParentIndex(index) != TreeModel.NO_PARENT;
  }

  @Override
  public long getParentId() {
    final int parent = tree.getParentIndex(index);
    return parent == TreeModel.NO_PARENT ? Fixed.NULL_NODE_KEY.getStandardProperty() : tree.getId(parent);
  }

  @Override
  public int getPre() {
    return numbering.getPre(index);
  }

  @Override
  public int getPost() {
    return numbering.getPost(index);
  }

  @Override
  public int getLevel() {
    return numbering.getLevel(index);
  }

  @Override
  public boolean equals(final @Nullable Object obj) {
    if (!(obj instanceof IndexedNode other)) {
      return false;
    }
    return tree == other.tree && index == other.index;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(getId());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("id", getId())
                      .add("type", getType())
                      .add("text", getText())
                      .add("pre", getPre())
                      .add("post", getPost())
                      .toString();
  }
}

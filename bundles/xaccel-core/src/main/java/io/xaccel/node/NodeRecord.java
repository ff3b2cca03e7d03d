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
import com.google.common.collect.SetMultimap;
import io.xaccel.settings.Fixed;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * One record of the node stream handed to the index by a document loader. Records arrive in
 * document order; children of the same parent appear in document order among themselves.
 *
 * <p>
 * Instances are immutable.
 * </p>
 */
public final class NodeRecord {

  private final long id;

  private final long parentId;

  private final String type;

  private final @Nullable String text;

  private final @Nullable String semanticId;

  private final ImmutableSetMultimap<String, String> attributes;

  private NodeRecord(final Builder builder) {
    id = builder.id;
    parentId = builder.parentId;
    type = builder.type;
    text = builder.text;
    semanticId = builder.semanticId;
    attributes = builder.attributes.build();
  }

  /**
   * Create a new builder for a record.
   *
   * @param id unique, non-negative id of the node
   * @param type the type label, for instance the element name
   * @return a new builder instance
   */
  public static Builder builder(final @NonNegative long id, final String type) {
    return new Builder(id, type);
  }

  public long getId() {
    return id;
  }

  /**
   * Get the id of the parent node.
   *
   * @return the parent id or {@link Fixed#NULL_NODE_KEY} for the root record
   */
  public long getParentId() {
    return parentId;
  }

  public boolean hasParent() {
    return parentId != Fixed.NULL_NODE_KEY.getStandardProperty();
  }

  public String getType() {
    return type;
  }

  public @Nullable String getText() {
    return text;
  }

  public @Nullable String getSemanticId() {
    return semanticId;
  }

  /**
   * Get the attributes. A key may be associated with several values.
   *
   * @return immutable attribute multimap
   */
  public ImmutableSetMultimap<String, String> getAttributes() {
    return attributes;
  }

  @Override
  public boolean equals(final @Nullable Object obj) {
    if (!(obj instanceof NodeRecord other)) {
      return false;
    }
    return id == other.id && parentId == other.parentId && type.equals(other.type)
        && Objects.equals(text, other.text) && Objects.equals(semanticId, other.semanticId)
        && attributes.equals(other.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, parentId, type, text, semanticId, attributes);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("id", id)
                      .add("parentId", parentId)
                      .add("type", type)
                      .add("text", text)
                      .add("semanticId", semanticId)
                      .add("attributes", attributes)
                      .toString();
  }

  /**
   * Builder to build a {@link NodeRecord} instance.
   */
  public static final class Builder {

    private final long id;

    private final String type;

    private long parentId = Fixed.NULL_NODE_KEY.getStandardProperty();

    private @Nullable String text;

    private @Nullable String semanticId;

    private final ImmutableSetMultimap.Builder<String, String> attributes = ImmutableSetMultimap.builder();

    private Builder(final long id, final String type) {
      checkArgument(id >= 0, "Node id must be >= 0!");
      this.id = id;
      this.type = requireNonNull(type);
    }

    /**
     * Set the parent id. Records without a parent id are roots.
     *
     * @param parentId the id of the parent record
     * @return this builder instance
     */
    public Builder parent(final @NonNegative long parentId) {
      checkArgument(parentId >= 0, "Parent id must be >= 0!");
      this.parentId = parentId;
      return this;
    }

    public Builder text(final @Nullable String text) {
      this.text = text;
      return this;
    }

    public Builder semanticId(final @Nullable String semanticId) {
      this.semanticId = semanticId;
      return this;
    }

    /**
     * Add an attribute. The same key may be added with several values.
     *
     * @param name the attribute name
     * @param value the attribute value
     * @return this builder instance
     */
    public Builder attribute(final String name, final String value) {
      attributes.put(requireNonNull(name), requireNonNull(value));
      return this;
    }

    public Builder attributes(final SetMultimap<String, String> attributes) {
      this.attributes.putAll(attributes);
      return this;
    }

    public NodeRecord build() {
      return new NodeRecord(this);
    }
  }
}

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

package io.xaccel.api;

import com.google.common.collect.ImmutableSetMultimap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Read-only view of one node of a built index, as handed to query callers.
 */
public interface NodeRef {

  long getId();

  String getType();

  @Nullable
  String getText();

  @Nullable
  String getSemanticId();

  ImmutableSetMultimap<String, String> getAttributes();

  boolean hasParent();

  /**
   * Get the parent id.
   *
   * @return the parent id or {@link io.xaccel.settings.Fixed#NULL_NODE_KEY} for the root
   */
  long getParentId();

  /**
   * Get the pre-order rank.
   *
   * @return the pre-order rank
   */
  int getPre();

  /**
   * Get the post-order rank.
   *
   * @return the post-order rank
   */
  int getPost();

  /**
   * Get the depth, the root has level {@code 0}.
   *
   * @return the level
   */
  int getLevel();
}

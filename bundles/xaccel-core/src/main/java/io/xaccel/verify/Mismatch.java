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

package io.xaccel.verify;

import io.xaccel.axis.AxisKind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One disagreement found while verifying an index.
 *
 * @param kind what went wrong
 * @param contextNodeId the context node
 * @param axis the evaluated axis, {@code null} for numbering violations
 * @param nodeId the offending node
 * @param detail human readable description
 */
public record Mismatch(Kind kind, long contextNodeId, @Nullable AxisKind axis, long nodeId, String detail) {

  /** The kinds of disagreement. */
  public enum Kind {
    /** The reference backend reports a node the checked backend misses. */
    MISSING,

    /** The checked backend reports a node the reference backend does not. */
    UNEXPECTED,

    /** The checked backend reports nodes out of document order. */
    ORDER,

    /** The ranks of a node contradict its position in the tree. */
    NUMBERING
  }

  @Override
  public String toString() {
    return kind + " context=" + contextNodeId + (axis == null ? "" : " axis=" + axis.getName()) + " node=" + nodeId
        + ": " + detail;
  }
}

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

package io.xaccel.exception;

import static java.util.Objects.requireNonNull;

/**
 * Thrown while building an index if the supplied node stream or tree structure violates the tree
 * invariants. No index is published if this exception is raised.
 */
public final class StructuralException extends XAccelException {

  private static final long serialVersionUID = 1L;

  /** The detected violation. */
  public enum Kind {
    /** A node is reachable from itself. */
    CYCLE,

    /** A node is listed as child of more than one parent. */
    MULTIPLE_PARENTS,

    /** More than one node has no parent. */
    MULTIPLE_ROOTS,

    /** No node without a parent exists. */
    NO_ROOT,

    /** Two records share the same id. */
    DUPLICATE_ID,

    /** A parent id references no record of the stream. */
    DANGLING_PARENT,

    /** A stored numbering differs from the one derived from the structure. */
    NUMBERING_MISMATCH,

    /** Two siblings share the same position. */
    DUPLICATE_POSITION
  }

  private final Kind kind;

  /**
   * Constructor.
   *
   * @param kind the violation
   * @param message format string
   * @param args format arguments
   */
  public StructuralException(final Kind kind, final String message, final Object... args) {
    super(kind + ": " + String.format(message, args));
    this.kind = requireNonNull(kind);
  }

  /**
   * Get the violation kind.
   *
   * @return the kind of structural violation
   */
  public Kind getKind() {
    return kind;
  }
}

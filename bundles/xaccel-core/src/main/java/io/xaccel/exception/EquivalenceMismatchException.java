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

import com.google.common.collect.ImmutableList;
import io.xaccel.verify.Mismatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Exception thrown if the interval backend and the adjacency backend disagree. This is a defect
 * signal, either the numbering or the interval axis evaluation is unsound, and the index must not be
 * used any further.
 *
 * <p>
 * The constructor logs every mismatch at ERROR level.
 * </p>
 */
public final class EquivalenceMismatchException extends XAccelRuntimeException {

  private static final Logger LOGGER = LoggerFactory.getLogger(EquivalenceMismatchException.class);

  private static final long serialVersionUID = 1L;

  private final ImmutableList<Mismatch> mismatches;

  /**
   * Constructor.
   *
   * @param mismatches the detected mismatches, must not be empty
   */
  public EquivalenceMismatchException(final List<Mismatch> mismatches) {
    super(buildMessage(mismatches));
    this.mismatches = ImmutableList.copyOf(mismatches);

    LOGGER.error("BACKEND EQUIVALENCE VIOLATED: {} mismatch(es)", this.mismatches.size());
    for (final Mismatch mismatch : this.mismatches) {
      LOGGER.error("  {}", mismatch);
    }
  }

  private static String buildMessage(final List<Mismatch> mismatches) {
    if (mismatches.isEmpty()) {
      throw new IllegalArgumentException("No mismatches given.");
    }
    return String.format("%d backend mismatch(es), first: %s", mismatches.size(), mismatches.get(0));
  }

  /**
   * Get the detected mismatches.
   *
   * @return immutable list of mismatches
   */
  public List<Mismatch> getMismatches() {
    return mismatches;
  }
}

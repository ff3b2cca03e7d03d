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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import io.xaccel.exception.EquivalenceMismatchException;

import java.util.List;

/**
 * Outcome of an equivalence verification: either success or the list of mismatches.
 */
public final class VerificationResult {

  private final ImmutableList<Mismatch> mismatches;

  private final int checkedContextNodes;

  VerificationResult(final List<Mismatch> mismatches, final int checkedContextNodes) {
    this.mismatches = ImmutableList.copyOf(mismatches);
    this.checkedContextNodes = checkedContextNodes;
  }

  public boolean isSuccess() {
    return mismatches.isEmpty();
  }

  public List<Mismatch> getMismatches() {
    return mismatches;
  }

  /**
   * Get the number of distinct context nodes the backends were compared on.
   *
   * @return checked context node count
   */
  public int getCheckedContextNodes() {
    return checkedContextNodes;
  }

  /**
   * Fail loudly if the verification found mismatches.
   *
   * @throws EquivalenceMismatchException if any mismatch was found
   */
  public void orElseThrow() {
    if (!mismatches.isEmpty()) {
      throw new EquivalenceMismatchException(mismatches);
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("success", isSuccess())
                      .add("checkedContextNodes", checkedContextNodes)
                      .add("mismatches", mismatches.size())
                      .toString();
  }
}

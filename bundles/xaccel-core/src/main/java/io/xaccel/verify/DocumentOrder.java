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

import io.xaccel.tree.TreeModel;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntComparator;

import static java.util.Objects.requireNonNull;

/**
 * Compares arena positions by document order, derived from parent links and child positions only.
 * An ancestor precedes its descendants; otherwise the children of the nearest common ancestor
 * decide.
 */
final class DocumentOrder implements IntComparator {

  private final TreeModel tree;

  DocumentOrder(final TreeModel tree) {
    this.tree = requireNonNull(tree);
  }

  @Override
  public int compare(final int first, final int second) {
    if (first == second) {
      return 0;
    }
    final IntArrayList firstPath = pathFromRoot(first);
    final IntArrayList secondPath = pathFromRoot(second);
    final int common = Math.min(firstPath.size(), secondPath.size());
    for (int i = 0; i < common; i++) {
      final int a = firstPath.getInt(i);
      final int b = secondPath.getInt(i);
      if (a != b) {
        return Integer.compare(tree.getChildPosition(a), tree.getChildPosition(b));
      }
    }
    // One path is a prefix of the other, the ancestor comes first.
    return Integer.compare(firstPath.size(), secondPath.size());
  }

  private IntArrayList pathFromRoot(final int index) {
    final IntArrayList path = new IntArrayList();
    for (int node = index; node != TreeModel.NO_PARENT; node = tree.getParentIndex(node)) {
      path.add(node);
    }
    final IntArrayList reversed = new IntArrayList(path.size());
    for (int i = path.size() - 1; i >= 0; i--) {
      reversed.add(path.getInt(i));
    }
    return reversed;
  }
}

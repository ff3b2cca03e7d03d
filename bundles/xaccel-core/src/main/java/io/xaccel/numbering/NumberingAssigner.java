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

package io.xaccel.numbering;

import io.xaccel.exception.StructuralException;
import io.xaccel.tree.TreeStructure;
import io.xaccel.utils.LogWrapper;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.BitSet;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Assigns pre-order and post-order ranks to every node of a {@link TreeStructure} in a single
 * depth-first traversal. Children are visited strictly in the order supplied by the structure.
 *
 * <p>
 * The structure is validated before any rank is computed: a node listed as child of more than one
 * parent, a second parentless node or a cycle aborts the assignment with a
 * {@link StructuralException}. Counters live in the invocation, so one assigner may be reused for
 * any number of independent builds, also concurrently.
 * </p>
 */
public final class NumberingAssigner {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(NumberingAssigner.class));

  /** First rank to assign. */
  private final int origin;

  /**
   * Constructor.
   *
   * @param origin the first rank, {@code 0} or {@code 1}
   */
  public NumberingAssigner(final int origin) {
    checkArgument(origin == 0 || origin == 1, "Numbering origin must be 0 or 1!");
    this.origin = origin;
  }

  /**
   * Number the given tree.
   *
   * @param tree the tree structure
   * @return the numbering
   * @throws StructuralException if the structure is not a tree
   */
  public Numbering assign(final TreeStructure tree) throws StructuralException {
    requireNonNull(tree);
    final long start = System.nanoTime();
    validate(tree);

    final int size = tree.size();
    final int[] pre = new int[size];
    final int[] post = new int[size];
    final int[] level = new int[size];
    final int[] subtreeSize = new int[size];

    int preCounter = origin;
    int postCounter = origin;

    // Explicit stack of nodes and the position of the next child to descend into.
    final IntArrayList nodeStack = new IntArrayList();
    final IntArrayList childCursorStack = new IntArrayList();

    final int root = tree.getRootIndex();
    pre[root] = preCounter++;
    level[root] = 0;
    nodeStack.push(root);
    childCursorStack.push(0);

    while (!nodeStack.isEmpty()) {
      final int top = nodeStack.size() - 1;
      final int node = nodeStack.getInt(top);
      final int cursor = childCursorStack.getInt(top);
      final IntList children = tree.getChildren(node);

      if (cursor < children.size()) {
        childCursorStack.set(top, cursor + 1);
        final int child = children.getInt(cursor);
        pre[child] = preCounter++;
        level[child] = level[node] + 1;
        nodeStack.push(child);
        childCursorStack.push(0);
      } else {
        post[node] = postCounter++;
        subtreeSize[node] = preCounter - pre[node];
        nodeStack.popInt();
        childCursorStack.popInt();
      }
    }

    LOGWRAPPER.debugElapsed("Numbered {} nodes, ranks {}..{}, took {} ms.", start, size, origin, preCounter - 1);
    return new Numbering(origin, pre, post, level, subtreeSize);
  }

  /**
   * Check that every node except the root is listed as child exactly once and that every node is
   * reachable from the root.
   */
  private static void validate(final TreeStructure tree) throws StructuralException {
    final int size = tree.size();
    if (size == 0) {
      throw new StructuralException(StructuralException.Kind.NO_ROOT, "Empty tree.");
    }
    final int root = tree.getRootIndex();
    if (root < 0 || root >= size) {
      throw new StructuralException(StructuralException.Kind.NO_ROOT, "Root position %d out of range.", root);
    }

    final int[] parentOf = new int[size];
    Arrays.fill(parentOf, -1);
    for (int node = 0; node < size; node++) {
      final IntList children = tree.getChildren(node);
      for (int i = 0, n = children.size(); i < n; i++) {
        final int child = children.getInt(i);
        if (child < 0 || child >= size) {
          throw new StructuralException(StructuralException.Kind.DANGLING_PARENT,
              "Child position %d of node %d out of range.", child, node);
        }
        if (child == root) {
          throw new StructuralException(StructuralException.Kind.CYCLE, "Root is listed as child of node %d.", node);
        }
        if (parentOf[child] != -1) {
          throw new StructuralException(StructuralException.Kind.MULTIPLE_PARENTS,
              "Node %d is listed as child of %d and %d.", child, parentOf[child], node);
        }
        parentOf[child] = node;
      }
    }

    for (int node = 0; node < size; node++) {
      if (node != root && parentOf[node] == -1) {
        throw new StructuralException(StructuralException.Kind.MULTIPLE_ROOTS, "Node %d has no parent.", node);
      }
    }

    // Every node has exactly one parent now, so nodes unreachable from the root sit on a cycle.
    final BitSet visited = new BitSet(size);
    final IntArrayList stack = new IntArrayList();
    stack.push(root);
    while (!stack.isEmpty()) {
      final int node = stack.popInt();
      visited.set(node);
      final IntList children = tree.getChildren(node);
      for (int i = 0, n = children.size(); i < n; i++) {
        stack.push(children.getInt(i));
      }
    }
    final int unreachable = visited.nextClearBit(0);
    if (unreachable < size) {
      throw new StructuralException(StructuralException.Kind.CYCLE, "Node %d is reachable from itself.", unreachable);
    }
  }
}

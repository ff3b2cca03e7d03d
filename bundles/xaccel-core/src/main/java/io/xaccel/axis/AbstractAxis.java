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

package io.xaccel.axis;

import com.google.common.base.MoreObjects;
import io.xaccel.api.Axis;
import io.xaccel.exception.NodeNotFoundException;
import io.xaccel.settings.Fixed;
import io.xaccel.tree.TreeModel;
import it.unimi.dsi.fastutil.longs.LongIterator;
import org.checkerframework.checker.index.qual.NonNegative;

import java.util.NoSuchElementException;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Provide standard Java iterator capability compatible with the enhanced for loop.
 * </p>
 * <p>
 * Override the "template method" {@code nextKey()} to implement an axis. Return {@code done()} if
 * the axis has no more "elements".
 * </p>
 */
public abstract class AbstractAxis implements Axis {

  /** The tree to iterate over. */
  protected final TreeModel tree;

  /** Key of next node. */
  private long nextNodeKey;

  /** Key of node where axis started. */
  private long startNodeKey;

  /** Arena position of the node where the axis started. */
  private int startIndex;

  /** Include self? */
  private final IncludeSelf includeSelf;

  /** Current state. */
  private State state = State.NOT_READY;

  /** State of the iterator. */
  private enum State {
    /** We have computed the next element and haven't returned it yet. */
    READY,

    /** We haven't yet computed or have already returned the element. */
    NOT_READY,

    /** We have reached the end of the data and are finished. */
    DONE,

    /** We've suffered an exception and are kaput. */
    FAILED,
  }

  /**
   * Bind axis step to a tree and a context node.
   *
   * @param tree the tree
   * @param nodeKey id of the context node
   * @param includeSelf determines if self is included
   * @throws NodeNotFoundException if the context node is unknown
   */
  protected AbstractAxis(final TreeModel tree, final long nodeKey, final IncludeSelf includeSelf) {
    this.tree = requireNonNull(tree);
    this.includeSelf = requireNonNull(includeSelf);
    reset(nodeKey);
  }

  @Override
  public final LongIterator iterator() {
    return this;
  }

  /**
   * Signals that axis traversal is done, that is {@code hasNext()} must return false.
   *
   * @return null node key to indicate that the traversal is done
   */
  protected final long done() {
    return Fixed.NULL_NODE_KEY.getStandardProperty();
  }

  @Override
  public final boolean hasNext() {
    checkState(state != State.FAILED);
    switch (state) {
      case DONE:
        return false;
      case READY:
        return true;
      case FAILED:
      case NOT_READY:
      default:
    }
    return tryToComputeNext();
  }

  /**
   * Try to compute the next node key.
   *
   * @return {@code true} if next node key exists, {@code false} otherwise
   */
  private boolean tryToComputeNext() {
    state = State.FAILED; // temporary pessimism
    nextNodeKey = nextKey();
    if (nextNodeKey == Fixed.NULL_NODE_KEY.getStandardProperty()) {
      state = State.DONE;
      return false;
    }
    state = State.READY;
    return true;
  }

  /**
   * Returns the next node key. The implementation must either call {@link #done()} when there are no
   * elements left in the iteration or return {@link Fixed#NULL_NODE_KEY}.
   *
   * <p>
   * Once the implementation either invokes {@link #done()} or throws an exception, {@code nextKey()}
   * is guaranteed to never be called again. If it throws, further attempts to use the iterator
   * result in an {@link IllegalStateException}.
   * </p>
   *
   * @return the next node key
   */
  protected abstract long nextKey();

  @Override
  public final long nextLong() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    state = State.NOT_READY;
    return nextNodeKey;
  }

  /**
   * Remove is not supported.
   */
  @Override
  public final void remove() {
    throw new UnsupportedOperationException();
  }

  @Override
  public void reset(@NonNegative final long nodeKey) {
    final int index = tree.getIndex(nodeKey);
    if (index == TreeModel.NOT_FOUND) {
      throw new NodeNotFoundException(nodeKey);
    }
    startNodeKey = nodeKey;
    startIndex = index;
    nextNodeKey = nodeKey;
    state = State.NOT_READY;
  }

  @Override
  public final long peek() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    return nextNodeKey;
  }

  @Override
  public final long getStartKey() {
    return startNodeKey;
  }

  /**
   * Get the arena position of the context node.
   *
   * @return start position
   */
  protected final int getStartIndex() {
    return startIndex;
  }

  @Override
  public final IncludeSelf includeSelf() {
    return includeSelf;
  }

  protected final boolean isSelfIncluded() {
    return includeSelf == IncludeSelf.YES;
  }

  /**
   * Map an arena position to the node id.
   *
   * @param index arena position
   * @return the node id
   */
  protected final long keyOf(final int index) {
    return tree.getId(index);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("startKey", startNodeKey).add("includeSelf", includeSelf).toString();
  }
}

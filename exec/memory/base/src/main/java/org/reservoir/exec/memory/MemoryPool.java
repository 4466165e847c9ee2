/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.reservoir.exec.memory;

import io.netty.buffer.ByteBuf;

import java.util.function.Predicate;

import org.reservoir.exec.exception.OutOfMemoryException;

/**
 * A node in the tree of memory consumers. Root pools hold the capacity granted
 * by the arbitrator; every pool in the tree reports the usage of its subtree.
 * Only leaf pools reserve and allocate memory.
 */
public interface MemoryPool extends AutoCloseable {

  /** Capacity of a pool that is never arbitrated. */
  long UNLIMITED_CAPACITY = Long.MAX_VALUE;

  enum Kind {
    /** Root or internal node; aggregates the usage of its children. */
    AGGREGATE,
    /** Allocation unit, has no children. */
    LEAF
  }

  String getName();

  Kind getKind();

  /**
   * @return the parent pool, null for a root pool
   */
  MemoryPool getParent();

  MemoryPool getRoot();

  boolean isRoot();

  int getChildCount();

  /**
   * Visit the live children of this pool until the visitor returns false.
   */
  void visitChildren(Predicate<MemoryPool> visitor);

  MemoryPool addLeafChild(String name, boolean threadSafe, MemoryReclaimer reclaimer);

  MemoryPool addAggregateChild(String name, MemoryReclaimer reclaimer);

  /**
   * @return the ceiling the root of this pool may ever be grown to
   */
  long getMaxCapacity();

  /**
   * @return the capacity currently granted to the root of this pool
   */
  long getCapacity();

  /**
   * @return granted capacity of the root that is not reserved by anyone
   */
  long freeCapacity();

  /**
   * @return bytes reserved in the subtree of this pool
   */
  long getCurrentBytes();

  long getPeakBytes();

  int getAlignment();

  boolean isThreadSafe();

  boolean isTrackingUsage();

  /**
   * Reserve memory in this leaf pool, growing the root's capacity through the
   * capacity authority if needed.
   *
   * @throws OutOfMemoryException if the reservation cannot be satisfied
   */
  void reserve(long bytes) throws OutOfMemoryException;

  /**
   * Same as {@link #reserve(long)}, but reports failure instead of throwing.
   */
  boolean maybeReserve(long bytes);

  void release(long bytes);

  /**
   * Reserve and allocate a buffer of {@code size} bytes. The reservation is
   * rounded up to the pool alignment.
   *
   * @throws OutOfMemoryException if either the reservation or the allocation fails
   */
  ByteBuf allocate(int size) throws OutOfMemoryException;

  /**
   * Free a buffer obtained from {@link #allocate(int)} on this pool.
   */
  void free(ByteBuf buf);

  MemoryReclaimer getReclaimer();

  /**
   * @return bytes that could be reclaimed from this subtree right now
   */
  long reclaimableBytes();

  /**
   * Ask the reclaimers of this subtree to free {@code targetBytes}.
   *
   * @return bytes freed
   */
  long reclaim(long targetBytes, long maxWaitMs);

  /**
   * Raise the granted capacity of this root pool. Arbitrator only.
   *
   * @return the new capacity
   */
  long grow(long bytes);

  /**
   * Give back unused capacity of this root pool. Arbitrator only.
   *
   * @param targetBytes bytes to give back, 0 for all unused capacity
   * @return bytes given back
   */
  long shrink(long targetBytes);

  boolean isClosed();

  /**
   * @return an indented dump of the usage of this subtree
   */
  String treeMemoryUsage();

  /**
   * Destroys the pool. Children must be closed first and no memory may still
   * be reserved; a root pool hands its capacity back to its authority.
   *
   * @throws IllegalStateException if children are open or memory is leaked
   */
  @Override
  void close();
}

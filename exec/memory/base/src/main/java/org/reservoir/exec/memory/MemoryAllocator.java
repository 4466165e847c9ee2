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

import org.reservoir.exec.exception.OutOfMemoryException;

import com.google.common.base.Preconditions;

/**
 * Performs the physical acquisition and release of memory for leaf pools.
 * Pools only account for memory; the allocator is what actually hands it out.
 */
public interface MemoryAllocator {
  int MIN_ALIGNMENT = 16;
  int MAX_ALIGNMENT = 64;

  /**
   * @return the maximum number of bytes this allocator hands out,
   *   {@link Long#MAX_VALUE} when unlimited
   */
  long capacity();

  long totalUsedBytes();

  /**
   * Allocate a buffer of exactly {@code size} bytes.
   *
   * @throws OutOfMemoryException if the allocator is at capacity
   */
  ByteBuf allocate(int size) throws OutOfMemoryException;

  /**
   * Return a buffer obtained from {@link #allocate(int)}.
   */
  void free(ByteBuf buf);

  /**
   * Checks that {@code alignment} is a power of two in
   * [{@value #MIN_ALIGNMENT}, {@value #MAX_ALIGNMENT}] and that
   * {@code allocateBytes} is a multiple of it.
   */
  static void alignmentCheck(long allocateBytes, int alignment) {
    Preconditions.checkArgument(alignment >= MIN_ALIGNMENT && alignment <= MAX_ALIGNMENT,
        "Alignment %s must be between %s and %s", alignment, MIN_ALIGNMENT, MAX_ALIGNMENT);
    Preconditions.checkArgument((alignment & (alignment - 1)) == 0,
        "Alignment %s must be a power of 2", alignment);
    Preconditions.checkArgument(allocateBytes % alignment == 0,
        "Allocation size %s is not aligned to %s", allocateBytes, alignment);
  }

  static long alignedSize(long bytes, int alignment) {
    return (bytes + alignment - 1) & ~((long) alignment - 1);
  }
}

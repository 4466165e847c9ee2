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
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.buffer.Unpooled;

import java.util.concurrent.atomic.AtomicLong;

import org.reservoir.common.util.ReservoirStringUtils;
import org.reservoir.exec.exception.OutOfMemoryException;

import com.google.common.base.Preconditions;

/**
 * {@link MemoryAllocator} over Netty's pooled direct buffers, bounded by a
 * fixed capacity.
 */
public class NettyMemoryAllocator implements MemoryAllocator {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(NettyMemoryAllocator.class);

  private final PooledByteBufAllocator innerAllocator;
  private final long capacity;
  private final AtomicLong usedBytes = new AtomicLong();
  private final AtomicLong numAllocations = new AtomicLong();
  private final AtomicLong numFrees = new AtomicLong();

  public NettyMemoryAllocator(long capacity) {
    this(capacity, PooledByteBufAllocator.DEFAULT);
  }

  public NettyMemoryAllocator(long capacity, PooledByteBufAllocator innerAllocator) {
    Preconditions.checkArgument(capacity >= 0, "Allocator capacity must be non-negative: %s", capacity);
    this.capacity = capacity;
    this.innerAllocator = Preconditions.checkNotNull(innerAllocator);
  }

  @Override
  public long capacity() {
    return capacity;
  }

  @Override
  public long totalUsedBytes() {
    return usedBytes.get();
  }

  @Override
  public ByteBuf allocate(int size) {
    Preconditions.checkArgument(size >= 0, "Allocation size must be non-negative: %s", size);
    if (size == 0) {
      return Unpooled.EMPTY_BUFFER;
    }
    final long newUsed = usedBytes.addAndGet(size);
    if (newUsed > capacity) {
      usedBytes.addAndGet(-size);
      throw new OutOfMemoryException(createErrorMsg(size));
    }

    try {
      final ByteBuf buffer = innerAllocator.directBuffer(size, size);
      numAllocations.incrementAndGet();
      return buffer;
    } catch (OutOfMemoryError e) {
      usedBytes.addAndGet(-size);
      logger.debug("Direct allocation of {} bytes failed", size, e);
      throw new OutOfMemoryException(createErrorMsg(size), e);
    }
  }

  @Override
  public void free(ByteBuf buf) {
    Preconditions.checkNotNull(buf);
    final int size = buf.capacity();
    if (size == 0) {
      return;
    }
    Preconditions.checkState(buf.refCnt() > 0, "Buffer of size %s has already been freed", size);
    buf.release();
    usedBytes.addAndGet(-size);
    numFrees.incrementAndGet();
  }

  private String createErrorMsg(int size) {
    return String.format("Unable to allocate buffer of size %d due to allocator capacity %d. Current allocation: %d",
        size, capacity, usedBytes.get());
  }

  @Override
  public String toString() {
    return "NettyMemoryAllocator[capacity " + ReservoirStringUtils.readable(capacity)
        + " usedBytes " + ReservoirStringUtils.readable(usedBytes.get())
        + " allocations " + numAllocations.get()
        + " frees " + numFrees.get() + "]";
  }
}

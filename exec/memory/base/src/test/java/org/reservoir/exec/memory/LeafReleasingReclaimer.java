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

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reclaims by releasing reservations of a single leaf, the way a spilling
 * operator would give back memory after writing it out.
 */
class LeafReleasingReclaimer implements MemoryReclaimer {
  private volatile MemoryPool leaf;
  private final AtomicInteger numCalls = new AtomicInteger();
  private final AtomicLong maxTarget = new AtomicLong();

  void setLeaf(MemoryPool leaf) {
    this.leaf = leaf;
  }

  @Override
  public long reclaimableBytes(MemoryPool pool) {
    return leaf == null ? 0 : leaf.getCurrentBytes();
  }

  @Override
  public long reclaim(MemoryPool pool, long targetBytes, long maxWaitMs) {
    numCalls.incrementAndGet();
    maxTarget.accumulateAndGet(targetBytes, Math::max);
    if (leaf == null) {
      return 0;
    }
    final long freed = Math.min(targetBytes, leaf.getCurrentBytes());
    leaf.release(freed);
    return freed;
  }

  int getNumCalls() {
    return numCalls.get();
  }

  long getMaxTarget() {
    return maxTarget.get();
  }
}

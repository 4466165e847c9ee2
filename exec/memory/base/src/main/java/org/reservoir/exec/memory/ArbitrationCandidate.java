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

/**
 * Point-in-time view of a pool taking part in an arbitration round. Values are
 * captured once so that sorting is stable while pools keep changing.
 */
public final class ArbitrationCandidate {
  private final MemoryPool pool;
  private final long capacity;
  private final long freeCapacity;
  private final long reclaimableBytes;

  private ArbitrationCandidate(MemoryPool pool, long capacity, long freeCapacity, long reclaimableBytes) {
    this.pool = pool;
    this.capacity = capacity;
    this.freeCapacity = freeCapacity;
    this.reclaimableBytes = reclaimableBytes;
  }

  public static ArbitrationCandidate of(MemoryPool pool, long reclaimableBytes) {
    return new ArbitrationCandidate(pool, pool.getCapacity(), pool.freeCapacity(), reclaimableBytes);
  }

  public MemoryPool getPool() {
    return pool;
  }

  public long getCapacity() {
    return capacity;
  }

  public long getFreeCapacity() {
    return freeCapacity;
  }

  public long getReclaimableBytes() {
    return reclaimableBytes;
  }

  @Override
  public String toString() {
    return String.format("%s[capacity %d, free %d, reclaimable %d]",
        pool.getName(), capacity, freeCapacity, reclaimableBytes);
  }
}

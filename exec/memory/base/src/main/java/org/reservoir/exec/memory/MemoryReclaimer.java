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
 * Frees memory held by the owner of a pool on request, for example by spilling
 * its state to disk. Installed per pool; a pool without a reclaimer cannot be
 * shrunk below its usage.
 * <p>An implementation releases what it frees through
 * {@link MemoryPool#release(long)} / {@link MemoryPool#free(io.netty.buffer.ByteBuf)}
 * on the pool (or its children) and reports the total.</p>
 */
public interface MemoryReclaimer {

  /**
   * @return how many bytes {@link #reclaim} could free right now
   */
  default long reclaimableBytes(MemoryPool pool) {
    return pool.getCurrentBytes();
  }

  /**
   * Try to free at least {@code targetBytes} from {@code pool}.
   *
   * @param maxWaitMs how long the call may block; 0 means no limit
   * @return bytes actually freed
   */
  long reclaim(MemoryPool pool, long targetBytes, long maxWaitMs);
}

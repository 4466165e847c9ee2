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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registry entry for a root pool. The entry stays alive until the pool is
 * destroyed, whether or not its owner still references it.
 */
final class PoolHandle {
  private final MemoryPool pool;
  private final AtomicBoolean alive = new AtomicBoolean(true);

  PoolHandle(MemoryPool pool) {
    this.pool = pool;
  }

  String getName() {
    return pool.getName();
  }

  /**
   * @return the pool, or null once it is being destroyed
   */
  MemoryPool get() {
    return alive.get() ? pool : null;
  }

  boolean refersTo(MemoryPool other) {
    return pool == other;
  }

  /**
   * @return false if the handle was already marked dead
   */
  boolean markDead() {
    return alive.compareAndSet(true, false);
  }

  boolean isAlive() {
    return alive.get();
  }
}

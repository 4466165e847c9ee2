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
 * What a root pool calls back into when it needs more capacity or goes away.
 */
public interface CapacityAuthority {

  /**
   * Ask for {@code incrementBytes} more capacity for {@code pool}. May block
   * while capacity is reclaimed from other pools.
   *
   * @return true if the whole increment was granted; false means backpressure
   */
  boolean requestGrowth(MemoryPool pool, long incrementBytes);

  /**
   * Called once by a root pool while it is being closed, after its usage has
   * dropped to zero.
   */
  void notifyDestroyed(MemoryPool pool);
}

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
 * Configuration keys of the memory subsystem, with their defaults in
 * {@code reservoir-module.conf}.
 */
public final class MemoryConstants {

  private MemoryConstants() {
  }

  public static final String MEMORY_ROOT = "reservoir.memory";

  /** Total bytes the manager may grant, a size or {@code "unlimited"}. */
  public static final String CAPACITY = "reservoir.memory.capacity";
  /** Part of the capacity handed to the arbitrator, a size or {@code "unlimited"}. */
  public static final String QUERY_CAPACITY = "reservoir.memory.query_capacity";
  public static final String POOL_INIT_CAPACITY = "reservoir.memory.pool.init_capacity";
  public static final String POOL_TRANSFER_CAPACITY = "reservoir.memory.pool.transfer_capacity";
  public static final String RECLAIM_WAIT = "reservoir.memory.reclaim.wait";
  public static final String ALIGNMENT = "reservoir.memory.alignment";
  public static final String TRACK_DEFAULT_USAGE = "reservoir.memory.track_default_usage";
  public static final String CHECK_USAGE_LEAK = "reservoir.memory.check_usage_leak";
  public static final String DEBUG = "reservoir.memory.debug";
  public static final String CORE_ON_ALLOCATION_FAILURE = "reservoir.memory.core_on_allocation_failure";
  public static final String ARBITRATOR_KIND = "reservoir.memory.arbitrator.kind";
  public static final String NUM_SHARED_LEAF_POOLS = "reservoir.memory.num_shared_leaf_pools";
}

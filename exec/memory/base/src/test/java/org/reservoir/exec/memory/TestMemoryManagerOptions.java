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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Properties;

import org.junit.Test;
import org.reservoir.common.config.ReservoirConfig;
import org.reservoir.test.ReservoirTest;

public class TestMemoryManagerOptions extends ReservoirTest {

  @Test
  public void testModuleDefaults() {
    final MemoryManagerOptions options = MemoryManagerOptions.fromConfig(ReservoirConfig.create());
    assertEquals(MemoryPool.UNLIMITED_CAPACITY, options.getCapacity());
    assertEquals(MemoryPool.UNLIMITED_CAPACITY, options.getQueryMemoryCapacity());
    assertEquals(MemoryManagerOptions.DEFAULT_POOL_INIT_CAPACITY, options.getMemoryPoolInitCapacity());
    assertEquals(MemoryManagerOptions.DEFAULT_POOL_TRANSFER_CAPACITY, options.getMemoryPoolTransferCapacity());
    assertEquals(MemoryManagerOptions.DEFAULT_RECLAIM_WAIT_MS, options.getMemoryReclaimWaitMs());
    assertEquals(MemoryAllocator.MAX_ALIGNMENT, options.getAlignment());
    assertFalse(options.isTrackDefaultUsage());
    assertTrue(options.isCheckUsageLeak());
    assertFalse(options.isDebugEnabled());
    assertFalse(options.isCoreOnAllocationFailureEnabled());
    assertEquals(MemoryArbitrator.SHARED, options.getArbitratorKind());
    assertEquals(MemoryManagerOptions.DEFAULT_NUM_SHARED_LEAF_POOLS, options.getNumSharedLeafPools());
    assertEquals(MemoryPool.UNLIMITED_CAPACITY, options.getAllocator().capacity());
    assertNull(options.getArbitrationStateCheck());
  }

  @Test
  public void testOverriddenSettings() throws Exception {
    final Properties props = new Properties();
    props.put(MemoryConstants.CAPACITY, "1G");
    props.put(MemoryConstants.QUERY_CAPACITY, "512M");
    props.put(MemoryConstants.POOL_INIT_CAPACITY, "16M");
    props.put(MemoryConstants.RECLAIM_WAIT, "10s");
    props.put(MemoryConstants.TRACK_DEFAULT_USAGE, "true");
    props.put(MemoryConstants.ARBITRATOR_KIND, MemoryArbitrator.SHARED_LARGEST_FIRST);
    props.put(MemoryConstants.NUM_SHARED_LEAF_POOLS, "4");

    final MemoryManagerOptions options = MemoryManagerOptions.fromConfig(ReservoirConfig.create(props));
    assertEquals(1L << 30, options.getCapacity());
    assertEquals(512L << 20, options.getQueryMemoryCapacity());
    assertEquals(16L << 20, options.getMemoryPoolInitCapacity());
    assertEquals(10_000, options.getMemoryReclaimWaitMs());
    assertTrue(options.isTrackDefaultUsage());
    assertEquals(4, options.getNumSharedLeafPools());

    try (MemoryManager manager = new MemoryManager(options)) {
      assertEquals(1L << 30, manager.capacity());
      assertEquals(512L << 20, manager.arbitrator().capacity());
      assertEquals(4, manager.getSharedLeafPools().size());
      assertSame(CandidateOrdering.LARGEST_CAPACITY_FIRST, ((SharedArbitrator) manager.arbitrator()).getOrdering());

      final MemoryPool pool = manager.addRootPool("query", MemoryPool.UNLIMITED_CAPACITY);
      assertEquals(16L << 20, pool.getCapacity());
      pool.close();

      // the default root tracks usage now
      final MemoryPool shared = manager.sharedLeafPool();
      shared.reserve(64);
      assertEquals(64, shared.getCurrentBytes());
      assertEquals(64, manager.defaultRoot().getCurrentBytes());
      shared.release(64);
    }
  }
}

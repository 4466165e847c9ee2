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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.concurrent.TimeUnit;

import org.junit.Test;
import org.reservoir.common.exceptions.ErrorType;
import org.reservoir.common.exceptions.UserException;
import org.reservoir.test.ReservoirTest;

import com.google.common.base.Stopwatch;

public class TestNoopArbitrator extends ReservoirTest {
  private static final long MB = 1L << 20;

  private static MemoryManager newManager() {
    return new MemoryManager(MemoryManagerOptions.builder()
        .capacity(8 * MB)
        .memoryPoolInitCapacity(MB)
        .memoryReclaimWaitMs(60_000)
        .arbitratorKind(MemoryArbitrator.NOOP)
        .build());
  }

  @Test
  public void testRootPoolGetsMaxCapacity() throws Exception {
    try (MemoryManager manager = newManager()) {
      assertTrue(manager.arbitrator() instanceof NoopArbitrator);
      final MemoryPool pool = manager.addRootPool("a", 4 * MB);
      assertEquals(4 * MB, pool.getCapacity());

      final MemoryPool leaf = pool.addLeafChild("leaf", true, null);
      leaf.reserve(4 * MB);
      assertFalse(leaf.maybeReserve(MB));
      assertFalse(manager.growPool(pool, MB));
      assertEquals(4 * MB, pool.getCapacity());

      leaf.release(4 * MB);
      leaf.close();
      pool.close();
      assertEquals(0, manager.numPools());
    }
  }

  @Test
  public void testShrinkPoolsWithoutReclaimersFreesNothing() throws Exception {
    try (MemoryManager manager = newManager()) {
      final MemoryPool a = manager.addRootPool("a", 2 * MB);
      final MemoryPool b = manager.addRootPool("b", 2 * MB);

      final Stopwatch watch = Stopwatch.createStarted();
      assertTrue(manager.shrinkPools(MB) <= 0);
      assertTrue(manager.shrinkPools(0) <= 0);
      assertTrue(watch.elapsed(TimeUnit.MILLISECONDS) < 60_000);
      assertEquals(2 * MB, a.getCapacity());
      assertEquals(2 * MB, b.getCapacity());

      a.close();
      b.close();
    }
  }

  @Test
  public void testUnlimitedPoolCantGrow() throws Exception {
    try (MemoryManager manager = newManager()) {
      final MemoryPool pool = manager.addRootPool();
      assertEquals(MemoryPool.UNLIMITED_CAPACITY, pool.getCapacity());
      try {
        manager.growPool(pool, MB);
        fail("Expected the growth to be rejected");
      } catch (UserException e) {
        assertEquals(ErrorType.VALIDATION, e.getErrorType());
      }
      pool.close();
    }
  }
}

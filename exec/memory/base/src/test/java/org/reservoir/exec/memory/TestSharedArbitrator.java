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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.Test;
import org.reservoir.common.exceptions.ErrorType;
import org.reservoir.common.exceptions.UserException;
import org.reservoir.test.ReservoirTest;

public class TestSharedArbitrator extends ReservoirTest {
  private static final long MB = 1L << 20;
  private static final long KB = 1L << 10;

  private static MemoryManagerOptions.Builder options(long capacity) {
    return MemoryManagerOptions.builder()
        .capacity(capacity)
        .memoryPoolInitCapacity(0)
        .memoryPoolTransferCapacity(0)
        .memoryReclaimWaitMs(2000);
  }

  @Test
  public void testGrowFromFreeCapacity() throws Exception {
    try (MemoryManager manager = new MemoryManager(options(4 * MB).build())) {
      final MemoryPool pool = manager.addRootPool("a", MemoryPool.UNLIMITED_CAPACITY);
      assertEquals(0, pool.getCapacity());

      assertTrue(manager.growPool(pool, MB));
      assertEquals(MB, pool.getCapacity());

      final MemoryArbitrator.Stats stats = manager.arbitrator().stats();
      assertEquals(1, stats.getNumRequests());
      assertEquals(1, stats.getNumSucceeded());
      assertEquals(3 * MB, stats.getFreeCapacity());
      assertEquals(4 * MB, stats.getMaxCapacity());
      pool.close();
    }
  }

  @Test
  public void testGrowBeyondPoolMaxCapacity() throws Exception {
    try (MemoryManager manager = new MemoryManager(options(4 * MB).build())) {
      final MemoryPool pool = manager.addRootPool("a", MB);
      assertFalse(manager.growPool(pool, 2 * MB));
      assertEquals(0, pool.getCapacity());
      assertEquals(1, manager.arbitrator().stats().getNumFailures());
      pool.close();
    }
  }

  @Test
  public void testTakeUnusedCapacity() throws Exception {
    try (MemoryManager manager = new MemoryManager(options(4 * MB).build())) {
      final MemoryPool a = manager.addRootPool("a", MemoryPool.UNLIMITED_CAPACITY);
      final MemoryPool b = manager.addRootPool("b", MemoryPool.UNLIMITED_CAPACITY);
      assertTrue(manager.growPool(a, 3 * MB));

      assertTrue(manager.growPool(b, 2 * MB));
      assertEquals(2 * MB, b.getCapacity());
      assertEquals(2 * MB, a.getCapacity());
      assertEquals(0, manager.arbitrator().stats().getFreeCapacity());
      assertEquals(MB, manager.arbitrator().stats().getNumShrunkBytes());

      a.close();
      b.close();
    }
  }

  @Test
  public void testReclaimUsedMemory() throws Exception {
    try (MemoryManager manager = new MemoryManager(options(4 * MB).build())) {
      final LeafReleasingReclaimer reclaimer = new LeafReleasingReclaimer();
      final MemoryPool a = manager.addRootPool("a", MemoryPool.UNLIMITED_CAPACITY, reclaimer);
      final MemoryPool aLeaf = a.addLeafChild("a_leaf", true, null);
      reclaimer.setLeaf(aLeaf);
      aLeaf.reserve(4 * MB);
      assertEquals(4 * MB, a.getCapacity());

      final MemoryPool b = manager.addRootPool("b", MemoryPool.UNLIMITED_CAPACITY);
      assertTrue(manager.growPool(b, MB));
      assertEquals(MB, b.getCapacity());
      assertEquals(3 * MB, a.getCapacity());
      assertEquals(3 * MB, aLeaf.getCurrentBytes());
      assertEquals(MB, manager.arbitrator().stats().getNumReclaimedBytes());

      aLeaf.release(3 * MB);
      aLeaf.close();
      a.close();
      b.close();
    }
  }

  @Test
  public void testTransferCapacityBoundsEachStep() throws Exception {
    try (MemoryManager manager = new MemoryManager(options(4 * MB).memoryPoolTransferCapacity(256 * KB).build())) {
      final LeafReleasingReclaimer reclaimer = new LeafReleasingReclaimer();
      final MemoryPool a = manager.addRootPool("a", MemoryPool.UNLIMITED_CAPACITY, reclaimer);
      final MemoryPool aLeaf = a.addLeafChild("a_leaf", true, null);
      reclaimer.setLeaf(aLeaf);
      aLeaf.reserve(4 * MB);

      final MemoryPool b = manager.addRootPool("b", MemoryPool.UNLIMITED_CAPACITY);
      assertTrue(manager.growPool(b, MB));
      assertEquals(4, reclaimer.getNumCalls());
      assertEquals(256 * KB, reclaimer.getMaxTarget());
      assertEquals(3 * MB, a.getCapacity());

      aLeaf.release(3 * MB);
      aLeaf.close();
      a.close();
      b.close();
    }
  }

  @Test
  public void testNoPartialGrant() throws Exception {
    try (MemoryManager manager = new MemoryManager(options(4 * MB).build())) {
      final MemoryPool a = manager.addRootPool("a", MemoryPool.UNLIMITED_CAPACITY);
      final MemoryPool aLeaf = a.addLeafChild("a_leaf", true, null);
      aLeaf.reserve(3 * MB);

      final MemoryPool b = manager.addRootPool("b", MemoryPool.UNLIMITED_CAPACITY);
      assertFalse(manager.growPool(b, 2 * MB));
      assertEquals(0, b.getCapacity());
      assertEquals(3 * MB, a.getCapacity());
      assertEquals(MB, manager.arbitrator().stats().getFreeCapacity());

      // what is free is still granted to a request it covers
      assertTrue(manager.growPool(b, MB));
      assertEquals(MB, b.getCapacity());

      aLeaf.release(3 * MB);
      aLeaf.close();
      a.close();
      b.close();
    }
  }

  @Test
  public void testCancelledRequest() throws Exception {
    final ArbitrationStateCheck stateCheck = mock(ArbitrationStateCheck.class);
    when(stateCheck.shouldContinue(any())).thenReturn(false);
    final MemoryReclaimer reclaimer = mock(MemoryReclaimer.class);
    when(reclaimer.reclaimableBytes(any())).thenReturn(4 * MB);

    try (MemoryManager manager = new MemoryManager(options(4 * MB).arbitrationStateCheck(stateCheck).build())) {
      final MemoryPool a = manager.addRootPool("a", MemoryPool.UNLIMITED_CAPACITY, reclaimer);
      final MemoryPool aLeaf = a.addLeafChild("a_leaf", true, null);
      aLeaf.reserve(4 * MB);

      final MemoryPool b = manager.addRootPool("b", MemoryPool.UNLIMITED_CAPACITY);
      assertFalse(manager.growPool(b, MB));
      assertEquals(0, b.getCapacity());
      assertEquals(4 * MB, a.getCapacity());
      assertEquals(1, manager.arbitrator().stats().getNumAborted());
      verify(reclaimer, never()).reclaim(any(), anyLong(), anyLong());

      aLeaf.release(4 * MB);
      aLeaf.close();
      a.close();
      b.close();
    }
  }

  @Test
  public void testFailingStateCheckCancels() throws Exception {
    final ArbitrationStateCheck stateCheck = requestor -> {
      throw new IllegalStateException("query was cancelled");
    };
    try (MemoryManager manager = new MemoryManager(options(MB).arbitrationStateCheck(stateCheck).build())) {
      final MemoryPool a = manager.addRootPool("a", MemoryPool.UNLIMITED_CAPACITY);
      assertTrue(manager.growPool(a, MB));

      final MemoryPool b = manager.addRootPool("b", MemoryPool.UNLIMITED_CAPACITY);
      assertFalse(manager.growPool(b, MB));
      assertEquals(1, manager.arbitrator().stats().getNumAborted());
      a.close();
      b.close();
    }
  }

  @Test
  public void testFailingReclaimerFreesNothing() throws Exception {
    final MemoryReclaimer reclaimer = mock(MemoryReclaimer.class);
    when(reclaimer.reclaimableBytes(any())).thenReturn(4 * MB);
    when(reclaimer.reclaim(any(), anyLong(), anyLong())).thenThrow(new IllegalStateException("spill failed"));

    try (MemoryManager manager = new MemoryManager(options(4 * MB).build())) {
      final MemoryPool a = manager.addRootPool("a", MemoryPool.UNLIMITED_CAPACITY, reclaimer);
      final MemoryPool aLeaf = a.addLeafChild("a_leaf", true, null);
      aLeaf.reserve(4 * MB);

      final MemoryPool b = manager.addRootPool("b", MemoryPool.UNLIMITED_CAPACITY);
      assertFalse(manager.growPool(b, MB));
      verify(reclaimer).reclaim(any(), anyLong(), anyLong());
      assertEquals(0, b.getCapacity());
      assertEquals(4 * MB, a.getCapacity());

      aLeaf.release(4 * MB);
      aLeaf.close();
      a.close();
      b.close();
    }
  }

  @Test
  public void testWaitingForArbitrationTimesOut() throws Exception {
    final CountDownLatch reclaimStarted = new CountDownLatch(1);
    final CountDownLatch reclaimRelease = new CountDownLatch(1);
    final MemoryReclaimer blockingReclaimer = new MemoryReclaimer() {
      @Override
      public long reclaimableBytes(MemoryPool pool) {
        return MB;
      }

      @Override
      public long reclaim(MemoryPool pool, long targetBytes, long maxWaitMs) {
        reclaimStarted.countDown();
        try {
          reclaimRelease.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        return 0;
      }
    };

    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try (MemoryManager manager = new MemoryManager(options(4 * MB).memoryReclaimWaitMs(200).build())) {
      final MemoryPool a = manager.addRootPool("a", MemoryPool.UNLIMITED_CAPACITY, blockingReclaimer);
      final MemoryPool aLeaf = a.addLeafChild("a_leaf", true, null);
      aLeaf.reserve(4 * MB);
      final MemoryPool b = manager.addRootPool("b", MemoryPool.UNLIMITED_CAPACITY);
      final MemoryPool c = manager.addRootPool("c", MemoryPool.UNLIMITED_CAPACITY);

      final Future<Boolean> blocked = executor.submit(() -> manager.growPool(b, MB));
      assertTrue(reclaimStarted.await(10, TimeUnit.SECONDS));

      final long start = System.nanoTime();
      assertFalse(manager.growPool(c, MB));
      assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) >= 150);

      reclaimRelease.countDown();
      assertFalse(blocked.get(10, TimeUnit.SECONDS));
      assertEquals(0, b.getCapacity());
      assertEquals(0, c.getCapacity());
      assertEquals(2, manager.arbitrator().stats().getNumFailures());

      aLeaf.release(4 * MB);
      aLeaf.close();
      a.close();
      b.close();
      c.close();
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  public void testConcurrentGrowthConservesCapacity() throws Exception {
    final long capacity = 16 * MB;
    final int numPools = 8;
    try (MemoryManager manager = new MemoryManager(options(capacity)
        .memoryPoolTransferCapacity(512 * KB)
        .build())) {
      final List<MemoryPool> roots = new ArrayList<>();
      final List<MemoryPool> leaves = new ArrayList<>();
      for (int i = 0; i < numPools; i++) {
        final MemoryPool root = manager.addRootPool("pool_" + i, MemoryPool.UNLIMITED_CAPACITY);
        roots.add(root);
        leaves.add(root.addLeafChild("leaf_" + i, true, null));
      }

      final ExecutorService executor = Executors.newFixedThreadPool(numPools);
      try {
        final List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < numPools; i++) {
          final MemoryPool leaf = leaves.get(i);
          final Random random = new Random(i);
          futures.add(executor.submit(() -> {
            for (int j = 0; j < 200; j++) {
              final long bytes = (1 + random.nextInt(64)) * 64 * KB;
              if (leaf.maybeReserve(bytes)) {
                leaf.release(bytes);
              }
            }
          }));
        }
        for (Future<?> future : futures) {
          future.get(60, TimeUnit.SECONDS);
        }
      } finally {
        executor.shutdownNow();
      }

      long granted = 0;
      for (MemoryPool root : roots) {
        assertEquals(0, root.getCurrentBytes());
        granted += root.getCapacity();
      }
      assertTrue(granted <= capacity);
      assertEquals(capacity, granted + manager.arbitrator().stats().getFreeCapacity());

      for (int i = 0; i < numPools; i++) {
        leaves.get(i).close();
        roots.get(i).close();
      }
      assertEquals(capacity, manager.arbitrator().stats().getFreeCapacity());
    }
  }

  @Test
  public void testShrinkPools() throws Exception {
    try (MemoryManager manager = new MemoryManager(options(4 * MB).build())) {
      final MemoryPool a = manager.addRootPool("a", MemoryPool.UNLIMITED_CAPACITY);
      assertTrue(manager.growPool(a, 2 * MB));

      final LeafReleasingReclaimer reclaimer = new LeafReleasingReclaimer();
      final MemoryPool b = manager.addRootPool("b", MemoryPool.UNLIMITED_CAPACITY, reclaimer);
      final MemoryPool bLeaf = b.addLeafChild("b_leaf", true, null);
      reclaimer.setLeaf(bLeaf);
      bLeaf.reserve(2 * MB);

      assertEquals(MB, manager.shrinkPools(MB));
      assertEquals(MB, a.getCapacity());
      assertEquals(2 * MB, bLeaf.getCurrentBytes());

      assertEquals(3 * MB, manager.shrinkPools(0));
      assertEquals(0, a.getCapacity());
      assertEquals(0, b.getCapacity());
      assertEquals(0, bLeaf.getCurrentBytes());
      assertEquals(4 * MB, manager.arbitrator().stats().getFreeCapacity());

      bLeaf.close();
      a.close();
      b.close();
    }
  }

  @Test
  public void testShrinkWithoutReclaimerOrUnusedCapacity() throws Exception {
    try (MemoryManager manager = new MemoryManager(options(2 * MB).build())) {
      final MemoryPool a = manager.addRootPool("a", MemoryPool.UNLIMITED_CAPACITY);
      final MemoryPool aLeaf = a.addLeafChild("a_leaf", true, null);
      aLeaf.reserve(2 * MB);

      assertEquals(0, manager.shrinkPools(MB));
      assertEquals(0, manager.shrinkPools(0));
      assertEquals(2 * MB, a.getCapacity());

      aLeaf.release(2 * MB);
      aLeaf.close();
      a.close();
    }
  }

  @Test
  public void testShrinkSinglePool() throws Exception {
    try (MemoryManager manager = new MemoryManager(options(4 * MB).build())) {
      final LeafReleasingReclaimer reclaimer = new LeafReleasingReclaimer();
      final MemoryPool a = manager.addRootPool("a", MemoryPool.UNLIMITED_CAPACITY, reclaimer);
      final MemoryPool aLeaf = a.addLeafChild("a_leaf", true, null);
      reclaimer.setLeaf(aLeaf);
      assertTrue(manager.growPool(a, 3 * MB));
      aLeaf.reserve(2 * MB);

      // unused capacity goes first, then the reclaimer covers the rest
      assertEquals(2 * MB, manager.arbitrator().shrinkCapacity(a, 2 * MB));
      assertEquals(MB, a.getCapacity());
      assertEquals(MB, aLeaf.getCurrentBytes());

      aLeaf.release(MB);
      aLeaf.close();
      a.close();
    }
  }

  @Test
  public void testFactoryRegistry() {
    final MemoryArbitrator.Config config = MemoryArbitrator.Config.builder()
        .kind("TESTING")
        .capacity(MB)
        .build();
    try {
      MemoryArbitrator.create(config);
      fail("Expected an unknown kind to be rejected");
    } catch (UserException e) {
      assertEquals(ErrorType.VALIDATION, e.getErrorType());
    }

    assertTrue(MemoryArbitrator.registerFactory("TESTING",
        cfg -> new SharedArbitrator(cfg, CandidateOrdering.LARGEST_CAPACITY_FIRST)));
    try {
      assertFalse(MemoryArbitrator.registerFactory("TESTING",
          cfg -> new SharedArbitrator(cfg, CandidateOrdering.FREE_CAPACITY_FIRST)));
      final MemoryArbitrator arbitrator = MemoryArbitrator.create(config);
      assertEquals("TESTING", arbitrator.getKind());
      assertEquals(MB, arbitrator.capacity());
      assertSame(CandidateOrdering.LARGEST_CAPACITY_FIRST, ((SharedArbitrator) arbitrator).getOrdering());
    } finally {
      assertTrue(MemoryArbitrator.unregisterFactory("TESTING"));
    }
    assertFalse(MemoryArbitrator.unregisterFactory("TESTING"));
  }

  @Test
  public void testBuiltInKinds() {
    final SharedArbitrator shared = (SharedArbitrator) MemoryArbitrator.create(MemoryArbitrator.Config.builder()
        .kind(MemoryArbitrator.SHARED)
        .build());
    assertSame(CandidateOrdering.FREE_CAPACITY_FIRST, shared.getOrdering());

    final SharedArbitrator largestFirst = (SharedArbitrator) MemoryArbitrator.create(MemoryArbitrator.Config.builder()
        .kind(MemoryArbitrator.SHARED_LARGEST_FIRST)
        .build());
    assertSame(CandidateOrdering.LARGEST_CAPACITY_FIRST, largestFirst.getOrdering());
  }
}

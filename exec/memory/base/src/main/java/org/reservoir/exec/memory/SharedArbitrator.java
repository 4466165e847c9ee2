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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.reservoir.common.util.ReservoirStringUtils;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;

/**
 * Arbitrator that keeps one free capacity shared by all root pools.
 * <p>A request that free capacity can't cover waits for the arbitration slot,
 * then takes unused capacity from the other pools and, when that is not
 * enough, asks their reclaimers to free used memory. Capacity moves in steps
 * of at most {@code memoryPoolTransferCapacity} and is only committed to the
 * requestor once the whole increment is available; whatever was moved for a
 * request that fails stays free for the next one.</p>
 * <p>Lock order is the state lock first, then a pool's own monitor. Reclaimers
 * run without the state lock.</p>
 */
public class SharedArbitrator extends MemoryArbitrator {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(SharedArbitrator.class);

  @VisibleForTesting
  static final long SLOT_POLL_MS = 10;

  private enum Outcome {
    ACQUIRED,
    GRANTED,
    ABORTED,
    TIMED_OUT,
    FAILED
  }

  private final CandidateOrdering ordering;

  private final Object stateLock = new Object();
  // guarded by stateLock
  private long freeCapacity;

  private final Semaphore arbitrationSlot = new Semaphore(1, true);
  private volatile Thread slotOwner;

  private final AtomicLong numRequests = new AtomicLong();
  private final AtomicLong numSucceeded = new AtomicLong();
  private final AtomicLong numAborted = new AtomicLong();
  private final AtomicLong numFailures = new AtomicLong();
  private final AtomicLong numShrunkBytes = new AtomicLong();
  private final AtomicLong numReclaimedBytes = new AtomicLong();

  public SharedArbitrator(Config config, CandidateOrdering ordering) {
    super(config);
    this.ordering = Preconditions.checkNotNull(ordering, "candidate ordering must be non-null");
    this.freeCapacity = config.getCapacity();
  }

  public CandidateOrdering getOrdering() {
    return ordering;
  }

  @Override
  public long growCapacity(MemoryPool pool, long targetBytes) {
    Preconditions.checkArgument(targetBytes >= 0, "growth target must be non-negative: %s", targetBytes);
    final long granted;
    synchronized (stateLock) {
      granted = Math.min(targetBytes, Math.min(freeCapacity, pool.getMaxCapacity() - pool.getCapacity()));
      if (granted > 0) {
        pool.grow(granted);
        freeCapacity -= granted;
      }
    }
    logger.debug("Granted memory pool {} initial capacity {} of requested {}",
        pool.getName(), granted, targetBytes);
    return granted;
  }

  @Override
  public boolean growCapacity(MemoryPool pool, List<MemoryPool> candidates, long targetBytes) {
    Preconditions.checkArgument(targetBytes >= 0, "growth target must be non-negative: %s", targetBytes);
    numRequests.incrementAndGet();
    if (targetBytes == 0) {
      numSucceeded.incrementAndGet();
      return true;
    }
    if (pool.getMaxCapacity() - pool.getCapacity() < targetBytes) {
      logger.debug("Can't grow memory pool {} by {} bytes beyond its max capacity {}",
          pool.getName(), targetBytes, pool.getMaxCapacity());
      numFailures.incrementAndGet();
      return false;
    }
    if (tryCommit(pool, targetBytes)) {
      numSucceeded.incrementAndGet();
      return true;
    }
    if (slotOwner == Thread.currentThread()) {
      // Growth from inside a reclaimer can only use what is already free.
      logger.debug("Memory pool {} asked for {} bytes from an arbitrating thread", pool.getName(), targetBytes);
      numFailures.incrementAndGet();
      return false;
    }

    final Stopwatch watch = Stopwatch.createStarted();
    final long deadlineNanos = deadlineNanos();
    Outcome outcome = acquireSlot(pool, deadlineNanos);
    if (outcome == Outcome.ACQUIRED) {
      try {
        outcome = arbitrate(pool, candidates, targetBytes, deadlineNanos);
      } finally {
        releaseSlot();
      }
    }
    return finish(pool, targetBytes, outcome, watch);
  }

  private boolean finish(MemoryPool pool, long targetBytes, Outcome outcome, Stopwatch watch) {
    switch (outcome) {
      case GRANTED:
        numSucceeded.incrementAndGet();
        logger.debug("Grew memory pool {} by {} in {} ms",
            pool.getName(), ReservoirStringUtils.readable(targetBytes), watch.elapsed(TimeUnit.MILLISECONDS));
        return true;
      case ABORTED:
        numAborted.incrementAndGet();
        logger.debug("Growth of memory pool {} by {} was aborted after {} ms",
            pool.getName(), ReservoirStringUtils.readable(targetBytes), watch.elapsed(TimeUnit.MILLISECONDS));
        return false;
      default:
        numFailures.incrementAndGet();
        logger.warn("Failed to grow memory pool {} by {} ({}) after {} ms, {}",
            pool.getName(), ReservoirStringUtils.readable(targetBytes), outcome,
            watch.elapsed(TimeUnit.MILLISECONDS), this);
        return false;
    }
  }

  private Outcome arbitrate(MemoryPool requestor, List<MemoryPool> candidates, long targetBytes,
      long deadlineNanos) {
    final List<ArbitrationCandidate> withUnused = snapshot(requestor, candidates, false);
    withUnused.sort(ordering.freeCapacityOrder());
    for (ArbitrationCandidate candidate : withUnused) {
      final Outcome outcome = transferFrom(requestor, candidate.getPool(), targetBytes, deadlineNanos, false);
      if (outcome != null) {
        return outcome;
      }
    }

    final List<ArbitrationCandidate> withUsed = snapshot(requestor, candidates, true);
    withUsed.removeIf(candidate -> candidate.getReclaimableBytes() <= 0);
    withUsed.sort(ordering.reclaimOrder());
    for (ArbitrationCandidate candidate : withUsed) {
      final Outcome outcome = transferFrom(requestor, candidate.getPool(), targetBytes, deadlineNanos, true);
      if (outcome != null) {
        return outcome;
      }
    }
    return tryCommit(requestor, targetBytes) ? Outcome.GRANTED : Outcome.FAILED;
  }

  /**
   * Move capacity from {@code source} until the request is covered or the
   * source runs dry.
   *
   * @return the final outcome, or null to go on with the next candidate
   */
  private Outcome transferFrom(MemoryPool requestor, MemoryPool source, long targetBytes,
      long deadlineNanos, boolean reclaim) {
    while (true) {
      if (tryCommit(requestor, targetBytes)) {
        return Outcome.GRANTED;
      }
      if (!shouldContinue(requestor)) {
        return Outcome.ABORTED;
      }
      if (remainingMs(deadlineNanos) <= 0) {
        return Outcome.TIMED_OUT;
      }
      final long needed = neededBytes(targetBytes);
      if (needed == 0) {
        // enough is free, the requestor itself can't take it
        return Outcome.FAILED;
      }
      final long step = transferStep(needed);
      if (reclaim) {
        reclaimSafely(source, step, deadlineNanos);
      }
      if (shrinkUnused(source, step) < step) {
        return null;
      }
    }
  }

  @Override
  public long shrinkCapacity(MemoryPool pool, long targetBytes) {
    Preconditions.checkArgument(targetBytes >= 0, "shrink target must be non-negative: %s", targetBytes);
    long freed = shrinkUnused(pool, targetBytes);
    if ((targetBytes == 0 || freed < targetBytes) && pool.getCurrentBytes() > 0 && !pool.isClosed()) {
      final long remaining = targetBytes == 0 ? pool.getCurrentBytes() : targetBytes - freed;
      reclaimSafely(pool, remaining, deadlineNanos());
      freed += shrinkUnused(pool, targetBytes == 0 ? 0 : remaining);
    }
    logger.debug("Shrunk memory pool {} by {} of target {}", pool.getName(), freed, targetBytes);
    return freed;
  }

  @Override
  public long shrinkCapacity(List<MemoryPool> pools, long targetBytes) {
    Preconditions.checkArgument(targetBytes >= 0, "shrink target must be non-negative: %s", targetBytes);
    final long target = targetBytes == 0 ? Long.MAX_VALUE : targetBytes;
    final long deadlineNanos = deadlineNanos();
    final boolean ownsSlot = slotOwner == Thread.currentThread();
    if (!ownsSlot && acquireSlot(null, deadlineNanos) != Outcome.ACQUIRED) {
      logger.warn("Timed out waiting to shrink {} memory pools by {}", pools.size(), targetBytes);
      return 0;
    }

    long freed = 0;
    try {
      final List<ArbitrationCandidate> withUnused = snapshot(null, pools, false);
      withUnused.sort(ordering.freeCapacityOrder());
      for (ArbitrationCandidate candidate : withUnused) {
        if (freed >= target) {
          break;
        }
        freed += shrinkUnused(candidate.getPool(), targetBytes == 0 ? 0 : target - freed);
      }

      if (freed < target) {
        final List<ArbitrationCandidate> withUsed = snapshot(null, pools, true);
        withUsed.removeIf(candidate -> candidate.getReclaimableBytes() <= 0);
        withUsed.sort(ordering.reclaimOrder());
        for (ArbitrationCandidate candidate : withUsed) {
          if (freed >= target || remainingMs(deadlineNanos) <= 0) {
            break;
          }
          final long step = transferStep(Math.min(target - freed, candidate.getReclaimableBytes()));
          reclaimSafely(candidate.getPool(), step, deadlineNanos);
          freed += shrinkUnused(candidate.getPool(), step);
        }
      }
    } finally {
      if (!ownsSlot) {
        releaseSlot();
      }
    }
    logger.debug("Shrunk {} memory pools by {} of target {}", pools.size(), freed, targetBytes);
    return freed;
  }

  @Override
  public Stats stats() {
    final long free;
    synchronized (stateLock) {
      free = freeCapacity;
    }
    return new Stats(numRequests.get(), numSucceeded.get(), numAborted.get(), numFailures.get(),
        numShrunkBytes.get(), numReclaimedBytes.get(), free, config.getCapacity());
  }

  @VisibleForTesting
  long freeCapacity() {
    synchronized (stateLock) {
      return freeCapacity;
    }
  }

  private boolean tryCommit(MemoryPool pool, long targetBytes) {
    synchronized (stateLock) {
      if (pool.isClosed()
          || freeCapacity < targetBytes
          || pool.getMaxCapacity() - pool.getCapacity() < targetBytes) {
        return false;
      }
      pool.grow(targetBytes);
      freeCapacity -= targetBytes;
      return true;
    }
  }

  private long neededBytes(long targetBytes) {
    synchronized (stateLock) {
      return Math.max(0, targetBytes - freeCapacity);
    }
  }

  /**
   * @param bytes 0 to take all unused capacity
   */
  private long shrinkUnused(MemoryPool pool, long bytes) {
    final long shrunk;
    synchronized (stateLock) {
      shrunk = pool.shrink(bytes);
      freeCapacity += shrunk;
    }
    numShrunkBytes.addAndGet(shrunk);
    return shrunk;
  }

  private long reclaimSafely(MemoryPool pool, long targetBytes, long deadlineNanos) {
    try {
      final long freed = pool.reclaim(targetBytes, reclaimWaitMs(deadlineNanos));
      numReclaimedBytes.addAndGet(freed);
      return freed;
    } catch (RuntimeException e) {
      logger.warn("Failed to reclaim {} bytes from memory pool {}", targetBytes, pool.getName(), e);
      return 0;
    }
  }

  private long reclaimableSafely(MemoryPool pool) {
    try {
      return pool.reclaimableBytes();
    } catch (RuntimeException e) {
      logger.warn("Failed to get reclaimable bytes of memory pool {}", pool.getName(), e);
      return 0;
    }
  }

  private List<ArbitrationCandidate> snapshot(MemoryPool requestor, List<MemoryPool> pools,
      boolean withReclaimable) {
    final List<ArbitrationCandidate> candidates = new ArrayList<>(pools.size());
    for (MemoryPool pool : pools) {
      if (pool == requestor || pool.isClosed() || !pool.isRoot()) {
        continue;
      }
      candidates.add(ArbitrationCandidate.of(pool, withReclaimable ? reclaimableSafely(pool) : 0));
    }
    return candidates;
  }

  private boolean shouldContinue(MemoryPool requestor) {
    final ArbitrationStateCheck stateCheck = config.getStateCheck();
    if (stateCheck == null || requestor == null) {
      return true;
    }
    try {
      return stateCheck.shouldContinue(requestor);
    } catch (RuntimeException e) {
      logger.warn("Arbitration state check failed for memory pool {}, aborting", requestor.getName(), e);
      return false;
    }
  }

  private Outcome acquireSlot(MemoryPool requestor, long deadlineNanos) {
    try {
      while (true) {
        if (!shouldContinue(requestor)) {
          return Outcome.ABORTED;
        }
        final long remainingMs = remainingMs(deadlineNanos);
        if (remainingMs <= 0) {
          return Outcome.TIMED_OUT;
        }
        if (arbitrationSlot.tryAcquire(Math.min(SLOT_POLL_MS, remainingMs), TimeUnit.MILLISECONDS)) {
          slotOwner = Thread.currentThread();
          return Outcome.ACQUIRED;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("Interrupted while waiting for memory arbitration", e);
      return Outcome.ABORTED;
    }
  }

  private void releaseSlot() {
    slotOwner = null;
    arbitrationSlot.release();
  }

  private long transferStep(long neededBytes) {
    final long transferCapacity = config.getMemoryPoolTransferCapacity();
    return transferCapacity == 0 ? neededBytes : Math.min(neededBytes, transferCapacity);
  }

  private long deadlineNanos() {
    final long waitMs = config.getMemoryReclaimWaitMs();
    return waitMs == 0 ? Long.MAX_VALUE : System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(waitMs);
  }

  private static long remainingMs(long deadlineNanos) {
    if (deadlineNanos == Long.MAX_VALUE) {
      return Long.MAX_VALUE;
    }
    return TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
  }

  private long reclaimWaitMs(long deadlineNanos) {
    if (deadlineNanos == Long.MAX_VALUE) {
      return 0;
    }
    return Math.max(1, remainingMs(deadlineNanos));
  }
}

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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.reservoir.common.AutoCloseables;
import org.reservoir.common.exceptions.UserException;
import org.reservoir.common.util.ReservoirStringUtils;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * Owns the memory capacity of the process and hands it out through root
 * memory pools.
 * <p>Root pools created with {@link #addRootPool} are registered and their
 * capacity is negotiated with the {@link MemoryArbitrator}. Leaf pools created
 * with {@link #addLeafPool} hang off an always present default root whose
 * capacity is unlimited and never arbitrated; the same root carries the shared
 * leaf pools and the spill pool.</p>
 * <p>A manager is normally constructed and passed around explicitly. The
 * static {@link #initialize}/{@link #getInstance} pair exists for code that
 * can't be handed one.</p>
 */
public class MemoryManager implements CapacityAuthority, AutoCloseable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(MemoryManager.class);

  public static final String DEFAULT_ROOT_NAME = "__default_root__";
  public static final String SHARED_LEAF_POOL_PREFIX = "default_shared_leaf_pool_";
  public static final String SPILL_POOL_NAME = "_sys.spilling";
  private static final String ROOT_NAME_PREFIX = "default_root_";
  private static final String LEAF_NAME_PREFIX = "default_leaf_";

  private static final AtomicLong rootIdGenerator = new AtomicLong();
  private static final AtomicLong leafIdGenerator = new AtomicLong();

  private static final Object instanceLock = new Object();
  private static volatile MemoryManager instance;

  private final long capacity;
  private final int alignment;
  private final long memoryPoolInitCapacity;
  private final boolean checkUsageLeak;
  private final MemoryAllocator allocator;
  private final MemoryArbitrator arbitrator;
  private final MemoryPoolOptions poolOptions;
  private final MemoryPoolImpl defaultRoot;
  private final List<MemoryPool> sharedLeafPools;
  private final MemoryPool spillPool;

  private final ReadWriteLock registryLock = new ReentrantReadWriteLock();
  // guarded by registryLock
  private final Map<String, PoolHandle> pools = new HashMap<>();

  public MemoryManager(MemoryManagerOptions options) {
    this(options, options.getAllocator(), MemoryArbitrator.create(MemoryArbitrator.Config.builder()
        .kind(options.getArbitratorKind())
        .capacity(Math.max(0, Math.min(options.getQueryMemoryCapacity(), options.getCapacity())))
        .memoryPoolTransferCapacity(options.getMemoryPoolTransferCapacity())
        .memoryReclaimWaitMs(options.getMemoryReclaimWaitMs())
        .stateCheck(options.getArbitrationStateCheck())
        .build()));
  }

  @VisibleForTesting
  MemoryManager(MemoryManagerOptions options, MemoryAllocator allocator, MemoryArbitrator arbitrator) {
    this.allocator = Preconditions.checkNotNull(allocator, "memory allocator must be non-null");
    this.arbitrator = Preconditions.checkNotNull(arbitrator, "memory arbitrator must be non-null");
    this.capacity = options.getCapacity();
    Preconditions.checkArgument(capacity >= 0, "memory capacity must be non-negative: %s", capacity);
    Preconditions.checkArgument(allocator.capacity() == capacity,
        "MemoryAllocator capacity %s must be the same as MemoryManager capacity %s",
        allocator.capacity(), capacity);
    this.alignment = Math.max(MemoryAllocator.MIN_ALIGNMENT, options.getAlignment());
    MemoryAllocator.alignmentCheck(0, alignment);
    this.memoryPoolInitCapacity = options.getMemoryPoolInitCapacity();
    this.checkUsageLeak = options.isCheckUsageLeak();

    this.poolOptions = MemoryPoolOptions.builder()
        .alignment(alignment)
        .trackUsage(true)
        .debugEnabled(options.isDebugEnabled())
        .coreOnAllocationFailureEnabled(options.isCoreOnAllocationFailureEnabled())
        .build();

    this.defaultRoot = new MemoryPoolImpl(DEFAULT_ROOT_NAME, MemoryPool.Kind.AGGREGATE, null, null, null,
        allocator, poolOptions.toBuilder()
            .maxCapacity(MemoryPool.UNLIMITED_CAPACITY)
            .trackUsage(options.isTrackDefaultUsage())
            .build());
    defaultRoot.grow(defaultRoot.getMaxCapacity());

    final int numSharedPools = Math.max(1, options.getNumSharedLeafPools());
    final ImmutableList.Builder<MemoryPool> sharedPools = ImmutableList.builder();
    for (int i = 0; i < numSharedPools; i++) {
      sharedPools.add(defaultRoot.addLeafChild(SHARED_LEAF_POOL_PREFIX + i, true, null));
    }
    this.sharedLeafPools = sharedPools.build();
    this.spillPool = defaultRoot.addLeafChild(SPILL_POOL_NAME, true, null);

    logger.info("Memory manager created: capacity {}, alignment {}, {}",
        ReservoirStringUtils.readable(capacity), alignment, arbitrator);
  }

  /**
   * Install the process wide manager.
   *
   * @throws IllegalStateException if one is already installed
   */
  public static MemoryManager initialize(MemoryManagerOptions options) {
    synchronized (instanceLock) {
      Preconditions.checkState(instance == null, "The memory manager has already been initialized");
      instance = new MemoryManager(options);
      return instance;
    }
  }

  /**
   * @throws IllegalStateException if {@link #initialize} hasn't been called
   */
  public static MemoryManager getInstance() {
    final MemoryManager manager = instance;
    Preconditions.checkState(manager != null, "The memory manager has not been initialized");
    return manager;
  }

  /**
   * Get the process wide manager, creating one with {@code options} if there is
   * none yet. Kept for callers that predate {@link #initialize}.
   */
  @Deprecated
  public static MemoryManager deprecatedGetInstance(MemoryManagerOptions options) {
    synchronized (instanceLock) {
      if (instance == null) {
        instance = new MemoryManager(options);
      }
      return instance;
    }
  }

  @VisibleForTesting
  public static MemoryManager testingSetInstance(MemoryManagerOptions options) {
    synchronized (instanceLock) {
      instance = new MemoryManager(options);
      return instance;
    }
  }

  @VisibleForTesting
  public static void testingClearInstance() {
    synchronized (instanceLock) {
      instance = null;
    }
  }

  public MemoryPool addRootPool(String name, long maxCapacity, MemoryReclaimer reclaimer) {
    Preconditions.checkArgument(maxCapacity >= 0, "max capacity must be non-negative: %s", maxCapacity);
    final String poolName = Strings.isNullOrEmpty(name)
        ? ROOT_NAME_PREFIX + rootIdGenerator.getAndIncrement()
        : name;

    final MemoryPoolImpl pool;
    registryLock.writeLock().lock();
    try {
      final PoolHandle existing = pools.get(poolName);
      if (existing != null && existing.isAlive()) {
        throw UserException.validationError()
            .message("Duplicate root pool name found: %s", poolName)
            .build(logger);
      }
      pool = new MemoryPoolImpl(poolName, MemoryPool.Kind.AGGREGATE, null, reclaimer, this, allocator,
          poolOptions.toBuilder().maxCapacity(maxCapacity).build());
      pools.put(poolName, new PoolHandle(pool));
    } finally {
      registryLock.writeLock().unlock();
    }

    final long granted = arbitrator.growCapacity(pool, Math.min(memoryPoolInitCapacity, maxCapacity));
    logger.debug("Added root memory pool {} with initial capacity {}", poolName, granted);
    return pool;
  }

  public MemoryPool addRootPool(String name, long maxCapacity) {
    return addRootPool(name, maxCapacity, null);
  }

  public MemoryPool addRootPool() {
    return addRootPool(null, MemoryPool.UNLIMITED_CAPACITY, null);
  }

  /**
   * Create a leaf pool under the default root. Leaf pools are not registered
   * and are not part of arbitration.
   */
  public MemoryPool addLeafPool(String name, boolean threadSafe) {
    final String poolName = Strings.isNullOrEmpty(name)
        ? LEAF_NAME_PREFIX + leafIdGenerator.getAndIncrement()
        : name;
    return defaultRoot.addLeafChild(poolName, threadSafe, null);
  }

  public MemoryPool addLeafPool() {
    return addLeafPool(null, true);
  }

  /**
   * Grow a registered root pool by {@code incrementBytes}, possibly at the
   * expense of the other registered pools. Blocks while capacity is reclaimed.
   *
   * @return false if the increment could not be granted in full
   */
  public boolean growPool(MemoryPool pool, long incrementBytes) {
    if (pool.getCapacity() == MemoryPool.UNLIMITED_CAPACITY) {
      throw UserException.validationError()
          .message("Memory pool %s with unlimited capacity can't be grown", pool.getName())
          .build(logger);
    }
    return arbitrator.growCapacity(pool, getAlivePools(), incrementBytes);
  }

  /**
   * @param targetBytes 0 to shrink as much as possible
   * @return bytes taken back from the registered pools
   */
  public long shrinkPools(long targetBytes) {
    return arbitrator.shrinkCapacity(getAlivePools(), targetBytes);
  }

  @Override
  public boolean requestGrowth(MemoryPool pool, long incrementBytes) {
    return growPool(pool, incrementBytes);
  }

  @Override
  public void notifyDestroyed(MemoryPool pool) {
    dropPool(pool);
  }

  /**
   * Unregister a root pool that is being destroyed and return its capacity to
   * the arbitrator.
   */
  @VisibleForTesting
  void dropPool(MemoryPool pool) {
    Preconditions.checkNotNull(pool);
    registryLock.writeLock().lock();
    try {
      final PoolHandle handle = pools.get(pool.getName());
      if (handle == null || !handle.refersTo(pool)) {
        throw UserException.internalError()
            .message("Memory pool %s is not registered with the memory manager", pool.getName())
            .build(logger);
      }
      handle.markDead();
      pools.remove(pool.getName());
    } finally {
      registryLock.writeLock().unlock();
    }

    Preconditions.checkState(pool.getCurrentBytes() == 0,
        "Memory pool %s still has %s bytes in use when dropped", pool.getName(), pool.getCurrentBytes());
    final long shrunk = arbitrator.shrinkCapacity(pool, 0);
    logger.debug("Dropped root memory pool {}, returned {} bytes", pool.getName(), shrunk);
  }

  /**
   * @return the registered root pools that are still alive
   */
  public List<MemoryPool> getAlivePools() {
    registryLock.readLock().lock();
    try {
      final List<MemoryPool> alive = new ArrayList<>(pools.size());
      for (PoolHandle handle : pools.values()) {
        final MemoryPool pool = handle.get();
        if (pool != null) {
          alive.add(pool);
        }
      }
      return alive;
    } finally {
      registryLock.readLock().unlock();
    }
  }

  /**
   * @return number of registered root pools that are alive plus the leaf pools
   *   created under the default root; the shared leaf pools and the spill pool
   *   are not counted
   */
  public int numPools() {
    final int numDefaultLeaves = Math.max(0, defaultRoot.getChildCount() - sharedLeafPools.size() - 1);
    return getAlivePools().size() + numDefaultLeaves;
  }

  /**
   * A shared leaf pool for the calling thread; the same thread always gets the
   * same pool.
   */
  public MemoryPool sharedLeafPool() {
    return sharedLeafPool(Thread.currentThread().getId());
  }

  public MemoryPool sharedLeafPool(long callerId) {
    return sharedLeafPools.get(Math.floorMod(Long.hashCode(callerId), sharedLeafPools.size()));
  }

  public List<MemoryPool> getSharedLeafPools() {
    return sharedLeafPools;
  }

  public MemoryPool spillPool() {
    return spillPool;
  }

  public boolean isSpillPool(MemoryPool pool) {
    return pool == spillPool;
  }

  public MemoryPool defaultRoot() {
    return defaultRoot;
  }

  /**
   * @return bytes allocated from the allocator by all pools, including the
   *   default root's
   */
  public long getTotalBytes() {
    return allocator.totalUsedBytes();
  }

  public long capacity() {
    return capacity;
  }

  public int alignment() {
    return alignment;
  }

  public MemoryAllocator allocator() {
    return allocator;
  }

  public MemoryArbitrator arbitrator() {
    return arbitrator;
  }

  /**
   * Closes the pools owned by the manager.
   *
   * @throws IllegalStateException if leak checking is on and root pools are
   *   still registered
   */
  @Override
  public void close() throws Exception {
    final int numRootPools = getAlivePools().size();
    if (checkUsageLeak && numRootPools > 0) {
      final String message = String.format("There are still %d alive memory pools on memory manager close:%n%s",
          numRootPools, toString(true));
      logger.error(message);
      throw new IllegalStateException(message);
    }
    final List<AutoCloseable> closeables = new ArrayList<>(sharedLeafPools.size() + 1);
    closeables.addAll(sharedLeafPools);
    closeables.add(spillPool);
    AutoCloseables.close(closeables);
    logger.debug("Memory manager closed, {}", arbitrator);
  }

  /**
   * @param detail include the usage tree of every pool instead of only names
   */
  public String toString(boolean detail) {
    final StringBuilder sb = new StringBuilder();
    sb.append("Memory Manager[capacity ")
        .append(ReservoirStringUtils.readable(capacity))
        .append(" alignment ")
        .append(ReservoirStringUtils.readable(alignment))
        .append(" usedBytes ")
        .append(ReservoirStringUtils.readable(getTotalBytes()))
        .append(" number of pools ")
        .append(numPools())
        .append('\n');
    sb.append("List of root pools:\n");
    if (detail) {
      sb.append(defaultRoot.treeMemoryUsage());
    } else {
      sb.append("\t").append(defaultRoot.getName()).append('\n');
    }
    for (MemoryPool pool : getAlivePools()) {
      if (detail) {
        sb.append(pool.treeMemoryUsage());
      } else {
        sb.append("\t").append(pool.getName()).append('\n');
      }
    }
    sb.append("Memory Allocator[").append(allocator).append("]\n");
    sb.append(arbitrator);
    return sb.toString();
  }

  @Override
  public String toString() {
    return toString(false);
  }
}

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

import java.util.concurrent.TimeUnit;

import org.reservoir.common.config.ReservoirConfig;

/**
 * Construction options of a {@link MemoryManager}. Either built in code or
 * read from the {@code reservoir.memory} section of the configuration.
 */
public class MemoryManagerOptions {
  public static final long DEFAULT_POOL_INIT_CAPACITY = 128L << 20;
  public static final long DEFAULT_POOL_TRANSFER_CAPACITY = 32L << 20;
  public static final long DEFAULT_RECLAIM_WAIT_MS = TimeUnit.MINUTES.toMillis(5);
  public static final int DEFAULT_NUM_SHARED_LEAF_POOLS = 32;

  private final long capacity;
  private final long queryMemoryCapacity;
  private final long memoryPoolInitCapacity;
  private final long memoryPoolTransferCapacity;
  private final long memoryReclaimWaitMs;
  private final int alignment;
  private final boolean trackDefaultUsage;
  private final boolean checkUsageLeak;
  private final boolean debugEnabled;
  private final boolean coreOnAllocationFailureEnabled;
  private final String arbitratorKind;
  private final int numSharedLeafPools;
  private final MemoryAllocator allocator;
  private final ArbitrationStateCheck arbitrationStateCheck;

  private MemoryManagerOptions(Builder builder) {
    this.capacity = builder.capacity;
    this.queryMemoryCapacity = builder.queryMemoryCapacity;
    this.memoryPoolInitCapacity = builder.memoryPoolInitCapacity;
    this.memoryPoolTransferCapacity = builder.memoryPoolTransferCapacity;
    this.memoryReclaimWaitMs = builder.memoryReclaimWaitMs;
    this.alignment = builder.alignment;
    this.trackDefaultUsage = builder.trackDefaultUsage;
    this.checkUsageLeak = builder.checkUsageLeak;
    this.debugEnabled = builder.debugEnabled;
    this.coreOnAllocationFailureEnabled = builder.coreOnAllocationFailureEnabled;
    this.arbitratorKind = builder.arbitratorKind;
    this.numSharedLeafPools = builder.numSharedLeafPools;
    this.allocator = builder.allocator != null ? builder.allocator : new NettyMemoryAllocator(builder.capacity);
    this.arbitrationStateCheck = builder.arbitrationStateCheck;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Read every option from the configuration. The allocator and the state
   * check can't be configured there and are left to the defaults.
   */
  public static Builder builder(ReservoirConfig config) {
    return new Builder()
        .capacity(config.getBytesOrUnlimited(MemoryConstants.CAPACITY))
        .queryMemoryCapacity(config.getBytesOrUnlimited(MemoryConstants.QUERY_CAPACITY))
        .memoryPoolInitCapacity(config.getBytes(MemoryConstants.POOL_INIT_CAPACITY))
        .memoryPoolTransferCapacity(config.getBytes(MemoryConstants.POOL_TRANSFER_CAPACITY))
        .memoryReclaimWaitMs(config.getDuration(MemoryConstants.RECLAIM_WAIT).toMillis())
        .alignment(config.getInt(MemoryConstants.ALIGNMENT))
        .trackDefaultUsage(config.getBoolean(MemoryConstants.TRACK_DEFAULT_USAGE))
        .checkUsageLeak(config.getBoolean(MemoryConstants.CHECK_USAGE_LEAK))
        .debugEnabled(config.getBoolean(MemoryConstants.DEBUG))
        .coreOnAllocationFailureEnabled(config.getBoolean(MemoryConstants.CORE_ON_ALLOCATION_FAILURE))
        .arbitratorKind(config.getString(MemoryConstants.ARBITRATOR_KIND))
        .numSharedLeafPools(config.getInt(MemoryConstants.NUM_SHARED_LEAF_POOLS));
  }

  public static MemoryManagerOptions fromConfig(ReservoirConfig config) {
    return builder(config).build();
  }

  public long getCapacity() {
    return capacity;
  }

  public long getQueryMemoryCapacity() {
    return queryMemoryCapacity;
  }

  public long getMemoryPoolInitCapacity() {
    return memoryPoolInitCapacity;
  }

  public long getMemoryPoolTransferCapacity() {
    return memoryPoolTransferCapacity;
  }

  public long getMemoryReclaimWaitMs() {
    return memoryReclaimWaitMs;
  }

  public int getAlignment() {
    return alignment;
  }

  public boolean isTrackDefaultUsage() {
    return trackDefaultUsage;
  }

  public boolean isCheckUsageLeak() {
    return checkUsageLeak;
  }

  public boolean isDebugEnabled() {
    return debugEnabled;
  }

  public boolean isCoreOnAllocationFailureEnabled() {
    return coreOnAllocationFailureEnabled;
  }

  public String getArbitratorKind() {
    return arbitratorKind;
  }

  public int getNumSharedLeafPools() {
    return numSharedLeafPools;
  }

  public MemoryAllocator getAllocator() {
    return allocator;
  }

  public ArbitrationStateCheck getArbitrationStateCheck() {
    return arbitrationStateCheck;
  }

  public static class Builder {
    private long capacity = MemoryPool.UNLIMITED_CAPACITY;
    private long queryMemoryCapacity = MemoryPool.UNLIMITED_CAPACITY;
    private long memoryPoolInitCapacity = DEFAULT_POOL_INIT_CAPACITY;
    private long memoryPoolTransferCapacity = DEFAULT_POOL_TRANSFER_CAPACITY;
    private long memoryReclaimWaitMs = DEFAULT_RECLAIM_WAIT_MS;
    private int alignment = MemoryAllocator.MAX_ALIGNMENT;
    private boolean trackDefaultUsage;
    private boolean checkUsageLeak = true;
    private boolean debugEnabled;
    private boolean coreOnAllocationFailureEnabled;
    private String arbitratorKind = MemoryArbitrator.SHARED;
    private int numSharedLeafPools = DEFAULT_NUM_SHARED_LEAF_POOLS;
    private MemoryAllocator allocator;
    private ArbitrationStateCheck arbitrationStateCheck;

    public Builder capacity(long capacity) {
      this.capacity = capacity;
      return this;
    }

    public Builder queryMemoryCapacity(long queryMemoryCapacity) {
      this.queryMemoryCapacity = queryMemoryCapacity;
      return this;
    }

    public Builder memoryPoolInitCapacity(long memoryPoolInitCapacity) {
      this.memoryPoolInitCapacity = memoryPoolInitCapacity;
      return this;
    }

    public Builder memoryPoolTransferCapacity(long memoryPoolTransferCapacity) {
      this.memoryPoolTransferCapacity = memoryPoolTransferCapacity;
      return this;
    }

    public Builder memoryReclaimWaitMs(long memoryReclaimWaitMs) {
      this.memoryReclaimWaitMs = memoryReclaimWaitMs;
      return this;
    }

    public Builder alignment(int alignment) {
      this.alignment = alignment;
      return this;
    }

    public Builder trackDefaultUsage(boolean trackDefaultUsage) {
      this.trackDefaultUsage = trackDefaultUsage;
      return this;
    }

    public Builder checkUsageLeak(boolean checkUsageLeak) {
      this.checkUsageLeak = checkUsageLeak;
      return this;
    }

    public Builder debugEnabled(boolean debugEnabled) {
      this.debugEnabled = debugEnabled;
      return this;
    }

    public Builder coreOnAllocationFailureEnabled(boolean coreOnAllocationFailureEnabled) {
      this.coreOnAllocationFailureEnabled = coreOnAllocationFailureEnabled;
      return this;
    }

    public Builder arbitratorKind(String arbitratorKind) {
      this.arbitratorKind = arbitratorKind;
      return this;
    }

    public Builder numSharedLeafPools(int numSharedLeafPools) {
      this.numSharedLeafPools = numSharedLeafPools;
      return this;
    }

    /**
     * Defaults to a {@link NettyMemoryAllocator} of the configured capacity.
     */
    public Builder allocator(MemoryAllocator allocator) {
      this.allocator = allocator;
      return this;
    }

    public Builder arbitrationStateCheck(ArbitrationStateCheck arbitrationStateCheck) {
      this.arbitrationStateCheck = arbitrationStateCheck;
      return this;
    }

    public MemoryManagerOptions build() {
      return new MemoryManagerOptions(this);
    }
  }
}

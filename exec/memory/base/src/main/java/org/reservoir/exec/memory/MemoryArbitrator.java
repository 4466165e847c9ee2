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

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.reservoir.common.exceptions.UserException;
import org.reservoir.common.util.ReservoirStringUtils;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * Distributes a fixed capacity among root memory pools. Implementations are
 * created by kind through {@link #create(Config)}; new kinds are plugged in
 * with {@link #registerFactory(String, Factory)}.
 */
public abstract class MemoryArbitrator {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(MemoryArbitrator.class);

  public static final String SHARED = "SHARED";
  public static final String SHARED_LARGEST_FIRST = "SHARED_LARGEST_FIRST";
  public static final String NOOP = "NOOP";

  private static final Map<String, Factory> factories = new ConcurrentHashMap<>();

  static {
    factories.put(SHARED, config -> new SharedArbitrator(config, CandidateOrdering.FREE_CAPACITY_FIRST));
    factories.put(SHARED_LARGEST_FIRST,
        config -> new SharedArbitrator(config, CandidateOrdering.LARGEST_CAPACITY_FIRST));
    factories.put(NOOP, NoopArbitrator::new);
  }

  @FunctionalInterface
  public interface Factory {
    MemoryArbitrator create(Config config);
  }

  /**
   * @return false if a factory is already registered under {@code kind}
   */
  public static boolean registerFactory(String kind, Factory factory) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(kind), "arbitrator kind must be non-empty");
    Preconditions.checkNotNull(factory, "arbitrator factory must be non-null");
    final boolean added = factories.putIfAbsent(kind, factory) == null;
    if (added) {
      logger.debug("Registered memory arbitrator factory {}", kind);
    }
    return added;
  }

  public static boolean unregisterFactory(String kind) {
    return factories.remove(kind) != null;
  }

  public static MemoryArbitrator create(Config config) {
    final Factory factory = factories.get(config.getKind());
    if (factory == null) {
      throw UserException.validationError()
          .message("Memory arbitrator factory for kind %s is not registered", config.getKind())
          .addContext("Registered kinds", factories.keySet().toString())
          .build(logger);
    }
    return factory.create(config);
  }

  protected final Config config;

  protected MemoryArbitrator(Config config) {
    this.config = Preconditions.checkNotNull(config);
  }

  public String getKind() {
    return config.getKind();
  }

  public long capacity() {
    return config.getCapacity();
  }

  /**
   * Grant a newly created pool its initial capacity out of free capacity only.
   *
   * @return bytes granted, possibly fewer than asked for
   */
  public abstract long growCapacity(MemoryPool pool, long targetBytes);

  /**
   * Grow {@code pool} by exactly {@code targetBytes}, taking capacity from the
   * other {@code candidates} if needed. Either the whole increment is granted or
   * nothing is.
   */
  public abstract boolean growCapacity(MemoryPool pool, List<MemoryPool> candidates, long targetBytes);

  /**
   * Take capacity back from a single pool, unused capacity first.
   *
   * @param targetBytes 0 to take as much as possible
   * @return bytes returned to the arbitrator
   */
  public abstract long shrinkCapacity(MemoryPool pool, long targetBytes);

  /**
   * Take capacity back from a set of pools, reclaiming used memory when unused
   * capacity is not enough.
   *
   * @param targetBytes 0 to take as much as possible
   * @return bytes returned to the arbitrator
   */
  public abstract long shrinkCapacity(List<MemoryPool> pools, long targetBytes);

  public abstract Stats stats();

  @Override
  public String toString() {
    return String.format("ARBITRATOR[%s CAPACITY %s %s]",
        getKind(), ReservoirStringUtils.readable(capacity()), stats());
  }

  /**
   * Arbitrator settings. Zero transfer capacity or wait means no limit.
   */
  public static class Config {
    private final String kind;
    private final long capacity;
    private final long memoryPoolTransferCapacity;
    private final long memoryReclaimWaitMs;
    private final ArbitrationStateCheck stateCheck;

    private Config(Builder builder) {
      this.kind = builder.kind;
      this.capacity = builder.capacity;
      this.memoryPoolTransferCapacity = builder.memoryPoolTransferCapacity;
      this.memoryReclaimWaitMs = builder.memoryReclaimWaitMs;
      this.stateCheck = builder.stateCheck;
    }

    public static Builder builder() {
      return new Builder();
    }

    public String getKind() {
      return kind;
    }

    public long getCapacity() {
      return capacity;
    }

    public long getMemoryPoolTransferCapacity() {
      return memoryPoolTransferCapacity;
    }

    public long getMemoryReclaimWaitMs() {
      return memoryReclaimWaitMs;
    }

    /**
     * @return the state check, or null when requests are never cancelled
     */
    public ArbitrationStateCheck getStateCheck() {
      return stateCheck;
    }

    public static class Builder {
      private String kind = SHARED;
      private long capacity = MemoryPool.UNLIMITED_CAPACITY;
      private long memoryPoolTransferCapacity;
      private long memoryReclaimWaitMs;
      private ArbitrationStateCheck stateCheck;

      public Builder kind(String kind) {
        this.kind = kind;
        return this;
      }

      public Builder capacity(long capacity) {
        this.capacity = capacity;
        return this;
      }

      public Builder memoryPoolTransferCapacity(long bytes) {
        this.memoryPoolTransferCapacity = bytes;
        return this;
      }

      public Builder memoryReclaimWaitMs(long waitMs) {
        this.memoryReclaimWaitMs = waitMs;
        return this;
      }

      public Builder stateCheck(ArbitrationStateCheck stateCheck) {
        this.stateCheck = stateCheck;
        return this;
      }

      public Config build() {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(kind), "arbitrator kind must be non-empty");
        Preconditions.checkArgument(capacity >= 0, "arbitrator capacity must be non-negative: %s", capacity);
        Preconditions.checkArgument(memoryPoolTransferCapacity >= 0,
            "transfer capacity must be non-negative: %s", memoryPoolTransferCapacity);
        Preconditions.checkArgument(memoryReclaimWaitMs >= 0,
            "reclaim wait must be non-negative: %s", memoryReclaimWaitMs);
        return new Config(this);
      }
    }
  }

  /**
   * Counters since the arbitrator was created.
   */
  public static class Stats {
    private final long numRequests;
    private final long numSucceeded;
    private final long numAborted;
    private final long numFailures;
    private final long numShrunkBytes;
    private final long numReclaimedBytes;
    private final long freeCapacity;
    private final long maxCapacity;

    public Stats(long numRequests, long numSucceeded, long numAborted, long numFailures,
        long numShrunkBytes, long numReclaimedBytes, long freeCapacity, long maxCapacity) {
      this.numRequests = numRequests;
      this.numSucceeded = numSucceeded;
      this.numAborted = numAborted;
      this.numFailures = numFailures;
      this.numShrunkBytes = numShrunkBytes;
      this.numReclaimedBytes = numReclaimedBytes;
      this.freeCapacity = freeCapacity;
      this.maxCapacity = maxCapacity;
    }

    public long getNumRequests() {
      return numRequests;
    }

    public long getNumSucceeded() {
      return numSucceeded;
    }

    public long getNumAborted() {
      return numAborted;
    }

    public long getNumFailures() {
      return numFailures;
    }

    public long getNumShrunkBytes() {
      return numShrunkBytes;
    }

    public long getNumReclaimedBytes() {
      return numReclaimedBytes;
    }

    public long getFreeCapacity() {
      return freeCapacity;
    }

    public long getMaxCapacity() {
      return maxCapacity;
    }

    @Override
    public String toString() {
      return String.format("STATS[numRequests %d numSucceeded %d numAborted %d numFailures %d "
          + "numShrunkBytes %s numReclaimedBytes %s freeCapacity %s maxCapacity %s]",
          numRequests, numSucceeded, numAborted, numFailures,
          ReservoirStringUtils.readable(numShrunkBytes),
          ReservoirStringUtils.readable(numReclaimedBytes),
          ReservoirStringUtils.readable(freeCapacity),
          ReservoirStringUtils.readable(maxCapacity));
    }
  }
}

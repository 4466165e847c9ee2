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
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Preconditions;

/**
 * Arbitrator that doesn't arbitrate. Every root pool gets its whole max
 * capacity when it is created and capacity is never moved between pools, so
 * growth requests fail and shrinking frees nothing.
 */
public class NoopArbitrator extends MemoryArbitrator {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(NoopArbitrator.class);

  private final AtomicLong numRequests = new AtomicLong();
  private final AtomicLong numFailures = new AtomicLong();

  public NoopArbitrator(Config config) {
    super(config);
  }

  @Override
  public long growCapacity(MemoryPool pool, long targetBytes) {
    Preconditions.checkArgument(targetBytes >= 0, "growth target must be non-negative: %s", targetBytes);
    final long granted = pool.getMaxCapacity() - pool.getCapacity();
    if (granted > 0) {
      pool.grow(granted);
    }
    logger.debug("Granted memory pool {} its max capacity {}", pool.getName(), pool.getMaxCapacity());
    return granted;
  }

  @Override
  public boolean growCapacity(MemoryPool pool, List<MemoryPool> candidates, long targetBytes) {
    numRequests.incrementAndGet();
    if (targetBytes == 0) {
      return true;
    }
    numFailures.incrementAndGet();
    logger.debug("Can't grow memory pool {} by {} bytes beyond its max capacity {}",
        pool.getName(), targetBytes, pool.getMaxCapacity());
    return false;
  }

  @Override
  public long shrinkCapacity(MemoryPool pool, long targetBytes) {
    return 0;
  }

  @Override
  public long shrinkCapacity(List<MemoryPool> pools, long targetBytes) {
    return 0;
  }

  @Override
  public Stats stats() {
    final long numSucceeded = numRequests.get() - numFailures.get();
    return new Stats(numRequests.get(), numSucceeded, 0, numFailures.get(), 0, 0,
        config.getCapacity(), config.getCapacity());
  }
}

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
 * Creation options of a {@link MemoryPoolImpl}. Children copy the options of
 * their parent, except for thread safety which is chosen per leaf.
 */
public class MemoryPoolOptions {
  private final int alignment;
  private final long maxCapacity;
  private final boolean trackUsage;
  private final boolean threadSafe;
  private final boolean debugEnabled;
  private final boolean coreOnAllocationFailureEnabled;

  private MemoryPoolOptions(Builder builder) {
    this.alignment = builder.alignment;
    this.maxCapacity = builder.maxCapacity;
    this.trackUsage = builder.trackUsage;
    this.threadSafe = builder.threadSafe;
    this.debugEnabled = builder.debugEnabled;
    this.coreOnAllocationFailureEnabled = builder.coreOnAllocationFailureEnabled;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .alignment(alignment)
        .maxCapacity(maxCapacity)
        .trackUsage(trackUsage)
        .threadSafe(threadSafe)
        .debugEnabled(debugEnabled)
        .coreOnAllocationFailureEnabled(coreOnAllocationFailureEnabled);
  }

  public int getAlignment() {
    return alignment;
  }

  public long getMaxCapacity() {
    return maxCapacity;
  }

  public boolean isTrackUsage() {
    return trackUsage;
  }

  public boolean isThreadSafe() {
    return threadSafe;
  }

  public boolean isDebugEnabled() {
    return debugEnabled;
  }

  public boolean isCoreOnAllocationFailureEnabled() {
    return coreOnAllocationFailureEnabled;
  }

  public static class Builder {
    private int alignment = MemoryAllocator.MAX_ALIGNMENT;
    private long maxCapacity = MemoryPool.UNLIMITED_CAPACITY;
    private boolean trackUsage = true;
    private boolean threadSafe = true;
    private boolean debugEnabled;
    private boolean coreOnAllocationFailureEnabled;

    public Builder alignment(int alignment) {
      this.alignment = alignment;
      return this;
    }

    public Builder maxCapacity(long maxCapacity) {
      this.maxCapacity = maxCapacity;
      return this;
    }

    public Builder trackUsage(boolean trackUsage) {
      this.trackUsage = trackUsage;
      return this;
    }

    public Builder threadSafe(boolean threadSafe) {
      this.threadSafe = threadSafe;
      return this;
    }

    public Builder debugEnabled(boolean debugEnabled) {
      this.debugEnabled = debugEnabled;
      return this;
    }

    public Builder coreOnAllocationFailureEnabled(boolean enabled) {
      this.coreOnAllocationFailureEnabled = enabled;
      return this;
    }

    public MemoryPoolOptions build() {
      return new MemoryPoolOptions(this);
    }
  }
}

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

import io.netty.buffer.ByteBuf;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

import org.reservoir.common.HistoricalLog;
import org.reservoir.common.exceptions.UserException;
import org.reservoir.common.util.ReservoirStringUtils;
import org.reservoir.exec.exception.OutOfMemoryException;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * Default {@link MemoryPool}.
 * <p>Reservations are made at the root first, under the root's monitor, and
 * only then added to the intermediate pools and the leaf. When the root is out
 * of capacity it asks its {@link CapacityAuthority} for exactly the missing
 * bytes without holding any pool lock, and retries.</p>
 * <p>A leaf created with {@code threadSafe == false} does not synchronize its
 * own counter; its single user must not call it concurrently. Aggregate pools
 * always synchronize.</p>
 */
public class MemoryPoolImpl implements MemoryPool {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(MemoryPoolImpl.class);

  private static final AtomicInteger idGenerator = new AtomicInteger(0);
  private static final int MAX_LOG_RECORDS = 6;

  private final int id = idGenerator.incrementAndGet();
  private final String name;
  private final Kind kind;
  private final MemoryPoolImpl parent;
  private final MemoryPoolImpl root;
  private final MemoryReclaimer reclaimer;
  private final CapacityAuthority authority;
  private final MemoryAllocator allocator;
  private final MemoryPoolOptions options;
  private final HistoricalLog historicalLog;

  // guarded by itself; also guards 'closed' transitions
  private final Map<String, MemoryPoolImpl> children = new LinkedHashMap<>();

  // root only, guarded by this
  private volatile long capacity;

  // guarded by this, except for leaves that are not thread safe
  private volatile long currentBytes;
  private volatile long peakBytes;

  private volatile boolean closed;

  /**
   * @param parent null for a root pool; roots must be aggregate pools
   * @param authority where a root pool asks for capacity, null for pools
   *   that are never arbitrated (and for every non-root pool)
   */
  public MemoryPoolImpl(
      String name,
      Kind kind,
      MemoryPoolImpl parent,
      MemoryReclaimer reclaimer,
      CapacityAuthority authority,
      MemoryAllocator allocator,
      MemoryPoolOptions options) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "memory pool name must be non-empty");
    Preconditions.checkArgument(parent != null || kind == Kind.AGGREGATE,
        "root memory pool %s must be an aggregate pool", name);
    Preconditions.checkArgument(parent == null || authority == null,
        "only root memory pools talk to a capacity authority, got one for %s", name);
    Preconditions.checkArgument(options.getMaxCapacity() >= 0,
        "the maximum capacity of %s must be non-negative", name);
    MemoryAllocator.alignmentCheck(0, options.getAlignment());

    this.name = name;
    this.kind = Preconditions.checkNotNull(kind);
    this.parent = parent;
    this.root = parent == null ? this : parent.root;
    this.reclaimer = reclaimer;
    this.authority = authority;
    this.allocator = Preconditions.checkNotNull(allocator, "allocator must be non-null");
    this.options = options;

    if (options.isDebugEnabled()) {
      historicalLog = new HistoricalLog(MAX_LOG_RECORDS, "pool[%d] %s", id, name);
      historicalLog.recordEvent("created %s pool, max capacity %d", kind, options.getMaxCapacity());
    } else {
      historicalLog = null;
    }
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public Kind getKind() {
    return kind;
  }

  @Override
  public MemoryPool getParent() {
    return parent;
  }

  @Override
  public MemoryPool getRoot() {
    return root;
  }

  @Override
  public boolean isRoot() {
    return parent == null;
  }

  @Override
  public int getChildCount() {
    synchronized (children) {
      return children.size();
    }
  }

  @Override
  public void visitChildren(Predicate<MemoryPool> visitor) {
    for (MemoryPoolImpl child : childrenSnapshot()) {
      if (!visitor.test(child)) {
        return;
      }
    }
  }

  private List<MemoryPoolImpl> childrenSnapshot() {
    synchronized (children) {
      return new ArrayList<>(children.values());
    }
  }

  @Override
  public MemoryPool addLeafChild(String name, boolean threadSafe, MemoryReclaimer reclaimer) {
    return addChild(name, Kind.LEAF, threadSafe, reclaimer);
  }

  @Override
  public MemoryPool addAggregateChild(String name, MemoryReclaimer reclaimer) {
    return addChild(name, Kind.AGGREGATE, true, reclaimer);
  }

  private MemoryPoolImpl addChild(String childName, Kind childKind, boolean threadSafe,
      MemoryReclaimer childReclaimer) {
    Preconditions.checkState(kind == Kind.AGGREGATE,
        "Can't add child pool %s to leaf memory pool %s", childName, name);
    synchronized (children) {
      ensureOpen();
      if (children.containsKey(childName)) {
        throw UserException.validationError()
            .message("Child memory pool %s already exists in %s", childName, name)
            .build(logger);
      }
      final MemoryPoolImpl child = new MemoryPoolImpl(childName, childKind, this, childReclaimer, null,
          allocator, options.toBuilder().threadSafe(threadSafe).build());
      children.put(childName, child);
      record("added %s child %s", childKind, childName);
      return child;
    }
  }

  private void removeChild(MemoryPoolImpl child) {
    synchronized (children) {
      children.remove(child.name);
    }
  }

  @Override
  public long getMaxCapacity() {
    return options.getMaxCapacity();
  }

  @Override
  public long getCapacity() {
    return root.capacity;
  }

  @Override
  public long freeCapacity() {
    synchronized (root) {
      return Math.max(0, root.capacity - root.currentBytes);
    }
  }

  @Override
  public long getCurrentBytes() {
    return currentBytes;
  }

  @Override
  public long getPeakBytes() {
    return peakBytes;
  }

  @Override
  public int getAlignment() {
    return options.getAlignment();
  }

  @Override
  public boolean isThreadSafe() {
    return kind == Kind.AGGREGATE || options.isThreadSafe();
  }

  @Override
  public boolean isTrackingUsage() {
    return options.isTrackUsage();
  }

  @Override
  public void reserve(long bytes) {
    if (!maybeReserve(bytes)) {
      throw new OutOfMemoryException(createErrorMsg(bytes));
    }
  }

  @Override
  public boolean maybeReserve(long bytes) {
    Preconditions.checkArgument(bytes >= 0, "reservation size must be non-negative: %s", bytes);
    checkLeaf("reserve");
    ensureOpen();
    if (bytes == 0 || !options.isTrackUsage()) {
      return true;
    }

    if (!root.reserveCapacity(bytes)) {
      logger.debug("Memory pool {} failed to reserve {} bytes, root {} has {} of {} in use",
          name, bytes, root.name, root.currentBytes, root.capacity);
      return false;
    }
    for (MemoryPoolImpl pool = parent; pool != root; pool = pool.parent) {
      pool.addUsage(bytes);
    }
    if (options.isThreadSafe()) {
      synchronized (this) {
        addLeafUsage(bytes);
      }
    } else {
      addLeafUsage(bytes);
    }
    record("reserved %d", bytes);
    return true;
  }

  @Override
  public void release(long bytes) {
    Preconditions.checkArgument(bytes >= 0, "release size must be non-negative: %s", bytes);
    checkLeaf("release");
    if (bytes == 0 || !options.isTrackUsage()) {
      return;
    }

    if (options.isThreadSafe()) {
      synchronized (this) {
        removeLeafUsage(bytes);
      }
    } else {
      removeLeafUsage(bytes);
    }
    for (MemoryPoolImpl pool = parent; pool != null; pool = pool.parent) {
      pool.addUsage(-bytes);
    }
    record("released %d", bytes);
  }

  private void addLeafUsage(long bytes) {
    currentBytes += bytes;
    peakBytes = Math.max(peakBytes, currentBytes);
  }

  private void removeLeafUsage(long bytes) {
    Preconditions.checkState(currentBytes >= bytes,
        "Releasing %s bytes from memory pool %s which only has %s reserved", bytes, name, currentBytes);
    currentBytes -= bytes;
  }

  private synchronized void addUsage(long delta) {
    currentBytes += delta;
    if (delta > 0) {
      peakBytes = Math.max(peakBytes, currentBytes);
    }
  }

  /**
   * Reserve at the root, asking the authority for the shortfall when needed.
   * Never holds the monitor while growth is requested.
   */
  private boolean reserveCapacity(long bytes) {
    while (true) {
      final long needed;
      synchronized (this) {
        final long free = capacity - currentBytes;
        if (free >= bytes) {
          currentBytes += bytes;
          peakBytes = Math.max(peakBytes, currentBytes);
          return true;
        }
        needed = bytes - free;
        if (options.getMaxCapacity() - capacity < needed) {
          logger.debug("Memory pool {} can't grow by {} bytes beyond its max capacity {}",
              name, needed, options.getMaxCapacity());
          return false;
        }
      }
      if (authority == null || !authority.requestGrowth(this, needed)) {
        return false;
      }
    }
  }

  @Override
  public ByteBuf allocate(int size) {
    Preconditions.checkArgument(size >= 0, "allocation size must be non-negative: %s", size);
    checkLeaf("allocate");
    final long reservation = MemoryAllocator.alignedSize(size, options.getAlignment());
    if (!maybeReserve(reservation)) {
      final String message = createErrorMsg(size);
      handleAllocationFailure(message);
      throw new OutOfMemoryException(message);
    }

    try {
      return allocator.allocate(size);
    } catch (OutOfMemoryException e) {
      release(reservation);
      handleAllocationFailure(e.getMessage());
      throw e;
    }
  }

  @Override
  public void free(ByteBuf buf) {
    checkLeaf("free");
    final int size = buf.capacity();
    allocator.free(buf);
    release(MemoryAllocator.alignedSize(size, options.getAlignment()));
  }

  private void handleAllocationFailure(String message) {
    if (options.isCoreOnAllocationFailureEnabled()) {
      logger.error("{}\nMemory usage of {}:\n{}", message, root.name, root.treeMemoryUsage());
    } else {
      logger.debug(message);
    }
  }

  @Override
  public MemoryReclaimer getReclaimer() {
    return reclaimer;
  }

  @Override
  public long reclaimableBytes() {
    if (closed) {
      return 0;
    }
    if (reclaimer != null) {
      return reclaimer.reclaimableBytes(this);
    }
    long reclaimable = 0;
    for (MemoryPoolImpl child : childrenSnapshot()) {
      reclaimable += child.reclaimableBytes();
    }
    return reclaimable;
  }

  @Override
  public long reclaim(long targetBytes, long maxWaitMs) {
    Preconditions.checkArgument(targetBytes >= 0, "reclaim target must be non-negative: %s", targetBytes);
    if (closed || targetBytes == 0) {
      return 0;
    }
    if (reclaimer != null) {
      final long freed = reclaimer.reclaim(this, targetBytes, maxWaitMs);
      record("reclaimed %d of %d", freed, targetBytes);
      return freed;
    }
    long freed = 0;
    for (MemoryPoolImpl child : childrenSnapshot()) {
      if (freed >= targetBytes) {
        break;
      }
      freed += child.reclaim(targetBytes - freed, maxWaitMs);
    }
    return freed;
  }

  @Override
  public long grow(long bytes) {
    Preconditions.checkState(isRoot(), "Only root memory pools can grow, %s is not one", name);
    Preconditions.checkArgument(bytes >= 0, "growth must be non-negative: %s", bytes);
    final long newCapacity;
    synchronized (this) {
      Preconditions.checkState(options.getMaxCapacity() - capacity >= bytes,
          "Memory pool %s can't grow by %s bytes beyond its max capacity %s", name, bytes, options.getMaxCapacity());
      capacity += bytes;
      newCapacity = capacity;
    }
    record("grew by %d to %d", bytes, newCapacity);
    return newCapacity;
  }

  @Override
  public long shrink(long targetBytes) {
    Preconditions.checkState(isRoot(), "Only root memory pools can shrink, %s is not one", name);
    Preconditions.checkArgument(targetBytes >= 0, "shrink target must be non-negative: %s", targetBytes);
    final long shrunk;
    synchronized (this) {
      final long unused = Math.max(0, capacity - currentBytes);
      shrunk = targetBytes == 0 ? unused : Math.min(unused, targetBytes);
      capacity -= shrunk;
    }
    if (shrunk > 0) {
      record("shrunk by %d", shrunk);
    }
    return shrunk;
  }

  @Override
  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    synchronized (children) {
      if (closed) {
        logger.warn("Tried to close memory pool {}, but it has already been closed", name);
        return;
      }
      if (!children.isEmpty()) {
        throw new IllegalStateException(String.format(
            "Failure while trying to close memory pool %s: child pools not closed: %s", name, children.keySet()));
      }
      if (options.isTrackUsage() && currentBytes != 0) {
        final StringBuilder sb = new StringBuilder();
        sb.append(String.format("Memory leaked: memory pool %s still has %d bytes reserved on close.",
            name, currentBytes));
        if (historicalLog != null) {
          historicalLog.buildHistory(sb, toString());
        }
        final String message = sb.toString();
        logger.error(message);
        throw new IllegalStateException(message);
      }
      closed = true;
    }

    record("closed");
    if (parent != null) {
      parent.removeChild(this);
    }
    if (authority != null) {
      authority.notifyDestroyed(this);
    }
  }

  @Override
  public String treeMemoryUsage() {
    final StringBuilder sb = new StringBuilder();
    appendTree(sb, 0);
    return sb.toString();
  }

  private void appendTree(StringBuilder sb, int depth) {
    for (int i = 0; i < depth; i++) {
      sb.append("    ");
    }
    sb.append(name)
        .append(" usage ").append(ReservoirStringUtils.readable(currentBytes))
        .append(" peak ").append(ReservoirStringUtils.readable(peakBytes));
    if (isRoot()) {
      sb.append(" capacity ").append(ReservoirStringUtils.readable(capacity))
          .append(" max ").append(ReservoirStringUtils.readable(options.getMaxCapacity()));
    }
    sb.append('\n');
    for (MemoryPoolImpl child : childrenSnapshot()) {
      child.appendTree(sb, depth + 1);
    }
  }

  private void checkLeaf(String operation) {
    Preconditions.checkState(kind == Kind.LEAF,
        "Can't %s on aggregate memory pool %s", operation, name);
  }

  private void ensureOpen() {
    Preconditions.checkState(!closed, "Memory pool %s is already closed", name);
  }

  private void record(String noteFormat, Object... args) {
    if (historicalLog != null) {
      historicalLog.recordEvent(noteFormat, args);
    }
  }

  private String createErrorMsg(long size) {
    return String.format("Unable to reserve %d bytes in memory pool %s due to memory limit. "
        + "Current usage: %d, root %s usage: %d, capacity: %d, max capacity: %d",
        size, name, currentBytes, root.name, root.currentBytes, root.capacity, options.getMaxCapacity());
  }

  @Override
  public String toString() {
    return String.format("Memory Pool[%s %s usage %s peak %s capacity %s%s]",
        name, kind,
        ReservoirStringUtils.readable(currentBytes),
        ReservoirStringUtils.readable(peakBytes),
        ReservoirStringUtils.readable(getCapacity()),
        options.isThreadSafe() ? "" : " not thread safe");
  }
}

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
package org.reservoir.common;

import java.util.ArrayDeque;
import java.util.Deque;

import org.slf4j.Logger;

/**
 * Bounded record of events that happened to an object, kept for debugging.
 * The first event (usually the creation site) is always retained; after that
 * only the most recent {@code limit} events are kept.
 */
public class HistoricalLog {
  private static class Event {
    private final long timestamp;
    private final String note;
    private final StackTrace stackTrace;

    Event(final String note) {
      this.timestamp = System.currentTimeMillis();
      this.note = note;
      this.stackTrace = new StackTrace();
    }
  }

  private final Deque<Event> history = new ArrayDeque<>();
  private final String idString;
  private final int limit;
  private final int framesPerEvent;
  private Event firstEvent;

  /**
   * @param limit maximum number of events kept, not counting the first one
   * @param framesPerEvent number of stack frames printed per event
   * @param idStringFormat {@link String#format} pattern identifying the owner
   * @param args arguments for the pattern
   */
  public HistoricalLog(final int limit, final int framesPerEvent,
      final String idStringFormat, final Object... args) {
    this.limit = limit;
    this.framesPerEvent = framesPerEvent;
    this.idString = String.format(idStringFormat, args);
  }

  public HistoricalLog(final int limit, final String idStringFormat, final Object... args) {
    this(limit, 8, idStringFormat, args);
  }

  /**
   * Record an event along with the stack it was recorded from.
   */
  public synchronized void recordEvent(final String noteFormat, final Object... args) {
    final Event event = new Event(String.format(noteFormat, args));
    if (firstEvent == null) {
      firstEvent = event;
      return;
    }
    if (history.size() == limit) {
      history.removeFirst();
    }
    history.addLast(event);
  }

  public synchronized int size() {
    return (firstEvent == null ? 0 : 1) + history.size();
  }

  /**
   * Write the identifier and every retained event to the builder.
   *
   * @param sb where to write
   * @param additional optional current state written under the identifier
   */
  public synchronized void buildHistory(final StringBuilder sb, final CharSequence additional) {
    sb.append('\n').append(idString);
    if (additional != null) {
      sb.append('\n').append(additional).append('\n');
    }
    sb.append(" event log\n");

    if (firstEvent != null) {
      appendEvent(sb, firstEvent);
      for (final Event event : history) {
        appendEvent(sb, event);
      }
    }
  }

  private void appendEvent(final StringBuilder sb, final Event event) {
    sb.append("  [")
        .append(event.timestamp)
        .append("] ")
        .append(event.note)
        .append('\n');
    event.stackTrace.writeToBuilder(sb, 4, framesPerEvent);
  }

  public void logHistory(final Logger logger, final CharSequence additional) {
    final StringBuilder sb = new StringBuilder();
    buildHistory(sb, additional);
    logger.debug(sb.toString());
  }
}

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

import java.util.Arrays;

/**
 * Captured stack of the current thread, used to tag debugging events with
 * the place they came from.
 */
public class StackTrace {
  private final StackTraceElement[] stackTraceElements;

  /**
   * Captures the current stack trace, skipping the frames of this constructor
   * and of {@link Thread#getStackTrace()}.
   */
  public StackTrace() {
    final StackTraceElement[] stack = Thread.currentThread().getStackTrace();
    stackTraceElements = stack.length > 2
        ? Arrays.copyOfRange(stack, 2, stack.length)
        : new StackTraceElement[0];
  }

  /**
   * Write the stack trace to a builder, one frame per line.
   *
   * @param sb where to write
   * @param indent number of spaces in front of each frame
   * @param maxFrames maximum number of frames to write
   */
  public void writeToBuilder(final StringBuilder sb, final int indent, final int maxFrames) {
    final char[] indentation = new char[indent];
    Arrays.fill(indentation, ' ');

    final int frames = Math.min(maxFrames, stackTraceElements.length);
    for (int i = 0; i < frames; i++) {
      final StackTraceElement ste = stackTraceElements[i];
      sb.append(indentation)
          .append(ste.getClassName())
          .append('.')
          .append(ste.getMethodName())
          .append(':')
          .append(ste.getLineNumber())
          .append('\n');
    }
  }

  public void writeToBuilder(final StringBuilder sb, final int indent) {
    writeToBuilder(sb, indent, Integer.MAX_VALUE);
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder();
    writeToBuilder(sb, 0);
    return sb.toString();
  }
}

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
import java.util.Collection;

/**
 * Utilities for closing groups of {@link AutoCloseable}s.
 */
public class AutoCloseables {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(AutoCloseables.class);

  private AutoCloseables() {
  }

  /**
   * Closes every non-null closeable. The first failure is rethrown after all
   * closeables have been visited, later ones are attached as suppressed.
   */
  public static void close(final Iterable<? extends AutoCloseable> closeables) throws Exception {
    Exception topLevelException = null;
    for (final AutoCloseable closeable : closeables) {
      if (closeable == null) {
        continue;
      }
      try {
        closeable.close();
      } catch (Exception e) {
        if (topLevelException == null) {
          topLevelException = e;
        } else {
          topLevelException.addSuppressed(e);
        }
      }
    }
    if (topLevelException != null) {
      throw topLevelException;
    }
  }

  public static void close(final AutoCloseable... closeables) throws Exception {
    close(Arrays.asList(closeables));
  }

  /**
   * Closes every closeable and attaches failures to an exception that is
   * already propagating.
   */
  public static void close(final Throwable t, final Collection<? extends AutoCloseable> closeables) {
    try {
      close(closeables);
    } catch (Exception e) {
      logger.debug("Suppressing failure while closing after {}", t.toString(), e);
      t.addSuppressed(e);
    }
  }
}

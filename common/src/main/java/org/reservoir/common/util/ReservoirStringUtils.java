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
package org.reservoir.common.util;

import java.util.Locale;

public class ReservoirStringUtils {

  private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB", "PB", "EB"};

  private ReservoirStringUtils() {
  }

  /**
   * Human readable byte count with two decimals, e.g. {@code 1.50MB}.
   * Negative values keep their sign.
   */
  public static String readable(long bytes) {
    if (bytes == Long.MAX_VALUE) {
      return "UNLIMITED";
    }
    if (bytes < 0) {
      return "-" + readable(bytes == Long.MIN_VALUE ? Long.MAX_VALUE - 1 : -bytes);
    }
    if (bytes < 1024) {
      return bytes + UNITS[0];
    }
    int unit = 0;
    double value = bytes;
    while (value >= 1024 && unit < UNITS.length - 1) {
      value /= 1024;
      unit++;
    }
    return String.format(Locale.ROOT, "%.2f%s", value, UNITS[unit]);
  }
}

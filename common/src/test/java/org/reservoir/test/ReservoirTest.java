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
package org.reservoir.test;

import org.junit.AfterClass;
import org.junit.Rule;
import org.junit.rules.TestName;
import org.junit.rules.TestRule;
import org.junit.rules.TestWatcher;
import org.junit.runner.Description;
import org.slf4j.Logger;

/**
 * Base class for Reservoir unit tests: applies a timeout to every test and
 * reports outcomes to the {@code org.reservoir.TestReporter} logger.
 */
public class ReservoirTest {
  static final Logger testReporter = org.slf4j.LoggerFactory.getLogger("org.reservoir.TestReporter");
  static final TestLogReporter LOG_OUTCOME = new TestLogReporter();

  static String className;

  @Rule public final TestRule TIMEOUT = TestTools.getTimeoutRule(50000);
  @Rule public final TestLogReporter logOutcome = LOG_OUTCOME;
  @Rule public TestName TEST_NAME = new TestName();

  @AfterClass
  public static void finiReservoirTest() {
    testReporter.info("Test Class done: {}, {} failure(s).", className, LOG_OUTCOME.failureCount);
    LOG_OUTCOME.failureCount = 0;
  }

  private static class TestLogReporter extends TestWatcher {
    private long start;
    private int failureCount = 0;

    @Override
    protected void starting(Description description) {
      className = description.getClassName();
      start = System.nanoTime();
    }

    @Override
    protected void failed(Throwable e, Description description) {
      testReporter.error(String.format("Test Failed (%d ms): %s", elapsedMillis(), description.getDisplayName()), e);
      failureCount++;
    }

    @Override
    protected void succeeded(Description description) {
      testReporter.info("Test Succeeded ({} ms): {}", elapsedMillis(), description.getDisplayName());
    }

    private long elapsedMillis() {
      return (System.nanoTime() - start) / 1_000_000;
    }
  }
}

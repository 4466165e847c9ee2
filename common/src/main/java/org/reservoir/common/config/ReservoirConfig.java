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
package org.reservoir.common.config;

import java.io.IOException;
import java.net.URL;
import java.time.Duration;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Map.Entry;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import org.reservoir.common.exceptions.UserException;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;

/**
 * Layered Typesafe configuration for Reservoir. Values are resolved in this
 * order of precedence, highest first:
 * <ul>
 * <li>properties handed to {@link #create(Properties)} (tests only)</li>
 * <li>JVM system properties</li>
 * <li>{@code reservoir-override.conf}, or the resource passed to
 *     {@link #create(String)}</li>
 * <li>every {@code reservoir-module.conf} found on the classpath</li>
 * <li>{@code reservoir-default.conf}</li>
 * </ul>
 */
public class ReservoirConfig {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ReservoirConfig.class);

  /** Value accepted by {@link #getBytesOrUnlimited(String)} to mean no limit. */
  public static final String UNLIMITED = "unlimited";

  private final Config config;

  @VisibleForTesting
  public ReservoirConfig(Config config) {
    this.config = config;
    logger.trace("Given Config object is:\n{}", config.root().render(ConfigRenderOptions.concise()));
  }

  public static ReservoirConfig create() {
    return create(null, null);
  }

  public static ReservoirConfig create(String overrideFileResourcePathname) {
    return create(overrideFileResourcePathname, null);
  }

  /**
   * <b><u>Do not use this method outside of test code.</u></b>
   */
  @VisibleForTesting
  public static ReservoirConfig create(Properties testConfigurations) {
    return create(null, testConfigurations);
  }

  public static ReservoirConfig create(Config config) {
    return new ReservoirConfig(config.resolve());
  }

  private static ReservoirConfig create(String overrideFileResourcePathname, Properties overriderProps) {
    final StringBuilder logString = new StringBuilder();
    final Stopwatch watch = Stopwatch.createStarted();
    final String overridePath = overrideFileResourcePathname == null
        ? CommonConstants.CONFIG_OVERRIDE_RESOURCE_PATHNAME
        : overrideFileResourcePathname;
    final ClassLoader classLoader = Thread.currentThread().getContextClassLoader();

    // 1. defaults
    Config fallback = ConfigFactory.parseResources(classLoader, CommonConstants.CONFIG_DEFAULT_RESOURCE_PATHNAME);
    logString.append("Base Configuration:\n\t- ")
        .append(classLoader.getResource(CommonConstants.CONFIG_DEFAULT_RESOURCE_PATHNAME))
        .append('\n');

    // 2. per-module files
    logString.append("Module Configuration files:\n");
    for (URL url : moduleConfigUrls(classLoader)) {
      logString.append("\t- ").append(url).append('\n');
      fallback = ConfigFactory.parseURL(url).withFallback(fallback);
    }

    // 3. override file, then system properties
    final URL overrideFileUrl = classLoader.getResource(overridePath);
    if (overrideFileUrl != null) {
      logString.append("Override File: ").append(overrideFileUrl).append('\n');
    }
    Config effectiveConfig = ConfigFactory.systemProperties()
        .withFallback(ConfigFactory.parseResources(classLoader, overridePath))
        .withFallback(fallback);

    // 4. explicit overrides
    if (overriderProps != null) {
      logString.append("Overridden Properties:\n");
      for (Entry<Object, Object> entry : overriderProps.entrySet()) {
        logString.append("\t-").append(entry.getKey()).append(" = ").append(entry.getValue()).append('\n');
      }
      effectiveConfig = ConfigFactory.parseProperties(overriderProps).withFallback(effectiveConfig);
    }

    logger.info("Configuration file(s) identified in {}ms.\n{}",
        watch.elapsed(TimeUnit.MILLISECONDS), logString);
    return new ReservoirConfig(effectiveConfig.resolve());
  }

  private static List<URL> moduleConfigUrls(ClassLoader classLoader) {
    try {
      final Enumeration<URL> urls = classLoader.getResources(CommonConstants.MODULE_CONFIG_RESOURCE_PATHNAME);
      return Collections.list(urls);
    } catch (IOException e) {
      throw UserException.systemError(e)
          .message("Failure while scanning the classpath for %s files.",
              CommonConstants.MODULE_CONFIG_RESOURCE_PATHNAME)
          .build(logger);
    }
  }

  public boolean hasPath(String path) {
    return config.hasPath(path);
  }

  public boolean getBoolean(String path) {
    return config.getBoolean(path);
  }

  public int getInt(String path) {
    return config.getInt(path);
  }

  public long getLong(String path) {
    return config.getLong(path);
  }

  public String getString(String path) {
    return config.getString(path);
  }

  /**
   * Size in bytes; accepts plain numbers and HOCON size units ({@code 512M}).
   */
  public long getBytes(String path) {
    return config.getBytes(path);
  }

  /**
   * Same as {@link #getBytes(String)}, but also accepts {@value #UNLIMITED},
   * returned as {@link Long#MAX_VALUE}.
   */
  public long getBytesOrUnlimited(String path) {
    try {
      if (UNLIMITED.equalsIgnoreCase(config.getString(path).trim())) {
        return Long.MAX_VALUE;
      }
    } catch (ConfigException.WrongType e) {
      // not a string, fall through to the size parser
      logger.trace("Value at {} is not a string", path);
    }
    return config.getBytes(path);
  }

  public Duration getDuration(String path) {
    return config.getDuration(path);
  }

  public Config getInnerConfig() {
    return config;
  }

  @Override
  public String toString() {
    return config.root().render();
  }
}

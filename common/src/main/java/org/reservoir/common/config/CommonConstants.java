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

public interface CommonConstants {
  String CONFIG_DEFAULT_RESOURCE_PATHNAME = "reservoir-default.conf";
  String CONFIG_OVERRIDE_RESOURCE_PATHNAME = "reservoir-override.conf";

  /** Every module ships one of these with its own defaults. */
  String MODULE_CONFIG_RESOURCE_PATHNAME = "reservoir-module.conf";
}

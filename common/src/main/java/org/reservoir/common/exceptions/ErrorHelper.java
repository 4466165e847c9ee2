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
package org.reservoir.common.exceptions;

/**
 * Helpers for walking exception cause chains.
 */
public class ErrorHelper {

  private ErrorHelper() {
  }

  /**
   * @return the message of the innermost cause, prefixed with its class name
   */
  static String getRootMessage(final Throwable t) {
    if (t == null) {
      return null;
    }
    Throwable ex = t;
    while (ex.getCause() != null && ex.getCause() != ex) {
      ex = ex.getCause();
    }
    return ex.getClass().getSimpleName() + ": " + ex.getMessage();
  }

  static String buildCausesMessage(final Throwable t) {
    final StringBuilder sb = new StringBuilder();
    Throwable ex = t;
    boolean cause = false;
    while (ex != null) {
      sb.append("  ");
      if (cause) {
        sb.append("Caused By ");
      }
      sb.append('(').append(ex.getClass().getCanonicalName()).append(") ")
          .append(ex.getMessage()).append('\n');
      for (StackTraceElement st : ex.getStackTrace()) {
        sb.append("    ").append(st.getClassName()).append('.')
            .append(st.getMethodName()).append("():").append(st.getLineNumber()).append('\n');
      }
      cause = true;
      ex = ex.getCause() != null && ex.getCause() != ex ? ex.getCause() : null;
    }
    return sb.toString();
  }

  /**
   * searches for a UserException wrapped inside the exception
   * @return null if exception is null or no UserException was found
   */
  static UserException findWrappedUserException(Throwable ex) {
    if (ex == null) {
      return null;
    }
    Throwable cause = ex;
    while (!(cause instanceof UserException)) {
      if (cause.getCause() != null && cause.getCause() != cause) {
        cause = cause.getCause();
      } else {
        return null;
      }
    }
    return (UserException) cause;
  }
}

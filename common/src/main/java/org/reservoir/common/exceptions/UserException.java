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

import org.slf4j.Logger;

/**
 * Failure surfaced to the caller of a Reservoir API. Carries an
 * {@link ErrorType} and a list of context lines; built through {@link Builder}
 * so that every new exception is logged once where it is created.
 * <p>Wrapping an exception that already is, or wraps, a user exception returns
 * that exception instead of creating a new one; context added through the
 * builder then goes to the existing exception.
 */
public class UserException extends ReservoirRuntimeException {
  private static final long serialVersionUID = -6720929331624621840L;

  public static Builder validationError() {
    return validationError(null);
  }

  public static Builder validationError(final Throwable cause) {
    return new Builder(ErrorType.VALIDATION, cause);
  }

  public static Builder resourceError() {
    return resourceError(null);
  }

  public static Builder resourceError(final Throwable cause) {
    return new Builder(ErrorType.RESOURCE, cause);
  }

  public static Builder internalError() {
    return internalError(null);
  }

  public static Builder internalError(final Throwable cause) {
    return new Builder(ErrorType.INTERNAL_ERROR, cause);
  }

  /**
   * Wraps the passed exception inside a system error. The root cause message
   * is always used.
   */
  public static Builder systemError(final Throwable cause) {
    return new Builder(ErrorType.SYSTEM, cause);
  }

  public static class Builder {

    private final Throwable cause;
    private final ErrorType errorType;
    private final UserException uex;
    private final UserExceptionContext context;

    private String message;

    private Builder(final ErrorType errorType, final Throwable cause) {
      this.cause = cause;

      uex = ErrorHelper.findWrappedUserException(cause);
      if (uex != null) {
        this.errorType = null;
        this.context = uex.context;
      } else {
        this.errorType = errorType;
        this.context = new UserExceptionContext();
        this.message = cause != null ? cause.getMessage() : null;
      }
    }

    /**
     * sets or replaces the error message; ignored if this builder wraps an
     * existing user exception.
     */
    public Builder message(final String format, final Object... args) {
      if (uex == null && format != null) {
        this.message = args.length == 0 ? format : String.format(format, args);
      }
      return this;
    }

    public Builder addContext(final String value) {
      context.add(value);
      return this;
    }

    public Builder addContext(final String name, final String value) {
      context.add(name, value);
      return this;
    }

    public Builder addContext(final String name, final long value) {
      context.add(name, value);
      return this;
    }

    public Builder pushContext(final String value) {
      context.push(value);
      return this;
    }

    public Builder pushContext(final String name, final String value) {
      context.push(name, value);
      return this;
    }

    /**
     * builds a user exception, or returns the wrapped one, and logs it:
     * system errors at error level, everything else at info.
     */
    public UserException build(final Logger logger) {
      if (uex != null) {
        return uex;
      }

      final boolean isSystemError = errorType == ErrorType.SYSTEM;
      if (isSystemError) {
        message = ErrorHelper.getRootMessage(cause);
      }

      final UserException newException = new UserException(this);
      if (isSystemError) {
        logger.error(newException.getMessage(), newException);
      } else {
        logger.info("User Error Occurred: {}", newException.getMessage(), newException);
      }
      return newException;
    }
  }

  private final ErrorType errorType;
  private final UserExceptionContext context;

  private UserException(final Builder builder) {
    super(builder.message, builder.cause);
    this.errorType = builder.errorType;
    this.context = builder.context;
  }

  public ErrorType getErrorType() {
    return errorType;
  }

  public UserExceptionContext getContext() {
    return context;
  }

  public String getErrorId() {
    return context.getErrorId();
  }

  /**
   * @return the message that was passed to the builder, without type or context
   */
  public String getOriginalMessage() {
    return super.getMessage();
  }

  @Override
  public String getMessage() {
    return errorType + " ERROR: " + super.getMessage() + "\n\n" + context.generateContextMessage(true);
  }

  public String getVerboseMessage() {
    return getMessage() + "\n\n" + ErrorHelper.buildCausesMessage(getCause());
  }
}

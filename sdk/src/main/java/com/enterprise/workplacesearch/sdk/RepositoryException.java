/*
 * Copyright © 2017 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.enterprise.workplacesearch.sdk;

import com.google.common.base.MoreObjects;
import java.io.IOException;
import java.util.Optional;

/**
 * An exception that is thrown for fatal errors while reading from the source repository or
 * writing to the search index.
 */
public class RepositoryException extends IOException {

  private final Optional<Integer> errorCode;
  private final ErrorType errorType;

  /** Error categories reported in logs and in the run summary. */
  public enum ErrorType {
    UNKNOWN,
    CONNECTION_ERROR,
    AUTHENTICATION_ERROR,
    CLIENT_ERROR,
    SERVER_ERROR,
    PARSE_ERROR
  }

  private RepositoryException(Builder builder) {
    super(builder.message, builder.cause);
    this.errorType = builder.errorType;
    this.errorCode = builder.errorCode;
  }

  /** Returns the HTTP status code of the failed call, if there was one. */
  public Optional<Integer> getErrorCode() {
    return errorCode;
  }

  /** Returns the error category. */
  public ErrorType getErrorType() {
    return errorType;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("type", errorType)
        .add("code", errorCode.orElse(null))
        .add("message", getMessage())
        .add("cause", getCause())
        .toString();
  }

  /** Builder for creating {@link RepositoryException} */
  public static class Builder {
    private String message;
    private Throwable cause;
    private Optional<Integer> errorCode = Optional.empty();
    private ErrorType errorType = ErrorType.UNKNOWN;

    /** Sets error message for exception. */
    public Builder setErrorMessage(String errorMessage) {
      this.message = errorMessage;
      return this;
    }

    /** Sets error type for exception. */
    public Builder setErrorType(ErrorType errorType) {
      this.errorType = errorType == null ? ErrorType.UNKNOWN : errorType;
      return this;
    }

    /** Sets {@code cause} for exception. */
    public Builder setCause(Throwable cause) {
      this.cause = cause;
      return this;
    }

    /** Sets the HTTP status code of the failed call. */
    public Builder setErrorCode(int errorCode) {
      this.errorCode = Optional.of(errorCode);
      return this;
    }

    /** Builds an instance of {@link RepositoryException} */
    public RepositoryException build() {
      return new RepositoryException(this);
    }
  }
}

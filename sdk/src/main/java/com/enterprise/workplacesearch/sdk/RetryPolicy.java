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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.enterprise.workplacesearch.sdk.config.Configuration;
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.util.BackOff;
import com.google.api.client.util.ExponentialBackOff;
import com.google.api.client.util.Sleeper;
import java.io.IOException;
import java.util.concurrent.Callable;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Policy used to retry calls that fail with recoverable errors.
 *
 * <p>A policy combines an exception classifier, an exponential back-off schedule and a maximum
 * number of attempts. By default a failure is transient when it is an {@link IOException} that
 * is not an {@link HttpResponseException}, that is a connection error or a timeout. HTTP error
 * responses are never retried here.
 */
public class RetryPolicy {
  private static final Logger logger = Logger.getLogger(RetryPolicy.class.getName());

  public static final String CONFIG_RETRY_COUNT = "connector.retryCount";
  public static final int DEFAULT_RETRY_COUNT = 3;

  /** Connection failures and timeouts, excluding HTTP error responses. */
  public static final Predicate<Exception> TRANSIENT_IO_ERRORS =
      e -> e instanceof IOException && !(e instanceof HttpResponseException);

  private final int maxAttempts;
  private final BackOffFactory backOffFactory;
  private final Predicate<Exception> transientErrors;
  private final Sleeper sleeper;

  private RetryPolicy(Builder builder) {
    this.maxAttempts = builder.maxAttempts;
    this.backOffFactory = builder.backOffFactory;
    this.transientErrors = builder.transientErrors;
    this.sleeper = builder.sleeper;
  }

  /**
   * Creates a retry policy from the connector configuration.
   *
   * <ul>
   *   <li>{@code connector.retryCount=3} - maximum number of attempts for a call that keeps
   *       failing with transient errors.
   * </ul>
   */
  public static RetryPolicy fromConfiguration() {
    checkState(Configuration.isInitialized(), "config not initialized");
    int retryCount = Configuration.getInteger(CONFIG_RETRY_COUNT, DEFAULT_RETRY_COUNT).get();
    Configuration.checkConfiguration(
        retryCount > 0, "%s must be greater than 0, was %s", CONFIG_RETRY_COUNT, retryCount);
    return new Builder().setMaxAttempts(retryCount).build();
  }

  /** Creates an instance of {@link BackOff} */
  public interface BackOffFactory {
    /** Returns a fresh {@link BackOff} for one retried call. */
    BackOff createBackOffInstance();
  }

  /** {@link ExponentialBackOff} with an initial delay of 1 second and a multiplier of 2. */
  public static class DefaultBackOffFactoryImpl implements BackOffFactory {
    public static final int INITIAL_DELAY_SECONDS = 1;
    public static final double MULTIPLIER = 2;

    @Override
    public BackOff createBackOffInstance() {
      return new ExponentialBackOff.Builder()
          .setInitialIntervalMillis(INITIAL_DELAY_SECONDS * 1000)
          .setMultiplier(MULTIPLIER)
          .build();
    }
  }

  /**
   * Runs {@code call}, retrying transient failures until the attempt budget is spent.
   *
   * @param operation name used in log messages
   * @param call the work to run
   * @return the result of the first successful attempt
   * @throws RetryCountExceededException if every attempt failed with a transient error
   * @throws IOException for the first non-transient I/O failure
   */
  public <T> T call(String operation, Callable<T> call) throws IOException {
    BackOff backOff = backOffFactory.createBackOffInstance();
    Exception lastFailure = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        return call.call();
      } catch (Exception e) {
        if (!transientErrors.test(e)) {
          throw propagate(e);
        }
        lastFailure = e;
        logger.log(
            Level.WARNING,
            String.format(
                "Attempt %d of %d for [%s] failed: %s", attempt, maxAttempts, operation, e));
        if (attempt < maxAttempts) {
          pause(backOff, operation);
        }
      }
    }
    throw new RetryCountExceededException(operation, maxAttempts, lastFailure);
  }

  private void pause(BackOff backOff, String operation) throws IOException {
    long delay = backOff.nextBackOffMillis();
    if (delay == BackOff.STOP) {
      return;
    }
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while retrying " + operation, e);
    }
  }

  private static IOException propagate(Exception e) {
    if (e instanceof IOException) {
      return (IOException) e;
    }
    if (e instanceof RuntimeException) {
      throw (RuntimeException) e;
    }
    return new IOException(e);
  }

  /** Maximum number of attempts for one call. */
  public int getMaxAttempts() {
    return maxAttempts;
  }

  public BackOffFactory getBackOffFactory() {
    return backOffFactory;
  }

  /** Returns true if {@code e} would be retried by this policy. */
  public boolean isTransient(Exception e) {
    return transientErrors.test(e);
  }

  /** Builder for creating an instance of {@link RetryPolicy} */
  public static final class Builder {
    private BackOffFactory backOffFactory = new DefaultBackOffFactoryImpl();
    private int maxAttempts = DEFAULT_RETRY_COUNT;
    private Predicate<Exception> transientErrors = TRANSIENT_IO_ERRORS;
    private Sleeper sleeper = Sleeper.DEFAULT;

    public Builder setMaxAttempts(int maxAttempts) {
      checkArgument(maxAttempts > 0, "maxAttempts must be greater than 0");
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder setBackOffFactory(BackOffFactory factory) {
      this.backOffFactory = checkNotNull(factory);
      return this;
    }

    /** Sets the classifier deciding which failures are retried. */
    public Builder setTransientErrors(Predicate<Exception> transientErrors) {
      this.transientErrors = checkNotNull(transientErrors);
      return this;
    }

    public Builder setSleeper(Sleeper sleeper) {
      this.sleeper = checkNotNull(sleeper);
      return this;
    }

    public RetryPolicy build() {
      return new RetryPolicy(this);
    }
  }
}

/*
 * Copyright (c) 2023, Sirix Contributors
 *
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *     * Redistributions of source code must retain the above copyright
 *       notice, this list of conditions and the following disclaimer.
 *     * Redistributions in binary form must reproduce the above copyright
 *       notice, this list of conditions and the following disclaimer in the
 *       documentation and/or other materials provided with the distribution.
 *     * Neither the name of the <organization> nor the
 *       names of its contributors may be used to endorse or promote products
 *       derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
 * ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
 * WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
 * DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
 * DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
 * (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
 * LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
 * ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
 * SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.xaccel.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * Level-guarded logging helper. Timed messages get the elapsed milliseconds since a
 * {@link System#nanoTime()} reading appended as last argument.
 */
public final class LogWrapper {

  /** Logger. */
  private final Logger logger;

  /**
   * Constructor.
   *
   * @param logger logger
   */
  public LogWrapper(final Logger logger) {
    this.logger = requireNonNull(logger);
  }

  /**
   * Create a wrapper around the logger of a class.
   *
   * @param type the class
   * @return the wrapper
   */
  public static LogWrapper of(final Class<?> type) {
    return new LogWrapper(LoggerFactory.getLogger(type));
  }

  public void error(final String message, final Object... objects) {
    if (logger.isErrorEnabled()) {
      logger.error(message, objects);
    }
  }

  public void warn(final String message, final Object... objects) {
    if (logger.isWarnEnabled()) {
      logger.warn(message, objects);
    }
  }

  public void info(final String message, final Object... objects) {
    if (logger.isInfoEnabled()) {
      logger.info(message, objects);
    }
  }

  /**
   * Log at info level with the elapsed time as last placeholder argument.
   *
   * @param message message, its last placeholder takes the milliseconds
   * @param startNanos {@link System#nanoTime()} at the start of the measured phase
   * @param objects the other arguments
   */
  public void infoElapsed(final String message, final long startNanos, final Object... objects) {
    if (logger.isInfoEnabled()) {
      logger.info(message, withElapsed(startNanos, objects));
    }
  }

  public void debug(final String message, final Object... objects) {
    if (logger.isDebugEnabled()) {
      logger.debug(message, objects);
    }
  }

  /**
   * Log at debug level with the elapsed time as last placeholder argument.
   *
   * @param message message, its last placeholder takes the milliseconds
   * @param startNanos {@link System#nanoTime()} at the start of the measured phase
   * @param objects the other arguments
   */
  public void debugElapsed(final String message, final long startNanos, final Object... objects) {
    if (logger.isDebugEnabled()) {
      logger.debug(message, withElapsed(startNanos, objects));
    }
  }

  public boolean isDebugEnabled() {
    return logger.isDebugEnabled();
  }

  private static Object[] withElapsed(final long startNanos, final Object[] objects) {
    final Object[] arguments = Arrays.copyOf(objects, objects.length + 1);
    arguments[objects.length] = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    return arguments;
  }
}

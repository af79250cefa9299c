/*
 * Copyright (C) 2011 the original author or authors. See the notice.md file distributed with this
 * work for additional information regarding copyright ownership.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */

package com.cleversafe.poolqueue.driver;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cleversafe.poolqueue.Channel;
import com.cleversafe.poolqueue.ChannelClosedException;
import com.cleversafe.poolqueue.PoolQueue;
import com.google.common.base.MoreObjects;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Producer loop driven by a channel of textual commands. Each command taken from the source is
 * passed to a {@link CommandHandler} together with the pool queue.
 * <p>
 * The loop ends normally when the command source is closed (logged at info) or when the handler
 * throws (logged at warn); neither is propagated. On exit the queue and the command source are
 * closed unless auto-close is disabled: after a normal end the queue only stops accepting items,
 * so the consumer drains what was produced; after a handler failure it is closed outright with
 * the failure as cause. The pool is left open for whoever performs the full
 * {@link PoolQueue#close() shutdown}.
 */
public class CommandLoop<T> implements Runnable {
  private static final Logger LOGGER = LoggerFactory.getLogger(CommandLoop.class);
  private static final ThreadFactory THREAD_FACTORY = new ThreadFactoryBuilder()
      .setNameFormat("poolqueue-command-loop-%d").setDaemon(true).build();

  private final Channel<String> commands;
  private final PoolQueue<T> poolQueue;
  private final CommandHandler<T> handler;
  private final boolean autoClose;
  private final Logger logger;

  public CommandLoop(final Channel<String> commands, final PoolQueue<T> poolQueue,
      final CommandHandler<T> handler) {
    this(commands, poolQueue, handler, true, LOGGER);
  }

  /**
   * @param autoClose whether to close the queue and the command source when the loop exits
   * @param logger receives the loop's termination messages
   */
  public CommandLoop(final Channel<String> commands, final PoolQueue<T> poolQueue,
      final CommandHandler<T> handler, final boolean autoClose, final Logger logger) {
    this.commands = Objects.requireNonNull(commands, "command source cannot be null");
    this.poolQueue = Objects.requireNonNull(poolQueue, "pool queue cannot be null");
    this.handler = Objects.requireNonNull(handler, "command handler cannot be null");
    this.autoClose = autoClose;
    this.logger = Objects.requireNonNull(logger, "logger cannot be null");
  }

  /**
   * Runs this loop on a new daemon thread.
   *
   * @return the started thread
   */
  public Thread start() {
    final Thread thread = THREAD_FACTORY.newThread(this);
    thread.start();
    return thread;
  }

  @Override
  public void run() {
    Exception failure = null;
    try {
      while (true) {
        final String command;
        try {
          command = commands.take();
        } catch (final ChannelClosedException e) {
          if (e.getCause() == null) {
            logger.info("{} command source closed, stopping", this);
          } else {
            logger.info("{} command source closed, stopping", this, e.getCause());
          }
          return;
        } catch (final InterruptedException e) {
          Thread.currentThread().interrupt();
          logger.info("{} interrupted waiting for a command, stopping", this);
          return;
        }

        try {
          handler.handle(command, poolQueue);
        } catch (final Exception e) {
          failure = e;
          if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
          }
          logger.warn("{} failed to produce for command '{}', stopping", this, command, e);
          return;
        }
      }
    } finally {
      if (autoClose) {
        if (failure == null) {
          poolQueue.queue().closeInput();
        } else {
          poolQueue.queue().close(failure);
        }
        commands.close();
      }
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("poolQueue", poolQueue).toString();
  }
}

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

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cleversafe.poolqueue.BoundedChannel;
import com.cleversafe.poolqueue.Channel;
import com.cleversafe.poolqueue.ChannelClosedException;
import com.google.common.io.LineReader;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

public final class CommandSources {
  private static final Logger LOGGER = LoggerFactory.getLogger(CommandSources.class);
  private static final ThreadFactory THREAD_FACTORY = new ThreadFactoryBuilder()
      .setNameFormat("poolqueue-command-source-%d").setDaemon(true).build();

  private CommandSources() {}

  /**
   * Returns a command channel fed with the trimmed, non-blank lines of {@code input} by a
   * background thread. Once the input is exhausted the channel stops accepting commands and is
   * closed as soon as the buffered ones are taken. If reading fails the channel is closed at once
   * with the exception as its cause. Closing the channel early stops the feeding thread at its
   * next line.
   *
   * @param capacity the number of commands buffered ahead of the consumer
   */
  public static Channel<String> lines(final Readable input, final int capacity) {
    Objects.requireNonNull(input, "input cannot be null");
    final Channel<String> commands = new BoundedChannel<>(capacity);
    THREAD_FACTORY.newThread(() -> feed(new LineReader(input), commands)).start();
    return commands;
  }

  private static void feed(final LineReader reader, final Channel<String> commands) {
    try {
      String line;
      while ((line = reader.readLine()) != null) {
        final String command = line.trim();
        if (!command.isEmpty()) {
          commands.put(command);
        }
      }
      commands.closeInput();
    } catch (final IOException e) {
      LOGGER.warn("failed reading commands", e);
      commands.close(e);
    } catch (final ChannelClosedException e) {
      LOGGER.debug("command channel closed before end of input");
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      commands.close(e);
    }
  }
}

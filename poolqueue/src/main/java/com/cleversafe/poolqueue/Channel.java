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

package com.cleversafe.poolqueue;

import java.util.Optional;

/**
 * A bounded, closeable FIFO mailbox handing values of one type from one thread to another.
 * {@link #put(Object) put} blocks while the channel is full and {@link #take() take} blocks while
 * it is empty. Once the channel is {@link #close() closed}, every blocked and every subsequent
 * put or take fails with a {@link ChannelClosedException}, whether or not values are still
 * buffered.
 *
 * @param <T> the type of value carried by the channel
 */
public interface Channel<T> extends AutoCloseable {

  /**
   * Append a value to the channel, waiting while the channel is at capacity.
   *
   * @throws ChannelClosedException if the channel is closed before or while waiting
   * @throws InterruptedException if interrupted while waiting
   */
  void put(T value) throws InterruptedException;

  /**
   * Remove the oldest value from the channel, waiting while the channel is empty.
   *
   * @throws ChannelClosedException if the channel is closed before or while waiting
   * @throws InterruptedException if interrupted while waiting
   */
  T take() throws InterruptedException;

  /**
   * Append a value if there is room for it without waiting.
   *
   * @return true if the value was appended, false if the channel was full
   * @throws ChannelClosedException if the channel is closed
   */
  boolean offer(T value);

  /**
   * Remove the oldest value if one is available without waiting.
   *
   * @throws ChannelClosedException if the channel is closed
   */
  Optional<T> poll();

  /**
   * Close the channel, releasing all waiting threads. Closing is idempotent.
   */
  @Override
  void close();

  /**
   * Close the channel, recording {@code cause} as the cause of every {@link ChannelClosedException}
   * subsequently raised by this channel. If the channel is already closed the original cause is
   * kept.
   */
  void close(Throwable cause);

  /**
   * Stop accepting values while letting takers drain what is already buffered. Subsequent puts
   * fail with {@link ChannelClosedException} at once; takes keep returning buffered values and
   * fail only once the channel is empty. A later {@link #close()} discards anything still
   * buffered.
   */
  void closeInput();

  /**
   * @return false once {@link #close()} or {@link #closeInput()} has been called
   */
  boolean isOpen();

  /**
   * @return true if at least one value is buffered
   */
  boolean isReady();

  int size();

  int capacity();
}

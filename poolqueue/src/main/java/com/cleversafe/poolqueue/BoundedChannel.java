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

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * {@link Channel} backed by a fixed-capacity ring buffer guarded by a single lock with separate
 * not-empty and not-full conditions.
 */
public class BoundedChannel<T> implements Channel<T> {
  private final ArrayDeque<T> buffer;
  private final int capacity;
  private final ReentrantLock lock;
  private final Condition notEmpty;
  private final Condition notFull;

  // guarded by lock
  private boolean closed = false;
  private boolean inputClosed = false;
  private Throwable closeCause = null;

  public BoundedChannel(final int capacity) {
    this(capacity, false);
  }

  /**
   * @param capacity maximum number of buffered values, must be positive
   * @param fair if true, blocked threads are granted access in arrival order
   */
  public BoundedChannel(final int capacity, final boolean fair) {
    Preconditions.checkArgument(capacity > 0, "channel capacity must be positive, was %s",
        capacity);
    this.buffer = new ArrayDeque<>(capacity);
    this.capacity = capacity;
    this.lock = new ReentrantLock(fair);
    this.notEmpty = lock.newCondition();
    this.notFull = lock.newCondition();
  }

  @Override
  public void put(final T value) throws InterruptedException {
    Objects.requireNonNull(value, "channel values cannot be null");
    lock.lockInterruptibly();
    try {
      while (!closed && !inputClosed && buffer.size() >= capacity) {
        notFull.await();
      }
      checkAcceptingInput();
      buffer.addLast(value);
      notEmpty.signal();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public T take() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (!closed && !inputClosed && buffer.isEmpty()) {
        notEmpty.await();
      }
      checkOpen();
      if (buffer.isEmpty()) {
        throw new ChannelClosedException("channel is closed and drained");
      }
      final T value = buffer.removeFirst();
      notFull.signal();
      return value;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean offer(final T value) {
    Objects.requireNonNull(value, "channel values cannot be null");
    lock.lock();
    try {
      checkAcceptingInput();
      if (buffer.size() >= capacity) {
        return false;
      }
      buffer.addLast(value);
      notEmpty.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<T> poll() {
    lock.lock();
    try {
      checkOpen();
      final T value = buffer.pollFirst();
      if (value != null) {
        notFull.signal();
      } else if (inputClosed) {
        throw new ChannelClosedException("channel is closed and drained");
      }
      return Optional.ofNullable(value);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    close(null);
  }

  @Override
  public void close(final Throwable cause) {
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      closeCause = cause;
      notEmpty.signalAll();
      notFull.signalAll();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void closeInput() {
    lock.lock();
    try {
      if (closed || inputClosed) {
        return;
      }
      inputClosed = true;
      notEmpty.signalAll();
      notFull.signalAll();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean isOpen() {
    lock.lock();
    try {
      return !closed && !inputClosed;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean isReady() {
    return size() > 0;
  }

  @Override
  public int size() {
    lock.lock();
    try {
      return buffer.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int capacity() {
    return capacity;
  }

  // must hold lock
  private void checkOpen() {
    if (closed) {
      throw closeCause == null ? new ChannelClosedException("channel is closed")
          : new ChannelClosedException("channel is closed", closeCause);
    }
  }

  // must hold lock
  private void checkAcceptingInput() {
    checkOpen();
    if (inputClosed) {
      throw new ChannelClosedException("channel no longer accepts values");
    }
  }

  @Override
  public String toString() {
    lock.lock();
    try {
      return MoreObjects.toStringHelper(this).add("size", buffer.size()).add("capacity", capacity)
          .add("closed", closed).add("inputClosed", inputClosed).toString();
    } finally {
      lock.unlock();
    }
  }
}

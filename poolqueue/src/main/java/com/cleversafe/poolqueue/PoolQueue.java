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

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cleversafe.poolqueue.util.ItemFactories;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * A PoolQueue shares a fixed set of reusable items between one producer thread and one consumer
 * thread. Items circulate through two bounded {@link Channel channels}: the <i>pool</i> of free
 * items and the <i>queue</i> of items ready for consumption.
 * <p>
 * The producer loop is
 *
 * <pre>
 * T item = pq.acquire(); // free item from the pool
 * fill(item);
 * pq.produce(item); // hand to the consumer
 * </pre>
 *
 * and the consumer loop is
 *
 * <pre>
 * T item = pq.consume(); // ready item from the queue
 * process(item);
 * pq.recycle(item); // hand back to the producer
 * </pre>
 *
 * An empty pool blocks the producer once every item is in flight, and a full queue blocks the
 * producer while the consumer lags behind. With a pool of two or more items the producer fills
 * the next item while the consumer processes the previous one, without allocating per item.
 * <p>
 * While an item is inside either channel no one may touch it; between a take and the matching put
 * it belongs exclusively to the thread that took it. This is a usage contract and is not checked.
 *
 * @param <T> the item type
 */
public final class PoolQueue<T> implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(PoolQueue.class);

  private final Channel<T> pool;
  private final Channel<T> queue;

  /**
   * Builds a pool queue over two existing channels. The pool is used as given; it is not
   * populated.
   */
  public PoolQueue(final Channel<T> pool, final Channel<T> queue) {
    this.pool = Objects.requireNonNull(pool, "pool channel cannot be null");
    this.queue = Objects.requireNonNull(queue, "queue channel cannot be null");
  }

  /**
   * @return an empty pool queue whose pool and queue both hold up to {@code capacity} items
   */
  public static <T> PoolQueue<T> create(final int capacity) {
    return create(capacity, capacity);
  }

  /**
   * @return an empty pool queue with the given pool and queue capacities
   * @throws IllegalArgumentException if either capacity is not positive
   */
  public static <T> PoolQueue<T> create(final int poolCapacity, final int queueCapacity) {
    return create(poolCapacity, queueCapacity, false);
  }

  /**
   * Creates a pool queue and recycles {@code poolCapacity} items made by {@code itemFactory} into
   * its pool.
   *
   * @throws IllegalArgumentException if either capacity is not positive
   */
  public static <T> PoolQueue<T> create(final int poolCapacity, final int queueCapacity,
      final Supplier<? extends T> itemFactory) {
    return create(PoolQueueOptions.<T>make().poolCapacity(poolCapacity)
        .queueCapacity(queueCapacity).itemFactory(itemFactory));
  }

  /**
   * Creates a pool queue and populates its pool with {@code poolCapacity} new instances of
   * {@code itemType}, each made by the public constructor accepting {@code constructorArgs}.
   *
   * @see ItemFactories#constructing(Class, Object...)
   */
  public static <T> PoolQueue<T> create(final Class<T> itemType, final int poolCapacity,
      final int queueCapacity, final Object... constructorArgs) {
    return create(poolCapacity, queueCapacity,
        ItemFactories.constructing(itemType, constructorArgs));
  }

  /**
   * Creates and populates a pool queue as described by {@code options}.
   *
   * @throws IllegalArgumentException if either capacity is not positive or no item factory is
   *         configured
   */
  public static <T> PoolQueue<T> create(final PoolQueueOptions<T> options) {
    Objects.requireNonNull(options, "options cannot be null");
    final Supplier<? extends T> itemFactory = options.itemFactory();
    Preconditions.checkArgument(itemFactory != null, "an item factory is required: %s", options);
    final PoolQueue<T> pq =
        create(options.poolCapacity(), options.queueCapacity(), options.fairChannels());
    for (int i = 0; i < options.poolCapacity(); i++) {
      final T item = Objects.requireNonNull(itemFactory.get(), "item factory returned null");
      // cannot block: the pool has room for every item made here
      Preconditions.checkState(pq.pool.offer(item), "pool rejected initial item %s", i);
    }
    LOGGER.debug("created {} from {}", pq, options);
    return pq;
  }

  private static <T> PoolQueue<T> create(final int poolCapacity, final int queueCapacity,
      final boolean fair) {
    Preconditions.checkArgument(poolCapacity > 0, "pool capacity must be positive, was %s",
        poolCapacity);
    Preconditions.checkArgument(queueCapacity > 0, "queue capacity must be positive, was %s",
        queueCapacity);
    return new PoolQueue<>(new BoundedChannel<>(poolCapacity, fair),
        new BoundedChannel<>(queueCapacity, fair));
  }

  /**
   * @return the channel of free items
   */
  public Channel<T> pool() {
    return pool;
  }

  /**
   * @return the channel of items ready for consumption
   */
  public Channel<T> queue() {
    return queue;
  }

  /**
   * Acquire a free item from the pool, waiting while the pool is empty.
   *
   * @throws ChannelClosedException if the pool is closed
   */
  public T acquire() throws InterruptedException {
    return pool.take();
  }

  /**
   * Acquire a free item from the pool if one is available without waiting.
   */
  public Optional<T> tryAcquire() {
    return pool.poll();
  }

  /**
   * Hand {@code item} to the consumer, waiting while the queue is full.
   *
   * @return {@code item}
   * @throws ChannelClosedException if the queue is closed
   */
  public T produce(final T item) throws InterruptedException {
    queue.put(item);
    return item;
  }

  /**
   * Acquire a free item, pass it to {@code producer} and {@link #produce(Object) produce} the
   * item it returns. If {@code producer} returns {@link Optional#empty()} the acquired item is
   * {@link #recycle(Object) recycled} and nothing is produced.
   * <p>
   * Anything thrown by {@code producer} is rethrown unchanged after the acquired item has been
   * returned to the pool. The same holds for the item to be queued when waiting for queue space
   * is interrupted or the queue is closed.
   *
   * @return the result of {@code producer}
   */
  public <E extends Exception> Optional<T> produce(final Producer<T, E> producer)
      throws E, InterruptedException {
    Objects.requireNonNull(producer, "producer cannot be null");
    final T item = acquire();
    final Optional<T> produced;
    try {
      produced = Objects.requireNonNull(producer.produce(item),
          "producer returned null; return Optional.empty() to skip production");
    } catch (final Throwable t) {
      restore(item, t);
      throw t;
    }
    return finishProduce(item, produced);
  }

  /**
   * As {@link #produce(Producer)}, passing {@code arg} to {@code producer} along with the item.
   */
  public <A, E extends Exception> Optional<T> produce(final BiProducer<T, A, E> producer,
      final A arg) throws E, InterruptedException {
    Objects.requireNonNull(producer, "producer cannot be null");
    final T item = acquire();
    final Optional<T> produced;
    try {
      produced = Objects.requireNonNull(producer.produce(item, arg),
          "producer returned null; return Optional.empty() to skip production");
    } catch (final Throwable t) {
      restore(item, t);
      throw t;
    }
    return finishProduce(item, produced);
  }

  private Optional<T> finishProduce(final T acquired, final Optional<T> produced)
      throws InterruptedException {
    final T item = produced.orElse(acquired);
    try {
      if (produced.isPresent()) {
        produce(item);
      } else {
        recycle(item);
      }
    } catch (final InterruptedException | RuntimeException e) {
      restore(item, e);
      throw e;
    }
    return produced;
  }

  /**
   * Consume a ready item from the queue, waiting while the queue is empty.
   *
   * @throws ChannelClosedException if the queue is closed
   */
  public T consume() throws InterruptedException {
    return queue.take();
  }

  /**
   * Consume a ready item if one is available without waiting.
   */
  public Optional<T> tryConsume() {
    return queue.poll();
  }

  /**
   * Consume a ready item, pass it to {@code consumer} and {@link #recycle(Object) recycle} the
   * item it returns, which need not be the consumed one. There is no way to skip recycling.
   * <p>
   * Anything thrown by {@code consumer} is rethrown unchanged after the consumed item has been
   * returned to the pool.
   *
   * @return the recycled item
   */
  public <E extends Exception> T consume(final Consumer<T, E> consumer)
      throws E, InterruptedException {
    Objects.requireNonNull(consumer, "consumer cannot be null");
    final T item = consume();
    final T processed;
    try {
      processed = Objects.requireNonNull(consumer.consume(item), "consumer returned null");
    } catch (final Throwable t) {
      restore(item, t);
      throw t;
    }
    return finishConsume(processed);
  }

  /**
   * As {@link #consume(Consumer)}, passing {@code arg} to {@code consumer} along with the item.
   */
  public <A, E extends Exception> T consume(final BiConsumer<T, A, E> consumer, final A arg)
      throws E, InterruptedException {
    Objects.requireNonNull(consumer, "consumer cannot be null");
    final T item = consume();
    final T processed;
    try {
      processed = Objects.requireNonNull(consumer.consume(item, arg), "consumer returned null");
    } catch (final Throwable t) {
      restore(item, t);
      throw t;
    }
    return finishConsume(processed);
  }

  private T finishConsume(final T processed) throws InterruptedException {
    try {
      return recycle(processed);
    } catch (final InterruptedException | RuntimeException e) {
      restore(processed, e);
      throw e;
    }
  }

  /**
   * Return {@code item} to the pool, waiting while the pool is full.
   *
   * @return {@code item}
   * @throws ChannelClosedException if the pool is closed
   */
  public T recycle(final T item) throws InterruptedException {
    pool.put(item);
    return item;
  }

  // puts an item held by a failed fused operation back into circulation
  private void restore(final T item, final Throwable failure) {
    try {
      if (!pool.offer(item)) {
        failure.addSuppressed(
            new IllegalStateException("pool is full, could not restore item " + item));
      }
    } catch (final RuntimeException e) {
      failure.addSuppressed(e);
    }
  }

  /**
   * Close the queue, then the pool. Threads blocked in {@link #consume()} are released before
   * those blocked in {@link #acquire()} or {@link #recycle(Object)}, and every later operation
   * fails with {@link ChannelClosedException}.
   */
  @Override
  public void close() {
    LOGGER.debug("closing {}", this);
    queue.close();
    pool.close();
  }

  /**
   * As {@link #close()}, recording {@code cause} on both channels.
   */
  public void close(final Throwable cause) {
    LOGGER.debug("closing {}", this, cause);
    queue.close(cause);
    pool.close(cause);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("pool", pool).add("queue", queue).toString();
  }

  /**
   * Fills an acquired item for {@link PoolQueue#produce(Producer)}.
   */
  @FunctionalInterface
  public interface Producer<T, E extends Exception> {
    /**
     * @return the item to produce, usually {@code item} itself, or {@link Optional#empty()} to
     *         recycle {@code item} without producing anything
     */
    Optional<T> produce(T item) throws E;
  }

  @FunctionalInterface
  public interface BiProducer<T, A, E extends Exception> {
    Optional<T> produce(T item, A arg) throws E;
  }

  /**
   * Processes a consumed item for {@link PoolQueue#consume(Consumer)}.
   */
  @FunctionalInterface
  public interface Consumer<T, E extends Exception> {
    /**
     * @return the item to recycle, usually {@code item} itself
     */
    T consume(T item) throws E;
  }

  @FunctionalInterface
  public interface BiConsumer<T, A, E extends Exception> {
    T consume(T item, A arg) throws E;
  }
}

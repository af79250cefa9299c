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
import java.util.function.Supplier;

/**
 * Configuration for {@link PoolQueue#create(PoolQueueOptions)}. Defaults may be overridden
 * process-wide with system properties named {@code poolqueue.options.<setter>}, for example
 * {@code -Dpoolqueue.options.poolCapacity=8}.
 *
 * @param <T> the item type circulated by the configured pool queue
 */
public class PoolQueueOptions<T> implements Cloneable // shallow field-for-field Object.clone
{
  private static final PoolQueueOptions<?> DEFAULT_OPTIONS =
      OptionsUtil.populateFromProperties("poolqueue.options.", new PoolQueueOptions<>(null));

  private PoolQueueOptions(final PoolQueueOptions<T> that) {
    OptionsUtil.copyFields(PoolQueueOptions.class, that, this);
  }

  /**
   * @return a new options instance with the default parameter set
   */
  @SuppressWarnings("unchecked")
  public static <T> PoolQueueOptions<T> make() {
    return copy((PoolQueueOptions<T>) DEFAULT_OPTIONS);
  }

  /**
   * @return a new options instance with identical parameters as the given argument
   */
  @SuppressWarnings("unchecked")
  public static <T> PoolQueueOptions<T> copy(final PoolQueueOptions<T> other) {
    try {
      return (PoolQueueOptions<T>) Objects.requireNonNull(other, "copy target cannot be null")
          .clone();
    } catch (final CloneNotSupportedException e) {
      throw new Error(e);
    }
  }

  @Override
  public String toString() {
    return OptionsUtil.toString(this);
  }

  private int poolCapacity = 2;
  private int queueCapacity = 2;
  private boolean fairChannels = false;
  private Supplier<? extends T> itemFactory = null;

  /**
   * Number of items the pool can hold. This is also the number of items created by the
   * {@link #itemFactory(Supplier) item factory}, and so the number of items in circulation.
   */
  public PoolQueueOptions<T> poolCapacity(final int poolCapacity) {
    this.poolCapacity = poolCapacity;
    return this;
  }

  /**
   * @see #poolCapacity(int)
   */
  public int poolCapacity() {
    return poolCapacity;
  }

  /**
   * Number of produced items the queue can hold before producers block.
   */
  public PoolQueueOptions<T> queueCapacity(final int queueCapacity) {
    this.queueCapacity = queueCapacity;
    return this;
  }

  /**
   * @see #queueCapacity(int)
   */
  public int queueCapacity() {
    return queueCapacity;
  }

  /**
   * If true, both channels grant blocked threads access in arrival order.
   */
  public PoolQueueOptions<T> fairChannels(final boolean fairChannels) {
    this.fairChannels = fairChannels;
    return this;
  }

  /**
   * @see #fairChannels(boolean)
   */
  public boolean fairChannels() {
    return fairChannels;
  }

  /**
   * Creates the items which pre-populate the pool. Required.
   */
  public PoolQueueOptions<T> itemFactory(final Supplier<? extends T> itemFactory) {
    this.itemFactory = Objects.requireNonNull(itemFactory, "item factory cannot be null");
    return this;
  }

  /**
   * @see #itemFactory(Supplier)
   */
  public Supplier<? extends T> itemFactory() {
    return itemFactory;
  }
}

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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Runs the actors of a multi-threaded test on named threads and collects their results.
 */
public class ConcurrencyHelper<T> implements AutoCloseable {
  private static final long TIMEOUT_SECONDS = 30;

  private final ExecutorService threadPool;

  public ConcurrencyHelper(final int threads, final String threadPrefix) {
    threadPool = Executors.newFixedThreadPool(Math.max(1, threads),
        new ThreadFactoryBuilder().setNameFormat(threadPrefix + "-%d").setDaemon(true).build());
  }

  /**
   * Runs every actor concurrently and returns their results in order. An actor still running
   * after the timeout is cancelled, which surfaces here as a {@code CancellationException}.
   */
  public List<T> runAll(final Collection<Callable<T>> actors)
      throws InterruptedException, ExecutionException {
    final List<T> results = new ArrayList<>(actors.size());
    for (final Future<T> actor : threadPool.invokeAll(actors, TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
      results.add(actor.get());
    }
    return results;
  }

  @Override
  public void close() throws InterruptedException {
    threadPool.shutdownNow();
    threadPool.awaitTermination(TIMEOUT_SECONDS, TimeUnit.SECONDS);
  }
}

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

package com.cleversafe.poolqueue.benchmark;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import com.cleversafe.poolqueue.PoolQueue;
import com.cleversafe.poolqueue.PoolQueueOptions;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

public class PoolQueueBenchmark {
  private final List<String> benchmarks;
  private final int num;
  private final int chunkSize;
  private final int poolCapacity;
  private final int queueCapacity;
  private final byte[] source;

  private long startTime;
  private long bytes;
  private int done;

  @SuppressWarnings("unchecked")
  public PoolQueueBenchmark(final Map<Flag, Object> flags) {
    benchmarks = (List<String>) flags.get(Flag.benchmarks);
    num = (Integer) flags.get(Flag.num);
    chunkSize = (Integer) flags.get(Flag.chunk_size);
    poolCapacity = (Integer) flags.get(Flag.pool_capacity);
    queueCapacity = (Integer) flags.get(Flag.queue_capacity);
    Preconditions.checkArgument(num > 0, "num must be positive");
    Preconditions.checkArgument(chunkSize > 0, "chunk_size must be positive");

    // reused cyclically as chunk contents, offset per chunk so consecutive chunks differ
    source = new byte[chunkSize * 2];
    ThreadLocalRandom.current().nextBytes(source);
  }

  /**
   * @return false if any benchmark's consumer saw different contents than its producer made
   */
  public boolean run() throws Exception {
    boolean allVerified = true;
    printHeader();
    for (final String benchmark : benchmarks) {
      final Callable<HashCode> producer;
      final Callable<HashCode> consumer;
      switch (benchmark) {
        case "primitive": {
          final PoolQueue<Chunk> pq = newPoolQueue();
          producer = () -> producePrimitive(pq);
          consumer = () -> consumePrimitive(pq);
          break;
        }
        case "fused": {
          final PoolQueue<Chunk> pq = newPoolQueue();
          producer = () -> produceFused(pq, false);
          consumer = () -> consumeFused(pq);
          break;
        }
        case "skipping": {
          final PoolQueue<Chunk> pq = newPoolQueue();
          producer = () -> produceFused(pq, true);
          consumer = () -> consumeFused(pq);
          break;
        }
        case "allocating": {
          final BlockingQueue<Chunk> queue = new ArrayBlockingQueue<>(queueCapacity);
          producer = () -> produceAllocating(queue);
          consumer = () -> consumeAllocating(queue);
          break;
        }
        default:
          System.err.printf("Unknown benchmark '%s'\n", benchmark);
          continue;
      }
      start();
      final boolean verified = runPair(benchmark, producer, consumer);
      stop(benchmark, verified);
      allVerified &= verified;
    }
    return allVerified;
  }

  private PoolQueue<Chunk> newPoolQueue() {
    return PoolQueue.create(PoolQueueOptions.<Chunk>make().poolCapacity(poolCapacity)
        .queueCapacity(queueCapacity).itemFactory(() -> new Chunk(chunkSize)));
  }

  // either side failing cancels the other, which may be blocked on its peer forever
  boolean runPair(final String benchmark, final Callable<HashCode> producer,
      final Callable<HashCode> consumer) throws InterruptedException, ExecutionException {
    final ListeningExecutorService threads =
        MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(2, new ThreadFactoryBuilder()
            .setNameFormat("poolqueue-benchmark-" + benchmark + "-%d").setDaemon(true).build()));
    try {
      final ListenableFuture<HashCode> consumed = threads.submit(consumer);
      final ListenableFuture<HashCode> produced = threads.submit(producer);
      Futures.allAsList(consumed, produced).get();
      return produced.get().equals(consumed.get());
    } finally {
      threads.shutdownNow();
      threads.awaitTermination(1, TimeUnit.MINUTES);
    }
  }

  private void fill(final Chunk chunk, final int sequence) {
    System.arraycopy(source, sequence % chunkSize, chunk.data, 0, chunkSize);
    chunk.sequence = sequence;
    chunk.last = sequence == num - 1;
  }

  private HashCode producePrimitive(final PoolQueue<Chunk> pq) throws InterruptedException {
    final Hasher hasher = Hashing.crc32c().newHasher();
    for (int i = 0; i < num; i++) {
      final Chunk chunk = pq.acquire();
      fill(chunk, i);
      hasher.putBytes(chunk.data);
      pq.produce(chunk);
    }
    return hasher.hash();
  }

  private HashCode consumePrimitive(final PoolQueue<Chunk> pq) throws InterruptedException {
    final Hasher hasher = Hashing.crc32c().newHasher();
    boolean last = false;
    while (!last) {
      final Chunk chunk = pq.consume();
      hasher.putBytes(chunk.data);
      last = chunk.last;
      pq.recycle(chunk);
      finishedSingleOp(chunkSize);
    }
    return hasher.hash();
  }

  private HashCode produceFused(final PoolQueue<Chunk> pq, final boolean skipAlternate)
      throws InterruptedException {
    final Hasher hasher = Hashing.crc32c().newHasher();
    final int[] sequence = {0};
    int cycle = 0;
    while (sequence[0] < num) {
      final boolean skip = skipAlternate && (cycle++ & 1) == 1;
      pq.produce(chunk -> {
        if (skip) {
          return Optional.empty();
        }
        fill(chunk, sequence[0]++);
        hasher.putBytes(chunk.data);
        return Optional.of(chunk);
      });
    }
    return hasher.hash();
  }

  private HashCode consumeFused(final PoolQueue<Chunk> pq) throws InterruptedException {
    final Hasher hasher = Hashing.crc32c().newHasher();
    final boolean[] last = {false};
    while (!last[0]) {
      pq.consume(chunk -> {
        hasher.putBytes(chunk.data);
        last[0] = chunk.last;
        return chunk;
      });
      finishedSingleOp(chunkSize);
    }
    return hasher.hash();
  }

  private HashCode produceAllocating(final BlockingQueue<Chunk> queue)
      throws InterruptedException {
    final Hasher hasher = Hashing.crc32c().newHasher();
    for (int i = 0; i < num; i++) {
      final Chunk chunk = new Chunk(chunkSize);
      fill(chunk, i);
      hasher.putBytes(chunk.data);
      queue.put(chunk);
    }
    return hasher.hash();
  }

  private HashCode consumeAllocating(final BlockingQueue<Chunk> queue)
      throws InterruptedException {
    final Hasher hasher = Hashing.crc32c().newHasher();
    boolean last = false;
    while (!last) {
      final Chunk chunk = queue.take();
      hasher.putBytes(chunk.data);
      last = chunk.last;
      finishedSingleOp(chunkSize);
    }
    return hasher.hash();
  }

  private void printHeader() {
    System.out.printf("Chunks:     %d x %d bytes\n", num, chunkSize);
    System.out.printf("RawSize:    %.1f MB\n", ((long) num * chunkSize) / 1048576.0);
    System.out.printf("Pool:       %d items\n", poolCapacity);
    System.out.printf("Queue:      %d items\n", queueCapacity);
    boolean assertsEnabled = false;
    assert assertsEnabled = true; // Intentional side effect!!!
    if (assertsEnabled) {
      System.out.printf("WARNING: Assertions are enabled; benchmarks unnecessarily slow\n");
    }
    System.out.printf("------------------------------------------------\n");
  }

  private void start() {
    startTime = System.nanoTime();
    bytes = 0;
    done = 0;
  }

  // consumer thread only
  private void finishedSingleOp(final int chunkBytes) {
    done++;
    bytes += chunkBytes;
  }

  private void stop(final String benchmark, final boolean verified) {
    final long endTime = System.nanoTime();
    final double elapsedSeconds = 1.0d * (endTime - startTime) / TimeUnit.SECONDS.toNanos(1);
    if (done < 1) {
      done = 1;
    }
    final String rate = String.format("%6.1f MB/s", (bytes / 1048576.0) / elapsedSeconds);
    System.out.printf("%-12s : %11.5f micros/op; %s%s\n", benchmark,
        elapsedSeconds * 1e6 / done, rate, verified ? "" : " (CHECKSUM MISMATCH)");
  }

  public static void main(final String[] args) throws Exception {
    final Map<Flag, Object> flags = new EnumMap<>(Flag.class);
    for (final Flag flag : Flag.values()) {
      flags.put(flag, flag.getDefaultValue());
    }
    for (final String arg : args) {
      boolean valid = false;
      if (arg.startsWith("--")) {
        try {
          final List<String> parts = Splitter.on("=").limit(2).splitToList(arg.substring(2));
          if (parts.size() == 2) {
            final Flag key = Flag.valueOf(parts.get(0));
            flags.put(key, key.parseValue(parts.get(1)));
            valid = true;
          }
        } catch (final IllegalArgumentException e) {
          valid = false;
        }
      }

      if (!valid) {
        System.err.println("Invalid argument " + arg);
        System.exit(1);
      }
    }
    if (!new PoolQueueBenchmark(flags).run()) {
      System.exit(2);
    }
  }

  protected enum Flag {
    // Comma-separated list of benchmarks to run in the specified order
    //      primitive   -- acquire/produce and consume/recycle on two threads
    //      fused       -- fused produce and consume callbacks
    //      skipping    -- fused produce which skips every other cycle
    //      allocating  -- new chunk per handoff over a bounded queue, for comparison
    benchmarks(ImmutableList.of("primitive", "fused", "skipping", "allocating")) {
      @Override
      public Object parseValue(final String value) {
        return ImmutableList.copyOf(Splitter.on(",").trimResults().omitEmptyStrings().split(value));
      }
    },

    // Number of chunks handed from producer to consumer
    num(1000000) {
      @Override
      public Object parseValue(final String value) {
        return Integer.parseInt(value);
      }
    },

    // Size of each chunk in bytes
    chunk_size(4096) {
      @Override
      public Object parseValue(final String value) {
        return Integer.parseInt(value);
      }
    },

    // Number of reusable chunks
    pool_capacity(4) {
      @Override
      public Object parseValue(final String value) {
        return Integer.parseInt(value);
      }
    },

    // Number of chunks which may wait for the consumer
    queue_capacity(4) {
      @Override
      public Object parseValue(final String value) {
        return Integer.parseInt(value);
      }
    };

    private final Object defaultValue;

    private Flag(final Object defaultValue) {
      this.defaultValue = defaultValue;
    }

    public abstract Object parseValue(String value);

    public Object getDefaultValue() {
      return defaultValue;
    }
  }

  static final class Chunk {
    final byte[] data;
    int sequence;
    boolean last;

    Chunk(final int size) {
      this.data = new byte[size];
    }
  }
}

/*
Copyright 2026 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.nonogram.stats;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.nonogram.gen.Candidate;
import us.blanshard.nonogram.gen.Outcome;
import us.blanshard.nonogram.gen.PuzzleBuilder;
import us.blanshard.nonogram.gen.PuzzleJson;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a puzzle builder over a batch of candidates on a fixed pool of worker
 * threads, one task per candidate.  A candidate that blows up becomes an error
 * outcome; it never stops the rest of the batch.
 *
 * @author Luke Blanshard
 */
public class BatchRunner {
  private static final Logger logger = Logger.getLogger(BatchRunner.class.getName());

  private final PuzzleBuilder builder;
  private final int threads;

  public BatchRunner(PuzzleBuilder builder, int threads) {
    checkArgument(threads > 0, "Need at least one thread");
    this.builder = checkNotNull(builder);
    this.threads = threads;
  }

  /** Uses one thread per available processor. */
  public BatchRunner(PuzzleBuilder builder) {
    this(builder, Runtime.getRuntime().availableProcessors());
  }

  /**
   * Processes all the candidates, returning their outcomes in the same order.
   *
   * @throws InterruptedException if the calling thread is interrupted while
   *     waiting; the workers are then interrupted too
   */
  public List<Outcome> run(List<Candidate> candidates) throws InterruptedException {
    List<PuzzleJson.Entry> entries = Lists.newArrayListWithCapacity(candidates.size());
    for (Candidate candidate : candidates)
      entries.add(PuzzleJson.Entry.of(candidate));
    return runEntries(entries);
  }

  /**
   * Processes all the entries of a candidate file, returning their outcomes in
   * the same order.  An unreadable entry becomes an error outcome.
   *
   * @throws InterruptedException if the calling thread is interrupted while
   *     waiting; the workers are then interrupted too
   */
  public List<Outcome> runEntries(List<PuzzleJson.Entry> entries) throws InterruptedException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    logger.info("Processing " + entries.size() + " candidates on " + threads + " threads");
    ListeningExecutorService executor = MoreExecutors.listeningDecorator(
        Executors.newFixedThreadPool(threads, new ThreadFactoryBuilder()
            .setNameFormat("puzzle-builder-%d")
            .setDaemon(true)
            .build()));
    try {
      ImmutableList.Builder<ListenableFuture<Outcome>> futures = ImmutableList.builder();
      for (final PuzzleJson.Entry entry : entries) {
        if (!entry.isReadable()) {
          logger.warning(entry.name + " is unreadable: " + entry.error);
          futures.add(Futures.immediateFuture(Outcome.error(entry.name, entry.error, 0)));
          continue;
        }
        futures.add(executor.submit(new Callable<Outcome>() {
          @Override public Outcome call() {
            return buildSafely(entry.candidate);
          }
        }));
      }

      ImmutableList.Builder<Outcome> outcomes = ImmutableList.builder();
      int i = 0;
      for (ListenableFuture<Outcome> future : futures.build()) {
        String name = entries.get(i++).name;
        try {
          outcomes.add(future.get());
        } catch (ExecutionException e) {
          logger.log(Level.WARNING, name + " failed", e.getCause());
          outcomes.add(Outcome.error(name, String.valueOf(e.getCause()), 0));
        }
      }
      logger.info("Processed " + entries.size() + " candidates in " + stopwatch);
      return outcomes.build();
    } finally {
      executor.shutdownNow();
    }
  }

  private Outcome buildSafely(Candidate candidate) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    try {
      return builder.build(candidate);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, candidate.name + " failed", e);
      return Outcome.error(candidate.name, e.toString(), stopwatch.elapsed(TimeUnit.MILLISECONDS));
    }
  }
}

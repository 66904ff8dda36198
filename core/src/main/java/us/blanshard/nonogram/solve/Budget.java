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
package us.blanshard.nonogram.solve;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Ticker;

import java.util.concurrent.TimeUnit;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * The time and node allowance for one solve attempt.  Solving code calls
 * {@link #check} at every line it solves and {@link #countNode} at every search
 * node; either one throws an {@link ExhaustedException} once the allowance is
 * used up, unwinding the search.  An interrupted thread counts as out of time.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Budget {

  public enum Kind { TIME, NODES }

  /** Thrown when a budget runs out. */
  public static class ExhaustedException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public final Kind kind;

    ExhaustedException(Kind kind, String message) {
      super(message);
      this.kind = kind;
    }
  }

  private final Ticker ticker;
  private final long deadlineNanos;
  private final long maxNodes;
  private long nodes;

  public Budget(long timeoutMillis, long maxNodes, Ticker ticker) {
    checkArgument(timeoutMillis > 0 && maxNodes > 0);
    this.ticker = ticker;
    this.deadlineNanos = ticker.read() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
    this.maxNodes = maxNodes;
  }

  /** Throws if the deadline has passed or the current thread is interrupted. */
  public void check() throws ExhaustedException {
    if (Thread.currentThread().isInterrupted())
      throw new ExhaustedException(Kind.TIME, "interrupted");
    if (ticker.read() - deadlineNanos > 0)
      throw new ExhaustedException(Kind.TIME, "deadline passed");
  }

  /** Counts one search node, throwing if that's one more than allowed. */
  public void countNode() throws ExhaustedException {
    if (++nodes > maxNodes)
      throw new ExhaustedException(Kind.NODES, "more than " + maxNodes + " nodes");
    check();
  }

  public long nodes() {
    return nodes;
  }
}

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

import us.blanshard.nonogram.core.Grid;

import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;

/**
 * The outcome of a uniqueness check.
 *
 * @author Luke Blanshard
 */
public final class Verdict {

  public enum Status {
    /** Exactly one grid satisfies the clues. */
    UNIQUE,
    /** At least two grids satisfy the clues. */
    MULTIPLE,
    /** No grid satisfies the clues. */
    INFEASIBLE,
    /** The time allowance ran out before the search finished. */
    TIMEOUT,
    /** The node allowance ran out before the search finished. */
    TOO_COMPLEX;
  }

  public final Status status;

  /** The first solution found, if any; for a unique puzzle, its solution. */
  @Nullable public final Grid solution;

  /** The second solution found, present only for {@link Status#MULTIPLE}. */
  @Nullable public final Grid otherSolution;

  public final SolveTrace trace;
  public final long elapsedMillis;

  Verdict(Status status, @Nullable Grid solution, @Nullable Grid otherSolution,
      SolveTrace trace, long elapsedMillis) {
    this.status = status;
    this.solution = solution;
    this.otherSolution = otherSolution;
    this.trace = trace;
    this.elapsedMillis = elapsedMillis;
  }

  public boolean isUnique() {
    return status == Status.UNIQUE;
  }

  /** Tells whether propagation alone, with no branching, reached the verdict. */
  public boolean solvedByPropagation() {
    return trace.branches() == 0;
  }

  @Override public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("status", status)
        .add("elapsedMillis", elapsedMillis)
        .add("trace", trace)
        .toString();
  }
}

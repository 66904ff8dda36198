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

import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.nonogram.core.Config;
import us.blanshard.nonogram.core.Grid;
import us.blanshard.nonogram.core.Nonogram;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Decides whether a puzzle has exactly one solution.  Propagates first; when
 * propagation stalls, branches on the most constrained unknown cell, trying
 * its candidate colors in ascending order, and recurses.  The search stops as
 * soon as a second solution turns up, or when the configured time or node
 * allowance runs out.
 *
 * <p> A checker holds no per-puzzle state, so one instance may check many
 * puzzles, on many threads at once.
 *
 * @author Luke Blanshard
 */
public class UniquenessChecker {
  private final Config config;
  private final Ticker ticker;

  public UniquenessChecker(Config config) {
    this(config, Ticker.systemTicker());
  }

  public UniquenessChecker(Config config, Ticker ticker) {
    this.config = checkNotNull(config);
    this.ticker = checkNotNull(ticker);
  }

  public Config config() {
    return config;
  }

  public Verdict check(Nonogram puzzle) {
    Stopwatch stopwatch = Stopwatch.createStarted(ticker);
    Search search = new Search(puzzle, new Budget(config.timeoutMillis, config.maxNodes, ticker));
    Verdict.Status status;
    try {
      search.run(0);
      switch (search.solutions.size()) {
        case 0: status = Verdict.Status.INFEASIBLE; break;
        case 1: status = Verdict.Status.UNIQUE; break;
        default: status = Verdict.Status.MULTIPLE; break;
      }
    } catch (Budget.ExhaustedException e) {
      status = e.kind == Budget.Kind.TIME ? Verdict.Status.TIMEOUT : Verdict.Status.TOO_COMPLEX;
    }
    long elapsed = stopwatch.elapsed(TimeUnit.MILLISECONDS);

    List<Grid> solutions = search.solutions;
    boolean complete = status == Verdict.Status.UNIQUE || status == Verdict.Status.MULTIPLE;
    return new Verdict(status,
        complete ? solutions.get(0) : null,
        status == Verdict.Status.MULTIPLE ? solutions.get(1) : null,
        search.trace, elapsed);
  }

  /** The state of one depth-first search. */
  private static class Search {
    final WorkGrid grid;
    final SolveTrace trace = new SolveTrace();
    final Budget budget;
    final Propagator propagator;
    final int colorCount;
    final List<Grid> solutions = new ArrayList<Grid>(2);

    Search(Nonogram puzzle, Budget budget) {
      this.grid = new WorkGrid(puzzle);
      this.budget = budget;
      this.propagator = new Propagator(puzzle, grid, trace, budget);
      this.colorCount = puzzle.colorCount();
    }

    /**
     * Explores the subtree rooted at the current grid state.  Returns true if
     * the search should stop because a second solution has been found.
     */
    boolean run(int depth) {
      budget.countNode();
      trace.node();
      if (!propagator.propagate(depth)) return false;

      if (grid.isSolved()) {
        solutions.add(grid.toGrid());
        return solutions.size() > 1;
      }

      int cell = grid.mostConstrainedCell();
      int mask = grid.mask(cell);
      for (int color = 0; color < colorCount; ++color) {
        if ((mask & (1 << color)) == 0) continue;
        trace.branch(depth + 1);
        int mark = grid.mark();
        grid.assign(cell, color);
        boolean stop = run(depth + 1);
        grid.rollback(mark);
        if (stop) return true;
      }
      return false;
    }
  }
}

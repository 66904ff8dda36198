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
package us.blanshard.nonogram.gen;

import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.nonogram.core.Config;
import us.blanshard.nonogram.core.Grid;
import us.blanshard.nonogram.core.Nonogram;
import us.blanshard.nonogram.rate.DifficultyScorer;
import us.blanshard.nonogram.rate.Quality;
import us.blanshard.nonogram.rate.QualityScorer;
import us.blanshard.nonogram.rate.Rating;
import us.blanshard.nonogram.solve.UniquenessChecker;
import us.blanshard.nonogram.solve.Verdict;

import com.google.common.base.Stopwatch;

import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns a candidate into a puzzle or a rejection.  The candidate's grid is
 * trimmed of empty borders, its clues derived, and the structural rules
 * checked; only then is the solver asked whether the clues have a unique
 * solution.  Unique puzzles are rated for difficulty and quality.
 *
 * <p> A builder holds no per-candidate state; one instance can serve any
 * number of worker threads.
 *
 * @author Luke Blanshard
 */
public class PuzzleBuilder {
  private static final Logger logger = Logger.getLogger(PuzzleBuilder.class.getName());

  private final Config config;
  private final UniquenessChecker checker;

  public PuzzleBuilder(Config config) {
    this(config, new UniquenessChecker(config));
  }

  PuzzleBuilder(Config config, UniquenessChecker checker) {
    this.config = checkNotNull(config);
    this.checker = checkNotNull(checker);
  }

  public Config config() {
    return config;
  }

  public Outcome build(Candidate candidate) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    Grid grid = candidate.grid.trim();
    Nonogram nonogram = Nonogram.fromGrid(grid, candidate.palette);

    Rejection rejection = ValidationRules.validate(nonogram, config);
    if (rejection != null) {
      return reject(candidate, rejection, stopwatch);
    }

    Verdict verdict = checker.check(nonogram);
    switch (verdict.status) {
      case UNIQUE:
        break;
      case MULTIPLE:
        return reject(candidate,
            searchRejection(Rejection.Reason.VALID_MULTIPLE, verdict), stopwatch);
      case TIMEOUT:
        return reject(candidate, searchRejection(Rejection.Reason.TIMEOUT, verdict), stopwatch);
      case TOO_COMPLEX:
        return reject(candidate, searchRejection(Rejection.Reason.TOO_COMPLEX, verdict), stopwatch);
      default:
        return reject(candidate, searchRejection(Rejection.Reason.INFEASIBLE, verdict), stopwatch);
    }

    if (!grid.equals(verdict.solution)) {
      // The candidate satisfies its own clues, so a unique solution must be it.
      String error = "unique solution differs from the source grid";
      logger.warning(candidate.name + ": " + error);
      return Outcome.error(candidate.name, error, elapsed(stopwatch));
    }

    Rating rating = DifficultyScorer.score(nonogram, grid, verdict.trace, config);
    Quality quality = QualityScorer.score(nonogram, grid);
    Puzzle puzzle = new Puzzle(candidate.name, nonogram, grid, rating, quality);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(candidate.name + ": accepted, " + rating + ", " + quality + ", " + verdict.trace);
    }
    return Outcome.accepted(puzzle, elapsed(stopwatch));
  }

  private static Rejection searchRejection(Rejection.Reason reason, Verdict verdict) {
    return Rejection.fromSearch(reason, verdict.elapsedMillis, verdict.trace.nodes());
  }

  private static Outcome reject(Candidate candidate, Rejection rejection, Stopwatch stopwatch) {
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(candidate.name + ": " + rejection);
    }
    return Outcome.rejected(candidate.name, rejection, elapsed(stopwatch));
  }

  private static long elapsed(Stopwatch stopwatch) {
    return stopwatch.elapsed(TimeUnit.MILLISECONDS);
  }
}

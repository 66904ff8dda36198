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
package us.blanshard.nonogram.rate;

import static com.google.common.base.Preconditions.checkArgument;

import us.blanshard.nonogram.core.Config;
import us.blanshard.nonogram.core.Difficulty;
import us.blanshard.nonogram.core.Grid;
import us.blanshard.nonogram.core.Nonogram;
import us.blanshard.nonogram.solve.SolveTrace;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

/**
 * Scores how hard a uniquely solvable puzzle is for a person to solve.
 *
 * <p> The puzzle's structure sets a baseline: its largest dimension, the
 * number of colors, how fragmented its clues are, and how close it is to half
 * filled.  The baseline is multiplied by a technique factor that grows with the
 * share of cells needing more than simple overlap reasoning.  Backtracking,
 * which people can't really do, adds a penalty on top and lifts the score to at
 * least the configured floor.  Every weight is non-negative, so the score
 * never drops when any single feature gets harder.
 *
 * @author Luke Blanshard
 */
public final class DifficultyScorer {

  private DifficultyScorer() {}

  /**
   * The inputs to the score.  Technique usage is expressed as shares of the
   * grid's cells, so that it doesn't vary with the grid's size.
   */
  public static final class Features {
    public final int width;
    public final int height;
    /** The number of distinct colors used, not counting empty. */
    public final int colorCount;
    /** Colored cells over all cells. */
    public final double fillRatio;
    /** Total runs over the number of lines. */
    public final double fragmentation;
    /** Share of cells found by simple overlap. */
    public final double overlapShare;
    /** Share of cells found by other first-pass line reasoning. */
    public final double edgeShare;
    /** Share of cells found only after crossing lines were solved. */
    public final double crossLineShare;
    public final int branches;
    public final int maxDepth;

    public Features(int width, int height, int colorCount, double fillRatio,
                    double fragmentation, double overlapShare, double edgeShare,
                    double crossLineShare, int branches, int maxDepth) {
      checkArgument(width >= 0 && height >= 0 && colorCount >= 0);
      checkArgument(branches >= 0 && maxDepth >= 0);
      this.width = width;
      this.height = height;
      this.colorCount = colorCount;
      this.fillRatio = fillRatio;
      this.fragmentation = fragmentation;
      this.overlapShare = overlapShare;
      this.edgeShare = edgeShare;
      this.crossLineShare = crossLineShare;
      this.branches = branches;
      this.maxDepth = maxDepth;
    }

    /** Gathers the features of a solved puzzle. */
    public static Features of(Nonogram puzzle, Grid solution, SolveTrace trace) {
      int cells = puzzle.cellCount();
      int lines = puzzle.width() + puzzle.height();
      return new Features(
          puzzle.width(), puzzle.height(), solution.distinctColors(),
          cells == 0 ? 0 : solution.coloredCount() / (double) cells,
          lines == 0 ? 0 : puzzle.totalRuns() / (double) lines,
          share(trace.overlapCells(), cells),
          share(trace.edgeCells(), cells),
          share(trace.crossLineCells(), cells),
          trace.branches(), trace.maxDepth());
    }

    private static double share(int count, int cells) {
      return cells == 0 ? 0 : count / (double) cells;
    }

    public int maxDimension() {
      return Math.max(width, height);
    }

    @Override public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("size", width + "x" + height)
          .add("colors", colorCount)
          .add("fill", fillRatio)
          .add("fragmentation", fragmentation)
          .add("edge", edgeShare)
          .add("crossLine", crossLineShare)
          .add("branches", branches)
          .add("maxDepth", maxDepth)
          .toString();
    }
  }

  public static Rating score(Nonogram puzzle, Grid solution, SolveTrace trace, Config config) {
    return score(Features.of(puzzle, solution, trace), config);
  }

  public static Rating score(Features f, Config config) {
    double size = config.sizeWeight * f.maxDimension();
    double colors = config.colorWeight * Math.max(0, f.colorCount - 1);
    double fragmentation = config.fragmentationWeight * f.fragmentation;
    double fillBalance = config.fillWeight * (1.0 - Math.abs(f.fillRatio - 0.5) * 2);
    double base = size + colors + fragmentation + fillBalance;

    double technique = 1.0
        + config.edgeWeight * f.edgeShare
        + config.crossLineWeight * f.crossLineShare;

    double backtrack = config.branchWeight * log2(1 + f.branches)
        + config.depthWeight * f.maxDepth;

    double score = base * technique + backtrack;
    boolean backtracked = f.branches > 0;
    if (backtracked) score = Math.max(score, config.backtrackFloor);

    ImmutableMap<String, Double> factors = ImmutableMap.<String, Double>builder()
        .put("size", size)
        .put("colors", colors)
        .put("fragmentation", fragmentation)
        .put("fillBalance", fillBalance)
        .put("base", base)
        .put("technique", technique)
        .put("backtrack", backtrack)
        .build();
    return new Rating(score, Difficulty.forScore(score, config), backtracked, factors);
  }

  /**
   * A rough tier guess from the clues alone, without solving; useful for
   * ordering or pre-filtering candidates.
   */
  public static Difficulty estimateStructural(Nonogram puzzle) {
    int lines = puzzle.width() + puzzle.height();
    double avgRuns = lines == 0 ? 0 : puzzle.totalRuns() / (double) lines;
    double score = puzzle.cellCount() * (0.5 + avgRuns * 0.2);
    if (score < 20) return Difficulty.TRIVIAL;
    if (score < 50) return Difficulty.EASY;
    if (score < 100) return Difficulty.MEDIUM;
    if (score < 200) return Difficulty.HARD;
    return Difficulty.EXPERT;
  }

  private static double log2(double x) {
    return Math.log(x) / Math.log(2);
  }
}

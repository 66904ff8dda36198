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

import us.blanshard.nonogram.core.Clue;
import us.blanshard.nonogram.core.Grid;
import us.blanshard.nonogram.core.Nonogram;
import us.blanshard.nonogram.core.Run;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import javax.annotation.Nullable;

/**
 * Scores a puzzle's design on a 0 to 100 scale.  Eight factors, each scored
 * from 0 to 1, are combined in a weighted average: fill ratio, aspect ratio,
 * grid size, color effectiveness, clue variety, edge utilization, line balance,
 * and clue density.
 *
 * @author Luke Blanshard
 */
public final class QualityScorer {

  private QualityScorer() {}

  public static Quality score(Nonogram puzzle, Grid solution) {
    checkArgument(puzzle.width() == solution.width() && puzzle.height() == solution.height(),
        "Solution doesn't match puzzle");
    Tally tally = new Tally();
    fillRatio(solution, tally);
    aspectRatio(puzzle, tally);
    gridSize(puzzle, tally);
    colorEffectiveness(puzzle, solution, tally);
    clueVariety(puzzle, tally);
    edgeUtilization(solution, tally);
    lineBalance(puzzle, tally);
    clueDensity(puzzle, tally);

    double raw = tally.weightedSum / tally.totalWeight * 100;
    double rounded = Math.round(raw * 10) / 10.0;
    return new Quality(rounded, Quality.Grade.forScore(raw), tally.factors.build(),
        ImmutableList.copyOf(tally.notes));
  }

  private static class Tally {
    final ImmutableMap.Builder<String, Double> factors = ImmutableMap.builder();
    final List<String> notes = new ArrayList<String>();
    double weightedSum;
    double totalWeight;

    void add(String name, double weight, double score, @Nullable String note) {
      factors.put(name, score);
      weightedSum += weight * score;
      totalWeight += weight;
      if (note != null) notes.add(note);
    }
  }

  private static String percent(double ratio) {
    return String.format(Locale.ROOT, "%.0f%%", ratio * 100);
  }

  private static String dims(Nonogram puzzle) {
    return puzzle.width() + "x" + puzzle.height();
  }

  /** Between 35% and 65% filled is ideal. */
  static void fillRatio(Grid solution, Tally tally) {
    int total = solution.cellCount();
    double ratio = total == 0 ? 0 : solution.coloredCount() / (double) total;
    double score;
    String note = null;
    if (ratio >= 0.35 && ratio <= 0.65) {
      score = 1.0;
    } else if (ratio < 0.20) {
      score = ratio / 0.20 * 0.5;
      note = "Very sparse (" + percent(ratio) + " filled)";
    } else if (ratio < 0.35) {
      score = 0.5 + (ratio - 0.20) / 0.15 * 0.5;
      note = "Sparse (" + percent(ratio) + " filled)";
    } else if (ratio > 0.80) {
      score = Math.max(0.3, 1.0 - (ratio - 0.80) / 0.20);
      note = "Very dense (" + percent(ratio) + " filled)";
    } else {
      score = 1.0 - (ratio - 0.65) / 0.15 * 0.3;
    }
    tally.add("fillRatio", 1.5, score, note);
  }

  /** Closer to square is better. */
  static void aspectRatio(Nonogram puzzle, Tally tally) {
    int min = Math.min(puzzle.width(), puzzle.height());
    double ratio = min == 0 ? 1 : Math.max(puzzle.width(), puzzle.height()) / (double) min;
    double score;
    String note = null;
    if (ratio <= 1.5) {
      score = 1.0;
    } else if (ratio <= 2.0) {
      score = 1.0 - (ratio - 1.5) / 0.5 * 0.2;
    } else if (ratio <= 3.0) {
      score = 0.8 - (ratio - 2.0) * 0.3;
      note = String.format(Locale.ROOT, "Elongated aspect ratio (%.1f:1)", ratio);
    } else {
      score = Math.max(0.3, 0.5 - (ratio - 3.0) / 2.0 * 0.2);
      note = String.format(Locale.ROOT, "Very elongated aspect ratio (%.1f:1)", ratio);
    }
    tally.add("aspectRatio", 0.8, score, note);
  }

  /** From 8x8 up to 25x25 is the sweet spot. */
  static void gridSize(Nonogram puzzle, Tally tally) {
    int min = Math.min(puzzle.width(), puzzle.height());
    int max = Math.max(puzzle.width(), puzzle.height());
    double score;
    String note = null;
    if (min < 5) {
      score = 0.3;
      note = "Very small grid (" + dims(puzzle) + ")";
    } else if (min < 8) {
      score = 0.5 + (min - 5) / 3.0 * 0.3;
      note = "Small grid (" + dims(puzzle) + ")";
    } else if (max > 35) {
      score = 0.4;
      note = "Very large grid (" + dims(puzzle) + ")";
    } else if (max > 25) {
      score = 0.7 - (max - 25) / 10.0 * 0.3;
      note = "Large grid (" + dims(puzzle) + ")";
    } else {
      score = 1.0;
    }
    tally.add("gridSize", 1.0, score, note);
  }

  /** Every color should carry a meaningful share of the picture. */
  static void colorEffectiveness(Nonogram puzzle, Grid solution, Tally tally) {
    if (puzzle.palette().size() <= 1) {
      tally.add("colorEffectiveness", 1.2, 0.5, "Single color puzzle");
      return;
    }
    int[] counts = new int[puzzle.colorCount()];
    for (int i = 0; i < solution.cellCount(); ++i)
      ++counts[solution.get(i)];
    int filled = solution.cellCount() - counts[0];
    if (filled == 0) {
      tally.add("colorEffectiveness", 1.2, 0.3, "No filled cells");
      return;
    }

    List<String> issues = new ArrayList<String>();
    int tiny = 0;
    double maxShare = 0;
    boolean balanced = true;
    for (int color = 1; color < counts.length; ++color) {
      if (counts[color] == 0) continue;
      double share = counts[color] / (double) filled;
      if (share < 0.03 && counts[color] < 5) ++tiny;
      maxShare = Math.max(maxShare, share);
      if (share < 0.10 || share > 0.60) balanced = false;
    }
    if (tiny > 0) issues.add(tiny + " colors with minimal use");
    if (maxShare > 0.85) {
      issues.add("One color dominates (" + percent(maxShare) + ")");
    } else if (maxShare > 0.75) {
      issues.add("Color imbalance (" + percent(maxShare) + " from one)");
    }

    double score = 1.0;
    if (tiny > 0) score -= 0.15 * Math.min(tiny, 3) / 3;
    if (maxShare > 0.75) score -= (maxShare - 0.75) / 0.25 * 0.3;
    if (balanced) score = Math.min(1.0, score + 0.1);
    score = Math.max(0.2, score);
    String note = issues.isEmpty() ? null : Joiner.on("; ").join(issues);
    tally.add("colorEffectiveness", 1.2, score, note);
  }

  /** A mix of run lengths is more interesting than monotony. */
  static void clueVariety(Nonogram puzzle, Tally tally) {
    SummaryStatistics lengths = new SummaryStatistics();
    Set<Integer> distinct = new HashSet<Integer>();
    for (Clue clue : allClues(puzzle)) {
      for (Run run : clue) {
        lengths.addValue(run.length);
        distinct.add(run.length);
      }
    }
    if (lengths.getN() == 0) {
      tally.add("clueVariety", 1.0, 0.5, "No clues");
      return;
    }

    double score;
    String note = null;
    double max = lengths.getMax();
    if (distinct.size() == 1) {
      score = 0.3;
      note = "All clues are length " + distinct.iterator().next();
    } else if (distinct.size() <= 2 && max <= 2) {
      score = 0.5;
      note = "Limited clue variety (all short)";
    } else if (max <= 2) {
      score = 0.6;
      note = "No long clues";
    } else {
      double cv = lengths.getStandardDeviation() / lengths.getMean();
      if (cv < 0.3) {
        score = 0.7;
        note = "Low clue variety";
      } else if (cv > 1.5) {
        score = 0.8;
      } else {
        score = 1.0;
      }
    }
    tally.add("clueVariety", 1.0, score, note);
  }

  /** The picture should reach the borders rather than float in the middle. */
  static void edgeUtilization(Grid solution, Tally tally) {
    int h = solution.height(), w = solution.width();
    int edgeFilled = 0, edgeTotal = 0, centerFilled = 0, centerTotal = 0;
    for (int r = 0; r < h; ++r) {
      for (int c = 0; c < w; ++c) {
        boolean filled = solution.get(r, c) != 0;
        if (r == 0 || r == h - 1 || c == 0 || c == w - 1) {
          ++edgeTotal;
          if (filled) ++edgeFilled;
        } else {
          ++centerTotal;
          if (filled) ++centerFilled;
        }
      }
    }
    if (edgeTotal == 0) {
      tally.add("edgeUtilization", 1.0, 1.0, null);
      return;
    }

    double edge = edgeFilled / (double) edgeTotal;
    double center = centerTotal == 0 ? 0 : centerFilled / (double) centerTotal;
    double score;
    String note = null;
    if (edge < 0.1 && center > 0.3) {
      score = 0.5;
      note = "Content doesn't reach edges (floating)";
    } else if (edge < 0.2 && center > edge * 2) {
      score = 0.7;
      note = "Sparse edges";
    } else {
      double balance = center > 0 ? Math.min(edge / center, center / edge) : edge;
      score = 0.6 + balance * 0.4;
    }
    tally.add("edgeUtilization", 1.0, Math.min(1.0, score), note);
  }

  /** A good puzzle mixes simple lines with complex ones. */
  static void lineBalance(Nonogram puzzle, Tally tally) {
    SummaryStatistics runCounts = new SummaryStatistics();
    int trivial = 0, complex = 0;
    for (Clue clue : allClues(puzzle)) {
      runCounts.addValue(clue.size());
      if (clue.size() <= 1) ++trivial;
      if (clue.size() >= 4) ++complex;
    }
    if (runCounts.getN() == 0 || runCounts.getMax() == 0) {
      tally.add("lineBalance", 0.8, 0.5, "Empty puzzle");
      return;
    }

    double trivialRatio = trivial / (double) runCounts.getN();
    double complexRatio = complex / (double) runCounts.getN();
    List<String> issues = new ArrayList<String>();
    double score = 1.0;
    if (trivialRatio > 0.5) {
      score -= 0.3;
      issues.add(percent(trivialRatio) + " trivial lines");
    } else if (trivialRatio > 0.3) {
      score -= 0.1;
    }
    if (complexRatio > 0.1 && trivialRatio < 0.4) score = Math.min(1.0, score + 0.1);
    if (runCounts.getN() > 1 && runCounts.getVariance() < 0.5 && runCounts.getMean() > 1) {
      issues.add("Monotonous line complexity");
      score -= 0.15;
    }
    score = Math.max(0.3, score);
    tally.add("lineBalance", 0.8, score, issues.isEmpty() ? null : Joiner.on("; ").join(issues));
  }

  /** Lines with too many runs are hard to display and to read. */
  static void clueDensity(Nonogram puzzle, Tally tally) {
    int max = 0, many = 0, lines = 0;
    for (Clue clue : allClues(puzzle)) {
      ++lines;
      max = Math.max(max, clue.size());
      if (clue.size() >= 10) ++many;
    }
    if (lines == 0) {
      tally.add("clueDensity", 1.5, 0.5, "No clues");
      return;
    }

    double score;
    String note = null;
    if (max <= 8) {
      score = 1.0;
    } else if (max <= 10) {
      score = 0.95;
    } else if (max <= 12) {
      score = 0.85;
      note = "Dense clues (max " + max + "/line)";
    } else if (max <= 15) {
      score = 0.65;
      note = "Very dense clues (max " + max + "/line)";
    } else if (max <= 20) {
      score = 0.4;
      note = "Overcrowded clues (max " + max + "/line)";
    } else {
      score = 0.2;
      note = "Unplayable clue density (max " + max + "/line)";
    }

    double manyRatio = many / (double) lines;
    if (manyRatio > 0.3 && max > 10) {
      score *= 0.9;
      String extra = percent(manyRatio) + " lines have 10+ clues";
      note = note == null ? extra : note + "; " + extra;
    }
    tally.add("clueDensity", 1.5, Math.max(0.1, score), note);
  }

  private static List<Clue> allClues(Nonogram puzzle) {
    List<Clue> answer = new ArrayList<Clue>(puzzle.rowClues());
    answer.addAll(puzzle.columnClues());
    return answer;
  }
}

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

import us.blanshard.nonogram.core.Clue;
import us.blanshard.nonogram.core.Config;
import us.blanshard.nonogram.core.Nonogram;
import us.blanshard.nonogram.core.Palette;

import java.util.List;
import java.util.Locale;

import javax.annotation.Nullable;

/**
 * Cheap structural checks run before solving.  Each returns the rejection it
 * finds, or null if the puzzle passes.
 *
 * @author Luke Blanshard
 */
public final class ValidationRules {

  /**
   * Runs every check, in order of cost: emptiness, color budget, color
   * separability, clue density, feasibility.  Returns the first rejection
   * found, or null.
   */
  @Nullable public static Rejection validate(Nonogram puzzle, Config config) {
    Rejection rejection = checkEmpty(puzzle);
    if (rejection == null) rejection = checkColorBudget(puzzle.palette(), config);
    if (rejection == null) rejection = checkSeparability(puzzle.palette(), config);
    if (rejection == null) rejection = checkDensity(puzzle, config);
    if (rejection == null) rejection = checkFeasibility(puzzle);
    return rejection;
  }

  @Nullable public static Rejection checkEmpty(Nonogram puzzle) {
    if (puzzle.cellCount() == 0 || puzzle.isBlank()) return Rejection.empty();
    return null;
  }

  @Nullable public static Rejection checkColorBudget(Palette palette, Config config) {
    if (palette.size() > config.maxColors)
      return Rejection.tooManyColors(palette.size(), config.maxColors);
    return null;
  }

  /** Compares every pair of palette colors; the background takes no part. */
  @Nullable public static Rejection checkSeparability(Palette palette, Config config) {
    for (int i = 1; i <= palette.size(); ++i) {
      for (int j = i + 1; j <= palette.size(); ++j) {
        double distance = palette.get(i).distanceTo(palette.get(j));
        if (distance < config.minColorDistance)
          return Rejection.colorsTooSimilar(i, j, distance, config.minColorDistance);
      }
    }
    return null;
  }

  @Nullable public static Rejection checkDensity(Nonogram puzzle, Config config) {
    Rejection rejection = checkDensity(puzzle.rowClues(), "row", config);
    return rejection != null ? rejection : checkDensity(puzzle.columnClues(), "column", config);
  }

  @Nullable private static Rejection checkDensity(List<Clue> clues, String kind, Config config) {
    for (int i = 0; i < clues.size(); ++i) {
      if (clues.get(i).size() > config.maxCluesPerLine)
        return Rejection.tooDense(kind + " " + i, clues.get(i).size(), config.maxCluesPerLine);
    }
    return null;
  }

  /**
   * Looks for clue arithmetic that no grid could satisfy: a line whose runs
   * and mandatory gaps don't fit in it, or a color whose row totals differ
   * from its column totals.
   */
  @Nullable public static Rejection checkFeasibility(Nonogram puzzle) {
    Rejection rejection = checkFit(puzzle.rowClues(), puzzle.width(), "row");
    if (rejection == null) rejection = checkFit(puzzle.columnClues(), puzzle.height(), "column");
    if (rejection != null) return rejection;

    for (int color = 1; color <= puzzle.palette().size(); ++color) {
      int rowTotal = 0, columnTotal = 0;
      for (Clue clue : puzzle.rowClues()) rowTotal += clue.count(color);
      for (Clue clue : puzzle.columnClues()) columnTotal += clue.count(color);
      if (rowTotal != columnTotal)
        return Rejection.infeasible(String.format(Locale.ROOT,
            "color %d: rows call for %d cells, columns for %d", color, rowTotal, columnTotal));
    }
    return null;
  }

  @Nullable private static Rejection checkFit(List<Clue> clues, int length, String kind) {
    for (int i = 0; i < clues.size(); ++i) {
      int min = clues.get(i).minLength();
      if (min > length)
        return Rejection.infeasible(
            String.format(Locale.ROOT, "%s %d needs %d cells but has %d", kind, i, min, length),
            kind + " " + i);
    }
    return null;
  }

  // Static methods only.
  private ValidationRules() {}
}

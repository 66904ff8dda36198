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

import us.blanshard.nonogram.core.Clue;
import us.blanshard.nonogram.core.Grid;
import us.blanshard.nonogram.core.Nonogram;

/**
 * Exhaustive enumeration, for checking the solver on small inputs.
 */
public class BruteForce {

  /**
   * Returns, for each cell, the bit set of colors it takes in some line that
   * matches the clue and the cells' candidates; or null if there is no such
   * line.
   */
  public static int[] linePossibilities(Clue clue, int[] cells, int colorCount) {
    int n = cells.length;
    int[] line = new int[n];
    int[] possible = new int[n];
    boolean found = false;
    long combos = (long) Math.pow(colorCount, n);
    for (long code = 0; code < combos; ++code) {
      long rest = code;
      boolean allowed = true;
      for (int p = 0; p < n; ++p) {
        line[p] = (int) (rest % colorCount);
        rest /= colorCount;
        if ((cells[p] & (1 << line[p])) == 0) allowed = false;
      }
      if (!allowed || !Clue.fromLine(line).equals(clue)) continue;
      found = true;
      for (int p = 0; p < n; ++p)
        possible[p] |= 1 << line[p];
    }
    return found ? possible : null;
  }

  /** Counts the grids satisfying the puzzle's clues, stopping at the given limit. */
  public static int countSolutions(Nonogram puzzle, int limit) {
    int w = puzzle.width(), h = puzzle.height(), k = puzzle.colorCount();
    int cells = w * h;
    long combos = (long) Math.pow(k, cells);
    int count = 0;
    for (long code = 0; code < combos && count < limit; ++code) {
      Grid.Builder builder = Grid.builder(w, h);
      long rest = code;
      for (int i = 0; i < cells; ++i) {
        builder.set(i / w, i % w, (int) (rest % k));
        rest /= k;
      }
      Grid grid = builder.build();
      if (grid.rowClues().equals(puzzle.rowClues())
          && grid.columnClues().equals(puzzle.columnClues())) {
        ++count;
      }
    }
    return count;
  }

  private BruteForce() {}
}

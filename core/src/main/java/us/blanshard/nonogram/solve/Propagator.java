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

import us.blanshard.nonogram.core.Nonogram;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Runs the line solver over the dirty rows, then the dirty columns, of a work
 * grid, over and over until a pass changes nothing or a line turns out to be
 * unsatisfiable.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Propagator {
  private final Nonogram puzzle;
  private final WorkGrid grid;
  private final SolveTrace trace;
  private final Budget budget;
  private final LineSolver solver = new LineSolver();
  private final int[] before;
  private final int[] after;

  public Propagator(Nonogram puzzle, WorkGrid grid, SolveTrace trace, Budget budget) {
    checkArgument(puzzle.width() == grid.width() && puzzle.height() == grid.height(),
        "Grid doesn't match puzzle");
    this.puzzle = puzzle;
    this.grid = grid;
    this.trace = trace;
    this.budget = budget;
    int size = Math.max(puzzle.width(), puzzle.height());
    this.before = new int[size];
    this.after = new int[size];
  }

  /**
   * Propagates to a fixpoint from the unguessed grid.
   *
   * @see #propagate(int)
   */
  public boolean propagate() {
    return propagate(0);
  }

  /**
   * Propagates to a fixpoint.  Returns false if some line has no placement
   * consistent with the grid; the grid may then be partly narrowed, and the
   * caller is expected to roll it back.  At a search depth above zero every
   * deduction rests on a guessed cell, so all of them count as cross-line.
   *
   * @throws Budget.ExhaustedException if the budget runs out along the way
   */
  public boolean propagate(int depth) {
    checkArgument(depth >= 0, "Negative depth %s", depth);
    int pass = depth == 0 ? 0 : 1;
    while (grid.hasDirtyLines()) {
      ++pass;
      trace.pass();
      for (int r = 0; r < grid.height(); ++r) {
        if (grid.isRowDirty(r) && !solveRow(r, pass)) return contradiction();
      }
      for (int c = 0; c < grid.width(); ++c) {
        if (grid.isColumnDirty(c) && !solveColumn(c, pass)) return contradiction();
      }
    }
    if (!grid.isSolved()) trace.stall();
    return true;
  }

  private boolean contradiction() {
    trace.contradiction();
    return false;
  }

  private boolean solveRow(int row, int pass) {
    budget.check();
    trace.lineSolve();
    int width = grid.width();
    grid.readRow(row, before);
    System.arraycopy(before, 0, after, 0, width);
    if (!solver.solve(puzzle.rowClue(row), after, width)) return false;
    for (int c = 0; c < width; ++c)
      apply(grid.index(row, c), c, pass);
    grid.clearRowDirty(row);
    return true;
  }

  private boolean solveColumn(int col, int pass) {
    budget.check();
    trace.lineSolve();
    int height = grid.height();
    grid.readColumn(col, before);
    System.arraycopy(before, 0, after, 0, height);
    if (!solver.solve(puzzle.columnClue(col), after, height)) return false;
    for (int r = 0; r < height; ++r)
      apply(grid.index(r, col), r, pass);
    grid.clearColumnDirty(col);
    return true;
  }

  private void apply(int index, int position, int pass) {
    int mask = after[position];
    if (mask == before[position]) return;
    grid.narrow(index, mask);
    if (!WorkGrid.isSingle(mask)) {
      trace.elimination();
    } else if (pass > 1) {
      trace.crossLine();
    } else if (solver.isOverlap(position)) {
      trace.overlap();
    } else {
      trace.edge();
    }
  }
}

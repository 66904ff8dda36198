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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static org.junit.Assert.fail;
import static us.blanshard.nonogram.core.Fixtures.BRANCHING;
import static us.blanshard.nonogram.core.Fixtures.DUO;
import static us.blanshard.nonogram.core.Fixtures.MONO;
import static us.blanshard.nonogram.core.Fixtures.PLUS;
import static us.blanshard.nonogram.core.Fixtures.mono;

import us.blanshard.nonogram.core.Clue;
import us.blanshard.nonogram.core.Fixtures;
import us.blanshard.nonogram.core.Grid;
import us.blanshard.nonogram.core.Nonogram;

import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;

import org.junit.Test;

import java.util.Random;

public class PropagatorTest {

  private final SolveTrace trace = new SolveTrace();
  private final Budget budget = new Budget(60000, 1000, Ticker.systemTicker());

  private Propagator propagator(Nonogram puzzle, WorkGrid grid) {
    return new Propagator(puzzle, grid, trace, budget);
  }

  @Test public void plusSolvesInOnePass() {
    Nonogram puzzle = mono(PLUS);
    WorkGrid grid = new WorkGrid(puzzle);
    assertThat(propagator(puzzle, grid).propagate()).isTrue();
    assertThat(grid.isSolved()).isTrue();
    assertThat(grid.toGrid()).isEqualTo(PLUS);

    // The middle row and column by overlap, the rest from the middle row's cells.
    assertThat(trace.overlapCells()).isEqualTo(9);
    assertThat(trace.edgeCells()).isEqualTo(16);
    assertThat(trace.crossLineCells()).isEqualTo(0);
    assertThat(trace.stalls()).isEqualTo(0);
    // The second pass finds nothing new.
    assertThat(trace.passes()).isEqualTo(2);
  }

  @Test public void deductionsAfterAGuessCountAsCrossLine() {
    Nonogram puzzle = mono(PLUS);
    WorkGrid grid = new WorkGrid(puzzle);
    assertThat(propagator(puzzle, grid).propagate(1)).isTrue();
    assertThat(grid.toGrid()).isEqualTo(PLUS);
    assertThat(trace.overlapCells()).isEqualTo(0);
    assertThat(trace.edgeCells()).isEqualTo(0);
    assertThat(trace.crossLineCells()).isEqualTo(25);
  }

  @Test public void laterPassesCountAsCrossLine() {
    Grid source = Grid.fromString(
        "1111.\n" +
        "1...1\n" +
        ".1111\n" +
        "111.1\n" +
        ".1.1.\n");
    Nonogram puzzle = mono(source);
    WorkGrid grid = new WorkGrid(puzzle);
    assertThat(propagator(puzzle, grid).propagate()).isTrue();
    assertThat(grid.toGrid()).isEqualTo(source);
    assertThat(trace.crossLineCells()).isGreaterThan(0);
    assertThat(trace.propagatedCells()).isEqualTo(25);
  }

  @Test public void stallsWhenNoLineAllowsDeduction() {
    Nonogram puzzle = mono(BRANCHING);
    WorkGrid grid = new WorkGrid(puzzle);
    assertThat(propagator(puzzle, grid).propagate()).isTrue();
    assertThat(grid.unknownCount()).isEqualTo(16);
    assertThat(trace.stalls()).isEqualTo(1);
    assertThat(trace.propagatedCells()).isEqualTo(0);
  }

  @Test public void reportsContradiction() {
    Nonogram puzzle = Nonogram.of(MONO,
        ImmutableList.of(Clue.fromString("2c1"), Clue.EMPTY),
        ImmutableList.of(Clue.fromString("1c1"), Clue.EMPTY));
    WorkGrid grid = new WorkGrid(puzzle);
    assertThat(propagator(puzzle, grid).propagate()).isFalse();
    assertThat(trace.contradictions()).isEqualTo(1);
  }

  @Test public void fixpointIsIdempotent() {
    Random random = new Random(42);
    LineSolver solver = new LineSolver();
    for (int trial = 0; trial < 50; ++trial) {
      Nonogram puzzle = Nonogram.fromGrid(Fixtures.random(random, 10, 8, 2), DUO);
      WorkGrid grid = new WorkGrid(puzzle);
      assertThat(propagator(puzzle, grid).propagate()).isTrue();

      int[] before = new int[10];
      int[] after = new int[10];
      for (int r = 0; r < grid.height(); ++r) {
        grid.readRow(r, before);
        grid.readRow(r, after);
        assertThat(solver.solve(puzzle.rowClue(r), after, grid.width())).isTrue();
        assertWithMessage("row " + r).that(after).isEqualTo(before);
      }
      for (int c = 0; c < grid.width(); ++c) {
        grid.readColumn(c, before);
        grid.readColumn(c, after);
        assertThat(solver.solve(puzzle.columnClue(c), after, grid.height())).isTrue();
        assertWithMessage("column " + c).that(after).isEqualTo(before);
      }
      assertThat(grid.hasDirtyLines()).isFalse();
    }
  }

  @Test public void checksBudgetPerLine() {
    Nonogram puzzle = mono(PLUS);
    Budget spent = new Budget(1, 1, new Ticker() {
      long nanos;
      @Override public long read() {
        return nanos += 2000000;
      }
    });
    try {
      new Propagator(puzzle, new WorkGrid(puzzle), trace, spent).propagate();
      fail();
    } catch (Budget.ExhaustedException e) {
      assertThat(e.kind).isEqualTo(Budget.Kind.TIME);
    }
  }
}

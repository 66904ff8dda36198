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
package us.blanshard.nonogram.core;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;

import org.junit.Test;

public class GridTest {

  @Test public void parsesAndPrints() {
    Grid grid = Grid.fromString("\n  1.2\n  .33\n");
    assertThat(grid.width()).isEqualTo(3);
    assertThat(grid.height()).isEqualTo(2);
    assertThat(grid.get(0, 2)).isEqualTo(2);
    assertThat(grid.get(4)).isEqualTo(3);
    assertThat(grid.toString()).isEqualTo("1.2\n.33");
    assertThat(Grid.fromRows(ImmutableList.of("1.2", ".33"))).isEqualTo(grid);
    assertThat(Grid.of(new int[][] {{1, 0, 2}, {0, 3, 3}})).isEqualTo(grid);
  }

  @Test public void rejectsRaggedRows() {
    try {
      Grid.fromString("11\n1\n");
      fail();
    } catch (IllegalArgumentException expected) {
    }
  }

  @Test public void highColorsPrintAsHash() {
    Grid grid = Grid.builder(2, 1).set(0, 0, 12).set(0, 1, 3).build();
    assertThat(grid.toString()).isEqualTo("#3");
  }

  @Test public void derivesClues() {
    Grid grid = Grid.fromString(
        "112\n" +
        "1.2\n" +
        "...\n");
    assertThat(grid.rowClues()).containsExactly(
        Clue.fromString("2c1 1c2"), Clue.fromString("1c1 1c2"), Clue.EMPTY).inOrder();
    assertThat(grid.columnClues()).containsExactly(
        Clue.fromString("2c1"), Clue.fromString("1c1"), Clue.fromString("2c2")).inOrder();
  }

  @Test public void countsColors() {
    Grid grid = Grid.fromString("1.3\n3.1\n");
    assertThat(grid.maxColor()).isEqualTo(3);
    assertThat(grid.distinctColors()).isEqualTo(2);
    assertThat(grid.coloredCount()).isEqualTo(4);
    assertThat(grid.cellCount()).isEqualTo(6);
  }

  @Test public void trimRemovesEmptyBorders() {
    Grid grid = Grid.fromString(
        ".....\n" +
        "..1..\n" +
        ".2.1.\n" +
        ".....\n");
    assertThat(grid.trim()).isEqualTo(Grid.fromString(".1.\n2.1\n"));
    Grid tight = Grid.fromString("1.\n.1\n");
    assertThat(tight.trim()).isSameInstanceAs(tight);
  }

  @Test public void blankGridTrimsToNothing() {
    Grid trimmed = Grid.fromString("...\n...\n").trim();
    assertThat(trimmed.width()).isEqualTo(0);
    assertThat(trimmed.height()).isEqualTo(0);
  }

  @Test public void builderCopiesOnBuild() {
    Grid.Builder builder = Grid.builder(2, 2).set(0, 0, 1);
    Grid first = builder.build();
    builder.set(1, 1, 1);
    assertThat(first.get(1, 1)).isEqualTo(0);
    assertThat(first.toBuilder().set(1, 1, 1).build()).isEqualTo(builder.build());
  }

  @Test public void nonogramRejectsColorsOutsidePalette() {
    try {
      Nonogram.fromGrid(Grid.fromString("12\n"), Fixtures.MONO);
      fail();
    } catch (IllegalArgumentException expected) {
    }
  }

  @Test public void nonogramSummarizesClues() {
    Nonogram puzzle = Nonogram.fromGrid(Fixtures.PLUS, Fixtures.MONO);
    assertThat(puzzle.width()).isEqualTo(5);
    assertThat(puzzle.colorCount()).isEqualTo(2);
    assertThat(puzzle.totalRuns()).isEqualTo(10);
    assertThat(puzzle.isBlank()).isFalse();
    assertThat(Nonogram.fromGrid(Grid.fromString("..\n"), Fixtures.MONO).isBlank()).isTrue();
  }
}

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
import static org.junit.Assert.fail;
import static us.blanshard.nonogram.core.Fixtures.BRANCHING;
import static us.blanshard.nonogram.core.Fixtures.TRIO;
import static us.blanshard.nonogram.core.Fixtures.mono;

import us.blanshard.nonogram.core.Grid;
import us.blanshard.nonogram.core.Nonogram;

import org.junit.Test;

public class WorkGridTest {

  @Test public void startsWithColorsMentionedByBothLines() {
    Nonogram puzzle = Nonogram.fromGrid(Grid.fromString("12\n3.\n"), TRIO);
    WorkGrid grid = new WorkGrid(puzzle);
    // Bit c stands for color c; bit 0 for empty.
    assertThat(grid.mask(grid.index(0, 0))).isEqualTo(0b0011);
    assertThat(grid.mask(grid.index(0, 1))).isEqualTo(0b0101);
    assertThat(grid.mask(grid.index(1, 0))).isEqualTo(0b1001);
    assertThat(grid.mask(grid.index(1, 1))).isEqualTo(0b0001);
    assertThat(grid.unknownCount()).isEqualTo(3);
    assertThat(grid.hasDirtyLines()).isTrue();
  }

  @Test public void rollbackRestoresState() {
    WorkGrid grid = new WorkGrid(mono(BRANCHING));
    grid.clearRowDirty(0);
    grid.clearColumnDirty(1);
    int mark = grid.mark();
    assertThat(grid.assign(1, 1)).isTrue();
    assertThat(grid.assign(1, 1)).isFalse();
    assertThat(grid.narrow(5, 1)).isTrue();
    assertThat(grid.unknownCount()).isEqualTo(14);
    assertThat(grid.colorAt(1)).isEqualTo(1);
    assertThat(grid.isRowDirty(0)).isTrue();
    assertThat(grid.isColumnDirty(1)).isTrue();

    grid.rollback(mark);
    assertThat(grid.unknownCount()).isEqualTo(16);
    assertThat(grid.colorAt(1)).isEqualTo(-1);
    assertThat(grid.mask(5)).isEqualTo(3);
  }

  @Test public void narrowRejectsNonSubsets() {
    WorkGrid grid = new WorkGrid(mono(BRANCHING));
    grid.assign(0, 0);
    try {
      grid.narrow(0, 2);
      fail();
    } catch (IllegalArgumentException expected) {
    }
  }

  @Test public void mostConstrainedCellPrefersFirstInRowMajorOrder() {
    Nonogram puzzle = Nonogram.fromGrid(Grid.fromString("11\n22\n"), TRIO);
    WorkGrid grid = new WorkGrid(puzzle);
    // Every cell starts with two candidates.
    assertThat(grid.mostConstrainedCell()).isEqualTo(0);
    grid.assign(0, 1);
    assertThat(grid.mostConstrainedCell()).isEqualTo(1);
    grid.assign(1, 1);
    grid.assign(2, 2);
    grid.assign(3, 0);
    assertThat(grid.mostConstrainedCell()).isEqualTo(-1);
    assertThat(grid.toGrid().toString()).isEqualTo("11\n2.");
  }

  @Test public void toStringShowsUnknowns() {
    WorkGrid grid = new WorkGrid(mono(Grid.fromString("11\n11\n")));
    grid.assign(0, 1);
    grid.assign(3, 0);
    assertThat(grid.toString()).isEqualTo("1?\n?.");
  }
}

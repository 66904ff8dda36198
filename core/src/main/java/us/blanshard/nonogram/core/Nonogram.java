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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * A puzzle as the solver sees it: dimensions, palette, and the row and column
 * clues.  The grid the clues came from is not part of it.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Nonogram {
  private final int width;
  private final int height;
  private final Palette palette;
  private final ImmutableList<Clue> rowClues;
  private final ImmutableList<Clue> columnClues;

  private Nonogram(int width, int height, Palette palette,
      ImmutableList<Clue> rowClues, ImmutableList<Clue> columnClues) {
    this.width = width;
    this.height = height;
    this.palette = palette;
    this.rowClues = rowClues;
    this.columnClues = columnClues;
  }

  /** Derives the clues by run-length encoding the grid's rows and columns. */
  public static Nonogram fromGrid(Grid grid, Palette palette) {
    checkArgument(grid.maxColor() <= palette.size(),
        "Grid uses color %s but the palette has only %s", grid.maxColor(), palette.size());
    return new Nonogram(grid.width(), grid.height(), palette, grid.rowClues(), grid.columnClues());
  }

  public static Nonogram of(Palette palette, List<Clue> rowClues, List<Clue> columnClues) {
    checkNotNull(palette);
    for (Clue clue : rowClues)
      checkColors(clue, palette);
    for (Clue clue : columnClues)
      checkColors(clue, palette);
    return new Nonogram(columnClues.size(), rowClues.size(), palette,
        ImmutableList.copyOf(rowClues), ImmutableList.copyOf(columnClues));
  }

  private static void checkColors(Clue clue, Palette palette) {
    for (Run run : clue)
      checkArgument(run.color <= palette.size(),
          "Clue %s uses color %s outside the palette", clue, run.color);
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public int cellCount() {
    return width * height;
  }

  public Palette palette() {
    return palette;
  }

  /** The number of cell states: the palette's colors plus empty. */
  public int colorCount() {
    return palette.size() + 1;
  }

  public Clue rowClue(int row) {
    return rowClues.get(row);
  }

  public Clue columnClue(int col) {
    return columnClues.get(col);
  }

  public ImmutableList<Clue> rowClues() {
    return rowClues;
  }

  public ImmutableList<Clue> columnClues() {
    return columnClues;
  }

  /** The total number of runs in all rows and columns. */
  public int totalRuns() {
    int total = 0;
    for (Clue clue : rowClues) total += clue.size();
    for (Clue clue : columnClues) total += clue.size();
    return total;
  }

  /** Tells whether every row and column clue is empty. */
  public boolean isBlank() {
    return totalRuns() == 0;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Nonogram)) return false;
    Nonogram that = (Nonogram) o;
    return this.palette.equals(that.palette)
        && this.rowClues.equals(that.rowClues)
        && this.columnClues.equals(that.columnClues);
  }

  @Override public int hashCode() {
    return (palette.hashCode() * 31 + rowClues.hashCode()) * 31 + columnClues.hashCode();
  }

  @Override public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("width", width)
        .add("height", height)
        .add("palette", palette)
        .add("rows", rowClues)
        .add("columns", columnClues)
        .toString();
  }
}

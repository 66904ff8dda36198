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
import static com.google.common.base.Preconditions.checkState;

import us.blanshard.nonogram.core.Clue;
import us.blanshard.nonogram.core.Grid;
import us.blanshard.nonogram.core.Nonogram;
import us.blanshard.nonogram.core.Run;

import java.util.Arrays;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * The mutable grid state of one solve attempt.  Each cell holds a bit set of
 * the colors still possible for it; a cell with a single bit is determined.
 * Every change is recorded in an undo log, so the search can return to an
 * earlier state with {@link #rollback} instead of copying the grid.
 *
 * <p> The grid also keeps track of which rows and columns have changed since
 * they were last solved.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class WorkGrid {
  private final int width;
  private final int height;
  private final int[] masks;
  private final boolean[] dirtyRows;
  private final boolean[] dirtyColumns;
  private int unknownCount;

  private int[] undoIndices = new int[64];
  private int[] undoMasks = new int[64];
  private int undoSize;

  /**
   * Creates a grid for solving the given puzzle.  A cell may hold a color only
   * if both its row's and its column's clues mention that color.
   */
  public WorkGrid(Nonogram puzzle) {
    this.width = puzzle.width();
    this.height = puzzle.height();
    this.masks = new int[width * height];
    this.dirtyRows = new boolean[height];
    this.dirtyColumns = new boolean[width];
    Arrays.fill(dirtyRows, true);
    Arrays.fill(dirtyColumns, true);

    int[] columnColors = new int[width];
    for (int c = 0; c < width; ++c)
      columnColors[c] = colorsOf(puzzle.columnClue(c));
    for (int r = 0; r < height; ++r) {
      int rowColors = colorsOf(puzzle.rowClue(r));
      for (int c = 0; c < width; ++c) {
        int mask = rowColors & columnColors[c];
        masks[r * width + c] = mask;
        if (!isSingle(mask)) ++unknownCount;
      }
    }
  }

  private static int colorsOf(Clue clue) {
    int bits = 1;  // Empty is always a candidate
    for (Run run : clue)
      bits |= 1 << run.color;
    return bits;
  }

  static boolean isSingle(int mask) {
    return (mask & (mask - 1)) == 0;
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public int index(int row, int col) {
    return row * width + col;
  }

  /** Returns the bit set of possible colors for the cell at the given index. */
  public int mask(int index) {
    return masks[index];
  }

  public boolean isDetermined(int index) {
    return isSingle(masks[index]);
  }

  /** Returns the determined color of a cell, or -1 if it's still unknown. */
  public int colorAt(int index) {
    int mask = masks[index];
    return isSingle(mask) ? Integer.numberOfTrailingZeros(mask) : -1;
  }

  /** The number of cells not yet determined. */
  public int unknownCount() {
    return unknownCount;
  }

  public boolean isSolved() {
    return unknownCount == 0;
  }

  /**
   * Narrows the given cell's candidates to the given subset of them, recording
   * the change for undo and marking the cell's row and column dirty.  Returns
   * true if the cell was changed.
   */
  public boolean narrow(int index, int mask) {
    int old = masks[index];
    checkArgument(mask != 0 && (mask & ~old) == 0,
        "Mask %s is not a non-empty subset of %s", mask, old);
    if (mask == old) return false;
    if (undoSize == undoIndices.length) {
      undoIndices = Arrays.copyOf(undoIndices, undoSize * 2);
      undoMasks = Arrays.copyOf(undoMasks, undoSize * 2);
    }
    undoIndices[undoSize] = index;
    undoMasks[undoSize] = old;
    ++undoSize;
    masks[index] = mask;
    if (isSingle(mask)) --unknownCount;
    dirtyRows[index / width] = true;
    dirtyColumns[index % width] = true;
    return true;
  }

  /** Determines the given cell to have the given color. */
  public boolean assign(int index, int color) {
    return narrow(index, 1 << color);
  }

  /** Returns a marker for the current state, for later use with {@link #rollback}. */
  public int mark() {
    return undoSize;
  }

  /** Undoes every change made since the given mark was taken. */
  public void rollback(int mark) {
    checkArgument(mark >= 0 && mark <= undoSize, "Bad mark %s", mark);
    while (undoSize > mark) {
      --undoSize;
      int index = undoIndices[undoSize];
      if (isSingle(masks[index])) ++unknownCount;
      masks[index] = undoMasks[undoSize];
    }
  }

  /** Copies the given row's masks into the buffer. */
  public void readRow(int row, int[] buffer) {
    System.arraycopy(masks, row * width, buffer, 0, width);
  }

  /** Copies the given column's masks into the buffer. */
  public void readColumn(int col, int[] buffer) {
    for (int r = 0; r < height; ++r)
      buffer[r] = masks[r * width + col];
  }

  public boolean isRowDirty(int row) {
    return dirtyRows[row];
  }

  public boolean isColumnDirty(int col) {
    return dirtyColumns[col];
  }

  public void clearRowDirty(int row) {
    dirtyRows[row] = false;
  }

  public void clearColumnDirty(int col) {
    dirtyColumns[col] = false;
  }

  public boolean hasDirtyLines() {
    for (boolean dirty : dirtyRows) if (dirty) return true;
    for (boolean dirty : dirtyColumns) if (dirty) return true;
    return false;
  }

  /**
   * Finds the undetermined cell with the fewest candidate colors, preferring
   * the first in row-major order among equals.  Returns -1 if every cell is
   * determined.
   */
  public int mostConstrainedCell() {
    int best = -1;
    int bestCount = Integer.MAX_VALUE;
    for (int i = 0; i < masks.length; ++i) {
      int count = Integer.bitCount(masks[i]);
      if (count > 1 && count < bestCount) {
        best = i;
        bestCount = count;
        if (count == 2) break;
      }
    }
    return best;
  }

  /** Converts the solved state to a grid. */
  public Grid toGrid() {
    checkState(isSolved(), "Grid has %s unknown cells", unknownCount);
    Grid.Builder builder = Grid.builder(width, height);
    for (int i = 0; i < masks.length; ++i)
      builder.set(i / width, i % width, colorAt(i));
    return builder.build();
  }

  /** Renders the grid, with "?" for cells that are still unknown. */
  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int r = 0; r < height; ++r) {
      if (r > 0) sb.append('\n');
      for (int c = 0; c < width; ++c) {
        int color = colorAt(index(r, c));
        sb.append(color < 0 ? '?' : color == 0 ? Grid.EMPTY_CHAR : (char) ('0' + color % 10));
      }
    }
    return sb.toString();
  }
}

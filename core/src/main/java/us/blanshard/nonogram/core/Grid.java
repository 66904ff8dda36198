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
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A fully determined nonogram grid: every cell holds a color index, with zero
 * meaning empty.  Grids are immutable; use a {@link Builder} to make one.
 *
 * <p> The text form has one row per line, "." for an empty cell and the digits
 * 1 through 9 for colors.  Colors above 9 print as "#" and can't be read
 * back.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Grid {

  public static final char EMPTY_CHAR = '.';

  private final int width;
  private final int height;
  private final byte[] cells;

  private Grid(int width, int height, byte[] cells) {
    this.width = width;
    this.height = height;
    this.cells = cells;
  }

  public static Builder builder(int width, int height) {
    return new Builder(width, height);
  }

  /** Makes a grid from rows of color indices; all rows must be the same length. */
  public static Grid of(int[][] rows) {
    int width = rows.length == 0 ? 0 : rows[0].length;
    Builder builder = builder(width, rows.length);
    for (int r = 0; r < rows.length; ++r) {
      checkArgument(rows[r].length == width, "Ragged row %s", r);
      for (int c = 0; c < width; ++c)
        builder.set(r, c, rows[r][c]);
    }
    return builder.build();
  }

  /**
   * Parses the text form.  Blank lines are skipped, and surrounding whitespace
   * on each line is ignored.
   */
  public static Grid fromString(String s) {
    List<String> rows = new ArrayList<String>();
    for (String line : Splitter.on('\n').trimResults().omitEmptyStrings().split(s))
      rows.add(line);
    return fromRows(rows);
  }

  /** Parses one text row per list element. */
  public static Grid fromRows(List<String> rows) {
    int width = rows.isEmpty() ? 0 : rows.get(0).length();
    Builder builder = builder(width, rows.size());
    for (int r = 0; r < rows.size(); ++r) {
      String row = rows.get(r);
      checkArgument(row.length() == width, "Row %s has length %s, expected %s",
          r, row.length(), width);
      for (int c = 0; c < width; ++c)
        builder.set(r, c, parseCell(row.charAt(c)));
    }
    return builder.build();
  }

  private static int parseCell(char ch) {
    if (ch == EMPTY_CHAR) return 0;
    checkArgument(ch >= '1' && ch <= '9', "Bad grid character '%s'", ch);
    return ch - '0';
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public int cellCount() {
    return cells.length;
  }

  public int get(int row, int col) {
    checkElementIndex(row, height, "row");
    checkElementIndex(col, width, "col");
    return cells[row * width + col];
  }

  /** Returns the color at the given row-major index. */
  public int get(int index) {
    return cells[index];
  }

  public int[] row(int row) {
    checkElementIndex(row, height, "row");
    int[] answer = new int[width];
    for (int c = 0; c < width; ++c)
      answer[c] = cells[row * width + c];
    return answer;
  }

  public int[] column(int col) {
    checkElementIndex(col, width, "col");
    int[] answer = new int[height];
    for (int r = 0; r < height; ++r)
      answer[r] = cells[r * width + col];
    return answer;
  }

  public Clue rowClue(int row) {
    return Clue.fromLine(row(row));
  }

  public Clue columnClue(int col) {
    return Clue.fromLine(column(col));
  }

  public ImmutableList<Clue> rowClues() {
    ImmutableList.Builder<Clue> builder = ImmutableList.builder();
    for (int r = 0; r < height; ++r)
      builder.add(rowClue(r));
    return builder.build();
  }

  public ImmutableList<Clue> columnClues() {
    ImmutableList.Builder<Clue> builder = ImmutableList.builder();
    for (int c = 0; c < width; ++c)
      builder.add(columnClue(c));
    return builder.build();
  }

  /** The largest color index appearing in the grid, or zero if it's empty. */
  public int maxColor() {
    int max = 0;
    for (byte cell : cells)
      if (cell > max) max = cell;
    return max;
  }

  /** The number of distinct non-empty colors appearing in the grid. */
  public int distinctColors() {
    long seen = 0;
    for (byte cell : cells)
      if (cell != 0) seen |= 1L << cell;
    return Long.bitCount(seen);
  }

  /** The number of non-empty cells. */
  public int coloredCount() {
    int count = 0;
    for (byte cell : cells)
      if (cell != 0) ++count;
    return count;
  }

  /**
   * Returns this grid with its empty border rows and columns removed.  An
   * entirely empty grid trims down to zero by zero.
   */
  public Grid trim() {
    int top = 0, bottom = height - 1, left = 0, right = width - 1;
    while (top <= bottom && isEmptyRow(top)) ++top;
    if (top > bottom) return new Grid(0, 0, new byte[0]);
    while (isEmptyRow(bottom)) --bottom;
    while (isEmptyColumn(left)) ++left;
    while (isEmptyColumn(right)) --right;
    if (top == 0 && left == 0 && bottom == height - 1 && right == width - 1) return this;
    Builder builder = builder(right - left + 1, bottom - top + 1);
    for (int r = top; r <= bottom; ++r)
      for (int c = left; c <= right; ++c)
        builder.set(r - top, c - left, get(r, c));
    return builder.build();
  }

  private boolean isEmptyRow(int row) {
    for (int c = 0; c < width; ++c)
      if (cells[row * width + c] != 0) return false;
    return true;
  }

  private boolean isEmptyColumn(int col) {
    for (int r = 0; r < height; ++r)
      if (cells[r * width + col] != 0) return false;
    return true;
  }

  public Builder toBuilder() {
    return new Builder(width, height, cells.clone());
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Grid)) return false;
    Grid that = (Grid) o;
    return this.width == that.width && Arrays.equals(this.cells, that.cells);
  }

  @Override public int hashCode() {
    return Arrays.hashCode(cells) * 31 + width;
  }

  /** Returns the text form, rows separated by newlines. */
  @Override public String toString() {
    StringBuilder sb = new StringBuilder(cells.length + height);
    for (int r = 0; r < height; ++r) {
      if (r > 0) sb.append('\n');
      for (int c = 0; c < width; ++c) {
        int color = cells[r * width + c];
        sb.append(color == 0 ? EMPTY_CHAR : formatColor(color));
      }
    }
    return sb.toString();
  }

  private static char formatColor(int color) {
    return color <= 9 ? (char) ('0' + color) : '#';
  }

  /**
   * Builds a grid cell by cell.  Cells start out empty.
   */
  @NotThreadSafe
  public static final class Builder {
    private final int width;
    private final int height;
    private final byte[] cells;

    private Builder(int width, int height) {
      this(width, height, newCells(width, height));
    }

    private Builder(int width, int height, byte[] cells) {
      this.width = width;
      this.height = height;
      this.cells = cells;
    }

    private static byte[] newCells(int width, int height) {
      checkArgument(width >= 0 && height >= 0, "Bad dimensions %sx%s", width, height);
      checkArgument((width == 0) == (height == 0), "Bad dimensions %sx%s", width, height);
      return new byte[width * height];
    }

    public Builder set(int row, int col, int color) {
      checkElementIndex(row, height, "row");
      checkElementIndex(col, width, "col");
      checkArgument(color >= 0 && color <= Palette.MAX_SIZE, "Bad color %s", color);
      cells[row * width + col] = (byte) color;
      return this;
    }

    public Grid build() {
      return new Grid(width, height, cells.clone());
    }
  }
}

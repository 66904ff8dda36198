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

import us.blanshard.nonogram.core.Clue;

import java.util.Arrays;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Deduces everything that can be known about a single row or column from its
 * clue and the current candidates of its cells.
 *
 * <p> The solver considers every placement of the clue's runs that agrees
 * with the cells' candidates, and narrows each cell to the colors it takes in
 * at least one of those placements.  This subsumes the overlap technique
 * (cells covered by a run in both its leftmost and rightmost placements), the
 * edge and gap techniques, and forced emptiness between runs.  The placements
 * are not enumerated: a backward pass finds the states from which the rest of
 * the clue can still be placed, and a forward pass walks only the states that
 * are both reachable and completable.
 *
 * <p> The solver also reports which cells were covered by some run's overlap,
 * so callers can tell simple deductions from the rest.
 *
 * <p> Instances keep scratch buffers between calls, and must not be shared
 * between threads.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class LineSolver {
  private static final int EMPTY = 1;

  private int[] runColors = new int[0];
  private int[] runLengths = new int[0];
  private boolean[] gapAfter = new boolean[0];
  private int[] reach = new int[0];      // per run, per position
  private boolean[] completable = new boolean[0];
  private boolean[] reachable = new boolean[0];
  private int[] coverage = new int[0];   // per run, difference array
  private int[] possible = new int[0];
  private int[] leftStart = new int[0];
  private int[] rightStart = new int[0];
  private boolean[] overlap = new boolean[0];
  private int stride;

  /**
   * Narrows the first {@code length} cell masks in {@code cells} to the
   * colors consistent with the clue.  Returns false if no placement of the
   * clue agrees with the cells, in which case the cells are left unchanged.
   */
  public boolean solve(Clue clue, int[] cells, int length) {
    checkArgument(length >= 0 && length <= cells.length, "Bad length %s", length);
    int k = clue.size();
    prepare(clue, k, length);
    Arrays.fill(overlap, 0, length, false);

    if (clue.minLength() > length) return false;
    computeReach(cells, k, length);
    computeCompletable(cells, k, length);
    if (!completable[0]) return false;
    walkForward(cells, k, length);

    for (int p = 0; p < length; ++p)
      cells[p] = possible[p];
    for (int j = 0; j < k; ++j) {
      for (int p = rightStart[j]; p < leftStart[j] + runLengths[j]; ++p)
        overlap[p] = true;
    }
    return true;
  }

  /**
   * Tells whether the given cell, in the most recent successful call to {@link
   * #solve}, lay within the overlap of some run's leftmost and rightmost
   * placements.
   */
  public boolean isOverlap(int position) {
    return overlap[position];
  }

  private void prepare(Clue clue, int k, int n) {
    if (runColors.length < k) {
      runColors = new int[k];
      runLengths = new int[k];
      gapAfter = new boolean[k];
      leftStart = new int[k];
      rightStart = new int[k];
    }
    for (int j = 0; j < k; ++j) {
      runColors[j] = clue.get(j).color;
      runLengths[j] = clue.get(j).length;
      gapAfter[j] = clue.needsGapAfter(j);
      leftStart[j] = Integer.MAX_VALUE;
      rightStart[j] = -1;
    }
    stride = n + 2;
    int states = (k + 1) * stride;
    if (completable.length < states) {
      completable = new boolean[states];
      reachable = new boolean[states];
      reach = new int[states];
      coverage = new int[states];
    }
    if (possible.length < n) {
      possible = new int[n];
      overlap = new boolean[n];
    }
  }

  /** For each run, the number of consecutive cells from each position that allow its color. */
  private void computeReach(int[] cells, int k, int n) {
    for (int j = 0; j < k; ++j) {
      int bit = 1 << runColors[j];
      int base = j * stride;
      reach[base + n] = 0;
      for (int p = n - 1; p >= 0; --p)
        reach[base + p] = (cells[p] & bit) != 0 ? reach[base + p + 1] + 1 : 0;
    }
  }

  /**
   * Fills in {@code completable[j][p]}: whether runs j onward can be placed in
   * cells p onward.
   */
  private void computeCompletable(int[] cells, int k, int n) {
    int base = k * stride;
    completable[base + n] = true;
    for (int p = n - 1; p >= 0; --p)
      completable[base + p] = (cells[p] & EMPTY) != 0 && completable[base + p + 1];

    for (int j = k - 1; j >= 0; --j) {
      base = j * stride;
      completable[base + n] = false;
      for (int p = n - 1; p >= 0; --p)
        completable[base + p] = canSkip(cells, j, p) || canPlace(cells, j, p, n);
    }
  }

  private boolean canSkip(int[] cells, int j, int p) {
    return (cells[p] & EMPTY) != 0 && completable[j * stride + p + 1];
  }

  /** Tells whether run j can start at p with the rest of the clue placeable after it. */
  private boolean canPlace(int[] cells, int j, int p, int n) {
    int end = p + runLengths[j];
    if (reach[j * stride + p] < runLengths[j]) return false;
    int next = (j + 1) * stride;
    if (gapAfter[j]) {
      return end < n && (cells[end] & EMPTY) != 0 && completable[next + end + 1];
    }
    return completable[next + end];
  }

  /**
   * Walks the states reachable from the start that can still be completed,
   * collecting the colors each cell takes along the way and the extreme start
   * positions of each run.
   */
  private void walkForward(int[] cells, int k, int n) {
    Arrays.fill(reachable, 0, (k + 1) * stride, false);
    Arrays.fill(coverage, 0, k * stride, 0);
    Arrays.fill(possible, 0, n, 0);
    reachable[0] = true;

    for (int p = 0; p < n; ++p) {
      for (int j = 0; j <= k; ++j) {
        if (!reachable[j * stride + p] || !completable[j * stride + p]) continue;
        if (canSkip(cells, j, p)) {
          possible[p] |= EMPTY;
          reachable[j * stride + p + 1] = true;
        }
        if (j < k && canPlace(cells, j, p, n)) {
          int end = p + runLengths[j];
          ++coverage[j * stride + p];
          --coverage[j * stride + end];
          if (p < leftStart[j]) leftStart[j] = p;
          if (p > rightStart[j]) rightStart[j] = p;
          if (gapAfter[j]) {
            possible[end] |= EMPTY;
            reachable[(j + 1) * stride + end + 1] = true;
          } else {
            reachable[(j + 1) * stride + end] = true;
          }
        }
      }
    }

    for (int j = 0; j < k; ++j) {
      int bit = 1 << runColors[j];
      int base = j * stride;
      int depth = 0;
      for (int p = 0; p < n; ++p) {
        depth += coverage[base + p];
        if (depth > 0) possible[p] |= bit;
      }
    }
  }
}

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

import com.google.common.base.MoreObjects;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Counters accumulated over one full solve attempt.  Cells resolved by line
 * propagation are split three ways: those found by the overlap of a single
 * run's extreme placements in a first pass over the lines, other first-pass
 * deductions (edges, gaps, multi-run reasoning), and deductions that only
 * became possible after other lines had been solved.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class SolveTrace {
  private int overlapCells;
  private int edgeCells;
  private int crossLineCells;
  private int eliminations;
  private int lineSolves;
  private int passes;
  private int stalls;
  private int contradictions;
  private long nodes;
  private int branches;
  private int maxDepth;

  void overlap() { ++overlapCells; }
  void edge() { ++edgeCells; }
  void crossLine() { ++crossLineCells; }
  void elimination() { ++eliminations; }
  void lineSolve() { ++lineSolves; }
  void pass() { ++passes; }
  void stall() { ++stalls; }
  void contradiction() { ++contradictions; }
  void node() { ++nodes; }

  void branch(int depth) {
    ++branches;
    if (depth > maxDepth) maxDepth = depth;
  }

  /** Cells determined by a single run's overlap in a first pass. */
  public int overlapCells() {
    return overlapCells;
  }

  /** Other cells determined in a first pass. */
  public int edgeCells() {
    return edgeCells;
  }

  /** Cells determined only in later passes, after crossing lines changed. */
  public int crossLineCells() {
    return crossLineCells;
  }

  /** All cells determined by propagation, in any category. */
  public int propagatedCells() {
    return overlapCells + edgeCells + crossLineCells;
  }

  /** Narrowings that removed some candidates without determining the cell. */
  public int eliminations() {
    return eliminations;
  }

  public int lineSolves() {
    return lineSolves;
  }

  public int passes() {
    return passes;
  }

  /** How many times propagation reached a fixpoint with cells still unknown. */
  public int stalls() {
    return stalls;
  }

  /** How many times propagation found a contradiction, pruning a branch. */
  public int contradictions() {
    return contradictions;
  }

  /** Search nodes visited, the root included. */
  public long nodes() {
    return nodes;
  }

  /** Branches tried by the search; zero if propagation alone solved the puzzle. */
  public int branches() {
    return branches;
  }

  /** The deepest branching level the search reached. */
  public int maxDepth() {
    return maxDepth;
  }

  @Override public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("overlap", overlapCells)
        .add("edge", edgeCells)
        .add("crossLine", crossLineCells)
        .add("eliminations", eliminations)
        .add("lineSolves", lineSolves)
        .add("passes", passes)
        .add("stalls", stalls)
        .add("contradictions", contradictions)
        .add("nodes", nodes)
        .add("branches", branches)
        .add("maxDepth", maxDepth)
        .toString();
  }
}

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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.util.Iterator;
import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * The ordered runs that must appear in one row or column.  Adjacent runs of the
 * same color are separated by at least one empty cell; adjacent runs of
 * different colors may touch.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Clue implements Iterable<Run> {

  public static final Clue EMPTY = new Clue(ImmutableList.<Run>of());

  private final ImmutableList<Run> runs;

  private Clue(ImmutableList<Run> runs) {
    this.runs = runs;
  }

  public static Clue of(Run... runs) {
    return runs.length == 0 ? EMPTY : new Clue(ImmutableList.copyOf(runs));
  }

  public static Clue of(List<Run> runs) {
    return runs.isEmpty() ? EMPTY : new Clue(ImmutableList.copyOf(runs));
  }

  /**
   * Run-length encodes a line of color indices, where zero means empty.
   */
  public static Clue fromLine(int[] colors) {
    ImmutableList.Builder<Run> builder = ImmutableList.builder();
    int i = 0;
    while (i < colors.length) {
      int color = colors[i];
      int start = i;
      while (i < colors.length && colors[i] == color)
        ++i;
      if (color != 0)
        builder.add(Run.of(i - start, color));
    }
    return of(builder.build());
  }

  /**
   * Parses the form produced by {@link #toString}: runs separated by spaces, eg
   * "2c1 1c3".  An empty or blank string is the empty clue.
   */
  public static Clue fromString(String s) {
    ImmutableList.Builder<Run> builder = ImmutableList.builder();
    for (String run : Splitter.on(' ').omitEmptyStrings().trimResults().split(s))
      builder.add(Run.fromString(run));
    return of(builder.build());
  }

  public int size() {
    return runs.size();
  }

  public boolean isEmpty() {
    return runs.isEmpty();
  }

  public Run get(int index) {
    return runs.get(index);
  }

  public ImmutableList<Run> runs() {
    return runs;
  }

  /** Tells whether a gap is required between the given run and the next one. */
  public boolean needsGapAfter(int index) {
    return index + 1 < runs.size() && runs.get(index).color == runs.get(index + 1).color;
  }

  /**
   * The smallest number of cells that can hold this clue: the run lengths plus
   * one for each pair of neighboring runs with the same color.
   */
  public int minLength() {
    int total = 0;
    for (int i = 0; i < runs.size(); ++i) {
      total += runs.get(i).length;
      if (needsGapAfter(i)) ++total;
    }
    return total;
  }

  /** The number of cells of the given color this clue calls for. */
  public int count(int color) {
    int total = 0;
    for (Run run : runs)
      if (run.color == color) total += run.length;
    return total;
  }

  @Override public Iterator<Run> iterator() {
    return runs.iterator();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Clue)) return false;
    return runs.equals(((Clue) o).runs);
  }

  @Override public int hashCode() {
    return runs.hashCode();
  }

  @Override public String toString() {
    return Joiner.on(' ').join(runs);
  }
}

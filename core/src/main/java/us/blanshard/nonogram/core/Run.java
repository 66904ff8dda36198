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

import javax.annotation.concurrent.Immutable;

/**
 * One entry in a clue: a run of consecutive cells of a single color.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Run {
  public final int length;
  public final int color;

  private Run(int length, int color) {
    this.length = length;
    this.color = color;
  }

  public static Run of(int length, int color) {
    checkArgument(length >= 1, "Run length must be positive: %s", length);
    checkArgument(color >= 1 && color <= Palette.MAX_SIZE, "Bad run color: %s", color);
    return new Run(length, color);
  }

  /** Parses the form produced by {@link #toString}, eg "3c2". */
  public static Run fromString(String s) {
    int index = s.indexOf('c');
    checkArgument(index > 0, "Not a run: %s", s);
    try {
      return of(Integer.parseInt(s.substring(0, index)), Integer.parseInt(s.substring(index + 1)));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not a run: " + s, e);
    }
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Run)) return false;
    Run that = (Run) o;
    return this.length == that.length && this.color == that.color;
  }

  @Override public int hashCode() {
    return length * 31 + color;
  }

  @Override public String toString() {
    return length + "c" + color;
  }
}

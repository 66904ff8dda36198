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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.Iterator;
import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * The ordered colors of a puzzle.  Color index zero is reserved for the empty
 * background and has no entry here; indices 1 through {@link #size} name the
 * palette's colors.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Palette implements Iterable<Color> {

  /** The largest number of colors a palette may hold, background excluded. */
  public static final int MAX_SIZE = 30;

  private final ImmutableList<Color> colors;

  private Palette(ImmutableList<Color> colors) {
    checkArgument(colors.size() <= MAX_SIZE, "Too many colors: %s", colors.size());
    this.colors = colors;
  }

  public static Palette of(Color... colors) {
    return new Palette(ImmutableList.copyOf(colors));
  }

  public static Palette of(List<Color> colors) {
    return new Palette(ImmutableList.copyOf(colors));
  }

  public static Palette fromHex(String... hexes) {
    ImmutableList.Builder<Color> builder = ImmutableList.builder();
    for (String hex : hexes)
      builder.add(Color.fromHex(hex));
    return new Palette(builder.build());
  }

  /** The number of colors, not counting the background. */
  public int size() {
    return colors.size();
  }

  /** Returns the color for the given index, which must be in 1..size. */
  public Color get(int colorIndex) {
    checkArgument(colorIndex >= 1 && colorIndex <= colors.size(),
        "Color index %s out of range 1..%s", colorIndex, colors.size());
    return colors.get(colorIndex - 1);
  }

  public ImmutableList<Color> colors() {
    return colors;
  }

  @Override public Iterator<Color> iterator() {
    return colors.iterator();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Palette)) return false;
    return colors.equals(((Palette) o).colors);
  }

  @Override public int hashCode() {
    return colors.hashCode();
  }

  @Override public String toString() {
    return "[" + Joiner.on(", ").join(colors) + "]";
  }
}

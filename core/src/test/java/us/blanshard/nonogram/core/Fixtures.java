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

import java.util.Random;

/**
 * Grids and palettes shared by tests.
 */
public class Fixtures {

  public static final Palette MONO = Palette.fromHex("#000000");
  public static final Palette DUO = Palette.fromHex("#000000", "#e02020");
  public static final Palette TRIO = Palette.fromHex("#000000", "#e02020", "#2040ff");

  /** Solved by propagation alone, in a single pass. */
  public static final Grid PLUS = Grid.fromString(
      "..1..\n" +
      "..1..\n" +
      "11111\n" +
      "..1..\n" +
      "..1..\n");

  /** Unique, but no line of the blank grid allows any deduction. */
  public static final Grid BRANCHING = Grid.fromString(
      "1.1.\n" +
      ".11.\n" +
      "1..1\n" +
      ".1.1\n");

  /** Both parities satisfy the same clues. */
  public static final Grid CHECKERBOARD = checkerboard(8);

  public static Grid checkerboard(int size) {
    Grid.Builder builder = Grid.builder(size, size);
    for (int r = 0; r < size; ++r)
      for (int c = 0; c < size; ++c)
        builder.set(r, c, (r + c) % 2);
    return builder.build();
  }

  /** A grid of random colors from 0 to {@code colors}. */
  public static Grid random(Random random, int width, int height, int colors) {
    Grid.Builder builder = Grid.builder(width, height);
    for (int r = 0; r < height; ++r)
      for (int c = 0; c < width; ++c)
        builder.set(r, c, random.nextInt(colors + 1));
    return builder.build();
  }

  public static Nonogram puzzle(Grid grid, Palette palette) {
    return Nonogram.fromGrid(grid, palette);
  }

  public static Nonogram mono(Grid grid) {
    return Nonogram.fromGrid(grid, MONO);
  }

  private Fixtures() {}
}

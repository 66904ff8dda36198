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
package us.blanshard.nonogram.gen;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.nonogram.core.Grid;
import us.blanshard.nonogram.core.Palette;

import javax.annotation.concurrent.Immutable;

/**
 * A would-be puzzle: a named, palette-reduced picture.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Candidate {
  public final String name;
  public final Grid grid;
  public final Palette palette;

  private Candidate(String name, Grid grid, Palette palette) {
    this.name = name;
    this.grid = grid;
    this.palette = palette;
  }

  public static Candidate of(String name, Grid grid, Palette palette) {
    checkNotNull(name);
    checkArgument(grid.maxColor() <= palette.size(),
        "%s: grid uses color %s but the palette has %s", name, grid.maxColor(), palette.size());
    return new Candidate(name, grid, palette);
  }

  @Override public String toString() {
    return name + " (" + grid.width() + "x" + grid.height() + ", " + palette.size() + " colors)";
  }
}

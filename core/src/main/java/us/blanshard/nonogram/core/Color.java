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

import java.util.Locale;

import javax.annotation.concurrent.Immutable;

/**
 * An opaque RGB color, as found in a puzzle's palette.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Color {
  public final int red;
  public final int green;
  public final int blue;

  private Color(int red, int green, int blue) {
    this.red = red;
    this.green = green;
    this.blue = blue;
  }

  public static Color of(int red, int green, int blue) {
    checkArgument(red >= 0 && red < 256, "red out of range: %s", red);
    checkArgument(green >= 0 && green < 256, "green out of range: %s", green);
    checkArgument(blue >= 0 && blue < 256, "blue out of range: %s", blue);
    return new Color(red, green, blue);
  }

  /** Parses a color of the form "#rrggbb" (the leading hash is optional). */
  public static Color fromHex(String hex) {
    String s = hex.startsWith("#") ? hex.substring(1) : hex;
    checkArgument(s.length() == 6, "Not a #rrggbb color: %s", hex);
    try {
      int rgb = Integer.parseInt(s, 16);
      return new Color((rgb >> 16) & 0xff, (rgb >> 8) & 0xff, rgb & 0xff);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not a #rrggbb color: " + hex, e);
    }
  }

  public String toHex() {
    return String.format(Locale.ROOT, "#%02x%02x%02x", red, green, blue);
  }

  /**
   * Returns the luminance-weighted Euclidean distance between this color and
   * another.  Green differences count for the most, then red, then blue.  The
   * result runs from zero for identical colors to about 255 for black versus
   * white.
   */
  public double distanceTo(Color that) {
    int dr = this.red - that.red;
    int dg = this.green - that.green;
    int db = this.blue - that.blue;
    return Math.sqrt(0.30 * dr * dr + 0.59 * dg * dg + 0.11 * db * db);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Color)) return false;
    Color that = (Color) o;
    return this.red == that.red && this.green == that.green && this.blue == that.blue;
  }

  @Override public int hashCode() {
    return (red << 16) | (green << 8) | blue;
  }

  @Override public String toString() {
    return toHex();
  }
}

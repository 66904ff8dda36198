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

import us.blanshard.nonogram.core.Difficulty;
import us.blanshard.nonogram.core.Grid;
import us.blanshard.nonogram.core.Nonogram;
import us.blanshard.nonogram.rate.Quality;
import us.blanshard.nonogram.rate.Rating;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import javax.annotation.concurrent.Immutable;

/**
 * An accepted puzzle: the clues, palette and unique solution, along with its
 * difficulty rating and quality.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Puzzle {
  public final String name;
  public final Nonogram nonogram;
  public final Grid solution;
  public final Rating rating;
  public final Quality quality;

  public Puzzle(String name, Nonogram nonogram, Grid solution, Rating rating, Quality quality) {
    checkArgument(nonogram.width() == solution.width() && nonogram.height() == solution.height(),
        "Solution doesn't match puzzle");
    this.name = name;
    this.nonogram = nonogram;
    this.solution = solution;
    this.rating = rating;
    this.quality = quality;
  }

  public int width() {
    return nonogram.width();
  }

  public int height() {
    return nonogram.height();
  }

  public Difficulty difficulty() {
    return rating.difficulty;
  }

  public double score() {
    return rating.score;
  }

  /** The title shown to players, eg "Red Fox (12x10, medium)". */
  public String title() {
    return displayName(name) + " (" + width() + "x" + height() + ", " + difficulty().code() + ")";
  }

  /**
   * Turns a file-style name into a display name: underscores and dashes become
   * spaces, and each word is capitalized.
   */
  public static String displayName(String name) {
    String spaced = CharMatcher.anyOf("_-").replaceFrom(name, ' ');
    List<String> words = new ArrayList<String>();
    for (String word : Splitter.on(' ').omitEmptyStrings().split(spaced)) {
      words.add(word.substring(0, 1).toUpperCase(Locale.ROOT)
          + word.substring(1).toLowerCase(Locale.ROOT));
    }
    return Joiner.on(' ').join(words);
  }

  @Override public String toString() {
    return title();
  }
}

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

import java.util.Locale;

/**
 * Difficulty tiers, easiest first.
 *
 * @author Luke Blanshard
 */
public enum Difficulty {
  TRIVIAL,
  EASY,
  MEDIUM,
  HARD,
  CHALLENGING,
  EXPERT,
  MASTER;

  /** The lower-case name used in configuration keys and exported puzzles. */
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Difficulty fromCode(String code) {
    return valueOf(code.toUpperCase(Locale.ROOT));
  }

  /**
   * Maps a score to its tier: the hardest tier whose threshold is at or below
   * the score.
   */
  public static Difficulty forScore(double score, Config config) {
    Difficulty answer = TRIVIAL;
    for (Difficulty d : values()) {
      if (score >= config.tierThreshold(d)) answer = d;
    }
    return answer;
  }
}

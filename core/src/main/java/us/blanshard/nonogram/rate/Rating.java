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
package us.blanshard.nonogram.rate;

import us.blanshard.nonogram.core.Difficulty;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;

import java.util.Locale;

/** The object returned by the {@link DifficultyScorer}. */
public class Rating {
  /** The puzzle's score; higher is harder, with no fixed upper bound. */
  public final double score;
  /** The tier the score falls into. */
  public final Difficulty difficulty;
  /** Whether the puzzle needed any backtracking to prove unique. */
  public final boolean backtracked;
  /** The named intermediate values that went into the score. */
  public final ImmutableMap<String, Double> factors;

  public Rating(double score, Difficulty difficulty, boolean backtracked,
                ImmutableMap<String, Double> factors) {
    this.score = score;
    this.difficulty = difficulty;
    this.backtracked = backtracked;
    this.factors = factors;
  }

  @Override public String toString() {
    return String.format(Locale.ROOT, "Rating:%.2f:%s:%s", score, difficulty.code(),
        Joiner.on(',').withKeyValueSeparator("=").join(factors));
  }
}

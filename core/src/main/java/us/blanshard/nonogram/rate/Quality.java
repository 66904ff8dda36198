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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Locale;

/**
 * How well designed a puzzle is, independent of how hard it is.
 *
 * @author Luke Blanshard
 */
public class Quality {

  public enum Grade {
    EXCELLENT(85),
    GOOD(70),
    FAIR(55),
    POOR(40),
    BAD(0);

    /** The inclusive lower bound on the score for this grade. */
    public final double threshold;

    private Grade(double threshold) {
      this.threshold = threshold;
    }

    public String code() {
      return name().toLowerCase(Locale.ROOT);
    }

    public static Grade forScore(double score) {
      for (Grade grade : values())
        if (score >= grade.threshold) return grade;
      return BAD;
    }
  }

  /** The score, from 0 to 100, rounded to one decimal place. */
  public final double score;
  public final Grade grade;
  /** The individual factor scores, each from 0 to 1. */
  public final ImmutableMap<String, Double> factors;
  /** Observations about the puzzle's weak points. */
  public final ImmutableList<String> notes;

  public Quality(double score, Grade grade, ImmutableMap<String, Double> factors,
                 ImmutableList<String> notes) {
    this.score = score;
    this.grade = grade;
    this.factors = factors;
    this.notes = notes;
  }

  @Override public String toString() {
    return "Quality:" + score + ":" + grade.code() + notes;
  }
}

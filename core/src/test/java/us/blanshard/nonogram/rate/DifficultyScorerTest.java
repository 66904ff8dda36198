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

import static com.google.common.truth.Truth.assertThat;
import static us.blanshard.nonogram.core.Fixtures.BRANCHING;
import static us.blanshard.nonogram.core.Fixtures.CHECKERBOARD;
import static us.blanshard.nonogram.core.Fixtures.PLUS;
import static us.blanshard.nonogram.core.Fixtures.mono;

import us.blanshard.nonogram.core.Config;
import us.blanshard.nonogram.core.Difficulty;
import us.blanshard.nonogram.core.Grid;
import us.blanshard.nonogram.core.Nonogram;
import us.blanshard.nonogram.rate.DifficultyScorer.Features;
import us.blanshard.nonogram.solve.UniquenessChecker;
import us.blanshard.nonogram.solve.Verdict;

import org.junit.Test;

public class DifficultyScorerTest {

  private static final Config CONFIG = Config.DEFAULT;

  private static Features features(int size, int colors, double edge, double cross,
                                   int branches, int depth) {
    return new Features(size, size, colors, 0.5, 1.5, 0.3, edge, cross, branches, depth);
  }

  private static double score(Features f) {
    return DifficultyScorer.score(f, CONFIG).score;
  }

  private static Rating rate(Grid grid) {
    Nonogram puzzle = mono(grid);
    Verdict verdict = new UniquenessChecker(CONFIG).check(puzzle);
    assertThat(verdict.status).isEqualTo(Verdict.Status.UNIQUE);
    return DifficultyScorer.score(puzzle, verdict.solution, verdict.trace, CONFIG);
  }

  @Test public void plusIsEasy() {
    Rating rating = rate(PLUS);
    // Size 5, fragmentation 2, fill balance 1.44; 16 of 25 cells by edge reasoning.
    assertThat(rating.factors.get("base")).isWithin(1e-9).of(8.44);
    assertThat(rating.factors.get("technique")).isWithin(1e-9).of(1.32);
    assertThat(rating.score).isWithin(1e-9).of(8.44 * 1.32);
    assertThat(rating.difficulty).isEqualTo(Difficulty.EASY);
    assertThat(rating.backtracked).isFalse();
  }

  @Test public void backtrackingLiftsToTheFloor() {
    Rating rating = rate(BRANCHING);
    assertThat(rating.backtracked).isTrue();
    assertThat(rating.score).isAtLeast(CONFIG.backtrackFloor);
    assertThat(rating.difficulty).isEqualTo(Difficulty.CHALLENGING);
    assertThat(rating.score).isGreaterThan(rate(PLUS).score);
  }

  @Test public void floorAppliesOnlyWhenBranching() {
    Features trivial = features(2, 1, 0, 0, 0, 0);
    assertThat(score(trivial)).isLessThan(CONFIG.backtrackFloor);
    Features branched = features(2, 1, 0, 0, 1, 1);
    assertThat(score(branched)).isEqualTo(CONFIG.backtrackFloor);
  }

  @Test public void harderFeaturesNeverLowerTheScore() {
    Features base = features(10, 2, 0.2, 0.1, 3, 2);
    double s = score(base);
    assertThat(score(features(11, 2, 0.2, 0.1, 3, 2))).isGreaterThan(s);
    assertThat(score(features(10, 3, 0.2, 0.1, 3, 2))).isGreaterThan(s);
    assertThat(score(features(10, 2, 0.3, 0.1, 3, 2))).isGreaterThan(s);
    assertThat(score(features(10, 2, 0.2, 0.2, 3, 2))).isGreaterThan(s);
    assertThat(score(features(10, 2, 0.2, 0.1, 4, 2))).isGreaterThan(s);
    assertThat(score(features(10, 2, 0.2, 0.1, 3, 3))).isGreaterThan(s);
  }

  @Test public void zeroWeightsFlattenFactors() {
    Config flat = Config.DEFAULT.toBuilder()
        .setSizeWeight(0).setColorWeight(0).setFragmentationWeight(0).setFillWeight(0)
        .build();
    Rating rating = DifficultyScorer.score(features(30, 5, 0.5, 0.5, 0, 0), flat);
    assertThat(rating.score).isEqualTo(0.0);
    assertThat(rating.difficulty).isEqualTo(Difficulty.TRIVIAL);
  }

  @Test public void featuresComeFromTheTrace() {
    Nonogram puzzle = mono(PLUS);
    Verdict verdict = new UniquenessChecker(CONFIG).check(puzzle);
    Features f = Features.of(puzzle, verdict.solution, verdict.trace);
    assertThat(f.maxDimension()).isEqualTo(5);
    assertThat(f.colorCount).isEqualTo(1);
    assertThat(f.fillRatio).isWithin(1e-9).of(9 / 25.0);
    assertThat(f.fragmentation).isWithin(1e-9).of(1.0);
    assertThat(f.overlapShare).isWithin(1e-9).of(9 / 25.0);
    assertThat(f.edgeShare).isWithin(1e-9).of(16 / 25.0);
    assertThat(f.crossLineShare).isEqualTo(0.0);
    assertThat(f.branches).isEqualTo(0);
  }

  @Test public void structuralEstimate() {
    assertThat(DifficultyScorer.estimateStructural(mono(PLUS))).isEqualTo(Difficulty.TRIVIAL);
    assertThat(DifficultyScorer.estimateStructural(mono(CHECKERBOARD)))
        .isEqualTo(Difficulty.MEDIUM);
    Grid sparse = Grid.builder(20, 20).set(0, 0, 1).build();
    assertThat(DifficultyScorer.estimateStructural(mono(sparse))).isEqualTo(Difficulty.EXPERT);
  }
}

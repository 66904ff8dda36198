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
package us.blanshard.nonogram.stats;

import static com.google.common.truth.Truth.assertThat;
import static us.blanshard.nonogram.stats.BatchRunnerTest.BLANK;
import static us.blanshard.nonogram.stats.BatchRunnerTest.CHECKS;
import static us.blanshard.nonogram.stats.BatchRunnerTest.KNOT;
import static us.blanshard.nonogram.stats.BatchRunnerTest.PLUS;

import us.blanshard.nonogram.core.Config;
import us.blanshard.nonogram.core.Difficulty;
import us.blanshard.nonogram.gen.Outcome;
import us.blanshard.nonogram.gen.PuzzleBuilder;
import us.blanshard.nonogram.gen.Rejection;

import com.google.common.collect.ImmutableList;

import org.junit.Test;

public class BatchReportTest {

  private final PuzzleBuilder builder = new PuzzleBuilder(Config.DEFAULT);

  @Test public void tallies() {
    BatchReport report = new BatchReport(ImmutableList.of(
        builder.build(KNOT),
        builder.build(CHECKS),
        builder.build(PLUS),
        builder.build(BLANK),
        builder.build(BLANK),
        Outcome.error("broken", "java.lang.IllegalStateException: boom", 3)));

    assertThat(report.total()).isEqualTo(6);
    assertThat(report.rejectedCount()).isEqualTo(3);
    assertThat(report.rejectedCount(Rejection.Reason.EMPTY)).isEqualTo(2);
    assertThat(report.rejectedCount(Rejection.Reason.VALID_MULTIPLE)).isEqualTo(1);
    assertThat(report.rejectedCount(Rejection.Reason.TIMEOUT)).isEqualTo(0);
    assertThat(report.errorCount()).isEqualTo(1);
    assertThat(report.acceptedCount(Difficulty.EASY)).isEqualTo(1);
    assertThat(report.acceptedCount(Difficulty.CHALLENGING)).isEqualTo(1);
    assertThat(report.acceptedCount(Difficulty.MASTER)).isEqualTo(0);
    assertThat(report.maxMillis()).isAtLeast(3.0);

    // Easiest first.
    assertThat(report.accepted()).hasSize(2);
    assertThat(report.accepted().get(0).name).isEqualTo("plus");
    assertThat(report.accepted().get(1).name).isEqualTo("knot");
  }

  @Test public void formats() {
    String text = new BatchReport(ImmutableList.of(builder.build(PLUS), builder.build(BLANK)))
        .format();
    assertThat(text).contains("Candidates: 2");
    assertThat(text).contains("Accepted: 1");
    assertThat(text).containsMatch("empty +1");
    assertThat(text).containsMatch("easy +1  score mean");
    assertThat(text).contains("Plus (5x5, easy)");
  }

  @Test public void emptyReport() {
    BatchReport report = new BatchReport(ImmutableList.<Outcome>of());
    assertThat(report.total()).isEqualTo(0);
    assertThat(report.meanMillis()).isEqualTo(0.0);
    assertThat(report.format()).contains("Candidates: 0");
  }
}

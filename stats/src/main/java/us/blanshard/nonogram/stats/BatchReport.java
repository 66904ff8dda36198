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

import us.blanshard.nonogram.core.Difficulty;
import us.blanshard.nonogram.gen.Outcome;
import us.blanshard.nonogram.gen.Puzzle;
import us.blanshard.nonogram.gen.Rejection;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Summarizes the outcomes of a batch: how many candidates were accepted,
 * rejected for each reason, or failed; the accepted puzzles by tier; and
 * timing statistics.
 *
 * @author Luke Blanshard
 */
public class BatchReport {
  private final int total;
  private final List<Puzzle> accepted = Lists.newArrayList();
  private final EnumMap<Rejection.Reason, Integer> rejections =
      Maps.newEnumMap(Rejection.Reason.class);
  private final List<Outcome> errors = Lists.newArrayList();
  private final EnumMap<Difficulty, DescriptiveStatistics> tierScores =
      Maps.newEnumMap(Difficulty.class);
  private final DescriptiveStatistics millis = new DescriptiveStatistics();

  public BatchReport(List<Outcome> outcomes) {
    this.total = outcomes.size();
    for (Outcome outcome : outcomes) {
      millis.addValue(outcome.elapsedMillis);
      switch (outcome.kind) {
        case ACCEPTED:
          accepted.add(outcome.puzzle);
          scoresFor(outcome.puzzle.difficulty()).addValue(outcome.puzzle.score());
          break;
        case REJECTED:
          Integer count = rejections.get(outcome.rejection.reason);
          rejections.put(outcome.rejection.reason, count == null ? 1 : count + 1);
          break;
        default:
          errors.add(outcome);
          break;
      }
    }
    Collections.sort(accepted, new Comparator<Puzzle>() {
      @Override public int compare(Puzzle a, Puzzle b) {
        return Double.compare(a.score(), b.score());
      }
    });
  }

  private DescriptiveStatistics scoresFor(Difficulty tier) {
    DescriptiveStatistics stats = tierScores.get(tier);
    if (stats == null) {
      stats = new DescriptiveStatistics();
      tierScores.put(tier, stats);
    }
    return stats;
  }

  public int total() {
    return total;
  }

  /** The accepted puzzles, easiest first. */
  public ImmutableList<Puzzle> accepted() {
    return ImmutableList.copyOf(accepted);
  }

  public int rejectedCount(Rejection.Reason reason) {
    Integer count = rejections.get(reason);
    return count == null ? 0 : count;
  }

  public int rejectedCount() {
    int sum = 0;
    for (int count : rejections.values()) sum += count;
    return sum;
  }

  public int errorCount() {
    return errors.size();
  }

  public int acceptedCount(Difficulty tier) {
    DescriptiveStatistics stats = tierScores.get(tier);
    return stats == null ? 0 : (int) stats.getN();
  }

  public double meanMillis() {
    return total == 0 ? 0 : millis.getMean();
  }

  public double maxMillis() {
    return total == 0 ? 0 : millis.getMax();
  }

  public String format() {
    StringWriter sw = new StringWriter();
    PrintWriter out = new PrintWriter(sw);
    out.printf(Locale.ROOT, "Candidates: %d%n", total);
    out.printf(Locale.ROOT, "Accepted: %d%n", accepted.size());
    out.printf(Locale.ROOT, "Rejected: %d%n", rejectedCount());
    for (Map.Entry<Rejection.Reason, Integer> entry : rejections.entrySet())
      out.printf(Locale.ROOT, "  %-20s %d%n", entry.getKey().code(), entry.getValue());
    out.printf(Locale.ROOT, "Errors: %d%n", errors.size());
    for (Outcome error : errors)
      out.printf(Locale.ROOT, "  %s: %s%n", error.name, error.error);

    if (!tierScores.isEmpty()) {
      out.printf(Locale.ROOT, "%nBy tier:%n");
      for (Map.Entry<Difficulty, DescriptiveStatistics> entry : tierScores.entrySet()) {
        DescriptiveStatistics stats = entry.getValue();
        out.printf(Locale.ROOT, "  %-12s %3d  score mean %.1f, min %.1f, max %.1f%n",
            entry.getKey().code(), stats.getN(), stats.getMean(), stats.getMin(), stats.getMax());
      }
      out.printf(Locale.ROOT, "%nAccepted puzzles:%n");
      for (Puzzle puzzle : accepted)
        out.printf(Locale.ROOT, "  %7.2f  %-12s %s%n",
            puzzle.score(), puzzle.difficulty().code(), puzzle.title());
    }

    out.printf(Locale.ROOT, "%nTime per candidate: mean %.0fms, max %.0fms%n",
        meanMillis(), maxMillis());
    out.flush();
    return sw.toString();
  }

  @Override public String toString() {
    return format();
  }
}

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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;

import java.util.Locale;

import javax.annotation.concurrent.Immutable;

/**
 * Why a candidate didn't become a puzzle, with diagnostic details.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Rejection {

  public enum Reason {
    /** Some line has more runs than allowed. */
    TOO_DENSE,
    /** Two palette colors are too close to tell apart. */
    COLORS_TOO_SIMILAR,
    /** The palette has more colors than allowed. */
    TOO_MANY_COLORS,
    /** More than one grid satisfies the clues. */
    VALID_MULTIPLE,
    /** The solver ran out of time. */
    TIMEOUT,
    /** The solver ran out of search nodes. */
    TOO_COMPLEX,
    /** No grid satisfies the clues. */
    INFEASIBLE,
    /** The grid has no colored cells. */
    EMPTY;

    /** The lower-case name used in reports. */
    public String code() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  public final Reason reason;
  public final String message;
  public final ImmutableMap<String, Object> details;

  private Rejection(Reason reason, String message, ImmutableMap<String, Object> details) {
    this.reason = checkNotNull(reason);
    this.message = checkNotNull(message);
    this.details = details;
  }

  public static Rejection of(Reason reason, String message) {
    return new Rejection(reason, message, ImmutableMap.<String, Object>of());
  }

  public static Rejection of(Reason reason, String message, ImmutableMap<String, Object> details) {
    return new Rejection(reason, message, details);
  }

  public static Rejection empty() {
    return of(Reason.EMPTY, "no colored cells");
  }

  public static Rejection tooManyColors(int colors, int max) {
    return of(Reason.TOO_MANY_COLORS, colors + " colors, at most " + max + " allowed",
        ImmutableMap.<String, Object>of("colors", colors, "max", max));
  }

  public static Rejection colorsTooSimilar(int color1, int color2, double distance, double min) {
    return of(Reason.COLORS_TOO_SIMILAR,
        String.format(Locale.ROOT, "colors %d and %d are %.1f apart, need %.1f",
            color1, color2, distance, min),
        ImmutableMap.<String, Object>of(
            "color1", color1, "color2", color2, "distance", distance, "min", min));
  }

  public static Rejection tooDense(String line, int runs, int max) {
    return of(Reason.TOO_DENSE, line + " has " + runs + " runs, at most " + max + " allowed",
        ImmutableMap.<String, Object>of("line", line, "runs", runs, "max", max));
  }

  public static Rejection infeasible(String message) {
    return of(Reason.INFEASIBLE, message);
  }

  public static Rejection infeasible(String message, String line) {
    return of(Reason.INFEASIBLE, message, ImmutableMap.<String, Object>of("line", line));
  }

  /** A rejection for a search that ended without producing a puzzle. */
  public static Rejection fromSearch(Reason reason, long elapsedMillis, long nodes) {
    return of(reason, reason.code() + " after " + elapsedMillis + "ms and " + nodes + " nodes",
        ImmutableMap.<String, Object>of("elapsedMillis", elapsedMillis, "nodes", nodes));
  }

  @Override public String toString() {
    return reason.code() + ": " + message;
  }
}

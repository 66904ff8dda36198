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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.math.LongMath;
import com.google.common.primitives.Ints;

import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * The tunable values shared by validation, solving and scoring.  A config is
 * immutable, so one instance may be shared freely among worker threads.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Config {

  public static final Config DEFAULT = builder().build();

  public final double minColorDistance;
  public final int maxColors;
  public final int maxCluesPerLine;
  public final long timeoutMillis;
  public final long maxNodes;

  public final double sizeWeight;
  public final double colorWeight;
  public final double fragmentationWeight;
  public final double fillWeight;
  public final double edgeWeight;
  public final double crossLineWeight;
  public final double branchWeight;
  public final double depthWeight;

  /** The least score a puzzle that needed any backtracking can receive. */
  public final double backtrackFloor;

  private final ImmutableMap<Difficulty, Double> tierThresholds;

  private Config(Builder b) {
    this.minColorDistance = b.minColorDistance;
    this.maxColors = b.maxColors;
    this.maxCluesPerLine = b.maxCluesPerLine;
    this.timeoutMillis = b.timeoutMillis;
    this.maxNodes = b.maxNodes;
    this.sizeWeight = b.sizeWeight;
    this.colorWeight = b.colorWeight;
    this.fragmentationWeight = b.fragmentationWeight;
    this.fillWeight = b.fillWeight;
    this.edgeWeight = b.edgeWeight;
    this.crossLineWeight = b.crossLineWeight;
    this.branchWeight = b.branchWeight;
    this.depthWeight = b.depthWeight;
    this.backtrackFloor = b.backtrackFloor;
    this.tierThresholds = Maps.immutableEnumMap(b.tierThresholds);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  /** The inclusive lower bound on the score of the given tier. */
  public double tierThreshold(Difficulty tier) {
    return tierThresholds.get(tier);
  }

  public ImmutableMap<Difficulty, Double> tierThresholds() {
    return tierThresholds;
  }

  /**
   * Reads a config from the given properties, starting from the defaults.
   * Recognized keys are the field names ("minColorDistance", "maxNodes", ...),
   * "weight.size", "weight.colors", "weight.fragmentation", "weight.fill",
   * "weight.edge", "weight.crossLine", "weight.branch", "weight.depth",
   * "backtrackFloor", and "tier.&lt;name&gt;" for each difficulty tier.
   * "timeoutSeconds" may stand in for "timeoutMillis".
   *
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static Config fromProperties(Properties props) {
    Builder b = builder();
    Double d;
    Integer i;
    Long n;
    if ((d = getDouble(props, "minColorDistance")) != null) b.setMinColorDistance(d);
    if ((i = getInt(props, "maxColors")) != null) b.setMaxColors(i);
    if ((i = getInt(props, "maxCluesPerLine")) != null) b.setMaxCluesPerLine(i);
    if ((n = getLong(props, "timeoutSeconds")) != null) b.setTimeoutMillis(secondsToMillis(n));
    if ((n = getLong(props, "timeoutMillis")) != null) b.setTimeoutMillis(n);
    if ((n = getLong(props, "maxNodes")) != null) b.setMaxNodes(n);
    if ((d = getDouble(props, "weight.size")) != null) b.setSizeWeight(d);
    if ((d = getDouble(props, "weight.colors")) != null) b.setColorWeight(d);
    if ((d = getDouble(props, "weight.fragmentation")) != null) b.setFragmentationWeight(d);
    if ((d = getDouble(props, "weight.fill")) != null) b.setFillWeight(d);
    if ((d = getDouble(props, "weight.edge")) != null) b.setEdgeWeight(d);
    if ((d = getDouble(props, "weight.crossLine")) != null) b.setCrossLineWeight(d);
    if ((d = getDouble(props, "weight.branch")) != null) b.setBranchWeight(d);
    if ((d = getDouble(props, "weight.depth")) != null) b.setDepthWeight(d);
    if ((d = getDouble(props, "backtrackFloor")) != null) b.setBacktrackFloor(d);
    for (Difficulty tier : Difficulty.values()) {
      if ((d = getDouble(props, "tier." + tier.code())) != null) b.setTierThreshold(tier, d);
    }
    return b.build();
  }

  @Nullable private static Double getDouble(Properties props, String key) {
    String value = props.getProperty(key);
    if (value == null) return null;
    try {
      return Double.valueOf(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Bad value for " + key + ": " + value, e);
    }
  }

  @Nullable private static Long getLong(Properties props, String key) {
    String value = props.getProperty(key);
    if (value == null) return null;
    try {
      return Long.decode(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Bad value for " + key + ": " + value, e);
    }
  }

  @Nullable private static Integer getInt(Properties props, String key) {
    Long value = getLong(props, key);
    if (value == null) return null;
    try {
      return Ints.checkedCast(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Value for " + key + " out of range: " + value, e);
    }
  }

  private static long secondsToMillis(long seconds) {
    try {
      return LongMath.checkedMultiply(seconds, 1000);
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("Value for timeoutSeconds out of range: " + seconds, e);
    }
  }

  @Override public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("minColorDistance", minColorDistance)
        .add("maxColors", maxColors)
        .add("maxCluesPerLine", maxCluesPerLine)
        .add("timeoutMillis", timeoutMillis)
        .add("maxNodes", maxNodes)
        .add("tiers", tierThresholds)
        .toString();
  }

  /**
   * Builds a config, starting from the default values.
   */
  @NotThreadSafe
  public static final class Builder {
    private double minColorDistance = 35.0;
    private int maxColors = 6;
    private int maxCluesPerLine = 15;
    private long timeoutMillis = 30000;
    private long maxNodes = 200000;

    private double sizeWeight = 1.0;
    private double colorWeight = 2.0;
    private double fragmentationWeight = 2.0;
    private double fillWeight = 2.0;
    private double edgeWeight = 0.5;
    private double crossLineWeight = 2.0;
    private double branchWeight = 6.0;
    private double depthWeight = 3.0;
    private double backtrackFloor = 25.0;

    private final EnumMap<Difficulty, Double> tierThresholds =
        new EnumMap<Difficulty, Double>(Difficulty.class);

    private Builder() {
      tierThresholds.put(Difficulty.TRIVIAL, 0.0);
      tierThresholds.put(Difficulty.EASY, 8.0);
      tierThresholds.put(Difficulty.MEDIUM, 15.0);
      tierThresholds.put(Difficulty.HARD, 25.0);
      tierThresholds.put(Difficulty.CHALLENGING, 40.0);
      tierThresholds.put(Difficulty.EXPERT, 60.0);
      tierThresholds.put(Difficulty.MASTER, 90.0);
    }

    private Builder(Config c) {
      this.minColorDistance = c.minColorDistance;
      this.maxColors = c.maxColors;
      this.maxCluesPerLine = c.maxCluesPerLine;
      this.timeoutMillis = c.timeoutMillis;
      this.maxNodes = c.maxNodes;
      this.sizeWeight = c.sizeWeight;
      this.colorWeight = c.colorWeight;
      this.fragmentationWeight = c.fragmentationWeight;
      this.fillWeight = c.fillWeight;
      this.edgeWeight = c.edgeWeight;
      this.crossLineWeight = c.crossLineWeight;
      this.branchWeight = c.branchWeight;
      this.depthWeight = c.depthWeight;
      this.backtrackFloor = c.backtrackFloor;
      this.tierThresholds.putAll(c.tierThresholds);
    }

    public Builder setMinColorDistance(double minColorDistance) {
      this.minColorDistance = minColorDistance;
      return this;
    }

    public Builder setMaxColors(int maxColors) {
      this.maxColors = maxColors;
      return this;
    }

    public Builder setMaxCluesPerLine(int maxCluesPerLine) {
      this.maxCluesPerLine = maxCluesPerLine;
      return this;
    }

    public Builder setTimeoutMillis(long timeoutMillis) {
      this.timeoutMillis = timeoutMillis;
      return this;
    }

    public Builder setMaxNodes(long maxNodes) {
      this.maxNodes = maxNodes;
      return this;
    }

    public Builder setSizeWeight(double sizeWeight) {
      this.sizeWeight = sizeWeight;
      return this;
    }

    public Builder setColorWeight(double colorWeight) {
      this.colorWeight = colorWeight;
      return this;
    }

    public Builder setFragmentationWeight(double fragmentationWeight) {
      this.fragmentationWeight = fragmentationWeight;
      return this;
    }

    public Builder setFillWeight(double fillWeight) {
      this.fillWeight = fillWeight;
      return this;
    }

    public Builder setEdgeWeight(double edgeWeight) {
      this.edgeWeight = edgeWeight;
      return this;
    }

    public Builder setCrossLineWeight(double crossLineWeight) {
      this.crossLineWeight = crossLineWeight;
      return this;
    }

    public Builder setBranchWeight(double branchWeight) {
      this.branchWeight = branchWeight;
      return this;
    }

    public Builder setDepthWeight(double depthWeight) {
      this.depthWeight = depthWeight;
      return this;
    }

    public Builder setBacktrackFloor(double backtrackFloor) {
      this.backtrackFloor = backtrackFloor;
      return this;
    }

    public Builder setTierThreshold(Difficulty tier, double threshold) {
      tierThresholds.put(tier, threshold);
      return this;
    }

    /**
     * Validates and builds the config.
     *
     * @throws IllegalArgumentException if any value is out of range, or the
     *     tier thresholds are not strictly ascending from zero
     */
    public Config build() {
      checkArgument(minColorDistance >= 0, "minColorDistance must be non-negative");
      checkArgument(maxColors >= 1 && maxColors <= Palette.MAX_SIZE,
          "maxColors must be in 1..%s: %s", Palette.MAX_SIZE, maxColors);
      checkArgument(maxCluesPerLine >= 1, "maxCluesPerLine must be positive");
      checkArgument(timeoutMillis > 0, "timeoutMillis must be positive");
      checkArgument(maxNodes > 0, "maxNodes must be positive");
      checkWeight("size", sizeWeight);
      checkWeight("colors", colorWeight);
      checkWeight("fragmentation", fragmentationWeight);
      checkWeight("fill", fillWeight);
      checkWeight("edge", edgeWeight);
      checkWeight("crossLine", crossLineWeight);
      checkWeight("branch", branchWeight);
      checkWeight("depth", depthWeight);
      checkWeight("backtrackFloor", backtrackFloor);

      checkArgument(tierThresholds.get(Difficulty.TRIVIAL) == 0.0,
          "The trivial tier must start at zero");
      double prev = -1;
      for (Map.Entry<Difficulty, Double> entry : tierThresholds.entrySet()) {
        checkArgument(entry.getValue() > prev,
            "Tier thresholds must ascend: %s at %s", entry.getKey(), entry.getValue());
        prev = entry.getValue();
      }
      return new Config(this);
    }

    private static void checkWeight(String name, double weight) {
      checkArgument(weight >= 0 && !Double.isInfinite(weight) && !Double.isNaN(weight),
          "Weight %s must be a non-negative number: %s", name, weight);
    }
  }
}

package com.gnovoa.fantasy.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Scoring limits and goal ladder.
 *
 * @param maxSubstitutions successful bench substitutions allowed per scoring call
 * @param goalThreshold points needed for the first goal
 * @param goalGap extra points needed for each further goal
 * @param captainSeed seed for the random captain pick; null means non-reproducible picks
 */
@ConfigurationProperties(prefix = "kickeststats")
public record ScoringProperties(
    @DefaultValue("5") int maxSubstitutions,
    @DefaultValue("200") double goalThreshold,
    @DefaultValue("20") double goalGap,
    Long captainSeed) {

  public static final int DEFAULT_MAX_SUBSTITUTIONS = 5;
  public static final double DEFAULT_GOAL_THRESHOLD = 200.0;
  public static final double DEFAULT_GOAL_GAP = 20.0;

  public ScoringProperties {
    if (maxSubstitutions < 0) {
      throw new IllegalArgumentException("maxSubstitutions must be >= 0, was " + maxSubstitutions);
    }
    if (!Double.isFinite(goalThreshold)) {
      throw new IllegalArgumentException("goalThreshold must be finite");
    }
    if (!(goalGap > 0) || !Double.isFinite(goalGap)) {
      throw new IllegalArgumentException("goalGap must be a positive number, was " + goalGap);
    }
  }

  public static ScoringProperties defaults() {
    return new ScoringProperties(
        DEFAULT_MAX_SUBSTITUTIONS, DEFAULT_GOAL_THRESHOLD, DEFAULT_GOAL_GAP, null);
  }

  public ScoringProperties withMaxSubstitutions(int max) {
    return new ScoringProperties(max, goalThreshold, goalGap, captainSeed);
  }
}

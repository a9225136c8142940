package com.gnovoa.fantasy.core;

/**
 * Converts a team score into goals.
 *
 * <p>The first goal needs more than {@code threshold} points, each further goal {@code gap} more:
 * with 200/20, 250 points is 3 goals (beats 200, 220, 240).
 */
public final class GoalConverter {

  private final double threshold;
  private final double gap;

  public GoalConverter(double threshold, double gap) {
    if (!Double.isFinite(threshold)) throw new IllegalArgumentException("threshold must be finite");
    if (!(gap > 0) || !Double.isFinite(gap)) {
      throw new IllegalArgumentException("gap must be a positive number");
    }
    this.threshold = threshold;
    this.gap = gap;
  }

  /**
   * @param points team score, finite and non-negative
   * @return number of ladder steps strictly exceeded
   */
  public int goals(double points) {
    if (!Double.isFinite(points) || points < 0) {
      throw new IllegalArgumentException("points must be a finite non-negative number, was " + points);
    }
    if (points <= threshold) return 0;
    // steps strictly below points; landing exactly on a step does not count it
    double steps = Math.ceil((points - threshold) / gap);
    return steps >= Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) steps;
  }

  public double threshold() {
    return threshold;
  }

  public double gap() {
    return gap;
  }
}

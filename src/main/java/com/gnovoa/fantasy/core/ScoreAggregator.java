package com.gnovoa.fantasy.core;

import com.gnovoa.fantasy.model.Player;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Sums a final line-up into a team score.
 *
 * <p>Home teams start from {@link #HOME_BONUS}; the captain counts double. The total is rounded to
 * two decimals half-to-even.
 */
public final class ScoreAggregator {

  public static final double HOME_BONUS = 6.0;
  public static final double CAPTAIN_MULTIPLIER = 2.0;

  public double total(List<Player> lineup, boolean away) {
    double points = away ? 0.0 : HOME_BONUS;
    for (Player p : lineup) {
      points += p.captain() ? CAPTAIN_MULTIPLIER * p.points() : p.points();
    }
    return round2(points);
  }

  static double round2(double value) {
    return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
  }
}

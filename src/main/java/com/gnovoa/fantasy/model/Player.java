package com.gnovoa.fantasy.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import java.util.Objects;

/**
 * Per-fixture player record.
 *
 * <p>{@code points == 0.0} means the player did not play or did not score. The captain flag only
 * matters on roster and bench entries handed to a {@code Team}; statistics entries ignore it.
 */
public record Player(
    @JsonAlias("_id") String id,
    String name,
    @JsonAlias("position_name") Position position,
    double points,
    boolean captain) {

  public Player {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(position, "position");
    if (!Double.isFinite(points)) {
      throw new IllegalArgumentException("Player " + id + " has non-finite points " + points);
    }
  }

  /** Roster or bench entry, no points yet. */
  public static Player of(String id, Position position, boolean captain) {
    return new Player(id, id, position, 0.0, captain);
  }

  /** Statistics entry for a fixture. */
  public static Player scored(String id, Position position, double points) {
    return new Player(id, id, position, points, false);
  }

  public Player withCaptain(boolean flag) {
    return flag == captain ? this : new Player(id, name, position, points, flag);
  }

  public boolean hasScored() {
    return points > 0.0;
  }
}

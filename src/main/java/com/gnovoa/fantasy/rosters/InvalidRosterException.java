package com.gnovoa.fantasy.rosters;

import com.gnovoa.fantasy.model.Position;

/**
 * The starting roster does not fit the formation.
 *
 * <p>{@link #position()} is null when the problem is not a per-position count mismatch (duplicate
 * ids, a player both starting and on the bench).
 */
public final class InvalidRosterException extends LineupException {

  private final Position position;
  private final int actual;
  private final int expected;
  private final String formationId;

  public InvalidRosterException(Position position, int actual, int expected, String formationId) {
    super(
        actual
            + " "
            + position.label().toLowerCase(java.util.Locale.ROOT)
            + "(s) not compatible with "
            + formationId
            + " (expected "
            + expected
            + ")");
    this.position = position;
    this.actual = actual;
    this.expected = expected;
    this.formationId = formationId;
  }

  public InvalidRosterException(String message, String formationId) {
    super(message);
    this.position = null;
    this.actual = -1;
    this.expected = -1;
    this.formationId = formationId;
  }

  public Position position() {
    return position;
  }

  public int actual() {
    return actual;
  }

  public int expected() {
    return expected;
  }

  public String formationId() {
    return formationId;
  }
}

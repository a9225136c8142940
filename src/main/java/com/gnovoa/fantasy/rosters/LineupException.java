package com.gnovoa.fantasy.rosters;

/** Base type for line-up problems detected while building a {@link Team}. */
public abstract class LineupException extends IllegalArgumentException {

  protected LineupException(String message) {
    super(message);
  }
}

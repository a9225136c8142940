package com.gnovoa.fantasy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Position category a player occupies in a formation. */
public enum Position {
  GOALKEEPER("Goalkeeper"),
  DEFENDER("Defender"),
  MIDFIELDER("Midfielder"),
  FORWARD("Forward");

  private final String label;

  Position(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  /**
   * Resolves a position from either its display label ("Midfielder") or its enum name
   * ("MIDFIELDER"), ignoring case.
   *
   * @param name position name as found in statistics feeds
   * @return matching position
   * @throws IllegalArgumentException if the name is blank or unknown
   */
  @JsonCreator
  public static Position fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Position name is required");
    }
    String normalized = name.trim().toUpperCase(Locale.ROOT);
    for (Position p : values()) {
      if (p.name().equals(normalized) || p.label.toUpperCase(Locale.ROOT).equals(normalized)) {
        return p;
      }
    }
    throw new IllegalArgumentException("Unknown position " + name);
  }
}

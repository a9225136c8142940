package com.gnovoa.fantasy.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Required number of starters per position for a line-up such as "4-4-2".
 *
 * @param id formation identifier
 * @param goalkeepers keeper slots (always 1)
 * @param defenders defender slots
 * @param midfielders midfielder slots
 * @param forwards forward slots
 */
public record Formation(String id, int goalkeepers, int defenders, int midfielders, int forwards) {

  public static final int STARTERS = 11;

  public Formation {
    if (goalkeepers != 1) {
      throw new IllegalArgumentException("Formation " + id + " must field exactly one goalkeeper");
    }
    if (defenders < 0 || midfielders < 0 || forwards < 0) {
      throw new IllegalArgumentException("Formation " + id + " has negative slot counts");
    }
    if (goalkeepers + defenders + midfielders + forwards != STARTERS) {
      throw new IllegalArgumentException("Formation " + id + " must field " + STARTERS + " players");
    }
  }

  /** Parses "D-M-F" shorthand; the goalkeeper is implied. */
  public static Formation parse(String id) {
    String[] parts = id.split("-");
    if (parts.length != 3) {
      throw new IllegalArgumentException("Formation " + id + " is not in D-M-F form");
    }
    try {
      return new Formation(
          id,
          1,
          Integer.parseInt(parts[0]),
          Integer.parseInt(parts[1]),
          Integer.parseInt(parts[2]));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Formation " + id + " is not in D-M-F form", e);
    }
  }

  public int slots(Position position) {
    return switch (position) {
      case GOALKEEPER -> goalkeepers;
      case DEFENDER -> defenders;
      case MIDFIELDER -> midfielders;
      case FORWARD -> forwards;
    };
  }

  public Map<Position, Integer> requirements() {
    Map<Position, Integer> map = new EnumMap<>(Position.class);
    for (Position p : Position.values()) map.put(p, slots(p));
    return map;
  }
}

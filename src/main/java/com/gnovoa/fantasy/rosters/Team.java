package com.gnovoa.fantasy.rosters;

import com.gnovoa.fantasy.model.Formation;
import com.gnovoa.fantasy.model.Player;
import com.gnovoa.fantasy.model.Position;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A validated fantasy team: starting roster, ordered bench and formation.
 *
 * <p>The roster must field exactly the number of players per position the formation asks for.
 * Bench order is substitution priority. Instances are immutable; a {@code Team} that exists has
 * passed validation.
 */
public record Team(List<Player> roster, List<Player> bench, Formation formation) {

  public Team {
    if (formation == null) throw new IllegalArgumentException("formation is required");
    roster = roster == null ? List.of() : List.copyOf(roster);
    bench = bench == null ? List.of() : List.copyOf(bench);
    validate(roster, bench, formation);
  }

  /**
   * Builds a team, resolving the formation through the catalog.
   *
   * @param roster starting players
   * @param bench substitutes in priority order
   * @param formationId formation identifier such as "4-4-2"
   * @param catalog formation lookup
   * @throws UnsupportedFormationException if the formation is unknown
   * @throws InvalidRosterException if the roster does not match the formation
   */
  public static Team of(
      List<Player> roster, List<Player> bench, String formationId, FormationCatalog catalog) {
    return new Team(roster, bench, catalog.require(formationId));
  }

  private static void validate(List<Player> roster, List<Player> bench, Formation formation) {
    Set<String> ids = new HashSet<>();
    for (Player p : roster) {
      if (!ids.add(p.id())) {
        throw new InvalidRosterException(
            "Player " + p.id() + " appears twice in the roster", formation.id());
      }
    }
    Set<String> benchIds = new HashSet<>();
    for (Player p : bench) {
      if (!benchIds.add(p.id())) {
        throw new InvalidRosterException(
            "Player " + p.id() + " appears twice on the bench", formation.id());
      }
      if (ids.contains(p.id())) {
        throw new InvalidRosterException(
            "Player " + p.id() + " is both starting and on the bench", formation.id());
      }
    }

    Map<Position, Integer> counts = new EnumMap<>(Position.class);
    for (Player p : roster) counts.merge(p.position(), 1, Integer::sum);

    for (Position position : Position.values()) {
      int actual = counts.getOrDefault(position, 0);
      int expected = formation.slots(position);
      if (actual != expected) {
        throw new InvalidRosterException(position, actual, expected, formation.id());
      }
    }
  }
}

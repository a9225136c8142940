package com.gnovoa.fantasy.core;

import com.gnovoa.fantasy.model.Player;
import java.util.List;

/**
 * Result of running the bench against the starters who played.
 *
 * @param lineup final scoring players, remaining starters first then substitutes in bench order;
 *     at most one carries the captain flag
 * @param substitutions substitutions in the order they were made
 * @param captainId captain after any transfer, null if nobody in the line-up is captain
 * @param limitReached true when the substitution budget is used up
 */
public record SubstitutionOutcome(
    List<Player> lineup, List<Substitution> substitutions, String captainId, boolean limitReached) {

  public SubstitutionOutcome {
    lineup = List.copyOf(lineup);
    substitutions = List.copyOf(substitutions);
  }

  public boolean captainTransferred() {
    return substitutions.stream().anyMatch(s -> s.out().captain());
  }
}

package com.gnovoa.fantasy.core;

import com.gnovoa.fantasy.model.Player;
import java.util.List;

/**
 * Outcome of scoring a team against one fixture.
 *
 * @param total rounded team score, home bonus included
 * @param goals goal equivalent of {@code total}
 * @param away whether the team played away
 * @param resolvedCaptainId captain picked from the roster before substitutions
 * @param finalCaptainId captain in the final line-up, after any transfer
 * @param substitutions substitutions made, in order
 * @param lineup players whose points counted
 */
public record ScoreReport(
    double total,
    int goals,
    boolean away,
    String resolvedCaptainId,
    String finalCaptainId,
    List<Substitution> substitutions,
    List<Player> lineup) {

  public ScoreReport {
    substitutions = List.copyOf(substitutions);
    lineup = List.copyOf(lineup);
  }
}

package com.gnovoa.fantasy.core;

import com.gnovoa.fantasy.model.Player;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces starters who did not score with bench players of the same position.
 *
 * <p>Single greedy pass: starters with zero points are walked in roster order and each takes the
 * first unused eligible substitute of its position in bench order. No backtracking. Starters
 * without a match stay in unscored and do not count against the limit. If the captain goes off,
 * the substitute inherits the armband whatever it scored.
 */
public final class SubstitutionEngine {

  private static final Logger log = LoggerFactory.getLogger(SubstitutionEngine.class);

  private final int maxSubstitutions;

  public SubstitutionEngine(int maxSubstitutions) {
    if (maxSubstitutions < 0) {
      throw new IllegalArgumentException("maxSubstitutions must be >= 0");
    }
    this.maxSubstitutions = maxSubstitutions;
  }

  public int maxSubstitutions() {
    return maxSubstitutions;
  }

  /**
   * @param playing starters found in the fixture, roster order, captain flag already resolved
   * @param eligible bench players who scored, bench order
   * @return final line-up and the substitutions made
   */
  public SubstitutionOutcome substitute(List<Player> playing, List<Player> eligible) {
    String captainId = captainOf(playing);
    if (eligible.isEmpty()) {
      return new SubstitutionOutcome(playing, List.of(), captainId, maxSubstitutions == 0);
    }

    List<Player> candidates = playing.stream().filter(p -> p.points() == 0.0).toList();
    log.debug("Candidates for substitution: {}", candidates);

    List<Substitution> done = new ArrayList<>();
    Set<String> outIds = new HashSet<>();
    Set<String> usedIds = new HashSet<>();
    String captainSubstituteId = null;

    for (Player candidate : candidates) {
      if (done.size() >= maxSubstitutions) break;
      Player sub = firstUnused(eligible, candidate, usedIds);
      if (sub == null) {
        log.debug("No substitute available for {}", candidate.id());
        continue;
      }
      outIds.add(candidate.id());
      usedIds.add(sub.id());
      done.add(new Substitution(candidate, sub));
      log.debug("Substituting {} with {}", candidate.id(), sub.id());
      if (candidate.captain()) {
        log.warn("Substitution of the captain {} by {}", candidate.id(), sub.id());
        captainSubstituteId = sub.id();
      }
      if (done.size() == maxSubstitutions) {
        log.info("Reached maximum substitutions limit ({})", maxSubstitutions);
      }
    }

    List<Player> lineup = new ArrayList<>(playing.size());
    for (Player p : playing) {
      if (!outIds.contains(p.id())) lineup.add(p);
    }
    for (Player p : eligible) {
      if (usedIds.contains(p.id())) lineup.add(p);
    }

    if (captainSubstituteId != null) {
      captainId = captainSubstituteId;
      List<Player> recaptained = new ArrayList<>(lineup.size());
      for (Player p : lineup) recaptained.add(p.withCaptain(p.id().equals(captainSubstituteId)));
      lineup = recaptained;
    }
    log.info("Final line-up: {}", lineup);
    return new SubstitutionOutcome(lineup, done, captainId, done.size() >= maxSubstitutions);
  }

  private static Player firstUnused(List<Player> eligible, Player candidate, Set<String> usedIds) {
    for (Player p : eligible) {
      if (p.position() == candidate.position() && !usedIds.contains(p.id())) return p;
    }
    return null;
  }

  private static String captainOf(List<Player> players) {
    for (Player p : players) {
      if (p.captain()) return p.id();
    }
    return null;
  }
}

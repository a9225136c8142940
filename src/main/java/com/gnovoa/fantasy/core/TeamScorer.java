package com.gnovoa.fantasy.core;

import com.gnovoa.fantasy.model.Player;
import com.gnovoa.fantasy.rosters.Team;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores a {@link Team} against a fixture's player statistics.
 *
 * <p>Resolves the captain, applies bench substitutions and sums the points. Pure apart from the
 * captain pick when no captain is flagged; the team is never modified. Statistics for players
 * outside the team are ignored, team players missing from the statistics do not count.
 */
public final class TeamScorer {

  private static final Logger log = LoggerFactory.getLogger(TeamScorer.class);

  private final CaptainResolver captains;
  private final SubstitutionEngine substitutions;
  private final ScoreAggregator aggregator;
  private final GoalConverter goals;

  public TeamScorer(
      CaptainResolver captains,
      SubstitutionEngine substitutions,
      ScoreAggregator aggregator,
      GoalConverter goals) {
    this.captains = captains;
    this.substitutions = substitutions;
    this.aggregator = aggregator;
    this.goals = goals;
  }

  /** Shortcut returning only the rounded total. */
  public double points(Team team, List<Player> fixture, boolean away) {
    return score(team, fixture, away).total();
  }

  public ScoreReport score(Team team, List<Player> fixture, boolean away) {
    Map<String, Player> stats = index(fixture);
    String captainId = captains.resolve(team.roster());

    List<Player> playing = new ArrayList<>();
    for (Player starter : team.roster()) {
      Player s = stats.get(starter.id());
      if (s != null) playing.add(s.withCaptain(s.id().equals(captainId)));
    }
    log.debug("Playing players: {}", playing);

    List<Player> eligible = new ArrayList<>();
    for (Player benched : team.bench()) {
      Player s = stats.get(benched.id());
      if (s != null && s.hasScored()) eligible.add(s.withCaptain(false));
    }
    log.debug("Eligible substitutes: {}", eligible);

    SubstitutionOutcome outcome = substitutions.substitute(playing, eligible);
    double total = aggregator.total(outcome.lineup(), away);
    return new ScoreReport(
        total,
        goals.goals(Math.max(0.0, total)),
        away,
        captainId,
        outcome.captainId(),
        outcome.substitutions(),
        outcome.lineup());
  }

  public GoalConverter goalConverter() {
    return goals;
  }

  /** First entry wins when a fixture lists the same id twice. */
  private static Map<String, Player> index(List<Player> fixture) {
    Map<String, Player> map = new LinkedHashMap<>();
    if (fixture == null) return map;
    for (Player p : fixture) map.putIfAbsent(p.id(), p);
    return map;
  }
}

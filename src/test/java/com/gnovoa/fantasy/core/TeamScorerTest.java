package com.gnovoa.fantasy.core;

import static com.gnovoa.fantasy.Lineups.bench;
import static com.gnovoa.fantasy.Lineups.fixture442;
import static com.gnovoa.fantasy.Lineups.roster442;
import static com.gnovoa.fantasy.Lineups.with;
import static org.assertj.core.api.Assertions.assertThat;

import com.gnovoa.fantasy.config.ScoringProperties;
import com.gnovoa.fantasy.config.ScoringWiring;
import com.gnovoa.fantasy.model.Player;
import com.gnovoa.fantasy.model.Position;
import com.gnovoa.fantasy.rosters.FormationCatalog;
import com.gnovoa.fantasy.rosters.StandardFormationCatalog;
import com.gnovoa.fantasy.rosters.Team;
import com.gnovoa.fantasy.sim.SeededRandomSource;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TeamScorerTest {

  private final FormationCatalog catalog = new StandardFormationCatalog();
  private final TeamScorer scorer =
      ScoringWiring.scorer(ScoringProperties.defaults(), new SeededRandomSource(3L));

  private Team team(String captainId, Player... bench) {
    return Team.of(roster442(captainId), List.of(bench), "4-4-2", catalog);
  }

  @Test
  @DisplayName("Home 4-4-2, captain scores 10, the rest 50: 6 + 20 + 50")
  void homeTeamWithCaptain() {
    Map<String, Double> points = Map.of("m1", 10.0);

    double total = scorer.points(team("m1"), fixture442(points), false);

    assertThat(total).isEqualTo(76.0);
  }

  @Test
  @DisplayName("Starting forward on 0 is replaced by the bench forward on 8")
  void forwardIsSubstituted() {
    Team team = team("m1", bench("bf", Position.FORWARD));
    List<Player> fixture =
        with(fixture442(Map.of("f2", 0.0)), Player.scored("bf", Position.FORWARD, 8.0));

    ScoreReport report = scorer.score(team, fixture, true);

    // 9 starters on 5, captain doubled, plus the substitute
    assertThat(report.total()).isEqualTo(9 * 5.0 + 2 * 5.0 + 8.0);
    assertThat(report.substitutions())
        .singleElement()
        .satisfies(
            s -> {
              assertThat(s.out().id()).isEqualTo("f2");
              assertThat(s.in().id()).isEqualTo("bf");
            });
    assertThat(report.lineup()).extracting(Player::id).doesNotContain("f2").contains("bf");
  }

  @Test
  @DisplayName("Captain on 0 is substituted and the substitute scores double")
  void captainTransfersToSubstitute() {
    Team team = team("m2", bench("bm", Position.MIDFIELDER));
    List<Player> fixture =
        with(fixture442(Map.of("m2", 0.0)), Player.scored("bm", Position.MIDFIELDER, 5.0));

    ScoreReport report = scorer.score(team, fixture, true);

    assertThat(report.resolvedCaptainId()).isEqualTo("m2");
    assertThat(report.finalCaptainId()).isEqualTo("bm");
    assertThat(report.total()).isEqualTo(10 * 5.0 + 10.0);
  }

  @Test
  void captainBonusAddsExactlyTheCaptainsPoints() {
    List<Player> fixture = fixture442(Map.of("f1", 12.5));

    double asCaptain = scorer.points(team("f1"), fixture, true);
    double notCaptain = scorer.points(team("gk"), fixture, true);

    // armband moves from the keeper (5) to f1 (12.5)
    assertThat(asCaptain).isEqualTo(notCaptain + 12.5 - 5.0);
  }

  @Test
  void substitutionsStopAtTheConfiguredLimit() {
    Team team =
        team(
            "gk",
            bench("b1", Position.DEFENDER),
            bench("b2", Position.DEFENDER),
            bench("b3", Position.DEFENDER),
            bench("b4", Position.DEFENDER),
            bench("b5", Position.MIDFIELDER),
            bench("b6", Position.MIDFIELDER));
    List<Player> fixture =
        with(
            fixture442(Map.of("d1", 0.0, "d2", 0.0, "d3", 0.0, "d4", 0.0, "m1", 0.0, "m2", 0.0)),
            Player.scored("b1", Position.DEFENDER, 1.0),
            Player.scored("b2", Position.DEFENDER, 1.0),
            Player.scored("b3", Position.DEFENDER, 1.0),
            Player.scored("b4", Position.DEFENDER, 1.0),
            Player.scored("b5", Position.MIDFIELDER, 1.0),
            Player.scored("b6", Position.MIDFIELDER, 1.0));

    ScoreReport report = scorer.score(team, fixture, true);

    assertThat(report.substitutions()).hasSize(5);
    assertThat(report.substitutions()).extracting(s -> s.out().id()).doesNotContain("m2");

    TeamScorer strict =
        ScoringWiring.scorer(
            ScoringProperties.defaults().withMaxSubstitutions(2), new SeededRandomSource(3L));
    assertThat(strict.score(team, fixture, true).substitutions()).hasSize(2);
  }

  @Test
  void benchPlayersWhoDidNotScoreOrPlayAreIgnored() {
    Team team =
        team(
            "m1",
            bench("zero", Position.FORWARD),
            bench("absent", Position.FORWARD),
            bench("late", Position.FORWARD));
    List<Player> fixture =
        with(
            fixture442(Map.of("f1", 0.0)),
            Player.scored("zero", Position.FORWARD, 0.0),
            Player.scored("late", Position.FORWARD, 2.0));

    ScoreReport report = scorer.score(team, fixture, true);

    assertThat(report.substitutions()).extracting(s -> s.in().id()).containsExactly("late");
  }

  @Test
  void benchOrderBeatsFixtureOrder() {
    Team team = team("m1", bench("first", Position.DEFENDER), bench("second", Position.DEFENDER));
    List<Player> fixture =
        with(
            fixture442(Map.of("d3", 0.0)),
            Player.scored("second", Position.DEFENDER, 9.0),
            Player.scored("first", Position.DEFENDER, 1.0));

    ScoreReport report = scorer.score(team, fixture, true);

    assertThat(report.substitutions()).extracting(s -> s.in().id()).containsExactly("first");
  }

  @Test
  void playersOutsideTheTeamAndMissingStartersDoNotCount() {
    List<Player> fixture =
        with(
            fixture442(Map.of()).subList(0, 10),
            Player.scored("stranger", Position.FORWARD, 100.0));

    ScoreReport report = scorer.score(team("gk"), fixture, true);

    assertThat(report.lineup()).hasSize(10);
    assertThat(report.total()).isEqualTo(11 * 5.0);
  }

  @Test
  void emptyFixtureScoresOnlyHomeBonus() {
    Team team = team("m1", bench("b", Position.FORWARD));

    assertThat(scorer.points(team, List.of(), false)).isEqualTo(6.0);
    assertThat(scorer.points(team, null, true)).isEqualTo(0.0);
  }

  @Test
  void scoringIsRepeatableAndLeavesTheTeamUntouched() {
    Team team = team(null, bench("bf", Position.FORWARD));
    List<Player> fixture =
        with(fixture442(Map.of("f1", 0.0, "m4", 7.0)), Player.scored("bf", Position.FORWARD, 3.0));

    TeamScorer a = ScoringWiring.scorer(ScoringProperties.defaults(), new SeededRandomSource(9L));
    TeamScorer b = ScoringWiring.scorer(ScoringProperties.defaults(), new SeededRandomSource(9L));

    assertThat(a.score(team, fixture, false)).isEqualTo(b.score(team, fixture, false));
    assertThat(team.roster()).noneMatch(Player::captain);
    assertThat(team.roster()).allMatch(p -> p.points() == 0.0);
  }

  @Test
  void reportCarriesGoalEquivalent() {
    Map<String, Double> points =
        Map.of("gk", 20.0, "d1", 20.0, "d2", 20.0, "d3", 20.0, "d4", 20.0, "m1", 25.0);

    ScoreReport report = scorer.score(team("m1"), fixture442(points), true);

    // 5*20 + 2*25 + 5*5 = 175
    assertThat(report.total()).isEqualTo(175.0);
    assertThat(report.goals()).isZero();

    ScoreReport home = scorer.score(team("m1"), fixture442(Map.of("m1", 120.0)), false);
    // 6 + 240 + 10*5 = 296 -> beats 200..280
    assertThat(home.total()).isEqualTo(296.0);
    assertThat(home.goals()).isEqualTo(5);
  }
}

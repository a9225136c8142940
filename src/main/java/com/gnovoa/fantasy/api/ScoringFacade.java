package com.gnovoa.fantasy.api;

import com.gnovoa.fantasy.api.dto.FormationResponse;
import com.gnovoa.fantasy.api.dto.GoalsResponse;
import com.gnovoa.fantasy.api.dto.PlayerEntry;
import com.gnovoa.fantasy.api.dto.ScoreRequest;
import com.gnovoa.fantasy.api.dto.ScoreResponse;
import com.gnovoa.fantasy.core.GoalConverter;
import com.gnovoa.fantasy.core.ScoreReport;
import com.gnovoa.fantasy.core.TeamScorer;
import com.gnovoa.fantasy.model.Player;
import com.gnovoa.fantasy.rosters.FormationCatalog;
import com.gnovoa.fantasy.rosters.Team;
import com.gnovoa.fantasy.stats.FixtureStatsReader;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Maps API payloads onto the scoring engine and back. */
@Component
public final class ScoringFacade {

    private final FormationCatalog formations;
    private final TeamScorer scorer;
    private final FixtureStatsReader statsReader;

    public ScoringFacade(FormationCatalog formations, TeamScorer scorer, FixtureStatsReader statsReader) {
        this.formations = formations;
        this.scorer = scorer;
        this.statsReader = statsReader;
    }

    public List<FormationResponse> formations() {
        return formations.all().stream().map(FormationResponse::from).toList();
    }

    public Optional<FormationResponse> formation(String id) {
        return formations.find(id).map(FormationResponse::from);
    }

    public ScoreResponse score(ScoreRequest request) {
        return score(request, players(request.fixture()));
    }

    /**
     * Scores a team against statistics uploaded as JSON Lines; {@code request.fixture()} is ignored.
     *
     * @throws IllegalStateException if the statistics cannot be parsed
     */
    public ScoreResponse score(ScoreRequest request, InputStream fixture, String source) {
        return score(request, statsReader.read(fixture, source));
    }

    private ScoreResponse score(ScoreRequest request, List<Player> fixture) {
        Team team = Team.of(players(request.roster()), players(request.bench()), request.formation(), formations);
        ScoreReport report = scorer.score(team, fixture, request.away());

        var subs = report.substitutions().stream()
                .map(s -> new ScoreResponse.SubstitutionItem(s.out().id(), s.in().id(), s.out().position().label()))
                .toList();
        var lineup = report.lineup().stream().map(PlayerEntry::from).toList();

        return new ScoreResponse(
                team.formation().id(),
                report.total(),
                report.goals(),
                report.away(),
                report.resolvedCaptainId(),
                report.finalCaptainId(),
                subs,
                lineup
        );
    }

    public GoalsResponse goals(double points) {
        GoalConverter converter = scorer.goalConverter();
        return new GoalsResponse(points, converter.goals(points), converter.threshold(), converter.gap());
    }

    private static List<Player> players(List<PlayerEntry> entries) {
        if (entries == null) return List.of();
        return entries.stream().map(PlayerEntry::toPlayer).toList();
    }
}

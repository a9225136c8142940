package com.gnovoa.fantasy.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.fantasy.core.CaptainResolver;
import com.gnovoa.fantasy.core.GoalConverter;
import com.gnovoa.fantasy.core.ScoreAggregator;
import com.gnovoa.fantasy.core.SubstitutionEngine;
import com.gnovoa.fantasy.core.TeamScorer;
import com.gnovoa.fantasy.rosters.FormationCatalog;
import com.gnovoa.fantasy.rosters.StandardFormationCatalog;
import com.gnovoa.fantasy.sim.LocalRandomSource;
import com.gnovoa.fantasy.sim.RandomSource;
import com.gnovoa.fantasy.sim.SeededRandomSource;
import com.gnovoa.fantasy.stats.FixtureStatsReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ScoringWiring {

    private static final Logger log = LoggerFactory.getLogger(ScoringWiring.class);

    @Bean
    public FormationCatalog formationCatalog() {
        return new StandardFormationCatalog();
    }

    @Bean
    public RandomSource captainRandomSource(ScoringProperties props) {
        if (props.captainSeed() != null) {
            log.info("Random captain picks seeded with {}", props.captainSeed());
            return new SeededRandomSource(props.captainSeed());
        }
        return new LocalRandomSource();
    }

    @Bean
    public TeamScorer teamScorer(ScoringProperties props, RandomSource captainRandomSource) {
        log.info("Scoring with maxSubstitutions={}, goalThreshold={}, goalGap={}",
                props.maxSubstitutions(), props.goalThreshold(), props.goalGap());
        return scorer(props, captainRandomSource);
    }

    @Bean
    public FixtureStatsReader fixtureStatsReader(ObjectMapper mapper) {
        return new FixtureStatsReader(mapper);
    }

    /** Builds a scorer outside Spring, e.g. for tests or batch tools. */
    public static TeamScorer scorer(ScoringProperties props, RandomSource rnd) {
        return new TeamScorer(
                new CaptainResolver(rnd),
                new SubstitutionEngine(props.maxSubstitutions()),
                new ScoreAggregator(),
                new GoalConverter(props.goalThreshold(), props.goalGap()));
    }
}

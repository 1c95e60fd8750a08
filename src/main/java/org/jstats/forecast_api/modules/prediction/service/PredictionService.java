package org.jstats.forecast_api.modules.prediction.service;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.forecast_api.modules.prediction.model.FinalScore;
import org.jstats.forecast_api.modules.prediction.model.HistoricalMatchup;
import org.jstats.forecast_api.modules.prediction.model.MatchInput;
import org.jstats.forecast_api.modules.prediction.model.PredictionContext;
import org.jstats.forecast_api.modules.prediction.model.PredictionResult;
import org.jstats.forecast_api.modules.prediction.model.StoredPrediction;
import org.jstats.forecast_api.modules.prediction.repository.MatchResultRepository;
import org.jstats.forecast_api.modules.prediction.repository.PredictionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the registered algorithms over matches, persists their output and
 * settles it once the final score is known.
 * <p>
 * Storage problems never cost a caller its predictions: reads fall back to an
 * empty head-to-head and failed writes are logged.
 */
@Service
@NullMarked
public class PredictionService {

    private static final Logger log = LoggerFactory.getLogger(PredictionService.class);

    private final AlgorithmRegistry registry;
    private final AlgorithmPredictor predictor;
    private final PredictionGrader grader;
    private final PredictionRepository predictionRepository;
    private final MatchResultRepository matchResultRepository;
    private final Clock clock;

    public PredictionService(
            AlgorithmRegistry registry,
            AlgorithmPredictor predictor,
            PredictionGrader grader,
            PredictionRepository predictionRepository,
            MatchResultRepository matchResultRepository,
            Clock clock) {
        this.registry = registry;
        this.predictor = predictor;
        this.grader = grader;
        this.predictionRepository = predictionRepository;
        this.matchResultRepository = matchResultRepository;
        this.clock = clock;
    }

    /**
     * One algorithm, one match. Unknown ids run with the default tuning.
     */
    public PredictionResult predict(String algorithmId, MatchInput match, @Nullable PredictionContext context) {
        PredictionResult result = predictor.predict(registry.definition(algorithmId), match, enrich(match, context));
        store(List.of(result));
        return result;
    }

    /**
     * Every registered algorithm on one match, in registry order.
     */
    public List<PredictionResult> predictAll(MatchInput match, @Nullable PredictionContext context) {
        PredictionContext enriched = enrich(match, context);
        List<PredictionResult> results = registry.all().stream()
                .map(algorithm -> predictor.predict(algorithm, match, enriched))
                .toList();
        if (log.isDebugEnabled()) {
            results.forEach(r -> log.debug("Match {} {}: {} @ {}", match.id(), r.algorithmName(),
                    r.recommendation().code(), r.confidence()));
        }
        store(results);
        return results;
    }

    /**
     * Every registered algorithm on every match; matches are independent of each other.
     */
    public List<PredictionResult> predictBatch(List<MatchInput> matches, @Nullable PredictionContext context) {
        List<PredictionResult> results = new ArrayList<>(matches.size() * registry.all().size());
        for (MatchInput match : matches) {
            PredictionContext enriched = enrich(match, context);
            for (AlgorithmDefinition algorithm : registry.all()) {
                results.add(predictor.predict(algorithm, match, enriched));
            }
        }
        log.info("Predicted {} matches with {} algorithms", matches.size(), registry.all().size());
        store(results);
        return results;
    }

    /**
     * Records the final score and settles every pending prediction for the match.
     *
     * @return the match's predictions after settlement
     */
    public List<StoredPrediction> settle(String matchId, FinalScore score) {
        var now = clock.instant();
        matchResultRepository.record(matchId, score, now);

        List<StoredPrediction> pending = predictionRepository.findPending(matchId);
        for (StoredPrediction prediction : pending) {
            PredictionGrader.Grade grade = grader.grade(prediction, score);
            predictionRepository.settle(prediction.id(), grade.status(), grade.accuracyRating(), now);
        }
        log.info("Settled {} predictions for match {} ({}-{})",
                pending.size(), matchId, score.homeScore(), score.awayScore());
        return predictionRepository.findByMatch(matchId);
    }

    // Head-to-head from stored results when the caller did not supply one
    PredictionContext enrich(MatchInput match, @Nullable PredictionContext context) {
        PredictionContext ctx = context != null ? context : PredictionContext.empty();
        if (ctx.historical() != null) {
            return ctx;
        }
        try {
            HistoricalMatchup matchup = matchResultRepository.headToHead(match.homeTeam().id(), match.awayTeam().id());
            return matchup.totalGames() > 0 ? ctx.withHistorical(matchup) : ctx;
        } catch (DataAccessException e) {
            if (log.isWarnEnabled()) {
                log.warn("Head-to-head lookup failed for match {}, predicting without it: {}", match.id(), e.getMessage());
            }
            return ctx;
        }
    }

    private void store(List<PredictionResult> results) {
        try {
            predictionRepository.saveBatch(results);
        } catch (DataAccessException e) {
            if (log.isErrorEnabled()) {
                log.error("Failed to store {} predictions: {}", results.size(), e.getMessage());
            }
        }
    }
}

package org.jstats.forecast_api.modules.prediction.service;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.forecast_api.modules.prediction.model.AlgorithmConfig;
import org.jstats.forecast_api.modules.prediction.model.HistoricalMatchup;
import org.jstats.forecast_api.modules.prediction.model.MatchInput;
import org.jstats.forecast_api.modules.prediction.model.OddsSnapshot;
import org.jstats.forecast_api.modules.prediction.model.PredictionContext;
import org.jstats.forecast_api.modules.prediction.model.PredictionFactors;
import org.jstats.forecast_api.modules.prediction.model.PredictionResult;
import org.jstats.forecast_api.modules.prediction.model.Recommendation;
import org.jstats.forecast_api.modules.prediction.model.ScorePair;
import org.jstats.forecast_api.modules.prediction.model.StrengthMetrics;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * The shared prediction pipeline: factors, confidence, recommendation, score
 * projection and wager sizing. Variants differ only through their
 * {@link AlgorithmConfig} and {@link PredictionHooks}.
 * <p>
 * Stateless; concurrent calls never share mutable data.
 */
@Component
@NullMarked
public class AlgorithmPredictor {

    private static final double EVEN_MONEY = 2.0;
    private static final double HISTORICAL_SCALE = 20;
    private static final double HOME_SCORE_BUMP = 1.02;

    private final TeamStrengthCalculator strengthCalculator;
    private final Clock clock;

    public AlgorithmPredictor(TeamStrengthCalculator strengthCalculator, Clock clock) {
        this.strengthCalculator = strengthCalculator;
        this.clock = clock;
    }

    public PredictionResult predict(AlgorithmDefinition algorithm, MatchInput match, @Nullable PredictionContext context) {
        AlgorithmConfig config = algorithm.config();
        PredictionHooks hooks = algorithm.hooks();
        PredictionContext ctx = context != null ? context : PredictionContext.empty();

        PredictionFactors factors = hooks.factors().apply(calculateFactors(match, ctx));
        double confidence = clampConfidence(baseConfidence(factors, config), config);
        confidence = clampConfidence(hooks.confidence().apply(confidence, factors, config), config);
        Recommendation recommendation = recommend(confidence, factors, config);

        double trueProbability = confidence / 100;
        double odds = oddsFor(recommendation, ctx.odds() != null ? ctx.odds() : match.odds());
        WagerMath.ExpectedValue ev = WagerMath.ExpectedValue.ZERO;
        WagerMath.KellyStake kelly = WagerMath.KellyStake.ZERO;
        if (recommendation.isSide() && WagerMath.isValid(trueProbability, odds)) {
            ev = WagerMath.expectedValue(trueProbability, odds);
            kelly = WagerMath.kelly(trueProbability, odds);
        }

        StrengthMetrics home = factors.teamStrength().home();
        StrengthMetrics away = factors.teamStrength().away();
        PredictionResult result = new PredictionResult(
                match.id(),
                config.id(),
                config.name(),
                recommendation,
                Math.round(confidence),
                trueProbability,
                new ScorePair(
                        projectScore(home, away, true, match.league()),
                        projectScore(away, home, false, match.league())),
                WagerMath.round(1 / trueProbability, 2),
                ev.expectedValue(),
                ev.evPercentage(),
                kelly.kellyFraction(),
                kelly.kellyStakeUnits(),
                factors,
                clock.instant());

        return hooks.result().apply(result);
    }

    public List<PredictionResult> predictBatch(AlgorithmDefinition algorithm, List<MatchInput> matches,
                                               @Nullable PredictionContext context) {
        return matches.stream()
                .map(match -> predict(algorithm, match, context))
                .toList();
    }

    PredictionFactors calculateFactors(MatchInput match, PredictionContext context) {
        StrengthMetrics home = strengthCalculator.calculate(match.homeTeam());
        StrengthMetrics away = strengthCalculator.calculate(match.awayTeam());

        PredictionFactors.HistoricalFactor historical = null;
        HistoricalMatchup matchup = context.historical();
        if (matchup != null && matchup.totalGames() > 0) {
            historical = new PredictionFactors.HistoricalFactor(matchup, (matchup.homeWinPct() - 0.5) * HISTORICAL_SCALE);
        }

        PredictionFactors.InjuryFactor injuries = null;
        if (context.injuries() != null) {
            PredictionContext.Injuries reported = context.injuries();
            injuries = new PredictionFactors.InjuryFactor(reported.homeImpact(), reported.awayImpact(),
                    reported.awayImpact() - reported.homeImpact());
        }

        PredictionFactors.WeatherFactor weather = null;
        if (context.weather() != null) {
            weather = new PredictionFactors.WeatherFactor(context.weather().condition(), context.weather().impact());
        }

        return new PredictionFactors(
                PredictionFactors.TeamStrength.of(home, away),
                LeagueProfiles.homeAdvantage(match.league()),
                new PredictionFactors.Momentum(home.momentum(), away.momentum(), home.momentum() - away.momentum()),
                historical,
                injuries,
                weather);
    }

    static double baseConfidence(PredictionFactors factors, AlgorithmConfig config) {
        AlgorithmConfig.Weights w = config.weights();
        double confidence = 50;
        confidence += factors.teamStrength().differential() * w.teamStrength();
        confidence += factors.homeAdvantage() * w.homeAdvantage();
        confidence += factors.momentum().differential() * w.momentum() * 0.1;
        if (factors.historical() != null) {
            confidence += factors.historical().impact() * w.historical();
        }
        if (factors.injuries() != null) {
            confidence += factors.injuries().differential() * w.injuries();
        }
        return confidence;
    }

    static Recommendation recommend(double confidence, PredictionFactors factors, AlgorithmConfig config) {
        if (confidence < config.thresholds().skipThreshold()) {
            return Recommendation.SKIP;
        }
        return factors.teamStrength().differential() >= 0 ? Recommendation.HOME : Recommendation.AWAY;
    }

    static double projectScore(StrengthMetrics team, StrengthMetrics opponent, boolean isHome, String league) {
        double base = LeagueProfiles.baseScore(league);
        double offenseImpact = (team.offense() - 50) / 100;
        double defenseImpact = (50 - opponent.defense()) / 100;
        double momentumImpact = (team.momentum() - 50) / 200;

        double projected = base * (1 + offenseImpact + defenseImpact + momentumImpact);
        if (isHome) {
            projected *= HOME_SCORE_BUMP;
        }
        return Math.max(0, WagerMath.round(projected, 1));
    }

    // Missing prices are priced at even money; skip has no price at all
    private static double oddsFor(Recommendation recommendation, @Nullable OddsSnapshot odds) {
        if (!recommendation.isSide()) {
            return 0;
        }
        if (odds == null) {
            return EVEN_MONEY;
        }
        Double price = odds.priceFor(recommendation);
        return price != null ? price : EVEN_MONEY;
    }

    private static double clampConfidence(double confidence, AlgorithmConfig config) {
        return Math.max(config.thresholds().minConfidence(), Math.min(AlgorithmRegistry.MAX_CONFIDENCE, confidence));
    }
}

package org.jstats.forecast_api.modules.consensus.service;

import org.jspecify.annotations.NullMarked;
import org.jstats.forecast_api.modules.consensus.model.AlgorithmWeight;
import org.jstats.forecast_api.modules.consensus.model.ConsensusResult;
import org.jstats.forecast_api.modules.prediction.model.PredictionFactors;
import org.jstats.forecast_api.modules.prediction.model.PredictionResult;
import org.jstats.forecast_api.modules.prediction.model.Recommendation;
import org.jstats.forecast_api.modules.prediction.model.ScorePair;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.jstats.forecast_api.modules.prediction.service.WagerMath.round;

/**
 * Fuses several algorithms' predictions for one match into a weighted vote.
 * <p>
 * Confidence is the weighted mean scaled by {@code 0.85 + 0.15 * agreement}, so a split
 * panel costs up to 15% of it while a unanimous one keeps it whole.
 */
@Component
@NullMarked
public class ConsensusSynthesizer {

    public static final String CONSENSUS_ID = "consensus";
    public static final String CONSENSUS_NAME = "AI Consensus";

    static final double MIN_CONFIDENCE = 40;
    static final double MAX_CONFIDENCE = 95;

    // Order decides ties between equal vote masses
    private static final List<Recommendation> VOTE_ORDER =
            List.of(Recommendation.HOME, Recommendation.AWAY, Recommendation.DRAW);

    private final Clock clock;

    public ConsensusSynthesizer(Clock clock) {
        this.clock = clock;
    }

    public ConsensusResult synthesize(List<PredictionResult> predictions, List<AlgorithmWeight> weights, String matchId) {
        int n = predictions.size();
        Map<String, Double> weightById = new HashMap<>();
        for (AlgorithmWeight w : weights) {
            weightById.put(w.algorithmId(), w.weight());
        }
        double defaultWeight = n > 0 ? 1.0 / n : 0;

        Map<Recommendation, Double> votes = new EnumMap<>(Recommendation.class);
        double totalWeight = 0;
        double confidence = 0;
        double probability = 0;
        double homeScore = 0;
        double awayScore = 0;
        double ev = 0;
        double evPct = 0;
        double kelly = 0;
        double stake = 0;

        for (PredictionResult p : predictions) {
            double w = weightById.getOrDefault(p.algorithmId(), defaultWeight);
            totalWeight += w;
            if (p.recommendation().isSide()) {
                votes.merge(p.recommendation(), w, Double::sum);
            }
            confidence += p.confidence() * w;
            probability += p.trueProbability() * w;
            homeScore += p.projectedScore().home() * w;
            awayScore += p.projectedScore().away() * w;
            ev += p.expectedValue() * w;
            evPct += p.evPercentage() * w;
            kelly += p.kellyFraction() * w;
            stake += p.kellyStakeUnits() * w;
        }

        Recommendation winner = winningRecommendation(votes);
        long matching = predictions.stream().filter(p -> p.recommendation() == winner).count();
        double agreement = n > 0 ? (double) matching / n : 0;

        // Rounded once, from the unrounded mean
        double meanConfidence = mean(confidence, totalWeight);
        double weightedConfidence = Math.round(meanConfidence);
        double finalConfidence = clamp(Math.round(meanConfidence * (0.85 + 0.15 * agreement)),
                MIN_CONFIDENCE, MAX_CONFIDENCE);
        double trueProbability = clamp(mean(probability, totalWeight), 0.01, 0.99);

        PredictionFactors factors = n > 0 ? predictions.get(0).factors() : PredictionFactors.neutral();
        PredictionResult fused = new PredictionResult(
                matchId,
                CONSENSUS_ID,
                CONSENSUS_NAME,
                winner,
                finalConfidence,
                trueProbability,
                new ScorePair(round(mean(homeScore, totalWeight), 1), round(mean(awayScore, totalWeight), 1)),
                impliedOdds(trueProbability),
                round(mean(ev, totalWeight), 4),
                round(mean(evPct, totalWeight), 2),
                round(mean(kelly, totalWeight), 4),
                round(mean(stake, totalWeight), 2),
                factors,
                clock.instant());

        return new ConsensusResult(fused, predictions, weights, agreement, agreement == 1.0, weightedConfidence);
    }

    /**
     * Category with the strictly largest vote mass; home wins ties over away, away over draw.
     * No mass at all means skip.
     */
    static Recommendation winningRecommendation(Map<Recommendation, Double> votes) {
        Recommendation winner = Recommendation.SKIP;
        double best = 0;
        for (Recommendation side : VOTE_ORDER) {
            double mass = votes.getOrDefault(side, 0.0);
            if (mass > best) {
                best = mass;
                winner = side;
            }
        }
        return winner;
    }

    static double impliedOdds(double probability) {
        return probability > 0 ? round(1 / probability, 2) : 2;
    }

    private static double mean(double sum, double totalWeight) {
        return totalWeight > 0 ? sum / totalWeight : 0;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}

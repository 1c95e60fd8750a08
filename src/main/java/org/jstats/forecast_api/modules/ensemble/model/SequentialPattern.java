package org.jstats.forecast_api.modules.ensemble.model;

/**
 * Shape detected in a team's recent form.
 *
 * @param strength   0-1 for streaks and alternation, signal magnitude otherwise
 * @param adjustment confidence points this pattern suggests for the team's side
 */
public record SequentialPattern(PatternType type, double strength, double adjustment, String description) {

    public static SequentialPattern none(String description) {
        return new SequentialPattern(PatternType.NONE, 0, 0, description);
    }
}

package org.jstats.forecast_api.modules.ensemble.model;

/**
 * Confidence points each ensemble layer contributed, rounded to 2 decimals.
 */
public record LayerContributions(
        double baseLearners,
        double gradientBoosting,
        double sequentialPattern,
        double diversityBonus
) {}

package org.jstats.forecast_api.modules.prediction.model;

public record ScorePair(double home, double away) {}

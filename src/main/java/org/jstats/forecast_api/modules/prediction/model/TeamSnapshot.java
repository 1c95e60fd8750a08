package org.jstats.forecast_api.modules.prediction.model;

import jakarta.validation.constraints.NotBlank;

import java.util.List;
import java.util.Objects;

/**
 * A team as seen at prediction time.
 *
 * @param id         stable team identifier
 * @param name       display name
 * @param record     won-lost record such as {@code "12-5"}; may be null
 * @param recentForm most recent result first, each one of {@code W}, {@code L} or {@code D};
 *                   null entries are dropped
 * @param logo       logo reference, passed through untouched
 */
public record TeamSnapshot(
        @NotBlank String id,
        @NotBlank String name,
        String record,
        List<String> recentForm,
        String logo
) {
    public TeamSnapshot {
        recentForm = recentForm == null ? List.of() : recentForm.stream().filter(Objects::nonNull).toList();
    }
}

package dev.regula.query;

import java.time.LocalDate;
import org.jspecify.annotations.Nullable;

/**
 * Structured filters derived from a question. Every field is optional; a {@code null} field means
 * "do not filter on this dimension".
 *
 * @param jurisdiction normalized jurisdiction key, e.g. {@code "federal"} or {@code "ontario"}
 * @param language question language, used to select the indexed language variant
 * @param effectiveFrom lower bound of the effective-date window
 * @param effectiveTo upper bound of the effective-date window
 * @param documentType {@code "act"} or {@code "regulation"}
 */
public record QueryFilters(
        @Nullable String jurisdiction,
        @Nullable QuestionLanguage language,
        @Nullable LocalDate effectiveFrom,
        @Nullable LocalDate effectiveTo,
        @Nullable String documentType) {

    public static QueryFilters none() {
        return new QueryFilters(null, null, null, null, null);
    }

    /** The relaxed filter set used when the narrow search comes back thin: language only. */
    public QueryFilters relaxed() {
        return new QueryFilters(null, language, null, null, null);
    }

    public boolean isEmpty() {
        return jurisdiction == null
                && language == null
                && effectiveFrom == null
                && effectiveTo == null
                && documentType == null;
    }
}

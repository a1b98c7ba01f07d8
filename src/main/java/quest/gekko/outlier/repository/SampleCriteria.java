package quest.gekko.outlier.repository;

import java.math.BigDecimal;

/**
 * Filters of one outlier sample request. Null filters are not applied; a category of
 * {@code "all"} is the same as no category.
 */
public record SampleCriteria(BigDecimal minScore, Long minViews, Integer maxAgeDays, String topicDomain,
                             String category, boolean excludeInstitutional, int size) {

    public static final String ALL_CATEGORIES = "all";

    public SampleCriteria {
        topicDomain = blankToNull(topicDomain);
        category = blankToNull(category);
        if (category != null && ALL_CATEGORIES.equalsIgnoreCase(category)) {
            category = null;
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}

package app.lingvo.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning of the study engine.
 *
 * @param maxIntervalDays    upper bound for the review interval in days
 * @param candidateBatchSize number of catalog words loaded per selector page
 * @param zone               time zone in which "today" is evaluated
 */
@ConfigurationProperties(prefix = "app.study")
public record StudyProps(
        Integer maxIntervalDays,
        Integer candidateBatchSize,
        String zone
) {
    public static final int DEFAULT_MAX_INTERVAL_DAYS = 90;
    public static final int DEFAULT_CANDIDATE_BATCH_SIZE = 50;

    public StudyProps {
        if (maxIntervalDays == null || maxIntervalDays < 1) {
            maxIntervalDays = DEFAULT_MAX_INTERVAL_DAYS;
        }
        if (candidateBatchSize == null || candidateBatchSize < 1) {
            candidateBatchSize = DEFAULT_CANDIDATE_BATCH_SIZE;
        }
        if (zone == null || zone.isBlank()) {
            zone = "UTC";
        }
    }

    public static StudyProps defaults() {
        return new StudyProps(null, null, null);
    }
}

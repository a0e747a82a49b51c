package app.lingvo.core.study.service;

import app.lingvo.core.study.algorithm.ReviewScheduler.ReviewComputation;
import app.lingvo.core.study.domain.HintType;
import app.lingvo.core.study.entity.ProgressRecordEntity;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

/**
 * Partial set of progress fields; {@code null} means "leave as stored".
 * Applying the same update twice leaves the record in the same state.
 */
public record ProgressUpdate(
        Integer score,
        Boolean skipped,
        Integer checkInterval,
        LocalDate nextCheckDate,
        Map<HintType, String> hints
) {
    public ProgressUpdate {
        hints = (hints == null || hints.isEmpty()) ? Map.of() : Map.copyOf(new EnumMap<>(hints));
    }

    public static ProgressUpdate scheduled(ReviewComputation computation) {
        return new ProgressUpdate(
                computation.score().code(),
                null,
                computation.checkInterval(),
                computation.nextCheckDate(),
                null
        );
    }

    public static ProgressUpdate skipped(boolean skipped) {
        return new ProgressUpdate(null, skipped, null, null, null);
    }

    public static ProgressUpdate hint(HintType type, String text) {
        return new ProgressUpdate(null, null, null, null, Map.of(type, text));
    }

    void applyTo(ProgressRecordEntity record) {
        if (score != null) {
            record.setScore(score);
        }
        if (skipped != null) {
            record.setSkipped(skipped);
        }
        if (checkInterval != null) {
            record.setCheckInterval(checkInterval);
        }
        if (nextCheckDate != null) {
            record.setNextCheckDate(nextCheckDate);
        }
        hints.forEach(record::setHint);
    }
}

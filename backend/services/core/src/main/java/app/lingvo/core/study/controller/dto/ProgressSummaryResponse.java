package app.lingvo.core.study.controller.dto;

import java.time.Instant;
import java.util.UUID;

public record ProgressSummaryResponse(
        UUID languageId,
        long total,
        long studied,
        long known,
        long skipped,
        long dueToday,
        double percentage,
        Instant lastStudiedAt
) {
}

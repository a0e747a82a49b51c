package app.lingvo.core.study.service;

import app.lingvo.core.study.api.WordCatalogPort;
import app.lingvo.core.study.controller.dto.ProgressSummaryResponse;
import app.lingvo.core.study.domain.Score;
import app.lingvo.core.study.entity.ProgressRecordEntity;
import app.lingvo.core.study.exception.StoreFailures;
import app.lingvo.core.study.repository.ProgressRecordRepository;
import app.lingvo.core.study.service.UserLanguageSettingsService.UserLanguageSettings;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Service
public class ProgressSummaryService {

    private final ProgressRecordRepository progressRepository;
    private final WordCatalogPort catalog;
    private final UserLanguageSettingsService settingsService;
    private final Clock clock;

    public ProgressSummaryService(ProgressRecordRepository progressRepository,
                                  WordCatalogPort catalog,
                                  UserLanguageSettingsService settingsService,
                                  Clock clock) {
        this.progressRepository = progressRepository;
        this.catalog = catalog;
        this.settingsService = settingsService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public ProgressSummaryResponse summary(UUID userId, UUID languageId) {
        UserLanguageSettings settings = settingsService.get(userId, languageId);
        LocalDate today = LocalDate.now(clock);

        long total = catalog.countWords(languageId);
        return StoreFailures.guard("progress summary", () -> {
            long studied = progressRepository.countByUserIdAndLanguageId(userId, languageId);
            long known = progressRepository.countByUserIdAndLanguageIdAndScore(userId, languageId, Score.KNOW.code());
            long skipped = progressRepository.countByUserIdAndLanguageIdAndSkippedTrue(userId, languageId);
            long dueToday = settings.skipMarked()
                    ? progressRepository.countByUserIdAndLanguageIdAndSkippedFalseAndNextCheckDateLessThanEqual(userId, languageId, today)
                    : progressRepository.countByUserIdAndLanguageIdAndNextCheckDateLessThanEqual(userId, languageId, today);
            Instant lastStudiedAt = progressRepository.findFirstByUserIdAndLanguageIdOrderByUpdatedAtDesc(userId, languageId)
                    .map(ProgressRecordEntity::getUpdatedAt)
                    .orElse(null);

            return new ProgressSummaryResponse(
                    languageId,
                    total,
                    studied,
                    known,
                    skipped,
                    dueToday,
                    percentage(known, total),
                    lastStudiedAt
            );
        });
    }

    static double percentage(long known, long total) {
        if (total <= 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(known)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}

package app.lingvo.core.study.service;

import app.lingvo.core.study.api.WordCatalogPort;
import app.lingvo.core.study.controller.dto.ProgressSummaryResponse;
import app.lingvo.core.study.entity.ProgressRecordEntity;
import app.lingvo.core.study.exception.NotFoundException;
import app.lingvo.core.study.repository.ProgressRecordRepository;
import app.lingvo.core.study.service.UserLanguageSettingsService.UserLanguageSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProgressSummaryServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2024, 3, 10);

    @Mock
    ProgressRecordRepository progressRepository;

    @Mock
    WordCatalogPort catalog;

    @Mock
    UserLanguageSettingsService settingsService;

    ProgressSummaryService service;

    final UUID userId = UUID.randomUUID();
    final UUID languageId = UUID.randomUUID();

    @BeforeEach
    void setup() {
        service = new ProgressSummaryService(progressRepository, catalog, settingsService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void summary_countsAndRoundsPercentage() {
        when(settingsService.get(userId, languageId)).thenReturn(UserLanguageSettings.DEFAULTS);
        when(catalog.countWords(languageId)).thenReturn(3L);
        when(progressRepository.countByUserIdAndLanguageId(userId, languageId)).thenReturn(2L);
        when(progressRepository.countByUserIdAndLanguageIdAndScore(userId, languageId, 1)).thenReturn(1L);
        when(progressRepository.countByUserIdAndLanguageIdAndSkippedTrue(userId, languageId)).thenReturn(1L);
        when(progressRepository.countByUserIdAndLanguageIdAndNextCheckDateLessThanEqual(userId, languageId, TODAY))
                .thenReturn(2L);
        ProgressRecordEntity latest = new ProgressRecordEntity();
        latest.setUpdatedAt(NOW.minusSeconds(60));
        when(progressRepository.findFirstByUserIdAndLanguageIdOrderByUpdatedAtDesc(userId, languageId))
                .thenReturn(Optional.of(latest));

        ProgressSummaryResponse summary = service.summary(userId, languageId);

        assertThat(summary.total()).isEqualTo(3);
        assertThat(summary.studied()).isEqualTo(2);
        assertThat(summary.known()).isEqualTo(1);
        assertThat(summary.skipped()).isEqualTo(1);
        assertThat(summary.dueToday()).isEqualTo(2);
        assertThat(summary.percentage()).isEqualTo(33.33);
        assertThat(summary.lastStudiedAt()).isEqualTo(NOW.minusSeconds(60));
    }

    @Test
    void summary_excludesSkippedFromDueWhenSkippingMarked() {
        when(settingsService.get(userId, languageId))
                .thenReturn(new UserLanguageSettings(1, true, true, true, true, true, true));
        when(catalog.countWords(languageId)).thenReturn(0L);
        when(progressRepository.countByUserIdAndLanguageIdAndSkippedFalseAndNextCheckDateLessThanEqual(
                userId, languageId, TODAY)).thenReturn(0L);
        when(progressRepository.findFirstByUserIdAndLanguageIdOrderByUpdatedAtDesc(userId, languageId))
                .thenReturn(Optional.empty());

        ProgressSummaryResponse summary = service.summary(userId, languageId);

        assertThat(summary.percentage()).isZero();
        assertThat(summary.lastStudiedAt()).isNull();
        verify(progressRepository, never())
                .countByUserIdAndLanguageIdAndNextCheckDateLessThanEqual(userId, languageId, TODAY);
    }

    @Test
    void summary_unknownLanguageIsNotFound() {
        when(settingsService.get(userId, languageId)).thenThrow(NotFoundException.language(languageId));

        assertThatThrownBy(() -> service.summary(userId, languageId)).isInstanceOf(NotFoundException.class);
        verifyNoInteractions(progressRepository);
    }

    @Test
    void percentage_roundsHalfUpToTwoDecimals() {
        assertThat(ProgressSummaryService.percentage(2, 3)).isEqualTo(66.67);
        assertThat(ProgressSummaryService.percentage(5, 5)).isEqualTo(100.0);
        assertThat(ProgressSummaryService.percentage(1, 0)).isZero();
    }
}

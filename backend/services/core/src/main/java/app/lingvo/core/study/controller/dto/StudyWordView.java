package app.lingvo.core.study.controller.dto;

import app.lingvo.core.study.domain.HintType;

import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/**
 * {@code wordForeign} and {@code transcription} stay {@code null} until the word is revealed.
 * {@code hints} holds texts of the hints used on this word so far.
 */
public record StudyWordView(
        UUID wordId,
        int wordNumber,
        String translation,
        String soundFilePath,
        String wordForeign,
        String transcription,
        Progress progress,
        Map<HintType, String> hints
) {
    public record Progress(
            int score,
            boolean skipped,
            int checkInterval,
            LocalDate nextCheckDate
    ) {
    }
}

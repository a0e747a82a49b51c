package app.lingvo.core.study.controller.dto;

import app.lingvo.core.study.domain.HintType;
import app.lingvo.core.study.domain.StudyPhase;

import java.util.Set;
import java.util.UUID;

public record SessionView(
        UUID sessionId,
        UUID languageId,
        StudyPhase phase,
        boolean completed,
        boolean wordShown,
        Set<HintType> usedHints,
        Set<HintType> visibleHintTypes,
        HintType pendingHintType,
        int wordsSeen,
        StudyWordView word
) {
}

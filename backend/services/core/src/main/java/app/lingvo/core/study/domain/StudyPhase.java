package app.lingvo.core.study.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a study session. Allowed transitions are declared here and
 * checked by the session state machine before any state change.
 */
public enum StudyPhase {
    STUDYING,
    VIEWING_WORD_DETAILS,
    CREATING_HINT,
    EDITING_HINT,
    COMPLETED;

    public Set<StudyPhase> allowedTargets() {
        return switch (this) {
            case STUDYING -> EnumSet.of(STUDYING, VIEWING_WORD_DETAILS, CREATING_HINT, EDITING_HINT, COMPLETED);
            case VIEWING_WORD_DETAILS -> EnumSet.of(VIEWING_WORD_DETAILS, STUDYING, CREATING_HINT, EDITING_HINT, COMPLETED);
            // hint entry returns to where it was entered from
            case CREATING_HINT, EDITING_HINT -> EnumSet.of(STUDYING, VIEWING_WORD_DETAILS);
            case COMPLETED -> EnumSet.noneOf(StudyPhase.class);
        };
    }

    public boolean canTransitionTo(StudyPhase target) {
        return allowedTargets().contains(target);
    }

    public boolean isHintEntry() {
        return this == CREATING_HINT || this == EDITING_HINT;
    }
}

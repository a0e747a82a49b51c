package app.lingvo.core.study.service;

import app.lingvo.core.study.api.WordCatalogPort;
import app.lingvo.core.study.api.WordCatalogPort.CatalogWord;
import app.lingvo.core.study.controller.dto.SessionView;
import app.lingvo.core.study.domain.HintType;
import app.lingvo.core.study.domain.Score;
import app.lingvo.core.study.domain.StudyPhase;
import app.lingvo.core.study.entity.ProgressRecordEntity;
import app.lingvo.core.study.entity.StudySessionEntity;
import app.lingvo.core.study.exception.NotFoundException;
import app.lingvo.core.study.repository.StudySessionRepository;
import app.lingvo.core.study.service.UserLanguageSettingsService.UserLanguageSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class StudySessionServiceTest {

    @Mock
    StudySessionRepository sessionRepository;

    @Mock
    SessionStateMachine stateMachine;

    @Mock
    ProgressStore progressStore;

    @Mock
    WordCatalogPort catalog;

    @Mock
    UserLanguageSettingsService settingsService;

    StudySessionService service;

    final UUID userId = UUID.randomUUID();
    final UUID languageId = UUID.randomUUID();
    final CatalogWord word = new CatalogWord(UUID.randomUUID(), languageId, "дом", "house", "[dom]", 5, "sound/5.mp3");

    @BeforeEach
    void setup() {
        service = new StudySessionService(sessionRepository, stateMachine, progressStore, catalog, settingsService);
        when(settingsService.get(userId, languageId)).thenReturn(UserLanguageSettings.DEFAULTS);
        when(catalog.findWord(word.id())).thenReturn(Optional.of(word));
        when(progressStore.get(any(), any())).thenReturn(Optional.empty());
        when(sessionRepository.save(any(StudySessionEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void begin_replacesPreviousSessionAndHidesForeignWord() {
        StudySessionEntity session = session(StudyPhase.STUDYING, false);
        when(stateMachine.start(userId, languageId)).thenReturn(session);

        SessionView view = service.begin(userId, languageId);

        verify(sessionRepository).deleteByUserId(userId);
        verify(sessionRepository).save(session);
        assertThat(view.phase()).isEqualTo(StudyPhase.STUDYING);
        assertThat(view.completed()).isFalse();
        assertThat(view.word().translation()).isEqualTo("house");
        assertThat(view.word().wordForeign()).isNull();
        assertThat(view.word().transcription()).isNull();
        assertThat(view.visibleHintTypes()).containsExactlyInAnyOrder(HintType.values());
    }

    @Test
    void reveal_locksSessionAndShowsWord() {
        StudySessionEntity session = session(StudyPhase.STUDYING, false);
        when(sessionRepository.findByIdForUpdate(session.getSessionId())).thenReturn(Optional.of(session));
        doAnswer(inv -> {
            StudySessionEntity s = inv.getArgument(0);
            s.setPhase(StudyPhase.VIEWING_WORD_DETAILS);
            s.setWordShown(true);
            return null;
        }).when(stateMachine).reveal(session);

        SessionView view = service.reveal(userId, session.getSessionId());

        assertThat(view.wordShown()).isTrue();
        assertThat(view.word().wordForeign()).isEqualTo("дом");
        assertThat(view.word().transcription()).isEqualTo("[dom]");
    }

    @Test
    void anyStep_onForeignSessionIsNotFound() {
        StudySessionEntity session = session(StudyPhase.STUDYING, false);
        when(sessionRepository.findByIdForUpdate(session.getSessionId())).thenReturn(Optional.of(session));

        assertThatThrownBy(() -> service.reveal(UUID.randomUUID(), session.getSessionId()))
                .isInstanceOf(NotFoundException.class);
        verifyNoInteractions(stateMachine);
    }

    @Test
    void answer_parsesScoreCode() {
        StudySessionEntity session = session(StudyPhase.VIEWING_WORD_DETAILS, true);
        when(sessionRepository.findByIdForUpdate(session.getSessionId())).thenReturn(Optional.of(session));

        service.answer(userId, session.getSessionId(), 1);

        verify(stateMachine).answer(session, Score.KNOW);
    }

    @Test
    void answer_unknownScoreCodeIsRejectedBeforeLoading() {
        assertThatThrownBy(() -> service.answer(userId, UUID.randomUUID(), 3))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(sessionRepository, stateMachine);
    }

    @Test
    void current_listsTextsOfUsedHintsOnly() {
        StudySessionEntity session = session(StudyPhase.STUDYING, false);
        session.setUsedHints(EnumSet.of(HintType.MEANING));
        ProgressRecordEntity record = new ProgressRecordEntity();
        record.setHintMeaning("a building to live in");
        record.setHintWriting("not used yet");
        record.setCheckInterval(2);
        record.setNextCheckDate(LocalDate.of(2024, 3, 12));
        when(progressStore.get(userId, word.id())).thenReturn(Optional.of(record));
        when(sessionRepository.findById(session.getSessionId())).thenReturn(Optional.of(session));

        SessionView view = service.current(userId, session.getSessionId());

        assertThat(view.word().hints()).containsOnlyKeys(HintType.MEANING);
        assertThat(view.word().progress().checkInterval()).isEqualTo(2);
        assertThat(view.usedHints()).containsExactly(HintType.MEANING);
    }

    @Test
    void current_completedSessionHasNoWord() {
        StudySessionEntity session = session(StudyPhase.COMPLETED, false);
        session.setCurrentWordId(null);
        when(sessionRepository.findById(session.getSessionId())).thenReturn(Optional.of(session));

        SessionView view = service.current(userId, session.getSessionId());

        assertThat(view.completed()).isTrue();
        assertThat(view.word()).isNull();
    }

    @Test
    void end_deletesOwnedSession() {
        StudySessionEntity session = session(StudyPhase.STUDYING, false);
        when(sessionRepository.findByIdForUpdate(session.getSessionId())).thenReturn(Optional.of(session));

        service.end(userId, session.getSessionId());

        verify(sessionRepository).delete(session);
    }

    private StudySessionEntity session(StudyPhase phase, boolean shown) {
        StudySessionEntity s = new StudySessionEntity();
        s.setSessionId(UUID.randomUUID());
        s.setUserId(userId);
        s.setLanguageId(languageId);
        s.setPhase(phase);
        s.setCurrentWordId(word.id());
        s.setCurrentWordNumber(word.wordNumber());
        s.setWordShown(shown);
        s.setWordsSeen(1);
        return s;
    }
}

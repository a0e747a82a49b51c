package app.lingvo.core.study.entity;

import app.lingvo.core.study.domain.HintType;
import app.lingvo.core.study.domain.StudyPhase;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Conversation state of one study session. A user has at most one session;
 * starting another one replaces it.
 */
@Entity
@Table(name = "study_sessions", schema = "app_core")
public class StudySessionEntity {

    @Id
    @Column(name = "session_id", nullable = false)
    private UUID sessionId;

    @Column(name = "user_id", nullable = false, unique = true)
    private UUID userId;

    @Column(name = "language_id", nullable = false)
    private UUID languageId;

    @Enumerated(EnumType.STRING)
    @Column(name = "phase", nullable = false)
    private StudyPhase phase;

    @Enumerated(EnumType.STRING)
    @Column(name = "return_phase")
    private StudyPhase returnPhase;

    @Enumerated(EnumType.STRING)
    @Column(name = "pending_hint_type")
    private HintType pendingHintType;

    @Column(name = "current_word_id")
    private UUID currentWordId;

    @Column(name = "current_word_number")
    private Integer currentWordNumber;

    @Column(name = "word_shown", nullable = false)
    private boolean wordShown;

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(name = "used_hints", columnDefinition = "text[]", nullable = false)
    private String[] usedHints = new String[0];

    @Column(name = "words_seen", nullable = false)
    private int wordsSeen;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "row_version", nullable = false)
    private long rowVersion;

    public UUID getSessionId() {
        return sessionId;
    }

    public void setSessionId(UUID sessionId) {
        this.sessionId = sessionId;
    }

    public UUID getUserId() {
        return userId;
    }

    public void setUserId(UUID userId) {
        this.userId = userId;
    }

    public UUID getLanguageId() {
        return languageId;
    }

    public void setLanguageId(UUID languageId) {
        this.languageId = languageId;
    }

    public StudyPhase getPhase() {
        return phase;
    }

    public void setPhase(StudyPhase phase) {
        this.phase = phase;
    }

    public StudyPhase getReturnPhase() {
        return returnPhase;
    }

    public void setReturnPhase(StudyPhase returnPhase) {
        this.returnPhase = returnPhase;
    }

    public HintType getPendingHintType() {
        return pendingHintType;
    }

    public void setPendingHintType(HintType pendingHintType) {
        this.pendingHintType = pendingHintType;
    }

    public UUID getCurrentWordId() {
        return currentWordId;
    }

    public void setCurrentWordId(UUID currentWordId) {
        this.currentWordId = currentWordId;
    }

    public Integer getCurrentWordNumber() {
        return currentWordNumber;
    }

    public void setCurrentWordNumber(Integer currentWordNumber) {
        this.currentWordNumber = currentWordNumber;
    }

    public boolean isWordShown() {
        return wordShown;
    }

    public void setWordShown(boolean wordShown) {
        this.wordShown = wordShown;
    }

    public Set<HintType> getUsedHints() {
        Set<HintType> out = EnumSet.noneOf(HintType.class);
        if (usedHints != null) {
            Arrays.stream(usedHints).map(HintType::valueOf).forEach(out::add);
        }
        return out;
    }

    public void setUsedHints(Set<HintType> hints) {
        this.usedHints = hints == null
                ? new String[0]
                : hints.stream().sorted().map(HintType::name).toArray(String[]::new);
    }

    public int getWordsSeen() {
        return wordsSeen;
    }

    public void setWordsSeen(int wordsSeen) {
        this.wordsSeen = wordsSeen;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public long getRowVersion() {
        return rowVersion;
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}

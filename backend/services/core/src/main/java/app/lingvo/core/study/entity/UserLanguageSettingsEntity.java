package app.lingvo.core.study.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "user_language_settings", schema = "app_core")
@IdClass(UserLanguageSettingsId.class)
public class UserLanguageSettingsEntity {

    @Id
    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Id
    @Column(name = "language_id", nullable = false)
    private UUID languageId;

    @Column(name = "start_word", nullable = false)
    private int startWord;

    @Column(name = "skip_marked", nullable = false)
    private boolean skipMarked;

    @Column(name = "use_check_date", nullable = false)
    private boolean useCheckDate;

    @Column(name = "show_hint_meaning", nullable = false)
    private boolean showHintMeaning;

    @Column(name = "show_hint_phoneticsound", nullable = false)
    private boolean showHintPhoneticSound;

    @Column(name = "show_hint_phoneticassociation", nullable = false)
    private boolean showHintPhoneticAssociation;

    @Column(name = "show_hint_writing", nullable = false)
    private boolean showHintWriting;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "row_version", nullable = false)
    private long rowVersion;

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

    public int getStartWord() {
        return startWord;
    }

    public void setStartWord(int startWord) {
        this.startWord = startWord;
    }

    public boolean isSkipMarked() {
        return skipMarked;
    }

    public void setSkipMarked(boolean skipMarked) {
        this.skipMarked = skipMarked;
    }

    public boolean isUseCheckDate() {
        return useCheckDate;
    }

    public void setUseCheckDate(boolean useCheckDate) {
        this.useCheckDate = useCheckDate;
    }

    public boolean isShowHintMeaning() {
        return showHintMeaning;
    }

    public void setShowHintMeaning(boolean showHintMeaning) {
        this.showHintMeaning = showHintMeaning;
    }

    public boolean isShowHintPhoneticSound() {
        return showHintPhoneticSound;
    }

    public void setShowHintPhoneticSound(boolean showHintPhoneticSound) {
        this.showHintPhoneticSound = showHintPhoneticSound;
    }

    public boolean isShowHintPhoneticAssociation() {
        return showHintPhoneticAssociation;
    }

    public void setShowHintPhoneticAssociation(boolean showHintPhoneticAssociation) {
        this.showHintPhoneticAssociation = showHintPhoneticAssociation;
    }

    public boolean isShowHintWriting() {
        return showHintWriting;
    }

    public void setShowHintWriting(boolean showHintWriting) {
        this.showHintWriting = showHintWriting;
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

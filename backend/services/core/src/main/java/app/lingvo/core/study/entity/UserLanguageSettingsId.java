package app.lingvo.core.study.entity;

import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

public class UserLanguageSettingsId implements Serializable {
    private UUID userId;
    private UUID languageId;

    public UserLanguageSettingsId() {}

    public UserLanguageSettingsId(UUID userId, UUID languageId) {
        this.userId = userId;
        this.languageId = languageId;
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

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        UserLanguageSettingsId that = (UserLanguageSettingsId) o;
        return Objects.equals(userId, that.userId) && Objects.equals(languageId, that.languageId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, languageId);
    }
}

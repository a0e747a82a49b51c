package app.lingvo.core.study.domain;

import java.util.Locale;

public enum HintType {
    MEANING("meaning"),
    PHONETIC_SOUND("phoneticsound"),
    PHONETIC_ASSOCIATION("phoneticassociation"),
    WRITING("writing");

    private final String code;

    HintType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static HintType fromString(String v) {
        if (v == null || v.isBlank()) {
            throw new IllegalArgumentException("Hint type is required");
        }
        String normalized = v.trim().toLowerCase(Locale.ROOT).replace("_", "");
        for (HintType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported hint type: " + v);
    }
}

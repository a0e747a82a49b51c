package app.lingvo.core.study.domain;

/**
 * Binary recall judgment. A hint-assisted recall counts as {@link #DONT_KNOW}.
 */
public enum Score {
    DONT_KNOW(0), KNOW(1);

    private final int code;
    Score(int code) { this.code = code; }
    public int code() { return code; }

    public static Score fromCode(int code) {
        for (Score s : values()) {
            if (s.code == code) return s;
        }
        throw new IllegalArgumentException("Score must be 0 or 1, got " + code);
    }
}

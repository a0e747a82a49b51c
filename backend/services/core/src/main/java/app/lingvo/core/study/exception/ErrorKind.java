package app.lingvo.core.study.exception;

public enum ErrorKind {
    NOT_FOUND,
    INVALID_SESSION_STATE,
    STORE_UNAVAILABLE,
    SETTINGS_INVALID
}

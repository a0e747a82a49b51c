package app.lingvo.core.study.exception;

/**
 * Base type for failures the study engine reports to its callers.
 * The transport layer decides how each {@link ErrorKind} is shown to the user.
 */
public abstract class StudyException extends RuntimeException {

    private final ErrorKind kind;

    protected StudyException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected StudyException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}

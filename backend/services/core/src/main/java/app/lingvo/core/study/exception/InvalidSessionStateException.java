package app.lingvo.core.study.exception;

/**
 * The session cannot perform the requested action in its current state.
 * Not recoverable in place: the caller restarts the session.
 */
public class InvalidSessionStateException extends StudyException {

    public InvalidSessionStateException(String message) {
        super(ErrorKind.INVALID_SESSION_STATE, message);
    }
}

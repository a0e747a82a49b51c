package app.lingvo.core.study.exception;

public class StoreUnavailableException extends StudyException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorKind.STORE_UNAVAILABLE, message, cause);
    }
}

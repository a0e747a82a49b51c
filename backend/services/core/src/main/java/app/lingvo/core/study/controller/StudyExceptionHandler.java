package app.lingvo.core.study.controller;

import app.lingvo.core.study.exception.ErrorKind;
import app.lingvo.core.study.exception.StoreFailures;
import app.lingvo.core.study.exception.StudyException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class StudyExceptionHandler {

    @ExceptionHandler(StudyException.class)
    public ResponseEntity<ProblemDetail> handleStudy(StudyException ex) {
        return problem(statusOf(ex.kind()), ex.kind().name(), ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex) {
        return problem(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage());
    }

    @ExceptionHandler({
            DataAccessResourceFailureException.class,
            TransientDataAccessException.class,
            RecoverableDataAccessException.class,
            CannotCreateTransactionException.class
    })
    public ResponseEntity<ProblemDetail> handleStoreUnavailable(RuntimeException ex) {
        StudyException unavailable = StoreFailures.unavailable("request", ex);
        return problem(HttpStatus.SERVICE_UNAVAILABLE, unavailable.kind().name(), unavailable.getMessage());
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_SESSION_STATE -> HttpStatus.CONFLICT;
            case SETTINGS_INVALID -> HttpStatus.BAD_REQUEST;
            case STORE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private static ResponseEntity<ProblemDetail> problem(HttpStatus status, String kind, String message) {
        ProblemDetail body = ProblemDetail.forStatusAndDetail(status, message);
        body.setProperty("kind", kind);
        return ResponseEntity.status(status).body(body);
    }
}

package app.lingvo.core.study.exception;

import java.util.UUID;

public class NotFoundException extends StudyException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static NotFoundException language(UUID languageId) {
        return new NotFoundException("Language not found: " + languageId);
    }

    public static NotFoundException word(UUID wordId) {
        return new NotFoundException("Word not found: " + wordId);
    }

    public static NotFoundException session(UUID sessionId) {
        return new NotFoundException("Study session not found: " + sessionId);
    }
}

package app.lingvo.core.study.exception;

public class SettingsInvalidException extends StudyException {

    public SettingsInvalidException(String message) {
        super(ErrorKind.SETTINGS_INVALID, message);
    }
}

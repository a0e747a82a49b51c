package app.lingvo.core.study.controller.dto;

/**
 * Used both as response and as partial update body; absent fields in a PATCH are left unchanged.
 */
public record LanguageSettingsDto(
        Integer startWord,
        Boolean skipMarked,
        Boolean useCheckDate,
        Boolean showHintMeaning,
        Boolean showHintPhoneticSound,
        Boolean showHintPhoneticAssociation,
        Boolean showHintWriting
) {
}

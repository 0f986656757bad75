package com.climbassessment.common.template;

/**
 * Texts of one metric level. Either field may be {@code null}; at least one
 * is non-blank in a valid entry.
 */
public record LevelTexts(String strength, String weakness) {

    public static LevelTexts strength(String text) {
        return new LevelTexts(text, null);
    }

    public static LevelTexts weakness(String text) {
        return new LevelTexts(null, text);
    }

    public String get(TextField field) {
        return field == TextField.STRENGTH ? strength : weakness;
    }

    boolean hasAnyText() {
        return !isBlank(strength) || !isBlank(weakness);
    }

    static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}

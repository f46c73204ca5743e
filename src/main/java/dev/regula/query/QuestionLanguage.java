package dev.regula.query;

import java.util.List;
import java.util.Locale;

/**
 * Language of a question. Canadian federal legislation is published in English and French, so
 * these are the only two languages the retrieval backends index.
 *
 * <p>Detection is a marker-counting heuristic: each language has a list of characteristic
 * function words and diacritics, and French wins only when it scores at least 2 and strictly
 * more than English.
 */
public enum QuestionLanguage {

    EN("en", "english"),
    FR("fr", "french");

    private static final List<String> FRENCH_MARKERS = List.of(
            " le ", " la ", " les ", " des ", " du ", " est ", " sont ", " pour ", " une ",
            " qui ", " que ", "qu'", " avec ", " dans ", "quel", "est-ce", "puis-je",
            "é", "è", "ê", "à", "ç");

    private static final List<String> ENGLISH_MARKERS = List.of(
            " the ", " is ", " are ", " can ", " for ", " what ", " how ", " of ", " who ",
            " does ", " do ", " with ", " under ", " and ");

    private final String code;
    private final String textSearchConfig;

    QuestionLanguage(String code, String textSearchConfig) {
        this.code = code;
        this.textSearchConfig = textSearchConfig;
    }

    /** ISO 639-1 code stored in passage metadata. */
    public String code() {
        return code;
    }

    /** PostgreSQL text search configuration name. */
    public String textSearchConfig() {
        return textSearchConfig;
    }

    public static QuestionLanguage detect(String text) {
        if (text == null || text.isBlank()) {
            return EN;
        }
        String padded = " " + text.toLowerCase(Locale.ROOT) + " ";
        int french = count(padded, FRENCH_MARKERS);
        int english = count(padded, ENGLISH_MARKERS);
        return french >= 2 && french > english ? FR : EN;
    }

    private static int count(String text, List<String> markers) {
        int score = 0;
        for (String marker : markers) {
            if (text.contains(marker)) {
                score++;
            }
        }
        return score;
    }
}

package dev.regula.retrieval.graph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns free-form seed terms into a safe Lucene query for Neo4j full-text indexes.
 *
 * <p>Lucene syntax characters are removed rather than escaped, stop words are dropped, slash
 * alternatives are split ({@code GST/HST} becomes two terms) and multi-word terms become quoted
 * phrases. Terms are joined with {@code OR}.
 */
public final class LuceneQuerySanitizer {

    private static final Pattern LUCENE_SPECIAL =
            Pattern.compile("[+\\-!(){}\\[\\]^\"~*?:\\\\&|/]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "by", "can", "for", "from", "how", "i",
            "in", "is", "it", "of", "on", "or", "not", "the", "to", "what", "who", "with",
            "le", "la", "les", "de", "des", "du", "et", "ou", "un", "une");

    private LuceneQuerySanitizer() {
        // static utility
    }

    /**
     * Builds an OR query from the given terms.
     *
     * @param terms seed terms, keywords or phrases
     * @param maxTerms cap on the number of clauses
     * @return the Lucene query, or an empty string if nothing searchable remains
     */
    public static String toQuery(List<String> terms, int maxTerms) {
        Set<String> clauses = new LinkedHashSet<>();
        for (String term : terms) {
            for (String alternative : term.split("/")) {
                String clause = toClause(alternative);
                if (!clause.isEmpty()) {
                    clauses.add(clause);
                }
            }
        }
        List<String> ordered = new ArrayList<>(clauses);
        return String.join(" OR ", ordered.subList(0, Math.min(maxTerms, ordered.size())));
    }

    static String toClause(String term) {
        String cleaned = LUCENE_SPECIAL.matcher(term.toLowerCase(Locale.ROOT)).replaceAll(" ");
        List<String> words = new ArrayList<>();
        for (String word : WHITESPACE.split(cleaned.strip())) {
            if (!word.isEmpty() && !STOP_WORDS.contains(word)) {
                words.add(word);
            }
        }
        if (words.isEmpty()) {
            return "";
        }
        if (words.size() == 1) {
            return words.get(0);
        }
        return "\"" + String.join(" ", words) + "\"";
    }
}

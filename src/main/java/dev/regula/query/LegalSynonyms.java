package dev.regula.query;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Bilingual synonym table for broadening keyword searches. Covers the federal benefit programs
 * (EI, CPP, OAS, GIS), common identifiers and generic legal vocabulary.
 */
public final class LegalSynonyms {

    private static final Map<String, List<String>> SYNONYMS = Map.ofEntries(
            Map.entry("employment insurance", List.of("ei", "unemployment insurance",
                    "assurance-emploi")),
            Map.entry("ei", List.of("employment insurance", "unemployment insurance")),
            Map.entry("canada pension plan", List.of("cpp", "régime de pensions du canada")),
            Map.entry("cpp", List.of("canada pension plan")),
            Map.entry("old age security", List.of("oas", "sécurité de la vieillesse")),
            Map.entry("oas", List.of("old age security")),
            Map.entry("guaranteed income supplement", List.of("gis", "income supplement")),
            Map.entry("gis", List.of("guaranteed income supplement")),
            Map.entry("social insurance number", List.of("sin", "numéro d'assurance sociale")),
            Map.entry("sin", List.of("social insurance number")),
            Map.entry("benefit", List.of("payment", "assistance", "entitlement", "allowance")),
            Map.entry("benefits", List.of("payments", "assistance", "entitlements")),
            Map.entry("eligible", List.of("qualify", "entitled", "admissible")),
            Map.entry("eligibility", List.of("qualification", "entitlement", "admissibility")),
            Map.entry("qualify", List.of("eligible", "entitled")),
            Map.entry("apply", List.of("application", "claim", "submit")),
            Map.entry("regulation", List.of("act", "statute", "legislation", "règlement")),
            Map.entry("act", List.of("statute", "legislation", "loi")),
            Map.entry("law", List.of("statute", "legislation", "loi")),
            Map.entry("requirement", List.of("condition", "criterion", "exigence")),
            Map.entry("requirements", List.of("conditions", "criteria", "exigences")),
            Map.entry("temporary", List.of("temporary resident", "visitor")),
            Map.entry("residents", List.of("resident", "residence")),
            Map.entry("resident", List.of("residence", "residency")),
            Map.entry("worker", List.of("employee", "insured person")),
            Map.entry("employee", List.of("worker", "insured person")),
            Map.entry("permit", List.of("authorization", "licence", "permis")));

    private LegalSynonyms() {
        // static utility
    }

    /**
     * Expands the given terms with their synonyms. The original terms come first, in order,
     * followed by synonyms in discovery order; no term appears twice.
     *
     * @param terms keywords and entity phrases
     * @param maxTerms upper bound on the size of the result
     * @return the expanded, de-duplicated term list
     */
    public static List<String> expand(List<String> terms, int maxTerms) {
        Set<String> expanded = new LinkedHashSet<>();
        for (String term : terms) {
            expanded.add(term.toLowerCase(Locale.ROOT));
        }
        for (String term : new ArrayList<>(expanded)) {
            for (String synonym : SYNONYMS.getOrDefault(term, List.of())) {
                expanded.add(synonym);
            }
        }
        return expanded.stream().limit(maxTerms).toList();
    }

    public static List<String> synonymsOf(String term) {
        return SYNONYMS.getOrDefault(term.toLowerCase(Locale.ROOT), List.of());
    }
}

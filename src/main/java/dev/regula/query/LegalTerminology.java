package dev.regula.query;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical legal vocabulary used for dictionary entity extraction. Each entry maps a normalized
 * key to the surface forms that denote it.
 *
 * <p>Two-letter province abbreviations that collide with ordinary English words ("on", "ns") are
 * left out on purpose: they would match almost every question.
 */
final class LegalTerminology {

    private static final Map<EntityType, Map<String, List<String>>> DICTIONARIES = Map.of(
            EntityType.PERSON_TYPE, orderedOf(
                    "citizen", List.of("canadian citizen", "citizen of canada", "citizen"),
                    "permanent_resident", List.of("permanent resident", "permanent residents",
                            "landed immigrant"),
                    "temporary_resident", List.of("temporary resident", "temporary residents",
                            "temporary foreign worker", "visitor"),
                    "foreign_national", List.of("foreign national", "foreign nationals",
                            "non-resident"),
                    "refugee", List.of("refugee", "refugees", "protected person", "asylum seeker"),
                    "indigenous_person", List.of("indigenous person", "first nations", "métis",
                            "inuit"),
                    "veteran", List.of("veteran", "veterans"),
                    "senior", List.of("senior", "seniors", "pensioner"),
                    "student", List.of("full-time student", "part-time student", "student",
                            "students"),
                    "worker", List.of("worker", "workers", "employee", "employees"),
                    "employer", List.of("employer", "employers"),
                    "self_employed", List.of("self-employed", "independent contractor")),
            EntityType.PROGRAM, orderedOf(
                    "employment_insurance", List.of("employment insurance", "ei benefits", "ei",
                            "unemployment insurance", "assurance-emploi"),
                    "canada_pension_plan", List.of("canada pension plan", "cpp"),
                    "old_age_security", List.of("old age security", "oas"),
                    "guaranteed_income_supplement", List.of("guaranteed income supplement", "gis"),
                    "canada_child_benefit", List.of("canada child benefit", "ccb"),
                    "disability_tax_credit", List.of("disability tax credit"),
                    "workers_compensation", List.of("workers compensation", "wsib"),
                    "social_assistance", List.of("social assistance", "income assistance"),
                    "express_entry", List.of("express entry"),
                    "family_sponsorship", List.of("family sponsorship", "spouse sponsorship"),
                    "provincial_nominee", List.of("provincial nominee program")),
            EntityType.JURISDICTION, orderedOf(
                    "federal", List.of("federal", "government of canada"),
                    "alberta", List.of("alberta"),
                    "british_columbia", List.of("british columbia", "b.c."),
                    "manitoba", List.of("manitoba"),
                    "new_brunswick", List.of("new brunswick"),
                    "newfoundland_and_labrador",
                    List.of("newfoundland and labrador", "newfoundland"),
                    "northwest_territories", List.of("northwest territories"),
                    "nova_scotia", List.of("nova scotia"),
                    "nunavut", List.of("nunavut"),
                    "ontario", List.of("ontario"),
                    "prince_edward_island", List.of("prince edward island"),
                    "quebec", List.of("quebec", "québec"),
                    "saskatchewan", List.of("saskatchewan"),
                    "yukon", List.of("yukon")),
            EntityType.REQUIREMENT, orderedOf(
                    "social_insurance_number", List.of("social insurance number", "sin"),
                    "work_permit", List.of("work permit", "employment authorization"),
                    "study_permit", List.of("study permit", "student visa"),
                    "proof_of_residency", List.of("proof of residency", "proof of address"),
                    "birth_certificate", List.of("birth certificate"),
                    "passport", List.of("passport"),
                    "tax_return", List.of("income tax return", "tax return"),
                    "notice_of_assessment", List.of("notice of assessment"),
                    "record_of_employment", List.of("record of employment"),
                    "insurable_hours",
                    List.of("insurable hours", "hours of insurable employment")));

    private LegalTerminology() {
        // static utility
    }

    static Map<String, List<String>> dictionary(EntityType type) {
        return DICTIONARIES.getOrDefault(type, Map.of());
    }

    private static Map<String, List<String>> orderedOf(Object... keyValues) {
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            @SuppressWarnings("unchecked")
            List<String> values = (List<String>) keyValues[i + 1];
            map.put((String) keyValues[i], values);
        }
        return map;
    }
}

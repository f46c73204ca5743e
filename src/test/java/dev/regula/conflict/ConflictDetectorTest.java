package dev.regula.conflict;

import static org.assertj.core.api.Assertions.assertThat;

import dev.regula.fixture.Contexts;
import dev.regula.fixture.RetrievalHitBuilder;
import dev.regula.fusion.FusedContext;
import dev.regula.retrieval.RelationKind;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConflictDetectorTest {

  private final ConflictDetector detector = new ConflictDetector();

  private static RetrievalHitBuilder doc(String documentId, String title) {
    return new RetrievalHitBuilder().id(documentId + "-hit").document(documentId).title(title);
  }

  @Test
  void supersedes_edge_yields_a_supersession_finding() {
    FusedContext context =
        Contexts.of(
            doc("uia", "Unemployment Insurance Act").section("17").build(),
            doc("ei-act", "Employment Insurance Act")
                .relatesTo(RelationKind.SUPERSEDES, "uia")
                .build());

    List<ConflictFinding> findings = detector.detect(context);

    assertThat(findings).hasSize(1);
    ConflictFinding finding = findings.get(0);
    assertThat(finding.kind()).isEqualTo(ConflictKind.SUPERSESSION);
    assertThat(finding.referenceA()).isEqualTo("R2");
    assertThat(finding.referenceB()).isEqualTo("R1");
    assertThat(finding.description())
        .isEqualTo(
            "[R2] Employment Insurance Act, Section 7 supersedes "
                + "[R1] Unemployment Insurance Act, Section 17");
  }

  @Test
  void mutual_supersedes_edges_yield_exactly_one_finding() {
    FusedContext context =
        Contexts.of(
            doc("a", "Act A").relatesTo(RelationKind.SUPERSEDES, "b").build(),
            doc("b", "Act B").relatesTo(RelationKind.SUPERSEDES, "a").build());

    List<ConflictFinding> findings = detector.detect(context);

    assertThat(findings)
        .extracting(ConflictFinding::kind)
        .containsExactly(ConflictKind.SUPERSESSION);
  }

  @Test
  void amends_edge_yields_a_contradiction_candidate() {
    FusedContext context =
        Contexts.of(
            doc("ei-regs", "Employment Insurance Regulations").build(),
            doc("c-30", "Budget Implementation Act")
                .relatesTo(RelationKind.AMENDS, "ei-regs")
                .build());

    List<ConflictFinding> findings = detector.detect(context);

    assertThat(findings).hasSize(1);
    assertThat(findings.get(0).kind()).isEqualTo(ConflictKind.DIRECT_CONTRADICTION_CANDIDATE);
    assertThat(findings.get(0).referenceA()).isEqualTo("R2");
    assertThat(findings.get(0).involves("R1")).isTrue();
  }

  @Test
  void edge_may_target_the_other_hit_id() {
    FusedContext context =
        Contexts.of(
            doc("new", "New Act").relatesTo(RelationKind.SUPERSEDES, "old-hit").build(),
            doc("old", "Old Act").build());

    assertThat(detector.detect(context)).hasSize(1);
  }

  @Test
  void supersession_outranks_amendment_for_the_same_pair() {
    FusedContext context =
        Contexts.of(
            doc("a", "Act A")
                .relatesTo(RelationKind.AMENDS, "b")
                .relatesTo(RelationKind.SUPERSEDES, "b")
                .build(),
            doc("b", "Act B").build());

    assertThat(detector.detect(context))
        .extracting(ConflictFinding::kind)
        .containsExactly(ConflictKind.SUPERSESSION);
  }

  @Test
  void several_passages_of_the_same_document_pair_yield_one_finding() {
    FusedContext context =
        Contexts.of(
            doc("ei-act", "Employment Insurance Act")
                .id("s7")
                .section("7")
                .relatesTo(RelationKind.AMENDS, "uia")
                .build(),
            doc("uia", "Unemployment Insurance Act").id("u1").section("1").build(),
            doc("ei-act", "Employment Insurance Act")
                .id("s8")
                .section("8")
                .relatesTo(RelationKind.SUPERSEDES, "uia")
                .build());

    List<ConflictFinding> findings = detector.detect(context);

    assertThat(findings).hasSize(1);
    assertThat(findings.get(0).kind()).isEqualTo(ConflictKind.SUPERSESSION);
  }

  @Test
  void same_citation_with_different_in_force_periods_is_an_ambiguous_overlap() {
    FusedContext context =
        Contexts.of(
            doc("ei-regs-2010", "Employment Insurance Regulations")
                .section("14")
                .inForce(LocalDate.of(2010, 1, 1), LocalDate.of(2018, 12, 31))
                .build(),
            doc("ei-regs-2019", "Employment Insurance Regulations")
                .section("14")
                .inForce(LocalDate.of(2019, 1, 1), null)
                .build());

    List<ConflictFinding> findings = detector.detect(context);

    assertThat(findings)
        .extracting(ConflictFinding::kind)
        .containsExactly(ConflictKind.AMBIGUOUS_OVERLAP);
    assertThat(findings.get(0).description())
        .contains("2010-01-01 to 2018-12-31 vs 2019-01-01 to open");
  }

  @Test
  void same_citation_without_explicit_dates_is_not_a_conflict() {
    FusedContext context =
        Contexts.of(
            doc("copy-1", "Employment Insurance Regulations").section("14").build(),
            doc("copy-2", "Employment Insurance Regulations")
                .section("14")
                .inForce(LocalDate.of(2019, 1, 1), null)
                .build());

    assertThat(detector.detect(context)).isEmpty();
  }

  @Test
  void references_and_has_section_edges_are_not_conflicts() {
    FusedContext context =
        Contexts.of(
            doc("a", "Act A")
                .relatesTo(RelationKind.REFERENCES, "b")
                .relatesTo(RelationKind.HAS_SECTION, "b")
                .build(),
            doc("b", "Act B").build());

    assertThat(detector.detect(context)).isEmpty();
  }

  @Test
  void passages_of_one_document_never_conflict_with_each_other() {
    FusedContext context =
        Contexts.of(
            doc("a", "Act A").id("a1").inForce(LocalDate.of(2000, 1, 1), null).build(),
            doc("a", "Act A").id("a2").inForce(LocalDate.of(2010, 1, 1), null).build());

    assertThat(detector.detect(context)).isEmpty();
  }
}

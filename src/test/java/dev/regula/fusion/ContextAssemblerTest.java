package dev.regula.fusion;

import static org.assertj.core.api.Assertions.assertThat;

import dev.regula.fixture.RetrievalHitBuilder;
import dev.regula.retrieval.CalibrationProperties;
import dev.regula.retrieval.RetrievalHit;
import dev.regula.retrieval.ScoreCalibrator;
import dev.regula.retrieval.Tier;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContextAssemblerTest {

  FusionProperties props;

  ContextAssembler assembler;

  @BeforeEach
  void setUp() {
    props = new FusionProperties();
    props.setMaxContextChars(1_000);
    props.setMaxEntries(5);
    assembler = new ContextAssembler(new ScoreCalibrator(new CalibrationProperties()), props);
  }

  private static RetrievalHitBuilder hit(String id, Tier tier, double rawScore) {
    return new RetrievalHitBuilder().id(id).section(id).tier(tier).score(rawScore);
  }

  @Test
  void empty_input_gives_empty_context() {
    FusedContext context = assembler.assemble(List.of());

    assertThat(context.isEmpty()).isTrue();
    assertThat(context.droppedForBudget()).isZero();
  }

  @Test
  void entries_are_ordered_by_calibrated_score_and_numbered() {
    FusedContext context =
        assembler.assemble(
            List.of(
                hit("a", Tier.HYBRID_NARROW, 0.5).build(),
                hit("b", Tier.FULL_TEXT, 0.3).build(),
                hit("c", Tier.GRAPH, 1.0).build()));

    // full-text 0.3 calibrates to 0.75, graph 1.0 to 0.5
    assertThat(context.entries())
        .extracting(e -> e.hit().id())
        .containsExactly("b", "a", "c");
    assertThat(context.entries())
        .extracting(ContextEntry::referenceId)
        .containsExactly("R1", "R2", "R3");
  }

  @Test
  void score_ties_prefer_lower_tier_then_later_effective_date() {
    FusedContext context =
        assembler.assemble(
            List.of(
                hit("relaxed", Tier.HYBRID_RELAXED, 0.6).build(),
                hit("older", Tier.HYBRID_NARROW, 0.6)
                    .inForce(LocalDate.of(2001, 1, 1), null)
                    .build(),
                hit("newer", Tier.HYBRID_NARROW, 0.6)
                    .inForce(LocalDate.of(2019, 1, 1), null)
                    .build()));

    assertThat(context.entries())
        .extracting(e -> e.hit().id())
        .containsExactly("newer", "older", "relaxed");
  }

  @Test
  void same_passage_from_two_tiers_keeps_the_lower_tier_and_records_corroboration() {
    RetrievalHit fromGraph =
        new RetrievalHitBuilder().id("g").section("7").tier(Tier.GRAPH).score(9.0).build();
    RetrievalHit fromHybrid =
        new RetrievalHitBuilder().id("h").section("7").tier(Tier.HYBRID_RELAXED).score(0.4).build();

    FusedContext context = assembler.assemble(List.of(fromGraph, fromHybrid));

    assertThat(context.size()).isEqualTo(1);
    ContextEntry entry = context.entries().get(0);
    assertThat(entry.hit().id()).isEqualTo("h");
    assertThat(entry.corroboratingTiers()).containsExactly(Tier.GRAPH);
    assertThat(context.duplicatesMerged()).isEqualTo(1);
  }

  @Test
  void same_passage_within_a_tier_keeps_the_higher_score() {
    FusedContext context =
        assembler.assemble(
            List.of(
                new RetrievalHitBuilder().id("low").section("7").score(0.3).build(),
                new RetrievalHitBuilder().id("high").section("7").score(0.9).build()));

    assertThat(context.entries()).singleElement().extracting(e -> e.hit().id()).isEqualTo("high");
    assertThat(context.entries().get(0).corroboratingTiers()).isEmpty();
  }

  @Test
  void fill_stops_at_the_entry_cap() {
    props.setMaxEntries(2);

    FusedContext context =
        assembler.assemble(
            List.of(
                hit("a", Tier.HYBRID_NARROW, 0.9).content("a").build(),
                hit("b", Tier.HYBRID_NARROW, 0.8).content("b").build(),
                hit("c", Tier.HYBRID_NARROW, 0.7).content("c").build()));

    assertThat(context.size()).isEqualTo(2);
    assertThat(context.droppedForBudget()).isEqualTo(1);
  }

  @Test
  void passage_that_would_exceed_the_budget_ends_the_fill_and_is_never_truncated() {
    FusedContext context =
        assembler.assemble(
            List.of(
                hit("a", Tier.HYBRID_NARROW, 0.9).content("x".repeat(600)).build(),
                hit("b", Tier.HYBRID_NARROW, 0.8).content("y".repeat(500)).build(),
                hit("c", Tier.HYBRID_NARROW, 0.7).content("z".repeat(100)).build()));

    assertThat(context.entries()).extracting(e -> e.hit().id()).containsExactly("a");
    assertThat(context.entries().get(0).contentSize()).isEqualTo(600);
    assertThat(context.totalContentSize()).isLessThanOrEqualTo(1_000);
    assertThat(context.droppedForBudget()).isEqualTo(2);
  }

  @Test
  void passage_larger_than_the_whole_budget_is_skipped_and_the_fill_continues() {
    FusedContext context =
        assembler.assemble(
            List.of(
                hit("huge", Tier.HYBRID_NARROW, 0.9).content("x".repeat(1_001)).build(),
                hit("b", Tier.HYBRID_NARROW, 0.8).content("short").build(),
                hit("c", Tier.HYBRID_NARROW, 0.7).content("brief").build()));

    assertThat(context.entries())
        .extracting(e -> e.hit().id())
        .containsExactly("b", "c");
    assertThat(context.entries())
        .extracting(ContextEntry::referenceId)
        .containsExactly("R1", "R2");
    assertThat(context.droppedForBudget()).isEqualTo(1);
  }

  @Test
  void assembly_is_deterministic_regardless_of_input_order() {
    List<RetrievalHit> hits =
        List.of(
            hit("a", Tier.HYBRID_NARROW, 0.5).build(),
            hit("b", Tier.HYBRID_NARROW, 0.5).build(),
            hit("c", Tier.GRAPH, 1.0).build());

    FusedContext forward = assembler.assemble(hits);
    FusedContext reversed = assembler.assemble(List.of(hits.get(2), hits.get(1), hits.get(0)));

    assertThat(forward.entries()).isEqualTo(reversed.entries());
  }
}

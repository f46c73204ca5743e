package dev.regula.cascade;

import dev.regula.query.ExtractedEntity;
import dev.regula.query.LegalSynonyms;
import dev.regula.query.QueryProperties;
import dev.regula.query.Question;
import dev.regula.retrieval.RelationKind;
import dev.regula.retrieval.RetrievalHit;
import dev.regula.retrieval.Tier;
import dev.regula.retrieval.TierQuery;
import dev.regula.retrieval.graph.GraphProperties;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Builds the backend-neutral request for each tier from the analyzed question and the hits
 * gathered by earlier tiers.
 */
@Component
public class TierQueryPlanner {

  static final Set<RelationKind> GRAPH_TRAVERSAL =
      Set.of(RelationKind.HAS_SECTION, RelationKind.REFERENCES);

  private static final int MAX_TITLE_SEEDS = 3;

  private final CascadeProperties cascadeProperties;
  private final GraphProperties graphProperties;
  private final QueryProperties queryProperties;

  public TierQueryPlanner(
      CascadeProperties cascadeProperties,
      GraphProperties graphProperties,
      QueryProperties queryProperties) {
    this.cascadeProperties = cascadeProperties;
    this.graphProperties = graphProperties;
    this.queryProperties = queryProperties;
  }

  public TierQuery plan(Tier tier, Question question, List<RetrievalHit> earlierHits) {
    int limit = limit(question);
    if (tier == Tier.HYBRID_NARROW) {
      return new TierQuery(
          tier,
          question.normalized(),
          question.keywords(),
          question.filters(),
          List.of(),
          Set.of(),
          0,
          limit,
          question.language());
    }
    if (tier == Tier.HYBRID_RELAXED) {
      List<String> expanded =
          LegalSynonyms.expand(baseTerms(question), queryProperties.getMaxExpandedTerms());
      return new TierQuery(
          tier,
          broadenedText(question, expanded),
          expanded,
          question.filters().relaxed(),
          List.of(),
          Set.of(),
          0,
          limit,
          question.language());
    }
    if (tier == Tier.GRAPH) {
      return new TierQuery(
          tier,
          question.normalized(),
          question.keywords(),
          question.filters().relaxed(),
          graphSeeds(question, earlierHits),
          GRAPH_TRAVERSAL,
          graphProperties.getMaxHops(),
          limit,
          question.language());
    }
    return new TierQuery(
        tier,
        question.normalized(),
        question.keywords(),
        question.filters().relaxed(),
        List.of(),
        Set.of(),
        0,
        limit,
        question.language());
  }

  /** Ambiguous questions cast a wider net. */
  int limit(Question question) {
    int base = cascadeProperties.getResultLimit();
    if (!question.ambiguous()) {
      return base;
    }
    return (int) Math.ceil(base * cascadeProperties.getAmbiguityBreadthFactor());
  }

  /** Entity phrases first, then single keywords. */
  private static List<String> baseTerms(Question question) {
    Set<String> terms = new LinkedHashSet<>();
    for (ExtractedEntity entity : question.entities()) {
      terms.add(entity.text().toLowerCase(Locale.ROOT));
    }
    terms.addAll(question.keywords());
    return new ArrayList<>(terms);
  }

  private static String broadenedText(Question question, List<String> expanded) {
    String lower = question.normalized().toLowerCase(Locale.ROOT);
    StringBuilder text = new StringBuilder(question.normalized());
    for (String term : expanded) {
      if (!lower.contains(term)) {
        text.append(' ').append(term);
      }
    }
    return text.toString();
  }

  private static List<String> graphSeeds(Question question, List<RetrievalHit> earlierHits) {
    Set<String> seeds = new LinkedHashSet<>(baseTerms(question));
    int titles = 0;
    for (RetrievalHit hit : earlierHits) {
      if (titles == MAX_TITLE_SEEDS) {
        break;
      }
      if (seeds.add(hit.citation().documentTitle().toLowerCase(Locale.ROOT))) {
        titles++;
      }
    }
    return new ArrayList<>(seeds);
  }
}

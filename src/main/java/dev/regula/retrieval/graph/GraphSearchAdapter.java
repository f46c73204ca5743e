package dev.regula.retrieval.graph;

import dev.regula.retrieval.Backend;
import dev.regula.retrieval.BackendUnavailableException;
import dev.regula.retrieval.HitCitation;
import dev.regula.retrieval.RelationKind;
import dev.regula.retrieval.Relationship;
import dev.regula.retrieval.RetrievalAdapter;
import dev.regula.retrieval.RetrievalHit;
import dev.regula.retrieval.TierQuery;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.neo4j.driver.AccessMode;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.TransactionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Graph retrieval over the Neo4j legislation graph.
 *
 * <p>Seeds come from the {@code legislation_fulltext} and {@code section_fulltext} Lucene indexes;
 * when both return nothing, a title {@code CONTAINS} match is used instead. Seeds are then expanded
 * by a bounded traversal over the requested relationship types, each neighbour scored as the best
 * seed score divided by {@code hops + 1}. Every hit carries its document's outgoing SUPERSEDES,
 * AMENDS and REFERENCES edges for conflict detection.
 */
@Component
public class GraphSearchAdapter implements RetrievalAdapter {

  private static final Logger log = LoggerFactory.getLogger(GraphSearchAdapter.class);

  /** Shared projection; expects {@code node}, {@code score}, {@code depth} and {@code doc}. */
  private static final String PROJECTION =
      """
      OPTIONAL MATCH (doc)-[rel:SUPERSEDES|AMENDS|REFERENCES]->(other)
      WITH node, score, depth, doc,
           collect(CASE WHEN other IS NULL THEN NULL
                        ELSE {kind: type(rel), target: other.id} END) AS relations
      RETURN node.id AS id,
             coalesce(node.title, doc.title) AS title,
             coalesce(node.content, node.full_text, '') AS content,
             doc.id AS documentId,
             coalesce(doc.title, node.title) AS documentTitle,
             CASE WHEN doc = node THEN NULL ELSE node.section_number END AS sectionId,
             CASE WHEN node:Section THEN 'section'
                  WHEN node:Regulation THEN 'regulation'
                  ELSE coalesce(toLower(node.node_type), 'act') END AS documentType,
             toString(coalesce(node.effective_date, doc.effective_date)) AS effectiveFrom,
             relations,
             score,
             depth
      ORDER BY score DESC, id
      """;

  private static final String DOCUMENT_SCOPE =
      """
      OPTIONAL MATCH (parent:Legislation)-[:HAS_SECTION]->(node)
      WITH node, score, depth, coalesce(parent, node) AS doc
      WHERE $language IS NULL OR coalesce(doc.language, 'en') = $language
      """;

  static final String FULLTEXT_SEEDS =
      """
      CALL {
        CALL db.index.fulltext.queryNodes('legislation_fulltext', $query) YIELD node, score
        RETURN node, score
        UNION ALL
        CALL db.index.fulltext.queryNodes('section_fulltext', $query) YIELD node, score
        RETURN node, score
      }
      WITH node, score, 0 AS depth
      ORDER BY score DESC
      LIMIT $limit
      """
          + DOCUMENT_SCOPE
          + PROJECTION;

  static final String CONTAINS_SEEDS =
      """
      MATCH (node)
      WHERE (node:Legislation OR node:Section OR node:Regulation)
        AND any(term IN $terms WHERE toLower(coalesce(node.title, '')) CONTAINS term)
      WITH node,
           toFloat(size([term IN $terms WHERE toLower(coalesce(node.title, '')) CONTAINS term]))
             AS score,
           0 AS depth
      ORDER BY score DESC
      LIMIT $limit
      """
          + DOCUMENT_SCOPE
          + PROJECTION;

  /** Traversal template; {@code %s} is the relationship pattern and {@code %d} the hop bound. */
  static final String TRAVERSAL =
      """
      MATCH (seed) WHERE seed.id IN $seedIds
      MATCH path = (seed)-[:%s*1..%d]-(node)
      WHERE NOT node.id IN $seedIds AND (node:Legislation OR node:Section OR node:Regulation)
      WITH node,
           max($seedScores[seed.id] / (length(path) + 1.0)) AS score,
           min(length(path)) AS depth
      ORDER BY score DESC
      LIMIT $limit
      """
          + DOCUMENT_SCOPE
          + PROJECTION;

  private final Driver driver;
  private final GraphProperties properties;

  public GraphSearchAdapter(Driver driver, GraphProperties properties) {
    this.driver = driver;
    this.properties = properties;
  }

  @Override
  public Backend backend() {
    return Backend.GRAPH;
  }

  @Override
  public List<RetrievalHit> retrieve(TierQuery query) {
    String luceneQuery = LuceneQuerySanitizer.toQuery(query.seedTerms(), properties.getMaxTerms());
    if (luceneQuery.isEmpty()) {
      log.debug("No usable seed terms for graph tier");
      return List.of();
    }
    String language = query.filters().language() == null ? null : query.language().code();
    int seedLimit = Math.max(properties.getSeedLimit(), query.limit());

    try {
      Map<String, Object> params = new HashMap<>();
      params.put("query", luceneQuery);
      params.put("limit", seedLimit);
      params.put("language", language);
      List<RetrievalHit> seeds = toHits(query, read(FULLTEXT_SEEDS, params));

      if (seeds.isEmpty()) {
        List<String> terms = containsTerms(query.seedTerms());
        if (!terms.isEmpty()) {
          log.debug("Full-text indexes returned nothing, falling back to title match on {}", terms);
          Map<String, Object> fallback = new HashMap<>();
          fallback.put("terms", terms);
          fallback.put("limit", seedLimit);
          fallback.put("language", language);
          seeds = toHits(query, read(CONTAINS_SEEDS, fallback));
        }
      }

      List<RetrievalHit> neighbours = List.of();
      String relationPattern = relationPattern(query);
      if (!seeds.isEmpty() && query.maxHops() > 0 && !relationPattern.isEmpty()) {
        Map<String, Object> seedScores = new LinkedHashMap<>();
        for (RetrievalHit seed : seeds) {
          seedScores.putIfAbsent(seed.id(), seed.rawScore());
        }
        Map<String, Object> traversal = new HashMap<>();
        traversal.put("seedIds", new ArrayList<>(seedScores.keySet()));
        traversal.put("seedScores", seedScores);
        traversal.put("limit", query.limit());
        traversal.put("language", language);
        String cypher = String.format(Locale.ROOT, TRAVERSAL, relationPattern, query.maxHops());
        neighbours = toHits(query, read(cypher, traversal));
      }

      List<RetrievalHit> merged = new ArrayList<>(seeds);
      merged.addAll(neighbours);
      merged.sort(
          Comparator.comparingDouble(RetrievalHit::rawScore)
              .reversed()
              .thenComparing(RetrievalHit::id));
      List<RetrievalHit> hits = merged.stream().limit(query.limit()).toList();
      log.debug(
          "Graph tier: {} seeds, {} neighbours -> {} hits",
          seeds.size(),
          neighbours.size(),
          hits.size());
      return hits;
    } catch (RuntimeException e) {
      throw new BackendUnavailableException(
          Backend.GRAPH, "Graph search failed: " + e.getMessage(), e);
    }
  }

  private List<Map<String, Object>> read(String cypher, Map<String, Object> params) {
    SessionConfig sessionConfig =
        SessionConfig.builder().withDefaultAccessMode(AccessMode.READ).build();
    TransactionConfig txConfig =
        TransactionConfig.builder().withTimeout(properties.getQueryTimeout()).build();
    try (Session session = driver.session(sessionConfig)) {
      return session.executeRead(tx -> tx.run(cypher, params).list(Record::asMap), txConfig);
    }
  }

  private List<RetrievalHit> toHits(TierQuery query, List<Map<String, Object>> rows) {
    List<RetrievalHit> hits = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      RetrievalHit hit = toHit(query, row, properties.getMaxContentChars());
      if (hit != null) {
        hits.add(hit);
      }
    }
    return hits;
  }

  static @Nullable RetrievalHit toHit(TierQuery query, Map<String, Object> row, int maxContent) {
    String id = text(row.get("id"));
    if (id == null) {
      return null;
    }
    String documentId = text(row.get("documentId"));
    String documentTitle = text(row.get("documentTitle"));
    String title = text(row.get("title"));
    String content = text(row.get("content"));
    if (content != null && content.length() > maxContent) {
      content = content.substring(0, maxContent);
    }
    Object score = row.get("score");

    return new RetrievalHit(
        id,
        query.tier(),
        score instanceof Number number ? number.doubleValue() : 0.0,
        0.0,
        title == null ? (documentTitle == null ? id : documentTitle) : title,
        content == null ? "" : content,
        new HitCitation(
            documentId == null ? id : documentId,
            documentTitle == null ? (title == null ? id : title) : documentTitle,
            text(row.get("sectionId"))),
        text(row.get("documentType")),
        date(text(row.get("effectiveFrom"))),
        null,
        relationships(row.get("relations")),
        null);
  }

  static List<Relationship> relationships(@Nullable Object value) {
    if (!(value instanceof List<?> entries)) {
      return List.of();
    }
    List<Relationship> relationships = new ArrayList<>();
    for (Object entry : entries) {
      if (entry instanceof Map<?, ?> edge) {
        String target = text(edge.get("target"));
        if (target != null) {
          RelationKind.parse(text(edge.get("kind")))
              .ifPresent(kind -> relationships.add(new Relationship(kind, target)));
        }
      }
    }
    return relationships;
  }

  private static String relationPattern(TierQuery query) {
    return query.traversal().stream()
        .map(RelationKind::name)
        .sorted()
        .collect(Collectors.joining("|"));
  }

  private static List<String> containsTerms(List<String> seedTerms) {
    List<String> terms = new ArrayList<>();
    for (String seed : seedTerms) {
      String term = seed.toLowerCase(Locale.ROOT).strip();
      if (term.length() >= 4 && !terms.contains(term)) {
        terms.add(term);
      }
    }
    return terms;
  }

  private static @Nullable String text(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    String text = String.valueOf(value).strip();
    return text.isEmpty() ? null : text;
  }

  private static @Nullable LocalDate date(@Nullable String text) {
    if (text == null || text.length() < 10) {
      return null;
    }
    try {
      return LocalDate.parse(text.substring(0, 10));
    } catch (DateTimeParseException e) {
      log.debug("Ignoring malformed effective date '{}'", text);
      return null;
    }
  }
}

package dev.regula.retrieval.hybrid;

import dev.langchain4j.data.segment.TextSegment;

/**
 * A hybrid-search candidate with its raw score from a single signal (vector or keyword). Input to
 * {@link ConvexCombinationFusion}.
 *
 * @param passageId embedding id, shared by both signals for the same passage
 * @param segment passage text and metadata
 * @param score raw score: cosine relevance for vector, {@code ts_rank} for keyword
 */
record ScoredCandidate(String passageId, TextSegment segment, double score) {}

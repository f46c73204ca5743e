package dev.regula.retrieval.hybrid;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A passage of legislation indexed for hybrid search.
 *
 * <p>Each row holds the passage text and JSONB metadata (document id and title, section id,
 * document type, jurisdiction, language, effective period, encoded relationships). The embedding
 * vector lives in the same table but is owned by LangChain4j's {@code PgVectorEmbeddingStore} and
 * is not mapped here. The table is populated by the ingestion pipeline; this side only reads it.
 *
 * @see PassageChunkRepository
 */
@Entity
@Immutable
@Table(name = "regulation_passages")
public class PassageChunk {

  @Id
  @Column(name = "embedding_id")
  private UUID id;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String text;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "JSONB")
  private String metadata;

  protected PassageChunk() {
    // JPA requires no-arg constructor
  }

  public UUID getId() {
    return id;
  }

  public String getText() {
    return text;
  }

  public String getMetadata() {
    return metadata;
  }
}

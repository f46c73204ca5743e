package dev.regula.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import javax.sql.DataSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the embedding model and vector store used by the hybrid tiers.
 *
 * <p>Uses the ONNX-based bge-small-en-v1.5 quantized model (384 dimensions) running in-process, so
 * question embedding needs no external API. The {@link PgVectorEmbeddingStore} reads the {@code
 * regulation_passages} table populated by the ingestion pipeline and shares the application's
 * HikariCP {@link DataSource}.
 *
 * @see dev.regula.retrieval.hybrid.HybridSearchAdapter
 */
@Configuration
public class EmbeddingConfig {

  /**
   * Provides the in-process ONNX embedding model (bge-small-en-v1.5 quantized, 384 dimensions).
   *
   * @return a ready-to-use embedding model requiring no external API
   */
  @Bean
  public EmbeddingModel embeddingModel() {
    return new BgeSmallEnV15QuantizedEmbeddingModel();
  }

  /**
   * Configures the read-only pgvector embedding store.
   *
   * <p>Table and HNSW index are owned by the ingestion pipeline; {@code createTable} and {@code
   * useIndex} are disabled so startup never alters the schema.
   *
   * @param dataSource the shared HikariCP data source (no duplicate pool)
   * @param table passages table name
   * @return a vector store over the regulation passages
   */
  @Bean
  public EmbeddingStore<TextSegment> embeddingStore(
      DataSource dataSource,
      @Value("${regula.hybrid.table:regulation_passages}") String table) {
    return PgVectorEmbeddingStore.datasourceBuilder()
        .datasource(dataSource)
        .table(table)
        .dimension(384)
        .createTable(false)
        .useIndex(false)
        .build();
  }
}

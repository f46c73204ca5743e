package dev.regula.retrieval.fulltext;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDate;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/**
 * A statute or regulation row in the relational store. Read-only: rows are written by the
 * ingestion pipeline, and the generated {@code search_vector} columns are maintained by
 * PostgreSQL.
 *
 * @see RegulationSearchRepository
 */
@Entity
@Immutable
@Table(name = "regulations")
public class Regulation {

  @Id private UUID id;

  @Column(nullable = false)
  private String title;

  @Column(nullable = false)
  private String jurisdiction;

  @Column(name = "effective_date")
  private LocalDate effectiveDate;

  private String status;

  private String language;

  protected Regulation() {
    // JPA requires no-arg constructor
  }

  public UUID getId() {
    return id;
  }

  public String getTitle() {
    return title;
  }

  public String getJurisdiction() {
    return jurisdiction;
  }

  public LocalDate getEffectiveDate() {
    return effectiveDate;
  }

  public String getStatus() {
    return status;
  }

  public String getLanguage() {
    return language;
  }
}

package com.flamingo.ai.discovery.domain.entity;

import com.flamingo.ai.discovery.domain.enums.SourceType;
import com.google.common.hash.Hashing;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A research source attached to a notebook, holding its already extracted text.
 *
 * <p>The text and its hash change together; a new hash invalidates every indexed chunk of the
 * source.
 */
@Entity
@Table(name = "sources", indexes = @Index(name = "idx_sources_notebook", columnList = "notebookId"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Source {

  public static final int MAX_NAME_LENGTH = 500;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private UUID notebookId;

  @Column(nullable = false, length = MAX_NAME_LENGTH)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private SourceType sourceType;

  @Column(length = 2048)
  private String url;

  @Column(columnDefinition = "TEXT")
  private String extractedText;

  /** SHA-256 of {@link #extractedText}, hex encoded. */
  @Column(nullable = false, length = 64)
  private String contentHash;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime deletedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }

  /** Creates a source for freshly extracted text. */
  public static Source create(UUID notebookId, String name, SourceType type, String text) {
    if (name == null || name.isBlank() || name.length() > MAX_NAME_LENGTH) {
      throw new IllegalArgumentException(
          "Source name is required and must be at most " + MAX_NAME_LENGTH + " characters");
    }
    return Source.builder()
        .notebookId(notebookId)
        .name(name)
        .sourceType(type)
        .extractedText(text == null ? "" : text)
        .contentHash(hashOf(text))
        .build();
  }

  /** Replaces the text after a new extraction. */
  public void reextract(String text) {
    this.extractedText = text == null ? "" : text;
    this.contentHash = hashOf(text);
  }

  public void markDeleted() {
    this.deletedAt = LocalDateTime.now();
  }

  public boolean isDeleted() {
    return deletedAt != null;
  }

  public static String hashOf(String text) {
    return Hashing.sha256().hashString(text == null ? "" : text, StandardCharsets.UTF_8).toString();
  }
}

package com.flamingo.ai.discovery.domain.entity;

import com.flamingo.ai.discovery.domain.converter.StringListConverter;
import com.flamingo.ai.discovery.domain.converter.StringMapConverter;
import com.flamingo.ai.discovery.domain.enums.OutputStatus;
import com.flamingo.ai.discovery.domain.enums.OutputType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A synthesized artifact of a notebook.
 *
 * <p>Status changes go through the conditional transitions of {@code OutputStore}; this entity
 * only carries state. {@link #metadata} holds per-type details keyed by plain strings.
 */
@Entity
@Table(
    name = "outputs",
    indexes = {
      @Index(name = "idx_outputs_notebook", columnList = "notebookId"),
      @Index(name = "idx_outputs_status", columnList = "status")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Output {

  public static final int MAX_TITLE_LENGTH = 500;
  public static final int MAX_CONTENT_LENGTH = 50_000;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private UUID notebookId;

  @Column(nullable = false, length = MAX_TITLE_LENGTH)
  private String title;

  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private String content = "";

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private OutputType outputType;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private OutputStatus status = OutputStatus.DRAFT;

  @Column(nullable = false)
  @Builder.Default
  private int version = 1;

  /** Ids of the sources the generated content actually cites. */
  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> sourceReferences = new ArrayList<>();

  private int wordCount;

  private LocalDateTime generatedAt;

  private LocalDateTime generationStartedAt;

  @Column(columnDefinition = "TEXT")
  private String lastError;

  @Convert(converter = StringMapConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private Map<String, String> metadata = new LinkedHashMap<>();

  @Embedded private GenerationSettings settings;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime updatedAt;

  private LocalDateTime deletedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  /** Checks the title constraints shared by creation and regenerate overrides. */
  public static String requireValidTitle(String title) {
    if (title == null || title.isBlank()) {
      throw new IllegalArgumentException("Output title is required");
    }
    if (title.length() > MAX_TITLE_LENGTH) {
      throw new IllegalArgumentException(
          "Output title must be at most " + MAX_TITLE_LENGTH + " characters");
    }
    return title;
  }
}

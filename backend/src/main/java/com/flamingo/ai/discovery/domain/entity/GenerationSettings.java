package com.flamingo.ai.discovery.domain.entity;

import com.flamingo.ai.discovery.domain.converter.StringListConverter;
import com.flamingo.ai.discovery.domain.enums.Tone;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Generation parameters an output was last produced with. Reused by regenerate. */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class GenerationSettings {

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> sourceIds = new ArrayList<>();

  private String templateId;

  @Column(columnDefinition = "TEXT")
  private String customPrompt;

  @Enumerated(EnumType.STRING)
  private Tone tone;

  private Integer targetLength;

  private int maxSources;

  private double temperature;

  private int maxTokens;

  private boolean includeReferences;
}

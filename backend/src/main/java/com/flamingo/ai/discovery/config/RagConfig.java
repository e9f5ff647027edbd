package com.flamingo.ai.discovery.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the indexing, retrieval and generation pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Validated
@Getter
@Setter
public class RagConfig {

  @Valid private Chunking chunking = new Chunking();
  @Valid private Retrieval retrieval = new Retrieval();
  @Valid private Prompt prompt = new Prompt();
  @Valid private Generation generation = new Generation();
  @Valid private Qa qa = new Qa();
  @Valid private Templates templates = new Templates();

  @Getter
  @Setter
  public static class Chunking {
    /** Window size in characters. */
    @Positive private int size = 1000;

    /** Characters re-read from the tail of the previous chunk, capped at half the size. */
    @PositiveOrZero private int overlap = 200;
  }

  @Getter
  @Setter
  public static class Retrieval {
    @Positive private int defaultLimit = 10;

    @Min(1)
    private int candidatesMultiplier = 2;

    /** Ceiling on candidates asked from the index; kNN accepts k up to 5000 with 2x headroom. */
    @Positive private int maxCandidates = 5000;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minRelevance = 0.0;
  }

  @Getter
  @Setter
  public static class Prompt {
    /** Upper bound for tokens kept free for the model's answer. */
    @Positive private int reservedForCompletion = 2048;

    /** Minimum tokens set aside for system prompt, section instructions and custom prompt. */
    @PositiveOrZero private int reservedForInstructions = 512;
  }

  @Getter
  @Setter
  public static class Generation {
    @Min(1)
    private int maxAttempts = 3;

    @NotNull private Duration initialBackoff = Duration.ofMillis(500);

    @DecimalMin("1.0")
    private double backoffMultiplier = 2.0;

    /** Per-attempt timeout for the LLM call. */
    @NotNull private Duration timeout = Duration.ofSeconds(120);

    private boolean streaming = true;

    /** GENERATING outputs older than this are failed by the reconciliation sweep. */
    @NotNull private Duration staleAfter = Duration.ofMinutes(15);

    @Positive private int maxContentLength = 50_000;
  }

  @Getter
  @Setter
  public static class Qa {
    @PositiveOrZero private int maxSources = 5;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double temperature = 0.3;

    @Positive private int maxTokens = 4096;

    @NotBlank
    private String noInformationAnswer =
        "No relevant information was found in this notebook's sources to answer the question.";
  }

  /** Named output templates, keyed by template id. */
  @Getter
  @Setter
  public static class Templates {
    private Map<String, TemplateDefinition> definitions = new LinkedHashMap<>();
  }

  @Getter
  @Setter
  public static class TemplateDefinition {
    private String name;
    private String systemPrompt;
    private List<SectionDefinition> sections = new ArrayList<>();
  }

  @Getter
  @Setter
  public static class SectionDefinition {
    private String name;
    private String instructions;
    private Integer minLength;
    private Integer maxLength;
  }
}

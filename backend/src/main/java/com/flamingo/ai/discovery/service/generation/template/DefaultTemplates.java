package com.flamingo.ai.discovery.service.generation.template;

import com.flamingo.ai.discovery.domain.enums.OutputType;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Built-in templates, one per {@link OutputType}. */
final class DefaultTemplates {

  static final String GROUNDING_RULES =
      "Use only the information in the provided source excerpts. "
          + "Every excerpt starts with a marker such as [S<source-id>:<chunk-index>]. "
          + "When you use information from an excerpt, cite it by repeating its marker exactly. "
          + "If the excerpts do not cover something, say so instead of guessing.";

  private static final Map<OutputType, ResolvedTemplate> TEMPLATES =
      new EnumMap<>(OutputType.class);

  static {
    register(
        OutputType.SUMMARY,
        "You are a research assistant writing a concise summary of a collection of sources.",
        new TemplateSection(
            "Overview", "State the central topic and purpose of the sources.", 40, 120),
        new TemplateSection(
            "Key Points", "List the most important findings, facts and arguments.", 80, 300),
        new TemplateSection("Conclusion", "Close with the main takeaway.", 20, 80));
    register(
        OutputType.BLOG_POST,
        "You are a skilled content writer creating a well-structured, engaging blog post.",
        new TemplateSection("Introduction", "Hook the reader and introduce the topic.", 50, 150),
        new TemplateSection(
            "Body",
            "Develop the main ideas in sections with clear headings and readable paragraphs.",
            200,
            null),
        new TemplateSection("Conclusion", "Wrap up with a takeaway or call to action.", 40, 120));
    register(
        OutputType.BRIEFING,
        "You are preparing a briefing document for a busy decision maker.",
        TemplateSection.of("Executive Summary", "Summarize the situation in a few sentences."),
        TemplateSection.of("Key Facts", "List the essential facts as bullet points."),
        TemplateSection.of("Implications", "Explain what the facts mean and what to watch."));
    register(
        OutputType.REPORT,
        "You are an analyst writing a structured report.",
        TemplateSection.of("Introduction", "Describe the scope and the sources covered."),
        TemplateSection.of("Findings", "Present the findings, grouped by theme."),
        TemplateSection.of("Analysis", "Interpret the findings and relate them to each other."),
        TemplateSection.of("Recommendations", "Give concrete, source-backed recommendations."));
    register(
        OutputType.ESSAY,
        "You are writing a coherent argumentative essay.",
        TemplateSection.of("Thesis", "State a clear thesis supported by the sources."),
        TemplateSection.of("Argument", "Develop the argument with evidence from the sources."),
        TemplateSection.of("Conclusion", "Restate the thesis in light of the evidence."));
    register(
        OutputType.FAQ,
        "You are writing a frequently-asked-questions document.",
        new TemplateSection(
            "Questions and Answers",
            "Write 5 to 10 questions a reader would ask, each followed by a short answer.",
            150,
            null));
    register(
        OutputType.MEETING_NOTES,
        "You are turning source material into structured meeting notes.",
        TemplateSection.of("Summary", "Summarize what was discussed."),
        TemplateSection.of("Decisions", "List the decisions taken."),
        TemplateSection.of("Action Items", "List follow-up actions with owners when known."));
    register(
        OutputType.COMPARATIVE_ANALYSIS,
        "You are comparing the positions and findings of several sources.",
        TemplateSection.of("Subjects", "Introduce what is being compared."),
        TemplateSection.of("Similarities", "Describe where the sources agree."),
        TemplateSection.of("Differences", "Describe where the sources disagree or diverge."),
        TemplateSection.of("Assessment", "Weigh the evidence on each side."));
    register(
        OutputType.MIND_MAP,
        "You are an expert at creating structured, hierarchical mind maps from information.",
        TemplateSection.of(
            "Outline",
            "Produce a markdown outline: a single # main topic, 3 to 7 ## branches, and ### or"
                + " #### sub-branches as needed. Keep each point to one or two lines and use"
                + " bullet points under headings for details."));
    register(
        OutputType.QA_ANSWER,
        "You are a helpful assistant that answers questions based on the provided context.",
        TemplateSection.of(
            "Answer", "Answer the question directly, then give supporting detail."));
    register(
        OutputType.CUSTOM,
        "You are a careful writer producing the document the user asks for.",
        TemplateSection.of("Content", "Follow the user's instructions."));
  }

  private DefaultTemplates() {}

  private static void register(OutputType type, String role, TemplateSection... sections) {
    TEMPLATES.put(
        type,
        new ResolvedTemplate(
            "default-" + type.name().toLowerCase(Locale.ROOT).replace('_', '-'),
            role + " " + GROUNDING_RULES,
            List.of(sections)));
  }

  static ResolvedTemplate forType(OutputType type) {
    return TEMPLATES.get(type);
  }
}

package com.longevitydigest.backend.ai.prompt;

import com.longevitydigest.backend.model.dto.Candidate;
import com.longevitydigest.backend.model.dto.Draft;
import com.longevitydigest.backend.model.enums.ContentType;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompt texts sent to the generation, revision and fact-check providers.
 */
public final class ContentPrompts {

    public static final int MAX_REVISION_ISSUES = 8;

    private static final String SYSTEM_PROMPT = """
            You write on behalf of a longevity science research team.

            Role:
            - Explain recent medical research so the general public can follow it
            - Keep scientific accuracy while using a warm, empathetic tone
            - Offer practical health insights

            Style:
            - Pair technical terms with plain explanations (keep the English term in parentheses)
            - Talk to the reader directly and politely
            - State the key message clearly
            - Stay hopeful and positive

            Cautions:
            - Phrase medical statements as "may" or "is reported to", never as advice
            - Name the source clearly
            - Avoid exaggeration and definitive claims
            - No personal medical advice; recommend consulting a doctor
            Write all generated text in %s.
            """;

    private static final String GENERATION_PROMPT = """
            Write %s content based on the following research paper.

            ## Paper
            Title: %s
            Authors: %s
            Journal: %s
            Published: %s

            ## Abstract
            %s

            ## Format
            %s

            ## Additional requirements
            1. Write in %s
            2. Keep the original English term in parentheses after technical terms
            3. List 3 key insights separately
            4. Suggest 2-3 practical applications
            5. Cite the source

            Respond in JSON:
            {
                "title": "title",
                "summary": "2-3 sentence summary",
                "body": "full body",
                "key_insights": ["insight 1", "insight 2", "insight 3"],
                "practical_applications": ["application 1", "application 2"],
                "confidence_score": 0.0-1.0
            }""";

    private static final String REVISION_PROMPT = """
            Revise the following content so it stays within the scope of the original abstract.

            Important:
            - Do not invent numbers, authors, years or results that are not in the abstract or title.
            - If something cannot be confirmed, state that the abstract does not confirm it.
            - Keep terminology faithful to the original meaning (e.g. knockout vs inhibition).
            - Only remove or qualify unsupported claims; do not add new facts.
            - Return JSON only, without code fences or commentary.

            ## Original paper
            Title: %s
            Authors: %s
            Journal: %s
            Published: %s

            Abstract:
            %s

            ## Current content
            title: %s
            summary: %s
            body:
            %s

            ## Fact-check issues
            %s

            Respond in JSON:
            {
              "title": "...",
              "summary": "...",
              "body": "...",
              "key_insights": ["...", "...", "..."],
              "practical_applications": ["...", "..."],
              "confidence_score": 0.0-1.0
            }""";

    private static final String FACT_CHECK_PROMPT = """
            You are a fact checker for medical research content.

            Verify whether the following AI-generated content is consistent with the original paper.

            ## Original paper
            Title: %s
            Abstract: %s

            ## AI-generated content
            %s

            ## Checks
            1. Accuracy of numbers and statistics
            2. Distorted causal claims
            3. Exaggerated wording
            4. Missing important information
            5. Potential for misunderstanding

            Respond in JSON:
            {
                "accuracy_score": 0.0-1.0,
                "issues": ["issue 1", "issue 2"],
                "suggestions": ["suggestion 1", "suggestion 2"],
                "safe_to_publish": true/false
            }""";

    private ContentPrompts() {
    }

    public static String systemPrompt(String language) {
        return SYSTEM_PROMPT.formatted(language);
    }

    public static String generation(Candidate candidate, ContentType contentType, String language) {
        return GENERATION_PROMPT.formatted(
                contentType.getValue(),
                nullToEmpty(candidate.getTitle()),
                joinAuthors(candidate.getAuthors()),
                nullToEmpty(candidate.getVenue()),
                nullToEmpty(candidate.getPublishedDate()),
                nullToEmpty(candidate.getAbstractText()),
                contentType.getTemplate(),
                language);
    }

    /**
     * Revision prompt; only the first {@value #MAX_REVISION_ISSUES} issues are included
     */
    public static String revision(Candidate candidate, Draft draft, List<String> issues) {
        String issuesText = (issues == null ? List.<String>of() : issues).stream()
                .limit(MAX_REVISION_ISSUES)
                .map(issue -> "- " + issue)
                .collect(Collectors.joining("\n"));

        return REVISION_PROMPT.formatted(
                nullToEmpty(candidate.getTitle()),
                joinAuthors(candidate.getAuthors()),
                nullToEmpty(candidate.getVenue()),
                nullToEmpty(candidate.getPublishedDate()),
                nullToEmpty(candidate.getAbstractText()),
                nullToEmpty(draft.getTitle()),
                nullToEmpty(draft.getSummary()),
                nullToEmpty(draft.getBody()),
                issuesText);
    }

    public static String factCheck(Candidate candidate, Draft draft) {
        return FACT_CHECK_PROMPT.formatted(
                nullToEmpty(candidate.getTitle()),
                nullToEmpty(candidate.getAbstractText()),
                nullToEmpty(draft.getBody()));
    }

    private static String joinAuthors(List<String> authors) {
        return authors == null ? "" : String.join(", ", authors);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}

package com.longevitydigest.backend.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * Output formats a draft can be generated in, each with its layout instructions.
 */
@Getter
public enum ContentType {
    NEWSLETTER("newsletter", """
            Newsletter format
            Title: an engaging question-style headline
            Greeting: a short warm greeting introducing this week's notable study
            Core content (3-4 paragraphs): background and why it matters, main findings,
            what it means for our health, what readers can act on
            Closing: a short friendly sign-off
            Total length: 400-600 characters
            """),
    BLOG("blog", """
            Blog format
            Title: a search-friendly headline
            Subtitle: one line summarising the content
            Introduction: a question or situation that hooks the reader and why the study matters
            Body (5-7 paragraphs): background, brief methods, main results, expert interpretation,
            limitations for a balanced view, everyday application
            Conclusion: key message and a call to action
            Total length: 800-1200 characters
            """),
    YOUTUBE_SCRIPT("youtube_script", """
            Video script format
            [Opening - 10s] a hook about the new result
            [Key question - 20s] does the studied intervention really help?
            [Study introduction - 1 min] where, who, how, and why it matters
            [Results - 2 min] key findings 1, 2, 3 with caption cues [caption: ...]
            [Interpretation - 1 min] what it means for us and what to be careful about
            [Practical tips - 1 min] what viewers can start today
            [Closing - 30s] subscribe reminder and next episode teaser
            Total length: 5-7 minutes
            """);

    @JsonValue
    private final String value;
    private final String template;

    ContentType(String value, String template) {
        this.value = value;
        this.template = template;
    }

    /**
     * Resolve a content type by value, falling back to NEWSLETTER for unknown names
     */
    @JsonCreator
    public static ContentType fromValue(String value) {
        if (value == null) return NEWSLETTER;
        for (ContentType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim()) || type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return NEWSLETTER;
    }
}

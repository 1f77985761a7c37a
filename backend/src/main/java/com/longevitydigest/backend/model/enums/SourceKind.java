package com.longevitydigest.backend.model.enums;

import java.util.Collection;
import lombok.Getter;

/**
 * Origin of a candidate record. Declaration order is the bucket priority used by
 * the diversity selector and by origin-source tagging of drafts.
 */
@Getter
public enum SourceKind {
    CLINICAL_TRIAL("clinical_trial", "ClinicalTrials.gov"),
    MEDRXIV("medrxiv", "medRxiv"),
    BIORXIV("biorxiv", "bioRxiv"),
    PUBMED("pubmed", "PubMed");

    public static final String PREPRINT_TAG = "preprint";

    private final String tag;
    private final String displayName;

    SourceKind(String tag, String displayName) {
        this.tag = tag;
        this.displayName = displayName;
    }

    /**
     * First kind (in priority order) whose tag is present, PUBMED when none match.
     */
    public static SourceKind classify(Collection<String> tags) {
        if (tags != null) {
            for (SourceKind kind : values()) {
                if (tags.contains(kind.tag)) {
                    return kind;
                }
            }
        }
        return PUBMED;
    }
}

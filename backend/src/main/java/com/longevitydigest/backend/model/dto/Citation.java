package com.longevitydigest.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Citation {
    private String doi;
    private String title;
    private String journal;

    public static Citation of(Candidate candidate) {
        return new Citation(candidate.getIdentifier(), candidate.getTitle(), candidate.getVenue());
    }
}

package com.longevitydigest.backend.discovery.source;

import com.longevitydigest.backend.model.dto.Candidate;
import com.longevitydigest.backend.model.dto.DateWindow;
import com.longevitydigest.backend.model.enums.SourceKind;
import java.util.List;

/**
 * Fetches candidates from one external source.
 * <p>
 * Implementations never throw for recoverable conditions (timeouts, non-200
 * responses, malformed payloads); those yield an empty list.
 */
public interface SourceAdapter {

    SourceKind getSourceKind();

    List<Candidate> fetch(String query, int maxResults, DateWindow window);
}

package com.longevitydigest.backend.discovery;

import com.longevitydigest.backend.model.dto.DateWindow;
import com.longevitydigest.backend.model.enums.SourceKind;
import lombok.Value;

/**
 * One adapter invocation in a discovery batch
 */
@Value
public class SourceQuery {
    SourceKind source;
    String query;
    int maxResults;
    DateWindow window;
}

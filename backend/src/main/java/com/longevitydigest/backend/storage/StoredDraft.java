package com.longevitydigest.backend.storage;

import com.longevitydigest.backend.model.dto.Draft;
import java.nio.file.Path;
import lombok.Value;

/**
 * A draft loaded from disk together with the file it came from
 */
@Value
public class StoredDraft {
    Path path;
    Draft draft;

    public String getFileName() {
        return path.getFileName().toString();
    }
}

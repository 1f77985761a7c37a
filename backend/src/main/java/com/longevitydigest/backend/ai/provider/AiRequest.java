package com.longevitydigest.backend.ai.provider;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AiRequest {
    String operation;
    String systemPrompt; // optional
    String userPrompt;
    Double temperature;  // null keeps the provider default
}

package com.longevitydigest.backend.support;

import com.longevitydigest.backend.ai.GenerationException;
import com.longevitydigest.backend.ai.provider.AiProvider;
import com.longevitydigest.backend.ai.provider.AiRequest;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * In-memory provider that replays a fixed script of replies and failures
 */
public class ScriptedAiProvider implements AiProvider {

    private final String name;
    private final boolean configured;
    private final Deque<Object> script = new ArrayDeque<>();
    private final List<AiRequest> requests = new ArrayList<>();

    public ScriptedAiProvider(String name) {
        this(name, true);
    }

    public ScriptedAiProvider(String name, boolean configured) {
        this.name = name;
        this.configured = configured;
    }

    public ScriptedAiProvider reply(String text) {
        script.add(text);
        return this;
    }

    public ScriptedAiProvider fail(String message) {
        script.add(new GenerationException(name + " call failed: " + message));
        return this;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isConfigured() {
        return configured;
    }

    @Override
    public String complete(AiRequest request) {
        requests.add(request);
        Object next = script.poll();
        if (next == null) {
            throw new GenerationException(name + " has no scripted response left");
        }
        if (next instanceof RuntimeException) {
            throw (RuntimeException) next;
        }
        return (String) next;
    }

    public List<AiRequest> getRequests() {
        return requests;
    }

    public long callsFor(String operation) {
        return requests.stream().filter(r -> operation.equals(r.getOperation())).count();
    }
}

package io.github.drompincen.folioagent.runtime.tools;

import io.github.drompincen.folioagent.protocol.api.ToolDescriptor;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The tools bound for a single request. Discarded when the request ends.
 */
public class ToolSet {

    private final long accountId;
    private final Map<String, BoundTool> tools;

    ToolSet(long accountId, List<BoundTool> bound) {
        this.accountId = accountId;
        Map<String, BoundTool> byName = new LinkedHashMap<>();
        for (BoundTool t : bound) {
            byName.put(t.name(), t);
        }
        this.tools = Collections.unmodifiableMap(byName);
    }

    public long accountId() { return accountId; }

    public Optional<BoundTool> get(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Collection<BoundTool> all() {
        return tools.values();
    }

    public List<ToolDescriptor> descriptors() {
        return tools.values().stream()
                .map(t -> new ToolDescriptor(t.name(), t.description(), t.inputSchema()))
                .toList();
    }

    public boolean isEmpty() {
        return tools.isEmpty();
    }
}

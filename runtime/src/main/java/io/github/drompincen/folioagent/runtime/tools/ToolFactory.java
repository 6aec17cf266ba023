package io.github.drompincen.folioagent.runtime.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.List;

/**
 * Builds the per-request {@link ToolSet} from the closed set of tool beans.
 */
@Component
public class ToolFactory {

    private static final Logger log = LoggerFactory.getLogger(ToolFactory.class);

    private final List<Tool> catalogue;

    public ToolFactory(List<Tool> catalogue) {
        for (Tool tool : catalogue) {
            assertNoAccountField(tool);
        }
        this.catalogue = List.copyOf(catalogue);
        log.info("Tool catalogue: {}", this.catalogue.stream().map(Tool::name).toList());
    }

    public ToolSet build(long authenticatedAccountId) {
        return build(authenticatedAccountId, null);
    }

    public ToolSet build(long authenticatedAccountId, String threadId) {
        if (authenticatedAccountId <= 0) {
            throw new IllegalArgumentException("Authenticated account id must be positive");
        }
        return new ToolSet(authenticatedAccountId, catalogue.stream()
                .map(t -> new BoundTool(t, authenticatedAccountId, threadId))
                .toList());
    }

    private static void assertNoAccountField(Tool tool) {
        Iterator<String> names = tool.inputSchema().path("properties").fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (BoundTool.isAccountKey(name)) {
                throw new IllegalStateException("Tool " + tool.name() + " exposes account field '" + name + "'");
            }
        }
    }
}

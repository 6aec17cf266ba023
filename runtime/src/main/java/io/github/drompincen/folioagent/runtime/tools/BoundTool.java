package io.github.drompincen.folioagent.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * A tool closed over one authenticated account. Account-like keys the model may have
 * invented are stripped before validation; the bound account is the only one the tool sees.
 */
public class BoundTool {

    private static final Logger log = LoggerFactory.getLogger(BoundTool.class);

    private final Tool tool;
    private final long accountId;
    private final String threadId;

    BoundTool(Tool tool, long accountId, String threadId) {
        this.tool = tool;
        this.accountId = accountId;
        this.threadId = threadId;
    }

    public String name() { return tool.name(); }
    public String description() { return tool.description(); }
    public JsonNode inputSchema() { return tool.inputSchema(); }
    public String statusMessage() { return tool.statusMessage(); }
    public long accountId() { return accountId; }

    /**
     * @throws ToolExecutionException if the arguments fail validation, the tool reports a
     *                                failure or the tool itself throws
     */
    public JsonNode invoke(String callId, JsonNode args) {
        ObjectNode sanitized = sanitize(args);
        List<String> errors = ToolSchemaValidator.validate(tool.inputSchema(), sanitized);
        if (!errors.isEmpty()) {
            throw new ToolExecutionException(name(), "Invalid arguments for " + name() + ": " + String.join("; ", errors));
        }
        ToolResult result;
        try {
            result = tool.execute(new ToolContext(accountId, threadId, callId), sanitized);
        } catch (ToolExecutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ToolExecutionException(name(), name() + " failed: " + e.getMessage(), e);
        }
        if (result == null || !result.success()) {
            throw new ToolExecutionException(name(), result == null ? name() + " returned no result" : result.error());
        }
        return result.output();
    }

    static ObjectNode sanitize(JsonNode args) {
        ObjectNode copy = args != null && args.isObject()
                ? ((ObjectNode) args).deepCopy()
                : JsonNodeFactory.instance.objectNode();
        List<String> stripped = new ArrayList<>();
        Iterator<String> names = copy.fieldNames();
        while (names.hasNext()) {
            String field = names.next();
            if (isAccountKey(field)) {
                stripped.add(field);
            }
        }
        if (!stripped.isEmpty()) {
            copy.remove(stripped);
            log.warn("Stripped account fields {} from tool arguments", stripped);
        }
        return copy;
    }

    static boolean isAccountKey(String field) {
        String normalized = field.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
        return normalized.equals("accountid");
    }
}

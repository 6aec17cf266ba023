package io.github.drompincen.folioagent.runtime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.folioagent.runtime.tools.Tool;
import io.github.drompincen.folioagent.runtime.tools.ToolContext;
import io.github.drompincen.folioagent.runtime.tools.ToolResult;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

final class TestTools {

    static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();

    private TestTools() {}

    /** Returns the account and date it was called with. */
    static class HoldingsTool implements Tool {
        final List<Long> accountsSeen = new CopyOnWriteArrayList<>();

        @Override
        public String name() { return "get_holdings"; }

        @Override
        public String description() { return "Holdings on a date"; }

        @Override
        public JsonNode inputSchema() {
            ObjectNode schema = MAPPER.createObjectNode();
            schema.put("type", "object");
            schema.putObject("properties").putObject("date").put("type", "string");
            schema.putArray("required").add("date");
            schema.put("additionalProperties", false);
            return schema;
        }

        @Override
        public ToolResult execute(ToolContext ctx, JsonNode input) {
            accountsSeen.add(ctx.accountId());
            ObjectNode out = MAPPER.createObjectNode();
            out.put("accountId", ctx.accountId());
            out.put("date", input.get("date").asText());
            out.put("positions", 3);
            return ToolResult.success(out);
        }
    }

    /** Sleeps for {@code delayMs} then echoes {@code label}. */
    static class SleepyTool implements Tool {
        final List<String> completionOrder = new CopyOnWriteArrayList<>();

        @Override
        public String name() { return "sleepy"; }

        @Override
        public String description() { return "Sleeps then echoes"; }

        @Override
        public JsonNode inputSchema() {
            ObjectNode schema = MAPPER.createObjectNode();
            schema.put("type", "object");
            ObjectNode props = schema.putObject("properties");
            props.putObject("label").put("type", "string");
            props.putObject("delayMs").put("type", "integer");
            schema.putArray("required").add("label").add("delayMs");
            return schema;
        }

        @Override
        public ToolResult execute(ToolContext ctx, JsonNode input) {
            try {
                Thread.sleep(input.get("delayMs").asLong());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ToolResult.failure("interrupted");
            }
            String label = input.get("label").asText();
            completionOrder.add(label);
            ObjectNode out = MAPPER.createObjectNode();
            out.put("label", label);
            return ToolResult.success(out);
        }
    }

    /** Blocks until released or interrupted. */
    static class BlockingTool implements Tool {
        final CountDownLatch running = new CountDownLatch(1);
        final CountDownLatch interrupted = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        @Override
        public String name() { return "blocking"; }

        @Override
        public String description() { return "Blocks until released"; }

        @Override
        public JsonNode inputSchema() { return MAPPER.createObjectNode().put("type", "object"); }

        @Override
        public ToolResult execute(ToolContext ctx, JsonNode input) {
            running.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
                return ToolResult.failure("interrupted");
            }
            return ToolResult.success(MAPPER.createObjectNode().put("released", true));
        }
    }

    /** Busy-waits for {@code delayMs}, ignoring interruption, and tracks overlap. */
    static class StubbornTool implements Tool {
        final AtomicInteger invocations = new AtomicInteger();
        final AtomicInteger running = new AtomicInteger();
        final AtomicInteger peak = new AtomicInteger();

        @Override
        public String name() { return "stubborn"; }

        @Override
        public String description() { return "Ignores interruption"; }

        @Override
        public JsonNode inputSchema() {
            ObjectNode schema = MAPPER.createObjectNode();
            schema.put("type", "object");
            schema.putObject("properties").putObject("delayMs").put("type", "integer");
            return schema;
        }

        @Override
        public ToolResult execute(ToolContext ctx, JsonNode input) {
            invocations.incrementAndGet();
            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
            long until = System.nanoTime() + input.get("delayMs").asLong() * 1_000_000L;
            while (System.nanoTime() < until) {
                Thread.onSpinWait();
            }
            running.decrementAndGet();
            return ToolResult.success(MAPPER.createObjectNode().put("done", true));
        }
    }

    static ObjectNode args(Object... kv) {
        ObjectNode node = MAPPER.createObjectNode();
        for (int i = 0; i < kv.length; i += 2) {
            Object v = kv[i + 1];
            if (v instanceof Number n) node.put((String) kv[i], n.longValue());
            else node.put((String) kv[i], String.valueOf(v));
        }
        return node;
    }
}

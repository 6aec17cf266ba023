package io.github.drompincen.folioagent.persistence.document;

/**
 * Composes the {@code _id} values of the checkpoint collections from their natural keys.
 */
public final class CheckpointKeys {

    private static final String SEP = "|";

    private CheckpointKeys() {}

    public static String checkpointId(String threadId, String namespace, String checkpointId) {
        return join(threadId, namespace, checkpointId);
    }

    public static String writeId(String threadId, String namespace, String checkpointId, String taskId, int idx) {
        return join(threadId, namespace, checkpointId, taskId, Integer.toString(idx));
    }

    public static String blobId(String threadId, String namespace, String channel, String version) {
        return join(threadId, namespace, channel, version);
    }

    private static String join(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) sb.append(SEP);
            sb.append(parts[i] == null ? "" : parts[i]);
        }
        return sb.toString();
    }
}

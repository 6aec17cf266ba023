package io.github.drompincen.folioagent.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Channel value stored apart from the checkpoint. Addressed by content version, so
 * re-saving an identical value is a no-op.
 */
@Document(collection = "checkpoint_blobs")
@CompoundIndex(name = "thread_ns_channel_version",
        def = "{'threadId': 1, 'namespace': 1, 'channel': 1, 'version': 1}", unique = true)
public class CheckpointBlobDocument {

    @Id
    private String id;
    private String threadId;
    private String namespace;
    private String channel;
    private String version;
    private String type;
    private byte[] blob;

    public CheckpointBlobDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getThreadId() { return threadId; }
    public void setThreadId(String threadId) { this.threadId = threadId; }

    public String getNamespace() { return namespace; }
    public void setNamespace(String namespace) { this.namespace = namespace; }

    public String getChannel() { return channel; }
    public void setChannel(String channel) { this.channel = channel; }

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public byte[] getBlob() { return blob; }
    public void setBlob(byte[] blob) { this.blob = blob; }
}

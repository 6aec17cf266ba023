package io.github.drompincen.folioagent.persistence.document;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CheckpointDocumentTest {

    @Test
    void checkpointFieldsPreserved() {
        CheckpointDocument doc = new CheckpointDocument();
        Instant now = Instant.now();

        doc.setId(CheckpointKeys.checkpointId("account_42_thread_7", "", "c2"));
        doc.setThreadId("account_42_thread_7");
        doc.setNamespace("");
        doc.setCheckpointId("c2");
        doc.setParentCheckpointId("c1");
        doc.setSeq(2);
        doc.setType("json");
        doc.setCheckpoint("{\"turn\":2}");
        doc.setMetadata("{\"source\":\"turn\"}");
        doc.setCreatedAt(now);

        assertThat(doc.getId()).isEqualTo("account_42_thread_7||c2");
        assertThat(doc.getParentCheckpointId()).isEqualTo("c1");
        assertThat(doc.getSeq()).isEqualTo(2);
        assertThat(doc.getCheckpoint()).contains("turn");
        assertThat(doc.getCreatedAt()).isEqualTo(now);
    }

    @Test
    void writeAndBlobKeysIncludeEveryNaturalKeyPart() {
        assertThat(CheckpointKeys.writeId("t", "ns", "c1", "task-a", 3)).isEqualTo("t|ns|c1|task-a|3");
        assertThat(CheckpointKeys.blobId("t", null, "messages", "abc")).isEqualTo("t||messages|abc");
    }

    @Test
    void pendingWriteFieldsPreserved() {
        CheckpointWriteDocument doc = new CheckpointWriteDocument();
        doc.setThreadId("t");
        doc.setCheckpointId("c1");
        doc.setTaskId("tool-call-1");
        doc.setIdx(0);
        doc.setChannel("messages");
        doc.setTaskPath("tools/get_holdings");
        doc.setValue("{}");

        assertThat(doc.getTaskId()).isEqualTo("tool-call-1");
        assertThat(doc.getChannel()).isEqualTo("messages");
        assertThat(doc.getTaskPath()).isEqualTo("tools/get_holdings");
    }

    @Test
    void blobFieldsPreserved() {
        CheckpointBlobDocument doc = new CheckpointBlobDocument();
        doc.setChannel("messages");
        doc.setVersion("deadbeef");
        doc.setType("json");
        doc.setBlob(new byte[]{1, 2, 3});

        assertThat(doc.getBlob()).containsExactly(1, 2, 3);
        assertThat(doc.getVersion()).isEqualTo("deadbeef");
    }
}

package io.github.drompincen.folioagent.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Lifecycle record of a conversation thread. The conversation itself lives in the checkpoint
 * collections; this only tracks ownership, title and activity.
 */
@Document(collection = "conversation_threads")
@CompoundIndex(name = "account_active_activity", def = "{'accountId': 1, 'active': 1, 'lastActivity': -1}")
public class ConversationThreadDocument {

    @Id
    private String threadId;
    private long accountId;
    private String title;
    private boolean active;
    private Instant lastActivity;
    private Instant createdAt;
    private Instant updatedAt;

    public ConversationThreadDocument() {}

    public String getThreadId() { return threadId; }
    public void setThreadId(String threadId) { this.threadId = threadId; }

    public long getAccountId() { return accountId; }
    public void setAccountId(long accountId) { this.accountId = accountId; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public Instant getLastActivity() { return lastActivity; }
    public void setLastActivity(Instant lastActivity) { this.lastActivity = lastActivity; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}

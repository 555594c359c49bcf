package com.concord.core.messaging;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Communication bus limits.
 */
@Component
@ConfigurationProperties(prefix = "concord.bus")
public class BusProperties {

    /** Messages a recipient's mailbox holds before senders block. */
    private int mailboxCapacity = 256;
    /** How long a sender blocks on a full mailbox before {@code QueueFullException}. */
    private Duration sendTimeout = Duration.ofSeconds(2);
    /** Handler invocations per message before it is dead-lettered. */
    private int maxDeliveryAttempts = 3;
    private Duration redeliveryDelay = Duration.ofMillis(50);
    /** Message ids remembered per receiver for de-duplication. */
    private int dedupWindow = 1024;
    /** Dead letters kept for inspection; older ones are only counted. */
    private int deadLetterRetention = 256;

    public int getMailboxCapacity() { return mailboxCapacity; }
    public void setMailboxCapacity(int mailboxCapacity) { this.mailboxCapacity = mailboxCapacity; }
    public Duration getSendTimeout() { return sendTimeout; }
    public void setSendTimeout(Duration sendTimeout) { this.sendTimeout = sendTimeout; }
    public int getMaxDeliveryAttempts() { return maxDeliveryAttempts; }
    public void setMaxDeliveryAttempts(int maxDeliveryAttempts) { this.maxDeliveryAttempts = maxDeliveryAttempts; }
    public Duration getRedeliveryDelay() { return redeliveryDelay; }
    public void setRedeliveryDelay(Duration redeliveryDelay) { this.redeliveryDelay = redeliveryDelay; }
    public int getDedupWindow() { return dedupWindow; }
    public void setDedupWindow(int dedupWindow) { this.dedupWindow = dedupWindow; }
    public int getDeadLetterRetention() { return deadLetterRetention; }
    public void setDeadLetterRetention(int deadLetterRetention) { this.deadLetterRetention = deadLetterRetention; }
}

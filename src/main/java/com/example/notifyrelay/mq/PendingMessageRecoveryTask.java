package com.example.notifyrelay.mq;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically hands messages that were left unacknowledged (handler returned
 * RETRY_LATER, or a consumer died mid-batch) back to their handler.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PendingMessageRecoveryTask {

    private final RedisStreamQueueClient queueClient;

    @Scheduled(fixedDelayString = "${relay.mq.recovery-interval-ms:30000}",
            initialDelayString = "${relay.mq.recovery-interval-ms:30000}")
    public void recoverPendingMessages() {
        log.debug("Checking pending messages");
        queueClient.redeliverPending();
    }
}

package com.example.notifyrelay.mq;

import com.example.notifyrelay.model.ConsumeDisposition;
import com.example.notifyrelay.model.QueueMessage;

import java.util.List;

/**
 * Callback invoked by a {@link QueueClient} for each delivered batch.
 * <p>
 * Returns one disposition for the whole batch. Implementations may be invoked
 * concurrently for different batches. A thrown exception counts as
 * {@link ConsumeDisposition#RETRY_LATER}.
 */
@FunctionalInterface
public interface MessageHandler {

    ConsumeDisposition handle(List<QueueMessage> batch);
}

package com.example.notifyrelay.mq;

import com.example.notifyrelay.exception.QueueException;
import com.example.notifyrelay.model.ConsumeDisposition;
import com.example.notifyrelay.model.QueueMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessage;
import org.springframework.data.redis.connection.stream.PendingMessages;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.stream.StreamMessageListenerContainer;
import org.springframework.data.redis.stream.StreamMessageListenerContainer.StreamMessageListenerContainerOptions;
import org.springframework.data.redis.stream.StreamMessageListenerContainer.StreamReadRequest;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * {@link QueueClient} on Redis Streams consumer groups.
 * <p>
 * Each topic is a stream. A message is stored as a {@value #BODY_FIELD} field holding the
 * body plus one field per property. New entries are read with {@code XREADGROUP} and
 * acknowledged with {@code XACK} only when the handler returns
 * {@link ConsumeDisposition#ACKNOWLEDGE}; anything else stays in the pending list until
 * {@link #redeliverPending()} claims it again. Redis' per-entry delivery counter is the
 * redelivery count handed to the handler.
 */
@Component
@Slf4j
public class RedisStreamQueueClient implements QueueClient {

    public static final String BODY_FIELD = "body";

    private final StringRedisTemplate redisTemplate;
    private final RedisConnectionFactory connectionFactory;
    private final Executor consumerExecutor;

    private final String groupName;
    private final String consumerName;
    private final Duration pollTimeout;
    private final int batchSize;
    private final Duration pendingIdle;
    private final int recoverCount;

    private final Map<String, MessageHandler> handlers = new ConcurrentHashMap<>();

    private volatile StreamMessageListenerContainer<String, MapRecord<String, String, String>> container;

    public RedisStreamQueueClient(StringRedisTemplate redisTemplate,
            RedisConnectionFactory connectionFactory,
            @Qualifier("consumerExecutor") Executor consumerExecutor,
            @Value("${relay.mq.group-name:notify-relay}") String groupName,
            @Value("${relay.mq.consumer-name:}") String consumerName,
            @Value("${relay.mq.poll-timeout-ms:1000}") long pollTimeoutMs,
            @Value("${relay.mq.batch-size:1}") int batchSize,
            @Value("${relay.mq.pending-idle-ms:60000}") long pendingIdleMs,
            @Value("${relay.mq.recover-count:100}") int recoverCount) {
        this.redisTemplate = redisTemplate;
        this.connectionFactory = connectionFactory;
        this.consumerExecutor = consumerExecutor;
        this.groupName = groupName;
        // unique per instance so several relays can share a group
        this.consumerName = consumerName == null || consumerName.isBlank()
                ? "consumer-" + UUID.randomUUID().toString().substring(0, 8)
                : consumerName;
        this.pollTimeout = Duration.ofMillis(pollTimeoutMs);
        this.batchSize = Math.max(1, batchSize);
        this.pendingIdle = Duration.ofMillis(pendingIdleMs);
        this.recoverCount = Math.max(1, recoverCount);
    }

    @Override
    public void subscribe(String topic, MessageHandler handler) {
        if (container != null) {
            throw new QueueException("Cannot subscribe to " + topic + " after the client has started");
        }
        if (handlers.putIfAbsent(topic, handler) != null) {
            throw new QueueException("Topic " + topic + " is already subscribed");
        }
        log.info("Subscribed to stream {} as {}/{}", topic, groupName, consumerName);
    }

    @Override
    public synchronized void start() {
        if (container != null) {
            throw new QueueException("Queue client already started");
        }
        handlers.keySet().forEach(this::createGroup);

        StreamMessageListenerContainerOptions<String, MapRecord<String, String, String>> options = StreamMessageListenerContainerOptions
                .builder()
                .pollTimeout(pollTimeout)
                .batchSize(batchSize)
                .executor(consumerExecutor)
                .build();

        StreamMessageListenerContainer<String, MapRecord<String, String, String>> listenerContainer = StreamMessageListenerContainer
                .create(connectionFactory, options);

        for (String topic : handlers.keySet()) {
            listenerContainer.register(
                    StreamReadRequest.builder(StreamOffset.create(topic, ReadOffset.lastConsumed()))
                            .cancelOnError(t -> false)
                            .errorHandler(t -> log.error("Error reading stream {}: {}", topic, t.getMessage(), t))
                            .consumer(Consumer.from(groupName, consumerName))
                            .autoAcknowledge(false)
                            .build(),
                    record -> dispatch(topic, List.of(toQueueMessage(record.getStream(), record.getId(),
                            record.getValue(), 0))));
        }

        listenerContainer.start();
        container = listenerContainer;
        log.info("Redis Stream consumer started for {} stream(s)", handlers.size());
    }

    @Override
    public synchronized void shutdown() {
        if (container == null) {
            return;
        }
        container.stop();
        container = null;
        log.info("Redis Stream consumer stopped");
    }

    @Override
    public void publish(String topic, byte[] body, Map<String, String> properties) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (properties != null) {
            properties.forEach((key, value) -> {
                if (BODY_FIELD.equals(key)) {
                    log.warn("Dropping property '{}' on {}: name is reserved", key, topic);
                } else {
                    fields.put(key, value);
                }
            });
        }
        fields.put(BODY_FIELD, encodeBody(topic, body));

        RecordId recordId;
        try {
            recordId = redisTemplate.opsForStream().add(topic, fields);
        } catch (DataAccessException e) {
            throw new QueueException("Failed to publish to " + topic + ": " + e.getMessage(), e);
        }
        if (recordId == null) {
            throw new QueueException("Failed to publish to " + topic + ": no record id returned");
        }
        log.debug("Published {} to {}", recordId, topic);
    }

    @Override
    public long depth(String topic) {
        try {
            Long size = redisTemplate.opsForStream().size(topic);
            return size != null ? size : 0;
        } catch (DataAccessException e) {
            throw new QueueException("Failed to read length of " + topic + ": " + e.getMessage(), e);
        }
    }

    /**
     * Claims entries that stayed unacknowledged longer than the idle threshold and hands
     * them to their handler again.
     */
    public void redeliverPending() {
        if (container == null) {
            return;
        }
        for (String topic : handlers.keySet()) {
            try {
                redeliverPending(topic);
            } catch (DataAccessException e) {
                log.error("Error during pending message recovery for {}: {}", topic, e.getMessage(), e);
            }
        }
    }

    /**
     * Walks the whole pending list of the group in pages of {@code recoverCount}, so entries
     * behind a window of repeatedly failing ones are still claimed and counted.
     */
    void redeliverPending(String topic) {
        StreamOperations<String, Object, Object> ops = redisTemplate.opsForStream();
        Range<String> range = Range.unbounded();
        List<QueueMessage> batch = new ArrayList<>();

        while (true) {
            PendingMessages pending = ops.pending(topic, groupName, range, recoverCount);
            if (pending == null || pending.isEmpty()) {
                break;
            }

            RecordId lastSeen = null;
            for (PendingMessage pm : pending) {
                lastSeen = pm.getId();
                Duration idle = pm.getElapsedTimeSinceLastDelivery();
                if (idle.compareTo(pendingIdle) < 0) {
                    continue;
                }
                List<MapRecord<String, Object, Object>> claimed = ops.claim(topic, groupName, consumerName,
                        pendingIdle, pm.getId());
                if (claimed == null || claimed.isEmpty()) {
                    log.debug("Pending entry {} on {} could not be claimed", pm.getId(), topic);
                    continue;
                }
                log.info("Redelivering pending message: id={}, idleTime={}ms, deliveryCount={}",
                        pm.getId(), idle.toMillis(), pm.getTotalDeliveryCount());

                // deliveries before this one, as counted by Redis
                int redeliveryCount = (int) Math.min(pm.getTotalDeliveryCount(), Integer.MAX_VALUE);
                for (MapRecord<String, Object, Object> record : claimed) {
                    batch.add(toQueueMessage(topic, record.getId(), record.getValue(), redeliveryCount));
                    if (batch.size() >= batchSize) {
                        dispatch(topic, List.copyOf(batch));
                        batch.clear();
                    }
                }
            }

            if (pending.size() < recoverCount || lastSeen == null) {
                break;
            }
            range = Range.rightUnbounded(Range.Bound.inclusive(successor(lastSeen)));
        }
        if (!batch.isEmpty()) {
            dispatch(topic, List.copyOf(batch));
        }
    }

    static String successor(RecordId id) {
        return RecordId.of(id.getTimestamp(), id.getSequence() + 1).getValue();
    }

    void dispatch(String topic, List<QueueMessage> batch) {
        MessageHandler handler = handlers.get(topic);
        if (handler == null) {
            log.warn("No handler for stream {}, leaving {} message(s) pending", topic, batch.size());
            return;
        }

        ConsumeDisposition disposition;
        try {
            disposition = handler.handle(batch);
        } catch (Exception e) {
            log.error("Handler failed for {} message(s) from {}: {}. Messages stay pending for redelivery.",
                    batch.size(), topic, e.getMessage(), e);
            disposition = ConsumeDisposition.RETRY_LATER;
        }

        if (disposition == ConsumeDisposition.ACKNOWLEDGE) {
            acknowledge(topic, batch);
        } else {
            log.debug("{} message(s) from {} left pending", batch.size(), topic);
        }
    }

    private void acknowledge(String topic, List<QueueMessage> batch) {
        String[] ids = batch.stream().map(QueueMessage::getId).toArray(String[]::new);
        try {
            redisTemplate.opsForStream().acknowledge(topic, groupName, ids);
            log.debug("Acknowledged {} on {}", String.join(",", ids), topic);
        } catch (DataAccessException e) {
            // unacknowledged entries come back through redeliverPending
            log.error("Failed to acknowledge {} on {}: {}", String.join(",", ids), topic, e.getMessage(), e);
        }
    }

    private void createGroup(String topic) {
        try (RedisConnection connection = connectionFactory.getConnection()) {
            connection.streamCommands().xGroupCreate(topic.getBytes(StandardCharsets.UTF_8), groupName,
                    ReadOffset.from("0"), true);
            log.info("Created consumer group {} on {}", groupName, topic);
        } catch (DataAccessException e) {
            String reason = String.valueOf(e.getMostSpecificCause().getMessage());
            if (!reason.contains("BUSYGROUP")) {
                throw new QueueException("Failed to create consumer group " + groupName + " on " + topic, e);
            }
            log.info("Consumer group {} already exists on {}", groupName, topic);
        }
    }

    /**
     * Stream fields are text: bytes that are not valid UTF-8 are replaced with U+FFFD.
     */
    static String encodeBody(String topic, byte[] body) {
        String text = new String(body, StandardCharsets.UTF_8);
        if (!Arrays.equals(text.getBytes(StandardCharsets.UTF_8), body)) {
            log.warn("Body published to {} is not valid UTF-8; invalid bytes were replaced", topic);
        }
        return text;
    }

    static QueueMessage toQueueMessage(String topic, RecordId id, Map<?, ?> values, int redeliveryCount) {
        Map<String, String> properties = new LinkedHashMap<>();
        String body = "";
        for (Map.Entry<?, ?> entry : values.entrySet()) {
            String key = String.valueOf(entry.getKey());
            String value = entry.getValue() != null ? entry.getValue().toString() : "";
            if (BODY_FIELD.equals(key)) {
                body = value;
            } else {
                properties.put(key, value);
            }
        }
        return QueueMessage.builder()
                .topic(topic)
                .id(id.getValue())
                .body(body.getBytes(StandardCharsets.UTF_8))
                .redeliveryCount(redeliveryCount)
                .properties(properties)
                .build();
    }
}

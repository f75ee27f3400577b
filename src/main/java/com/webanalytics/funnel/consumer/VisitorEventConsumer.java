package com.webanalytics.funnel.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webanalytics.funnel.metrics.Metrics;
import com.webanalytics.funnel.model.VisitorEvent;
import com.webanalytics.funnel.store.EventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Kafka consumer that appends visitor events to the event store.
 *
 * Offsets are committed manually after the event is stored, for at-least-once delivery.
 * Redelivered events are deduplicated by event id in the store.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VisitorEventConsumer {

    private final EventStore eventStore;
    private final ObjectMapper objectMapper;
    private final Metrics metrics;

    /**
     * Consume visitor events.
     *
     * - Parse JSON to VisitorEvent
     * - Drop (and acknowledge) records that cannot be parsed or lack a required field
     * - Append to the event store
     * - Acknowledge offset on success, rethrow on store failure so the record is redelivered
     */
    @KafkaListener(
        topics = "${kafka.topics.events:analytics_events}",
        groupId = "${kafka.consumer.group-id:funnel-analytics-group}",
        containerFactory = "visitorEventListenerContainerFactory",
        autoStartup = "${kafka.consumer.auto-startup:true}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        log.debug("Received visitor event from partition {} at offset {}",
            record.partition(), record.offset());

        VisitorEvent event;
        try {
            event = objectMapper.readValue(record.value(), VisitorEvent.class);
        } catch (JsonProcessingException e) {
            log.warn("Dropping unparseable visitor event from partition {} offset {}: {}",
                record.partition(), record.offset(), e.getOriginalMessage());
            metrics.onEventRejected();
            acknowledgment.acknowledge();
            return;
        }

        String missing = missingField(event);
        if (missing != null) {
            log.warn("Dropping visitor event from partition {} offset {}: missing {}",
                record.partition(), record.offset(), missing);
            metrics.onEventRejected();
            acknowledgment.acknowledge();
            return;
        }

        event.setPartition(record.partition());
        event.setOffset(record.offset());

        try {
            boolean stored = eventStore.append(event);
            if (stored) {
                metrics.onEventIngested();
            } else {
                log.debug("Duplicate visitor event {} ignored", event.getEventId());
            }
            acknowledgment.acknowledge();
        } catch (Exception e) {
            log.error("Error storing visitor event from partition {} offset {}: {}",
                record.partition(), record.offset(), record.value(), e);
            // Don't acknowledge - will be retried
            throw new RuntimeException("Failed to store visitor event", e);
        }
    }

    static String missingField(VisitorEvent event) {
        if (isBlank(event.getWebsiteId())) {
            return "website_id";
        }
        if (isBlank(event.getSessionId())) {
            return "session_id";
        }
        if (isBlank(event.getEventName())) {
            return "event_name";
        }
        if (event.getEventTime() == null) {
            return "event_time";
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

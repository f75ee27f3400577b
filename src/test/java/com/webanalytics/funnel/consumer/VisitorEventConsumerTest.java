package com.webanalytics.funnel.consumer;

import com.webanalytics.funnel.metrics.MetricsRegistry;
import com.webanalytics.funnel.model.VisitorEvent;
import com.webanalytics.funnel.store.EventStore;
import com.webanalytics.funnel.store.StorageException;
import com.webanalytics.funnel.testutil.TestFactory;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.support.Acknowledgment;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class VisitorEventConsumerTest {

    private static final String VALID = """
            {"event_id":"ev_1","website_id":"site_1","session_id":"sess_1","anonymous_id":"anon_1",
             "event_name":"screen_view","event_time":"2024-03-01T10:00:00","path":"/pricing",
             "referrer":"https://www.google.com/","country":"DE","properties":{"plan":"pro"},
             "unknown_field":"ignored"}
            """;

    private EventStore store;
    private MetricsRegistry metrics;
    private Acknowledgment ack;
    private VisitorEventConsumer consumer;

    @BeforeEach
    void setUp() {
        store = mock(EventStore.class);
        metrics = new MetricsRegistry();
        ack = mock(Acknowledgment.class);
        consumer = new VisitorEventConsumer(store, TestFactory.objectMapper(), metrics);
    }

    private static ConsumerRecord<String, String> record(String value) {
        return new ConsumerRecord<>("analytics_events", 2, 42L, "sess_1", value);
    }

    @Test
    void testValidEventIsStoredThenAcknowledged() {
        when(store.append(any())).thenReturn(true);

        consumer.consume(record(VALID), ack);

        ArgumentCaptor<VisitorEvent> captor = ArgumentCaptor.forClass(VisitorEvent.class);
        verify(store).append(captor.capture());
        VisitorEvent event = captor.getValue();
        assertThat(event.getSessionId()).isEqualTo("sess_1");
        assertThat(event.getEventTime()).isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
        assertThat(event.getProperties()).containsEntry("plan", "pro");
        assertThat(event.getPartition()).isEqualTo(2);
        assertThat(event.getOffset()).isEqualTo(42L);
        verify(ack).acknowledge();
        assertThat(metrics.snapshot().eventsIngested()).isEqualTo(1);
    }

    private VisitorEvent consumeWithEventTime(String eventTimeJson) {
        when(store.append(any())).thenReturn(true);
        consumer.consume(record(VALID.replace("\"2024-03-01T10:00:00\"", eventTimeJson)), ack);

        ArgumentCaptor<VisitorEvent> captor = ArgumentCaptor.forClass(VisitorEvent.class);
        verify(store).append(captor.capture());
        verify(ack).acknowledge();
        return captor.getValue();
    }

    @Test
    void testEpochMillisEventTime() {
        VisitorEvent event = consumeWithEventTime("1709287200123");

        assertThat(event.getEventTime()).isEqualTo(Instant.parse("2024-03-01T10:00:00.123Z"));
    }

    @Test
    void testUtcInstantEventTime() {
        VisitorEvent event = consumeWithEventTime("\"2024-03-01T10:00:00Z\"");

        assertThat(event.getEventTime()).isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
    }

    @Test
    void testInstantWithMillisEventTime() {
        VisitorEvent event = consumeWithEventTime("\"2024-03-01T10:00:00.123Z\"");

        assertThat(event.getEventTime()).isEqualTo(Instant.parse("2024-03-01T10:00:00.123Z"));
    }

    @Test
    void testTrackerFieldNamesAreAccepted() {
        when(store.append(any())).thenReturn(true);
        String tracked = """
                {"event_id":"ev_2","client_id":"site_1","session_id":"sess_9","event_name":"signup_clicked",
                 "time":1709287200123,"timestamp":1709287200123,"event_type":"track"}
                """;

        consumer.consume(record(tracked), ack);

        ArgumentCaptor<VisitorEvent> captor = ArgumentCaptor.forClass(VisitorEvent.class);
        verify(store).append(captor.capture());
        assertThat(captor.getValue().getWebsiteId()).isEqualTo("site_1");
        assertThat(captor.getValue().getEventTime()).isEqualTo(Instant.parse("2024-03-01T10:00:00.123Z"));
        verify(ack).acknowledge();
    }

    @Test
    void testUnparseableEventTimeIsRejected() {
        consumer.consume(record(VALID.replace("\"2024-03-01T10:00:00\"", "\"yesterday\"")), ack);

        verify(store, never()).append(any());
        verify(ack).acknowledge();
        assertThat(metrics.snapshot().eventsRejected()).isEqualTo(1);
    }

    @Test
    void testDuplicateIsAcknowledgedWithoutCounting() {
        when(store.append(any())).thenReturn(false);

        consumer.consume(record(VALID), ack);

        verify(ack).acknowledge();
        assertThat(metrics.snapshot().eventsIngested()).isZero();
    }

    @Test
    void testEventWithoutSessionIsDropped() {
        consumer.consume(record(VALID.replace("\"session_id\":\"sess_1\",", "")), ack);

        verify(store, never()).append(any());
        verify(ack).acknowledge();
        assertThat(metrics.snapshot().eventsRejected()).isEqualTo(1);
    }

    @Test
    void testMalformedJsonIsDropped() {
        consumer.consume(record("{not json"), ack);

        verify(store, never()).append(any());
        verify(ack).acknowledge();
        assertThat(metrics.snapshot().eventsRejected()).isEqualTo(1);
    }

    @Test
    void testStoreFailureIsNotAcknowledged() {
        when(store.append(any())).thenThrow(new StorageException("database is locked", null));

        assertThatThrownBy(() -> consumer.consume(record(VALID), ack))
                .isInstanceOf(RuntimeException.class)
                .hasMessage("Failed to store visitor event");
        verify(ack, never()).acknowledge();
    }

    @Test
    void testMissingFieldNames() {
        VisitorEvent event = TestFactory.event("s1", "signup", Instant.now());
        assertThat(VisitorEventConsumer.missingField(event)).isNull();

        event.setEventName(" ");
        assertThat(VisitorEventConsumer.missingField(event)).isEqualTo("event_name");

        event.setWebsiteId(null);
        assertThat(VisitorEventConsumer.missingField(event)).isEqualTo("website_id");
    }
}

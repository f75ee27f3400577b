package com.webanalytics.funnel.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Reads an event timestamp sent by trackers in any of the forms they use:
 * epoch milliseconds (number or digit string), an ISO-8601 instant with offset
 * ({@code 2024-03-01T10:00:00.123Z}) or a local date-time taken as UTC
 * ({@code 2024-03-01T10:00:00}).
 */
public class EventTimeDeserializer extends StdDeserializer<Instant> {

    public EventTimeDeserializer() {
        super(Instant.class);
    }

    @Override
    public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken token = p.currentToken();
        if (token == JsonToken.VALUE_NUMBER_INT) {
            return Instant.ofEpochMilli(p.getLongValue());
        }
        if (token == JsonToken.VALUE_NUMBER_FLOAT) {
            return Instant.ofEpochMilli((long) p.getDoubleValue());
        }
        if (token != JsonToken.VALUE_STRING) {
            return (Instant) ctxt.handleUnexpectedToken(Instant.class, p);
        }

        String text = p.getText().trim();
        if (text.isEmpty()) {
            return null;
        }
        if (text.length() <= 18 && text.chars().allMatch(Character::isDigit)) {
            return Instant.ofEpochMilli(Long.parseLong(text));
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException local) {
                return (Instant) ctxt.handleWeirdStringValue(Instant.class, text,
                        "expected epoch millis or an ISO-8601 timestamp");
            }
        }
    }
}

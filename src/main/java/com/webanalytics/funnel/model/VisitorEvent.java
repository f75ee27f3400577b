package com.webanalytics.funnel.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * A recorded visitor event, as ingested from the events topic and stored in the event store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VisitorEvent {

    /** Event name under which page views are recorded. */
    public static final String PAGE_VIEW_EVENT = "screen_view";

    @JsonProperty("event_id")
    private String eventId;

    @JsonProperty("website_id")
    @JsonAlias("client_id")
    private String websiteId;

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("anonymous_id")
    private String anonymousId;

    @JsonProperty("event_name")
    private String eventName;

    @JsonProperty("event_time")
    @JsonAlias("time")
    @JsonDeserialize(using = EventTimeDeserializer.class)
    private Instant eventTime;

    @JsonProperty("path")
    private String path;

    @JsonProperty("referrer")
    private String referrer;

    @JsonProperty("country")
    private String country;

    @JsonProperty("city")
    private String city;

    @JsonProperty("device_type")
    private String deviceType;

    @JsonProperty("browser_name")
    private String browserName;

    @JsonProperty("os_name")
    private String osName;

    @JsonProperty("language")
    private String language;

    @JsonProperty("screen_resolution")
    private String screenResolution;

    @JsonProperty("utm_source")
    private String utmSource;

    @JsonProperty("utm_medium")
    private String utmMedium;

    @JsonProperty("utm_campaign")
    private String utmCampaign;

    @JsonProperty("utm_term")
    private String utmTerm;

    @JsonProperty("utm_content")
    private String utmContent;

    @JsonProperty("properties")
    private Map<String, Object> properties;

    // Metadata fields for processing
    private transient int partition;
    private transient long offset;
}

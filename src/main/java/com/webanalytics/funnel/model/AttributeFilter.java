package com.webanalytics.funnel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Declarative restriction applied to every step query of a funnel.
 *
 * The operator is kept as the raw wire string so that operators this build does not know
 * about survive a round trip through storage and can be skipped at compile time.
 * The value is either a single string or a list of strings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttributeFilter {

    @JsonProperty("field")
    private String field;

    @JsonProperty("operator")
    private String operator;

    @JsonProperty("value")
    private Object value;

    public static AttributeFilter of(String field, String operator, String value) {
        return new AttributeFilter(field, operator, value);
    }

    public static AttributeFilter of(String field, String operator, List<String> values) {
        return new AttributeFilter(field, operator, values);
    }
}

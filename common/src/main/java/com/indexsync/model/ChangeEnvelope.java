package com.indexsync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Debezium change envelope as produced by the JSON converter.
 *
 * <p>Row snapshots are kept as {@link JsonNode} so that an absent snapshot,
 * an explicit {@code null} and a snapshot that does not bind to the entity
 * can be told apart when the envelope is decoded.</p>
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChangeEnvelope {

    private Payload payload;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Payload {
        private JsonNode before;
        private JsonNode after;
        private Source source;
        private String op;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Source {
        @JsonProperty("ts_ms")
        private Long tsMs;
        private String connector;
        private String db;
        private String schema;
        private String table;
        private Long txId;
        private Long lsn;
    }
}

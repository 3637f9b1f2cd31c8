package com.indexsync.categories.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.indexsync.error.ErrorCode;
import com.indexsync.error.SyncException;
import com.indexsync.model.SyncStatus;
import com.indexsync.serde.JsonMappers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Category Tests")
class CategoryTest {

    private final ObjectMapper mapper = JsonMappers.create();

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("A named category with a non-negative status is valid")
        void valid() {
            Category category = Category.builder().id("c1").name("Pulsa").status(1).build();

            assertThatCode(category::validate).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("The name is required")
        void nameRequired() {
            Category category = Category.builder().id("c1").name("").status(1).build();

            assertThatThrownBy(category::validate)
                    .isInstanceOfSatisfying(SyncException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.VALIDATION_FAILED))
                    .hasMessageContaining("name");
        }

        @Test
        @DisplayName("A negative status is rejected")
        void negativeStatus() {
            Category category = Category.builder().id("c1").name("Pulsa").status(-1).build();

            assertThatThrownBy(category::validate).hasMessageContaining("status");
        }
    }

    @Nested
    @DisplayName("JSON")
    class Json {

        @Test
        @DisplayName("Binds a captured row, ignoring columns it does not know")
        void bindsRow() throws Exception {
            String row = "{\"id\":\"c1\",\"name\":\"Pulsa\",\"description\":\"Mobile credit\",\"status\":1,"
                    + "\"created_at\":\"2025-04-01T00:00:00Z\",\"updated_at\":\"2025-04-02T08:30:00Z\","
                    + "\"version\":3,\"tenant\":\"id\"}";

            Category category = mapper.readValue(row, Category.class);

            assertThat(category.getId()).isEqualTo("c1");
            assertThat(category.getDescription()).isEqualTo("Mobile credit");
            assertThat(category.getCreatedAt()).isEqualTo(Instant.parse("2025-04-01T00:00:00Z"));
            assertThat(category.getUpdatedAt()).isEqualTo(Instant.parse("2025-04-02T08:30:00Z"));
            assertThat(category.getVersion()).isEqualTo(3);
            assertThat(category.getSyncStatus()).isNull();
        }

        @Test
        @DisplayName("A synced category is written with snake_case sync fields")
        void writesSyncFields() {
            Category category = Category.builder().id("c1").name("Pulsa").status(1).build();
            category.markSynced(Instant.parse("2025-04-15T10:00:00Z"));

            JsonNode doc = mapper.valueToTree(category);

            assertThat(category.getSyncStatus()).isEqualTo(SyncStatus.SUCCESS);
            assertThat(doc.get("sync_status").asText()).isEqualTo("SUCCESS");
            assertThat(doc.get("last_sync").asText()).isEqualTo("2025-04-15T10:00:00Z");
            assertThat(doc.has("lastSyncedAt")).isFalse();
        }
    }
}

package com.minicall.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class JacksonConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
            .withUserConfiguration(JacksonConfig.class);

    @Test
    void idLongFieldsSerializedAsStringButNonIdLongFieldsRemainNumber() {
        contextRunner.run(ctx -> {
            ObjectMapper objectMapper = ctx.getBean(ObjectMapper.class);

            String json = objectMapper.writeValueAsString(
                    new Payload(123L, 2004874454540382209L, 9007199254740992L, 42L, 1024L, 1700000000000L));
            JsonNode node = objectMapper.readTree(json);

            assertThat(node.get("id").isTextual()).isTrue();
            assertThat(node.get("peerUserId").isTextual()).isTrue();
            assertThat(node.get("from").isTextual()).isTrue();
            assertThat(node.get("durationSeconds").isNumber()).isTrue();
            assertThat(node.get("sizeBytes").isNumber()).isTrue();
            assertThat(node.get("ts").isNumber()).isTrue();
        });
    }

    @Test
    void datesSerializedAsIsoStrings() {
        contextRunner.run(ctx -> {
            ObjectMapper objectMapper = ctx.getBean(ObjectMapper.class);
            JsonNode node = objectMapper.readTree(objectMapper.writeValueAsString(
                    new Timed(LocalDateTime.of(2024, 5, 1, 12, 30, 0))));

            assertThat(node.get("startTime").isTextual()).isTrue();
            assertThat(node.get("startTime").asText()).startsWith("2024-05-01T12:30");
        });
    }

    record Payload(long id, long peerUserId, long from, long durationSeconds, long sizeBytes, long ts) {
    }

    record Timed(LocalDateTime startTime) {
    }
}

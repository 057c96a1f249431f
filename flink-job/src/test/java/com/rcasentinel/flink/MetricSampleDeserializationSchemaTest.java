package com.rcasentinel.flink;

import com.rcasentinel.core.model.MetricSample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MetricSampleDeserializationSchema}.
 */
class MetricSampleDeserializationSchemaTest {

    private final MetricSampleDeserializationSchema schema = new MetricSampleDeserializationSchema();

    @Test
    @DisplayName("Should parse a complete sample")
    void shouldParseSample() {
        MetricSample sample = schema.deserialize(bytes(
                "{\"metric\":\"cpu_usage\",\"timestamp\":1700000000.5,\"value\":0.42,\"scope\":\"checkout\"}"));

        assertThat(sample).isNotNull();
        assertThat(sample.getMetric()).isEqualTo("cpu_usage");
        assertThat(sample.getTimestamp()).isEqualTo(1_700_000_000.5);
        assertThat(sample.getValue()).isEqualTo(0.42);
        assertThat(sample.resolvedScope()).isEqualTo("checkout");
    }

    @Test
    @DisplayName("Should default the scope and keep a missing value as NaN")
    void shouldDefaultScopeAndValue() {
        MetricSample sample = schema.deserialize(bytes(
                "{\"metric\":\"memory_usage\",\"timestamp\":1700000060,\"host\":\"node-1\"}"));

        assertThat(sample).isNotNull();
        assertThat(sample.resolvedScope()).isEqualTo(MetricSample.DEFAULT_SCOPE);
        assertThat(sample.getValue()).isNaN();
    }

    @Test
    @DisplayName("Should drop malformed JSON")
    void shouldDropMalformedJson() {
        assertThat(schema.deserialize(bytes("{not json"))).isNull();
    }

    @Test
    @DisplayName("Should drop samples without a metric name")
    void shouldDropNamelessSample() {
        assertThat(schema.deserialize(bytes("{\"timestamp\":1700000000,\"value\":1.0}"))).isNull();
    }

    @Test
    @DisplayName("Should drop empty payloads")
    void shouldDropEmptyPayload() {
        assertThat(schema.deserialize(new byte[0])).isNull();
        assertThat(schema.deserialize(null)).isNull();
    }

    @Test
    @DisplayName("Should never signal end of stream")
    void shouldNeverEndStream() {
        assertThat(schema.isEndOfStream(new MetricSample("cpu_usage", 0, 1))).isFalse();
        assertThat(schema.getProducedType().getTypeClass()).isEqualTo(MetricSample.class);
    }

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}

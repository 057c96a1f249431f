package com.rcasentinel.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rcasentinel.core.model.MetricSample;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes into a
 * {@link MetricSample}.
 * <p>
 * Expected record: {@code {"metric": "cpu_usage", "timestamp": 1700000000,
 * "value": 0.42, "scope": "checkout"}} with the timestamp in epoch seconds.
 * Malformed or unusable records are logged and dropped (returns
 * {@code null}), so one bad record never fails the pipeline.
 * </p>
 */
public class MetricSampleDeserializationSchema implements DeserializationSchema<MetricSample> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MetricSampleDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public MetricSample deserialize(byte[] message) {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            MetricSample sample = objectMapper().readValue(message, MetricSample.class);
            if (sample == null || !sample.isUsable()) {
                LOG.warn("Dropping metric sample without a name or a finite timestamp: {}", sample);
                return null;
            }
            return sample;
        } catch (Exception e) {
            LOG.warn("Failed to deserialize metric sample - skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(MetricSample nextElement) {
        return false;
    }

    @Override
    public TypeInformation<MetricSample> getProducedType() {
        return TypeInformation.of(MetricSample.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}

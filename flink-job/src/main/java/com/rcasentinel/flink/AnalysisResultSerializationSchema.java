package com.rcasentinel.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.rcasentinel.core.model.AnalysisResult;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link SerializationSchema} that converts an {@link AnalysisResult}
 * into JSON bytes for the Kafka result topic. Instants are written as
 * ISO-8601 strings.
 */
public class AnalysisResultSerializationSchema implements SerializationSchema<AnalysisResult> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AnalysisResultSerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(AnalysisResult result) {
        try {
            return objectMapper().writeValueAsBytes(result);
        } catch (Exception e) {
            LOG.error("Failed to serialize analysis result: {}", e.getMessage(), e);
            return new byte[0];
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}

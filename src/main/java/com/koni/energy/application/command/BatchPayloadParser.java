package com.koni.energy.application.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.koni.energy.domain.exception.MalformedBatchException;
import com.koni.energy.domain.model.RawReading;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw batch contents into untrusted readings.
 * Only the outer shape is checked here: the contents must be a JSON array.
 * Each element is validated individually afterwards.
 */
@Component
public class BatchPayloadParser {

    private final ObjectReader reader;

    public BatchPayloadParser(ObjectMapper objectMapper) {
        // energy values are read as BigDecimal, never double
        this.reader = objectMapper.reader().with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    /**
     * @param batchLocator the batch being parsed, used for error reporting
     * @param content the raw batch contents
     * @return one raw reading per array element, in order
     * @throws MalformedBatchException if the contents are not a JSON array
     */
    public List<RawReading> parse(String batchLocator, String content) {
        if (content == null || content.isBlank()) {
            throw new MalformedBatchException(batchLocator, "batch is empty");
        }
        JsonNode root;
        try {
            root = reader.readTree(content);
        } catch (JsonProcessingException e) {
            throw new MalformedBatchException(batchLocator, "batch is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new MalformedBatchException(batchLocator, "batch must be a JSON array");
        }
        List<RawReading> readings = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            readings.add(RawReading.fromJson(i, root.get(i)));
        }
        return readings;
    }
}

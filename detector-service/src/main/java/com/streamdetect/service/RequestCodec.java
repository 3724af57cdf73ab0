package com.streamdetect.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.streamdetect.core.model.Record;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON codec for the snake_case request/response contract.
 *
 * <p>
 * Unknown request properties are ignored so that older clients keep working
 * when fields are added.
 * </p>
 */
public final class RequestCodec {

    private final ObjectMapper mapper;

    public RequestCodec() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @throws IllegalArgumentException if {@code json} is not a valid request
     */
    public StreamIngestRequest readRequest(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Request body must not be empty");
        }
        try {
            return mapper.readValue(json, StreamIngestRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed ingest request: " + e.getOriginalMessage(), e);
        }
    }

    public String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Turn the {@code data} node of a request into records.
     *
     * <p>
     * Accepted shapes: a record object, a list of record objects, a list of
     * numbers (one positional record) and a list of number lists. Each element
     * is parsed on its own: an element that is not a valid record is reported
     * in {@link ParsedData#getRejected()} under its batch position and does not
     * affect the others.
     * </p>
     *
     * @throws IllegalArgumentException if {@code data} is missing or is not
     *                                  one of the accepted shapes
     */
    public ParsedData parseData(JsonNode data) {
        if (data == null || data.isNull() || data.isMissingNode()) {
            throw new IllegalArgumentException("'data' is required");
        }
        List<Record> records = new ArrayList<>();
        Map<Integer, String> rejected = new TreeMap<>();
        if (data.isObject()) {
            parseElement(0, data, records, rejected);
            return new ParsedData(records, rejected);
        }
        if (!data.isArray()) {
            throw new IllegalArgumentException("'data' must be a record, a list of records, "
                    + "a list of numbers or a list of number lists");
        }
        if (!data.isEmpty() && data.get(0).isNumber()) {
            parseElement(0, data, records, rejected);
            return new ParsedData(records, rejected);
        }
        for (int i = 0; i < data.size(); i++) {
            parseElement(i, data.get(i), records, rejected);
        }
        return new ParsedData(records, rejected);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void parseElement(int position, JsonNode element, List<Record> records,
            Map<Integer, String> rejected) {
        try {
            if (element.isObject()) {
                records.add(toRecord(element));
            } else if (element.isArray()) {
                records.add(toPositionalRecord(element));
            } else {
                rejected.put(position, "Unsupported element in 'data': " + element.getNodeType());
            }
        } catch (IllegalArgumentException e) {
            rejected.put(position, e.getMessage());
        }
    }

    private static Record toRecord(JsonNode node) {
        Map<String, Object> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            fields.put(field.getKey(), scalar(field.getKey(), field.getValue()));
        }
        return Record.of(fields);
    }

    private static Record toPositionalRecord(JsonNode array) {
        List<Double> values = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            if (!element.isNumber()) {
                throw new IllegalArgumentException("Positional records must contain only numbers, got: "
                        + element.getNodeType());
            }
            values.add(element.doubleValue());
        }
        return Record.ofValues(values);
    }

    private static Object scalar(String field, JsonNode value) {
        if (value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.numberValue();
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        throw new IllegalArgumentException("Field '" + field + "' must be a number, string or boolean, got: "
                + value.getNodeType());
    }
}

package com.tapas.superstore.etl.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.tapas.superstore.etl.exception.MalformedRecordException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a base64 message body into flat records: base64, then strict UTF-8, then
 * JSON. The JSON is one record object or an array of them.
 */
public class MessageDecoder {

    private final ObjectReader reader;

    public MessageDecoder(ObjectMapper objectMapper) {
        this.reader = objectMapper.readerFor(Object.class)
                .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    public List<Map<String, Object>> decode(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new MalformedRecordException("Message body is empty");
        }

        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            throw new MalformedRecordException("Message body is not valid base64", e);
        }

        String json;
        try {
            json = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new MalformedRecordException("Message body is not valid UTF-8", e);
        }

        Object root;
        try {
            root = reader.readValue(json);
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException("Message body is not valid JSON: " + e.getOriginalMessage(), e);
        }

        if (root instanceof Map<?, ?> object) {
            return List.of(toRecord(object));
        }
        if (root instanceof List<?> array && !array.isEmpty()) {
            var records = new ArrayList<Map<String, Object>>(array.size());
            for (Object element : array) {
                if (!(element instanceof Map<?, ?> object)) {
                    throw new MalformedRecordException("Every array element must be a JSON object");
                }
                records.add(toRecord(object));
            }
            return records;
        }
        throw new MalformedRecordException("Expected a JSON object or a non-empty array of objects");
    }

    private static Map<String, Object> toRecord(Map<?, ?> object) {
        var record = new LinkedHashMap<String, Object>();
        object.forEach((key, value) -> record.put(String.valueOf(key), value));
        return record;
    }
}

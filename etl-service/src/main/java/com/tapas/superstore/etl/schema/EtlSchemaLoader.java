package com.tapas.superstore.etl.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Reads the JSON schema document and validates it.
 */
public class EtlSchemaLoader {

    private static final Logger log = LoggerFactory.getLogger(EtlSchemaLoader.class);

    private final ObjectMapper objectMapper;

    public EtlSchemaLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public EtlSchema load(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            EtlSchema schema = objectMapper.readValue(in, EtlSchema.class).validate();
            log.info("Loaded schema {} from {}: {} fields, {} entities, {} relationships, {} features",
                    schema.name(),
                    resource.getDescription(),
                    schema.fields().size(),
                    schema.entities().size(),
                    schema.relationships().size(),
                    schema.features().size());
            return schema;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read schema from " + resource.getDescription(), e);
        }
    }
}

package com.tapas.superstore.etl.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tapas.superstore.etl.feature.AggregationPrimitive;
import com.tapas.superstore.etl.feature.DatePartPrimitive;
import com.tapas.superstore.etl.feature.EnrichmentMerger;
import com.tapas.superstore.etl.feature.FeatureDerivationEngine;
import com.tapas.superstore.etl.feature.FeatureSelector;
import com.tapas.superstore.etl.graph.EntityGraphBuilder;
import com.tapas.superstore.etl.graph.ReferentialIntegrity;
import com.tapas.superstore.etl.normalize.RecordNormalizer;
import com.tapas.superstore.etl.schema.EtlSchema;
import com.tapas.superstore.etl.schema.EtlSchemaLoader;
import com.tapas.superstore.etl.service.MessageDecoder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.time.Clock;
import java.util.List;

/**
 * Wires the transformation stages around the one schema document they share.
 */
@Configuration
public class EtlConfig {

    @Value("${etl.schema-location:classpath:schema/superstore-schema.json}")
    private Resource schemaLocation;

    @Value("${etl.referential-integrity:null-joinable}")
    private String referentialIntegrity;

    @Value("${etl.parallel-aggregation:false}")
    private boolean parallelAggregation;

    @Bean
    public EtlSchema etlSchema(ObjectMapper objectMapper) {
        return new EtlSchemaLoader(objectMapper).load(schemaLocation);
    }

    @Bean
    public MessageDecoder messageDecoder(ObjectMapper objectMapper) {
        return new MessageDecoder(objectMapper);
    }

    @Bean
    public RecordNormalizer recordNormalizer(EtlSchema etlSchema) {
        return new RecordNormalizer(etlSchema);
    }

    @Bean
    public EntityGraphBuilder entityGraphBuilder() {
        return new EntityGraphBuilder(ReferentialIntegrity.fromProperty(referentialIntegrity));
    }

    @Bean
    public FeatureDerivationEngine featureDerivationEngine() {
        return new FeatureDerivationEngine(
                List.of(AggregationPrimitive.values()),
                List.of(DatePartPrimitive.values()),
                parallelAggregation);
    }

    @Bean
    public FeatureSelector featureSelector(EtlSchema etlSchema) {
        return new FeatureSelector(etlSchema.features());
    }

    @Bean
    public EnrichmentMerger enrichmentMerger() {
        return new EnrichmentMerger();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

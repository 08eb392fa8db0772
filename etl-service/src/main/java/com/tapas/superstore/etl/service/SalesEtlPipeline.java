package com.tapas.superstore.etl.service;

import com.tapas.superstore.etl.domain.EntityFrame;
import com.tapas.superstore.etl.domain.NormalizedBatch;
import com.tapas.superstore.etl.domain.WarehouseTable;
import com.tapas.superstore.etl.exception.EtlException;
import com.tapas.superstore.etl.feature.EnrichmentMerger;
import com.tapas.superstore.etl.feature.FeatureDerivationEngine;
import com.tapas.superstore.etl.feature.FeatureMatrix;
import com.tapas.superstore.etl.feature.FeatureSelector;
import com.tapas.superstore.etl.graph.EntityGraph;
import com.tapas.superstore.etl.graph.EntityGraphBuilder;
import com.tapas.superstore.etl.normalize.RecordNormalizer;
import com.tapas.superstore.etl.repository.ProcessedMessage;
import com.tapas.superstore.etl.repository.ProcessedMessageStore;
import com.tapas.superstore.etl.repository.WarehouseSink;
import com.tapas.superstore.etl.schema.EntityDefinition;
import com.tapas.superstore.etl.schema.EtlSchema;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one inbound message end to end: normalize, build the entity graph,
 * derive and select features, enrich the fact table and append all tables.
 * <p>
 * Nothing is written until the whole batch has been transformed, and success is
 * only reported once every table is in the warehouse. Each table is appended in
 * the same transaction as its processed-message marker.
 */
@Service
public class SalesEtlPipeline {

    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(SalesEtlPipeline.class);

    private final EtlSchema schema;
    private final MessageDecoder decoder;
    private final RecordNormalizer normalizer;
    private final EntityGraphBuilder graphBuilder;
    private final FeatureDerivationEngine engine;
    private final FeatureSelector selector;
    private final EnrichmentMerger merger;
    private final WarehouseSink sink;
    private final ProcessedMessageStore processedStore;
    private final TransactionOperations transactions;
    private final Clock clock;

    public SalesEtlPipeline(
            EtlSchema schema,
            MessageDecoder decoder,
            RecordNormalizer normalizer,
            EntityGraphBuilder graphBuilder,
            FeatureDerivationEngine engine,
            FeatureSelector selector,
            EnrichmentMerger merger,
            WarehouseSink sink,
            ProcessedMessageStore processedStore,
            @Qualifier("warehouseTransactions") TransactionOperations transactions,
            Clock clock) {
        this.schema = schema;
        this.decoder = decoder;
        this.normalizer = normalizer;
        this.graphBuilder = graphBuilder;
        this.engine = engine;
        this.selector = selector;
        this.merger = merger;
        this.sink = sink;
        this.processedStore = processedStore;
        this.transactions = transactions;
        this.clock = clock;
    }

    /**
     * Decodes a base64 message body and processes it. Decode failures are
     * reported as a rejected outcome.
     */
    public EtlOutcome process(String messageId, String encodedBody) {
        List<Map<String, Object>> records;
        try {
            records = decoder.decode(encodedBody);
        } catch (EtlException e) {
            logger.error("Rejecting message {}: {}", messageId, e.getMessage());
            return EtlOutcome.rejected(messageId, e);
        }
        logger.debug("Decoded message {} into {} record(s)", messageId, records.size());
        return process(new EtlRequest(messageId, records));
    }

    public EtlOutcome process(EtlRequest request) {
        String messageId = request.messageId();
        var appended = new LinkedHashMap<String, Integer>();
        try {
            List<WarehouseTable> tables = transform(request.records());

            Set<String> alreadyAppended = processedStore.findProcessedTables(messageId);
            for (WarehouseTable table : tables) {
                if (alreadyAppended.contains(table.name())) {
                    logger.info("Skipping {} for message {}: appended by an earlier delivery",
                            table.name(), messageId);
                    continue;
                }
                transactions.executeWithoutResult(status -> {
                    sink.append(table);
                    processedStore.save(new ProcessedMessage(messageId, table.name(), clock.instant()));
                });
                appended.put(table.name(), table.rows().size());
            }

            if (appended.isEmpty()) {
                logger.info("Message {} was already fully processed", messageId);
                return EtlOutcome.duplicate(messageId);
            }
            logger.info("Processed message {}: appended {}", messageId, appended);
            return EtlOutcome.succeeded(messageId, appended);

        } catch (EtlException e) {
            if (e.isRetryable()) {
                logger.error("Failed to process message {} after appending {}, will retry",
                        messageId, appended.keySet(), e);
                return EtlOutcome.retryable(messageId, appended, e);
            }
            logger.error("Rejecting message {}: {}", messageId, e.getMessage());
            return EtlOutcome.rejected(messageId, e);
        } catch (RuntimeException e) {
            logger.error("Unexpected failure processing message {}, will retry", messageId, e);
            return EtlOutcome.retryable(messageId, appended, e);
        }
    }

    /**
     * Builds every warehouse table for a batch without writing anything.
     * Tables come back in schema order with the target entity enriched.
     */
    public List<WarehouseTable> transform(List<Map<String, Object>> records) {
        NormalizedBatch batch = normalizer.normalize(records);
        EntityGraph graph = graphBuilder.build(batch, schema.relationships());

        String target = schema.target().entity();
        FeatureMatrix features = engine.derive(graph, target, schema.target().maxDepth());
        FeatureMatrix selected = selector.select(features);

        var tables = new ArrayList<WarehouseTable>();
        for (EntityDefinition entity : schema.entities()) {
            EntityFrame frame = batch.frame(entity.name());
            tables.add(entity.name().equals(target)
                    ? merger.merge(frame, selected)
                    : frame.toWarehouseTable());
        }
        return tables;
    }
}

package com.tapas.superstore.etl.consumer;

import com.tapas.superstore.etl.exception.MalformedRecordException;
import com.tapas.superstore.etl.exception.SinkWriteException;
import com.tapas.superstore.etl.service.EtlOutcome;
import com.tapas.superstore.etl.service.SalesEtlPipeline;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.listener.BatchListenerFailedException;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SalesRecordConsumerTest {

    private SalesEtlPipeline pipeline;
    private SalesRecordConsumer consumer;

    @BeforeEach
    void setUp() {
        pipeline = mock(SalesEtlPipeline.class);
        consumer = new SalesRecordConsumer(pipeline);
    }

    private static ConsumerRecord<String, String> message(long offset, String value) {
        return new ConsumerRecord<>("superstore-sales", 0, offset, null, value);
    }

    @Test
    void processesEveryMessageOfThePoll() {
        when(pipeline.process("superstore-sales-0@10", "a")).thenReturn(EtlOutcome.succeeded("m", Map.of("Orders", 1)));
        when(pipeline.process("superstore-sales-0@11", "b")).thenReturn(EtlOutcome.duplicate("m"));

        consumer.consume(List.of(message(10, "a"), message(11, "b")));

        verify(pipeline).process("superstore-sales-0@10", "a");
        verify(pipeline).process("superstore-sales-0@11", "b");
    }

    @Test
    void poisonMessageIsSkipped() {
        when(pipeline.process("superstore-sales-0@10", "bad"))
                .thenReturn(EtlOutcome.rejected("m", new MalformedRecordException("Message body is not valid base64")));
        when(pipeline.process("superstore-sales-0@11", "good"))
                .thenReturn(EtlOutcome.succeeded("m", Map.of("Orders", 1)));

        assertDoesNotThrow(() -> consumer.consume(List.of(message(10, "bad"), message(11, "good"))));

        verify(pipeline).process("superstore-sales-0@11", "good");
    }

    @Test
    void transientFailureStopsAtTheFailedMessage() {
        var failure = new SinkWriteException("Ecommerce_DW.Orders", new IllegalStateException("down"));
        when(pipeline.process("superstore-sales-0@10", "a")).thenReturn(EtlOutcome.succeeded("m", Map.of("Orders", 1)));
        when(pipeline.process("superstore-sales-0@11", "b")).thenReturn(EtlOutcome.retryable("m", Map.of(), failure));

        var ex = assertThrows(BatchListenerFailedException.class,
                () -> consumer.consume(List.of(message(10, "a"), message(11, "b"), message(12, "c"))));

        assertEquals(1, ex.getIndex());
        assertSame(failure, ex.getCause());
        verify(pipeline, never()).process("superstore-sales-0@12", "c");
    }

    @Test
    void messageIdIsTopicPartitionOffset() {
        assertEquals("superstore-sales-3@99",
                SalesRecordConsumer.messageId(new ConsumerRecord<>("superstore-sales", 3, 99L, "k", "v")));
    }
}

package com.tapas.superstore.etl.config;

import com.tapas.superstore.etl.exception.DanglingReferenceException;
import com.tapas.superstore.etl.exception.FeatureComputationException;
import com.tapas.superstore.etl.exception.MalformedRecordException;
import com.tapas.superstore.etl.exception.MissingFeatureException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

@Configuration
public class KafkaConsumerConfig {

    @Value("${etl.kafka.retry-interval-ms:2000}")
    private long retryIntervalMs;

    @Value("${etl.kafka.max-retries:5}")
    private long maxRetries;

    @Bean
    public ConsumerFactory<String, String> consumerFactory(
            KafkaProperties kafkaProperties) {
        return new DefaultKafkaConsumerFactory<>(
                kafkaProperties.buildConsumerProperties());
    }

    @Bean
    public DefaultErrorHandler kafkaErrorHandler() {
        DefaultErrorHandler errorHandler =
                new DefaultErrorHandler(new FixedBackOff(retryIntervalMs, maxRetries));
        errorHandler.addNotRetryableExceptions(
                MalformedRecordException.class,
                DanglingReferenceException.class,
                FeatureComputationException.class,
                MissingFeatureException.class);
        return errorHandler;
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, String> kafkaListenerContainerFactory(
            ConsumerFactory<String, String> consumerFactory,
            DefaultErrorHandler kafkaErrorHandler) {

        ConcurrentKafkaListenerContainerFactory<String, String> factory = new ConcurrentKafkaListenerContainerFactory<>();

        factory.setConsumerFactory(consumerFactory);
        factory.setConcurrency(1); // keep per-partition order deterministic
        factory.setBatchListener(true);
        factory.setCommonErrorHandler(kafkaErrorHandler);

        return factory;
    }
}

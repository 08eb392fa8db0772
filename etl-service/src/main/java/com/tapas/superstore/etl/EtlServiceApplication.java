package com.tapas.superstore.etl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.kafka.annotation.EnableKafka;


@EnableKafka
@SpringBootApplication
public class EtlServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(EtlServiceApplication.class, args);
    }
}

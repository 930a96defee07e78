package io.github.drompincen.synapsehub.gateway.config;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

import java.time.Clock;

/** Message inserts and their task updates commit together, which needs a replica set. */
@Configuration
@EntityScan(basePackages = "io.github.drompincen.synapsehub.persistence.document")
@EnableMongoRepositories(basePackages = "io.github.drompincen.synapsehub.persistence.repository")
public class MongoConfig {

    @Bean
    MongoTransactionManager transactionManager(MongoDatabaseFactory databaseFactory) {
        return new MongoTransactionManager(databaseFactory);
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}

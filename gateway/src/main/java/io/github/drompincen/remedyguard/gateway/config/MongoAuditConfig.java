package io.github.drompincen.remedyguard.gateway.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@Configuration
@ConditionalOnProperty(name = "remedyguard.audit.sink", havingValue = "mongo")
@EnableMongoRepositories(basePackages = "io.github.drompincen.remedyguard.persistence.repository")
public class MongoAuditConfig {
}

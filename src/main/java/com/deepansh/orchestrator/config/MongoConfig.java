package com.deepansh.orchestrator.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Enable MongoDB auditing so @CreatedDate and @LastModifiedDate
 * are populated on stored plans and run traces.
 */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = {
    "com.deepansh.orchestrator.plan",
    "com.deepansh.orchestrator.observability"
})
public class MongoConfig {
}

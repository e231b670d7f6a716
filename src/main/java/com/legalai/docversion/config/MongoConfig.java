package com.legalai.docversion.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.AbstractMongoClientConfiguration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

import java.util.concurrent.TimeUnit;

/**
 * Mongo client for the version store. Pool and socket limits come from
 * {@code versioning.mongo.*}; index creation stays on so the unique
 * (documentId, versionNumber) index exists before the first write.
 */
@Configuration
@EnableMongoRepositories(basePackages = "com.legalai.docversion.repository")
public class MongoConfig extends AbstractMongoClientConfiguration {

    private final String uri;
    private final String database;
    private final boolean autoIndexCreation;
    private final int maxPoolSize;
    private final int minPoolSize;
    private final int timeoutSeconds;

    public MongoConfig(@Value("${spring.data.mongodb.uri}") String uri,
                       @Value("${spring.data.mongodb.database}") String database,
                       @Value("${spring.data.mongodb.auto-index-creation:true}") boolean autoIndexCreation,
                       @Value("${versioning.mongo.max-pool-size:50}") int maxPoolSize,
                       @Value("${versioning.mongo.min-pool-size:5}") int minPoolSize,
                       @Value("${versioning.mongo.timeout-seconds:10}") int timeoutSeconds) {
        this.uri = uri;
        this.database = database;
        this.autoIndexCreation = autoIndexCreation;
        this.maxPoolSize = maxPoolSize;
        this.minPoolSize = minPoolSize;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    protected String getDatabaseName() {
        return database;
    }

    @Override
    protected boolean autoIndexCreation() {
        return autoIndexCreation;
    }

    @Override
    protected void configureClientSettings(MongoClientSettings.Builder builder) {
        builder.applyConnectionString(new ConnectionString(uri))
                .applyToConnectionPoolSettings(pool -> pool
                        .maxSize(maxPoolSize)
                        .minSize(Math.min(minPoolSize, maxPoolSize))
                        .maxConnectionIdleTime(60, TimeUnit.SECONDS))
                .applyToSocketSettings(socket -> socket
                        .connectTimeout(timeoutSeconds, TimeUnit.SECONDS)
                        .readTimeout(timeoutSeconds, TimeUnit.SECONDS));
    }
}

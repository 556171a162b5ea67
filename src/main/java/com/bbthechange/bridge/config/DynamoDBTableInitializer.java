package com.bbthechange.bridge.config;

import com.bbthechange.bridge.model.Puppet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.EnhancedGlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.Projection;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Creates the puppet table and its custom mxid index when they do not exist yet.
 * Runs before the application is reported ready, so the startup hook can scan the index.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true", matchIfMissing = true)
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);

    private static final ProvisionedThroughput THROUGHPUT = ProvisionedThroughput.builder()
            .readCapacityUnits(5L)
            .writeCapacityUnits(5L)
            .build();

    private final DynamoDbTable<Puppet> puppetTable;

    public DynamoDBTableInitializer(DynamoDbTable<Puppet> puppetTable) {
        this.puppetTable = puppetTable;
    }

    @Override
    public void run(ApplicationArguments args) {
        createTableIfNotExists();
    }

    void createTableIfNotExists() {
        try {
            puppetTable.describeTable();
            logger.info("Table {} already exists", puppetTable.tableName());
        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", puppetTable.tableName());
            puppetTable.createTable(CreateTableEnhancedRequest.builder()
                    .provisionedThroughput(THROUGHPUT)
                    .globalSecondaryIndices(EnhancedGlobalSecondaryIndex.builder()
                            .indexName(Puppet.CUSTOM_MXID_INDEX)
                            .projection(Projection.builder().projectionType(ProjectionType.ALL).build())
                            .provisionedThroughput(THROUGHPUT)
                            .build())
                    .build());
            logger.info("Table {} created with index {}", puppetTable.tableName(), Puppet.CUSTOM_MXID_INDEX);
        } catch (Exception e) {
            logger.error("Error creating table {}: {}", puppetTable.tableName(), e.getMessage());
            throw e;
        }
    }
}

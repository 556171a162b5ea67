package com.bbthechange.bridge.repository.impl;

import com.bbthechange.bridge.exception.RepositoryException;
import com.bbthechange.bridge.model.Puppet;
import com.bbthechange.bridge.repository.PuppetRepository;
import com.bbthechange.bridge.util.StoreOperationTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbIndex;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.model.PutItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * DynamoDB implementation of PuppetRepository.
 * Custom mxids live in a sparse GSI, so only double puppeted entries show up in it.
 */
@Repository
public class PuppetRepositoryImpl implements PuppetRepository {

    private static final Logger logger = LoggerFactory.getLogger(PuppetRepositoryImpl.class);

    private static final Expression NOT_EXISTS = Expression.builder()
            .expression("attribute_not_exists(remoteUserKey)")
            .build();

    private final DynamoDbTable<Puppet> puppetTable;
    private final DynamoDbIndex<Puppet> customMxidIndex;
    private final StoreOperationTracker tracker;

    public PuppetRepositoryImpl(DynamoDbTable<Puppet> puppetTable, StoreOperationTracker tracker) {
        this.puppetTable = puppetTable;
        this.customMxidIndex = puppetTable.index(Puppet.CUSTOM_MXID_INDEX);
        this.tracker = tracker;
    }

    @Override
    public Optional<Puppet> findByRemoteUserKey(String remoteUserKey) {
        return tracker.track("GetItem", () -> {
            try {
                Puppet puppet = puppetTable.getItem(Key.builder().partitionValue(remoteUserKey).build());
                return Optional.ofNullable(puppet);
            } catch (DynamoDbException e) {
                logger.error("Failed to load puppet {}", remoteUserKey, e);
                throw new RepositoryException("Failed to load puppet " + remoteUserKey, e);
            }
        });
    }

    @Override
    public Optional<Puppet> findByCustomMxid(String customMxid) {
        return tracker.track("Query-GSI", () -> {
            try {
                return customMxidIndex.query(QueryConditional.keyEqualTo(Key.builder()
                                .partitionValue(customMxid)
                                .build()))
                        .stream()
                        .flatMap(page -> page.items().stream())
                        .findFirst();
            } catch (DynamoDbException e) {
                logger.error("Failed to load puppet by custom mxid {}", customMxid, e);
                throw new RepositoryException("Failed to load puppet by custom mxid " + customMxid, e);
            }
        });
    }

    @Override
    public List<Puppet> findAllWithCustomMxid() {
        return tracker.track("Scan-GSI", () -> {
            try {
                return customMxidIndex.scan()
                        .stream()
                        .flatMap(page -> page.items().stream())
                        .collect(Collectors.toList());
            } catch (DynamoDbException e) {
                logger.error("Failed to list double puppeted puppets", e);
                throw new RepositoryException("Failed to list double puppeted puppets", e);
            }
        });
    }

    @Override
    public Puppet insert(Puppet puppet) {
        return tracker.track("PutItem-New", () -> {
            try {
                puppetTable.putItem(PutItemEnhancedRequest.builder(Puppet.class)
                        .item(puppet)
                        .conditionExpression(NOT_EXISTS)
                        .build());
                logger.info("Inserted puppet {}", puppet.getRemoteUserKey());
                return puppet;
            } catch (ConditionalCheckFailedException e) {
                throw new RepositoryException("Puppet " + puppet.getRemoteUserKey() + " already exists", e);
            } catch (DynamoDbException e) {
                logger.error("Failed to insert puppet {}", puppet.getRemoteUserKey(), e);
                throw new RepositoryException("Failed to insert puppet " + puppet.getRemoteUserKey(), e);
            }
        });
    }

    @Override
    public Puppet save(Puppet puppet) {
        return tracker.track("PutItem", () -> {
            try {
                puppetTable.putItem(puppet);
                logger.debug("Saved puppet {}", puppet.getRemoteUserKey());
                return puppet;
            } catch (DynamoDbException e) {
                logger.error("Failed to save puppet {}", puppet.getRemoteUserKey(), e);
                throw new RepositoryException("Failed to save puppet " + puppet.getRemoteUserKey(), e);
            }
        });
    }
}

package com.bbthechange.bridge.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;

import java.time.Instant;

/**
 * Local Matrix representative of a LinkedIn member.
 *
 * The remote user key is the LinkedIn member URN and never changes once the puppet exists.
 * {@code nameApplied} and {@code avatarApplied} track whether the stored values actually reached
 * the homeserver, so a failed push is retried on the next profile sync.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class Puppet {

    public static final String CUSTOM_MXID_INDEX = "CustomMxidIndex";

    private String remoteUserKey;
    private String displayName;
    private String photoId;
    private String photoMxc;
    private boolean nameApplied;
    private boolean avatarApplied;
    private boolean registered;
    private String customMxid;
    private String syncToken;
    private Instant lastInfoSync;

    public Puppet(String remoteUserKey) {
        this.remoteUserKey = remoteUserKey;
    }

    @DynamoDbPartitionKey
    public String getRemoteUserKey() {
        return remoteUserKey;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = CUSTOM_MXID_INDEX)
    public String getCustomMxid() {
        return customMxid;
    }

    @DynamoDbIgnore
    public Instant getLastInfoSync() {
        return lastInfoSync;
    }
}

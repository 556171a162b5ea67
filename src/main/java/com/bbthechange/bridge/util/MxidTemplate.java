package com.bbthechange.bridge.util;

import java.util.Objects;
import java.util.Optional;

/**
 * Maps remote user keys to ghost mxids and back.
 *
 * A ghost mxid is {@code @<template prefix><key><template suffix>:<domain>}, with the key
 * substituted as is. Parsing strips the same prefix and suffix again, so every key maps to exactly
 * one ghost mxid and back.
 */
public class MxidTemplate {

    public static final String PLACEHOLDER = "{userid}";

    private final String mxidPrefix;
    private final String mxidSuffix;

    public MxidTemplate(String usernameTemplate, String domain) {
        Objects.requireNonNull(usernameTemplate, "usernameTemplate");
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("Homeserver domain must be set");
        }
        int index = usernameTemplate.indexOf(PLACEHOLDER);
        if (index < 0 || index != usernameTemplate.lastIndexOf(PLACEHOLDER)) {
            throw new IllegalArgumentException(
                    "Username template must contain " + PLACEHOLDER + " exactly once: " + usernameTemplate);
        }
        this.mxidPrefix = "@" + usernameTemplate.substring(0, index);
        this.mxidSuffix = usernameTemplate.substring(index + PLACEHOLDER.length()) + ":" + domain;
    }

    /**
     * Ghost mxid for a remote user key.
     *
     * @throws IllegalArgumentException if the key is null or empty
     */
    public String format(String remoteUserKey) {
        if (remoteUserKey == null || remoteUserKey.isEmpty()) {
            throw new IllegalArgumentException("Remote user key must not be empty");
        }
        return mxidPrefix + remoteUserKey + mxidSuffix;
    }

    /**
     * Remote user key encoded in a ghost mxid, or empty if the mxid does not belong to this bridge.
     */
    public Optional<String> parse(String mxid) {
        if (mxid == null
                || mxid.length() <= mxidPrefix.length() + mxidSuffix.length()
                || !mxid.startsWith(mxidPrefix)
                || !mxid.endsWith(mxidSuffix)) {
            return Optional.empty();
        }
        return Optional.of(mxid.substring(mxidPrefix.length(), mxid.length() - mxidSuffix.length()));
    }

    public boolean isGhostMxid(String mxid) {
        return parse(mxid).isPresent();
    }
}

package com.bbthechange.bridge.service;

import com.bbthechange.bridge.client.MatrixIntentClient;
import com.bbthechange.bridge.dto.ProfilePicture;
import com.bbthechange.bridge.dto.ProfileSyncResult;
import com.bbthechange.bridge.model.Puppet;
import com.bbthechange.bridge.repository.PuppetRepository;
import com.bbthechange.bridge.util.DisplaynameFormatter;
import com.bbthechange.bridge.util.MxidTemplate;
import com.bbthechange.bridge.util.PhotoIdParser;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pushes LinkedIn profile data (name and picture) to a puppet's ghost account.
 *
 * Updates are idempotent: a value is only pushed when it differs from the stored one or when the
 * previous push did not succeed. A failed push never aborts the sync, it clears the matching
 * applied flag so the next sync tries again.
 */
@Service
public class ProfileSyncService {

    private static final Logger logger = LoggerFactory.getLogger(ProfileSyncService.class);

    private final PuppetRepository puppetRepository;
    private final MatrixIntentClient matrixIntentClient;
    private final AvatarReuploadService avatarReuploadService;
    private final MxidTemplate mxidTemplate;
    private final DisplaynameFormatter displaynameFormatter;
    private final MeterRegistry meterRegistry;

    public ProfileSyncService(PuppetRepository puppetRepository,
                              MatrixIntentClient matrixIntentClient,
                              AvatarReuploadService avatarReuploadService,
                              MxidTemplate mxidTemplate,
                              DisplaynameFormatter displaynameFormatter,
                              MeterRegistry meterRegistry) {
        this.puppetRepository = puppetRepository;
        this.matrixIntentClient = matrixIntentClient;
        this.avatarReuploadService = avatarReuploadService;
        this.mxidTemplate = mxidTemplate;
        this.displaynameFormatter = displaynameFormatter;
        this.meterRegistry = meterRegistry;
    }

    public ProfileSyncResult updateInfo(Puppet puppet, String source, JsonNode info) {
        return updateInfo(puppet, source, info, true);
    }

    /**
     * Apply profile info received from LinkedIn to the puppet.
     *
     * @param puppet       the puppet to update, owned by the caller for the duration of the call
     * @param source       remote key of the bridge user whose session delivered the info, used for logging
     * @param info         the raw profile, with the name and picture under {@code miniProfile};
     *                     null or empty info leaves the puppet untouched
     * @param updateAvatar whether to sync the picture as well as the name
     * @return the sync outcome; never throws
     */
    public ProfileSyncResult updateInfo(Puppet puppet, String source, JsonNode info, boolean updateAvatar) {
        if (info == null || info.isEmpty()) {
            // TODO fetch the profile through the source user's session once the transport exposes it
            return ProfileSyncResult.unchanged(puppet);
        }

        puppet.setLastInfoSync(Instant.now());
        List<Exception> failures = new ArrayList<>();
        boolean registeredChanged = false;
        boolean nameChanged = false;
        boolean avatarChanged = false;
        boolean saved = false;

        try {
            String mxid = mxidTemplate.format(puppet.getRemoteUserKey());
            JsonNode miniProfile = info.path("miniProfile");

            registeredChanged = ensureRegistered(puppet, mxid, failures);
            nameChanged = updateName(puppet, mxid, miniProfile, failures);
            if (updateAvatar) {
                avatarChanged = updatePhoto(puppet, mxid, ProfilePicture.fromMiniProfile(miniProfile), failures);
            }

            if (registeredChanged || nameChanged || avatarChanged) {
                puppetRepository.save(puppet);
                saved = true;
            }
        } catch (Exception e) {
            logger.error("Failed to update info of {} from source {}", puppet.getRemoteUserKey(), source, e);
            failures.add(e);
        }

        ProfileSyncResult result = new ProfileSyncResult(
                puppet, registeredChanged, nameChanged, avatarChanged, saved, failures);
        meterRegistry.counter("puppet_profile_sync_total", "status", status(result)).increment();
        return result;
    }

    private boolean ensureRegistered(Puppet puppet, String mxid, List<Exception> failures) {
        if (puppet.isRegistered()) {
            return false;
        }
        try {
            matrixIntentClient.ensureRegistered(mxid);
            puppet.setRegistered(true);
            return true;
        } catch (RuntimeException e) {
            logger.warn("Failed to register ghost {}: {}", mxid, e.getMessage());
            failures.add(e);
            return false;
        }
    }

    private boolean updateName(Puppet puppet, String mxid, JsonNode miniProfile, List<Exception> failures) {
        String name = displaynameFormatter.format(
                miniProfile.path("firstName").asText(null),
                miniProfile.path("lastName").asText(null));
        if (name.equals(puppet.getDisplayName()) && puppet.isNameApplied()) {
            return false;
        }

        puppet.setDisplayName(name);
        try {
            matrixIntentClient.setDisplayName(mxid, name);
            puppet.setNameApplied(true);
        } catch (RuntimeException e) {
            logger.warn("Failed to set displayname of {}", mxid, e);
            puppet.setNameApplied(false);
            failures.add(e);
        }
        return true;
    }

    private boolean updatePhoto(Puppet puppet, String mxid, ProfilePicture picture, List<Exception> failures) {
        String photoId = PhotoIdParser.extractPhotoId(picture.rootUrl()).orElse(null);
        if (Objects.equals(photoId, puppet.getPhotoId()) && puppet.isAvatarApplied()) {
            return false;
        }

        puppet.setPhotoId(photoId);
        try {
            if (photoId != null) {
                String url = picture.smallestArtifactUrl()
                        .orElseThrow(() -> new IllegalStateException("Picture " + photoId + " lists no artifacts"));
                puppet.setPhotoMxc(avatarReuploadService.reupload(mxid, url));
            } else {
                puppet.setPhotoMxc("");
            }
            matrixIntentClient.setAvatarUrl(mxid, puppet.getPhotoMxc());
            puppet.setAvatarApplied(true);
        } catch (RuntimeException e) {
            logger.warn("Failed to set avatar of {}", mxid, e);
            puppet.setAvatarApplied(false);
            failures.add(e);
        }
        return true;
    }

    private static String status(ProfileSyncResult result) {
        if (!result.isComplete()) {
            return result.isChanged() ? "partial" : "error";
        }
        return result.isChanged() ? "updated" : "unchanged";
    }
}

package com.bbthechange.bridge.util;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the stable photo id from a LinkedIn vector image root URL.
 *
 * Root URLs look like {@code https://media.licdn.com/dms/image/C4D03AQH/profile-displayphoto-shrink_}.
 * The path segment right after {@code /image/} identifies the uploaded picture and changes only
 * when the member changes their photo, so it is used as the avatar version token.
 */
public final class PhotoIdParser {

    /**
     * Group 1 captures the photo id. Matched from the start of the URL only.
     */
    public static final Pattern PHOTO_ID_PATTERN = Pattern.compile("https://.*?/image/(.*?)/profile-.*?");

    private PhotoIdParser() {
    }

    public static Optional<String> extractPhotoId(String rootUrl) {
        if (rootUrl == null || rootUrl.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = PHOTO_ID_PATTERN.matcher(rootUrl);
        if (!matcher.lookingAt()) {
            return Optional.empty();
        }
        String photoId = matcher.group(1);
        return photoId.isEmpty() ? Optional.empty() : Optional.of(photoId);
    }
}

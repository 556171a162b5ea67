package com.bbthechange.bridge.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The {@code com.linkedin.common.VectorImage} of a LinkedIn mini profile: a root URL plus the
 * path segments of the rendered sizes.
 */
public record ProfilePicture(String rootUrl, List<Artifact> artifacts) {

    public static final String VECTOR_IMAGE = "com.linkedin.common.VectorImage";

    /**
     * One rendered size of the picture. Width is null when the profile does not list it.
     */
    public record Artifact(Integer width, String fileIdentifyingUrlPathSegment) {
    }

    /**
     * Read the picture from a mini profile node. Missing fields yield a picture without root URL or artifacts.
     */
    public static ProfilePicture fromMiniProfile(JsonNode miniProfile) {
        JsonNode vectorImage = miniProfile.path("picture").path(VECTOR_IMAGE);
        String rootUrl = vectorImage.path("rootUrl").asText(null);

        List<Artifact> artifacts = new ArrayList<>();
        for (JsonNode artifact : vectorImage.path("artifacts")) {
            String segment = artifact.path("fileIdentifyingUrlPathSegment").asText(null);
            if (segment == null) {
                continue;
            }
            JsonNode width = artifact.path("width");
            artifacts.add(new Artifact(width.isNumber() ? width.asInt() : null, segment));
        }
        return new ProfilePicture(rootUrl, List.copyOf(artifacts));
    }

    /**
     * Full URL of the lowest resolution artifact. When widths are missing the first listed
     * artifact is used, LinkedIn lists the 100x100 rendition first.
     */
    public Optional<String> smallestArtifactUrl() {
        if (rootUrl == null || artifacts.isEmpty()) {
            return Optional.empty();
        }
        Artifact smallest = artifacts.stream()
                .min(Comparator.comparing(Artifact::width, Comparator.nullsLast(Comparator.naturalOrder())))
                .orElseThrow();
        return Optional.of(rootUrl + smallest.fileIdentifyingUrlPathSegment());
    }
}

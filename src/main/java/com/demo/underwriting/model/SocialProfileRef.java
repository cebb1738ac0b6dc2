package com.demo.underwriting.model;

import java.net.URI;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/** A (platform, identifier) pair the applicant declared. */
public record SocialProfileRef(Platform platform, String identifier) {

    public SocialProfileRef {
        Objects.requireNonNull(platform, "platform");
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier must not be blank");
        }
        identifier = identifier.trim();
    }

    /**
     * Builds a reference from a profile URL. LinkedIn slugs become a display
     * name ({@code john-doe-123} to {@code John Doe}); other platforms keep the
     * handle; unknown hosts keep the URL itself as identifier.
     */
    public static SocialProfileRef fromUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        Platform platform = Platform.detect(url);
        List<String> path = pathSegments(Platform.parse(url));
        if (platform == Platform.LINKEDIN) {
            if (path.size() >= 2 && path.get(0).equalsIgnoreCase("in")) {
                return new SocialProfileRef(platform, slugToName(path.get(1)));
            }
        } else if (platform != Platform.PERSONAL_WEBSITE && !path.isEmpty()) {
            String handle = path.get(0).startsWith("@") ? path.get(0).substring(1) : path.get(0);
            if (!handle.isBlank()) {
                return new SocialProfileRef(platform, handle);
            }
        }
        return new SocialProfileRef(platform, url.trim());
    }

    private static List<String> pathSegments(URI uri) {
        if (uri == null || uri.getPath() == null) return List.of();
        return Arrays.stream(uri.getPath().split("/")).filter(seg -> !seg.isBlank()).toList();
    }

    private static String slugToName(String slug) {
        String name = slug.replace('-', ' ').replace('_', ' ').replaceAll("\\s*\\d+$", "").trim();
        StringBuilder sb = new StringBuilder();
        for (String part : name.split("\\s+")) {
            if (part.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1).toLowerCase());
        }
        return sb.length() == 0 ? slug : sb.toString();
    }
}

package com.demo.underwriting.model;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/** Social platforms a profile identifier can belong to, with the feature groups each one informs. */
public enum Platform {
    LINKEDIN("professional network", EnumSet.of(FeatureGroup.PROFESSIONAL)),
    INSTAGRAM("photo sharing", EnumSet.of(FeatureGroup.LIFESTYLE, FeatureGroup.SOCIAL)),
    FACEBOOK("social network", EnumSet.of(FeatureGroup.LIFESTYLE, FeatureGroup.SOCIAL)),
    TIKTOK("short video", EnumSet.of(FeatureGroup.LIFESTYLE)),
    TWITTER("microblog", EnumSet.of(FeatureGroup.SOCIAL)),
    PERSONAL_WEBSITE("personal website", EnumSet.of(FeatureGroup.PROFESSIONAL));

    private final String category;
    private final Set<FeatureGroup> informs;

    Platform(String category, Set<FeatureGroup> informs) {
        this.category = category;
        this.informs = informs;
    }

    public String category() {
        return category;
    }

    public boolean informs(FeatureGroup group) {
        return informs.contains(group);
    }

    public Set<FeatureGroup> informedGroups() {
        return EnumSet.copyOf(informs);
    }

    /** Matches on the URL's host, so {@code netflix.com} is not X and {@code dropbox.com} is not Facebook. */
    public static Platform detect(String url) {
        URI uri = parse(url);
        String host = uri == null || uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        if (onDomain(host, "linkedin.com")) return LINKEDIN;
        if (onDomain(host, "instagram.com")) return INSTAGRAM;
        if (onDomain(host, "twitter.com") || onDomain(host, "x.com")) return TWITTER;
        if (onDomain(host, "facebook.com") || onDomain(host, "fb.com")) return FACEBOOK;
        if (onDomain(host, "tiktok.com")) return TIKTOK;
        return PERSONAL_WEBSITE;
    }

    /** Parses a profile URL, scheme optional; null when it is not a URL at all. */
    static URI parse(String url) {
        if (url == null || url.isBlank()) return null;
        String s = url.trim();
        if (!s.contains("://")) s = "https://" + s;
        try {
            return new URI(s);
        } catch (URISyntaxException e) {
            // không parse được -> coi như website cá nhân, giữ nguyên URL
            return null;
        }
    }

    private static boolean onDomain(String host, String domain) {
        return host.equals(domain) || host.endsWith("." + domain);
    }
}

package com.demo.underwriting.service.profile;

import com.demo.underwriting.model.FeatureGroup;
import com.demo.underwriting.model.Platform;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Prompts sent to the profile search capability. */
public final class ProfilePromptBuilder {

    static final String SYSTEM_PROMPT = """
            You are a profile analyst supporting mortgage underwriting risk assessment.
            Extract factual, observable information from public profiles about financial stability,
            employment consistency, lifestyle patterns and social connectedness.
            Only report what can be observed or reasonably inferred and mark inferences as such.
            If a profile is private or information is unavailable, state that explicitly.""";

    private static final Map<Platform, Map<FeatureGroup, List<String>>> ASPECTS = new EnumMap<>(Platform.class);

    static {
        ASPECTS.put(Platform.LINKEDIN, Map.of(
                FeatureGroup.PROFESSIONAL, List.of(
                        "Current title and employer",
                        "Employment history and tenure per role",
                        "Total years of experience",
                        "Education and certifications",
                        "Career progression"),
                FeatureGroup.SOCIAL, List.of(
                        "Connection count tier (<500, 500-1000, 1000+)",
                        "Recommendations received and given")));
        ASPECTS.put(Platform.INSTAGRAM, Map.of(
                FeatureGroup.LIFESTYLE, List.of(
                        "Apparent lifestyle level (modest, comfortable, lavish)",
                        "Travel frequency",
                        "Material possessions and spending patterns on display",
                        "Home and living situation"),
                FeatureGroup.SOCIAL, List.of(
                        "Family and friends present in posts",
                        "Community involvement",
                        "Relationship status indicators")));
        ASPECTS.put(Platform.FACEBOOK, Map.of(
                FeatureGroup.LIFESTYLE, List.of(
                        "Life events (marriage, home purchase, relocation)",
                        "Family situation",
                        "Check-ins and travel"),
                FeatureGroup.SOCIAL, List.of(
                        "Family connections visible",
                        "Community group memberships",
                        "Relationship status")));
        ASPECTS.put(Platform.TIKTOK, Map.of(
                FeatureGroup.LIFESTYLE, List.of(
                        "Lifestyle portrayed in videos",
                        "Spending indicators",
                        "Hobbies and activities")));
        ASPECTS.put(Platform.TWITTER, Map.of(
                FeatureGroup.SOCIAL, List.of(
                        "Engagement patterns and tone",
                        "Community involvement",
                        "Life events shared")));
        ASPECTS.put(Platform.PERSONAL_WEBSITE, Map.of(
                FeatureGroup.PROFESSIONAL, List.of(
                        "Business or professional activity described",
                        "Credentials and publications",
                        "Length of the stated track record")));
    }

    private ProfilePromptBuilder() {}

    public static String userPrompt(Platform platform, String identifier) {
        StringBuilder sb = new StringBuilder();
        sb.append("Profile (").append(platform.category()).append("): ").append(identifier).append("\n\n");
        sb.append("Analyze this profile for mortgage underwriting risk assessment.\n\nEXTRACT:\n");
        for (FeatureGroup g : FeatureGroup.values()) {
            List<String> aspects = ASPECTS.getOrDefault(platform, Map.of()).get(g);
            if (aspects == null) continue;
            sb.append("\n**").append(g.key().toUpperCase(Locale.ROOT)).append(" ASPECTS:**\n");
            aspects.forEach(a -> sb.append("- ").append(a).append('\n'));
        }
        sb.append("""

                Finish with two sections, each a bullet list (write "None" if empty):

                **Red flags:**
                - financial instability, lifestyle beyond apparent means, employment gaps, risky behavior

                **Positive indicators:**
                - long-term employment, professional growth, stable lifestyle, community ties, financial responsibility

                Note explicitly if the profile is private or not found.""");
        return sb.toString();
    }
}

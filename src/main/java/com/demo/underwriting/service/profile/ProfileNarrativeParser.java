package com.demo.underwriting.service.profile;

import com.demo.underwriting.model.Confidence;
import com.demo.underwriting.model.FeatureGroup;
import com.demo.underwriting.model.Platform;
import com.demo.underwriting.model.ProfileAnalysis;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the free-text narrative of a profile search into a {@link ProfileAnalysis}.
 * <p>
 * Indicators are read from the bullet list under a "Red flags" or "Positive
 * indicators" heading; the list ends at the first blank line or the next heading.
 * A narrative saying the profile is private or missing, with no indicators to
 * go on, is a failed lookup; with indicators it is kept at LOW confidence.
 */
@Component
public class ProfileNarrativeParser {

    static final int SUMMARY_MAX_CHARS = 600;

    private static final Map<FeatureGroup, List<String>> FOCUS = new EnumMap<>(FeatureGroup.class);

    static {
        FOCUS.put(FeatureGroup.PROFESSIONAL, List.of("professional", "employment", "career", "work"));
        FOCUS.put(FeatureGroup.LIFESTYLE, List.of("lifestyle", "spending", "living", "travel"));
        FOCUS.put(FeatureGroup.SOCIAL, List.of("social", "connect", "network", "community"));
    }

    /** Phrases saying the profile itself could not be read; "private equity" and the like must not match. */
    private static final Pattern UNAVAILABLE = Pattern.compile(String.join("|",
            "\\b(?:profile|account|page|user)\\b[^.\\n]{0,60}?\\bnot found\\b",
            "\\b(?:could ?n[o']t|can(?:no|')t|unable to) (?:find|locate|access) (?:a |an |the |any )?(?:public )?"
                    + "(?:\\w+ )?(?:profile|account|page)\\b",
            "\\bdoes not (?:appear to )?exist\\b",
            "\\bno (?:public )?(?:information|profile|results?|data) (?:is |was |were )?(?:available|found)\\b",
            "\\b(?:profile|account|page) (?:is|was|appears to be|seems to be) (?:set to )?"
                    + "(?:private|restricted|unavailable|not (?:publicly )?(?:available|accessible))\\b",
            "\\b(?:private|restricted|locked) (?:profile|account)\\b"));

    public ProfileAnalysis parse(Platform platform, String identifier, String narrative) throws ProfileSearchException {
        if (narrative == null || narrative.isBlank()) {
            throw new ProfileSearchException("empty narrative");
        }
        String text = narrative.replace("\r\n", "\n").trim();
        List<String> redFlags = section(text, "red flag");
        List<String> positives = section(text, "positive indicator");
        int indicators = positives.size() + redFlags.size();
        String unavailable = unavailablePhrase(text);
        if (unavailable != null && indicators == 0) {
            // không có gì để chấm -> coi như lookup thất bại
            throw new ProfileSearchException("profile unavailable: " + unavailable);
        }
        Confidence confidence = unavailable != null ? Confidence.LOW
                : indicators >= 2 ? Confidence.HIGH : Confidence.MEDIUM;
        return new ProfileAnalysis(platform, identifier, text, summary(platform, text),
                positives, redFlags, confidence);
    }

    static List<String> section(String text, String heading) {
        String[] lines = text.split("\n");
        List<String> out = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            if (!isHeading(lines[i], heading)) continue;

            String inline = afterColon(lines[i]);
            if (inline != null) addEntry(out, inline);

            boolean started = false;
            for (int j = i + 1; j < lines.length; j++) {
                String line = lines[j].trim();
                if (line.isEmpty()) {
                    if (started) break;
                    continue;
                }
                if (line.startsWith("**") || line.startsWith("#")) break;
                started = true;
                addEntry(out, line);
            }
            return out;
        }
        return out;
    }

    private static boolean isHeading(String line, String heading) {
        String l = stripMarkup(line).toLowerCase(Locale.ROOT);
        return l.startsWith(heading) && (line.trim().startsWith("**") || line.trim().startsWith("#") || l.contains(":"));
    }

    private static String afterColon(String line) {
        int idx = line.indexOf(':');
        if (idx < 0) return null;
        String rest = stripMarkup(line.substring(idx + 1));
        return rest.isEmpty() ? null : rest;
    }

    private static void addEntry(List<String> out, String raw) {
        String entry = stripMarkup(raw.replaceFirst("^\\s*(?:[-•*]+|\\d+[.)])\\s*", ""));
        String bare = entry.endsWith(".") ? entry.substring(0, entry.length() - 1) : entry;
        if (bare.equalsIgnoreCase("none") || bare.equalsIgnoreCase("none identified")) return;
        if (entry.length() <= 3) return;
        out.add(entry);
    }

    private static String stripMarkup(String s) {
        return s.replaceAll("^[\\s#*]+", "").replaceAll("[\\s*]+$", "");
    }

    static String summary(Platform platform, String text) {
        String[] paragraphs = text.split("\\n\\s*\\n");
        List<String> keywords = new ArrayList<>();
        for (FeatureGroup g : platform.informedGroups()) {
            keywords.addAll(FOCUS.getOrDefault(g, List.of()));
        }
        List<String> relevant = new ArrayList<>();
        for (String p : paragraphs) {
            String lower = p.toLowerCase(Locale.ROOT);
            if (keywords.stream().anyMatch(lower::contains)) {
                relevant.add(p.trim());
                if (relevant.size() == 2) break;
            }
        }
        String s = relevant.isEmpty() ? paragraphs[0].trim() : String.join("\n\n", relevant);
        return s.length() > SUMMARY_MAX_CHARS ? s.substring(0, SUMMARY_MAX_CHARS) : s;
    }

    static String unavailablePhrase(String text) {
        Matcher m = UNAVAILABLE.matcher(text.toLowerCase(Locale.ROOT));
        return m.find() ? m.group() : null;
    }
}

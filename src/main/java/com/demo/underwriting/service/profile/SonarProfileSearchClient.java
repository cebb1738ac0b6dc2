package com.demo.underwriting.service.profile;

import com.demo.underwriting.model.Platform;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Profile search over an OpenAI-compatible chat-completions endpoint
 * (Perplexity Sonar by default). One request per lookup, no retries.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "profileSearch.enabled", havingValue = "true")
public class SonarProfileSearchClient implements ProfileSearchPort {

    static final double TEMPERATURE = 0.2;
    static final int MAX_TOKENS = 3000;

    private final RestTemplate restTemplate;

    @Value("${profileSearch.baseUrl:https://api.perplexity.ai}")
    private String baseUrl;

    @Value("${profileSearch.apiKey:}")
    private String apiKey;

    @Value("${profileSearch.model:sonar}")
    private String model;

    @PostConstruct
    void warnIfUnconfigured() {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Profile search enabled without profileSearch.apiKey; every lookup will fail");
        }
    }

    @Override
    public String search(Platform platform, String identifier) throws ProfileSearchException {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProfileSearchException("no API key configured for profile search");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(
                Map.of("role", "system", "content", ProfilePromptBuilder.SYSTEM_PROMPT),
                Map.of("role", "user", "content", ProfilePromptBuilder.userPrompt(platform, identifier))));
        body.put("temperature", TEMPERATURE);
        body.put("max_tokens", MAX_TOKENS);

        ResponseEntity<ChatCompletion> resp;
        try {
            var req = RequestEntity
                    .post(URI.create(trimSlash(baseUrl) + "/chat/completions"))
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .header("Authorization", "Bearer " + apiKey)
                    .body(body);
            resp = restTemplate.exchange(req, ChatCompletion.class);
        } catch (RestClientException ex) {
            throw new ProfileSearchException("search request failed: " + ex.getMessage(), ex);
        }

        String content = contentOf(resp.getBody());
        if (content == null || content.isBlank()) {
            throw new ProfileSearchException("malformed search response: no message content");
        }
        log.debug("Profile search answered for {} ({} chars)", platform, content.length());
        return content;
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String contentOf(ChatCompletion c) {
        if (c == null || c.getChoices() == null || c.getChoices().isEmpty()) return null;
        Choice first = c.getChoices().get(0);
        return first == null || first.getMessage() == null ? null : first.getMessage().getContent();
    }

    // Wire DTOs, chỉ lấy phần cần dùng
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatCompletion {
        private List<Choice> choices;
        private List<String> citations;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Choice {
        private Message message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {
        private String role;
        private String content;
    }
}

package com.replifast.backend.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * Drafts review replies with Anthropic Claude.
 * The brand voice preset sets the tone; a custom instruction is appended when present.
 */
@Service
@Slf4j
public class ClaudeReplyGenerator implements ReplyDraftGenerator {

    private static final Map<String, String> PRESET_TONES = Map.of(
            "professional", "courteous, polished and professional",
            "friendly", "warm, upbeat and friendly",
            "casual", "relaxed and conversational"
    );

    @Value("${anthropic.api.key:}")
    private String anthropicApiKey;

    @Value("${anthropic.api.url:https://api.anthropic.com/v1/messages}")
    private String anthropicApiUrl;

    @Value("${anthropic.model:claude-3-5-sonnet-20241022}")
    private String model;

    @Value("${anthropic.version:2023-06-01}")
    private String apiVersion;

    private final RestTemplate restTemplate;

    public ClaudeReplyGenerator(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public String generate(String reviewText, int rating, String reviewerName, BrandVoice brandVoice) {
        if (anthropicApiKey == null || anthropicApiKey.isBlank()) {
            log.warn("Anthropic API key not configured, using fallback reply");
            return fallbackReply(rating, reviewerName, brandVoice.businessName());
        }

        try {
            Map<String, Object> requestBody = Map.of(
                    "model", model,
                    "max_tokens", 300,
                    "system", buildSystemPrompt(rating, brandVoice),
                    "messages", List.of(Map.of("role", "user", "content", buildUserPrompt(reviewText, rating, reviewerName)))
            );

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            headers.set("x-api-key", anthropicApiKey);
            headers.set("anthropic-version", apiVersion);

            ResponseEntity<Map> response = restTemplate.postForEntity(
                    anthropicApiUrl, new HttpEntity<>(requestBody, headers), Map.class);

            String reply = extractText(response.getBody());
            if (reply != null) {
                log.info("Generated Claude reply draft (rating: {})", rating);
                return reply;
            }

            log.warn("No text content in Claude API response");
            return fallbackReply(rating, reviewerName, brandVoice.businessName());

        } catch (RestClientException e) {
            log.error("Error calling Claude API: {}", e.getMessage(), e);
            return fallbackReply(rating, reviewerName, brandVoice.businessName());
        }
    }

    @SuppressWarnings("unchecked")
    private String extractText(Map<String, Object> body) {
        if (body == null || !(body.get("content") instanceof List<?> content) || content.isEmpty()) {
            return null;
        }
        Map<String, Object> block = (Map<String, Object>) content.get(0);
        if (!"text".equals(block.get("type")) || block.get("text") == null) {
            return null;
        }
        String text = ((String) block.get("text")).trim();
        return text.isEmpty() ? null : text;
    }

    private String buildSystemPrompt(int rating, BrandVoice brandVoice) {
        String tone = PRESET_TONES.getOrDefault(brandVoice.preset(), PRESET_TONES.get("professional"));
        String stance = rating >= 4 ? "grateful" : "apologetic and understanding";

        StringBuilder prompt = new StringBuilder();
        prompt.append(String.format(
                "You write public replies to Google reviews on behalf of %s. " +
                        "Your tone is %s, and %s toward this reviewer.\n" +
                        "- Two to three sentences\n" +
                        "- Address what the reviewer actually mentioned\n" +
                        "- No emojis, no signature line\n" +
                        "- Never promise refunds or discounts",
                brandVoice.businessName(), tone, stance));

        if (brandVoice.customInstruction() != null && !brandVoice.customInstruction().isBlank()) {
            prompt.append("\nOwner instructions: ").append(brandVoice.customInstruction().trim());
        }
        return prompt.toString();
    }

    private String buildUserPrompt(String reviewText, int rating, String reviewerName) {
        StringBuilder prompt = new StringBuilder();
        prompt.append(String.format("Rating: %d/5\n", rating));
        if (reviewerName != null && !reviewerName.isEmpty()) {
            prompt.append(String.format("Reviewer: %s\n", reviewerName));
        }
        if (reviewText != null && !reviewText.isEmpty()) {
            prompt.append(String.format("Review: \"%s\"\n", reviewText));
        }
        prompt.append("\nWrite the reply.");
        return prompt.toString();
    }

    private String fallbackReply(int rating, String reviewerName, String businessName) {
        String greeting = (reviewerName != null && !reviewerName.isEmpty())
                ? "Hi " + reviewerName + ","
                : "Hello,";

        if (rating >= 4) {
            return String.format("%s thank you for the kind review! We're glad you had a great experience with %s " +
                    "and hope to see you again soon.", greeting, businessName);
        }
        return String.format("%s thank you for your feedback. We're sorry we fell short this time; " +
                "please get in touch so we can put it right.", greeting);
    }
}

package com.replifast.backend.services;

/**
 * Produces a reply draft for a review. Implementations never fail the caller; they fall back
 * to a template reply when the model is unavailable.
 */
public interface ReplyDraftGenerator {

    String generate(String reviewText, int rating, String reviewerName, BrandVoice brandVoice);

    /**
     * Tone settings for a business.
     *
     * @param businessName       shown in the prompt and in template replies
     * @param preset             one of the built-in tones (professional, friendly, casual)
     * @param customInstruction  free-form owner instruction; null unless the plan allows custom voice
     */
    record BrandVoice(String businessName, String preset, String customInstruction) {
    }
}

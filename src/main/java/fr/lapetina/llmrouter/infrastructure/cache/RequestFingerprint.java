package fr.lapetina.llmrouter.infrastructure.cache;

import fr.lapetina.llmrouter.domain.model.CompletionRequest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic cache key of a request.
 *
 * SHA-256 over the trimmed prompt, max tokens, temperature and model preference. Request id,
 * priority, timeout and timestamps do not take part, so resubmitting the same question maps to
 * the same key.
 */
public final class RequestFingerprint {

    private static final char SEPARATOR = '\u001f';

    private RequestFingerprint() {
    }

    public static String of(CompletionRequest request) {
        StringBuilder canonical = new StringBuilder(request.prompt().length() + 48)
                .append(request.prompt().strip()).append(SEPARATOR)
                .append(request.maxTokens() != null ? request.maxTokens() : "").append(SEPARATOR)
                .append(request.temperature() != null ? request.temperature() : "").append(SEPARATOR)
                .append(request.modelPreference() != null ? request.modelPreference().name() : "");
        return sha256(canonical.toString());
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

package autoflow.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Client for an OpenAI-compatible {@code /chat/completions} endpoint
 * (Ollama, vLLM, LM Studio or a hosted gateway).
 *
 * <p>One request, one complete answer: streaming is disabled. Server errors
 * (5xx) and transport failures are retried up to {@code retryCount} times with
 * a fixed delay; client errors (4xx) and malformed answers fail immediately.
 */
public class LLMClient {

    private static final Logger log = LoggerFactory.getLogger(LLMClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int PROMPT_LOG_CHARS = 500;

    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final double temperature;
    private final int maxTokens;
    private final int retryCount;
    private final long retryDelayMs;
    private final OkHttpClient httpClient;

    /**
     * @param baseUrl      endpoint root, e.g. {@code http://localhost:11434/v1}
     * @param apiKey       bearer token, or null/blank for unauthenticated local servers
     * @param model        model identifier sent with every request
     * @param temperature  sampling temperature
     * @param maxTokens    completion token limit
     * @param timeoutSec   read timeout per attempt
     * @param retryCount   extra attempts after a retriable failure
     * @param retryDelayMs pause between attempts
     */
    public LLMClient(String baseUrl, String apiKey, String model, double temperature, int maxTokens,
                     int timeoutSec, int retryCount, long retryDelayMs) {
        this.baseUrl      = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey       = apiKey;
        this.model        = model;
        this.temperature  = temperature;
        this.maxTokens    = maxTokens;
        this.retryCount   = Math.max(0, retryCount);
        this.retryDelayMs = retryDelayMs;
        this.httpClient   = new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(timeoutSec, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build();
    }

    public String getModel() { return model; }

    /**
     * Sends the conversation and returns the assistant's reply.
     *
     * @param messages conversation in order, usually one system and one user message
     * @return {@code choices[0].message.content}, trimmed
     * @throws IOException if the request fails for good or the answer is malformed
     */
    public String complete(List<ChatMessage> messages) throws IOException {
        if (log.isDebugEnabled()) {
            messages.stream()
                    .filter(m -> "user".equals(m.role()))
                    .findFirst()
                    .ifPresent(m -> log.debug("LLM request to {} | model={} | user_prompt_start={}",
                            baseUrl, model, abbreviate(m.content())));
        }

        String body = buildRequestJson(messages);
        String url = baseUrl + "/chat/completions";
        IOException lastFailure = null;

        for (int attempt = 1; attempt <= retryCount + 1; attempt++) {
            if (attempt > 1) {
                log.warn("Retrying LLM request (attempt {}/{}) after {}ms",
                        attempt, retryCount + 1, retryDelayMs);
                pause();
            }

            Request.Builder request = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(body, JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                request.header("Authorization", "Bearer " + apiKey);
            }

            try (Response response = httpClient.newCall(request.build()).execute()) {
                String text = response.body() != null ? response.body().string() : "";
                int status = response.code();

                if (status >= 500) {
                    log.warn("LLM endpoint returned {} on attempt {}: {}", status, attempt, text);
                    lastFailure = new IOException("LLM server error " + status + " on attempt "
                            + attempt + ": " + text);
                    continue;
                }
                if (!response.isSuccessful()) {
                    throw new FatalLLMException("LLM request failed with HTTP " + status + ": " + text);
                }
                return parseContent(text);
            } catch (FatalLLMException e) {
                throw e;
            } catch (IOException e) {
                log.warn("LLM request I/O error on attempt {}: {}", attempt, e.getMessage());
                lastFailure = e;
            }
        }

        throw new IOException("LLM request failed after " + (retryCount + 1) + " attempt(s). Last error: "
                + (lastFailure != null ? lastFailure.getMessage() : "unknown"), lastFailure);
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private String buildRequestJson(List<ChatMessage> messages) throws IOException {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("model", model);
        root.put("temperature", temperature);
        root.put("max_tokens", maxTokens);
        root.put("stream", false);

        ArrayNode msgs = root.putArray("messages");
        for (ChatMessage msg : messages) {
            ObjectNode node = msgs.addObject();
            node.put("role", msg.role());
            node.put("content", msg.content());
        }
        return MAPPER.writeValueAsString(root);
    }

    private String parseContent(String responseBody) throws IOException {
        JsonNode root;
        try {
            root = MAPPER.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new FatalLLMException("Failed to parse LLM response JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new FatalLLMException("LLM response missing 'choices' array: " + responseBody);
        }
        JsonNode content = choices.get(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            throw new FatalLLMException("LLM response missing choices[0].message.content: " + responseBody);
        }
        return content.asText().trim();
    }

    private void pause() throws IOException {
        try {
            Thread.sleep(retryDelayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted during retry delay", ie);
        }
    }

    private static String abbreviate(String s) {
        return s.length() > PROMPT_LOG_CHARS ? s.substring(0, PROMPT_LOG_CHARS) + "..." : s;
    }

    // ── Nested types ──────────────────────────────────────────────────────

    /** A single chat turn. */
    public record ChatMessage(String role, String content) {

        public static ChatMessage system(String content) {
            return new ChatMessage("system", content);
        }

        public static ChatMessage user(String content) {
            return new ChatMessage("user", content);
        }
    }

    /** Failure that another attempt cannot fix: HTTP 4xx or a malformed answer. */
    static class FatalLLMException extends IOException {
        FatalLLMException(String msg) { super(msg); }
        FatalLLMException(String msg, Throwable cause) { super(msg, cause); }
    }
}

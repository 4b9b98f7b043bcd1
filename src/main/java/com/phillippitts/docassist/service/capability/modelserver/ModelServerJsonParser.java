package com.phillippitts.docassist.service.capability.modelserver;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds and parses the JSON exchanged with the local model server.
 *
 * <p>Thread-safe: All methods are static and stateless.
 *
 * <p>Protects against unbounded responses by capping input at {@link #MAX_JSON_SIZE}.
 */
final class ModelServerJsonParser {

    /** Maximum response size accepted from the model server (4MB). */
    static final int MAX_JSON_SIZE = 4 * 1_048_576;

    private static final Pattern REASONING_BLOCKS = Pattern.compile(
            "<(think|thinking|reason|reasoning)>[\\s\\S]*?</\\1>", Pattern.CASE_INSENSITIVE);

    private ModelServerJsonParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Extracts model names from a {@code /api/tags} response: {@code {"models":[{"name":"..."}]}}.
     *
     * @return model names in server order; empty for blank or malformed input
     */
    static List<String> parseModelNames(String json) {
        List<String> names = new ArrayList<>();
        if (json == null || json.isBlank() || json.length() > MAX_JSON_SIZE) {
            return names;
        }
        try {
            JSONArray models = new JSONObject(json).optJSONArray("models");
            if (models == null) {
                return names;
            }
            for (int i = 0; i < models.length(); i++) {
                JSONObject model = models.optJSONObject(i);
                String name = model == null ? "" : model.optString("name", "").trim();
                if (!name.isEmpty()) {
                    names.add(name);
                }
            }
        } catch (JSONException e) {
            return new ArrayList<>();
        }
        return names;
    }

    /**
     * Extracts the answer from a {@code /api/chat} response. Reads {@code message.content}
     * and falls back to {@code response}.
     *
     * @throws IllegalArgumentException if the response is not valid JSON or too large
     */
    static String parseChatContent(String json) {
        if (json == null || json.isBlank()) {
            return "";
        }
        if (json.length() > MAX_JSON_SIZE) {
            throw new IllegalArgumentException("Response exceeds " + MAX_JSON_SIZE + " chars");
        }
        try {
            JSONObject obj = new JSONObject(json);
            JSONObject message = obj.optJSONObject("message");
            String raw = message != null ? message.optString("content", "") : "";
            if (raw.isEmpty()) {
                raw = obj.optString("response", "");
            }
            return stripReasoning(raw);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed chat response: " + e.getMessage(), e);
        }
    }

    /**
     * Builds a non-streaming chat request body.
     */
    static String buildChatRequest(String model, String systemPrompt, String userPrompt, double temperature) {
        JSONArray messages = new JSONArray();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.put(new JSONObject().put("role", "system").put("content", systemPrompt));
        }
        messages.put(new JSONObject().put("role", "user").put("content", userPrompt == null ? "" : userPrompt));
        JSONObject options = new JSONObject()
                .put("temperature", temperature)
                .put("top_p", 0.9);
        return new JSONObject()
                .put("model", model)
                .put("messages", messages)
                .put("stream", false)
                .put("options", options)
                .toString();
    }

    /** Removes reasoning blocks some models emit before their answer. */
    static String stripReasoning(String text) {
        if (text == null) {
            return "";
        }
        return REASONING_BLOCKS.matcher(text).replaceAll("").trim();
    }
}

package com.phillippitts.sessionscribe.service.stt.vosk;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Parses recogniser JSON into text, confidence and word-timing bounds.
 *
 * <p>Formats handled:
 * <ul>
 *   <li><b>Final:</b> {@code {"text": "...", "result": [{"word":..,"start":..,"end":..,"conf":..}]}}</li>
 *   <li><b>Alternatives:</b> {@code {"alternatives": [{"text": "...", "confidence": ...}]}}</li>
 *   <li><b>Partial:</b> {@code {"partial": "..."}}</li>
 * </ul>
 *
 * <p>Responses are capped at {@link #MAX_JSON_SIZE} before parsing.
 */
final class VoskJsonParser {

    private static final Logger LOG = LogManager.getLogger(VoskJsonParser.class);

    static final int MAX_JSON_SIZE = 1_048_576; // 1MB

    private static final VoskResult EMPTY = new VoskResult("", null, null, null);

    private VoskJsonParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses a final (or alternatives) result.
     *
     * @return parsed result; empty text on blank or malformed input
     */
    static VoskResult parseFinal(String json) {
        if (json == null || json.isBlank()) {
            return EMPTY;
        }
        try {
            JSONObject obj = new JSONObject(truncateIfNeeded(json));
            if (obj.has("alternatives")) {
                JSONArray alternatives = obj.getJSONArray("alternatives");
                if (alternatives.isEmpty()) {
                    return EMPTY;
                }
                JSONObject first = alternatives.getJSONObject(0);
                Double confidence = first.has("confidence") ? clamp(first.getDouble("confidence")) : null;
                return withTimings(first.optString("text", "").trim(), confidence, first.optJSONArray("result"));
            }
            JSONArray words = obj.optJSONArray("result");
            return withTimings(obj.optString("text", "").trim(), averageConfidence(words), words);
        } catch (JSONException e) {
            LOG.warn("Failed to parse recogniser result ({} chars)", json.length(), e);
            return EMPTY;
        }
    }

    /**
     * Extracts the partial hypothesis text; empty on blank or malformed input.
     */
    static String parsePartial(String json) {
        if (json == null || json.isBlank()) {
            return "";
        }
        try {
            return new JSONObject(truncateIfNeeded(json)).optString("partial", "").trim();
        } catch (JSONException e) {
            LOG.warn("Failed to parse recogniser partial ({} chars)", json.length(), e);
            return "";
        }
    }

    private static VoskResult withTimings(String text, Double confidence, JSONArray words) {
        if (words == null || words.isEmpty()) {
            return new VoskResult(text, confidence, null, null);
        }
        JSONObject first = words.getJSONObject(0);
        JSONObject last = words.getJSONObject(words.length() - 1);
        Double start = first.has("start") ? first.getDouble("start") : null;
        Double end = last.has("end") ? last.getDouble("end") : null;
        return new VoskResult(text, confidence, start, end);
    }

    private static Double averageConfidence(JSONArray words) {
        if (words == null || words.isEmpty()) {
            return null;
        }
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < words.length(); i++) {
            JSONObject word = words.getJSONObject(i);
            if (word.has("conf")) {
                sum += word.getDouble("conf");
                count++;
            }
        }
        return count > 0 ? clamp(sum / count) : null;
    }

    private static double clamp(double raw) {
        return Math.min(1.0, Math.max(0.0, raw));
    }

    private static String truncateIfNeeded(String json) {
        if (json.length() > MAX_JSON_SIZE) {
            LOG.warn("Recogniser JSON exceeds {}B cap (actual: {}B); truncating", MAX_JSON_SIZE, json.length());
            return json.substring(0, MAX_JSON_SIZE);
        }
        return json;
    }

    /**
     * @param text         recognised text, possibly empty
     * @param confidence   0.0..1.0 or {@code null} when the recogniser gave none
     * @param startSeconds first word start relative to the recogniser's audio origin
     * @param endSeconds   last word end relative to the recogniser's audio origin
     */
    record VoskResult(String text, Double confidence, Double startSeconds, Double endSeconds) {

        boolean isEmpty() {
            return text.isEmpty();
        }
    }
}

package com.chartbot.ai;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * Pulls the JSON object out of a model reply that may be wrapped in prose or code fences.
 */
final class JsonReplies {
    private JsonReplies() {
    }

    static JSONObject extractObject(String reply) throws JSONException {
        String text = reply == null ? "" : reply.trim();
        text = text.replace("```json", "").replace("```JSON", "").replace("```", "").trim();
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new JSONException("no JSON object in model reply");
        }
        return new JSONObject(text.substring(start, end + 1));
    }
}

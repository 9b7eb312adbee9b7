package com.chartbot.db;

import com.chartbot.model.EconomicEvent;
import com.chartbot.model.ImpactLevel;
import com.chartbot.model.TradeSetup;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Column conversions shared by the DAOs: UTC timestamps and the JSON text columns.
 */
final class RowCodec {
    private RowCodec() {
    }

    static OffsetDateTime utc(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    static Instant instant(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }

    static String stringsToJson(List<String> values) {
        JSONArray arr = new JSONArray();
        if (values != null) {
            for (String value : values) {
                if (value != null) {
                    arr.put(value);
                }
            }
        }
        return arr.toString();
    }

    static List<String> jsonToStrings(String json) {
        List<String> out = new ArrayList<>();
        if (json == null || json.trim().isEmpty()) {
            return out;
        }
        try {
            JSONArray arr = new JSONArray(json);
            for (int i = 0; i < arr.length(); i++) {
                out.add(arr.optString(i, ""));
            }
        } catch (JSONException e) {
            throw new IllegalStateException("stored string list is not a JSON array", e);
        }
        return out;
    }

    static String tradeSetupToJson(TradeSetup setup) {
        if (setup == null) {
            return null;
        }
        JSONObject obj = new JSONObject();
        obj.put("quality", setup.quality == null ? JSONObject.NULL : setup.quality);
        obj.put("entryPrice", setup.entryPrice == null ? JSONObject.NULL : setup.entryPrice);
        obj.put("stopLoss", setup.stopLoss == null ? JSONObject.NULL : setup.stopLoss);
        obj.put("targetPrice", setup.targetPrice == null ? JSONObject.NULL : setup.targetPrice);
        obj.put("riskRewardRatio", setup.riskRewardRatio == null ? JSONObject.NULL : setup.riskRewardRatio);
        obj.put("description", setup.description == null ? JSONObject.NULL : setup.description);
        return obj.toString();
    }

    static TradeSetup jsonToTradeSetup(String json) {
        if (json == null || json.trim().isEmpty()) {
            return null;
        }
        JSONObject obj = new JSONObject(json);
        return new TradeSetup(
                optText(obj, "quality"),
                optNumber(obj, "entryPrice"),
                optNumber(obj, "stopLoss"),
                optNumber(obj, "targetPrice"),
                optNumber(obj, "riskRewardRatio"),
                optText(obj, "description")
        );
    }

    static String eventsToJson(List<EconomicEvent> events) {
        JSONArray arr = new JSONArray();
        if (events != null) {
            for (EconomicEvent e : events) {
                JSONObject obj = new JSONObject();
                obj.put("eventId", nullable(e.eventId));
                obj.put("time", e.time == null ? JSONObject.NULL : e.time.toString());
                obj.put("country", nullable(e.country));
                obj.put("currency", nullable(e.currency));
                obj.put("title", nullable(e.title));
                obj.put("impact", e.impact.name().toLowerCase());
                obj.put("category", nullable(e.category));
                obj.put("actual", nullable(e.actual));
                obj.put("forecast", nullable(e.forecast));
                obj.put("previous", nullable(e.previous));
                obj.put("source", nullable(e.source));
                arr.put(obj);
            }
        }
        return arr.toString();
    }

    static List<EconomicEvent> jsonToEvents(String json) {
        List<EconomicEvent> out = new ArrayList<>();
        if (json == null || json.trim().isEmpty()) {
            return out;
        }
        JSONArray arr = new JSONArray(json);
        for (int i = 0; i < arr.length(); i++) {
            JSONObject obj = arr.optJSONObject(i);
            if (obj == null) {
                continue;
            }
            String time = optText(obj, "time");
            out.add(new EconomicEvent(
                    optText(obj, "eventId"),
                    time == null ? null : Instant.parse(time),
                    optText(obj, "country"),
                    optText(obj, "currency"),
                    optText(obj, "title"),
                    ImpactLevel.fromLabel(optText(obj, "impact")),
                    optText(obj, "category"),
                    optText(obj, "actual"),
                    optText(obj, "forecast"),
                    optText(obj, "previous"),
                    optText(obj, "source")
            ));
        }
        return out;
    }

    private static Object nullable(String value) {
        return value == null ? JSONObject.NULL : value;
    }

    private static String optText(JSONObject obj, String key) {
        if (!obj.has(key) || obj.isNull(key)) {
            return null;
        }
        return obj.optString(key, null);
    }

    private static Double optNumber(JSONObject obj, String key) {
        if (!obj.has(key) || obj.isNull(key)) {
            return null;
        }
        double value = obj.optDouble(key, Double.NaN);
        return Double.isFinite(value) ? value : null;
    }
}

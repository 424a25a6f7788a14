package com.labelops.core.ai;

import com.labelops.config.MappingField;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the model's JSON answer into {@link Suggestion}s.
 */
final class SuggestionParser {
    private static final Pattern FENCE_OPEN = Pattern.compile("^```[A-Za-z0-9_-]*\\n?");
    private static final Pattern OBJECT = Pattern.compile("\\{.*\\}", Pattern.DOTALL);
    private static final Map<String, MappingField> ALIASES = Map.of(
        "name", MappingField.FULL_NAME,
        "recipient", MappingField.FULL_NAME,
        "line1", MappingField.ADDRESS_LINE_1,
        "line2", MappingField.ADDRESS_LINE_2,
        "town", MappingField.TOWN_CITY,
        "city", MappingField.TOWN_CITY,
        "state", MappingField.COUNTY,
        "zip", MappingField.POSTCODE);

    private SuggestionParser() {
    }

    /**
     * @param dropNames discard suggestions for the recipient name
     */
    static List<Suggestion> parse(String modelOutput, boolean dropNames) throws CorrectorUnavailableException {
        JSONObject answer;
        try {
            answer = new JSONObject(extractObject(modelOutput));
        } catch (JSONException ex) {
            throw new CorrectorUnavailableException("Model output was not valid JSON", ex);
        }

        RiskLevel overall = RiskLevel.fromString(answer.optString("overall_risk", "high"));
        JSONArray items = answer.optJSONArray("suggestions");
        if (items == null) {
            return List.of();
        }

        List<Suggestion> suggestions = new ArrayList<>();
        for (int i = 0; i < items.length(); i++) {
            JSONObject item = items.optJSONObject(i);
            if (item == null) {
                continue;
            }
            Optional<MappingField> field = field(item.optString("field", ""));
            if (field.isEmpty() || field.get() == MappingField.WEIGHT_KG) {
                continue;
            }
            if (dropNames && field.get() == MappingField.FULL_NAME) {
                continue;
            }
            RiskLevel risk = item.has("risk") ? RiskLevel.fromString(item.optString("risk")) : overall;
            suggestions.add(new Suggestion(
                field.get(),
                item.optString("suggested", item.optString("proposed_value", "")),
                item.optDouble("confidence", 0.0),
                risk,
                item.optString("reason", "")
            ));
        }
        return suggestions;
    }

    static String extractObject(String text) throws CorrectorUnavailableException {
        String stripped = text == null ? "" : text.strip();
        if (stripped.startsWith("```")) {
            stripped = FENCE_OPEN.matcher(stripped).replaceFirst("").replace("```", "").strip();
        }
        if (stripped.startsWith("{") && stripped.endsWith("}")) {
            return stripped;
        }
        Matcher matcher = OBJECT.matcher(stripped);
        if (matcher.find()) {
            return matcher.group();
        }
        throw new CorrectorUnavailableException("No JSON object found in model output");
    }

    private static Optional<MappingField> field(String name) {
        String key = name.trim().toLowerCase(Locale.ROOT);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        MappingField alias = ALIASES.get(key);
        return alias != null ? Optional.of(alias) : MappingField.fromKey(key);
    }
}

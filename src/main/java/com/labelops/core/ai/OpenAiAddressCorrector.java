package com.labelops.core.ai;

import com.labelops.config.MappingField;
import com.labelops.core.parse.AddressRecord;
import com.labelops.logging.AppLogger;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Asks the OpenAI Responses API for address corrections. Only address fields are sent; the
 * recipient name is left out as well when name redaction is on.
 */
public final class OpenAiAddressCorrector implements AddressCorrector {
    private static final Logger LOGGER = AppLogger.get();

    static final URI DEFAULT_ENDPOINT = URI.create("https://api.openai.com/v1/responses");
    static final String DEFAULT_MODEL = "gpt-4o-mini";
    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private static final List<MappingField> ADDRESS_FIELDS = List.of(
        MappingField.ADDRESS_LINE_1,
        MappingField.ADDRESS_LINE_2,
        MappingField.TOWN_CITY,
        MappingField.COUNTY,
        MappingField.POSTCODE,
        MappingField.COUNTRY);

    private final HttpClient httpClient;
    private final URI endpoint;
    private final String apiKey;
    private final String model;
    private final Duration timeout;
    private final boolean redactNames;

    public OpenAiAddressCorrector(HttpClient httpClient,
                                  URI endpoint,
                                  String apiKey,
                                  String model,
                                  Duration timeout,
                                  boolean redactNames) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.endpoint = endpoint == null ? DEFAULT_ENDPOINT : endpoint;
        this.apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey.trim();
        this.model = model == null || model.isBlank() ? DEFAULT_MODEL : model.trim();
        this.timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        this.redactNames = redactNames;
    }

    /**
     * Builds a corrector from {@code OPENAI_API_KEY}, {@code OPENAI_MODEL},
     * {@code OPENAI_TIMEOUT_SECONDS} and {@code AI_REDACT_NAMES}.
     */
    public static OpenAiAddressCorrector fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static OpenAiAddressCorrector fromEnvironment(Function<String, String> env) {
        Duration timeout = DEFAULT_TIMEOUT;
        String rawTimeout = env.apply("OPENAI_TIMEOUT_SECONDS");
        if (rawTimeout != null && !rawTimeout.isBlank()) {
            try {
                timeout = Duration.ofSeconds(Math.max(1, Long.parseLong(rawTimeout.trim())));
            } catch (NumberFormatException ex) {
                LOGGER.warning("Ignoring OPENAI_TIMEOUT_SECONDS=%s; using %ds"
                    .formatted(rawTimeout, DEFAULT_TIMEOUT.toSeconds()));
            }
        }
        HttpClient client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(20))
            .build();
        return new OpenAiAddressCorrector(
            client,
            DEFAULT_ENDPOINT,
            env.apply("OPENAI_API_KEY"),
            env.apply("OPENAI_MODEL"),
            timeout,
            "1".equals(env.apply("AI_REDACT_NAMES")));
    }

    public boolean isConfigured() {
        return apiKey != null;
    }

    @Override
    public List<Suggestion> suggest(AddressRecord record) throws CorrectorUnavailableException {
        Objects.requireNonNull(record, "record");
        if (apiKey == null) {
            throw new CorrectorUnavailableException("OPENAI_API_KEY is not set");
        }

        JSONObject body = new JSONObject()
            .put("model", model)
            .put("input", buildPrompt(record));
        HttpRequest request = HttpRequest.newBuilder(endpoint)
            .timeout(timeout)
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException ex) {
            throw new CorrectorUnavailableException("Correction request timed out after %ds".formatted(timeout.toSeconds()), ex);
        } catch (IOException ex) {
            throw new CorrectorUnavailableException("Correction request failed: " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CorrectorUnavailableException("Correction request interrupted", ex);
        }

        if (response.statusCode() / 100 != 2) {
            throw new CorrectorUnavailableException("Correction service returned HTTP " + response.statusCode());
        }
        return SuggestionParser.parse(outputText(response.body()), redactNames);
    }

    String buildPrompt(AddressRecord record) {
        JSONObject payload = new JSONObject();
        if (!redactNames) {
            payload.put(MappingField.FULL_NAME.key(), record.fullName());
        }
        for (MappingField field : ADDRESS_FIELDS) {
            payload.put(field.key(), record.value(field));
        }
        return """
            You are an address correction assistant. Do NOT invent missing fields. \
            Only suggest changes when you are highly confident. Output STRICT JSON only, no prose.

            JSON schema:
            {
              "suggestions": [
                {"field": "country", "suggested": "UNITED KINGDOM", "reason": "typo fix", "confidence": 0.92, "risk": "low"}
              ],
              "overall_risk": "low|medium|high"
            }

            Record:
            """ + payload.toString(2);
    }

    /**
     * Concatenates the text parts of a Responses API answer.
     */
    static String outputText(String responseBody) throws CorrectorUnavailableException {
        JSONObject json;
        try {
            json = new JSONObject(responseBody);
        } catch (JSONException ex) {
            throw new CorrectorUnavailableException("Correction service returned malformed JSON", ex);
        }
        String direct = json.optString("output_text", "");
        if (!direct.isBlank()) {
            return direct;
        }
        StringBuilder text = new StringBuilder();
        JSONArray output = json.optJSONArray("output");
        if (output != null) {
            for (int i = 0; i < output.length(); i++) {
                JSONObject item = output.optJSONObject(i);
                JSONArray content = item == null ? null : item.optJSONArray("content");
                if (content == null) {
                    continue;
                }
                for (int j = 0; j < content.length(); j++) {
                    JSONObject part = content.optJSONObject(j);
                    if (part != null && "output_text".equals(part.optString("type"))) {
                        text.append(part.optString("text", ""));
                    }
                }
            }
        }
        if (text.length() == 0) {
            throw new CorrectorUnavailableException("Correction service returned no text output");
        }
        return text.toString();
    }
}

package io.huddle.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.huddle.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrubs secrets from audit details. Agents paste connection strings into messages and
 * {@code credential} memory entries, so free text is checked as well as key names.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential"
    );
    private static final Pattern INLINE_ASSIGNMENT = Pattern.compile(
            "(?i)\\b(password|passwd|pwd|secret|token|api[_-]?key)(\\s*[=:]\\s*)([^\\s,;]+)"
    );
    private static final Pattern URL_CREDENTIALS = Pattern.compile("(://[^:/\\s@]+:)([^@\\s]+)(@)");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                String key = entry.getKey();
                JsonNode value = entry.getValue();
                if (isSensitiveKey(key)) {
                    out.put(key, MASK);
                } else {
                    out.set(key, masked(value));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual()) {
            String text = input.asText("");
            if (likelySecretValue(text)) {
                return Jsons.mapper().getNodeFactory().textNode(MASK);
            }
            return Jsons.mapper().getNodeFactory().textNode(maskInline(text));
        }
        return input;
    }

    /**
     * Replaces {@code key=value} secrets and URL passwords inside free text.
     */
    public static String maskInline(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        Matcher m = INLINE_ASSIGNMENT.matcher(text);
        String out = m.replaceAll("$1$2" + MASK);
        return URL_CREDENTIALS.matcher(out).replaceAll("$1" + MASK + "$3");
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean likelySecretValue(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        if (v.length() < 24) {
            return false;
        }
        // Long opaque tokens with no spaces.
        return v.matches("^[A-Za-z0-9+/=_\\-:.]{24,}$");
    }
}

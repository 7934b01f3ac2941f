package com.statementradar.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.statementradar.domain.ExtractedStatement;
import com.statementradar.domain.ExtractionErrorCode;
import com.statementradar.domain.LineItem;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns the vision service's free-text answer into an {@link ExtractedStatement}.
 * The JSON object is cut out between the first '{' and the last '}', so markdown fences
 * and leading prose are tolerated.
 */
@Component
@RequiredArgsConstructor
public class ExtractionResponseParser {

    /** Confidence of a field returned as a bare number or without a confidence of its own. */
    static final double DEFAULT_CONFIDENCE = 0.5;

    private static final Pattern YEAR_KEY = Pattern.compile("base_year|year_\\d+");
    private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9.\\-]");

    private final ObjectMapper objectMapper;

    /**
     * Concatenated text blocks of a Messages API response body.
     */
    public String messageText(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            throw new ExtractionFatalException(ExtractionErrorCode.EMPTY_RESPONSE, "Vision service returned an empty body");
        }
        JsonNode root = readTree(responseBody);
        StringBuilder text = new StringBuilder();
        for (JsonNode block : root.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText(""));
            }
        }
        if (text.isEmpty()) {
            throw new ExtractionFatalException(ExtractionErrorCode.EMPTY_RESPONSE, "Vision service returned no text content");
        }
        return text.toString();
    }

    public ExtractedStatement parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ExtractionFatalException(ExtractionErrorCode.EMPTY_RESPONSE, "Extraction response is empty");
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new ExtractionFatalException(ExtractionErrorCode.MALFORMED_RESPONSE, "No JSON object in extraction response");
        }
        JsonNode root = readTree(text.substring(start, end + 1));
        if (!root.isObject()) {
            throw new ExtractionFatalException(ExtractionErrorCode.MALFORMED_RESPONSE, "Extraction response is not a JSON object");
        }

        List<String> years = new ArrayList<>();
        for (JsonNode year : root.path("years_detected")) {
            String y = year.asText("").trim();
            if (!y.isEmpty()) {
                years.add(y);
            }
        }
        String baseYear = textOrNull(root.get("base_year"));
        if (baseYear == null && !years.isEmpty()) {
            baseYear = years.get(0);
        }

        Map<String, Map<String, LineItem>> lineItems = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> categories = root.path("line_items").fields();
        while (categories.hasNext()) {
            Map.Entry<String, JsonNode> category = categories.next();
            if (!category.getValue().isObject()) {
                continue;
            }
            Map<String, LineItem> fields = parseFields(category.getValue());
            if (!fields.isEmpty()) {
                lineItems.put(category.getKey(), fields);
            }
        }

        return new ExtractedStatement(
                textOrNull(root.get("company_name")),
                textOrNull(root.get("period")),
                textOrNull(root.get("currency")),
                years,
                baseYear,
                lineItems,
                parseFields(root.path("summary_metrics")),
                textOrNull(root.get("notes")));
    }

    private Map<String, LineItem> parseFields(JsonNode node) {
        Map<String, LineItem> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            LineItem item = parseItem(field.getValue());
            if (item != null) {
                fields.put(field.getKey(), item);
            }
        }
        return fields;
    }

    private static LineItem parseItem(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            BigDecimal bare = decimal(node);
            return bare == null ? null : LineItem.of(bare, DEFAULT_CONFIDENCE);
        }
        Map<String, BigDecimal> yearValues = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (YEAR_KEY.matcher(e.getKey()).matches()) {
                yearValues.put(e.getKey(), decimal(e.getValue()));
            }
        }
        double confidence = Math.max(0.0, Math.min(1.0, node.path("confidence").asDouble(DEFAULT_CONFIDENCE)));
        return new LineItem(decimal(node.get("value")), confidence, yearValues, textOrNull(node.get("source")), null);
    }

    /**
     * Numbers pass through; strings are cleaned of grouping and currency symbols,
     * and "(1,234)" reads as -1234. Anything unparseable is null.
     */
    static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (!node.isTextual()) {
            return null;
        }
        String raw = node.asText().trim();
        boolean negative = raw.startsWith("(") && raw.endsWith(")");
        String cleaned = NON_NUMERIC.matcher(raw).replaceAll("");
        if (cleaned.isEmpty() || "-".equals(cleaned) || ".".equals(cleaned)) {
            return null;
        }
        try {
            BigDecimal value = new BigDecimal(cleaned);
            return negative ? value.abs().negate() : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        String text = node.asText("").trim();
        return text.isEmpty() ? null : text;
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ExtractionFatalException(ExtractionErrorCode.MALFORMED_RESPONSE,
                    "Extraction response is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}

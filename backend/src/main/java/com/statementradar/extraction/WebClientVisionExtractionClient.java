package com.statementradar.extraction;

import com.statementradar.domain.ExtractedStatement;
import com.statementradar.domain.ExtractionErrorCode;
import com.statementradar.domain.PageImage;
import com.statementradar.extraction.config.VisionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Vision extraction over the Anthropic Messages API using WebClient. Sends the page image and its
 * raw text, then parses the JSON object out of the model's answer.
 */
@Slf4j
public class WebClientVisionExtractionClient implements VisionExtractionClient {

    static final String MESSAGES_PATH = "/v1/messages";

    private static final String PROMPT_TEMPLATE = """
            Extract every line item from this %s page as JSON only.
            Use relative years: base_year is the primary (most recent) column, year_1, year_2, year_3 are older columns.
            Shape:
            {"company_name": "", "period": "", "currency": "", "years_detected": ["2024", "2023"], "base_year": "2024",
             "line_items": {"<category>": {"<field>": {"value": 0, "confidence": 0.0, "base_year": 0, "year_1": 0}}},
             "summary_metrics": {"<metric>": {"value": 0, "confidence": 0.0}},
             "notes": ""}
            Use snake_case names, numbers without separators, negative numbers for parenthesized amounts,
            and null for values you cannot read.
            Text layer of the page for reference:
            %s
            """;

    private final WebClient webClient;
    private final VisionProperties properties;
    private final ExtractionResponseParser parser;
    private final ExtractionErrorClassifier errorClassifier;

    public WebClientVisionExtractionClient(WebClient.Builder builder,
                                           VisionProperties properties,
                                           ExtractionResponseParser parser,
                                           ExtractionErrorClassifier errorClassifier) {
        this.webClient = builder.baseUrl(properties.getBaseUrl()).build();
        this.properties = properties;
        this.parser = parser;
        this.errorClassifier = errorClassifier;
    }

    @Override
    public ExtractedStatement extract(PageImage image, String statementTypeHint, String rawText) {
        if (image == null || image.isEmpty()) {
            throw new ExtractionFatalException(ExtractionErrorCode.MISSING_IMAGE, "Page image is missing");
        }
        String body = webClient.post()
                .uri(MESSAGES_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .header("x-api-key", properties.getApiKey())
                .header("anthropic-version", properties.getApiVersion())
                .bodyValue(requestBody(image, statementTypeHint, rawText))
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class, errorClassifier::classify)
                .block(Duration.ofMillis(properties.getTimeoutMs()));
        ExtractedStatement statement = parser.parse(parser.messageText(body));
        log.debug("Vision service returned {} line items for a {} page", statement.lineItemCount(), statementTypeHint);
        return statement;
    }

    Map<String, Object> requestBody(PageImage image, String statementTypeHint, String rawText) {
        String mediaType = image.mediaType() != null ? image.mediaType() : MediaType.IMAGE_PNG_VALUE;
        String prompt = String.format(PROMPT_TEMPLATE,
                statementTypeHint != null ? statementTypeHint.replace('_', ' ') : "financial statement",
                rawText != null ? rawText : "");
        Map<String, Object> imageBlock = Map.of(
                "type", "image",
                "source", Map.of("type", "base64", "media_type", mediaType, "data", image.base64()));
        Map<String, Object> textBlock = Map.of("type", "text", "text", prompt);
        return Map.of(
                "model", properties.getModel(),
                "max_tokens", properties.getMaxTokens(),
                "messages", List.of(Map.of("role", "user", "content", List.of(imageBlock, textBlock))));
    }
}

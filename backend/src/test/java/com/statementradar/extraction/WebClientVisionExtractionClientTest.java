package com.statementradar.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.statementradar.domain.ExtractedStatement;
import com.statementradar.domain.ExtractionErrorCode;
import com.statementradar.domain.PageImage;
import com.statementradar.extraction.config.VisionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientVisionExtractionClientTest {

    private static final PageImage IMAGE = new PageImage("image/png", "png-bytes".getBytes(StandardCharsets.UTF_8));

    private VisionProperties properties;
    private AtomicReference<ClientRequest> lastRequest;

    @BeforeEach
    void setUp() {
        properties = new VisionProperties();
        properties.setBaseUrl("https://vision.test");
        properties.setApiKey("test-key");
        properties.setTimeoutMs(5_000);
        lastRequest = new AtomicReference<>();
    }

    @Test
    void extract_okResponse_parsesStatement() {
        String body = """
                {"content": [{"type": "text", "text": "{\\"company_name\\": \\"ABC\\", \\"line_items\\": {\\"equity\\": {\\"share_capital\\": {\\"value\\": 100, \\"confidence\\": 0.9}}}}"}]}
                """;
        WebClientVisionExtractionClient client = client(HttpStatus.OK, body);

        ExtractedStatement s = client.extract(IMAGE, "balance_sheet", "raw text");

        assertThat(s.companyName()).isEqualTo("ABC");
        assertThat(s.lineItems().get("equity").get("share_capital").value()).isEqualByComparingTo("100");
        ClientRequest request = lastRequest.get();
        assertThat(request.url().toString()).isEqualTo("https://vision.test/v1/messages");
        assertThat(request.headers().getFirst("x-api-key")).isEqualTo("test-key");
        assertThat(request.headers().getFirst("anthropic-version")).isEqualTo("2023-06-01");
    }

    @Test
    void extract_tooManyRequests_transient() {
        WebClientVisionExtractionClient client = client(HttpStatus.TOO_MANY_REQUESTS, "{\"error\": \"slow down\"}");

        assertThatThrownBy(() -> client.extract(IMAGE, "balance_sheet", "raw text"))
                .isInstanceOf(ExtractionTransientException.class);
    }

    @Test
    void extract_serverError_fatal() {
        WebClientVisionExtractionClient client = client(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\": \"boom\"}");

        assertThatThrownBy(() -> client.extract(IMAGE, "balance_sheet", "raw text"))
                .isInstanceOf(ExtractionFatalException.class)
                .extracting("errorCode").isEqualTo(ExtractionErrorCode.SERVICE_ERROR);
    }

    @Test
    void extract_answerWithoutJson_malformed() {
        String body = "{\"content\": [{\"type\": \"text\", \"text\": \"Sorry, unreadable.\"}]}";
        WebClientVisionExtractionClient client = client(HttpStatus.OK, body);

        assertThatThrownBy(() -> client.extract(IMAGE, "income_statement", "raw text"))
                .isInstanceOf(ExtractionFatalException.class)
                .extracting("errorCode").isEqualTo(ExtractionErrorCode.MALFORMED_RESPONSE);
    }

    @Test
    void extract_missingImage_failsWithoutCallingService() {
        WebClientVisionExtractionClient client = client(HttpStatus.OK, "{}");

        assertThatThrownBy(() -> client.extract(null, "balance_sheet", "raw text"))
                .isInstanceOf(ExtractionFatalException.class)
                .extracting("errorCode").isEqualTo(ExtractionErrorCode.MISSING_IMAGE);
        assertThat(lastRequest.get()).isNull();
    }

    @Test
    @SuppressWarnings("unchecked")
    void requestBody_carriesImageAndPrompt() {
        WebClientVisionExtractionClient client = client(HttpStatus.OK, "{}");

        Map<String, Object> body = client.requestBody(IMAGE, "cash_flow", "Net increase in cash 1,000");

        assertThat(body).containsEntry("model", properties.getModel()).containsEntry("max_tokens", properties.getMaxTokens());
        Map<String, Object> message = ((List<Map<String, Object>>) body.get("messages")).get(0);
        List<Map<String, Object>> content = (List<Map<String, Object>>) message.get("content");
        Map<String, Object> source = (Map<String, Object>) content.get(0).get("source");
        assertThat(source).containsEntry("media_type", "image/png").containsEntry("data", IMAGE.base64());
        assertThat((String) content.get(1).get("text")).contains("cash flow").contains("Net increase in cash 1,000");
    }

    private WebClientVisionExtractionClient client(HttpStatus status, String responseBody) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            lastRequest.set(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(responseBody)
                    .build());
        });
        return new WebClientVisionExtractionClient(builder, properties,
                new ExtractionResponseParser(new ObjectMapper()), new ExtractionErrorClassifier());
    }
}

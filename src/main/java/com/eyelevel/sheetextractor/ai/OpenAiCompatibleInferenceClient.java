package com.eyelevel.sheetextractor.ai;

import com.eyelevel.sheetextractor.ai.dto.ChatCompletionRequest;
import com.eyelevel.sheetextractor.ai.dto.ChatCompletionResponse;
import com.eyelevel.sheetextractor.ai.dto.ChatMessage;
import com.eyelevel.sheetextractor.common.apiclient.ApiClient;
import com.eyelevel.sheetextractor.common.apiclient.authentication.Authentication;
import com.eyelevel.sheetextractor.common.apiclient.model.ApiRequest;
import com.eyelevel.sheetextractor.common.apiclient.model.ApiResponse;
import com.eyelevel.sheetextractor.common.json.JsonParser;
import com.eyelevel.sheetextractor.common.json.JsonSerializer;
import com.eyelevel.sheetextractor.exception.apiclient.ApiException;
import com.eyelevel.sheetextractor.exception.apiclient.GatewayTimeoutException;
import com.eyelevel.sheetextractor.exception.apiclient.TooManyRequestsException;
import com.eyelevel.sheetextractor.exception.json.JsonParsingException;
import com.eyelevel.sheetextractor.exception.processing.AiInvalidResponseException;
import com.eyelevel.sheetextractor.exception.processing.AiRateLimitedException;
import com.eyelevel.sheetextractor.exception.processing.AiTimeoutException;
import com.eyelevel.sheetextractor.exception.processing.PermanentProcessingException;
import com.eyelevel.sheetextractor.exception.processing.TransientProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link AiInferenceClient} for any service speaking the OpenAI chat-completions protocol.
 * <p>
 * Each call sends one sheet as JSON and asks for a JSON object back (JSON mode). The model reports its own
 * confidence in a top-level {@code confidence} field, which is removed from the payload; when it is
 * missing or unreadable {@value #DEFAULT_CONFIDENCE} is used.
 */
@Slf4j
@Service("openAiCompatibleInferenceClient")
public class OpenAiCompatibleInferenceClient extends ApiClient implements AiInferenceClient {

    static final double DEFAULT_CONFIDENCE = 0.7;
    static final String CONFIDENCE_FIELD = "confidence";

    private static final String SYSTEM_PROMPT = """
            You are a data extraction expert. You receive one sheet of a spreadsheet as JSON with its \
            column headers and rows. Return a single JSON object with the key information.
            If the sheet is an invoice, use these fields: invoice_number (string), invoice_date \
            (yyyy-MM-dd), vendor_name, customer_name, currency, subtotal (number), tax_amount (number), \
            total_amount (number) and line_items (array of objects with description, quantity, \
            unit_price and amount).
            Otherwise return the table as "records" (array of objects keyed by column name) and add any \
            document-level values you can identify as top-level fields.
            Always add "confidence": a number between 0.0 and 1.0 telling how reliable the extraction is.""";

    private final JsonParser jsonParser;
    private final JsonSerializer jsonSerializer;
    private final String model;
    private final String inferEndpoint;
    private final double temperature;
    private final int maxTokens;
    private final int maxRowsPerCall;

    public OpenAiCompatibleInferenceClient(@Qualifier("aiWebClient") final WebClient webClient,
                                           @Qualifier("aiAuthentication") final Authentication authentication,
                                           @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
                                           @Qualifier("jacksonJsonSerializer") final JsonSerializer jsonSerializer,
                                           @Value("${app.ai-client.model}") final String model,
                                           @Value("${app.ai-client.endpoint.infer:/v1/chat/completions}")
                                           final String inferEndpoint,
                                           @Value("${app.ai-client.timeout-seconds:60}") final long timeoutSeconds,
                                           @Value("${app.ai-client.temperature:0.0}") final double temperature,
                                           @Value("${app.ai-client.max-tokens:4096}") final int maxTokens,
                                           @Value("${app.ai-client.max-rows-per-call:500}") final int maxRowsPerCall) {
        super(webClient, authentication, Duration.ofSeconds(timeoutSeconds));
        this.jsonParser = jsonParser;
        this.jsonSerializer = jsonSerializer;
        this.model = model;
        this.inferEndpoint = inferEndpoint;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.maxRowsPerCall = maxRowsPerCall;
    }

    @Override
    public AiInferenceResult infer(final AiInferenceRequest request) {
        log.info("[{}] Requesting extraction for sheet '{}' ({} rows).", request.jobId(), request.unitName(),
                 request.rows().size());
        final ApiRequest apiRequest = ApiRequest.builder()
                                                .method(HttpMethod.POST)
                                                .path(inferEndpoint)
                                                .contentType(MediaType.APPLICATION_JSON)
                                                .acceptMediaType(MediaType.APPLICATION_JSON)
                                                .body(buildCompletionRequest(request))
                                                .build();
        final ApiResponse response = send(apiRequest, request);
        final Map<String, Object> payload = parsePayload(response, request);
        final double confidence = takeConfidence(payload);
        log.debug("[{}] Sheet '{}' extracted with {} fields, confidence {}.", request.jobId(), request.unitName(),
                  payload.size(), confidence);
        return new AiInferenceResult(payload, confidence);
    }

    private ChatCompletionRequest buildCompletionRequest(final AiInferenceRequest request) {
        final List<Map<String, Object>> rows = request.rows().size() > maxRowsPerCall
                                               ? request.rows().subList(0, maxRowsPerCall)
                                               : request.rows();
        final Map<String, Object> sheet = new LinkedHashMap<>();
        sheet.put("sheet", request.unitName());
        sheet.put("format", request.subtype());
        sheet.put("columns", request.columns());
        sheet.put("rows", rows);
        if (rows.size() < request.rows().size()) {
            sheet.put("truncated_rows", request.rows().size() - rows.size());
        }
        return new ChatCompletionRequest(model,
                                         List.of(new ChatMessage("system", SYSTEM_PROMPT),
                                                 new ChatMessage("user", jsonSerializer.serialize(sheet))),
                                         temperature, maxTokens, ChatCompletionRequest.JSON_OBJECT);
    }

    private ApiResponse send(final ApiRequest apiRequest, final AiInferenceRequest request) {
        try {
            return call(apiRequest);
        } catch (final TooManyRequestsException e) {
            throw new AiRateLimitedException("AI service rate limited the call for sheet '" + request.unitName() + "'",
                                             e);
        } catch (final GatewayTimeoutException e) {
            throw new AiTimeoutException("AI call for sheet '" + request.unitName() + "' timed out", e);
        } catch (final ApiException e) {
            if (e.getStatusCode() >= 500 || e.getStatusCode() == 408) {
                throw new TransientProcessingException(
                        "AI service error " + e.getStatusCode() + " for sheet '" + request.unitName() + "'", e);
            }
            throw new PermanentProcessingException("ai_request_rejected",
                                                   "status " + e.getStatusCode() + ": " + e.getMessage(), e);
        }
    }

    private Map<String, Object> parsePayload(final ApiResponse response, final AiInferenceRequest request) {
        final String content;
        try {
            final ChatCompletionResponse completion = jsonParser.parseObject(response.getData(),
                                                                             ChatCompletionResponse.class);
            if (completion == null || completion.choices() == null || completion.choices().isEmpty()
                || completion.choices().get(0).message() == null) {
                throw new AiInvalidResponseException("AI response for sheet '" + request.unitName()
                                                     + "' has no choices");
            }
            content = completion.choices().get(0).message().content();
        } catch (final JsonParsingException e) {
            throw new AiInvalidResponseException("AI response for sheet '" + request.unitName()
                                                 + "' is not a chat completion", e);
        }
        try {
            return jsonParser.parseMap(content);
        } catch (final JsonParsingException e) {
            throw new AiInvalidResponseException("AI answer for sheet '" + request.unitName()
                                                 + "' is not a JSON object", e);
        }
    }

    private static double takeConfidence(final Map<String, Object> payload) {
        final Object reported = payload.remove(CONFIDENCE_FIELD);
        double value = Double.NaN;
        if (reported instanceof Number number) {
            value = number.doubleValue();
        } else if (reported instanceof String text) {
            try {
                value = Double.parseDouble(text.trim());
            } catch (final NumberFormatException e) {
                log.debug("Ignoring unreadable confidence '{}'", text);
            }
        }
        return Double.isNaN(value) ? DEFAULT_CONFIDENCE : Math.max(0.0, Math.min(1.0, value));
    }
}

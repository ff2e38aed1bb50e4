package com.eyelevel.sheetextractor.common.apiclient;

import com.eyelevel.sheetextractor.common.apiclient.authentication.Authentication;
import com.eyelevel.sheetextractor.common.apiclient.model.ApiRequest;
import com.eyelevel.sheetextractor.common.apiclient.model.ApiResponse;
import com.eyelevel.sheetextractor.exception.apiclient.ApiException;
import com.eyelevel.sheetextractor.exception.apiclient.BadRequestException;
import com.eyelevel.sheetextractor.exception.apiclient.ConflictException;
import com.eyelevel.sheetextractor.exception.apiclient.GatewayTimeoutException;
import com.eyelevel.sheetextractor.exception.apiclient.InternalServerException;
import com.eyelevel.sheetextractor.exception.apiclient.NotFoundException;
import com.eyelevel.sheetextractor.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.sheetextractor.exception.apiclient.TooManyRequestsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Abstract base class for blocking API clients built on {@link WebClient}. It applies authentication and
 * headers, sends the request, and maps every failure onto the {@link ApiException} hierarchy by HTTP status,
 * so subclasses only deal with one exception family.
 */
@Slf4j
public abstract class ApiClient {

    protected final WebClient webClient;
    protected final Authentication authentication;
    private final Duration timeout;

    protected ApiClient(final WebClient webClient, final Authentication authentication, final Duration timeout) {
        this.webClient = webClient;
        this.authentication = authentication;
        this.timeout = timeout;
    }

    /**
     * Executes an API call and blocks for the response.
     *
     * @param apiRequest The API request to execute. Must not be null.
     * @return The response of a 2xx call.
     * @throws ApiException If the call failed, timed out or returned a non-2xx status.
     */
    protected ApiResponse call(@NonNull ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        log.debug("Calling API with method: {} and path: {}", apiRequest.getMethod(), apiRequest.getPath());

        try {
            WebClient.RequestBodySpec requestBodySpec = configureRequest(apiRequest);
            configureHeaders(apiRequest, requestBodySpec);
            configureBody(apiRequest, requestBodySpec);

            return requestBodySpec.exchangeToMono(this::handleResponse).timeout(timeout)
                                  .onErrorMap(this::mapException).block();
        } catch (ApiException e) {
            log.warn("API call to {} failed with status {}: {}", apiRequest.getPath(), e.getStatusCode(),
                     e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Unexpected error during API call to {}", apiRequest.getPath(), e);
            throw mapException(e);
        }
    }

    private RuntimeException mapException(Throwable error) {
        if (error instanceof ApiException apiException) {
            return apiException;
        }
        if (error instanceof WebClientResponseException webClientError) {
            return createException(webClientError.getResponseBodyAsString(), webClientError.getStatusCode().value());
        }
        if (error instanceof TimeoutException || error.getCause() instanceof TimeoutException) {
            return new GatewayTimeoutException("Request timed out after " + timeout.toMillis() + " ms");
        }
        if (error instanceof WebClientRequestException || error instanceof ConnectException
            || error instanceof UnknownHostException) {
            return new ServiceUnavailableException("Failed to connect to external service: " + error.getMessage());
        }
        if (error instanceof WebClientException) {
            return new ApiException("Unexpected WebClient error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value());
        }
        return new ApiException("Internal API client error: " + error.getMessage(),
                                HttpStatus.INTERNAL_SERVER_ERROR.value());
    }

    private WebClient.RequestBodySpec configureRequest(ApiRequest apiRequest) {
        return webClient.method(apiRequest.getMethod()).uri(uriBuilder -> {
            uriBuilder.path(apiRequest.getPath());
            Optional.ofNullable(apiRequest.getQueryParams())
                    .ifPresent(params -> params.forEach(uriBuilder::queryParam));
            return uriBuilder.build();
        });
    }

    private void configureHeaders(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        authentication.applyAuthentication(apiRequest.getHeaders());
        apiRequest.getHeaders().forEach(requestBodySpec::header);
        Optional.ofNullable(apiRequest.getAcceptMediaType()).ifPresent(requestBodySpec::accept);
    }

    private void configureBody(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        if (apiRequest.getBody() == null) {
            return;
        }
        MediaType contentType = Optional.ofNullable(apiRequest.getContentType()).orElse(MediaType.APPLICATION_JSON);
        requestBodySpec.contentType(contentType);
        try {
            requestBodySpec.body(BodyInserters.fromValue(apiRequest.getBody()));
        } catch (Exception e) {
            log.error("Invalid request body {}", e.getMessage());
            throw new BadRequestException("Invalid request body: " + e.getMessage());
        }
    }

    private Mono<ApiResponse> handleResponse(ClientResponse response) {
        final int statusCode = response.statusCode().value();
        if (!response.statusCode().is2xxSuccessful()) {
            return response.bodyToMono(String.class).defaultIfEmpty("")
                           .flatMap(body -> Mono.error(createException(body, statusCode)));
        }
        final HttpHeaders headers = response.headers().asHttpHeaders();
        final Instant timestamp = Instant.now();
        return response.bodyToMono(byte[].class).defaultIfEmpty(new byte[0])
                       .map(data -> ApiResponse.builder().data(data).contentType(headers.getContentType())
                                               .headers(headers).statusCode(statusCode).timestamp(timestamp)
                                               .build());
    }

    /**
     * Creates the {@link ApiException} subtype matching an HTTP error status.
     */
    private ApiException createException(String body, int statusCode) {
        ApiException exception = switch (statusCode) {
            case 400 -> new BadRequestException(body);
            case 404 -> new NotFoundException(body);
            case 409 -> new ConflictException(body);
            case 429 -> new TooManyRequestsException(body);
            case 500 -> new InternalServerException(body);
            case 503 -> new ServiceUnavailableException(body);
            case 504 -> new GatewayTimeoutException(body);
            default -> new ApiException(body, statusCode);
        };
        log.debug("Mapped status {} to {}", statusCode, exception.getClass().getSimpleName());
        return exception;
    }
}

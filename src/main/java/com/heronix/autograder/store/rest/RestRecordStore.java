package com.heronix.autograder.store.rest;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;

import com.heronix.autograder.config.AutograderProperties;
import com.heronix.autograder.exception.PersistenceException;
import com.heronix.autograder.store.RecordQuery;
import com.heronix.autograder.store.RecordStore;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Record store client for a PostgREST-compatible REST API (the API a Supabase
 * project exposes under /rest/v1).
 *
 * Row filters use PostgREST operators ({@code id=eq.42}); writes ask for the
 * written row back with {@code Prefer: return=representation}. Every call is
 * bounded by the configured timeout. Reads are retried with backoff on
 * transient failures; writes are sent exactly once.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Component
@ConditionalOnProperty(name = "heronix.autograder.store.mode", havingValue = "rest", matchIfMissing = true)
@Slf4j
public class RestRecordStore implements RecordStore {

    private static final ParameterizedTypeReference<List<Map<String, Object>>> ROWS =
            new ParameterizedTypeReference<>() {};

    private static final String RETURN_REPRESENTATION = "return=representation";

    private final WebClient webClient;
    private final Duration timeout;
    private final int retryAttempts;
    private final Duration retryDelay;

    public RestRecordStore(WebClient.Builder webClientBuilder, AutograderProperties properties) {
        AutograderProperties.StoreConfig store = properties.getStore();

        WebClient.Builder builder = webClientBuilder
                .baseUrl(store.getBaseUrl() + "/rest/v1")
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);

        String apiKey = store.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader("apikey", apiKey);
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }

        this.webClient = builder.build();
        this.timeout = Duration.ofSeconds(store.getTimeoutSeconds());
        this.retryAttempts = store.getRetryAttempts();
        this.retryDelay = Duration.ofMillis(store.getRetryDelayMs());

        log.info("REST_STORE: Initialized - store URL: {}", store.getBaseUrl());
    }

    @Override
    public String getMode() {
        return "rest";
    }

    @Override
    public Mono<Map<String, Object>> findById(String table, String id) {
        return read(table, webClient.get()
                .uri(builder -> builder.path("/{table}")
                        .queryParam("id", "eq." + id)
                        .queryParam("select", "*")
                        .build(table))
                .retrieve()
                .bodyToMono(ROWS))
                .flatMap(RestRecordStore::firstRow);
    }

    @Override
    public Mono<List<Map<String, Object>>> select(RecordQuery query) {
        return read(query.table(), webClient.get()
                .uri(builder -> buildQueryUri(builder, query))
                .retrieve()
                .bodyToMono(ROWS))
                .defaultIfEmpty(List.of());
    }

    @Override
    public Mono<Map<String, Object>> update(String table, String id, Map<String, Object> patch) {
        return write(table, webClient.patch()
                .uri(builder -> builder.path("/{table}")
                        .queryParam("id", "eq." + id)
                        .build(table))
                .header("Prefer", RETURN_REPRESENTATION)
                .bodyValue(patch)
                .retrieve()
                .bodyToMono(ROWS))
                .flatMap(RestRecordStore::firstRow);
    }

    @Override
    public Mono<Map<String, Object>> insert(String table, Map<String, Object> row) {
        return write(table, webClient.post()
                .uri("/{table}", table)
                .header("Prefer", RETURN_REPRESENTATION)
                .bodyValue(row)
                .retrieve()
                .bodyToMono(ROWS))
                .flatMap(RestRecordStore::firstRow)
                .switchIfEmpty(Mono.error(() -> new PersistenceException(table,
                        "Record store returned no row for insert into " + table)));
    }

    @Override
    public boolean isAvailable() {
        try {
            webClient.get()
                    .uri("/")
                    .retrieve()
                    .toBodilessEntity()
                    .block(timeout);
            return true;
        } catch (Exception e) {
            log.debug("REST_STORE: health check failed: {}", e.getMessage());
            return false;
        }
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private URI buildQueryUri(UriBuilder builder, RecordQuery query) {
        builder.path("/{table}").queryParam("select", "*");
        query.filters().forEach((column, value) -> builder.queryParam(column, "eq." + value));
        if (query.orderBy() != null) {
            builder.queryParam("order", query.orderBy() + (query.ascending() ? ".asc" : ".desc"));
        }
        return builder.build(query.table());
    }

    private <T> Mono<T> read(String table, Mono<T> call) {
        return call
                .timeout(timeout)
                .retryWhen(Retry.backoff(retryAttempts, retryDelay)
                        .filter(RestRecordStore::isTransient)
                        .doBeforeRetry(signal -> log.warn("REST_STORE: retrying read on {} (attempt {}): {}",
                                table, signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .onErrorMap(error -> translate(table, error));
    }

    private <T> Mono<T> write(String table, Mono<T> call) {
        return call
                .timeout(timeout)
                .onErrorMap(error -> translate(table, error));
    }

    private static Mono<Map<String, Object>> firstRow(List<Map<String, Object>> rows) {
        return rows == null || rows.isEmpty() ? Mono.empty() : Mono.just(rows.get(0));
    }

    private static boolean isTransient(Throwable error) {
        if (error instanceof WebClientResponseException) {
            return ((WebClientResponseException) error).getStatusCode().is5xxServerError();
        }
        return error instanceof WebClientRequestException || error instanceof TimeoutException;
    }

    private static Throwable translate(String table, Throwable error) {
        if (error instanceof PersistenceException) {
            return error;
        }
        if (error instanceof WebClientResponseException) {
            WebClientResponseException response = (WebClientResponseException) error;
            return new PersistenceException(table, "Record store rejected request on " + table
                    + " (HTTP " + response.getStatusCode().value() + "): "
                    + response.getResponseBodyAsString(), error);
        }
        if (error instanceof TimeoutException) {
            return new PersistenceException(table, "Record store timed out on " + table, error);
        }
        return new PersistenceException(table, "Record store unreachable for " + table + ": "
                + error.getMessage(), error);
    }
}

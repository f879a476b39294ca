package com.fintech.pricefeed.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * Base class for adapters backed by a JSON HTTP API.
 * Handles the request, maps 404 to "no data" and leaves decoding to subclasses.
 */
public abstract class HttpSourceAdapter implements SourceAdapter {

    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;
    protected final Clock clock;

    protected HttpSourceAdapter(WebClient webClient, ObjectMapper objectMapper, Clock clock) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * GETs a JSON document. Emits nothing on 404, errors on any other non-2xx status.
     */
    protected Mono<JsonNode> getJson(String uriTemplate, Object... uriVariables) {
        return webClient.get()
            .uri(uriTemplate, uriVariables)
            .accept(MediaType.APPLICATION_JSON)
            .exchangeToMono(response -> {
                if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                    return response.releaseBody().then(Mono.<String>empty());
                }
                if (response.statusCode().isError()) {
                    return response.<String>createError();
                }
                return response.bodyToMono(String.class);
            })
            .map(this::readTree);
    }

    protected JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SourceDataException(name() + " returned malformed JSON", e);
        }
    }

    /**
     * Reads a decimal from a JSON number or numeric string.
     *
     * @return the value, or null if the node is missing, null or blank
     * @throws SourceDataException if the node holds a non-numeric value
     */
    protected static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText();
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            throw new SourceDataException("Non-numeric value: " + text, e);
        }
    }
}

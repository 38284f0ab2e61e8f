package com.exohunt.inference;

import com.exohunt.error.ModelUnavailableException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Classifier client for a model-serving sidecar.
 *
 * <p>POSTs {@code {"sequence": [...], "scalars": [...]}} and expects
 * {@code {"probabilities": [p0, p1, p2]}}. Every transport or protocol failure surfaces as
 * {@link ModelUnavailableException}.
 */
public class SidecarClassifier implements TabularClassifier {

    private static final Logger log = LoggerFactory.getLogger(SidecarClassifier.class);

    record InferRequest(@JsonProperty("sequence") double[] sequence, @JsonProperty("scalars") double[] scalars) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record InferResponse(@JsonProperty("probabilities") double[] probabilities) {
    }

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI endpoint;
    private final Duration timeout;

    public SidecarClassifier(HttpClient httpClient, ObjectMapper objectMapper, URI endpoint, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.endpoint = endpoint;
        this.timeout = timeout;
    }

    @Override
    public double[] infer(double[] sequence, double[] scalars) {
        try {
            String body = objectMapper.writeValueAsString(new InferRequest(sequence, scalars));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(endpoint)
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.warn("Model sidecar returned HTTP {} from {}", response.statusCode(), endpoint);
                throw new ModelUnavailableException("Model sidecar returned HTTP " + response.statusCode());
            }
            InferResponse decoded = objectMapper.readValue(response.body(), InferResponse.class);
            if (decoded.probabilities() == null) {
                throw new ModelUnavailableException("Model sidecar response has no probabilities");
            }
            return decoded.probabilities();
        } catch (IOException e) {
            throw new ModelUnavailableException("Model sidecar at " + endpoint + " unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelUnavailableException("Interrupted while waiting for model sidecar", e);
        }
    }

    public URI getEndpoint() {
        return endpoint;
    }
}

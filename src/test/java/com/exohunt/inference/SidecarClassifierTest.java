package com.exohunt.inference;

import com.exohunt.error.ModelUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SidecarClassifier")
class SidecarClassifierTest {

    private HttpServer server;
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String response = "{\"probabilities\": [0.1, 0.2, 0.7]}";

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/infer", exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] body = response.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    private SidecarClassifier classifier() {
        URI endpoint = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/infer");
        return new SidecarClassifier(HttpClient.newHttpClient(), new ObjectMapper(), endpoint, Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("posts sequence and scalars and returns the probabilities")
    void roundTrip() {
        double[] probabilities = classifier().infer(new double[]{1.0, 0.99}, new double[]{0.5});

        assertThat(probabilities).containsExactly(0.1, 0.2, 0.7);
        assertThat(lastBody.get()).contains("\"sequence\":[1.0,0.99]").contains("\"scalars\":[0.5]");
    }

    @Test
    @DisplayName("a non-200 response is ModelUnavailableError")
    void httpError() {
        status = 503;
        response = "{\"error\": \"loading\"}";

        assertThatThrownBy(() -> classifier().infer(new double[]{1.0}, new double[]{0.0}))
                .isInstanceOf(ModelUnavailableException.class)
                .hasMessageContaining("503");
    }

    @Test
    @DisplayName("a response without probabilities is ModelUnavailableError")
    void missingProbabilities() {
        response = "{\"status\": \"ok\"}";

        assertThatThrownBy(() -> classifier().infer(new double[]{1.0}, new double[]{0.0}))
                .isInstanceOf(ModelUnavailableException.class);
    }

    @Test
    @DisplayName("an unreachable sidecar is ModelUnavailableError")
    void unreachable() {
        SidecarClassifier offline = new SidecarClassifier(HttpClient.newHttpClient(), new ObjectMapper(),
                URI.create("http://127.0.0.1:1/infer"), Duration.ofSeconds(2));

        assertThatThrownBy(() -> offline.infer(new double[]{1.0}, new double[]{0.0}))
                .isInstanceOf(ModelUnavailableException.class);
    }
}

package com.exohunt.config;

import com.exohunt.inference.InferenceContext;
import com.exohunt.inference.ScalerTable;
import com.exohunt.inference.ScalerTableLoader;
import com.exohunt.inference.SidecarClassifier;
import com.exohunt.inference.TabularClassifier;
import com.exohunt.preprocess.PreprocessingPipeline;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Builds the startup inference context from {@code exohunt.model.*}.
 */
@Configuration
public class InferenceConfig {

    private static final Logger log = LoggerFactory.getLogger(InferenceConfig.class);

    @Bean
    public TabularClassifier tabularClassifier(
            ObjectMapper objectMapper,
            @Value("${exohunt.model.endpoint:http://localhost:8001/infer}") String endpoint,
            @Value("${exohunt.model.connect-timeout-ms:2000}") long connectTimeoutMs,
            @Value("${exohunt.model.timeout-ms:10000}") long timeoutMs) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();
        return new SidecarClassifier(client, objectMapper, URI.create(endpoint), Duration.ofMillis(timeoutMs));
    }

    @Bean
    public InferenceContext inferenceContext(
            ObjectMapper objectMapper,
            TabularClassifier classifier,
            @Value("${exohunt.model.version:v1.0}") String version,
            @Value("${exohunt.model.scaler-location:classpath:model/koi-scaler.json}") Resource scalerLocation) {
        ScalerTable scaler = ScalerTableLoader.load(scalerLocation, objectMapper);
        log.info("Inference context ready: model={} features={} sequenceLength={}",
                version, scaler.featureCount(), PreprocessingPipeline.SEQUENCE_LENGTH);
        return new InferenceContext(version, scaler, classifier, PreprocessingPipeline.SEQUENCE_LENGTH);
    }
}

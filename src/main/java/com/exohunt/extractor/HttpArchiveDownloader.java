package com.exohunt.extractor;

import com.exohunt.error.DataFormatException;
import com.exohunt.error.FetchTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Downloads light curves over HTTP from an identifier-resolving archive endpoint.
 *
 * <p>The URL template may contain {@code {kepid}} and the zero-padded {@code {kepid9}}.
 * The request timeout here bounds the fetch only; local computation is not covered by it.
 */
@Component
public class HttpArchiveDownloader implements ArchiveDownloader {

    private static final Logger log = LoggerFactory.getLogger(HttpArchiveDownloader.class);

    private final HttpClient httpClient;
    private final String urlTemplate;
    private final Duration timeout;

    @Autowired
    public HttpArchiveDownloader(
            @Value("${exohunt.archive.url-template:http://localhost:8002/lightcurves/{kepid}}") String urlTemplate,
            @Value("${exohunt.archive.connect-timeout-ms:5000}") long connectTimeoutMs,
            @Value("${exohunt.archive.timeout-ms:30000}") long timeoutMs) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofMillis(connectTimeoutMs)).build(),
                urlTemplate, Duration.ofMillis(timeoutMs));
    }

    HttpArchiveDownloader(HttpClient httpClient, String urlTemplate, Duration timeout) {
        this.httpClient = httpClient;
        this.urlTemplate = urlTemplate;
        this.timeout = timeout;
    }

    @Override
    public byte[] download(long kepid) {
        URI uri = resolve(kepid);
        String target = "kic:" + kepid;
        log.info("Downloading light curve for {} from {}", target, uri);
        long start = System.currentTimeMillis();

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .GET()
                .build();
        try {
            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() != 200) {
                throw new DataFormatException("Archive has no light curve for " + target + " (HTTP " + response.statusCode() + ")");
            }
            byte[] body = response.body();
            log.info("Downloaded {} bytes for {} in {}ms", body.length, target, System.currentTimeMillis() - start);
            return body;
        } catch (HttpTimeoutException e) {
            log.warn("Archive fetch for {} timed out after {}ms", target, timeout.toMillis());
            throw new FetchTimeoutException(target, timeout, e);
        } catch (IOException e) {
            throw new DataFormatException("Archive fetch for " + target + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchTimeoutException(target, timeout, e);
        }
    }

    URI resolve(long kepid) {
        return URI.create(urlTemplate
                .replace("{kepid9}", String.format("%09d", kepid))
                .replace("{kepid}", Long.toString(kepid)));
    }
}

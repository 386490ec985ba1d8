package com.production.pdf_analysis.extract;

import com.production.pdf_analysis.config.AppConfig;
import com.production.pdf_analysis.exception.DownloadFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Fetches PDF bytes over HTTP(S). Follows redirects and rejects any non-2xx response.
 * Retries are not attempted here; a failed download is reported to the caller as is.
 */
@Service
@Slf4j
public class PdfDownloader {

    private final AppConfig appConfig;
    private final HttpClient httpClient;

    @Autowired
    public PdfDownloader(AppConfig appConfig) {
        this(appConfig, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(appConfig.getExtraction().getConnectTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    PdfDownloader(AppConfig appConfig, HttpClient httpClient) {
        this.appConfig = appConfig;
        this.httpClient = httpClient;
    }

    public PdfSource download(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new DownloadFailureException("Malformed URL: " + url, e);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new DownloadFailureException("URL must start with http:// or https://: " + url, 0);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(Duration.ofSeconds(appConfig.getExtraction().getDownloadTimeoutSeconds()))
                .GET()
                .build();

        long start = System.currentTimeMillis();
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new DownloadFailureException("Timed out downloading " + url, e);
        } catch (IOException e) {
            throw new DownloadFailureException("Network error downloading " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DownloadFailureException("Interrupted while downloading " + url, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new DownloadFailureException("HTTP " + status + " for URL: " + url, status);
        }

        byte[] body = response.body() == null ? new byte[0] : response.body();
        log.info("[TIMING] download {}: {} bytes in {}ms", url, body.length, System.currentTimeMillis() - start);
        return new PdfSource(body, sourceNameOf(response.uri() != null ? response.uri() : uri));
    }

    /**
     * Last non-empty path segment, URL-decoded; {@code null} when the path is empty.
     */
    static String sourceNameOf(URI uri) {
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            return null;
        }
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        int slash = path.lastIndexOf('/');
        String segment = slash >= 0 ? path.substring(slash + 1) : path;
        if (segment.isEmpty()) {
            return null;
        }
        try {
            return URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return segment;
        }
    }
}

package com.production.pdf_analysis.llm.gigachat;

import com.production.pdf_analysis.config.AppConfig;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.net.http.HttpClient;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;

/**
 * Shared {@link HttpClient} for the GigaChat OAuth and chat endpoints.
 */
@Slf4j
public final class GigaChatHttp {

    private GigaChatHttp() {
    }

    public static HttpClient newClient(AppConfig.Llm.GigaChat config, Duration connectTimeout) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        if (!config.isVerifySsl()) {
            try {
                // GigaChat certificates are issued by a private CA
                SSLContext sslContext = SSLContext.getInstance("TLS");
                sslContext.init(null, new TrustManager[]{new X509TrustManager() {
                    public X509Certificate[] getAcceptedIssuers() { return new X509Certificate[0]; }
                    public void checkClientTrusted(X509Certificate[] certs, String authType) {}
                    public void checkServerTrusted(X509Certificate[] certs, String authType) {}
                }}, new SecureRandom());
                builder.sslContext(sslContext);
                log.info("GigaChat HTTP client initialized (SSL verification disabled)");
            } catch (GeneralSecurityException e) {
                log.warn("Failed to create custom SSLContext, falling back to default: {}", e.getMessage());
            }
        }
        return builder.build();
    }
}

package io.sentix.infrastructure.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Plain JSON GET against a public market data API.
 *
 * Transport failures and non-200 statuses surface as {@link ProviderException}
 * with the normalized error type, so callers only parse the body.
 */
public final class ProviderHttp {
    private static final Logger log = LoggerFactory.getLogger(ProviderHttp.class);

    public static final String USER_AGENT = "SentixPro/3.0 (Trading Analytics)";

    /**
     * @return response body of a 200 response
     * @throws ProviderException on timeout, network error, interruption or non-200 status
     */
    public static String getJson(
        HttpClient httpClient,
        String provider,
        String endpoint,
        URI uri,
        Duration timeout
    ) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(timeout)
            .header("Accept", "application/json")
            .header("User-Agent", USER_AGENT)
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ProviderException(provider, ProviderErrorType.TIMEOUT, endpoint, null,
                "Request timed out: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ProviderException(provider, ProviderErrorType.NETWORK_ERROR, endpoint, null,
                "Network error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(provider, ProviderErrorType.NETWORK_ERROR, endpoint, null,
                "Interrupted while fetching " + endpoint, e);
        }

        int status = response.statusCode();
        if (status != 200) {
            ProviderErrorType type = ProviderErrorType.fromHttpStatus(status);
            log.error("[{}] {} HTTP {} ({})", provider, endpoint, status, type);
            throw new ProviderException(provider, type, endpoint, status, "HTTP error " + status);
        }
        return response.body();
    }

    private ProviderHttp() {}
}

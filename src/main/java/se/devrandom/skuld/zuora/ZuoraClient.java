/*
 * Skuld - Incremental Billing Data Extraction
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.skuld.zuora;

import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import se.devrandom.skuld.config.ConfigurationException;
import se.devrandom.skuld.config.ZuoraCredentials;
import se.devrandom.skuld.util.TransportRetryPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * HTTP access to the Zuora REST and AQuA endpoints.
 *
 * Non-2xx answers surface as {@link ZuoraApiException} (429 as {@link RateLimitException}); every call
 * goes through the transport retry policy. Export files are streamed to a temporary file and handed
 * out as an input stream that deletes the file when closed.
 */
public class ZuoraClient {
    private static final Logger log = LoggerFactory.getLogger(ZuoraClient.class);

    static final String WSDL_VERSION = "91.0";
    static final String PROBE_PATH = "v1/describe/Account";

    public enum Api { AQUA, REST }

    private final WebClient webClient;
    private final ZuoraCredentials credentials;
    private final TransportRetryPolicy retryPolicy;

    private volatile String baseUrl;
    private volatile String accessToken;

    public ZuoraClient(WebClient webClient, ZuoraCredentials credentials, TransportRetryPolicy retryPolicy) {
        this.webClient = webClient;
        this.credentials = credentials;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Authenticates and picks the data center: the first candidate base URL that does not answer 401 wins.
     */
    public void connect() {
        List<String> candidates = credentials.candidateBaseUrls();
        for (String candidate : candidates) {
            if (credentials.getAuthType() == ZuoraCredentials.AuthType.OAUTH) {
                try {
                    accessToken = requestAccessToken(candidate).accessToken;
                } catch (ZuoraApiException e) {
                    log.warn("OAuth token request against {} failed with HTTP {}", candidate, e.getStatusCode());
                    continue;
                }
            }
            int status = probe(candidate);
            if (status == 401) {
                log.info("{} rejected the credentials, trying next data center", candidate);
                continue;
            }
            baseUrl = candidate;
            log.info("Connected to Zuora at {} ({} authentication)", candidate, credentials.getAuthType());
            return;
        }
        throw new ConfigurationException("Zuora credentials were rejected by every candidate endpoint: " + candidates);
    }

    public JSONObject get(Api api, String path) {
        return request(HttpMethod.GET, api, path, null, null);
    }

    public JSONObject post(Api api, String path, JSONObject body) {
        return request(HttpMethod.POST, api, path, body, null);
    }

    /**
     * POST that fails with {@link QueryTimeoutException} when no answer arrives within {@code timeout}.
     */
    public JSONObject post(Api api, String path, JSONObject body, Duration timeout) {
        return request(HttpMethod.POST, api, path, body, timeout);
    }

    public void delete(Api api, String path) {
        request(HttpMethod.DELETE, api, path, null, null);
    }

    /**
     * Downloads a file to a temporary location and opens it. The file is deleted when the stream is closed.
     *
     * @throws StaleFileReferenceException when the file is no longer served
     */
    public InputStream openFile(Api api, String path, String fileId) {
        String url = requireBaseUrl() + path;
        Path target;
        try {
            target = Files.createTempFile("skuld-" + fileId + "-", ".csv");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create temp file for " + fileId, e);
        }

        try {
            withAuthRefresh(() -> retryPolicy.execute(() -> {
                Flux<DataBuffer> body = webClient.get()
                        .uri(url)
                        .headers(h -> applyHeaders(h, api))
                        .accept(MediaType.ALL)
                        .exchangeToFlux(response -> response.statusCode().is2xxSuccessful()
                                ? response.bodyToFlux(DataBuffer.class)
                                : this.<DataBuffer>readError(response).flux());
                DataBufferUtils.write(body, target,
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE).block();
                return target;
            }, "download " + fileId));
            log.debug("Downloaded file {} to {}", fileId, target);
            return Files.newInputStream(target, StandardOpenOption.DELETE_ON_CLOSE);
        } catch (ZuoraApiException e) {
            deleteTempFile(target);
            if (e.getStatusCode() == 404) {
                throw new StaleFileReferenceException(fileId, e);
            }
            throw e;
        } catch (IOException e) {
            deleteTempFile(target);
            throw new UncheckedIOException("Failed to open downloaded file " + fileId, e);
        } catch (RuntimeException e) {
            deleteTempFile(target);
            throw e;
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    private JSONObject request(HttpMethod method, Api api, String path, JSONObject body, Duration timeout) {
        String url = requireBaseUrl() + path;
        String operation = method.name() + " " + path;
        return withAuthRefresh(() -> retryPolicy.execute(() -> {
            WebClient.RequestBodySpec spec = webClient.method(method)
                    .uri(url)
                    .headers(h -> applyHeaders(h, api))
                    .accept(MediaType.APPLICATION_JSON);
            WebClient.RequestHeadersSpec<?> request = body == null
                    ? spec
                    : spec.contentType(MediaType.APPLICATION_JSON).bodyValue(body.toString());
            Mono<String> response = request.exchangeToMono(this::readBody);
            if (timeout != null) {
                response = response.timeout(timeout);
            }
            log.debug("{} {}", method.name(), url);
            return toJson(block(response, operation, timeout));
        }, operation));
    }

    private String block(Mono<String> response, String operation, Duration timeout) {
        try {
            return response.block();
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                throw new QueryTimeoutException(operation + " did not answer within " + timeout, e);
            }
            throw e;
        }
    }

    private Mono<String> readBody(ClientResponse response) {
        if (response.statusCode().is2xxSuccessful()) {
            return response.bodyToMono(String.class).defaultIfEmpty("");
        }
        return readError(response);
    }

    private <T> Mono<T> readError(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> Mono.<T>error(status == 429
                        ? new RateLimitException(body)
                        : new ZuoraApiException(status, body)));
    }

    private <T> T withAuthRefresh(Supplier<T> call) {
        try {
            return call.get();
        } catch (ZuoraApiException e) {
            if (e.getStatusCode() != 401 || credentials.getAuthType() != ZuoraCredentials.AuthType.OAUTH) {
                throw e;
            }
            log.info("Access token rejected, requesting a new one");
            accessToken = requestAccessToken(requireBaseUrl()).accessToken;
            return call.get();
        }
    }

    private ZuoraAccessToken requestAccessToken(String candidate) {
        LinkedMultiValueMap<String, String> formData = new LinkedMultiValueMap<>();
        formData.add("grant_type", "client_credentials");
        formData.add("client_id", credentials.getUsername());
        formData.add("client_secret", credentials.getPassword());

        return retryPolicy.execute(() -> webClient.post()
                .uri(candidate + "oauth/token")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(formData))
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(response -> response.statusCode().is2xxSuccessful()
                        ? response.bodyToMono(ZuoraAccessToken.class)
                        : this.<ZuoraAccessToken>readError(response))
                .block(), "OAuth token request");
    }

    private int probe(String candidate) {
        Integer status = retryPolicy.execute(() -> webClient.get()
                .uri(candidate + PROBE_PATH)
                .headers(h -> applyHeaders(h, Api.REST))
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(response -> response.releaseBody().thenReturn(response.statusCode().value()))
                .block(), "probe " + candidate);
        return status == null ? 0 : status;
    }

    private void applyHeaders(HttpHeaders headers, Api api) {
        if (credentials.getAuthType() == ZuoraCredentials.AuthType.OAUTH) {
            headers.setBearerAuth(accessToken);
        } else {
            headers.set("apiAccessKeyId", credentials.getUsername());
            headers.set("apiSecretAccessKey", credentials.getPassword());
        }
        if (api == Api.REST) {
            headers.set("X-Zuora-WSDL-Version", WSDL_VERSION);
        }
    }

    private String requireBaseUrl() {
        if (baseUrl == null) {
            throw new IllegalStateException("ZuoraClient is not connected");
        }
        return baseUrl;
    }

    private static JSONObject toJson(String body) {
        if (body == null || body.isBlank()) {
            return new JSONObject();
        }
        return new JSONObject(body);
    }

    private static void deleteTempFile(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }
}

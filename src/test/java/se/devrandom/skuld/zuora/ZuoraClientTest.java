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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import se.devrandom.skuld.config.ConfigurationException;
import se.devrandom.skuld.config.ZuoraCredentials;
import se.devrandom.skuld.testing.RecordingSleeper;
import se.devrandom.skuld.util.Backoff;
import se.devrandom.skuld.util.TransportRetryPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static se.devrandom.skuld.zuora.StubExchangeFunction.json;
import static se.devrandom.skuld.zuora.StubExchangeFunction.ok;
import static se.devrandom.skuld.zuora.StubExchangeFunction.text;

@DisplayName("ZuoraClient Tests")
class ZuoraClientTest {

    private ZuoraCredentials credentials;
    private RecordingSleeper sleeper;
    private StubExchangeFunction exchange;

    @BeforeEach
    void setUp() {
        credentials = new ZuoraCredentials();
        credentials.setUsername("key-id");
        credentials.setPassword("secret");
        sleeper = new RecordingSleeper();
        exchange = new StubExchangeFunction(call -> ok("{}"));
    }

    private ZuoraClient client() {
        WebClient webClient = WebClient.builder().exchangeFunction(exchange).build();
        TransportRetryPolicy retryPolicy = new TransportRetryPolicy(3,
                new Backoff(Duration.ofMillis(100), 2.0, Duration.ofSeconds(1), 0.0), sleeper);
        return new ZuoraClient(webClient, credentials, retryPolicy);
    }

    private ZuoraClient connected() {
        credentials.setBaseUrl("https://rest.test.zuora.com");
        ZuoraClient client = client();
        client.connect();
        return client;
    }

    // ==================== Connecting ====================

    @Test
    @DisplayName("Should move on to the next data center when credentials are rejected")
    void testConnect_FallsBackOn401() {
        exchange.route(call -> call.url().startsWith("https://rest.na.zuora.com/")
                ? json(HttpStatus.UNAUTHORIZED, "{\"message\":\"bad credentials\"}")
                : ok("{}"));
        ZuoraClient client = client();

        client.connect();

        assertEquals("https://rest.zuora.com/", client.getBaseUrl());
        assertEquals(2, exchange.getCalls().size());
        StubExchangeFunction.Call probe = exchange.getCalls().get(1);
        assertEquals("https://rest.zuora.com/" + ZuoraClient.PROBE_PATH, probe.url());
        assertEquals("key-id", probe.headers().getFirst("apiAccessKeyId"));
        assertEquals("secret", probe.headers().getFirst("apiSecretAccessKey"));
        assertEquals(ZuoraClient.WSDL_VERSION, probe.headers().getFirst("X-Zuora-WSDL-Version"));
    }

    @Test
    @DisplayName("Should fail with a configuration error when every data center rejects the credentials")
    void testConnect_AllRejected() {
        exchange.route(call -> json(HttpStatus.UNAUTHORIZED, "{}"));

        assertThrows(ConfigurationException.class, () -> client().connect());
    }

    @Test
    @DisplayName("Should refuse requests before connecting")
    void testRequest_NotConnected() {
        assertThrows(IllegalStateException.class, () -> client().get(ZuoraClient.Api.REST, "v1/describe/Account"));
    }

    @Test
    @DisplayName("Should send a bearer token with OAuth and refresh it once on 401")
    void testOAuth_RefreshOn401() {
        credentials.setAuthType(ZuoraCredentials.AuthType.OAUTH);
        AtomicInteger tokens = new AtomicInteger();
        AtomicInteger jobCalls = new AtomicInteger();
        exchange.route(call -> {
            if (call.url().endsWith("oauth/token")) {
                return ok("{\"access_token\":\"token-" + tokens.incrementAndGet() + "\",\"token_type\":\"bearer\",\"expires_in\":3599}");
            }
            if (call.url().endsWith("v1/batch-query/jobs/job-1") && jobCalls.incrementAndGet() == 1) {
                return json(HttpStatus.UNAUTHORIZED, "{\"message\":\"expired\"}");
            }
            return ok("{\"status\":\"pending\"}");
        });
        ZuoraClient client = connected();

        assertEquals("Bearer token-1", exchange.callsTo(ZuoraClient.PROBE_PATH).get(0).headers().getFirst("Authorization"));

        assertEquals("pending", client.get(ZuoraClient.Api.AQUA, "v1/batch-query/jobs/job-1").getString("status"));
        assertEquals(2, tokens.get());
        StubExchangeFunction.Call retried = exchange.callsTo("v1/batch-query/jobs/job-1").get(1);
        assertEquals("Bearer token-2", retried.headers().getFirst("Authorization"));
        assertNull(retried.headers().getFirst("X-Zuora-WSDL-Version"));
    }

    // ==================== Errors ====================

    @Test
    @DisplayName("Should surface 429 as a rate limit without transport retries")
    void testRequest_RateLimited() {
        ZuoraClient client = connected();
        exchange.route(call -> json(HttpStatus.TOO_MANY_REQUESTS, "{\"message\":\"slow down\"}"));

        RateLimitException e = assertThrows(RateLimitException.class,
                () -> client.get(ZuoraClient.Api.AQUA, "v1/batch-query/jobs/job-1"));

        assertEquals(429, e.getStatusCode());
        assertEquals(1, exchange.callsTo("job-1").size());
    }

    @Test
    @DisplayName("Should retry server errors")
    void testRequest_RetriesServerErrors() {
        ZuoraClient client = connected();
        AtomicInteger calls = new AtomicInteger();
        exchange.route(call -> calls.incrementAndGet() == 1
                ? json(HttpStatus.BAD_GATEWAY, "")
                : ok("{\"id\":\"job-1\"}"));

        assertEquals("job-1", client.get(ZuoraClient.Api.AQUA, "v1/batch-query/").getString("id"));
        assertEquals(1, sleeper.getSleeps().size());
    }

    @Test
    @DisplayName("Should carry status and body of client errors")
    void testRequest_ClientError() {
        ZuoraClient client = connected();
        exchange.route(call -> json(HttpStatus.BAD_REQUEST, "{\"message\":\"invalid query\"}"));

        ZuoraApiException e = assertThrows(ZuoraApiException.class,
                () -> client.post(ZuoraClient.Api.REST, "v1/action/query", new JSONObject()));

        assertEquals(400, e.getStatusCode());
        assertTrue(e.getResponseBody().contains("invalid query"));
        assertFalse(e.isServerError());
    }

    // ==================== Files ====================

    @Test
    @DisplayName("Should stream a downloaded file")
    void testOpenFile() throws IOException {
        ZuoraClient client = connected();
        exchange.route(call -> text(HttpStatus.OK, "Invoice.Id\ninv1\n"));

        try (InputStream input = client.openFile(ZuoraClient.Api.AQUA, "v1/file/f1", "f1")) {
            assertEquals("Invoice.Id\ninv1\n", new String(input.readAllBytes(), StandardCharsets.UTF_8));
        }
        assertEquals(HttpMethod.GET, exchange.callsTo("v1/file/f1").get(0).method());
    }

    @Test
    @DisplayName("Should report a missing file as a stale reference")
    void testOpenFile_NotFound() {
        ZuoraClient client = connected();
        exchange.route(call -> text(HttpStatus.NOT_FOUND, "not found"));

        StaleFileReferenceException e = assertThrows(StaleFileReferenceException.class,
                () -> client.openFile(ZuoraClient.Api.AQUA, "v1/file/f1", "f1"));

        assertEquals("f1", e.getFileId());
    }
}

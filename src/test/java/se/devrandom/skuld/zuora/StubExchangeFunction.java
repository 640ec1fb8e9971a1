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

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Answers WebClient requests from a routing function and records every request it saw.
 */
class StubExchangeFunction implements ExchangeFunction {

    record Call(HttpMethod method, String url, HttpHeaders headers) {
    }

    private final List<Call> calls = new ArrayList<>();
    private Function<Call, ClientResponse> router;

    StubExchangeFunction(Function<Call, ClientResponse> router) {
        this.router = router;
    }

    void route(Function<Call, ClientResponse> router) {
        this.router = router;
    }

    @Override
    public synchronized Mono<ClientResponse> exchange(ClientRequest request) {
        Call call = new Call(request.method(), request.url().toString(), request.headers());
        calls.add(call);
        return Mono.just(router.apply(call));
    }

    synchronized List<Call> getCalls() {
        return new ArrayList<>(calls);
    }

    synchronized List<Call> callsTo(String pathSuffix) {
        return calls.stream().filter(call -> call.url().endsWith(pathSuffix)).toList();
    }

    static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }

    static ClientResponse ok(String body) {
        return json(HttpStatus.OK, body);
    }

    static ClientResponse text(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, "text/csv")
                .body(body)
                .build();
    }
}

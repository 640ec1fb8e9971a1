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
package se.devrandom.skuld.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import se.devrandom.skuld.catalog.CatalogProvider;
import se.devrandom.skuld.catalog.JsonCatalogProvider;
import se.devrandom.skuld.sink.JsonLinesRecordSink;
import se.devrandom.skuld.sink.RecordSink;
import se.devrandom.skuld.state.FileStateStore;
import se.devrandom.skuld.state.S3StateStore;
import se.devrandom.skuld.state.StateSerializer;
import se.devrandom.skuld.state.StateStore;
import se.devrandom.skuld.util.Sleeper;
import se.devrandom.skuld.util.TransportRetryPolicy;
import se.devrandom.skuld.zuora.AquaExportApi;
import se.devrandom.skuld.zuora.ExportApi;
import se.devrandom.skuld.zuora.QueryApi;
import se.devrandom.skuld.zuora.RestExportApi;
import se.devrandom.skuld.zuora.ZuoraClient;
import se.devrandom.skuld.zuora.ZuoraQueryApi;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

@Configuration
@ConditionalOnProperty(name = "skuld.sync.enabled", havingValue = "true", matchIfMissing = true)
public class SkuldConfiguration {
    private static final Logger log = LoggerFactory.getLogger(SkuldConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public TransportRetryPolicy transportRetryPolicy(SyncProperties properties, Sleeper sleeper) {
        SyncProperties.BackoffSettings transport = properties.getTransport();
        return new TransportRetryPolicy(transport.getMaxAttempts(), transport.toBackoff("transport"), sleeper);
    }

    @Bean
    public ZuoraClient zuoraClient(WebClient webClient, ZuoraCredentials credentials, TransportRetryPolicy retryPolicy) {
        if (isBlank(credentials.getUsername()) || isBlank(credentials.getPassword())) {
            throw new ConfigurationException("zuora.username and zuora.password are required");
        }
        ZuoraClient client = new ZuoraClient(webClient, credentials, retryPolicy);
        client.connect();
        return client;
    }

    @Bean
    public ExportApi exportApi(ZuoraClient client, ZuoraCredentials credentials) {
        return switch (credentials.getApiType()) {
            case AQUA -> new AquaExportApi(client, credentials.getPartnerId());
            case REST -> new RestExportApi(client);
        };
    }

    @Bean
    public QueryApi queryApi(ZuoraClient client, SyncProperties properties) {
        return new ZuoraQueryApi(client, properties.getQueryTimeout());
    }

    @Bean
    public StateStore stateStore(StorageProperties storage) {
        StorageProperties.State state = storage.getState();
        if (!state.useS3()) {
            log.info("Sync state is kept in {}", state.getPath());
            return new FileStateStore(Path.of(state.getPath()));
        }
        S3Client s3Client = S3Client.builder()
                .region(Region.of(state.getS3Region()))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(Duration.ofMinutes(2))
                        .apiCallAttemptTimeout(Duration.ofSeconds(30))
                        .retryPolicy(RetryPolicy.builder()
                                .numRetries(3)
                                .build())
                        .build())
                .build();
        log.info("Sync state is kept in s3://{}/{} ({})", state.getS3Bucket(), state.getS3Key(), state.getS3Region());
        return new S3StateStore(s3Client, state.getS3Bucket(), state.getS3Key());
    }

    @Bean
    public RecordSink recordSink(StorageProperties storage) {
        String path = storage.getOutput().getPath();
        OutputStream output;
        if (path == null || path.isBlank()) {
            output = System.out;
        } else {
            try {
                output = Files.newOutputStream(Path.of(path));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot open output file " + path, e);
            }
        }
        return new JsonLinesRecordSink(output, StateSerializer.mapper());
    }

    @Bean
    public CatalogProvider catalogProvider(SyncProperties properties, ObjectMapper objectMapper) {
        return new JsonCatalogProvider(Path.of(properties.getCatalogPath()), objectMapper);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

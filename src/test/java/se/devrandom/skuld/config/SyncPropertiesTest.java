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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Configuration Tests")
class SyncPropertiesTest {

    private static SyncProperties valid() {
        SyncProperties properties = new SyncProperties();
        properties.setStartDate("2024-01-01");
        return properties;
    }

    // ==================== SyncProperties ====================

    @Test
    @DisplayName("Should accept the defaults once a start date is set")
    void testValidate_Defaults() {
        SyncProperties properties = valid();

        assertDoesNotThrow(properties::validate);
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), properties.startInstant());
        assertEquals(Duration.ofMinutes(90), properties.getJobTimeout());
        assertEquals(Duration.ofSeconds(60), properties.getPollInterval());
    }

    @Test
    @DisplayName("Should require a start date")
    void testValidate_MissingStartDate() {
        assertThrows(ConfigurationException.class, new SyncProperties()::validate);
    }

    @Test
    @DisplayName("Should reject an unparsable start date")
    void testStartInstant_Invalid() {
        SyncProperties properties = new SyncProperties();
        properties.setStartDate("last tuesday");

        assertThrows(ConfigurationException.class, properties::startInstant);
    }

    @Test
    @DisplayName("Should reject non-positive durations and concurrency")
    void testValidate_InvalidValues() {
        SyncProperties zeroWindow = valid();
        zeroWindow.setMaxWindow(Duration.ZERO);
        assertThrows(ConfigurationException.class, zeroWindow::validate);

        SyncProperties noDownloads = valid();
        noDownloads.setDownloadConcurrency(0);
        assertThrows(ConfigurationException.class, noDownloads::validate);

        SyncProperties noReadTimeout = valid();
        noReadTimeout.getHttp().setReadTimeout(Duration.ofSeconds(-1));
        assertThrows(ConfigurationException.class, noReadTimeout::validate);
    }

    @Test
    @DisplayName("Should report an invalid backoff as a configuration error")
    void testValidate_InvalidBackoff() {
        SyncProperties properties = valid();
        properties.getRateLimit().setJitter(1.5);

        ConfigurationException e = assertThrows(ConfigurationException.class, properties::validate);
        assertTrue(e.getMessage().contains("rate-limit"));
    }

    // ==================== ZuoraCredentials ====================

    @ParameterizedTest
    @CsvSource({
            "false, false, https://rest.na.zuora.com/",
            "true, false, https://rest.sandbox.na.zuora.com/",
            "false, true, https://rest.eu.zuora.com/",
            "true, true, https://rest.sandbox.eu.zuora.com/"
    })
    @DisplayName("Should try the data center matching sandbox and region first")
    void testCandidateBaseUrls(boolean sandbox, boolean european, String first) {
        ZuoraCredentials credentials = new ZuoraCredentials();
        credentials.setSandbox(sandbox);
        credentials.setEuropean(european);

        assertEquals(first, credentials.candidateBaseUrls().get(0));
    }

    @Test
    @DisplayName("Should use only an explicit base URL, with trailing slash")
    void testCandidateBaseUrls_Explicit() {
        ZuoraCredentials credentials = new ZuoraCredentials();
        credentials.setBaseUrl("https://rest.test.zuora.com");

        assertEquals(List.of("https://rest.test.zuora.com/"), credentials.candidateBaseUrls());
    }
}

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

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "zuora")
public class ZuoraCredentials {

    public enum AuthType { BASIC, OAUTH }

    public enum ApiType { AQUA, REST }

    // Optional, otherwise resolved from the data-center table
    private String baseUrl;
    // API access key id, or OAuth client id
    private String username;
    // API secret access key, or OAuth client secret
    private String password;
    private AuthType authType = AuthType.BASIC;
    private ApiType apiType = ApiType.AQUA;
    private String partnerId;
    private boolean sandbox;
    private boolean european;

    /**
     * Base URLs to try in order when no explicit base URL is configured.
     */
    public List<String> candidateBaseUrls() {
        if (baseUrl != null && !baseUrl.isBlank()) {
            return List.of(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/");
        }
        if (european) {
            return sandbox
                    ? List.of("https://rest.sandbox.eu.zuora.com/")
                    : List.of("https://rest.eu.zuora.com/");
        }
        return sandbox
                ? List.of("https://rest.sandbox.na.zuora.com/", "https://rest.apisandbox.zuora.com/")
                : List.of("https://rest.na.zuora.com/", "https://rest.zuora.com/");
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public AuthType getAuthType() {
        return authType;
    }

    public void setAuthType(AuthType authType) {
        this.authType = authType;
    }

    public ApiType getApiType() {
        return apiType;
    }

    public void setApiType(ApiType apiType) {
        this.apiType = apiType;
    }

    public String getPartnerId() {
        return partnerId;
    }

    public void setPartnerId(String partnerId) {
        this.partnerId = partnerId;
    }

    public boolean isSandbox() {
        return sandbox;
    }

    public void setSandbox(boolean sandbox) {
        this.sandbox = sandbox;
    }

    public boolean isEuropean() {
        return european;
    }

    public void setEuropean(boolean european) {
        this.european = european;
    }
}

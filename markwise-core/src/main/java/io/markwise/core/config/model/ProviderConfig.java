package io.markwise.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderConfig(
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    @JsonAlias({"http_referer"}) String httpReferer,
    @JsonAlias({"app_title"}) String appTitle,
    @JsonAlias({"extra_headers"}) Map<String, String> extraHeaders
) {

    public static ProviderConfig defaults() {
        return new ProviderConfig("", "https://openrouter.ai/api/v1", "", "Markwise", Map.of());
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public Map<String, String> requestHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        if (httpReferer != null && !httpReferer.isBlank()) {
            headers.put("HTTP-Referer", httpReferer);
        }
        if (appTitle != null && !appTitle.isBlank()) {
            headers.put("X-Title", appTitle);
        }
        if (extraHeaders != null) {
            headers.putAll(extraHeaders);
        }
        return headers;
    }
}

package com.phillippitts.n8nsync.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the remote n8n public API.
 */
@Validated
@ConfigurationProperties(prefix = "n8n.api")
public class N8nApiProperties {

    /** Base URL of the n8n instance, e.g. {@code http://localhost:5678}. */
    @NotBlank(message = "n8n.api.host must be set")
    private final String host;

    /** Value sent in the {@code X-N8N-API-KEY} header. */
    private final String apiKey;

    @Min(1)
    private final int connectTimeoutMs;

    @Min(1)
    private final int readTimeoutMs;

    /** Page size for workflow listing (the public API caps it at 250). */
    @Min(1)
    @Max(250)
    private final int pageSize;

    @ConstructorBinding
    public N8nApiProperties(String host, String apiKey, Integer connectTimeoutMs,
                            Integer readTimeoutMs, Integer pageSize) {
        this.host = host == null ? null : host.trim().replaceFirst("/+$", "");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.connectTimeoutMs = connectTimeoutMs == null ? 5_000 : connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs == null ? 30_000 : readTimeoutMs;
        this.pageSize = pageSize == null ? 250 : pageSize;
    }

    public N8nApiProperties(String host, String apiKey) {
        this(host, apiKey, null, null, null);
    }

    public String getHost() {
        return host;
    }

    public String getApiKey() {
        return apiKey;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public int getPageSize() {
        return pageSize;
    }
}

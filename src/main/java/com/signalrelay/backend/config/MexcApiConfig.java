package com.signalrelay.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "mexc.api")
public class MexcApiConfig {
    private String key;
    private String secret;
    private String futuresBaseUrl = "https://contract.mexc.com";
    private boolean useAuth = true;

    // Futures API v1 paths
    public String getFuturesApiV1Path(String path) {
        return futuresBaseUrl + "/api/v1" + path;
    }

    // Check if authentication should be used
    public boolean shouldUseAuth() {
        return useAuth && key != null && !key.isEmpty() && secret != null && !secret.isEmpty();
    }
}

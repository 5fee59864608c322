package com.signalrelay.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "mailbox")
public class MailboxProperties {
    private boolean enabled = false;
    private String host = "imap.gmail.com";
    private int port = 993;
    private String user;
    private String password;
    private String folder = "tv-alerts";
    private String failedFolder = "tv-alerts-failed";
    private Duration maxMessageAge = Duration.ofMinutes(5);
    private Duration connectTimeout = Duration.ofSeconds(20);
    /** Delay between polls, read by the scheduler through its placeholder. */
    private long pollIntervalMs = 30_000;

    public boolean hasCredentials() {
        return user != null && !user.isBlank() && password != null && !password.isBlank();
    }
}

package com.ryuqq.handover.adapter.mail;

import java.time.Duration;

/**
 * SMTP relay settings.
 *
 * @param host relay host
 * @param port relay port
 * @param fromAddress sender address on every message
 * @param connectTimeout socket connect timeout
 * @param readTimeout socket read timeout for relay replies
 * @param writeTimeout socket write timeout for the message data
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record SmtpConfig(
    String host,
    int port,
    String fromAddress,
    Duration connectTimeout,
    Duration readTimeout,
    Duration writeTimeout
) {

    public static final int DEFAULT_PORT = 25;
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_WRITE_TIMEOUT = Duration.ofSeconds(30);

    public SmtpConfig {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host cannot be null or blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535, but was: " + port);
        }
        if (fromAddress == null || fromAddress.isBlank()) {
            throw new IllegalArgumentException("fromAddress cannot be null or blank");
        }
        requirePositive(connectTimeout, "connectTimeout");
        requirePositive(readTimeout, "readTimeout");
        requirePositive(writeTimeout, "writeTimeout");
    }

    public SmtpConfig(String host, int port, String fromAddress) {
        this(host, port, fromAddress, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT, DEFAULT_WRITE_TIMEOUT);
    }

    public SmtpConfig(String host, String fromAddress) {
        this(host, DEFAULT_PORT, fromAddress);
    }

    /**
     * Same relay with one timeout applied to connect, read and write.
     */
    public SmtpConfig withTimeout(Duration timeout) {
        return new SmtpConfig(host, port, fromAddress, timeout, timeout, timeout);
    }

    private static void requirePositive(Duration timeout, String name) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}

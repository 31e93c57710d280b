package com.gigpulse.service.http;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

public record UpstreamTruststore(Path path, String password) {
    public UpstreamTruststore {
        Objects.requireNonNull(path, "truststore path is required");
        Objects.requireNonNull(password, "truststore password is required");
    }

    public String type() {
        String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return lower.endsWith(".p12") || lower.endsWith(".pfx") || lower.endsWith(".pkcs12") ? "PKCS12" : "JKS";
    }
}

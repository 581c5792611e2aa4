package com.skystack.service.http;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public record TrustStoreSettings(Path path, String password, String type) {
    public static final String PATH_VARIABLE = "TRUSTSTORE_PATH";
    public static final String PASSWORD_VARIABLE = "TRUSTSTORE_PASSWORD";

    public static Optional<TrustStoreSettings> fromEnvironment(Map<String, String> environment) {
        String location = environment.get(PATH_VARIABLE);
        if (location == null || location.isBlank()) {
            return Optional.empty();
        }
        String password = environment.get(PASSWORD_VARIABLE);
        if (password == null) {
            throw new IllegalStateException(PASSWORD_VARIABLE + " must be set when " + PATH_VARIABLE + " is configured");
        }
        Path path = Path.of(location);
        if (!Files.exists(path)) {
            throw new IllegalStateException("Truststore file does not exist: " + path);
        }
        return Optional.of(new TrustStoreSettings(path, password, typeOf(path)));
    }

    static String typeOf(Path path) {
        String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (lower.endsWith(".p12") || lower.endsWith(".pfx") || lower.endsWith(".pkcs12")) {
            return "PKCS12";
        }
        return "JKS";
    }
}

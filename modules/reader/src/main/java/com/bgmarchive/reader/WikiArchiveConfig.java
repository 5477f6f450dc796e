package com.bgmarchive.reader;

import com.bgmarchive.reader.stream.ErrorPolicy;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where the archive lives and how decode failures are handled.
 *
 * <p>Read from MicroProfile Config:
 * <ul>
 *   <li>{@code bgm.archive.path} (required)</li>
 *   <li>{@code bgm.archive.error-policy}: {@code silent}, {@code fail-fast} (default) or {@code collect}</li>
 * </ul>
 */
public record WikiArchiveConfig(Path archivePath, ErrorPolicy errorPolicy) {

    public static final String PATH_KEY = "bgm.archive.path";
    public static final String ERROR_POLICY_KEY = "bgm.archive.error-policy";
    public static final ErrorPolicy DEFAULT_ERROR_POLICY = ErrorPolicy.FAIL_FAST;

    public WikiArchiveConfig {
        Objects.requireNonNull(archivePath, "archivePath cannot be null");
        Objects.requireNonNull(errorPolicy, "errorPolicy cannot be null");
    }

    /**
     * @throws java.util.NoSuchElementException if {@code bgm.archive.path} is not set
     * @throws IllegalArgumentException         if the error policy is not recognized
     */
    public static WikiArchiveConfig fromConfig(Config config) {
        Path path = Path.of(config.getValue(PATH_KEY, String.class));
        ErrorPolicy policy = config.getOptionalValue(ERROR_POLICY_KEY, String.class)
                .map(ErrorPolicy::fromLabel)
                .orElse(DEFAULT_ERROR_POLICY);
        return new WikiArchiveConfig(path, policy);
    }

    /**
     * Reads the configuration visible to the current class loader: system properties,
     * environment variables and {@code META-INF/microprofile-config.properties}.
     */
    public static WikiArchiveConfig load() {
        return fromConfig(ConfigProvider.getConfig());
    }
}

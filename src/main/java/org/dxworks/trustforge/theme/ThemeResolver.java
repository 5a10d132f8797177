package org.dxworks.trustforge.theme;

import org.dxworks.trustforge.error.ThemeException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Finds the theme file to use.
 * <ol>
 *   <li>the configured path, absolute or relative to the working directory;</li>
 *   <li>{@code themes/neutral.yaml} in the working directory;</li>
 *   <li>the theme bundled in the jar (empty result).</li>
 * </ol>
 * A configured path other than the default that does not exist is an error rather than a silent
 * fallback.
 */
public final class ThemeResolver {

    private ThemeResolver() {}

    public static Optional<Path> resolve(String configuredPath) {
        Path defaultPath = Paths.get("").toAbsolutePath().resolve(ThemeLoader.BUNDLED_THEME);

        if (configuredPath != null && !configuredPath.isBlank()) {
            Path configured = Paths.get(configuredPath);
            Path candidate = configured.isAbsolute() ? configured : Paths.get("").toAbsolutePath().resolve(configured);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
            if (!candidate.normalize().equals(defaultPath.normalize())) {
                throw new ThemeException(configuredPath, "Theme file not found. Tried: " + candidate);
            }
        }

        if (Files.isRegularFile(defaultPath)) {
            return Optional.of(defaultPath);
        }
        return Optional.empty();
    }
}

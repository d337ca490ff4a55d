package httpreq;

import httpreq.common.Quantities;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Process-wide settings, resolved once at start-up and handed to whatever needs them.
 * <p>
 * The configuration directory is {@code $REQ_CONFIG_DIR}, else {@code ~/.config/req}. It holds the session
 * files and an optional {@code req.properties} with the keys {@code timeout}, {@code max-redirects} and
 * {@code user-agent}.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public class Configuration {
    private static final Set<String> KEYS = Set.of("timeout", "max-redirects", "user-agent");

    private final Path configDir;
    private final Duration timeout;
    private final int maxRedirects;
    private final String userAgent;

    public static Configuration defaults(final Path configDir) {
        return new Configuration(configDir, Const.DEFAULT_TIMEOUT, Const.MAX_REDIRECTS, Const.USER_AGENT);
    }

    public static Configuration load(final Map<String, String> env) {
        final var override = env.get(Const.CONFIG_DIR_ENV);
        final var configDir = override != null && !override.isBlank()
            ? Paths.get(override)
            : Paths.get(System.getProperty("user.home"), ".config", Const.REQ);
        return load(configDir);
    }

    public static Configuration load(final Path configDir) {
        final var file = configDir.resolve(Const.PROPERTIES_FILE);
        if (!Files.isRegularFile(file)) {
            return defaults(configDir);
        }

        final var properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file)) {
            properties.load(reader);
        } catch (final IOException e) {
            throw new IllegalArgumentException("Cannot read configuration file " + file + ": " + e.getMessage(), e);
        }

        for (final var key : properties.stringPropertyNames()) {
            if (!KEYS.contains(key)) {
                throw new IllegalArgumentException(String.format("Unknown configuration key '%s' in %s.", key, file));
            }
        }

        return new Configuration(
            configDir,
            durationVal(properties, "timeout", Const.DEFAULT_TIMEOUT),
            intVal(properties, "max-redirects", Const.MAX_REDIRECTS),
            properties.getProperty("user-agent", Const.USER_AGENT));
    }

    private static int intVal(final Properties properties, final String key, final int fallback) {
        final var val = properties.getProperty(key);
        if (val == null) {
            return fallback;
        }
        try {
            final var parsed = Integer.parseInt(val.trim());
            if (parsed < 0) {
                throw new NumberFormatException("negative");
            }
            return parsed;
        } catch (final NumberFormatException e) {
            final var message = String.format("Cannot parse value '%s' for configuration key '%s' as a non-negative integer.", val, key);
            throw new IllegalArgumentException(message, e);
        }
    }

    private static Duration durationVal(final Properties properties, final String key, final Duration fallback) {
        final var val = properties.getProperty(key);
        if (val == null) {
            return fallback;
        }
        try {
            return Quantities.duration(val);
        } catch (final IllegalArgumentException e) {
            final var message = String.format("Cannot parse value '%s' for configuration key '%s' as a duration.", val, key);
            throw new IllegalArgumentException(message, e);
        }
    }
}

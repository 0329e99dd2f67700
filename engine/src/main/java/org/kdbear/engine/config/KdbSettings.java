package org.kdbear.engine.config;

import org.kdbear.engine.KdbException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;

/**
 * Naming settings of a session.
 *
 * Defaults come from the classpath resource {@code kdbear.properties}; explicit
 * {@link Properties} and system properties override them key by key.
 *
 * @param sessionName   label used in log output
 * @param stagingSuffix suffix of the unkeyed copy staged for each join input
 * @param asofSuffix    suffix of the adjusted right table of an as-of or window join
 * @param windowSuffix  suffix of the staged window of a window join
 */
public record KdbSettings(String sessionName, String stagingSuffix, String asofSuffix, String windowSuffix) {

    public static final String RESOURCE = "/kdbear.properties";

    public static final String SESSION_NAME = "kdbear.session.name";
    public static final String STAGING_SUFFIX = "kdbear.staging.suffix";
    public static final String ASOF_SUFFIX = "kdbear.asof.suffix";
    public static final String WINDOW_SUFFIX = "kdbear.window.suffix";

    public KdbSettings {
        Objects.requireNonNull(sessionName, "sessionName");
        requireSuffix(stagingSuffix, STAGING_SUFFIX);
        requireSuffix(asofSuffix, ASOF_SUFFIX);
        requireSuffix(windowSuffix, WINDOW_SUFFIX);
    }

    private static void requireSuffix(String suffix, String key) {
        if (suffix == null || !suffix.matches("[A-Za-z0-9_]+")) {
            throw new IllegalArgumentException(key + " must be a non-empty q name fragment, got: " + suffix);
        }
    }

    /**
     * Settings from the bundled resource, overridden by system properties.
     */
    public static KdbSettings defaults() {
        return from(System.getProperties());
    }

    /**
     * Settings from the bundled resource, overridden by {@code overrides}.
     */
    public static KdbSettings from(Properties overrides) {
        Properties merged = new Properties();
        merged.putAll(loadResource());
        for (String key : new String[] { SESSION_NAME, STAGING_SUFFIX, ASOF_SUFFIX, WINDOW_SUFFIX }) {
            String value = overrides.getProperty(key);
            if (value != null) {
                merged.setProperty(key, value.trim());
            }
        }
        return new KdbSettings(
                merged.getProperty(SESSION_NAME, "default"),
                merged.getProperty(STAGING_SUFFIX, "unkeyed"),
                merged.getProperty(ASOF_SUFFIX, "adj"),
                merged.getProperty(WINDOW_SUFFIX, "window"));
    }

    public KdbSettings withSessionName(String name) {
        return new KdbSettings(name, stagingSuffix, asofSuffix, windowSuffix);
    }

    private static Properties loadResource() {
        Properties props = new Properties();
        try (InputStream in = KdbSettings.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new KdbException("Failed to read " + RESOURCE, e);
        }
        return props;
    }
}

package org.kdbear.engine.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KdbSettings Tests")
class KdbSettingsTest {

    @Test
    @DisplayName("Defaults come from kdbear.properties")
    void testDefaults() {
        KdbSettings settings = KdbSettings.from(new Properties());

        assertEquals("default", settings.sessionName());
        assertEquals("unkeyed", settings.stagingSuffix());
        assertEquals("adj", settings.asofSuffix());
        assertEquals("window", settings.windowSuffix());
    }

    @Test
    @DisplayName("Explicit properties override defaults key by key")
    void testOverrides() {
        Properties overrides = new Properties();
        overrides.setProperty(KdbSettings.STAGING_SUFFIX, " tmp ");
        overrides.setProperty(KdbSettings.SESSION_NAME, "risk");

        KdbSettings settings = KdbSettings.from(overrides);

        assertEquals("tmp", settings.stagingSuffix());
        assertEquals("risk", settings.sessionName());
        assertEquals("adj", settings.asofSuffix());
    }

    @Test
    @DisplayName("Suffixes must be usable inside q names")
    void testInvalidSuffix() {
        assertThrows(IllegalArgumentException.class, () -> new KdbSettings("s", "bad suffix", "adj", "window"));
        assertThrows(IllegalArgumentException.class, () -> new KdbSettings("s", "unkeyed", "", "window"));
    }

    @Test
    @DisplayName("withSessionName keeps the other settings")
    void testWithSessionName() {
        KdbSettings settings = KdbSettings.from(new Properties()).withSessionName("blotter");
        assertEquals("blotter", settings.sessionName());
        assertEquals("unkeyed", settings.stagingSuffix());
    }
}

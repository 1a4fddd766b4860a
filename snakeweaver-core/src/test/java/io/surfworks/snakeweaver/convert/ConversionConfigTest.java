package io.surfworks.snakeweaver.convert;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Tests for {@link ConversionConfig}. */
@DisplayName("ConversionConfig")
class ConversionConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(ConversionConfig.PROP_STRICT_CONVERSION);
        System.clearProperty(ConversionConfig.PROP_IGNORE_FALLBACKS);
    }

    @Test
    @DisplayName("flags are off unless set")
    void builderDefaults() {
        ConversionConfig config = ConversionConfig.builder().build();
        assertFalse(config.isStrictConversion());
        assertFalse(config.isIgnoreFallbacks());
    }

    @Test
    @DisplayName("toBuilder keeps both flags")
    void toBuilder() {
        ConversionConfig config = ConversionConfig.builder().strictConversion(true).ignoreFallbacks(true).build()
                .toBuilder().build();
        assertTrue(config.isStrictConversion());
        assertTrue(config.isIgnoreFallbacks());
    }

    @ParameterizedTest
    @ValueSource(strings = {"true", "TRUE", " True ", "1"})
    @DisplayName("truthy flag values")
    void truthy(String value) {
        assertTrue(ConversionConfig.parseFlag(value));
    }

    @ParameterizedTest
    @ValueSource(strings = {"false", "0", "yes", ""})
    @DisplayName("other flag values")
    void falsy(String value) {
        assertFalse(ConversionConfig.parseFlag(value));
    }

    @Test
    @DisplayName("an absent flag is off")
    void absent() {
        assertFalse(ConversionConfig.parseFlag(null));
    }

    @Test
    @DisplayName("system properties are read")
    void systemProperties() {
        System.setProperty(ConversionConfig.PROP_STRICT_CONVERSION, "1");
        System.setProperty(ConversionConfig.PROP_IGNORE_FALLBACKS, "true");

        ConversionConfig config = ConversionConfig.defaults();
        assertTrue(config.isStrictConversion());
        assertTrue(config.isIgnoreFallbacks());
    }

    @Test
    @DisplayName("a system property takes precedence over the environment")
    void propertyWins() {
        System.setProperty(ConversionConfig.PROP_STRICT_CONVERSION, "false");

        assertFalse(ConversionConfig.defaults().isStrictConversion());
    }
}

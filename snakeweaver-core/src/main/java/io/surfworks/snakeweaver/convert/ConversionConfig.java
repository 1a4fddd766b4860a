package io.surfworks.snakeweaver.convert;

/**
 * Flags consulted by the conversion engine.
 *
 * <p>Both flags are off by default. {@link #defaults()} reads them from the
 * environment ({@code SNAKEWEAVER_STRICT_CONVERSION=true}) or from system
 * properties ({@code -Dsnakeweaver.strictConversion=true}); a system property
 * takes precedence over the environment.
 */
public final class ConversionConfig {

    /**
     * Environment variable turning fallback conditions into hard errors.
     */
    public static final String ENV_STRICT_CONVERSION = "SNAKEWEAVER_STRICT_CONVERSION";

    /**
     * Environment variable suppressing fallback warnings.
     */
    public static final String ENV_IGNORE_FALLBACKS = "SNAKEWEAVER_IGNORE_FALLBACKS";

    public static final String PROP_STRICT_CONVERSION = "snakeweaver.strictConversion";
    public static final String PROP_IGNORE_FALLBACKS = "snakeweaver.ignoreFallbacks";

    private final boolean strictConversion;
    private final boolean ignoreFallbacks;

    private ConversionConfig(Builder builder) {
        this.strictConversion = builder.strictConversion;
        this.ignoreFallbacks = builder.ignoreFallbacks;
    }

    /**
     * Configuration from system properties and environment variables.
     */
    public static ConversionConfig defaults() {
        return builder()
                .strictConversion(flag(PROP_STRICT_CONVERSION, ENV_STRICT_CONVERSION))
                .ignoreFallbacks(flag(PROP_IGNORE_FALLBACKS, ENV_IGNORE_FALLBACKS))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Type mismatches and unconvertible domains raise instead of falling back,
     * and primitive failures propagate.
     */
    public boolean isStrictConversion() {
        return strictConversion;
    }

    /**
     * Fallbacks still happen but emit no warning.
     */
    public boolean isIgnoreFallbacks() {
        return ignoreFallbacks;
    }

    public Builder toBuilder() {
        return new Builder().strictConversion(strictConversion).ignoreFallbacks(ignoreFallbacks);
    }

    @Override
    public String toString() {
        return "ConversionConfig[strictConversion=" + strictConversion + ", ignoreFallbacks=" + ignoreFallbacks + "]";
    }

    static boolean parseFlag(String value) {
        return value != null && ("true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim()));
    }

    private static boolean flag(String property, String env) {
        String value = System.getProperty(property);
        if (value == null) {
            value = System.getenv(env);
        }
        return parseFlag(value);
    }

    public static final class Builder {

        private boolean strictConversion;
        private boolean ignoreFallbacks;

        private Builder() {}

        public Builder strictConversion(boolean strictConversion) {
            this.strictConversion = strictConversion;
            return this;
        }

        public Builder ignoreFallbacks(boolean ignoreFallbacks) {
            this.ignoreFallbacks = ignoreFallbacks;
            return this;
        }

        public ConversionConfig build() {
            return new ConversionConfig(this);
        }
    }
}

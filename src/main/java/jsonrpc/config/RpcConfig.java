package jsonrpc.config;

import jsonrpc.codec.DataFormat;
import jsonrpc.wire.MethodSchema;
import jsonrpc.wire.Profile;
import jsonrpc.wire.RpcBinding;
import jsonrpc.wire.WireMode;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * Deployment-wide protocol configuration: wire mode, data format and profile.
 * Immutable configuration object with builder pattern support.
 * <p>
 * The choice is made once, typically at packaging time through the
 * {@value #RESOURCE} classpath resource; an existing client or server never switches.
 */
public final class RpcConfig {

    public static final String RESOURCE = "jsonrpc.properties";

    public static final String WIRE_MODE_KEY = "jsonrpc.wire.mode";
    public static final String DATA_FORMAT_KEY = "jsonrpc.data.format";
    public static final String PROFILE_KEY = "jsonrpc.profile";

    private final WireMode wireMode;
    private final DataFormat dataFormat;
    private final Profile profile;

    private RpcConfig(Builder builder) {
        this.wireMode = builder.wireMode;
        this.dataFormat = builder.dataFormat;
        this.profile = builder.profile;

        validate();
    }

    private void validate() {
        if (wireMode == null) {
            throw new IllegalArgumentException("wireMode cannot be null");
        }
        if (dataFormat == null) {
            throw new IllegalArgumentException("dataFormat cannot be null");
        }
        if (profile == null) {
            throw new IllegalArgumentException("profile cannot be null");
        }
    }

    public WireMode wireMode() {
        return wireMode;
    }

    public DataFormat dataFormat() {
        return dataFormat;
    }

    public Profile profile() {
        return profile;
    }

    /**
     * Binds this configuration to an application's methods and result type.
     */
    public <M, R> RpcBinding<M, R> bind(MethodSchema<M> schema, Class<R> resultType) {
        return new RpcBinding<>(dataFormat.newCodec(), wireMode.newWireFormat(profile), schema, resultType);
    }

    /**
     * Creates a builder with default values.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a configuration with default values: compact JSON, standard profile.
     */
    public static RpcConfig defaults() {
        return builder().build();
    }

    /**
     * Reads {@value #RESOURCE} from the context class loader, falling back to
     * {@link #defaults()} when the resource is absent.
     *
     * @throws UncheckedIOException if the resource exists but cannot be read
     * @throws IllegalArgumentException if it names an unknown mode, format or profile
     */
    public static RpcConfig load() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = RpcConfig.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    /**
     * Builds a configuration from properties; missing keys keep their defaults.
     */
    public static RpcConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder = builder();
        String wireMode = properties.getProperty(WIRE_MODE_KEY);
        if (wireMode != null) {
            builder.wireMode(WireMode.parse(wireMode));
        }
        String dataFormat = properties.getProperty(DATA_FORMAT_KEY);
        if (dataFormat != null) {
            builder.dataFormat(DataFormat.parse(dataFormat));
        }
        String profile = properties.getProperty(PROFILE_KEY);
        if (profile != null) {
            builder.profile(Profile.parse(profile));
        }
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RpcConfig)) return false;
        RpcConfig other = (RpcConfig) o;
        return wireMode == other.wireMode && dataFormat == other.dataFormat && profile == other.profile;
    }

    @Override
    public int hashCode() {
        return Objects.hash(wireMode, dataFormat, profile);
    }

    @Override
    public String toString() {
        return String.format("RpcConfig{wireMode=%s, dataFormat=%s, profile=%s}", wireMode, dataFormat, profile);
    }

    /**
     * Builder for RpcConfig with fluent API.
     */
    public static final class Builder {
        private WireMode wireMode = WireMode.COMPACT;
        private DataFormat dataFormat = DataFormat.JSON;
        private Profile profile = Profile.STANDARD;

        public Builder wireMode(WireMode wireMode) {
            this.wireMode = wireMode;
            return this;
        }

        public Builder dataFormat(DataFormat dataFormat) {
            this.dataFormat = dataFormat;
            return this;
        }

        public Builder profile(Profile profile) {
            this.profile = profile;
            return this;
        }

        public RpcConfig build() {
            return new RpcConfig(this);
        }
    }
}

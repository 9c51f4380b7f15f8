package express.mvp.myra.messaging;

import express.mvp.myra.messaging.util.Addresses;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of a messaging session and its engine.
 *
 * <p>Instances are immutable. A configuration is sealed when the first session opens with it;
 * sealing only records that it is in use, since nothing can change it afterwards. Range checks
 * happen in the builder. Checks that depend on several options or on the file system (a
 * certificate is required unless encryption is disabled) happen when the engine initializes, and
 * fail the session with a {@link express.mvp.myra.messaging.error.ConfigurationException}.
 *
 * <h2>Configuration Options</h2>
 *
 * <table border="1">
 *   <caption>Session Configuration Parameters</caption>
 *   <tr><th>Parameter</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>reuseTime</td><td>30s</td><td>Idle time before a connection is collected
 *       (at least 3 x timeout)</td></tr>
 *   <tr><td>timeout</td><td>5s</td><td>Send and request timeout; connect timeout is
 *       min(2 x timeout, 60s)</td></tr>
 *   <tr><td>port</td><td>2998</td><td>Listen port, 0 for ephemeral</td></tr>
 *   <tr><td>backlog</td><td>100</td><td>TCP listen backlog</td></tr>
 *   <tr><td>maxSlots</td><td>0</td><td>Receive slots per connection; 0 means 1 when
 *       synchronous, 16 otherwise</td></tr>
 *   <tr><td>synchronous</td><td>true</td><td>Remote acknowledges each message before the
 *       next one is sent</td></tr>
 *   <tr><td>autoRelease</td><td>true</td><td>Adapters release slots for the handler</td></tr>
 *   <tr><td>bufferSize</td><td>0</td><td>Connection buffer size, 0 for the default</td></tr>
 *   <tr><td>maxMessageSize</td><td>100 MiB</td><td>Largest header plus payload</td></tr>
 *   <tr><td>bindV4</td><td>0.0.0.0</td><td>IPv4 listen address</td></tr>
 *   <tr><td>bindV6</td><td>none</td><td>IPv6 listen address</td></tr>
 *   <tr><td>identity</td><td>zero</td><td>Node identity; zero generates one</td></tr>
 *   <tr><td>certChainPem</td><td>none</td><td>PEM with certificate chain and private key</td></tr>
 *   <tr><td>dhParamsPem</td><td>none</td><td>PEM with DH parameters</td></tr>
 *   <tr><td>disableEncryption</td><td>false</td><td>Plain TCP to every peer</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * SessionConfig config = SessionConfig.builder()
 *     .port(2992)
 *     .timeout(Duration.ofSeconds(2))
 *     .certChainPem("/etc/myra/cert.pem")
 *     .dhParamsPem("/etc/myra/dh.pem")
 *     .build();
 * }</pre>
 */
public final class SessionConfig {

    /** Default listen port. */
    public static final int DEFAULT_PORT = 2998;

    /** Default maximum message size (100 MiB). */
    public static final int DEFAULT_MAX_MESSAGE_SIZE = 100 * 1024 * 1024;

    /** Engine buffer size used when {@code bufferSize} is 0. */
    public static final int DEFAULT_BUFFER_SIZE = 64 * 1024;

    /** Smallest explicit buffer size. */
    public static final int MIN_BUFFER_SIZE = 1024;

    /** Largest number of receive slots per connection. */
    public static final int MAX_SLOTS = 32;

    /** Idle time before a connection is collected. */
    private final Duration reuseTime;

    /** Send, request and stop-drain timeout. */
    private final Duration timeout;

    /** Listen port. */
    private final int port;

    /** TCP listen backlog. */
    private final int backlog;

    /** Configured receive slots, 0 for the mode default. */
    private final int maxSlots;

    /** Connection-synchronous mode. */
    private final boolean synchronous;

    /** Adapter auto-release policy. */
    private final boolean autoRelease;

    /** Connection buffer size, 0 for the default. */
    private final int bufferSize;

    /** Largest accepted header plus payload. */
    private final int maxMessageSize;

    /** IPv4 listen address in canonical form. */
    private final String bindV4;

    /** IPv6 listen address in canonical form, null when disabled. */
    private final String bindV6;

    /** Node identity override. */
    private final Identity identity;

    /** Certificate chain and key file. */
    private final String certChainPem;

    /** DH parameter file. */
    private final String dhParamsPem;

    /** Disables TLS for every peer. */
    private final boolean disableEncryption;

    private volatile boolean sealed;

    private SessionConfig(Builder builder) {
        this.reuseTime = builder.reuseTime;
        this.timeout = builder.timeout;
        this.port = builder.port;
        this.backlog = builder.backlog;
        this.maxSlots = builder.maxSlots;
        this.synchronous = builder.synchronous;
        this.autoRelease = builder.autoRelease;
        this.bufferSize = builder.bufferSize;
        this.maxMessageSize = builder.maxMessageSize;
        this.bindV4 = builder.bindV4;
        this.bindV6 = builder.bindV6;
        this.identity = builder.identity;
        this.certChainPem = builder.certChainPem;
        this.dhParamsPem = builder.dhParamsPem;
        this.disableEncryption = builder.disableEncryption;
    }

    /**
     * Creates a new builder with default values.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the default configuration.
     *
     * @return a configuration with every option at its default
     */
    public static SessionConfig defaults() {
        return builder().build();
    }

    /**
     * Creates a builder seeded with this configuration's values.
     *
     * @return a new, unsealed builder
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.reuseTime = reuseTime;
        b.timeout = timeout;
        b.port = port;
        b.backlog = backlog;
        b.maxSlots = maxSlots;
        b.synchronous = synchronous;
        b.autoRelease = autoRelease;
        b.bufferSize = bufferSize;
        b.maxMessageSize = maxMessageSize;
        b.bindV4 = bindV4;
        b.bindV6 = bindV6;
        b.identity = identity;
        b.certChainPem = certChainPem;
        b.dhParamsPem = dhParamsPem;
        b.disableEncryption = disableEncryption;
        return b;
    }

    public Duration reuseTime() {
        return reuseTime;
    }

    /**
     * Returns the idle time after which a connection is collected: the larger of
     * {@link #reuseTime()} and three times {@link #timeout()}.
     *
     * @return the effective reuse time
     */
    public Duration effectiveReuseTime() {
        Duration minimum = timeout.multipliedBy(3);
        return reuseTime.compareTo(minimum) >= 0 ? reuseTime : minimum;
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Returns the connect timeout: {@code min(2 * timeout, 60s)}.
     *
     * @return the connect timeout
     */
    public Duration connectTimeout() {
        Duration doubled = timeout.multipliedBy(2);
        Duration cap = Duration.ofSeconds(60);
        return doubled.compareTo(cap) <= 0 ? doubled : cap;
    }

    public int port() {
        return port;
    }

    public int backlog() {
        return backlog;
    }

    /**
     * Returns the configured slot count, 0 meaning "mode default".
     *
     * @return the configured value
     */
    public int maxSlots() {
        return maxSlots;
    }

    /**
     * Returns the number of receive slots per connection after applying the mode default.
     *
     * @return 1..32
     */
    public int effectiveMaxSlots() {
        if (maxSlots != 0) {
            return maxSlots;
        }
        return synchronous ? 1 : 16;
    }

    public boolean synchronous() {
        return synchronous;
    }

    public boolean autoRelease() {
        return autoRelease;
    }

    public int bufferSize() {
        return bufferSize;
    }

    /**
     * Returns the buffer size after applying the default.
     *
     * @return the buffer size in bytes
     */
    public int effectiveBufferSize() {
        return bufferSize == 0 ? DEFAULT_BUFFER_SIZE : bufferSize;
    }

    public int maxMessageSize() {
        return maxMessageSize;
    }

    public String bindV4() {
        return bindV4;
    }

    public String bindV6() {
        return bindV6;
    }

    public Identity identity() {
        return identity;
    }

    public String certChainPem() {
        return certChainPem;
    }

    public String dhParamsPem() {
        return dhParamsPem;
    }

    public boolean disableEncryption() {
        return disableEncryption;
    }

    /**
     * Checks whether a session has been opened with this configuration.
     *
     * @return true once sealed
     */
    public boolean isSealed() {
        return sealed;
    }

    /** Marks the configuration as in use. */
    void seal() {
        sealed = true;
    }

    @Override
    public String toString() {
        return "SessionConfig[port=" + port
                + ", timeout=" + timeout
                + ", synchronous=" + synchronous
                + ", maxSlots=" + effectiveMaxSlots()
                + ", autoRelease=" + autoRelease
                + ", encryption=" + !disableEncryption
                + "]";
    }

    /** Builder for {@link SessionConfig}. */
    public static final class Builder {

        private Duration reuseTime = Duration.ofSeconds(30);
        private Duration timeout = Duration.ofSeconds(5);
        private int port = DEFAULT_PORT;
        private int backlog = 100;
        private int maxSlots = 0;
        private boolean synchronous = true;
        private boolean autoRelease = true;
        private int bufferSize = 0;
        private int maxMessageSize = DEFAULT_MAX_MESSAGE_SIZE;
        private String bindV4 = "0.0.0.0";
        private String bindV6;
        private Identity identity = Identity.ZERO;
        private String certChainPem;
        private String dhParamsPem;
        private boolean disableEncryption;

        private Builder() {}

        public Builder reuseTime(Duration reuseTime) {
            this.reuseTime = positive(reuseTime, "reuseTime");
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = positive(timeout, "timeout");
            return this;
        }

        public Builder port(int port) {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("port must be 0..65535, got " + port);
            }
            this.port = port;
            return this;
        }

        public Builder backlog(int backlog) {
            if (backlog < 1 || backlog > 255) {
                throw new IllegalArgumentException("backlog must be 1..255, got " + backlog);
            }
            this.backlog = backlog;
            return this;
        }

        public Builder maxSlots(int maxSlots) {
            if (maxSlots < 0 || maxSlots > MAX_SLOTS) {
                throw new IllegalArgumentException(
                        "maxSlots must be 0..." + MAX_SLOTS + ", got " + maxSlots);
            }
            this.maxSlots = maxSlots;
            return this;
        }

        public Builder synchronous(boolean synchronous) {
            this.synchronous = synchronous;
            return this;
        }

        public Builder autoRelease(boolean autoRelease) {
            this.autoRelease = autoRelease;
            return this;
        }

        public Builder bufferSize(int bufferSize) {
            if (bufferSize != 0 && bufferSize < MIN_BUFFER_SIZE) {
                throw new IllegalArgumentException(
                        "bufferSize must be 0 or at least " + MIN_BUFFER_SIZE + ", got "
                                + bufferSize);
            }
            this.bufferSize = bufferSize;
            return this;
        }

        public Builder maxMessageSize(int maxMessageSize) {
            if (maxMessageSize < 1) {
                throw new IllegalArgumentException(
                        "maxMessageSize must be positive, got " + maxMessageSize);
            }
            this.maxMessageSize = maxMessageSize;
            return this;
        }

        /**
         * Sets the IPv4 listen address.
         *
         * @param bindV4 a dotted-quad literal
         * @return this builder
         * @throws IllegalArgumentException if not an IPv4 literal
         */
        public Builder bindV4(String bindV4) {
            String canonical = Addresses.normalize(bindV4);
            if (canonical.indexOf(':') >= 0) {
                throw new IllegalArgumentException("Not an IPv4 address: " + bindV4);
            }
            this.bindV4 = canonical;
            return this;
        }

        /**
         * Sets the IPv6 listen address; {@code null} disables the IPv6 listener.
         *
         * @param bindV6 an IPv6 literal or null
         * @return this builder
         * @throws IllegalArgumentException if not an IPv6 literal
         */
        public Builder bindV6(String bindV6) {
            if (bindV6 == null) {
                this.bindV6 = null;
                return this;
            }
            if (bindV6.indexOf(':') < 0) {
                throw new IllegalArgumentException("Not an IPv6 address: " + bindV6);
            }
            this.bindV6 = Addresses.normalize(bindV6);
            return this;
        }

        public Builder identity(Identity identity) {
            this.identity = Objects.requireNonNull(identity, "identity must not be null");
            return this;
        }

        public Builder certChainPem(String certChainPem) {
            this.certChainPem = certChainPem;
            return this;
        }

        public Builder dhParamsPem(String dhParamsPem) {
            this.dhParamsPem = dhParamsPem;
            return this;
        }

        public Builder disableEncryption(boolean disableEncryption) {
            this.disableEncryption = disableEncryption;
            return this;
        }

        public SessionConfig build() {
            return new SessionConfig(this);
        }

        private static Duration positive(Duration value, String name) {
            Objects.requireNonNull(value, name + " must not be null");
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive, got " + value);
            }
            return value;
        }
    }
}

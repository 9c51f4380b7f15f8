package express.mvp.myra.messaging.engine.netty;

import io.netty.handler.ssl.ClientAuth;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import java.io.File;
import javax.net.ssl.SSLException;

/**
 * Builds the TLS contexts of the engine from one PEM file.
 *
 * <p>The file holds the certificate chain followed by the PKCS#8 private key. Both sides present
 * the chain and trust only certificates issued by it, so every node of a deployment shares the
 * same certificate authority.
 */
final class TlsContexts {

    private static final String[] PROTOCOLS = {"TLSv1.3", "TLSv1.2"};

    private TlsContexts() {
        // Utility class
    }

    /**
     * Builds the context for accepted connections. Clients must authenticate.
     *
     * @param certChainPem the PEM file
     * @return the server context
     * @throws SSLException if the certificate or key cannot be used
     * @throws IllegalArgumentException if the file holds no certificate or key
     */
    static SslContext server(File certChainPem) throws SSLException {
        return SslContextBuilder.forServer(certChainPem, certChainPem)
                .trustManager(certChainPem)
                .clientAuth(ClientAuth.REQUIRE)
                .protocols(PROTOCOLS)
                .build();
    }

    /**
     * Builds the context for outbound connections.
     *
     * @param certChainPem the PEM file
     * @return the client context
     * @throws SSLException if the certificate or key cannot be used
     * @throws IllegalArgumentException if the file holds no certificate or key
     */
    static SslContext client(File certChainPem) throws SSLException {
        return SslContextBuilder.forClient()
                .keyManager(certChainPem, certChainPem)
                .trustManager(certChainPem)
                .protocols(PROTOCOLS)
                .build();
    }
}

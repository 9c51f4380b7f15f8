package express.mvp.myra.adapters;

import express.mvp.myra.messaging.MessageEnvelope;
import express.mvp.myra.messaging.SessionConfig;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/** Loopback configurations without certificates. */
final class LocalConfigs {

    private LocalConfigs() {}

    static SessionConfig.Builder local() {
        return SessionConfig.builder()
                .port(0)
                .bindV4("127.0.0.1")
                .disableEncryption(true)
                .timeout(Duration.ofSeconds(2));
    }

    static MessageEnvelope to(int port, String payload) {
        return new MessageEnvelope()
                .address("127.0.0.1")
                .port(port)
                .payload(payload.getBytes(StandardCharsets.UTF_8));
    }

    static String text(MessageEnvelope envelope) {
        return new String(envelope.payload(), StandardCharsets.UTF_8);
    }
}

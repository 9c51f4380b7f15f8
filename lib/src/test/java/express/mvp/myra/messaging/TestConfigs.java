package express.mvp.myra.messaging;

import java.time.Duration;

/** Configurations for sessions on the loopback interface, without certificates. */
final class TestConfigs {

    private TestConfigs() {}

    static SessionConfig.Builder local() {
        return SessionConfig.builder()
                .port(0)
                .bindV4("127.0.0.1")
                .disableEncryption(true)
                .timeout(Duration.ofSeconds(2));
    }

    static MessageEnvelope to(MessagingSession session) {
        return new MessageEnvelope().address("127.0.0.1").port(session.port());
    }
}

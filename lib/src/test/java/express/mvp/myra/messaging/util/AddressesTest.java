package express.mvp.myra.messaging.util;

import static org.junit.jupiter.api.Assertions.*;

import java.net.InetAddress;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

/** Unit tests for {@link Addresses}. */
@DisplayName("Addresses")
class AddressesTest {

    @Nested
    @DisplayName("Normalization")
    class NormalizeTests {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "127.0.0.1, 127.0.0.1",
            "0.0.0.0, 0.0.0.0",
            "010.1.1.1, 10.1.1.1",
            "::1, ::1",
            "1:0:0::, 1::",
            "2001:DB8:0:0:0:0:0:1, 2001:db8::1",
            "2001:db8:0:1:0:0:0:1, 2001:db8:0:1::1",
            "2001:db8:0:1:1:1:1:1, 2001:db8:0:1:1:1:1:1",
            "0:0:0:0:0:0:0:0, ::"
        })
        @DisplayName("Produces canonical text")
        void canonicalText(String input, String expected) {
            assertEquals(expected, Addresses.normalize(input));
        }
    }

    @Nested
    @DisplayName("Rejection")
    class RejectTests {

        @ParameterizedTest(name = "\"{0}\"")
        @ValueSource(strings = {"127.0", "1.2.3.4.5", "256.1.1.1", "a.b.c.d", "1..2.3", "host",
            "fe80::1%eth0"})
        @DisplayName("Invalid literals are rejected")
        void invalidRejected(String input) {
            assertThrows(IllegalArgumentException.class, () -> Addresses.parse(input));
        }

        @Test
        @DisplayName("Null and empty are rejected")
        void emptyRejected() {
            assertThrows(IllegalArgumentException.class, () -> Addresses.parse(null));
            assertThrows(IllegalArgumentException.class, () -> Addresses.parse(""));
        }
    }

    @Test
    @DisplayName("Loopback detection covers both families")
    void loopback() {
        InetAddress v4 = Addresses.parse("127.0.0.5");
        InetAddress v6 = Addresses.parse("::1");

        assertTrue(Addresses.isLoopback(v4));
        assertTrue(Addresses.isLoopback(v6));
        assertFalse(Addresses.isLoopback(Addresses.parse("10.0.0.1")));
    }
}

package express.mvp.myra.messaging;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link Identity}. */
@DisplayName("Identity")
class IdentityTest {

    @Test
    @DisplayName("Random identities are distinct and non-zero")
    void randomIdentitiesAreDistinct() {
        Set<Identity> seen = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            Identity id = Identity.random();
            assertFalse(id.isZero());
            assertTrue(seen.add(id));
        }
    }

    @Test
    @DisplayName("Equality is by content")
    void equalityByContent() {
        byte[] bytes = new byte[Identity.SIZE];
        bytes[3] = 42;
        Identity a = Identity.of(bytes);
        Identity b = Identity.of(bytes.clone());

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, Identity.ZERO);
    }

    @Test
    @DisplayName("of() copies its input")
    void ofCopiesInput() {
        byte[] bytes = new byte[Identity.SIZE];
        Identity id = Identity.of(bytes);
        bytes[0] = 1;

        assertTrue(id.isZero());
        assertEquals(Identity.ZERO, id);
    }

    @Test
    @DisplayName("Wrong length is rejected")
    void wrongLengthRejected() {
        assertThrows(IllegalArgumentException.class, () -> Identity.of(new byte[15]));
        assertThrows(IllegalArgumentException.class, () -> Identity.of(new byte[17]));
        assertThrows(NullPointerException.class, () -> Identity.of(null));
    }

    @Test
    @DisplayName("toString is lowercase hex")
    void toStringIsHex() {
        byte[] bytes = new byte[Identity.SIZE];
        bytes[0] = (byte) 0xAB;
        bytes[15] = 0x01;

        assertEquals("ab000000000000000000000000000001", Identity.of(bytes).toString());
    }

    @Test
    @DisplayName("copyTo writes at the offset")
    void copyToOffset() {
        Identity id = Identity.random();
        byte[] target = new byte[Identity.SIZE + 2];

        id.copyTo(target, 2);

        byte[] copied = new byte[Identity.SIZE];
        System.arraycopy(target, 2, copied, 0, Identity.SIZE);
        assertArrayEquals(id.toBytes(), copied);
    }
}

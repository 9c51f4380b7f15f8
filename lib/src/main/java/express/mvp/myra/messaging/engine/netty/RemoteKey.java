package express.mvp.myra.messaging.engine.netty;

import express.mvp.myra.messaging.util.Addresses;
import java.net.InetAddress;

/**
 * Route to a remote node: its address in canonical form and its public listen port.
 *
 * @param address canonical textual address
 * @param port public listen port of the remote
 */
public record RemoteKey(String address, int port) {

    /**
     * Builds the key for an address and port.
     *
     * @param address the remote address
     * @param port the remote's public port
     * @return the key
     */
    public static RemoteKey of(InetAddress address, int port) {
        return new RemoteKey(Addresses.canonical(address), port);
    }

    @Override
    public String toString() {
        return address.indexOf(':') >= 0 ? "[" + address + "]:" + port : address + ":" + port;
    }
}

package admit.java.engine;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Optional;

/**
 * Helpers shared by the transport-specific key extractors.
 */
public final class ClientKeys {

    public static final String SHARED_KEY = "shared";

    private ClientKeys() {
    }

    public static String orShared(Optional<String> key) {
        return key.map(String::trim)
            .filter(k -> !k.isEmpty())
            .orElse(SHARED_KEY);
    }

    /**
     * First (client-most) address of an X-Forwarded-For style header.
     */
    public static Optional<String> firstForwardedFor(String headerValue) {
        if (headerValue == null) {
            return Optional.empty();
        }
        String first = headerValue.split(",", 2)[0].trim();
        return first.isEmpty() ? Optional.empty() : Optional.of(first);
    }

    /**
     * IP address of a socket address; empty for non-IP transports.
     */
    public static Optional<String> hostOf(SocketAddress address) {
        if (!(address instanceof InetSocketAddress)) {
            return Optional.empty();
        }
        InetSocketAddress inet = (InetSocketAddress) address;
        InetAddress resolved = inet.getAddress();
        return Optional.ofNullable(resolved != null ? resolved.getHostAddress() : inet.getHostString());
    }
}

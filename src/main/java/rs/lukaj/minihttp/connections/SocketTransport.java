package rs.lukaj.minihttp.connections;

import javax.net.ssl.SSLSocket;
import java.io.IOException;
import java.net.Socket;

/**
 * {@link Transport} over a connected socket. Whether it's a plain socket, a TLS socket or a socket tunneled
 * through a proxy makes no difference here; {@link Connector} takes care of setting it up.
 */
public class SocketTransport extends StreamTransport {
    private final Socket socket;

    /**
     * @param socket connected socket; for TLS, handshake should already be done
     * @throws IOException if socket streams can't be obtained
     */
    public SocketTransport(Socket socket) throws IOException {
        super(socket.getInputStream(), socket.getOutputStream());
        this.socket = socket;
    }

    /**
     * @return whether bytes go over TLS
     */
    public boolean isSecure() {
        return socket instanceof SSLSocket;
    }

    @Override
    public boolean isClosed() {
        return super.isClosed() || socket.isClosed();
    }

    @Override
    public void close() throws IOException {
        try {
            super.close();
        } finally {
            socket.close();
        }
    }

    @Override
    public String toString() {
        return (isSecure() ? "TLS " : "") + "socket to " + socket.getRemoteSocketAddress();
    }
}

package rs.lukaj.minihttp.connections;

import java.io.Closeable;
import java.io.IOException;

/**
 * Duplex byte stream bound to a single remote endpoint, used by exactly one request. Doesn't implement any HTTP;
 * {@link RequestWriter} and {@link ResponseParser} only ever see this interface, regardless of whether bytes go
 * over a plain socket, over TLS, or through a proxy tunnel.
 * <br/>
 * Implementations are not thread-safe.
 */
public interface Transport extends Closeable {

    /**
     * Read at most len bytes into the buffer, starting at offset. Blocks until at least one byte is available,
     * end of stream is reached or an error occurs.
     * @param buf buffer used for storing read data
     * @param offset data is stored starting on this index
     * @param len maximum number of bytes to read
     * @return number of bytes read, or -1 if end of stream has been reached
     * @throws IOException if reading fails
     */
    int read(byte[] buf, int offset, int len) throws IOException;

    /**
     * Read a single byte. Blocks until it's available.
     * @return next byte, or -1 if end of stream has been reached
     * @throws IOException if reading fails
     */
    default int read() throws IOException {
        byte[] single = new byte[1];
        int n;
        do {
            n = read(single, 0, 1);
        } while(n == 0);
        return n < 0 ? -1 : single[0] & 0xFF;
    }

    /**
     * Write len bytes from the buffer, starting at offset. Bytes may be buffered until {@link #flush()}.
     * @param buf data to be sent
     * @param offset index of the first byte to send
     * @param len number of bytes to send
     * @throws IOException if writing fails
     */
    void write(byte[] buf, int offset, int len) throws IOException;

    /**
     * Write all given bytes. Bytes may be buffered until {@link #flush()}.
     * @param bytes data to be sent
     * @throws IOException if writing fails
     */
    default void write(byte[] bytes) throws IOException {
        write(bytes, 0, bytes.length);
    }

    /**
     * Send all buffered bytes to the remote endpoint.
     * @throws IOException if writing fails
     */
    void flush() throws IOException;

    /**
     * @return whether this transport has been closed
     */
    boolean isClosed();
}

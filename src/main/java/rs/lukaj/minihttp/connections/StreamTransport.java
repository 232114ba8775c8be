package rs.lukaj.minihttp.connections;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * {@link Transport} over a pair of streams. Output is buffered; input isn't, so nothing is read past what the
 * caller asked for (which matters when a TLS session is layered over a proxy tunnel afterwards).
 * <br/>
 * Can be used as-is over in-memory streams, e.g. to replay a recorded response.
 */
public class StreamTransport implements Transport {
    private static final int OUTPUT_BUFFER = 8192;

    private final InputStream input;
    private final OutputStream output;
    private volatile boolean closed = false;

    public StreamTransport(InputStream input, OutputStream output) {
        this.input = input;
        this.output = new BufferedOutputStream(output, OUTPUT_BUFFER);
    }

    private void ensureOpen() throws IOException {
        if(closed) throw new IOException("Transport is closed");
    }

    @Override
    public int read(byte[] buf, int offset, int len) throws IOException {
        ensureOpen();
        return input.read(buf, offset, len);
    }

    @Override
    public int read() throws IOException {
        ensureOpen();
        return input.read();
    }

    @Override
    public void write(byte[] buf, int offset, int len) throws IOException {
        ensureOpen();
        output.write(buf, offset, len);
    }

    @Override
    public void flush() throws IOException {
        ensureOpen();
        output.flush();
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    /**
     * Close both streams.
     * @throws IOException if closing any of the streams fails
     */
    @Override
    public void close() throws IOException {
        if(closed) return;
        closed = true;
        try {
            input.close();
        } finally {
            output.close();
        }
    }
}

package rs.lukaj.minihttp.connections;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

import static java.nio.charset.StandardCharsets.UTF_8;
import static rs.lukaj.minihttp.connections.HttpException.Kind.UNEXPECTED_EOF;

/**
 * InputStream view of a {@link Transport}, with line reading for the HTTP head. Doesn't buffer on its own;
 * wrap it in a {@link java.io.BufferedInputStream} if nothing else will read from the transport afterwards.
 */
class TransportInputStream extends InputStream {
    private static final Logger log = LogManager.getLogger(TransportInputStream.class);
    static final int MAX_LINE_LENGTH = 65_536;

    private final Transport transport;

    TransportInputStream(Transport transport) {
        this.transport = transport;
    }

    @Override
    public int read() throws IOException {
        return transport.read();
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if(len == 0) return 0;
        return transport.read(b, off, len);
    }

    /**
     * Read a line terminated by CRLF. A bare LF is tolerated as well (with a warning).
     * @param in stream to read from
     * @param tooLong kind of failure reported if the line is longer than {@link #MAX_LINE_LENGTH}
     * @return line without the terminator, or null if the stream ended before the first byte
     * @throws HttpException of kind {@link HttpException.Kind#UNEXPECTED_EOF} if stream ends in the middle of the
     *                       line, or of the given kind if the line is too long
     * @throws IOException if reading fails
     */
    //we're skirting the spec here, because it specifies only CRLF as newline
    static String readLine(InputStream in, HttpException.Kind tooLong) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(64);
        int curr = in.read();
        if(curr == -1) return null;
        while(curr != '\n') {
            if(curr == -1) throw new HttpException(UNEXPECTED_EOF, "stream ended inside a line");
            if(out.size() >= MAX_LINE_LENGTH) throw new HttpException(tooLong, "line longer than " + MAX_LINE_LENGTH + " bytes");
            out.write(curr);
            curr = in.read();
        }
        byte[] line = out.toByteArray();
        int len = line.length;
        if(len > 0 && line[len-1] == '\r') len--;
        else log.warn("Line terminated with bare LF instead of CRLF");
        return new String(line, 0, len, UTF_8);
    }
}

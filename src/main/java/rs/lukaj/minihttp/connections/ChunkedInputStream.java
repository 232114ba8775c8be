package rs.lukaj.minihttp.connections;

import java.io.IOException;
import java.io.InputStream;

import static rs.lukaj.minihttp.connections.HttpException.Kind.MALFORMED_CHUNK;
import static rs.lukaj.minihttp.connections.HttpException.Kind.UNEXPECTED_EOF;

/**
 * InputStream designed to read from HTTP chunked data (Transfer-Encoding: chunked), according to the spec.
 * Requires CRLF after every chunk, otherwise throws {@link HttpException}. Use {@link #hasMoreChunks()} to see
 * whether more chunks are remaining and {@link #readChunk()} to read the next chunk, or just read it as any
 * other stream.
 * <br/>
 * Trailer fields following the last chunk are read and discarded.
 */
public class ChunkedInputStream extends InputStream {

    private final InputStream in;
    private long remaining = 0;
    private boolean closed = false;
    private boolean end = false;
    private boolean beginning = true;

    /**
     * @param socketStream input stream positioned at the first chunk-size line
     */
    public ChunkedInputStream(InputStream socketStream) {
        in = socketStream;
    }

    private void ensureOpen() throws IOException {
        if(closed) throw new IOException("Trying to read from closed stream!");
    }

    @Override
    public int read() throws IOException {
        ensureOpen();
        if(!hasMoreChunks()) return -1;
        int next = in.read();
        if(next == -1) throw new HttpException(UNEXPECTED_EOF, "stream ended inside a chunk");
        remaining--;
        return next;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        ensureOpen();
        if(len == 0) return 0;
        if(!hasMoreChunks()) return -1;
        int read = in.read(b, off, (int) Math.min(len, remaining));
        if(read == -1) throw new HttpException(UNEXPECTED_EOF, "stream ended inside a chunk");
        remaining -= read;
        return read;
    }

    private void enterChunk() throws IOException {
        if(!beginning) {
            int current = in.read(), next = in.read();
            if(current == -1 || next == -1) throw new HttpException(UNEXPECTED_EOF, "stream ended after chunk data");
            if (!(current == '\r' && next == '\n')) throw new HttpException(MALFORMED_CHUNK, "no CRLF at the end of chunk");
        }
        beginning = false;
        String sizeLine = TransportInputStream.readLine(in, MALFORMED_CHUNK);
        if(sizeLine == null) throw new HttpException(UNEXPECTED_EOF, "stream ended before chunk size");
        long len = parseSize(sizeLine);
        if(len == 0) {
            end = true;
            skipTrailers();
        }
        else remaining = len;
    }

    private static long parseSize(String sizeLine) throws HttpException {
        int ext = sizeLine.indexOf(';'); //chunk extensions are ignored
        String lenStr = (ext < 0 ? sizeLine : sizeLine.substring(0, ext)).trim();
        if(lenStr.isEmpty() || lenStr.length() > 15) throw new HttpException(MALFORMED_CHUNK, "invalid chunk size: " + sizeLine);
        long len = 0;
        for(int i=0; i<lenStr.length(); i++) {
            int digit = hexDigit(lenStr.charAt(i));
            if(digit < 0) throw new HttpException(MALFORMED_CHUNK, "invalid chunk size: " + sizeLine);
            len = len * 16 + digit;
        }
        return len;
    }

    //ASCII only; Character.digit would also accept e.g. fullwidth digits
    private static int hexDigit(char c) {
        if(c >= '0' && c <= '9') return c - '0';
        if(c >= 'a' && c <= 'f') return c - 'a' + 10;
        if(c >= 'A' && c <= 'F') return c - 'A' + 10;
        return -1;
    }

    private void skipTrailers() throws IOException {
        String line;
        do {
            line = TransportInputStream.readLine(in, MALFORMED_CHUNK);
        } while(line != null && !line.isEmpty()); //server closing right after the last chunk is tolerated
    }

    /**
     *
     * @return number of remaining bytes in current chunk
     */
    public long getRemaining() {
        return remaining;
    }

    /**
     * Reads bytes to the end of the chunk.
     * @return remaining bytes in current chunk
     * @throws IOException if reading fails or stream ends before the chunk does
     */
    public byte[] readChunk() throws IOException {
        ensureOpen();
        if(!hasMoreChunks()) return new byte[0];
        if(remaining > Integer.MAX_VALUE - 8) throw new HttpException(MALFORMED_CHUNK, "chunk too large: " + remaining);
        byte[] chunk = in.readNBytes((int) remaining);
        if(chunk.length < remaining) throw new HttpException(UNEXPECTED_EOF, "stream ended inside a chunk");
        remaining = 0;
        return chunk;
    }

    /**
     * Checks whether there are more chunks, and enters the next one if needed.
     * @return true if there are more chunks, false otherwise
     * @throws IOException if chunk framing is broken or reading fails
     */
    public boolean hasMoreChunks() throws IOException {
        if(end) return false;
        if(remaining != 0) return true;
        enterChunk();
        return !end;
    }

    @Override
    public int available() throws IOException {
        return end ? 0 : (int) Math.min(in.available(), remaining);
    }

    /**
     * Closes this stream only; the underlying stream stays open.
     */
    @Override
    public void close() {
        closed = true;
    }
}

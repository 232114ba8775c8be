package rs.lukaj.minihttp.connections;

import java.util.Locale;

/**
 * Headers which are received from server. Provides helper functions for getting them.
 */
public class ResponseHeaders extends Headers {
    public ResponseHeaders() {
    }

    public ResponseHeaders(Headers other) {
        super(other);
    }

    public String getTransferEncoding() {
        return getHeader("Transfer-Encoding");
    } //oh god these headers are a mess
    public String getContentLength() {
        return getHeader("Content-Length");
    }

    /**
     * Whether the body is sent in chunks, i.e. chunked is the last (or only) transfer coding.
     * @return true if Transfer-Encoding ends with chunked
     */
    public boolean isChunked() {
        String te = getTransferEncoding();
        if(te == null) return false;
        String[] codings = te.split(",");
        if(codings.length == 0) return false;
        return codings[codings.length - 1].trim().toLowerCase(Locale.ROOT).equals("chunked");
    }
}

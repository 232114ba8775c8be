package rs.lukaj.minihttp.connections;

import java.io.IOException;

/**
 * Thrown when a request cannot be completed. Every failure is described by a {@link Kind}; some kinds also carry
 * a detail, e.g. the status line the proxy answered with or the header line which couldn't be parsed.
 * <br/>
 * A request which failed with this exception leaves nothing behind: the connection is closed and no partial
 * response is returned. Retrying means building and sending the request again.
 */
public class HttpException extends IOException {

    /**
     * What went wrong.
     */
    public enum Kind {
        INVALID_URL("Invalid URL"),
        DNS_RESOLUTION_FAILED("DNS resolution failed"),
        CONNECTION_REFUSED("Connection refused"),
        TLS_HANDSHAKE_FAILED("TLS handshake failed"),
        PROXY_CONNECT_FAILED("Proxy CONNECT failed"),
        TRANSPORT_ERROR("Transport error"),
        MALFORMED_STATUS_LINE("Malformed status line"),
        MALFORMED_HEADER("Malformed header"),
        MALFORMED_CHUNK("Malformed chunk"),
        UNEXPECTED_EOF("Unexpected end of stream"),
        INVALID_UTF8("Invalid UTF-8");

        private final String description;

        Kind(String description) {
            this.description = description;
        }

        @Override
        public String toString() {
            return description;
        }
    }

    private final Kind kind;
    private final String detail;

    public HttpException(Kind kind, String detail) {
        super(kind + (detail == null ? "" : ": " + detail));
        this.kind = kind;
        this.detail = detail;
    }

    public HttpException(Kind kind, String detail, Throwable cause) {
        super(kind + (detail == null ? "" : ": " + detail), cause);
        this.kind = kind;
        this.detail = detail;
    }

    /**
     * @return kind of this failure
     */
    public Kind getKind() {
        return kind;
    }

    /**
     * Get the detail of this failure. For {@link Kind#PROXY_CONNECT_FAILED} this is the status line returned by
     * the proxy (if it returned one).
     * @return failure detail, or null if there is none
     */
    public String getDetail() {
        return detail;
    }
}

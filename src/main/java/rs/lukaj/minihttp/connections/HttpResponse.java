package rs.lukaj.minihttp.connections;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Represents a HTTP response: status line, headers and body. Fully read before it's handed out, and never
 * changed afterwards; {@link ResponseParser} is what builds it.
 */
public final class HttpResponse {
    private final Status status;
    private final ResponseHeaders headers;
    private final byte[] body;

    public HttpResponse(Status status, Headers headers, byte[] body) {
        this.status = status;
        this.headers = new ResponseHeaders(headers);
        this.body = body.clone();
    }

    /**
     * Get data from Status-Line received in this response.
     * @return status line data
     */
    public Status getStatus() {
        return status;
    }

    public int getStatusCode() {
        return status.responseCode;
    }

    public String getReason() {
        return status.responsePhrase;
    }

    /**
     * Get value of a response header. Names are case-insensitive.
     * @param name header name
     * @return header value, or null if the server didn't send it
     */
    public String getHeader(String name) {
        return headers.getHeader(name);
    }

    /**
     * Get response headers received. Returned object is a copy; changing it doesn't affect this response.
     * @return received headers
     */
    public ResponseHeaders getHeaders() {
        return new ResponseHeaders(headers);
    }

    /**
     * @return all headers as an unmodifiable map, names as the server sent them
     */
    public Map<String, String> headers() {
        return headers.asMap();
    }

    /**
     * @return copy of the raw body bytes (empty if there was no body)
     */
    public byte[] getBody() {
        return body.clone();
    }

    /**
     * Decode body as UTF-8.
     * @return response body, parsed as string
     * @throws HttpException of kind {@link HttpException.Kind#INVALID_UTF8} if body is not valid UTF-8
     */
    public String text() throws HttpException {
        try {
            return UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(body))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new HttpException(HttpException.Kind.INVALID_UTF8, "body is not valid UTF-8", e);
        }
    }

    /**
     * @return true for 2xx responses
     */
    public boolean isSuccessful() {
        return status.isSuccessful();
    }

    /**
     * @return true for 4xx and 5xx responses
     */
    public boolean isError() {
        return status.isError();
    }

    @Override
    public String toString() {
        return status + " (" + body.length + " bytes)";
    }

    /**
     * Represents data contained in a Status-Line of the response. Contains HTTP version, response code and a
     * a response phrase.
     */
    public static final class Status {
        private static final Logger log = LogManager.getLogger(Status.class);

        public final String httpVersion;
        public final int responseCode;
        public final String responsePhrase;

        public Status(String httpVersion, int responseCode, String responsePhrase) {
            this.httpVersion = httpVersion;
            this.responseCode = responseCode;
            this.responsePhrase = responsePhrase;
        }

        /**
         * Parse the status line, i.e. HTTP/&lt;version&gt; &lt;code&gt; &lt;reason&gt;. Reason phrase may be empty
         * or missing.
         * @param statusLine status line without the terminating CRLF
         * @return parsed status line
         * @throws HttpException of kind {@link HttpException.Kind#MALFORMED_STATUS_LINE} if the line doesn't start
         *                       with HTTP version or code isn't a 3-digit number
         */
        public static Status parse(String statusLine) throws HttpException {
            String[] tokens = statusLine.split(" ", 3);
            if(tokens.length < 2 || !tokens[0].startsWith("HTTP/") || tokens[0].length() == "HTTP/".length())
                throw new HttpException(HttpException.Kind.MALFORMED_STATUS_LINE, statusLine);
            String code = tokens[1];
            if(code.length() != 3 || !isDigit(code.charAt(0)) || !isDigit(code.charAt(1)) || !isDigit(code.charAt(2)))
                throw new HttpException(HttpException.Kind.MALFORMED_STATUS_LINE, statusLine);
            String phrase;
            if(tokens.length == 3) {
                phrase = tokens[2];
            } else {
                phrase = "";
                log.warn("HTTP status line missing response phrase: {}", statusLine);
            }
            if(!tokens[0].startsWith("HTTP/1.")) {
                log.warn("Unsupported HTTP version returned by server: {}", tokens[0]);
            }
            return new Status(tokens[0], Integer.parseInt(code), phrase);
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        public boolean isSuccessful() {
            return responseCode / 100 == 2;
        }

        /**
         * Does this code represent an error. Error codes are client and server errors.
         * @return true if this is an error code, false otherwise.
         */
        public boolean isError() {
            return responseCode >= 400;
        }

        @Override
        public String toString() {
            return httpVersion + " " + responseCode + " " + responsePhrase;
        }
    }
}

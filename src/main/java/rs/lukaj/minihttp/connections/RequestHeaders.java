package rs.lukaj.minihttp.connections;

/**
 * Headers which are sent with the request. Provides helper functions for setting them.
 * If empty or null is passed to helper functions, header is removed.
 */
public class RequestHeaders extends Headers {
    public static final String USER_AGENT = "minihttp/1.0 (Java " + javaVersion() + ")";

    private RequestHeaders() {
    }

    private RequestHeaders(Headers other) {
        super(other);
    }

    private static String javaVersion() {
        try {
            return System.getProperty("java.version", "unknown");
        } catch (SecurityException ignored) {
            return "unknown";
        }
    }

    //there's no great reason to use static factory methods here, except disambiguating 'default' and 'empty' headers
    //and honestly, that's enough for me
    public static RequestHeaders createEmpty() {
        return new RequestHeaders();
    }

    /**
     * Headers every request starts with: Connection: close (connections are never reused) and User-Agent.
     * @return new default headers
     */
    public static RequestHeaders createDefault() {
        RequestHeaders headers = new RequestHeaders();
        headers.setConnection("close");
        headers.setUserAgent(USER_AGENT);
        return headers;
    }

    public static RequestHeaders copyOf(Headers headers) {
        return new RequestHeaders(headers);
    }

    private void setOrRemove(String header, String value) {
        if(value == null || value.isEmpty()) removeHeader(header);
        else setHeader(header, value);
    }

    public void setConnection(String connection) {
        setOrRemove("Connection", connection);
    }
    public void setUserAgent(String userAgent) {
        setOrRemove("User-Agent", userAgent);
    }
}

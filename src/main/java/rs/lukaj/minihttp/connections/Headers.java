package rs.lukaj.minihttp.connections;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;


/**
 * Represents headers which are received from server or sent as a part of the request.
 * Header names are case-insensitive: setting a header replaces any existing one with the same name, regardless
 * of case. The name is kept as it was last set, so it's sent the same way.
 */
public class Headers {
    //lowercase name -> header
    private final Map<String, Header> headers = new LinkedHashMap<>();

    public Headers() {
    }

    public Headers(Headers other) {
        headers.putAll(other.headers);
    }

    private static String key(String header) {
        return header.toLowerCase(Locale.ROOT);
    }

    /**
     * Get value of the header identified by the name passed
     * @param header name of the header
     * @return value of the header, or null if it doesn't exist
     */
    public String getHeader(String header) {
        Header h = headers.get(key(header));
        return h == null ? null : h.value;
    }

    /**
     * Put a new header, replacing the existing one if it exists.
     * @param header name of the header
     * @param value value of the header
     * @return previous value of the header, or null if it didn't exist
     */
    public String setHeader(String header, String value) {
        Objects.requireNonNull(header, "Header name can't be null!");
        Objects.requireNonNull(value, "Header value can't be null!");
        Header previous = headers.put(key(header), new Header(header, value));
        return previous == null ? null : previous.value;
    }

    /**
     * Put a new header, replacing one if it exists.
     * @param line header line, where header name and value are separated by a colon
     * @return previous value of the header, or null if it didn't exist
     * @throws HttpException of kind {@link HttpException.Kind#MALFORMED_HEADER} if there's no colon or the name
     *                       is empty
     */
    public String setHeader(String line) throws HttpException {
        int colon = line.indexOf(':');
        if(colon < 0) throw new HttpException(HttpException.Kind.MALFORMED_HEADER, line);
        String name = line.substring(0, colon).trim();
        if(name.isEmpty()) throw new HttpException(HttpException.Kind.MALFORMED_HEADER, line);
        return setHeader(name, line.substring(colon + 1).trim());
    }

    /**
     * Put all given headers, in order. Later ones replace earlier ones with the same name.
     * @param other headers to add
     */
    public void setHeaders(Headers other) {
        for(Header h : other.headers.values()) setHeader(h.name, h.value);
    }

    /**
     * Remove a header if it exists.
     * @param header header name
     * @return previous value of the header, or null if it didn't exist
     */
    public String removeHeader(String header) {
        Header previous = headers.remove(key(header));
        return previous == null ? null : previous.value;
    }

    /**
     * Check whether header exists.
     * @param header header name
     * @return true if it exists, false otherwise
     */
    public boolean hasHeader(String header) {
        return headers.containsKey(key(header));
    }

    public int size() {
        return headers.size();
    }

    public boolean isEmpty() {
        return headers.isEmpty();
    }

    /**
     * @return unmodifiable snapshot of the headers, names as they were set
     */
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for(Header h : headers.values()) map.put(h.name, h.value);
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Headers)) return false;
        Headers other = (Headers) o;
        if(other.headers.size() != headers.size()) return false;
        for(Map.Entry<String, Header> e : headers.entrySet()) {
            Header h = other.headers.get(e.getKey());
            if(h == null || !h.value.equals(e.getValue().value)) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for(Map.Entry<String, Header> e : headers.entrySet())
            hash += e.getKey().hashCode() ^ e.getValue().value.hashCode();
        return hash;
    }

    /**
     * Returns headers in format appropriate for sending, each line terminated by CRLF.
     * @return String representation of headers
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(size() * 32);
        for(Header h : headers.values()) {
            builder.append(h.name).append(": ").append(h.value).append("\r\n"); //Windows newline, ew
        }
        return builder.toString();
    }

    private static final class Header {
        private final String name;
        private final String value;

        private Header(String name, String value) {
            this.name = name;
            this.value = value;
        }
    }
}

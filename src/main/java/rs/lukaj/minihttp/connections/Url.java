package rs.lukaj.minihttp.connections;

import java.util.Locale;
import java.util.Objects;

import static rs.lukaj.minihttp.connections.HttpException.Kind.INVALID_URL;

/**
 * Location of a HTTP resource: scheme, host, port and the path with query. Only http and https are supported.
 * The path and query are kept exactly as given, so they end up in the request line byte for byte.
 * <br/>
 * Unlike {@link java.net.URL}, this doesn't know about protocol handlers, doesn't normalize anything and never
 * resolves the host.
 */
public final class Url {
    public static final String HTTP = "http";
    public static final String HTTPS = "https";

    private final String scheme;
    private final String host;
    private final int port;
    private final String file;

    private Url(String scheme, String host, int port, String file) {
        this.scheme = scheme;
        this.host = host;
        this.port = port;
        this.file = file;
    }

    /**
     * Parse the URL. Input must start with http:// or https://. Fragment (from the first '#') is dropped, as it's
     * never sent to the server. Host ends at the first '/', ':' or '?'. If ':' follows the host, digits up to the
     * next '/' are the port, overriding the default one (80 for http, 443 for https). Everything from the first '/'
     * onward is the path with query; if there's no path, it's "/".
     * @param input URL to parse
     * @return parsed URL
     * @throws HttpException of kind {@link HttpException.Kind#INVALID_URL} if scheme is missing or unknown, host
     *                       is empty or port is not a valid port number
     */
    public static Url parse(String input) throws HttpException {
        if(input == null) throw new HttpException(INVALID_URL, "null");
        int fragment = input.indexOf('#');
        if(fragment >= 0) input = input.substring(0, fragment);
        int schemeEnd = input.indexOf("://");
        if(schemeEnd <= 0) throw new HttpException(INVALID_URL, "missing scheme in " + input);
        String scheme = input.substring(0, schemeEnd).toLowerCase(Locale.ROOT);
        int defaultPort;
        if(scheme.equals(HTTP)) defaultPort = 80;
        else if(scheme.equals(HTTPS)) defaultPort = 443;
        else throw new HttpException(INVALID_URL, "unsupported scheme " + scheme);

        int hostStart = schemeEnd + 3;
        int hostEnd = hostStart;
        while(hostEnd < input.length() && "/:?".indexOf(input.charAt(hostEnd)) < 0) hostEnd++;
        String host = input.substring(hostStart, hostEnd);
        if(host.isEmpty()) throw new HttpException(INVALID_URL, "empty host in " + input);

        int port = defaultPort;
        int fileStart = hostEnd;
        if(hostEnd < input.length() && input.charAt(hostEnd) == ':') {
            int portEnd = hostEnd + 1;
            while(portEnd < input.length() && "/?".indexOf(input.charAt(portEnd)) < 0) portEnd++;
            port = parsePort(input.substring(hostEnd + 1, portEnd), input);
            fileStart = portEnd;
        }

        String file;
        if(fileStart >= input.length()) file = "/";
        else if(input.charAt(fileStart) == '?') file = "/" + input.substring(fileStart); //query without a path
        else file = input.substring(fileStart);
        return new Url(scheme, host, port, file);
    }

    private static int parsePort(String portStr, String input) throws HttpException {
        if(portStr.isEmpty() || portStr.length() > 5) throw new HttpException(INVALID_URL, "invalid port in " + input);
        for(int i=0; i<portStr.length(); i++)
            if(portStr.charAt(i) < '0' || portStr.charAt(i) > '9') throw new HttpException(INVALID_URL, "invalid port in " + input);
        int port = Integer.parseInt(portStr);
        if(port < 1 || port > 65535) throw new HttpException(INVALID_URL, "port out of range in " + input);
        return port;
    }

    public String getScheme() {
        return scheme;
    }
    public String getHost() {
        return host;
    }
    public int getPort() {
        return port;
    }
    public boolean isHttps() {
        return scheme.equals(HTTPS);
    }

    /**
     * @return whether the port is the default one for the scheme
     */
    public boolean isDefaultPort() {
        return port == (isHttps() ? 443 : 80);
    }

    /**
     * @return path and query, exactly as they appeared in the parsed string, without the fragment (at least "/")
     */
    public String getFile() {
        return file;
    }

    /**
     * @return path portion, without the query
     */
    public String getPath() {
        int q = file.indexOf('?');
        return q < 0 ? file : file.substring(0, q);
    }

    /**
     * @return query portion (without '?'), or null if there's no query
     */
    public String getQuery() {
        int q = file.indexOf('?');
        return q < 0 ? null : file.substring(q + 1);
    }

    /**
     * @return host and port, joined with a colon
     */
    public String getAuthority() {
        return host + ":" + port;
    }

    private String lowerHost() {
        return host.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Url)) return false;
        Url url = (Url) o;
        return port == url.port && scheme.equals(url.scheme) && lowerHost().equals(url.lowerHost()) && file.equals(url.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scheme, lowerHost(), port, file);
    }

    @Override
    public String toString() {
        return scheme + "://" + host + (isDefaultPort() ? "" : ":" + port) + file;
    }
}

package rs.lukaj.minihttp.connections;

/**
 * Endpoint to which connections are connected. Consists of host, port and whether the connection should be
 * over TLS. Host is not resolved here; that's left to the socket when connecting.
 */
public class Endpoint {
    private final String host;
    private final int port;
    private final boolean https;

    /**
     * Create a new endpoint
     * @param host hostname of the server
     * @param port port on which to connect (e.g. 80 for HTTP, 443 for HTTPS)
     * @param isHttps should the connection be over TLS
     */
    public Endpoint(String host, int port, boolean isHttps) {
        if(host == null) throw new NullPointerException("Host can't be null!");
        this.host = host;
        this.port = port;
        this.https = isHttps;
    }

    /**
     * Create Endpoint pointing to the host and port of the given URL. TLS is used if URL scheme is https.
     * @param url URL to which this endpoint should point
     * @return new Endpoint for the given address
     */
    public static Endpoint fromUrl(Url url) {
        return new Endpoint(url.getHost(), url.getPort(), url.isHttps());
    }

    public String getHost() {
        return host;
    }
    public int getPort() {
        return port;
    }
    public boolean isHttps() {
        return https;
    }

    /**
     * @return host:port, as used in CONNECT requests
     */
    public String getAuthority() {
        return host + ":" + port;
    }

    @Override
    public String toString() {
        return (https ? "https://" : "http://") + getAuthority();
    }
}

package rs.lukaj.minihttp.connections;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import java.time.Duration;

import static rs.lukaj.minihttp.connections.HttpException.Kind.*;

/**
 * Opens {@link Transport}s: a plain socket, a TLS socket, or either of them tunneled through a HTTP proxy.
 * Every call opens a new connection; nothing is pooled or reused.
 */
public class Connector {
    private static final Logger log = LogManager.getLogger(Connector.class);

    private final Config config;

    public Connector() {
        this(new Config());
    }

    /**
     * @param config connection parameters; copied, so later changes don't affect this connector
     */
    public Connector(Config config) {
        this.config = config.copy();
    }

    public Config getConfig() {
        return config.copy();
    }

    /**
     * Connect to the target, directly or through the proxy. If target is https, TLS handshake is done (over
     * the tunnel, when there's a proxy) before this method returns.
     * @param target endpoint to connect to
     * @param proxy HTTP proxy to tunnel through using CONNECT, or null to connect directly
     * @return connected transport, owned by the caller
     * @throws HttpException of kind {@link HttpException.Kind#DNS_RESOLUTION_FAILED},
     *                       {@link HttpException.Kind#CONNECTION_REFUSED}, {@link HttpException.Kind#TLS_HANDSHAKE_FAILED},
     *                       {@link HttpException.Kind#PROXY_CONNECT_FAILED} or {@link HttpException.Kind#TRANSPORT_ERROR}
     */
    public Transport connect(Endpoint target, Url proxy) throws HttpException {
        String first = proxy == null ? target.getHost() : proxy.getHost();
        int firstPort = proxy == null ? target.getPort() : proxy.getPort();
        log.debug("Connecting to {}{}", target, proxy == null ? "" : " via proxy " + proxy.getAuthority());

        Socket socket = openSocket(first, firstPort);
        try {
            if(proxy != null) {
                //not closed here: closing it would close the socket
                StreamTransport proxyTransport = new StreamTransport(socket.getInputStream(), socket.getOutputStream());
                ProxyTunnel.establish(proxyTransport, target);
            }
            if(target.isHttps()) socket = handshake(socket, target);
            return new SocketTransport(socket);
        } catch (HttpException e) {
            closeQuietly(socket, e);
            throw e;
        } catch (IOException e) {
            closeQuietly(socket, e);
            throw new HttpException(TRANSPORT_ERROR, "setting up connection to " + target + " failed", e);
        }
    }

    private Socket openSocket(String host, int port) throws HttpException {
        InetAddress address;
        try {
            address = InetAddress.getByName(host);
        } catch (UnknownHostException e) {
            throw new HttpException(DNS_RESOLUTION_FAILED, host, e);
        }
        Socket socket = new Socket();
        int timeout = (int) Math.min(Integer.MAX_VALUE, config.getTimeout().toMillis());
        try {
            socket.connect(new InetSocketAddress(address, port), timeout);
            socket.setSoTimeout(timeout);
            return socket;
        } catch (ConnectException e) {
            closeQuietly(socket, e);
            throw new HttpException(CONNECTION_REFUSED, host + ":" + port, e);
        } catch (SocketTimeoutException e) {
            closeQuietly(socket, e);
            throw new HttpException(TRANSPORT_ERROR, "connecting to " + host + ":" + port + " timed out", e);
        } catch (IOException e) {
            closeQuietly(socket, e);
            throw new HttpException(TRANSPORT_ERROR, "connecting to " + host + ":" + port + " failed", e);
        }
    }

    private SSLSocket handshake(Socket plain, Endpoint target) throws HttpException {
        SSLSocket sslSocket;
        try {
            sslSocket = (SSLSocket) socketFactory().createSocket(plain, target.getHost(), target.getPort(), true);
        } catch (IOException e) {
            throw new HttpException(TLS_HANDSHAKE_FAILED, target.getAuthority(), e);
        }
        if(config.isVerifyCertificates()) {
            SSLParameters params = sslSocket.getSSLParameters();
            params.setEndpointIdentificationAlgorithm("HTTPS");
            sslSocket.setSSLParameters(params);
        }
        try {
            sslSocket.startHandshake();
        } catch (IOException e) {
            throw new HttpException(TLS_HANDSHAKE_FAILED, target.getAuthority(), e);
        }
        return sslSocket;
    }

    private SSLSocketFactory socketFactory() throws HttpException {
        if(config.isVerifyCertificates()) return (SSLSocketFactory) SSLSocketFactory.getDefault();

        log.warn("TLS certificate verification disabled - any certificate will be accepted");
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[] {new TrustAll()}, null);
            return context.getSocketFactory();
        } catch (GeneralSecurityException e) {
            throw new HttpException(TLS_HANDSHAKE_FAILED, "can't set up TLS without verification", e);
        }
    }

    private static void closeQuietly(Socket socket, Exception cause) {
        try {
            socket.close();
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    private static class TrustAll implements X509TrustManager {
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }

    /**
     * Connection parameters. Defaults: 30 seconds timeout, certificates are verified.
     */
    public static class Config {
        private Duration timeout = Duration.ofSeconds(30);
        private boolean verifyCertificates = true;

        public Config() {
        }

        public Config(Duration timeout, boolean verifyCertificates) {
            setTimeout(timeout);
            this.verifyCertificates = verifyCertificates;
        }

        /**
         * Set timeout used both for connecting and for each blocking read from the socket.
         * @param timeout positive duration
         * @return this, to allow chaining
         */
        public Config setTimeout(Duration timeout) {
            if(timeout == null || timeout.isZero() || timeout.isNegative())
                throw new InvalidConfigException("Timeout must be positive!");
            this.timeout = timeout;
            return this;
        }

        /**
         * Set whether server certificate and host name are verified for TLS connections. Don't turn this off
         * unless you know why.
         * @param verifyCertificates whether to verify
         * @return this, to allow chaining
         */
        public Config setVerifyCertificates(boolean verifyCertificates) {
            this.verifyCertificates = verifyCertificates;
            return this;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public boolean isVerifyCertificates() {
            return verifyCertificates;
        }

        public Config copy() {
            return new Config(timeout, verifyCertificates);
        }
    }
}

package rs.lukaj.minihttp.connections;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;

import static java.nio.charset.StandardCharsets.UTF_8;
import static rs.lukaj.minihttp.connections.Http.CRLF;
import static rs.lukaj.minihttp.connections.HttpException.Kind.*;

/**
 * Turns a connection to a HTTP proxy into a raw byte pipe to the target endpoint, using CONNECT. Once the proxy
 * answers with 2xx, whatever is written to the transport goes to the target, so TLS (if needed) is negotiated
 * over the tunnel afterwards.
 * <br/>
 * Proxy response is read byte by byte, so nothing past its end is consumed.
 */
public class ProxyTunnel {
    private static final Logger log = LogManager.getLogger(ProxyTunnel.class);

    private ProxyTunnel() {
    }

    /**
     * @param target endpoint to tunnel to
     * @return CONNECT request, as sent to the proxy
     */
    public static String connectRequest(Endpoint target) {
        String authority = target.getAuthority();
        return Http.Verb.CONNECT + " " + authority + " " + Http.VERSION + CRLF
                + "Host: " + authority + CRLF
                + CRLF;
    }

    /**
     * Send CONNECT to the proxy and wait for the answer. Any 2xx status means the tunnel is established.
     * @param proxy transport connected to the proxy
     * @param target endpoint the tunnel should lead to
     * @throws HttpException of kind {@link HttpException.Kind#PROXY_CONNECT_FAILED} (carrying proxy's status line)
     *                       if proxy refuses or answers with garbage, {@link HttpException.Kind#TRANSPORT_ERROR} if
     *                       I/O fails
     */
    public static void establish(Transport proxy, Endpoint target) throws HttpException {
        try {
            proxy.write(connectRequest(target).getBytes(UTF_8));
            proxy.flush();

            InputStream in = new TransportInputStream(proxy);
            String statusLine = TransportInputStream.readLine(in, PROXY_CONNECT_FAILED);
            if(statusLine == null)
                throw new HttpException(PROXY_CONNECT_FAILED, "proxy closed the connection without response");
            HttpResponse.Status status;
            try {
                status = HttpResponse.Status.parse(statusLine);
            } catch (HttpException e) {
                throw new HttpException(PROXY_CONNECT_FAILED, statusLine, e);
            }
            if(!status.isSuccessful()) throw new HttpException(PROXY_CONNECT_FAILED, statusLine);

            String line;
            do { //headers of CONNECT response aren't interesting
                line = TransportInputStream.readLine(in, PROXY_CONNECT_FAILED);
                if(line == null) throw new HttpException(PROXY_CONNECT_FAILED, "proxy closed the connection: " + statusLine);
            } while(!line.isEmpty());
            log.debug("Tunnel to {} established: {}", target.getAuthority(), statusLine);
        } catch (HttpException e) {
            if(e.getKind() == UNEXPECTED_EOF) throw new HttpException(PROXY_CONNECT_FAILED, e.getDetail(), e);
            throw e;
        } catch (IOException e) {
            throw new HttpException(TRANSPORT_ERROR, "CONNECT to proxy failed", e);
        }
    }
}

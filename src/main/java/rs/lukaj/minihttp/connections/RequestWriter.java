package rs.lukaj.minihttp.connections;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static rs.lukaj.minihttp.connections.Http.CRLF;

/**
 * Writes a {@link RequestSpec} to a {@link Transport}: request line, Host header, the rest of the headers,
 * Content-Length if there's a body and it wasn't set explicitly, blank line and finally the body.
 * Headers set by the caller always win over the ones written here.
 */
public class RequestWriter {
    private static final Logger log = LogManager.getLogger(RequestWriter.class);

    private RequestWriter() {
    }

    /**
     * Build the request line and headers, including the blank line which ends them.
     * @param spec request to serialize
     * @return request head, as sent over the wire
     */
    public static String head(RequestSpec spec) {
        Url url = spec.getUrl();
        RequestHeaders headers = spec.getHeaders();
        StringBuilder head = new StringBuilder(256);
        head.append(spec.getMethod()).append(' ').append(url.getFile()).append(' ').append(Http.VERSION).append(CRLF);

        String host = headers.removeHeader("Host");
        if(host == null) host = url.isDefaultPort() ? url.getHost() : url.getAuthority();
        head.append("Host: ").append(host).append(CRLF);

        head.append(headers);
        if(spec.hasBody() && !headers.hasHeader("Content-Length"))
            head.append("Content-Length: ").append(spec.getBody().length).append(CRLF);
        head.append(CRLF);
        return head.toString();
    }

    /**
     * Write the whole request and flush the transport. On failure, the transport is in an unknown state and
     * shouldn't be used any more.
     * @param spec request to write
     * @param transport transport to write to
     * @throws HttpException of kind {@link HttpException.Kind#TRANSPORT_ERROR} if writing fails
     */
    public static void write(RequestSpec spec, Transport transport) throws HttpException {
        Http.Verb verb = spec.getVerb();
        if(verb == null || !verb.isSupported()) {
            log.warn("Using non-supported http method {} (might fail unpredictably)", spec.getMethod());
        }
        String head = head(spec);
        try {
            transport.write(head.getBytes(UTF_8));
            if(spec.hasBody()) transport.write(spec.getBody());
            transport.flush();
        } catch (IOException e) {
            throw new HttpException(HttpException.Kind.TRANSPORT_ERROR, "writing request failed", e);
        }
        log.debug("Sent {} {} {}", spec.getMethod(), spec.getUrl().getFile(), Http.VERSION);
    }
}

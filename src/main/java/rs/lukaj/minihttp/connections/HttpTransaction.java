package rs.lukaj.minihttp.connections;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * This is used to represent a single request/response exchange: connect, write the request, read the response,
 * close the connection. Everything happens on the calling thread, and the call blocks until the response is
 * read completely or something fails.
 * <br/>
 * It is illegal to use one HttpTransaction object for multiple requests.
 */
//similar role to HttpURLConnection in standard library, minus everything that makes it complicated
public class HttpTransaction {
    private static final Logger log = LogManager.getLogger(HttpTransaction.class);

    private final Connector connector;
    private boolean used = false;

    /**
     * Create a new transaction which uses given connector to open the connection.
     * @param connector connector used for opening the connection
     */
    public HttpTransaction(Connector connector) {
        this.connector = connector;
    }

    /**
     * Make the request and read the response. Connection is closed before this method returns, whether it
     * succeeded or not.
     * @param spec request to make
     * @return response, with body fully read
     * @throws HttpException if connecting, writing the request or reading the response fails
     * @throws IllegalStateException if this transaction has already been used
     */
    public HttpResponse makeRequest(RequestSpec spec) throws HttpException {
        if(used) throw new IllegalStateException("HttpTransaction can be used only once!");
        used = true;

        Transport transport = connector.connect(Endpoint.fromUrl(spec.getUrl()), spec.getProxy());
        try {
            RequestWriter.write(spec, transport);
            return ResponseParser.parse(transport, spec.getMethod());
        } finally {
            try {
                transport.close();
            } catch (IOException e) {
                //response (or the failure) is already known, nothing more to do with the connection
                log.debug("Closing {} failed", transport, e);
            }
        }
    }
}

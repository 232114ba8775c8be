package rs.lukaj.minihttp.connections;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;

import static rs.lukaj.minihttp.connections.HttpException.Kind.*;

/**
 * Reads a {@link HttpResponse} from a {@link Transport}: status line, headers and body. Body length is
 * determined, in this order, by chunked Transfer-Encoding, by Content-Length, or by the server closing the
 * connection.
 * <br/>
 * The parser reads ahead, so the transport shouldn't be read from by anyone else afterwards.
 */
public class ResponseParser {
    private static final Logger log = LogManager.getLogger(ResponseParser.class);
    private static final int MAX_INFORMATIVE_RESPONSES = 5;

    private ResponseParser() {
    }

    /**
     * Parse the response to a request whose method doesn't matter for framing (i.e. anything but HEAD).
     * @param transport transport the request was sent over
     * @return fully read response
     * @throws HttpException if response is malformed, stream ends too early, or reading fails
     */
    public static HttpResponse parse(Transport transport) throws HttpException {
        return parse(transport, Http.Verb.GET.toString());
    }

    /**
     * Parse the response to a request made with the given method. Responses to HEAD, as well as 1xx, 204 and 304
     * responses, never have a body. Informative (1xx) responses other than 101 are skipped.
     * @param transport transport the request was sent over
     * @param requestMethod method of the request this response answers
     * @return fully read response
     * @throws HttpException if response is malformed, stream ends too early, or reading fails
     */
    public static HttpResponse parse(Transport transport, String requestMethod) throws HttpException {
        InputStream in = new BufferedInputStream(new TransportInputStream(transport));
        try {
            HttpResponse.Status status;
            ResponseHeaders headers;
            int infoResponses = 0;
            do {
                status = readStatus(in);
                headers = readHeaders(in);
                infoResponses++;
            } while(status.responseCode / 100 == 1 && status.responseCode != 101
                    && infoResponses <= MAX_INFORMATIVE_RESPONSES); //informative status lines - ignored
            log.debug("Received {}", status);

            byte[] body;
            Http.Verb verb = Http.Verb.fromText(requestMethod);
            if((verb != null && !verb.responseHasBody()) || !Http.statusHasBody(status.responseCode))
                body = new byte[0];
            else
                body = readBody(in, headers);
            return new HttpResponse(status, headers, body);
        } catch (HttpException e) {
            throw e;
        } catch (IOException e) {
            throw new HttpException(TRANSPORT_ERROR, "reading response failed", e);
        }
    }

    private static HttpResponse.Status readStatus(InputStream in) throws IOException {
        String line = TransportInputStream.readLine(in, MALFORMED_STATUS_LINE);
        if(line == null) throw new HttpException(UNEXPECTED_EOF, "connection closed before status line");
        return HttpResponse.Status.parse(line);
    }

    private static ResponseHeaders readHeaders(InputStream in) throws IOException {
        ResponseHeaders headers = new ResponseHeaders();
        String line;
        while(true) {
            line = TransportInputStream.readLine(in, MALFORMED_HEADER);
            if(line == null) throw new HttpException(UNEXPECTED_EOF, "connection closed inside headers");
            if(line.isEmpty()) return headers;
            headers.setHeader(line);
        }
    }

    private static byte[] readBody(InputStream in, ResponseHeaders headers) throws IOException {
        if(headers.isChunked()) {
            try(ChunkedInputStream chunks = new ChunkedInputStream(in)) {
                return chunks.readAllBytes();
            }
        }
        String lenStr = headers.getContentLength();
        if(lenStr != null) {
            int len = parseContentLength(lenStr);
            byte[] body = in.readNBytes(len);
            if(body.length < len)
                throw new HttpException(UNEXPECTED_EOF, "expected " + len + " bytes of body, got " + body.length);
            return body;
        }
        //no framing: body lasts until the server closes the connection
        return in.readAllBytes();
    }

    private static int parseContentLength(String lenStr) throws HttpException {
        String len = lenStr.trim();
        if(len.isEmpty() || len.length() > 10) throw new HttpException(MALFORMED_HEADER, "Content-Length: " + lenStr);
        for(int i=0; i<len.length(); i++)
            if(len.charAt(i) < '0' || len.charAt(i) > '9')
                throw new HttpException(MALFORMED_HEADER, "Content-Length: " + lenStr);
        long parsed = Long.parseLong(len);
        if(parsed > Integer.MAX_VALUE - 8) throw new HttpException(MALFORMED_HEADER, "Content-Length too large: " + lenStr);
        return (int) parsed;
    }
}

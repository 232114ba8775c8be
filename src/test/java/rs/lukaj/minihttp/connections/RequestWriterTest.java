package rs.lukaj.minihttp.connections;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

public class RequestWriterTest {

    private static String written(RequestSpec spec) throws HttpException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        RequestWriter.write(spec, new StreamTransport(new ByteArrayInputStream(new byte[0]), out));
        return out.toString(UTF_8);
    }

    @Test
    public void requestLineAndHost() throws HttpException {
        RequestHeaders headers = RequestHeaders.createEmpty();
        headers.setHeader("X-Trace", "abc");
        RequestSpec spec = new RequestSpec("GET", Url.parse("http://example.com/search?q=a%20b&x"), headers, null, null);
        assertEquals("GET /search?q=a%20b&x HTTP/1.1\r\n" +
                "Host: example.com\r\n" +
                "X-Trace: abc\r\n" +
                "\r\n", written(spec));
    }

    @Test
    public void fragmentNotSent() throws HttpException {
        RequestSpec spec = new RequestSpec("GET", Url.parse("http://example.com/p?q=1#frag"), null, null, null);
        assertEquals("GET /p?q=1 HTTP/1.1\r\nHost: example.com\r\n\r\n", written(spec));
    }

    @Test
    public void hostIncludesNonDefaultPort() throws HttpException {
        RequestSpec spec = new RequestSpec("GET", Url.parse("https://example.com:8443"), null, null, null);
        assertEquals("GET / HTTP/1.1\r\nHost: example.com:8443\r\n\r\n", written(spec));
    }

    /**
     * Host given by the caller replaces the synthesized one, and is written only once, right after the request line.
     */
    @Test
    public void explicitHostWins() throws HttpException {
        RequestHeaders headers = RequestHeaders.createEmpty();
        headers.setHeader("Accept", "*/*");
        headers.setHeader("host", "virtual.example");
        RequestSpec spec = new RequestSpec("GET", Url.parse("http://10.0.0.1/"), headers, null, null);
        String request = written(spec);
        assertEquals("GET / HTTP/1.1\r\nHost: virtual.example\r\nAccept: */*\r\n\r\n", request);
    }

    @Test
    public void bodyGetsContentLength() throws HttpException {
        byte[] body = "žaba=1".getBytes(UTF_8); //length in bytes, not chars
        RequestSpec spec = new RequestSpec("POST", Url.parse("http://example.com/form"), null, body, null);
        assertEquals("POST /form HTTP/1.1\r\n" +
                "Host: example.com\r\n" +
                "Content-Length: 7\r\n" +
                "\r\n" +
                "žaba=1", written(spec));
    }

    @Test
    public void emptyBodyStillHasContentLength() throws HttpException {
        RequestSpec spec = new RequestSpec("PUT", Url.parse("http://example.com/"), null, new byte[0], null);
        assertEquals("PUT / HTTP/1.1\r\nHost: example.com\r\nContent-Length: 0\r\n\r\n", written(spec));
    }

    @Test
    public void explicitContentLengthNotDuplicated() throws HttpException {
        RequestHeaders headers = RequestHeaders.createEmpty();
        headers.setHeader("content-length", "3");
        RequestSpec spec = new RequestSpec("POST", Url.parse("http://example.com/"), headers, "abc".getBytes(UTF_8), null);
        String request = written(spec);
        assertEquals("POST / HTTP/1.1\r\nHost: example.com\r\ncontent-length: 3\r\n\r\nabc", request);
    }

    @Test
    public void customMethod() throws HttpException {
        RequestSpec spec = new RequestSpec("PROPFIND", Url.parse("http://example.com/dav/"), null, null, null);
        assertTrue(written(spec).startsWith("PROPFIND /dav/ HTTP/1.1\r\n"));
    }

    @Test
    public void writeFailureIsTransportError() throws HttpException {
        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("Broken pipe");
            }
        };
        RequestSpec spec = new RequestSpec("GET", Url.parse("http://example.com/"), null, null, null);
        Transport transport = new StreamTransport(new ByteArrayInputStream(new byte[0]), broken);
        HttpException e = assertThrows(HttpException.class, () -> RequestWriter.write(spec, transport));
        assertEquals(HttpException.Kind.TRANSPORT_ERROR, e.getKind());
        assertInstanceOf(IOException.class, e.getCause());
    }
}

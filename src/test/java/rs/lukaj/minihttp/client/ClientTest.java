package rs.lukaj.minihttp.client;

import org.junit.jupiter.api.Test;
import rs.lukaj.minihttp.connections.HttpException;
import rs.lukaj.minihttp.connections.HttpResponse;
import rs.lukaj.minihttp.connections.InvalidConfigException;
import rs.lukaj.minihttp.connections.InvalidRequestException;
import rs.lukaj.minihttp.connections.RequestHeaders;
import rs.lukaj.minihttp.testutil.LoopbackServer;

import javax.net.ssl.SSLSocket;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

public class ClientTest {

    @Test
    public void immutableBuilder() throws HttpException {
        Client base = Client.create("http://example.com/");
        Client post = base.post().header("X-Test", "1").body("data");
        assertEquals("GET", base.getMethod());
        assertNull(base.getHeaders().getHeader("X-Test"));
        assertNull(base.build().getBody());
        assertEquals("POST", post.getMethod());
        assertEquals("1", post.getHeaders().getHeader("x-test"));
        assertArrayEquals("data".getBytes(UTF_8), post.build().getBody());
    }

    @Test
    public void defaults() throws HttpException {
        Client client = Client.create("https://example.com");
        assertEquals("GET", client.getMethod());
        assertEquals("close", client.getHeaders().getHeader("Connection"));
        assertEquals(RequestHeaders.USER_AGENT, client.getHeaders().getHeader("User-Agent"));
        assertEquals(Duration.ofSeconds(30), client.getConfig().getTimeout());
        assertTrue(client.getConfig().isVerifyCertificates());
        assertNull(client.getProxy());
    }

    @Test
    public void laterHeaderWins() throws HttpException {
        Client client = Client.create("http://example.com").headers(List.of(Map.entry("X", "a"), Map.entry("x", "B")));
        assertEquals("B", client.getHeaders().getHeader("X"));
        assertEquals(3, client.getHeaders().size());
    }

    @Test
    public void invalidRequests() throws HttpException {
        Client get = Client.create("http://example.com").body("not allowed");
        assertThrows(InvalidRequestException.class, get::send);
        assertThrows(InvalidRequestException.class, () -> Client.create("http://example.com").method("GE T").build());
        assertThrows(InvalidRequestException.class, () -> Client.create("http://example.com").method("").build());
    }

    @Test
    public void invalidConfig() throws HttpException {
        Client http = Client.create("http://example.com");
        assertThrows(InvalidConfigException.class, () -> http.verify(false));
        assertThrows(InvalidConfigException.class, () -> http.timeout(Duration.ofMillis(-5)));

        Client https = Client.create("https://example.com").verify(false);
        assertFalse(https.getConfig().isVerifyCertificates());
    }

    @Test
    public void invalidUrls() throws HttpException {
        assertEquals(HttpException.Kind.INVALID_URL,
                assertThrows(HttpException.class, () -> Client.create("ftp://example.com")).getKind());
        Client client = Client.create("http://example.com");
        assertEquals(HttpException.Kind.INVALID_URL,
                assertThrows(HttpException.class, () -> client.proxy("not a url")).getKind());
    }

    @Test
    public void getRequest() throws Exception {
        try(LoopbackServer server = new LoopbackServer()) {
            server.respond("HTTP/1.1 200 OK\r\nContent-Type: text/plain\r\nContent-Length: 5\r\n\r\nhello");
            HttpResponse response = Client.create(server.url("/hello?x=1")).send();
            server.await();

            assertEquals(200, response.getStatusCode());
            assertEquals("hello", response.text());
            assertEquals("text/plain", response.getHeader("content-type"));
            String head = server.getRequestHead();
            assertTrue(head.startsWith("GET /hello?x=1 HTTP/1.1\r\nHost: 127.0.0.1:" + server.getPort() + "\r\n"), head);
            assertTrue(head.contains("\r\nConnection: close\r\n"), head);
            assertTrue(head.contains("\r\nUser-Agent: " + RequestHeaders.USER_AGENT + "\r\n"), head);
            assertFalse(head.contains("Content-Length"), head);
        }
    }

    @Test
    public void postWithBody() throws Exception {
        try(LoopbackServer server = new LoopbackServer()) {
            server.respond("HTTP/1.1 201 Created\r\nContent-Length: 0\r\n\r\n");
            HttpResponse response = Client.create(server.url("/items"))
                    .post()
                    .header("Content-Type", "application/json")
                    .body("{\"name\":\"čaj\"}")
                    .send();
            server.await();

            assertEquals(201, response.getStatusCode());
            assertEquals(0, response.getBody().length);
            String head = server.getRequestHead();
            assertTrue(head.startsWith("POST /items HTTP/1.1\r\n"), head);
            assertTrue(head.contains("\r\nContent-Type: application/json\r\n"), head);
            assertTrue(head.contains("\r\nContent-Length: 15\r\n"), head);
            assertEquals("{\"name\":\"čaj\"}", new String(server.getRequestBody(), UTF_8));
        }
    }

    @Test
    public void userHeadersOverrideDefaults() throws Exception {
        try(LoopbackServer server = new LoopbackServer()) {
            server.respond("HTTP/1.1 204 No Content\r\n\r\n");
            Client.create(server.url("/"))
                    .header("user-agent", "tester/2.0")
                    .header("Host", "virtual.example")
                    .send();
            server.await();

            String head = server.getRequestHead();
            assertTrue(head.startsWith("GET / HTTP/1.1\r\nHost: virtual.example\r\n"), head);
            assertTrue(head.contains("\r\nuser-agent: tester/2.0\r\n"), head);
            assertFalse(head.contains(RequestHeaders.USER_AGENT), head);
        }
    }

    @Test
    public void chunkedResponse() throws Exception {
        try(LoopbackServer server = new LoopbackServer()) {
            server.respond("HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\n" +
                    "4\r\nWiki\r\n5\r\npedia\r\nE\r\n in\r\n\r\nchunks.\r\n0\r\n\r\n");
            HttpResponse response = Client.create(server.url("/chunked")).send();
            server.await();
            assertEquals("Wikipedia in\r\n\r\nchunks.", response.text());
        }
    }

    @Test
    public void responseUntilClose() throws Exception {
        try(LoopbackServer server = new LoopbackServer()) {
            server.respond("HTTP/1.0 200 OK\r\n\r\nread until the server closes");
            HttpResponse response = Client.create(server.url("/")).send();
            server.await();
            assertEquals("read until the server closes", response.text());
        }
    }

    @Test
    public void headRequest() throws Exception {
        try(LoopbackServer server = new LoopbackServer()) {
            server.respond("HTTP/1.1 200 OK\r\nContent-Length: 12345\r\n\r\n");
            HttpResponse response = Client.create(server.url("/big")).head().send();
            server.await();
            assertEquals("12345", response.getHeader("Content-Length"));
            assertEquals(0, response.getBody().length);
            assertTrue(server.getRequestHead().startsWith("HEAD /big HTTP/1.1\r\n"));
        }
    }

    @Test
    public void throughProxy() throws Exception {
        try(LoopbackServer proxy = new LoopbackServer()) {
            proxy.serve(socket -> {
                InputStream in = socket.getInputStream();
                OutputStream out = socket.getOutputStream();
                assertTrue(LoopbackServer.readHead(in).startsWith("CONNECT example.com:80 HTTP/1.1\r\n"));
                out.write("HTTP/1.1 200 Connection Established\r\n\r\n".getBytes(UTF_8));
                out.flush();
                String request = LoopbackServer.readHead(in);
                assertTrue(request.startsWith("GET /via-proxy HTTP/1.1\r\nHost: example.com\r\n"), request);
                out.write("HTTP/1.1 200 OK\r\nContent-Length: 7\r\n\r\ntunnel!".getBytes(UTF_8));
                out.flush();
            });
            HttpResponse response = Client.create("http://example.com/via-proxy")
                    .proxy("http://127.0.0.1:" + proxy.getPort())
                    .send();
            proxy.await();
            assertEquals("tunnel!", response.text());
        }
    }

    @Test
    public void httpsThroughProxy() throws Exception {
        try(LoopbackServer proxy = new LoopbackServer()) {
            proxy.serve(socket -> {
                assertTrue(LoopbackServer.readHead(socket.getInputStream()).startsWith("CONNECT example.com:443 HTTP/1.1\r\n"));
                socket.getOutputStream().write("HTTP/1.1 200 Connection Established\r\n\r\n".getBytes(UTF_8));
                socket.getOutputStream().flush();
                try(SSLSocket tls = LoopbackServer.startTls(socket)) {
                    String request = LoopbackServer.readHead(tls.getInputStream());
                    assertTrue(request.startsWith("GET /secure?a=1 HTTP/1.1\r\nHost: example.com\r\n"), request);
                    tls.getOutputStream().write("HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\n4\r\nWiki\r\n5\r\npedia\r\n0\r\n\r\n"
                            .getBytes(UTF_8));
                    tls.getOutputStream().flush();
                }
            });
            HttpResponse response = Client.create("https://example.com/secure?a=1#section")
                    .proxy("http://127.0.0.1:" + proxy.getPort())
                    .verify(false)
                    .send();
            proxy.await();
            assertEquals(200, response.getStatusCode());
            assertEquals("Wikipedia", response.text());
        }
    }

    @Test
    public void httpsDirect() throws Exception {
        try(LoopbackServer server = new LoopbackServer()) {
            server.respondOverTls("HTTP/1.1 200 OK\r\nContent-Length: 9\r\n\r\nWikipedia");
            HttpResponse response = Client.create("https://127.0.0.1:" + server.getPort() + "/").verify(false).send();
            server.await();
            assertEquals("Wikipedia", response.text());
        }
    }

    @Test
    public void proxyRefuses() throws Exception {
        try(LoopbackServer proxy = new LoopbackServer()) {
            proxy.serve(socket -> {
                LoopbackServer.readHead(socket.getInputStream());
                socket.getOutputStream().write("HTTP/1.1 502 Bad Gateway\r\n\r\n".getBytes(UTF_8));
                socket.getOutputStream().flush();
            });
            Client client = Client.create("https://example.com/").proxy("http://127.0.0.1:" + proxy.getPort());
            HttpException e = assertThrows(HttpException.class, client::send);
            proxy.await();
            assertEquals(HttpException.Kind.PROXY_CONNECT_FAILED, e.getKind());
            assertEquals("HTTP/1.1 502 Bad Gateway", e.getDetail());
        }
    }

    @Test
    public void readTimeout() throws Exception {
        try(LoopbackServer server = new LoopbackServer()) {
            server.serve(socket -> {
                InputStream in = socket.getInputStream();
                LoopbackServer.readHead(in);
                //never answer, wait for the client to give up
                while(in.read() != -1) ;
            });
            Client client = Client.create(server.url("/slow")).timeout(Duration.ofMillis(200));
            HttpException e = assertThrows(HttpException.class, client::send);
            assertEquals(HttpException.Kind.TRANSPORT_ERROR, e.getKind());
            server.await();
        }
    }

    @Test
    public void truncatedResponse() throws Exception {
        try(LoopbackServer server = new LoopbackServer()) {
            server.respond("HTTP/1.1 200 OK\r\nContent-Length: 100\r\n\r\nonly a part");
            HttpException e = assertThrows(HttpException.class, () -> Client.create(server.url("/")).send());
            server.await();
            assertEquals(HttpException.Kind.UNEXPECTED_EOF, e.getKind());
        }
    }
}

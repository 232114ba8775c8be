package rs.lukaj.minihttp;

import org.junit.jupiter.api.Test;
import rs.lukaj.minihttp.connections.HttpException;
import rs.lukaj.minihttp.connections.HttpResponse;
import rs.lukaj.minihttp.testutil.LoopbackServer;

import static org.junit.jupiter.api.Assertions.*;

public class MiniHttpTest {

    @Test
    public void get() throws Exception {
        try(LoopbackServer server = new LoopbackServer()) {
            server.respond("HTTP/1.1 200 OK\r\nContent-Length: 2\r\n\r\nhi");
            HttpResponse response = MiniHttp.get(server.url("/"));
            server.await();
            assertEquals("hi", response.text());
            assertTrue(server.getRequestHead().startsWith("GET / HTTP/1.1\r\n"));
        }
    }

    @Test
    public void delete() throws Exception {
        try(LoopbackServer server = new LoopbackServer()) {
            server.respond("HTTP/1.1 404 Not Found\r\nContent-Length: 0\r\n\r\n");
            HttpResponse response = MiniHttp.delete(server.url("/items/7"));
            server.await();
            //error statuses are responses, not exceptions
            assertTrue(response.isError());
            assertEquals(404, response.getStatusCode());
            assertTrue(server.getRequestHead().startsWith("DELETE /items/7 HTTP/1.1\r\n"));
        }
    }

    @Test
    public void invalidUrl() {
        HttpException e = assertThrows(HttpException.class, () -> MiniHttp.get("example.com"));
        assertEquals(HttpException.Kind.INVALID_URL, e.getKind());
    }
}

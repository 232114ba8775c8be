package rs.lukaj.minihttp;

import rs.lukaj.minihttp.client.Client;
import rs.lukaj.minihttp.connections.HttpException;
import rs.lukaj.minihttp.connections.HttpResponse;

/**
 * One-line requests with default settings. For headers, body, proxy or timeouts, use {@link Client}.
 * <pre>
 *     String page = MiniHttp.get("https://example.com").text();
 * </pre>
 */
public final class MiniHttp {
    private MiniHttp() {
    }

    public static HttpResponse get(String url) throws HttpException {
        return Client.create(url).get().send();
    }

    public static HttpResponse post(String url) throws HttpException {
        return Client.create(url).post().send();
    }

    public static HttpResponse head(String url) throws HttpException {
        return Client.create(url).head().send();
    }

    public static HttpResponse put(String url) throws HttpException {
        return Client.create(url).put().send();
    }

    public static HttpResponse delete(String url) throws HttpException {
        return Client.create(url).delete().send();
    }

    public static HttpResponse options(String url) throws HttpException {
        return Client.create(url).options().send();
    }
}

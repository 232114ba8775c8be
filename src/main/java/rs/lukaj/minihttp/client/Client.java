package rs.lukaj.minihttp.client;

import rs.lukaj.minihttp.connections.*;

import java.time.Duration;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Builds and sends a single HTTP request. Instances are immutable: every method returns a new Client, leaving
 * the one it was called on as it was, so a partially configured client can be shared and reused as a template.
 * <br/>
 * Example:
 * <br/>
 * <pre>
 *     HttpResponse response = Client.create("https://example.com/search?q=java")
 *                                   .header("Accept", "text/html")
 *                                   .proxy("http://127.0.0.1:3128")
 *                                   .get()
 *                                   .send();
 *     System.out.println(response.getStatusCode() + " " + response.text());
 * </pre>
 * Requests start as GET with {@link RequestHeaders#createDefault() default headers}. Headers set here always
 * win over the ones the client would send on its own, including Host and Content-Length.
 */
public final class Client {
    private final Url url;
    private final String method;
    private final RequestHeaders headers;
    private final byte[] body;
    private final Url proxy;
    private final Connector.Config config;

    private Client(Url url, String method, RequestHeaders headers, byte[] body, Url proxy, Connector.Config config) {
        this.url = url;
        this.method = method;
        this.headers = headers;
        this.body = body;
        this.proxy = proxy;
        this.config = config;
    }

    /**
     * Create a client for the given URL.
     * @param url http or https URL
     * @return new client, set up for a GET request
     * @throws HttpException of kind {@link HttpException.Kind#INVALID_URL} if URL can't be parsed
     */
    public static Client create(String url) throws HttpException {
        return new Client(Url.parse(url), Http.Verb.GET.toString(), RequestHeaders.createDefault(), null, null,
                new Connector.Config());
    }

    private Client withMethod(String method) {
        return new Client(url, method, headers, body, proxy, config);
    }

    public Client get() {
        return withMethod(Http.Verb.GET.toString());
    }
    public Client post() {
        return withMethod(Http.Verb.POST.toString());
    }
    public Client put() {
        return withMethod(Http.Verb.PUT.toString());
    }
    public Client delete() {
        return withMethod(Http.Verb.DELETE.toString());
    }
    public Client head() {
        return withMethod(Http.Verb.HEAD.toString());
    }
    public Client options() {
        return withMethod(Http.Verb.OPTIONS.toString());
    }
    public Client patch() {
        return withMethod(Http.Verb.PATCH.toString());
    }

    /**
     * Use a custom request method. It must be a valid token; this is checked when the request is built.
     * @param method method name, sent as-is
     * @return new client using the method
     */
    public Client method(String method) {
        return withMethod(method);
    }

    /**
     * Set a single header, replacing any header with the same name (case-insensitive).
     * @param name header name
     * @param value header value
     * @return new client with the header set
     */
    public Client header(String name, String value) {
        RequestHeaders merged = RequestHeaders.copyOf(headers);
        merged.setHeader(name, value);
        return new Client(url, method, merged, body, proxy, config);
    }

    /**
     * Merge headers into the ones already set. Headers are applied in iteration order, so a later header replaces
     * an earlier one with the same name (case-insensitive).
     * @param pairs header name-value pairs
     * @return new client with headers merged
     */
    public Client headers(Iterable<? extends Map.Entry<String, String>> pairs) {
        RequestHeaders merged = RequestHeaders.copyOf(headers);
        for(Map.Entry<String, String> pair : pairs) merged.setHeader(pair.getKey(), pair.getValue());
        return new Client(url, method, merged, body, proxy, config);
    }

    /**
     * Merge headers into the ones already set.
     * @param headers header names mapped to values
     * @return new client with headers merged
     * @see #headers(Iterable)
     */
    public Client headers(Map<String, String> headers) {
        return headers(headers.entrySet());
    }

    /**
     * Tunnel the request through a HTTP proxy, using CONNECT. The proxy is always spoken to in plain text; scheme
     * of the proxy URL only determines its default port.
     * @param proxyUrl proxy URL, e.g. http://127.0.0.1:3128
     * @return new client using the proxy
     * @throws HttpException of kind {@link HttpException.Kind#INVALID_URL} if proxy URL can't be parsed
     */
    public Client proxy(String proxyUrl) throws HttpException {
        return new Client(url, method, headers, body, Url.parse(proxyUrl), config);
    }

    /**
     * Set request body. Only methods which can carry a body (e.g. POST, PUT) may have one; this is checked when
     * the request is built.
     * @param body raw body bytes, copied
     * @return new client with the body set
     */
    public Client body(byte[] body) {
        return new Client(url, method, headers, body.clone(), proxy, config);
    }

    /**
     * Set request body to the UTF-8 encoding of the string.
     * @param body body text
     * @return new client with the body set
     */
    public Client body(String body) {
        return new Client(url, method, headers, body.getBytes(UTF_8), proxy, config);
    }

    /**
     * Set timeout for connecting and for each read from the server.
     * @param timeout positive duration
     * @return new client using the timeout
     * @throws InvalidConfigException if timeout isn't positive
     */
    public Client timeout(Duration timeout) {
        return new Client(url, method, headers, body, proxy, config.copy().setTimeout(timeout));
    }

    /**
     * Set whether TLS certificates are verified (they are by default).
     * @param verify whether to verify server certificate and host name
     * @return new client with the setting applied
     * @throws InvalidConfigException if URL isn't https
     */
    public Client verify(boolean verify) {
        if(!url.isHttps()) throw new InvalidConfigException("Verify setting only for https");
        return new Client(url, method, headers, body, proxy, config.copy().setVerifyCertificates(verify));
    }

    public Url getUrl() {
        return url;
    }

    public String getMethod() {
        return method;
    }

    public Url getProxy() {
        return proxy;
    }

    /**
     * @return copy of the headers which would be sent, not counting Host and Content-Length
     */
    public RequestHeaders getHeaders() {
        return RequestHeaders.copyOf(headers);
    }

    public Connector.Config getConfig() {
        return config.copy();
    }

    /**
     * Finalize the request description.
     * @return request as it would be sent
     * @throws InvalidRequestException if method is invalid, or it can't carry the body which is set
     */
    public RequestSpec build() {
        return new RequestSpec(method, url, headers, body, proxy);
    }

    /**
     * Send the request and read the response, blocking the calling thread until done. A new connection is opened
     * and closed for each call.
     * @return response, with body fully read
     * @throws HttpException if connecting, sending or reading fails; nothing is retried
     * @throws InvalidRequestException if the request is invalid, see {@link #build()}
     */
    public HttpResponse send() throws HttpException {
        RequestSpec spec = build();
        return new HttpTransaction(new Connector(config)).makeRequest(spec);
    }
}

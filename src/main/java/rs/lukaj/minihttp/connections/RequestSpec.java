package rs.lukaj.minihttp.connections;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable description of a single outgoing request: method, target URL, headers, optional body and optional
 * proxy. Knows nothing about sockets; {@link RequestWriter} turns it into bytes and {@link HttpTransaction}
 * sends it.
 */
public final class RequestSpec {
    private final String method;
    private final Url url;
    private final RequestHeaders headers;
    private final byte[] body;
    private final Url proxy;

    /**
     * Create a request description. Headers and body are copied.
     * @param method request method, e.g. GET; methods outside {@link Http.Verb} are allowed if they're valid tokens
     * @param url target URL
     * @param headers headers to send, or null for none
     * @param body request body, or null if the request has no body
     * @param proxy URL of the proxy to tunnel through, or null to connect directly
     * @throws InvalidRequestException if method is not a valid token, or the method can't carry a body but one is set
     */
    public RequestSpec(String method, Url url, Headers headers, byte[] body, Url proxy) {
        Objects.requireNonNull(url, "URL can't be null!");
        if(!Http.isToken(method)) throw new InvalidRequestException("Invalid request method: " + method);
        Http.Verb verb = Http.Verb.fromText(method);
        if(body != null && verb != null && !verb.canProvideRequestBody())
            throw new InvalidRequestException("Can't provide body with " + method + " request!");
        this.method = method;
        this.url = url;
        this.headers = headers == null ? RequestHeaders.createEmpty() : RequestHeaders.copyOf(headers);
        this.body = body == null ? null : body.clone();
        this.proxy = proxy;
    }

    public String getMethod() {
        return method;
    }

    /**
     * @return verb matching the method, or null if it's a custom method
     */
    public Http.Verb getVerb() {
        return Http.Verb.fromText(method);
    }

    public Url getUrl() {
        return url;
    }

    /**
     * @return copy of the headers
     */
    public RequestHeaders getHeaders() {
        return RequestHeaders.copyOf(headers);
    }

    public boolean hasBody() {
        return body != null;
    }

    /**
     * @return copy of the body, or null if there is none
     */
    public byte[] getBody() {
        return body == null ? null : body.clone();
    }

    /**
     * @return proxy URL, or null if connecting directly
     */
    public Url getProxy() {
        return proxy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RequestSpec)) return false;
        RequestSpec that = (RequestSpec) o;
        return method.equals(that.method) && url.equals(that.url) && headers.equals(that.headers)
                && Arrays.equals(body, that.body) && Objects.equals(proxy, that.proxy);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(method, url, headers, proxy) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return method + " " + url + (proxy == null ? "" : " via " + proxy.getAuthority());
    }
}

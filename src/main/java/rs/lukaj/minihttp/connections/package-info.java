/**
 * This package implements low-level communication with server: the whole HTTP/1.1 exchange over a
 * freshly opened connection. More high-level (i.e. usable) stuff is located inside the client package.
 *
 * <br/>
 * <h3>Overview</h3>
 * {@link rs.lukaj.minihttp.connections.Url} parses the target. It's deliberately simpler than {@link java.net.URL}:
 * path and query are sent exactly as given.
 * <br/>
 * {@link rs.lukaj.minihttp.connections.Transport} is a duplex byte stream. Doesn't actually implement any HTTP.
 * {@link rs.lukaj.minihttp.connections.Connector} opens one over a plain socket or TLS, optionally through a
 * {@link rs.lukaj.minihttp.connections.ProxyTunnel}.
 * <br/>
 * {@link rs.lukaj.minihttp.connections.RequestWriter} / {@link rs.lukaj.minihttp.connections.ResponseParser}
 * turn a {@link rs.lukaj.minihttp.connections.RequestSpec} into bytes and bytes into a
 * {@link rs.lukaj.minihttp.connections.HttpResponse}. They only know about the Transport interface.
 * <br/>
 * {@link rs.lukaj.minihttp.connections.HttpTransaction} ties it all together: connect, write, read, close.
 * <br/>
 * Every failure is a {@link rs.lukaj.minihttp.connections.HttpException} carrying its
 * {@link rs.lukaj.minihttp.connections.HttpException.Kind}. Connections are never pooled nor reused, and
 * nothing is retried.
 */
package rs.lukaj.minihttp.connections;

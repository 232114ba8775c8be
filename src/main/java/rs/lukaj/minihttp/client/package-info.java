/**
 * Classes meant to be used by the programmer to make requests.
 * <br/>
 * <h3>Overview</h3>
 * {@link rs.lukaj.minihttp.client.Client} collects method, headers, body, proxy and timeouts, and sends the
 * request using {@link rs.lukaj.minihttp.connections.HttpTransaction}. It doesn't know much nor cares about
 * HTTP framing; that's all in the connections package.
 */
package rs.lukaj.minihttp.client;

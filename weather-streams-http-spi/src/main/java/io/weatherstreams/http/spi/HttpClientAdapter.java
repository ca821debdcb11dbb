package io.weatherstreams.http.spi;

/**
 * Opens event-stream exchanges over a concrete HTTP library.
 *
 * <p>The stream client only needs one operation: send a request and get the status and headers
 * back as soon as they arrive, leaving the body to be consumed chunk by chunk. Both a long-lived
 * {@code GET} subscription and a {@code POST} that answers with an event stream go through here.
 * Adapters are shared by every stream of a client and must tolerate concurrent calls.
 */
public interface HttpClientAdapter {

    /**
     * Sends the request and waits for the response head only.
     *
     * <p>Non-2xx statuses are returned, not thrown. The caller closes the response; a close from
     * another thread must unblock a read in progress on the body.
     *
     * @param request the request to send
     * @return the open response
     * @throws HttpTimeoutException if no response head arrived within {@link HttpClientRequest#timeout()}
     * @throws HttpClientException if the exchange could not be started
     */
    HttpClientResponse open(HttpClientRequest request) throws HttpClientException;
}

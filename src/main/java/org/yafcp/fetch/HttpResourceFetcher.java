package org.yafcp.fetch;

import org.yafcp.plugin.FetchException;
import org.yafcp.plugin.ResourceFetcher;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link ResourceFetcher} issuing one HTTP GET per locator through the shared {@link NetworkContext}.
 * <p>
 * The timeout is hard: it bounds the whole exchange including the body, not only the wait for headers.
 * Any status outside 2xx is a transport failure.
 */
public class HttpResourceFetcher implements ResourceFetcher {

    private static final String ACCEPT = "text/csv, text/plain;q=0.9, */*;q=0.8";

    private final NetworkContext context;
    private final Charset charset;

    public HttpResourceFetcher(NetworkContext context, Charset charset) {
        this.context = context;
        this.charset = charset;
    }

    @Override
    public String fetch(String locator, Duration timeout) throws FetchException {
        final HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(locator))
                    .timeout(timeout)
                    .header("Accept", ACCEPT)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw FetchException.transport(locator, "invalid URL (" + e.getMessage() + ")", e);
        }

        final CompletableFuture<HttpResponse<byte[]>> future =
                context.client().sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
        final HttpResponse<byte[]> response;
        try {
            response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw FetchException.timeout(locator, timeout.toMillis(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof HttpTimeoutException) {
                throw FetchException.timeout(locator, timeout.toMillis(), cause);
            }
            throw FetchException.transport(locator, cause.getClass().getSimpleName()
                                                    + (cause.getMessage() != null ? " " + cause.getMessage() : ""), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw FetchException.transport(locator, "interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw FetchException.transport(locator, "HTTP " + status, null);
        }
        byte[] body = response.body();
        return body == null ? "" : new String(body, charset);
    }
}

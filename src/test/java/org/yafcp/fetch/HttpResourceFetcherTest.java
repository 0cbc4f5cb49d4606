package org.yafcp.fetch;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.yafcp.plugin.FetchException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HttpResourceFetcherTest {

    private MockWebServer server;
    private NetworkContext context;
    private HttpResourceFetcher fetcher;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        context = NetworkContext.open(Duration.ofSeconds(2), 2);
        fetcher = new HttpResourceFetcher(context, StandardCharsets.UTF_8);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (context != null) context.close();
        if (server != null) server.shutdown();
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void fetch_returnsBody() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("x,y\n1,2"));

        String body = fetcher.fetch(server.url("/data.csv").toString(), Duration.ofSeconds(2));

        assertEquals("x,y\n1,2", body);
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("GET", request.getMethod());
        assertEquals("/data.csv", request.getPath());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void fetch_decodesWithConfiguredCharset() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200)
                .setBody(new okio.Buffer().write("name\nJosé\n".getBytes(StandardCharsets.ISO_8859_1))));
        HttpResourceFetcher latin1 = new HttpResourceFetcher(context, StandardCharsets.ISO_8859_1);

        assertEquals("name\nJosé\n", latin1.fetch(server.url("/latin1.csv").toString(), Duration.ofSeconds(2)));
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void fetch_slowResponse_isTimeout() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("a\n1")
                .setHeadersDelay(2, TimeUnit.SECONDS));

        FetchException e = assertThrows(FetchException.class,
                () -> fetcher.fetch(server.url("/slow.csv").toString(), Duration.ofMillis(200)));

        assertEquals(FetchException.Kind.TIMEOUT, e.kind());
        assertEquals("FetchError::Timeout", e.category());
        assertTrue(e.locator().endsWith("/slow.csv"));
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void fetch_non2xx_isTransport() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("not found"));

        FetchException e = assertThrows(FetchException.class,
                () -> fetcher.fetch(server.url("/missing.csv").toString(), Duration.ofSeconds(2)));

        assertEquals(FetchException.Kind.TRANSPORT, e.kind());
        assertTrue(e.getMessage().contains("HTTP 404"), e.getMessage());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void fetch_connectionRefused_isTransport() throws Exception {
        String url = server.url("/gone.csv").toString();
        server.shutdown();
        server = null;

        FetchException e = assertThrows(FetchException.class, () -> fetcher.fetch(url, Duration.ofSeconds(2)));

        assertEquals(FetchException.Kind.TRANSPORT, e.kind());
        assertEquals("FetchError::Transport", e.category());
    }

    @Test
    void fetch_invalidUrl_isTransport() {
        FetchException e = assertThrows(FetchException.class, () -> fetcher.fetch("not a url", Duration.ofSeconds(1)));
        assertEquals(FetchException.Kind.TRANSPORT, e.kind());

        FetchException ftp = assertThrows(FetchException.class,
                () -> fetcher.fetch("ftp://example.com/file.csv", Duration.ofSeconds(1)));
        assertEquals(FetchException.Kind.TRANSPORT, ftp.kind());
    }

    @Test
    void closedContext_rejectsUse() {
        context.close();
        assertTrue(context.isClosed());
        assertThrows(IllegalStateException.class, context::client);
        context.close(); // idempotent
    }
}

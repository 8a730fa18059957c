package com.kapi.client;

import com.kapi.KapiConfig;
import com.kapi.error.ApiErrorException;
import com.kapi.error.RequestTimeoutException;
import com.kapi.error.TransportException;
import okhttp3.Request;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class KapiHttpClientTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private KapiHttpClient client(Duration readTimeout) {
        return new KapiHttpClient(KapiConfig.defaults().withTimeouts(Duration.ofSeconds(5), readTimeout));
    }

    private Request get() {
        return new Request.Builder().url(server.url("/ping")).build();
    }

    @Test
    void execute_returnsBody() throws Exception {
        server.enqueue(new MockResponse().setBody("pong"));

        assertEquals("pong", client(Duration.ofSeconds(5)).execute(get()));
    }

    @Test
    void execute_emptyBodyIsEmptyString() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));

        assertEquals("", client(Duration.ofSeconds(5)).execute(get()));
    }

    @Test
    void execute_nonSuccessStatus() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));

        var e = assertThrows(ApiErrorException.class, () -> client(Duration.ofSeconds(5)).execute(get()));
        assertEquals(429, e.statusCode());
        assertEquals("slow down", e.body());
    }

    @Test
    void execute_readTimeout() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));

        assertThrows(RequestTimeoutException.class, () -> client(Duration.ofMillis(200)).execute(get()));
    }

    @Test
    void execute_disconnectIsTransportFailure() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));

        var e = assertThrows(TransportException.class, () -> client(Duration.ofSeconds(5)).execute(get()));
        assertFalse(e instanceof RequestTimeoutException);
    }

    @Test
    void execute_doesNotRetry() throws Exception {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));
        server.enqueue(new MockResponse().setBody("second"));
        var client = client(Duration.ofSeconds(5));

        assertThrows(TransportException.class, () -> client.execute(get()));

        // a retry would have consumed it
        assertEquals("second", client.execute(get()));
    }
}

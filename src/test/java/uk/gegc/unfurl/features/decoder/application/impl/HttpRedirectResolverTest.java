package uk.gegc.unfurl.features.decoder.application.impl;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.unfurl.features.decoder.config.DecoderProperties;
import uk.gegc.unfurl.features.decoder.domain.UrlDecodeException;
import uk.gegc.unfurl.features.decoder.domain.model.FailureReason;
import uk.gegc.unfurl.features.urlsafety.application.UrlSafetyValidator;
import uk.gegc.unfurl.features.urlsafety.domain.SsrfProtectionException;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.endsWith;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * Runs the resolver against a loopback server. The safety gate is mocked, since it would
 * otherwise reject the loopback address itself.
 */
@DisplayName("HttpRedirectResolver Tests")
class HttpRedirectResolverTest {

    private HttpServer server;
    private ExecutorService executor;
    private String baseUrl;
    private UrlSafetyValidator validator;
    private HttpRedirectResolver resolver;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getByName("127.0.0.1"), 0), 0);
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);

        server.createContext("/start", exchange -> redirect(exchange, 302, "/final"));
        server.createContext("/hop1", exchange -> redirect(exchange, 301, "/hop2"));
        server.createContext("/hop2", exchange -> redirect(exchange, 307, baseUrl + "/final"));
        server.createContext("/final", exchange -> respond(exchange, 200, "<html>article</html>"));
        server.createContext("/loop", exchange -> redirect(exchange, 302, "/loop"));
        server.createContext("/missing", exchange -> respond(exchange, 404, "not here"));
        server.createContext("/to-missing", exchange -> redirect(exchange, 302, "/missing"));
        server.createContext("/unavailable", exchange -> respond(exchange, 503, "later"));
        server.createContext("/no-location", exchange -> {
            exchange.sendResponseHeaders(302, -1);
            exchange.close();
        });
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "late");
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

        DecoderProperties properties = new DecoderProperties();
        properties.setTimeoutMs(500);
        properties.setMaxRedirects(3);
        validator = mock(UrlSafetyValidator.class);
        resolver = new HttpRedirectResolver(properties, validator);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        executor.shutdownNow();
    }

    private static void redirect(HttpExchange exchange, int status, String location) throws IOException {
        exchange.getResponseHeaders().add("Location", location);
        exchange.sendResponseHeaders(status, -1);
        exchange.close();
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Test
    @DisplayName("resolve: follows a relative redirect to the final URL")
    void resolve_relativeRedirect() {
        assertThat(resolver.resolve(baseUrl + "/start")).isEqualTo(baseUrl + "/final");
    }

    @Test
    @DisplayName("resolve: follows a chain and validates every hop")
    void resolve_chain_validatesEveryHop() {
        String result = resolver.resolve(baseUrl + "/hop1");

        assertThat(result).isEqualTo(baseUrl + "/final");
        verify(validator).validate(baseUrl + "/hop1");
        verify(validator).validate(baseUrl + "/hop2");
        verify(validator).validate(baseUrl + "/final");
    }

    @Test
    @DisplayName("resolve: blocked hop aborts before it is requested")
    void resolve_blockedHop_throws() {
        doThrow(new SsrfProtectionException("SSRF protection: private IP address blocked: 127.0.0.1"))
                .when(validator).validate(endsWith("/final"));

        assertThatThrownBy(() -> resolver.resolve(baseUrl + "/start"))
                .isInstanceOf(SsrfProtectionException.class)
                .hasMessageContaining("SSRF protection");
    }

    @Test
    @DisplayName("resolve: redirect loop stops at the configured maximum")
    void resolve_loop_throwsTooManyRedirects() {
        assertThatThrownBy(() -> resolver.resolve(baseUrl + "/loop"))
                .isInstanceOf(UrlDecodeException.class)
                .hasMessageContaining("Too many redirects (max: 3)")
                .extracting(ex -> ((UrlDecodeException) ex).getReason())
                .isEqualTo(FailureReason.TOO_MANY_REDIRECTS);
    }

    @Test
    @DisplayName("resolve: error status at the end of the chain fails with that status")
    void resolve_finalNotFound_throwsHttpStatus() {
        assertThatThrownBy(() -> resolver.resolve(baseUrl + "/to-missing"))
                .isInstanceOf(UrlDecodeException.class)
                .hasMessage("HTTP error 404 when fetching URL")
                .extracting(ex -> ((UrlDecodeException) ex).getFailure().httpStatus())
                .isEqualTo(404);
    }

    @Test
    @DisplayName("resolve: 503 without a redirect reports the status")
    void resolve_unavailable_throwsHttpStatus() {
        assertThatThrownBy(() -> resolver.resolve(baseUrl + "/unavailable"))
                .isInstanceOf(UrlDecodeException.class)
                .hasMessageContaining("503");
    }

    @Test
    @DisplayName("resolve: success without any redirect is not a resolution")
    void resolve_noRedirect_throws() {
        assertThatThrownBy(() -> resolver.resolve(baseUrl + "/final"))
                .isInstanceOf(UrlDecodeException.class)
                .extracting(ex -> ((UrlDecodeException) ex).getReason())
                .isEqualTo(FailureReason.NO_REDIRECT);
    }

    @Test
    @DisplayName("resolve: redirect without Location fails")
    void resolve_missingLocation_throws() {
        assertThatThrownBy(() -> resolver.resolve(baseUrl + "/no-location"))
                .isInstanceOf(UrlDecodeException.class)
                .hasMessageContaining("Location");
    }

    @Test
    @DisplayName("resolve: slow server fails with a timeout")
    void resolve_slowServer_throwsTimeout() {
        assertThatThrownBy(() -> resolver.resolve(baseUrl + "/slow"))
                .isInstanceOf(UrlDecodeException.class)
                .hasMessageContaining("timeout")
                .extracting(ex -> ((UrlDecodeException) ex).getReason())
                .isEqualTo(FailureReason.TIMEOUT);
    }

    @Test
    @DisplayName("resolve: unparseable URL is invalid input")
    void resolve_unparseable_throwsInvalidInput() {
        assertThatThrownBy(() -> resolver.resolve("http://exa mple.com/"))
                .isInstanceOf(UrlDecodeException.class)
                .extracting(ex -> ((UrlDecodeException) ex).getReason())
                .isEqualTo(FailureReason.INVALID_INPUT);
    }
}

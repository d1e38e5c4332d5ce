package fun.fengwk.msh.core.facade.search.google;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import fun.fengwk.msh.core.facade.search.SearchProviderException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * GoogleClient tests.
 *
 * @author fengwk
 */
class GoogleClientTest {

    private HttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void shouldCapNumAndReadItemLinks() throws Exception {
        AtomicReference<URI> uriRef = new AtomicReference<>();
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/customsearch/v1", exchange -> {
            uriRef.set(exchange.getRequestURI());
            writeJson(exchange, 200, """
                {"items": [{"link": "https://a.test/"}, {"title": "no link"}, {"link": "https://b.test/"}]}
                """);
        });
        server.start();

        assertThat(client("key", "cx").search("java", 25)).containsExactly("https://a.test/", "https://b.test/");
        assertThat(uriRef.get().getQuery()).contains("num=10").contains("cx=cx").contains("key=key");
    }

    @Test
    void shouldFailPermanentlyWithoutCseId() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();

        assertThatThrownBy(() -> client("key", "").search("java", 5))
            .isInstanceOfSatisfying(SearchProviderException.class, ex -> assertThat(ex.isTransientFailure()).isFalse());
    }

    @Test
    void shouldTreatRateLimitAsTransient() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/", exchange -> writeJson(exchange, 429, "{}"));
        server.start();

        assertThatThrownBy(() -> client("key", "cx").search("java", 5))
            .isInstanceOfSatisfying(SearchProviderException.class, ex -> assertThat(ex.isTransientFailure()).isTrue());
    }

    @Test
    void shouldReturnEmptyWhenNoItems() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/", exchange -> writeJson(exchange, 200, "{\"searchInformation\": {}}"));
        server.start();

        assertThat(client("key", "cx").search("java", 5)).isEmpty();
    }

    private GoogleClient client(String apiKey, String cseId) {
        GoogleProperties properties = new GoogleProperties();
        properties.setBaseUrl("http://127.0.0.1:" + server.getAddress().getPort());
        properties.setApiKey(apiKey);
        properties.setCseId(cseId);
        properties.setTimeoutMs(2000);
        return new GoogleClient(properties, HttpClient.newHttpClient(), new ObjectMapper());
    }

    private static void writeJson(HttpExchange exchange, int status, String json) throws IOException {
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        exchange.getResponseBody().write(bytes);
        exchange.close();
    }

}

package fun.fengwk.msh.core.service.fetch;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodySubscribers;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fetches page text for ranking only. Nothing is persisted.
 *
 * <p>Every url gets an entry in the result, empty when the fetch failed, timed out or the
 * body was not text.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class LightContentFetcher {

    private final FetchProperties properties;
    private final HttpClient httpClient;

    public LightContentFetcher(FetchProperties properties) {
        properties.validate();
        this.properties = properties;
        this.httpClient = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofMillis(properties.getRequestTimeoutMs()))
            .build();
    }

    public List<String> fetchAll(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            return List.of();
        }

        List<CompletableFuture<String>> futures = new ArrayList<>(urls.size());
        for (String url : urls) {
            futures.add(fetch(url));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .get(properties.getSessionTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            log.warn("fetch session timed out, timeoutMs={}", properties.getSessionTimeoutMs());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("fetch session interrupted");
        } catch (ExecutionException ex) {
            // per-url failures are already mapped to empty text
            log.debug("fetch session completed with error, error={}", ex.getMessage());
        }

        List<String> texts = new ArrayList<>(urls.size());
        int fetched = 0;
        for (int i = 0; i < futures.size(); i++) {
            CompletableFuture<String> future = futures.get(i);
            if (!future.isDone()) {
                future.cancel(true);
                log.warn("fetch cancelled by session timeout, url={}", urls.get(i));
            }
            String text = future.isDone() && !future.isCompletedExceptionally() ? future.join() : "";
            if (!text.isEmpty()) {
                fetched++;
            }
            texts.add(text);
        }
        log.info("content fetched, urls={}, nonEmpty={}", urls.size(), fetched);
        return texts;
    }

    private CompletableFuture<String> fetch(String url) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofMillis(properties.getRequestTimeoutMs()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", "text/html,application/xhtml+xml,text/plain;q=0.9,*/*;q=0.1")
                .GET()
                .build();
        } catch (IllegalArgumentException ex) {
            log.warn("fetch skipped, url={}, error={}", url, ex.getMessage());
            return CompletableFuture.completedFuture("");
        }

        return httpClient.sendAsync(request, textBodyHandler())
            .thenApply(response -> toText(url, response))
            .completeOnTimeout("", properties.getRequestTimeoutMs(), TimeUnit.MILLISECONDS)
            .exceptionally(ex -> {
                log.warn("fetch failed, url={}, error={}", url, ex.getMessage());
                return "";
            });
    }

    private BodyHandler<byte[]> textBodyHandler() {
        return responseInfo -> {
            String contentType = responseInfo.headers().firstValue("content-type").orElse("");
            long declaredLength = responseInfo.headers().firstValueAsLong("content-length").orElse(-1L);
            if (responseInfo.statusCode() >= 400
                || !isTextContent(contentType)
                || declaredLength > properties.getMaxContentBytes()) {
                return BodySubscribers.replacing(null);
            }
            return new BoundedBodySubscriber(properties.getMaxContentBytes());
        };
    }

    private String toText(String url, HttpResponse<byte[]> response) {
        byte[] body = response.body();
        if (body == null || body.length == 0) {
            log.debug("fetch produced no text, url={}, status={}", url, response.statusCode());
            return "";
        }
        String contentType = response.headers().firstValue("content-type").orElse("");
        String content = new String(body, resolveCharset(contentType));
        if (mimeOf(contentType).equals("text/plain")) {
            return content;
        }
        return Jsoup.parse(content, url).text();
    }

    static boolean isTextContent(String contentType) {
        String mime = mimeOf(contentType);
        return mime.equals("text/html") || mime.equals("application/xhtml+xml") || mime.equals("text/plain");
    }

    private static String mimeOf(String contentType) {
        if (!StringUtils.hasText(contentType)) {
            return "";
        }
        String normalized = contentType.trim().toLowerCase(Locale.ROOT);
        int semicolonIndex = normalized.indexOf(';');
        return semicolonIndex >= 0 ? normalized.substring(0, semicolonIndex).trim() : normalized;
    }

    private static Charset resolveCharset(String contentType) {
        for (String part : contentType.split(";")) {
            String trimmed = part.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = trimmed.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException ex) {
                    log.debug("unknown charset, charset={}", name);
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

}

package fun.fengwk.msh.core.facade.search.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.msh.core.facade.search.SearchProvider;
import fun.fengwk.msh.core.facade.search.SearchProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Base for providers backed by a JSON-over-HTTP search API.
 *
 * <p>HTTP 429, 5xx and transport failures are transient. Other 4xx statuses, unreadable
 * bodies and missing credentials are permanent.
 *
 * @author fengwk
 */
@Slf4j
public abstract class AbstractHttpSearchProvider implements SearchProvider {

    protected final HttpClient httpClient;
    protected final ObjectMapper objectMapper;

    protected AbstractHttpSearchProvider(HttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<String> search(String query, int maxResults) {
        if (!StringUtils.hasText(query)) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (maxResults <= 0) {
            return List.of();
        }

        HttpRequest request = buildRequest(query.trim(), maxResults);
        HttpResponse<String> response = send(request);
        int statusCode = response.statusCode();
        if (statusCode == 429 || statusCode >= 500) {
            throw SearchProviderException.transientFailure(name(), "http status " + statusCode, null);
        }
        if (statusCode >= 400) {
            throw SearchProviderException.permanent(name(), "http status " + statusCode);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.body() == null ? "" : response.body());
        } catch (JsonProcessingException ex) {
            throw SearchProviderException.permanent(name(), "invalid response body: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || root.isMissingNode() || !root.isObject()) {
            throw SearchProviderException.permanent(name(), "invalid response body");
        }

        Set<String> urls = new LinkedHashSet<>();
        for (String url : extractUrls(root)) {
            if (StringUtils.hasText(url)) {
                urls.add(url.trim());
            }
            if (urls.size() >= maxResults) {
                break;
            }
        }
        log.debug("provider search completed, provider={}, query={}, size={}", name(), query, urls.size());
        return new ArrayList<>(urls);
    }

    protected abstract HttpRequest buildRequest(String query, int maxResults);

    protected abstract List<String> extractUrls(JsonNode root);

    protected HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw SearchProviderException.transientFailure(name(), "request failed: " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw SearchProviderException.permanent(name(), "request interrupted", ex);
        }
    }

    protected static URI buildUri(String baseUrl, String path, Map<String, String> params) {
        String base = baseUrl == null ? "" : baseUrl.trim();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            joiner.add(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                + "=" + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
        }
        String queryString = joiner.toString();
        return URI.create(queryString.isEmpty() ? base + path : base + path + "?" + queryString);
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

}

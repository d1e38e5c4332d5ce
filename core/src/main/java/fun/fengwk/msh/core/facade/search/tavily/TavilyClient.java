package fun.fengwk.msh.core.facade.search.tavily;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.msh.core.facade.search.SearchProviderException;
import fun.fengwk.msh.core.facade.search.support.AbstractHttpSearchProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tavily search client.
 *
 * @author fengwk
 */
@Component
public class TavilyClient extends AbstractHttpSearchProvider {

    public static final String NAME = "tavily";

    private final TavilyProperties properties;

    public TavilyClient(TavilyProperties properties,
                        @Qualifier("searchHttpClient") HttpClient httpClient,
                        ObjectMapper objectMapper) {
        super(httpClient, objectMapper);
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected HttpRequest buildRequest(String query, int maxResults) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw SearchProviderException.permanent(NAME, "api key is not configured");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("max_results", maxResults);
        payload.put("search_depth", properties.getSearchDepth());

        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw SearchProviderException.permanent(NAME, "failed to build request", ex);
        }
        return HttpRequest.newBuilder()
            .uri(buildUri(properties.getBaseUrl(), "/search", Map.of()))
            .timeout(Duration.ofMillis(properties.getTimeoutMs()))
            .header("Accept", "application/json")
            .header("Content-Type", "application/json")
            .header("Authorization", "Bearer " + properties.getApiKey().trim())
            .POST(BodyPublishers.ofString(body, StandardCharsets.UTF_8))
            .build();
    }

    @Override
    protected List<String> extractUrls(JsonNode root) {
        JsonNode results = root.path("results");
        if (!results.isArray()) {
            // older response envelope
            results = root.path("data").path("results");
        }
        List<String> urls = new ArrayList<>();
        for (JsonNode result : results) {
            String url = text(result, "url");
            if (url != null) {
                urls.add(url);
            }
        }
        return urls;
    }

}

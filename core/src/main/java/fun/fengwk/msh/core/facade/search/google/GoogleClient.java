package fun.fengwk.msh.core.facade.search.google;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.msh.core.facade.search.SearchProviderException;
import fun.fengwk.msh.core.facade.search.support.AbstractHttpSearchProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Google custom search JSON API client.
 *
 * @author fengwk
 */
@Component
public class GoogleClient extends AbstractHttpSearchProvider {

    public static final String NAME = "google";

    /**
     * The API rejects num greater than 10.
     */
    private static final int MAX_NUM = 10;

    private final GoogleProperties properties;

    public GoogleClient(GoogleProperties properties,
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
        if (!StringUtils.hasText(properties.getApiKey()) || !StringUtils.hasText(properties.getCseId())) {
            throw SearchProviderException.permanent(NAME, "api key or cse id is not configured");
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("key", properties.getApiKey().trim());
        params.put("cx", properties.getCseId().trim());
        params.put("q", query);
        params.put("num", String.valueOf(Math.min(maxResults, MAX_NUM)));
        return HttpRequest.newBuilder()
            .uri(buildUri(properties.getBaseUrl(), "/customsearch/v1", params))
            .timeout(Duration.ofMillis(properties.getTimeoutMs()))
            .header("Accept", "application/json")
            .GET()
            .build();
    }

    @Override
    protected List<String> extractUrls(JsonNode root) {
        List<String> urls = new ArrayList<>();
        for (JsonNode item : root.path("items")) {
            String link = text(item, "link");
            if (link != null) {
                urls.add(link);
            }
        }
        return urls;
    }

}

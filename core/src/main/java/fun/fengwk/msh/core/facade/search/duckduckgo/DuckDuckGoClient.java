package fun.fengwk.msh.core.facade.search.duckduckgo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.msh.core.facade.search.support.AbstractHttpSearchProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DuckDuckGo instant answer client, no credential required.
 *
 * @author fengwk
 */
@Component
public class DuckDuckGoClient extends AbstractHttpSearchProvider {

    public static final String NAME = "duckduckgo";

    private final DuckDuckGoProperties properties;

    public DuckDuckGoClient(DuckDuckGoProperties properties,
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
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", query);
        params.put("format", "json");
        params.put("no_html", "1");
        params.put("skip_disambig", "1");
        return HttpRequest.newBuilder()
            .uri(buildUri(properties.getBaseUrl(), "/", params))
            .timeout(Duration.ofMillis(properties.getTimeoutMs()))
            .header("Accept", "application/json")
            .GET()
            .build();
    }

    @Override
    protected List<String> extractUrls(JsonNode root) {
        List<String> urls = new ArrayList<>();
        collectFirstUrls(root.path("Results"), urls);
        collectFirstUrls(root.path("RelatedTopics"), urls);
        return urls;
    }

    private void collectFirstUrls(JsonNode topics, List<String> urls) {
        if (!topics.isArray()) {
            return;
        }
        for (JsonNode topic : topics) {
            String firstUrl = text(topic, "FirstURL");
            if (firstUrl != null) {
                urls.add(firstUrl);
            }
            // grouped topics nest another RelatedTopics-like array
            collectFirstUrls(topic.path("Topics"), urls);
        }
    }

}

package fun.fengwk.msh.core.facade.search.tavily;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tavily search API configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "msh.search.tavily")
public class TavilyProperties {

    private String baseUrl = "https://api.tavily.com";

    private String apiKey = "";

    private int timeoutMs = 15000;

    /**
     * basic or advanced.
     */
    private String searchDepth = "basic";

}

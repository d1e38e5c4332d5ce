package fun.fengwk.msh.core.facade.search.duckduckgo;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * DuckDuckGo instant answer API configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "msh.search.duckduckgo")
public class DuckDuckGoProperties {

    private String baseUrl = "https://api.duckduckgo.com";

    /**
     * Request timeout in milliseconds.
     */
    private int timeoutMs = 10000;

}

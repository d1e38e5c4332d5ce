package fun.fengwk.msh.core.facade.search.google;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Google custom search configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "msh.search.google")
public class GoogleProperties {

    private String baseUrl = "https://www.googleapis.com";

    private String apiKey = "";

    /**
     * Programmable search engine id (cx).
     */
    private String cseId = "";

    private int timeoutMs = 10000;

}

package fun.fengwk.msh.core.service.storage;

import fun.fengwk.msh.core.configuration.ConfigurationException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * On-disk layout roots.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "msh.directories")
public class DirectoryProperties {

    /**
     * Parent of all session directories.
     */
    private String base = "Data";

    private String searchResults = "Search_Results";

    private String scrapedResults = "Scraped_Results";

    public void validate() {
        ConfigurationException.check(StringUtils.hasText(base), "directories.base must not be blank");
        ConfigurationException.check(StringUtils.hasText(searchResults), "directories.search-results must not be blank");
        ConfigurationException.check(StringUtils.hasText(scrapedResults), "directories.scraped-results must not be blank");
    }

}

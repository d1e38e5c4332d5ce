package fun.fengwk.msh.core.service.scrape;

import fun.fengwk.msh.core.configuration.ConfigurationException;
import fun.fengwk.msh.core.service.scrape.model.ScrapeMode;
import fun.fengwk.msh.core.service.scrape.model.ScrapeToggles;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scrape orchestration configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "msh.scraping")
public class ScrapeProperties {

    /**
     * Tasks in flight at the same time.
     */
    private int maxConcurrent = 5;

    /**
     * Page navigate and render timeout in milliseconds.
     */
    private int timeoutMs = 30000;

    /**
     * Deadline of a whole task, extraction and saving included.
     */
    private long taskTimeoutMs = 60000;

    /**
     * Timeout of lightweight status checks and resource downloads.
     */
    private int probeTimeoutMs = 10000;

    private RateLimit rateLimit = new RateLimit();

    private String defaultMode = "standard";

    /**
     * Per mode toggle overrides keyed by mode value, e.g. {@code deep.max-images}.
     */
    private Map<String, ModeOverride> modes = new LinkedHashMap<>();

    /**
     * Elements captured as formula screenshots.
     */
    private String formulaSelector = "math, .math, .equation";

    public void validate() {
        ConfigurationException.check(maxConcurrent >= 1, "scraping.max-concurrent must be >= 1, actual=%s", maxConcurrent);
        ConfigurationException.check(timeoutMs > 0, "scraping.timeout-ms must be > 0, actual=%s", timeoutMs);
        ConfigurationException.check(taskTimeoutMs > 0, "scraping.task-timeout-ms must be > 0, actual=%s", taskTimeoutMs);
        ConfigurationException.check(probeTimeoutMs > 0, "scraping.probe-timeout-ms must be > 0, actual=%s", probeTimeoutMs);
        ConfigurationException.check(rateLimit.getDelayMs() >= 0,
            "scraping.rate-limit.delay-ms must be >= 0, actual=%s", rateLimit.getDelayMs());
        resolveDefaultMode();
        for (String key : modes.keySet()) {
            try {
                ScrapeMode.fromValue(key);
            } catch (IllegalArgumentException ex) {
                throw new ConfigurationException("unknown mode in scraping.modes: " + key);
            }
        }
    }

    public ScrapeMode resolveDefaultMode() {
        try {
            return ScrapeMode.fromValue(defaultMode);
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("unknown scraping.default-mode: " + defaultMode);
        }
    }

    /**
     * Mode defaults with configured overrides applied.
     */
    public ScrapeToggles resolveToggles(ScrapeMode mode) {
        ScrapeToggles.ScrapeTogglesBuilder builder = mode.getDefaults().toBuilder();
        ModeOverride override = null;
        for (Map.Entry<String, ModeOverride> entry : modes.entrySet()) {
            if (ScrapeMode.fromValue(entry.getKey()) == mode) {
                override = entry.getValue();
            }
        }
        if (override == null) {
            return builder.build();
        }
        if (override.getSaveHtml() != null) {
            builder.saveHtml(override.getSaveHtml());
        }
        if (override.getSaveText() != null) {
            builder.saveText(override.getSaveText());
        }
        if (override.getSaveImages() != null) {
            builder.saveImages(override.getSaveImages());
        }
        if (override.getSaveFormulas() != null) {
            builder.saveFormulas(override.getSaveFormulas());
        }
        if (override.getSavePdfs() != null) {
            builder.savePdfs(override.getSavePdfs());
        }
        if (override.getFollowPdfLinks() != null) {
            builder.followPdfLinks(override.getFollowPdfLinks());
        }
        if (override.getMaxImages() != null) {
            builder.maxImages(Math.max(0, override.getMaxImages()));
        }
        if (override.getMaxPdfLinks() != null) {
            builder.maxPdfLinks(Math.max(0, override.getMaxPdfLinks()));
        }
        return builder.build();
    }

    @Data
    public static class RateLimit {

        /**
         * Minimum gap between task starts, 0 disables it.
         */
        private long delayMs = 1000;

    }

    @Data
    public static class ModeOverride {

        private Boolean saveHtml;
        private Boolean saveText;
        private Boolean saveImages;
        private Boolean saveFormulas;
        private Boolean savePdfs;
        private Boolean followPdfLinks;
        private Integer maxImages;
        private Integer maxPdfLinks;

    }

}

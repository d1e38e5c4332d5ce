package fun.fengwk.msh.core.service.browser;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Headless browser configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "msh.browser")
public class BrowserProperties {

    /**
     * Workers kept alive when idle, 0 scales to zero.
     */
    private int workerPoolMinSize = 0;

    /**
     * Upper bound of browser workers, each owning one browser process.
     */
    private int workerPoolMaxSize = 5;

    /**
     * Pending task queue capacity.
     */
    private int requestQueueCapacity = 64;

    /**
     * Time a submit waits for queue space before failing with busy.
     */
    private int queueOfferTimeoutMs = 15000;

    /**
     * Idle time after which a worker above the minimum retires, 0 keeps workers forever.
     */
    private long workerIdleTtlMs = 60000;

    /**
     * Worker queue poll interval.
     */
    private long workerRefreshIntervalMs = 1000;

    /**
     * Tasks a browser serves before its worker relaunches it, 0 never recycles.
     */
    private int browserRecycleAfterTasks = 200;

    private boolean headless = true;

    /**
     * Fixed user agent, wins over {@link #userAgents} when set.
     */
    private String userAgent = "";

    /**
     * User agents rotated per browser context.
     */
    private List<String> userAgents = List.of(
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36"
    );

    private String acceptLanguage = "en-US,en;q=0.5";

    private String locale = "";

    private String timezoneId = "";

    private Map<String, String> extraHeaders = Map.of();

    /**
     * e.g. http://127.0.0.1:7890, blank disables the proxy.
     */
    private String proxyServer = "";

    private String proxyUsername = "";

    private String proxyPassword = "";

    private String browserChannel = "";

    private String executablePath = "";

    private List<String> launchArgs = List.of();

    private List<String> ignoreDefaultArgs = List.of("--enable-automation");

    public String pickUserAgent() {
        if (StringUtils.hasText(userAgent)) {
            return userAgent.trim();
        }
        if (userAgents == null || userAgents.isEmpty()) {
            return "";
        }
        return userAgents.get(ThreadLocalRandom.current().nextInt(userAgents.size()));
    }

}

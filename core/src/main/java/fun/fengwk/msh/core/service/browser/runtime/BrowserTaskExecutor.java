package fun.fengwk.msh.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.options.Proxy;
import fun.fengwk.msh.core.service.browser.BrowserProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs browser tasks in a fresh, isolated browser context on a pooled worker.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class BrowserTaskExecutor {

    private final BrowserProperties browserProperties;
    private final BrowserWorkerManager browserWorkerManager;

    public <T> CompletableFuture<T> submit(BrowserTask<T> task, BrowserTaskSignal signal) {
        return browserWorkerManager.submit(browser -> doExecute(browser, task, signal));
    }

    private <T> T doExecute(Browser browser, BrowserTask<T> task, BrowserTaskSignal signal) throws Exception {
        signal.throwIfCancelled();
        signal.markStarted();
        try (BrowserContext context = browser.newContext(buildContextOptions())) {
            Page page = context.newPage();
            BrowserRuntimeContext runtimeContext = BrowserRuntimeContext.builder()
                .browserContext(context)
                .page(page)
                .signal(signal)
                .build();
            return task.execute(runtimeContext);
        }
    }

    Browser.NewContextOptions buildContextOptions() {
        Browser.NewContextOptions options = new Browser.NewContextOptions();
        String userAgent = browserProperties.pickUserAgent();
        if (StringUtils.hasText(userAgent)) {
            options.setUserAgent(userAgent);
        }
        if (StringUtils.hasText(browserProperties.getLocale())) {
            options.setLocale(browserProperties.getLocale());
        }
        if (StringUtils.hasText(browserProperties.getTimezoneId())) {
            options.setTimezoneId(browserProperties.getTimezoneId());
        }

        Map<String, String> headers = new LinkedHashMap<>();
        if (browserProperties.getExtraHeaders() != null) {
            headers.putAll(browserProperties.getExtraHeaders());
        }
        if (StringUtils.hasText(browserProperties.getAcceptLanguage())) {
            headers.putIfAbsent("Accept-Language", browserProperties.getAcceptLanguage());
        }
        if (!headers.isEmpty()) {
            options.setExtraHTTPHeaders(headers);
        }

        if (StringUtils.hasText(browserProperties.getProxyServer())) {
            Proxy proxy = new Proxy(browserProperties.getProxyServer());
            if (StringUtils.hasText(browserProperties.getProxyUsername())) {
                proxy.setUsername(browserProperties.getProxyUsername());
                proxy.setPassword(browserProperties.getProxyPassword());
            }
            options.setProxy(proxy);
        }
        return options;
    }

}

package fun.fengwk.msh.core.service.scrape.support;

import com.microsoft.playwright.APIResponse;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.options.RequestOptions;
import lombok.extern.slf4j.Slf4j;

/**
 * Downloads resources through the page's request context, sharing its cookies and proxy.
 *
 * @author fengwk
 */
@Slf4j
public final class PageResourceFetcher {

    private static final int MAX_REDIRECTS = 5;

    private PageResourceFetcher() {
    }

    /**
     * GET a resource. The body is only read for successful responses.
     */
    public static PageResource get(Page page, String url, int timeoutMs) {
        APIResponse response = null;
        try {
            response = page.request().get(
                url,
                RequestOptions.create()
                    .setTimeout(timeoutMs)
                    .setMaxRedirects(MAX_REDIRECTS)
            );
            int status = response.status();
            String mime = ScrapeMediaUtils.resolveMime(response.headers());
            byte[] body = status < 400 ? response.body() : null;
            return new PageResource(status, mime, body);
        } finally {
            if (response != null) {
                try {
                    response.dispose();
                } catch (Exception ex) {
                    log.debug("dispose api response failed, url={}, error={}", url, ex.getMessage());
                }
            }
        }
    }

    public record PageResource(int status, String mime, byte[] body) {

        public boolean hasBody() {
            return body != null && body.length > 0;
        }

    }

}

package fun.fengwk.msh.core.service.browser.runtime;

import com.microsoft.playwright.Browser;

/**
 * Task executed with a worker's browser instance.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface BrowserSessionTask<T> {

    T execute(Browser browser) throws Exception;

}

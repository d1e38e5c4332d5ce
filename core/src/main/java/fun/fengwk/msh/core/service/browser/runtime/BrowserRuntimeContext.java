package fun.fengwk.msh.core.service.browser.runtime;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import lombok.Builder;
import lombok.Data;

/**
 * Runtime context passed to browser tasks.
 *
 * @author fengwk
 */
@Data
@Builder
public class BrowserRuntimeContext {

    private BrowserContext browserContext;
    private Page page;
    private BrowserTaskSignal signal;

    /**
     * Stop the task if its submitter gave up on it.
     */
    public void checkpoint() {
        if (signal != null) {
            signal.throwIfCancelled();
        }
    }

}

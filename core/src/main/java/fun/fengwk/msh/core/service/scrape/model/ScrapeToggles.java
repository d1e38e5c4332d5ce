package fun.fengwk.msh.core.service.scrape.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What a full extraction saves.
 *
 * @author fengwk
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScrapeToggles {

    private boolean saveHtml;
    private boolean saveText;
    private boolean saveImages;
    private boolean saveFormulas;
    private boolean savePdfs;

    /**
     * Download pdfs linked from the page.
     */
    private boolean followPdfLinks;

    private int maxImages;
    private int maxPdfLinks;

}

package fun.fengwk.msh.core.facade.search.model;

import lombok.Builder;
import lombok.Data;

/**
 * @author fengwk
 */
@Data
@Builder
public class ProviderReport {

    private String provider;
    private ProviderStatus status;
    private int attempts;
    private int resultCount;
    private String error;

}

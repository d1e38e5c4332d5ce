package fun.fengwk.msh.core.service.rank;

import fun.fengwk.msh.core.configuration.ConfigurationException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * BM25 term weighting constants.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "msh.bm25")
public class Bm25Properties {

    /**
     * Term frequency saturation.
     */
    private double k1 = 1.2;

    /**
     * Document length normalization, 0 disables it.
     */
    private double b = 0.75;

    public void validate() {
        ConfigurationException.check(k1 > 0, "bm25.k1 must be > 0, actual=%s", k1);
        ConfigurationException.check(b >= 0 && b <= 1, "bm25.b must be within [0, 1], actual=%s", b);
    }

}

package fun.fengwk.msh.core.service.validation;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Candidate url admission rules.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "msh.url-validation")
public class UrlValidationProperties {

    /**
     * When non-empty only these hosts pass. Entries are exact hosts or {@code *.suffix} patterns.
     */
    private List<String> allowedDomains = new ArrayList<>();

    /**
     * Rejected hosts, same pattern syntax as {@link #allowedDomains}.
     */
    private List<String> blockedDomains = new ArrayList<>();

    /**
     * Rejected path extensions, leading dot optional.
     */
    private List<String> blockedExtensions = new ArrayList<>(List.of(".exe", ".zip", ".rar"));

    /**
     * Whether urls carrying user info (user:password@host) are admitted.
     */
    private boolean allowAuthRequired = false;

}

package fun.fengwk.msh.core.service.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Persisted search results file.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResultsRecord {

    private String query;
    private List<String> urls;

    /**
     * ISO-8601 instant.
     */
    private String timestamp;

    private Map<String, Object> metadata;

}

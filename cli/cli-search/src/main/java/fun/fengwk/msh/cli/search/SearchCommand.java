package fun.fengwk.msh.cli.search;

import fun.fengwk.msh.core.report.ReportFormatter;
import fun.fengwk.msh.core.service.pipeline.SearchPipelineService;
import fun.fengwk.msh.core.service.pipeline.model.PipelineReport;
import fun.fengwk.msh.core.service.scrape.model.ScrapeMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Runs one search for {@code --query=...}, optionally with {@code --mode=standard|deep|text_only},
 * and prints the report.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SearchCommand implements ApplicationRunner {

    static final String QUERY_OPTION = "query";
    static final String MODE_OPTION = "mode";

    private final SearchPipelineService searchPipelineService;
    private final ReportFormatter reportFormatter;

    @Override
    public void run(ApplicationArguments args) {
        String query = firstOption(args, QUERY_OPTION);
        if (!StringUtils.hasText(query)) {
            List<String> nonOptionArgs = args.getNonOptionArgs();
            query = nonOptionArgs.isEmpty() ? null : String.join(" ", nonOptionArgs);
        }
        if (!StringUtils.hasText(query)) {
            log.info("no query given, usage: --query=<text> [--mode=standard|deep|text_only]");
            return;
        }

        ScrapeMode mode = null;
        String modeValue = firstOption(args, MODE_OPTION);
        if (StringUtils.hasText(modeValue)) {
            try {
                mode = ScrapeMode.fromValue(modeValue);
            } catch (IllegalArgumentException ex) {
                log.warn("unknown mode, mode={}, usage: --mode=standard|deep|text_only", modeValue);
                return;
            }
        }

        PipelineReport report = searchPipelineService.run(query.trim(), mode);
        System.out.println(reportFormatter.formatPipelineReport(report));
    }

    private static String firstOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

}

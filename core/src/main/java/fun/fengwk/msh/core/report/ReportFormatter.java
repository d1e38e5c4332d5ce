package fun.fengwk.msh.core.report;

import freemarker.template.Template;
import freemarker.template.TemplateException;
import fun.fengwk.msh.core.service.pipeline.model.PipelineReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

/**
 * Renders reports with the templates under {@code /report/templates/}.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ReportFormatter {

    public static final String PIPELINE_REPORT_TEMPLATE = "pipeline_report.ftl";

    private final freemarker.template.Configuration reportTemplateConfiguration;

    public ReportFormatter(@Qualifier("reportTemplateConfiguration") freemarker.template.Configuration reportTemplateConfiguration) {
        this.reportTemplateConfiguration = reportTemplateConfiguration;
    }

    public String formatPipelineReport(PipelineReport report) {
        return format(PIPELINE_REPORT_TEMPLATE, report);
    }

    public String format(String templateName, Object model) {
        if (model == null) {
            return "empty report";
        }
        StringWriter result = new StringWriter(1024);
        try {
            Template template = reportTemplateConfiguration.getTemplate(templateName);
            Object root = model instanceof Map ? model : Map.of("data", model);
            template.process(root, result);
            return result.toString();
        } catch (IOException | TemplateException e) {
            log.warn("report format failed, template={}, error={}", templateName, e.getMessage());
            return "format error: " + e.getMessage();
        }
    }

}

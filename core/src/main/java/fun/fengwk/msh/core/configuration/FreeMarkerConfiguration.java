package fun.fengwk.msh.core.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.ClassUtils;

import java.util.Locale;

/**
 * @author fengwk
 */
@Configuration
public class FreeMarkerConfiguration {

    @Bean(name = "reportTemplateConfiguration")
    public freemarker.template.Configuration reportTemplateConfiguration() {
        freemarker.template.Configuration cfg = new freemarker.template.Configuration(
            freemarker.template.Configuration.VERSION_2_3_33);
        cfg.setClassLoaderForTemplateLoading(ClassUtils.getDefaultClassLoader(), "/report/templates/");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setNumberFormat("computer");
        cfg.setLocale(Locale.ROOT);
        return cfg;
    }

}

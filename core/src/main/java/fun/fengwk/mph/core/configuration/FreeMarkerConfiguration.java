package fun.fengwk.mph.core.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.ClassUtils;

import java.util.Locale;

/**
 * @author fengwk
 */
@Configuration
public class FreeMarkerConfiguration {

    @Bean(name = "mcpTemplateConfiguration")
    public freemarker.template.Configuration mcpTemplateConfiguration() {
        freemarker.template.Configuration cfg = new freemarker.template.Configuration(
            freemarker.template.Configuration.VERSION_2_3_34);
        cfg.setClassLoaderForTemplateLoading(ClassUtils.getDefaultClassLoader(), "/mcp/templates/");
        cfg.setDefaultEncoding("UTF-8");
        // Prices and scores are rendered with a dot decimal separator.
        cfg.setLocale(Locale.ROOT);
        return cfg;
    }

}

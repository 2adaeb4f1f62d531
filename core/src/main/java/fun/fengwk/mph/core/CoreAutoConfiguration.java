package fun.fengwk.mph.core;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.context.annotation.ComponentScan;

/**
 * @author fengwk
 */
@AutoConfiguration
@ComponentScan
public class CoreAutoConfiguration {
}

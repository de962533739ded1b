package fun.fengwk.rp.core.service.plain;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Plain content defaults.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "rp.plain")
public class PlainContentProperties {

    /**
     * Attach a content digest to every element.
     */
    private boolean contentDigests = false;

    /**
     * Attach a hierarchical node index to every element.
     */
    private boolean nodeIndexes = false;

}

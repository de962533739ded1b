package fun.fengwk.rp.core.service.plain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Per call switches, null values fall back to the configured defaults.
 *
 * @author fengwk
 */
@Data
@Builder
public class PlainContentOptions {

    private Boolean contentDigests;
    private Boolean nodeIndexes;

}

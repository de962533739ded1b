package fun.fengwk.rp.core.service.plain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One block of a flat text listing.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TextBlock {

    /**
     * Index copied from the block element, null when the element was not indexed.
     */
    private String nodeIndex;

    private String text;

}

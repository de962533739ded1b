package fun.fengwk.rp.core.service.plain.model;

/**
 * Sub-kinds of text nodes.
 *
 * @author fengwk
 */
public enum TextKind {

    /**
     * Printable character data.
     */
    PLAIN(true),

    /**
     * Markup comment, never visible.
     */
    COMMENT(false),

    /**
     * CDATA section, never visible.
     */
    CDATA(false);

    private final boolean printing;

    TextKind(boolean printing) {
        this.printing = printing;
    }

    public boolean isPrinting() {
        return printing;
    }

}

package co.fanki.codegraph.analysis.domain;

/**
 * What kind of expression inside a try block can reach its catch.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum CatchSourceType {

    AWAITED_CALL("awaited_call"),
    SYNC_CALL("sync_call"),
    THROW_STATEMENT("throw_statement"),
    CONSTRUCTOR_CALL("constructor_call");

    private final String label;

    CatchSourceType(final String theLabel) {
        label = theLabel;
    }

    public String label() {
        return label;
    }

}

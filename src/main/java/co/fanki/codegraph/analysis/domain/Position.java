package co.fanki.codegraph.analysis.domain;

import org.treesitter.TSNode;

/**
 * A 1-based line and 0-based column. Nodes without position information
 * map to {@link #UNKNOWN}.
 *
 * @param line the 1-based line, 0 when unknown
 * @param column the 0-based column
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
record Position(int line, int column) {

    static final Position UNKNOWN = new Position(0, 0);

    static Position of(final TSNode node) {
        if (node == null || node.isNull() || node.getStartPoint() == null) {
            return UNKNOWN;
        }
        return new Position(node.getStartPoint().getRow() + 1,
                node.getStartPoint().getColumn());
    }

}

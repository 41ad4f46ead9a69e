package co.fanki.codegraph.analysis.domain;

import java.util.List;

/**
 * The exception sources a catch clause can receive: the calls, throws and
 * constructor calls written directly in its try block, excluding nested
 * try blocks and nested functions.
 *
 * @param catchBlockId the CATCH_BLOCK node id
 * @param parameterName the catch parameter, or null
 * @param sources the sources, in source order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CatchesFromInfo(String catchBlockId, String parameterName,
        List<Source> sources) {

    public CatchesFromInfo {
        sources = List.copyOf(sources);
    }

    /**
     * One exception source.
     *
     * @param sourceId the node id of the call, throw or constructor call
     * @param type the kind of source
     * @param line the line of the source
     */
    public record Source(String sourceId, CatchSourceType type, int line) {
    }

}

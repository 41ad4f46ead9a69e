package co.fanki.codegraph.analysis.domain;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;

/**
 * The UTF-8 bytes of a parsed file. Tree-sitter reports byte offsets, so
 * node text is sliced from the bytes, not from the Java string.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class SourceText {

    private final byte[] bytes;

    SourceText(final String content) {
        bytes = content.getBytes(StandardCharsets.UTF_8);
    }

    String of(final TSNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        final int start = Math.max(0, node.getStartByte());
        final int end = Math.min(bytes.length, node.getEndByte());
        if (end <= start) {
            return "";
        }
        return new String(bytes, start, end - start, StandardCharsets.UTF_8);
    }

}

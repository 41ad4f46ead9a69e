package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterTypescript;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Analyzes one JavaScript or TypeScript file in a single pass over its
 * tree-sitter syntax tree.
 *
 * <p>The analyzer holds no state between files and can be called from
 * several threads at once; each call gets its own parser. A file that does
 * not parse cleanly fails as a whole with a {@link SourceParseException}
 * and produces nothing.</p>
 *
 * <p>The TypeScript grammar is used for every supported extension: it
 * accepts plain ECMAScript modules as well.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class JsSourceAnalyzer {

    private static final Logger LOG =
            LoggerFactory.getLogger(JsSourceAnalyzer.class);

    /**
     * Analyzes a file that imports nothing from the project.
     *
     * @param source the file, never null
     * @return the collections of the file
     * @throws SourceParseException if the file does not parse
     */
    public ModuleCollections analyze(final SourceFile source) {
        return analyze(source, ImportResolver.isolated());
    }

    /**
     * Analyzes a file, resolving its relative imports against the files of
     * the current batch.
     *
     * @param source the file, never null
     * @param resolver the import resolver, never null
     * @return the collections of the file
     * @throws SourceParseException if the file does not parse
     */
    public ModuleCollections analyze(final SourceFile source,
            final ImportResolver resolver) {
        Preconditions.requireNonNull(source, "Source file is required");
        Preconditions.requireNonNull(resolver, "Import resolver is required");

        final TSParser parser = new TSParser();
        parser.setLanguage(new TreeSitterTypescript());
        final TSTree tree = parser.parseString(null, source.content());
        final TSNode root = tree == null ? null : tree.getRootNode();
        if (root == null || root.isNull()) {
            throw new SourceParseException(source.path(),
                    "parser produced no syntax tree");
        }
        if (root.hasError()) {
            final Position error = Position.of(firstError(root));
            throw new SourceParseException(source.path(),
                    "syntax error at line " + error.line() + ", column "
                            + error.column());
        }

        final ModuleCollections collections = new FileTraversal(source,
                resolver).run(root, lineCount(source.content()));
        LOG.debug("Analyzed {}: {} nodes, {} call sites, {} rejection"
                + " patterns", source.path(), collections.nodes().size() + 1,
                collections.callSites().size(),
                collections.rejectionPatterns().size());
        return collections;
    }

    private static TSNode firstError(final TSNode root) {
        final Deque<TSNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            final TSNode node = pending.pop();
            if ("ERROR".equals(node.getType())) {
                return node;
            }
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                pending.push(node.getChild(i));
            }
        }
        return root;
    }

    private static int lineCount(final String content) {
        if (content.isEmpty()) {
            return 0;
        }
        int lines = 1;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                lines++;
            }
        }
        return lines;
    }

}

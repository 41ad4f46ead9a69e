package co.fanki.codegraph.analysis.domain;

import co.fanki.codegraph.graph.domain.GraphNode;

/**
 * A node created while analyzing a file, with the id of its structural
 * parent.
 *
 * @param node the node
 * @param parentId the module, class, function or try block containing it
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ContainedNode(GraphNode node, String parentId) {
}

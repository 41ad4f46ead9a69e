package co.fanki.codegraph.analysis.domain;

/**
 * A class declared in the analyzed file.
 *
 * @param classId the class node id
 * @param name the class name
 * @param superClassName the extends clause as written, or null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ClassDeclarationInfo(String classId, String name,
        String superClassName) {
}

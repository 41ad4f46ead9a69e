package co.fanki.codegraph.analysis.domain;

/**
 * A local binding introduced by an import statement.
 *
 * @param importId the IMPORT node id
 * @param localName the name used in this file
 * @param importedName the exported name, "default" or "*"
 * @param source the specifier as written
 * @param resolvedFile the project file it resolves to, null when external
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ImportInfo(String importId, String localName,
        String importedName, String source, String resolvedFile) {

    public boolean isNamed() {
        return !"default".equals(importedName) && !"*".equals(importedName);
    }

}

package org.dxworks.lintframe.registry;

/**
 * A class found in a model directory, with the table overrides declared in its own body.
 */
public class ModelDeclaration {
    public final String fqcn;
    public final String shortName;
    /** Parent as written, resolved against the file's namespace and imports; null without {@code extends}. */
    public final String parent;
    public final String file;
    public String tableProperty;
    public boolean tablePropertyDynamic;
    public String getTableLiteral;
    public boolean getTableDynamic;

    public ModelDeclaration(String fqcn, String shortName, String parent, String file) {
        this.fqcn = fqcn;
        this.shortName = shortName;
        this.parent = parent;
        this.file = file;
    }

    public boolean declaresTable() {
        return tableProperty != null || tablePropertyDynamic || getTableLiteral != null || getTableDynamic;
    }
}

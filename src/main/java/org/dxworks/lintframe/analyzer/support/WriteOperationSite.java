package org.dxworks.lintframe.analyzer.support;

import org.dxworks.lintframe.syntax.SyntaxNode;

public class WriteOperationSite {
    public final int line;
    public final String operation;
    public final boolean protectedByTransaction;
    public final SyntaxNode node;

    public WriteOperationSite(int line, String operation, boolean protectedByTransaction, SyntaxNode node) {
        this.line = line;
        this.operation = operation;
        this.protectedByTransaction = protectedByTransaction;
        this.node = node;
    }

    @Override
    public String toString() {
        return operation + "@" + line + (protectedByTransaction ? " (protected)" : "");
    }
}

package org.dxworks.lintframe.scope;

public enum ScopeKind {
    FILE,
    NAMESPACE,
    CLASS,
    ANONYMOUS_CLASS,
    METHOD,
    CLOSURE;

    public boolean ownsBindings() {
        return this == METHOD || this == CLOSURE;
    }

    public boolean isClass() {
        return this == CLASS || this == ANONYMOUS_CLASS;
    }
}

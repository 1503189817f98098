package org.dxworks.lintframe.scope;

import java.util.Optional;

/**
 * Parent lookup for classes declared outside the file being walked.
 */
public interface ClassHierarchy {

    ClassHierarchy EMPTY = fqcn -> Optional.empty();

    Optional<String> parentOf(String fqcn);
}

package org.cnext.compiler.frontend.headers;

import org.cnext.compiler.frontend.semantics.SourceLanguage;

/**
 * Collects symbols from C headers.
 */
public class CHeaderCollector extends AbstractHeaderCollector {

    @Override
    protected SourceLanguage language() {
        return SourceLanguage.C;
    }
}

package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppLanguageElement;

/**
 * Generates a declaration, e.g. {@code int GetItem();}.
 */
public abstract class CppDeclaration<E extends CppLanguageElement> extends CppCodeGenerator<E> {

    protected CppDeclaration(E element, RenderOptions options) {
        super(element, options);
    }
}

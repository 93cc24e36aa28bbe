package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppLanguageElement;

/**
 * Generates a definition, e.g. {@code int Foo::GetItem() { ... }}.
 */
public abstract class CppDefinition<E extends CppLanguageElement> extends CppCodeGenerator<E> {

    protected CppDefinition(E element, RenderOptions options) {
        super(element, options);
    }
}

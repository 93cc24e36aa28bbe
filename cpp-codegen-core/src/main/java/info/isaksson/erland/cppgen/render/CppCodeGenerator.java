package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppLanguageElement;
import info.isaksson.erland.cppgen.style.Indentation;

import java.util.Objects;

/**
 * Renders C++ text for one language element.
 *
 * <p>Generators are cheap and single use; each render call creates its own indentation and
 * brace strategies, so rendering the same element twice yields the same text.</p>
 */
public abstract class CppCodeGenerator<E extends CppLanguageElement> {

    protected final E element;
    protected final RenderOptions options;

    protected CppCodeGenerator(E element, RenderOptions options) {
        this.element = Objects.requireNonNull(element, "element must not be null");
        this.options = options == null ? RenderOptions.defaults() : options;
    }

    public E element() {
        return element;
    }

    /** Renders starting from the given indentation, which is shared with nested renderers. */
    public abstract String code(Indentation indentation);

    public String code() {
        return code(options.newIndentation());
    }

    /** Documentation without the code. */
    public String docs() {
        return options.docsStyle.attach(element, null);
    }

    public String codeWithDocs() {
        return options.docsStyle.attach(element, code());
    }

    protected Indentation orNew(Indentation indentation) {
        return indentation == null ? options.newIndentation() : indentation;
    }
}

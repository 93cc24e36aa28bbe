package info.isaksson.erland.cppgen.file;

import info.isaksson.erland.cppgen.model.CppEnum;
import info.isaksson.erland.cppgen.model.CppLanguageElement;
import info.isaksson.erland.cppgen.render.CppRenderer;
import info.isaksson.erland.cppgen.render.RenderOptions;

/**
 * Source text: includes, then the definitions of the added elements. A class contributes the
 * definitions of its static data and functions; classes with nothing to define and enums are
 * skipped.
 */
public final class SourceFile extends CppFile {

    public SourceFile(String fileName) {
        super(fileName);
    }

    /** Includes the given header locally. */
    public SourceFile includeLocal(HeaderFile header) {
        super.includeLocal(header.fileName);
        return this;
    }

    @Override
    protected String renderElement(CppLanguageElement element, RenderOptions options) {
        if (element instanceof CppEnum) return "";
        return CppRenderer.definition(element, options);
    }

    @Override
    public String render(RenderOptions options) {
        return renderBody(options);
    }

    @Override
    public SourceFile include(String header) {
        super.include(header);
        return this;
    }

    @Override
    public SourceFile includeLocal(String header) {
        super.includeLocal(header);
        return this;
    }

    @Override
    public SourceFile add(CppLanguageElement element) {
        super.add(element);
        return this;
    }

    @Override
    public SourceFile addRaw(String text) {
        super.addRaw(text);
        return this;
    }
}

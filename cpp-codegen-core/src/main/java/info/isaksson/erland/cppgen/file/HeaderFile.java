package info.isaksson.erland.cppgen.file;

import info.isaksson.erland.cppgen.model.CppLanguageElement;
import info.isaksson.erland.cppgen.render.CppRenderer;
import info.isaksson.erland.cppgen.render.RenderOptions;

import java.util.Locale;

/**
 * Header text: optional include guard, includes, then the declarations of the added elements.
 */
public final class HeaderFile extends CppFile {

    private String guard;

    public HeaderFile(String fileName) {
        super(fileName);
    }

    public HeaderFile guard(String guard) {
        this.guard = guard;
        return this;
    }

    public String getGuard() {
        return guard;
    }

    /** Guard symbol derived from a file name, e.g. {@code "config.h"} becomes {@code CONFIG_H}. */
    public static String guardFor(String fileName) {
        return fileName.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_");
    }

    @Override
    protected String renderElement(CppLanguageElement element, RenderOptions options) {
        return CppRenderer.declarationWithDocs(element, options);
    }

    @Override
    public String render(RenderOptions options) {
        String body = renderBody(options);
        if (guard == null || guard.isBlank()) return body;
        StringBuilder sb = new StringBuilder();
        sb.append("#ifndef ").append(guard).append('\n');
        sb.append("#define ").append(guard).append('\n');
        if (!body.isEmpty()) sb.append('\n').append(body).append('\n');
        sb.append("#endif\n");
        return sb.toString();
    }

    @Override
    public HeaderFile include(String header) {
        super.include(header);
        return this;
    }

    @Override
    public HeaderFile includeLocal(String header) {
        super.includeLocal(header);
        return this;
    }

    @Override
    public HeaderFile add(CppLanguageElement element) {
        super.add(element);
        return this;
    }

    @Override
    public HeaderFile addRaw(String text) {
        super.addRaw(text);
        return this;
    }
}

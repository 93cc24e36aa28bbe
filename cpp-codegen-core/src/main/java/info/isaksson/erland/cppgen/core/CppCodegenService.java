package info.isaksson.erland.cppgen.core;

import info.isaksson.erland.cppgen.file.HeaderFile;
import info.isaksson.erland.cppgen.file.SourceFile;
import info.isaksson.erland.cppgen.model.CppLanguageElement;
import info.isaksson.erland.cppgen.render.RenderOptions;

import java.util.List;

/**
 * Programmatic API for generating a header/source pair from language elements.
 *
 * <p>The CLI should use this class instead of assembling the files itself.</p>
 */
public final class CppCodegenService {

    /**
     * Declarations of {@code elements} go to {@code <baseName>.h}, their definitions to
     * {@code <baseName>.cpp}, which includes the header.
     */
    public CppCodegenResult generate(String baseName, List<? extends CppLanguageElement> elements, CppCodegenOptions options) {
        if (baseName == null || baseName.isBlank()) throw new IllegalArgumentException("baseName must not be blank");
        if (elements == null) throw new IllegalArgumentException("elements must not be null");
        if (options == null) options = new CppCodegenOptions();

        RenderOptions renderOptions = options.toRenderOptions();

        HeaderFile header = new HeaderFile(baseName + ".h");
        if (options.includeGuard) {
            header.guard(HeaderFile.guardFor(header.fileName));
        }
        for (String inc : options.headerIncludes) {
            header.include(inc);
        }

        SourceFile source = new SourceFile(baseName + ".cpp");
        source.includeLocal(header);
        for (String inc : options.sourceIncludes) {
            source.include(inc);
        }

        for (CppLanguageElement e : elements) {
            header.add(e);
            source.add(e);
        }

        return new CppCodegenResult(header, header.render(renderOptions), source, source.render(renderOptions));
    }
}

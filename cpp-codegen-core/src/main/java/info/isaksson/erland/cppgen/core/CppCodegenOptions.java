package info.isaksson.erland.cppgen.core;

import info.isaksson.erland.cppgen.render.CppStandard;
import info.isaksson.erland.cppgen.render.RenderOptions;
import info.isaksson.erland.cppgen.style.BraceStyle;
import info.isaksson.erland.cppgen.style.DocsStyle;
import info.isaksson.erland.cppgen.style.Indentation;

import java.util.ArrayList;
import java.util.List;

/**
 * Options for generating a header/source pair.
 *
 * <p>Mirrors the CLI flags in a structured form.</p>
 */
public final class CppCodegenOptions {
    public CppStandard cppStandard = CppStandard.CPP_11;
    public BraceStyle braceStyle = BraceStyle.KNR;
    public DocsStyle docsStyle = DocsStyle.ABOVE;
    public String indentUnit = Indentation.TAB;

    /** Whether the header gets an include guard derived from its file name. */
    public boolean includeGuard = true;

    /** System headers ({@code <...>}) included by the generated header. */
    public List<String> headerIncludes = new ArrayList<>();

    /** System headers included by the generated source, after its own header. */
    public List<String> sourceIncludes = new ArrayList<>();

    public RenderOptions toRenderOptions() {
        return new RenderOptions(cppStandard, braceStyle, docsStyle, indentUnit);
    }
}

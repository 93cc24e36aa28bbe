package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.style.BraceStyle;
import info.isaksson.erland.cppgen.style.DocsStyle;
import info.isaksson.erland.cppgen.style.Indentation;

/** Formatting policy for one render call. */
public final class RenderOptions {

    public final CppStandard cppStandard;
    public final BraceStyle braceStyle;
    public final DocsStyle docsStyle;

    /** Whitespace written once per indentation level. */
    public final String indentUnit;

    public RenderOptions(CppStandard cppStandard, BraceStyle braceStyle, DocsStyle docsStyle, String indentUnit) {
        this.cppStandard = cppStandard == null ? CppStandard.CPP_11 : cppStandard;
        this.braceStyle = braceStyle == null ? BraceStyle.KNR : braceStyle;
        this.docsStyle = docsStyle == null ? DocsStyle.ABOVE : docsStyle;
        this.indentUnit = (indentUnit == null || indentUnit.isEmpty()) ? Indentation.TAB : indentUnit;
    }

    public static RenderOptions defaults() {
        return new RenderOptions(CppStandard.CPP_11, BraceStyle.KNR, DocsStyle.ABOVE, Indentation.TAB);
    }

    public RenderOptions withCppStandard(CppStandard standard) {
        return new RenderOptions(standard, braceStyle, docsStyle, indentUnit);
    }

    public RenderOptions withBraceStyle(BraceStyle style) {
        return new RenderOptions(cppStandard, style, docsStyle, indentUnit);
    }

    public RenderOptions withDocsStyle(DocsStyle style) {
        return new RenderOptions(cppStandard, braceStyle, style, indentUnit);
    }

    public RenderOptions withIndentUnit(String unit) {
        return new RenderOptions(cppStandard, braceStyle, docsStyle, unit);
    }

    /** Fresh indentation at level zero using this unit. */
    public Indentation newIndentation() {
        return new Indentation(0, indentUnit);
    }

    @Override
    public String toString() {
        return "RenderOptions{" +
                "cppStandard=" + cppStandard +
                ", braceStyle=" + braceStyle +
                ", docsStyle=" + docsStyle +
                ", indentUnit='" + indentUnit.replace("\t", "\\t") + '\'' +
                '}';
    }
}

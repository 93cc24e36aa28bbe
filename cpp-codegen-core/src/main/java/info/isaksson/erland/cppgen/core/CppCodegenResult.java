package info.isaksson.erland.cppgen.core;

import info.isaksson.erland.cppgen.file.HeaderFile;
import info.isaksson.erland.cppgen.file.SourceFile;

/** Generated header/source pair. */
public final class CppCodegenResult {
    public final HeaderFile header;
    public final SourceFile source;

    public final String headerText;
    public final String sourceText;

    CppCodegenResult(HeaderFile header, String headerText, SourceFile source, String sourceText) {
        this.header = header;
        this.headerText = headerText;
        this.source = source;
        this.sourceText = sourceText;
    }
}

package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppStruct;

public class StructDeclaration extends ClassDeclaration {

    public StructDeclaration(CppStruct element, RenderOptions options) {
        super(element, options);
    }

    @Override
    protected String keyword() {
        return "struct";
    }
}

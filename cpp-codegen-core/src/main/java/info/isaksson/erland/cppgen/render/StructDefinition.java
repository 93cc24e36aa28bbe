package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppStruct;

public class StructDefinition extends ClassDefinition {

    public StructDefinition(CppStruct element, RenderOptions options) {
        super(element, options);
    }
}

package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppStruct;

public class StructArrayInitializer extends ClassArrayInitializer {

    public StructArrayInitializer(CppStruct element, RenderOptions options) {
        super(element, options);
    }
}

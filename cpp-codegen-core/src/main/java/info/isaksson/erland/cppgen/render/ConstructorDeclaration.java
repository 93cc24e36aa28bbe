package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppFunction;

/** Constructor declaration: a function declaration without return type. */
public class ConstructorDeclaration extends FunctionDeclaration {

    public ConstructorDeclaration(CppFunction element, RenderOptions options) {
        super(element, options);
    }

    @Override
    protected String returnType() {
        return null;
    }
}

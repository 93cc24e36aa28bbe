package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppArray;
import info.isaksson.erland.cppgen.model.CppVariable;

/** Picks the initializer-list renderer for a member variable. */
public final class ConstructorInitializerFactory {

    private final RenderOptions options;

    public ConstructorInitializerFactory(RenderOptions options) {
        this.options = options;
    }

    public CppDefinition<? extends CppVariable> build(CppVariable variable) {
        if (variable instanceof CppArray) {
            return new ArrayConstructorDefinition((CppArray) variable, options);
        }
        return new VariableConstructorDefinition(variable, options);
    }
}

package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppVariable;
import info.isaksson.erland.cppgen.style.Indentation;

/** Entry of a constructor initializer list, e.g. {@code my_var(0)}. Qualifiers are ignored. */
public class VariableConstructorDefinition extends CppDefinition<CppVariable> {

    public VariableConstructorDefinition(CppVariable element, RenderOptions options) {
        super(element, options);
    }

    @Override
    public String code(Indentation indentation) {
        String value = element.hasInitValue() ? element.getInitValue() : "";
        return element.name + "(" + value + ")";
    }
}

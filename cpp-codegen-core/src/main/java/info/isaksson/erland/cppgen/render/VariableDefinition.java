package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppVariable;
import info.isaksson.erland.cppgen.style.Indentation;

/**
 * Variable definition; {@code static} is dropped and the name is scope-qualified.
 *
 * <pre>
 * int MyClass::x = 0;
 * </pre>
 */
public class VariableDefinition extends CppDefinition<CppVariable> {

    public VariableDefinition(CppVariable element, RenderOptions options) {
        super(element, options);
    }

    @Override
    public String code(Indentation indentation) {
        return Scopes.definitionPrototype(element) + " = " + DefaultValueFactory.defaultValue(element) + ";";
    }
}

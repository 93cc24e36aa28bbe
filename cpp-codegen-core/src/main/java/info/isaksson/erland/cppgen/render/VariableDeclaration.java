package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppClass;
import info.isaksson.erland.cppgen.model.CppVariable;
import info.isaksson.erland.cppgen.model.Qualifier;
import info.isaksson.erland.cppgen.style.Indentation;

/**
 * Variable declaration.
 *
 * <pre>
 * int x;
 * const int y = 1;
 * static const int COUNT = 0;   // const integral static member, initialized in class
 * static std::string name;      // any other static member, defined at namespace scope
 * </pre>
 */
public class VariableDeclaration extends CppDeclaration<CppVariable> {

    public VariableDeclaration(CppVariable element, RenderOptions options) {
        super(element, options);
    }

    /**
     * Whether the declaration carries its initializer.
     *
     * @throws IllegalArgumentException for a constexpr variable without init value
     */
    protected boolean isAssignable() {
        Qualifier q = element.getQualifier();
        if (Qualifier.isConstexpr(q)) {
            if (element.hasInitValue()) return true;
            throw new IllegalArgumentException("constexpr requires an init value: '" + element.name
                    + "' of type: " + element.type);
        }
        if (element.getParent() instanceof CppClass && Qualifier.isStatic(q)) {
            return DefaultValueFactory.isIntegral(element.type) && Qualifier.isConst(q);
        }
        return element.hasInitValue() && Qualifier.isConst(q);
    }

    @Override
    public String code(Indentation indentation) {
        if (isAssignable()) {
            return Scopes.variablePrototype(element) + " = " + DefaultValueFactory.defaultValue(element) + ";";
        }
        return Scopes.variablePrototype(element) + ";";
    }
}

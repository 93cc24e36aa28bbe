package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppArray;
import info.isaksson.erland.cppgen.style.Indentation;

/** Standard library array declaration, e.g. {@code std::array<int, COUNT> values;}. */
public class StdArrayDeclaration extends CppDeclaration<CppArray> {

    public StdArrayDeclaration(CppArray element, RenderOptions options) {
        super(element, options);
    }

    @Override
    public String code(Indentation indentation) {
        return Scopes.prefix(element.getQualifier()) + "std::array<" + element.type + ", "
                + element.sizeExpression() + "> " + element.name + ";";
    }
}

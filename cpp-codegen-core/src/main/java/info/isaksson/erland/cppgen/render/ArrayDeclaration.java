package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppArray;
import info.isaksson.erland.cppgen.style.Indentation;

/**
 * Raw array declaration, e.g. {@code int values[COUNT];} or {@code int values[0];} when nothing is
 * known about the contents yet.
 */
public class ArrayDeclaration extends CppDeclaration<CppArray> {

    public ArrayDeclaration(CppArray element, RenderOptions options) {
        super(element, options);
    }

    @Override
    public String code(Indentation indentation) {
        return Scopes.prefix(element.getQualifier()) + element.type + " " + element.name
                + "[" + element.sizeExpression() + "];";
    }
}

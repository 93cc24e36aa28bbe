package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppArray;
import info.isaksson.erland.cppgen.style.BraceStrategy;
import info.isaksson.erland.cppgen.style.Indentation;

/**
 * Array definition. Items win over the init value; the init value is only used, verbatim, when
 * no items were added.
 *
 * <pre>
 * int A::values[] = {
 *     0,
 *     1
 * };
 * </pre>
 */
public class ArrayDefinition extends CppDefinition<CppArray> {

    public ArrayDefinition(CppArray element, RenderOptions options) {
        super(element, options);
    }

    static String contents(CppArray array, String separator) {
        if (!array.getItems().isEmpty()) {
            return String.join(separator, array.getItems());
        }
        return array.hasInitValue() ? array.getInitValue() : "";
    }

    @Override
    public String code(Indentation indentation) {
        StringBuilder code = new StringBuilder(Scopes.definitionPrototype(element)).append("[] =");
        try (BraceStrategy block = options.braceStyle.open(code, orNew(indentation), ";")) {
            block.writeLines(contents(element, ",\n"));
        }
        return code.toString();
    }
}

package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppArray;
import info.isaksson.erland.cppgen.style.BraceStrategy;
import info.isaksson.erland.cppgen.style.BraceStyle;
import info.isaksson.erland.cppgen.style.Indentation;

/**
 * Array entry of a constructor initializer list: {@code values{0,1}} for C++11, {@code values()}
 * for C++03 where member arrays cannot be brace-initialized.
 */
public class ArrayConstructorDefinition extends CppDefinition<CppArray> {

    public ArrayConstructorDefinition(CppArray element, RenderOptions options) {
        super(element, options);
    }

    @Override
    public String code(Indentation indentation) {
        StringBuilder code = new StringBuilder(element.name);
        if (!options.cppStandard.isAtLeast(CppStandard.CPP_11)) {
            return code.append("()").toString();
        }
        try (BraceStrategy block = BraceStyle.SINGLE_LINE.open(code, orNew(indentation))) {
            block.write(ArrayDefinition.contents(element, ","));
        }
        return code.toString();
    }
}

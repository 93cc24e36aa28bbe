package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppClass;
import info.isaksson.erland.cppgen.model.CppVariable;
import info.isaksson.erland.cppgen.style.BraceStrategy;
import info.isaksson.erland.cppgen.style.BraceStyle;
import info.isaksson.erland.cppgen.style.Indentation;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate initializer for one instance of a class, e.g. {@code {0, "", 0.0}}: the init value
 * (or type default) of every variable member, in member order.
 */
public class ClassArrayInitializer extends CppDefinition<CppClass> {

    public ClassArrayInitializer(CppClass element, RenderOptions options) {
        super(element, options);
    }

    @Override
    public String code(Indentation indentation) {
        List<String> values = new ArrayList<>();
        for (CppClass.Member m : element.getElements()) {
            if (m.element instanceof CppVariable) {
                values.add(DefaultValueFactory.defaultValue((CppVariable) m.element));
            }
        }
        StringBuilder code = new StringBuilder();
        try (BraceStrategy block = BraceStyle.SINGLE_LINE.open(code, orNew(indentation))) {
            block.write(String.join(", ", values));
        }
        return code.toString();
    }
}

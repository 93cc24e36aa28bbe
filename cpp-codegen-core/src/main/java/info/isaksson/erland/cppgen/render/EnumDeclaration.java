package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppEnum;
import info.isaksson.erland.cppgen.style.BraceStrategy;
import info.isaksson.erland.cppgen.style.Indentation;

import java.util.ArrayList;
import java.util.List;

/**
 * Enum declaration.
 *
 * <pre>
 * enum Color {
 *     COLOR_RED = 0,
 *     COLOR_BLUE
 * };
 * </pre>
 */
public class EnumDeclaration extends CppDeclaration<CppEnum> {

    public EnumDeclaration(CppEnum element, RenderOptions options) {
        super(element, options);
    }

    protected String body() {
        List<String> lines = new ArrayList<>();
        for (CppEnum.Item item : element.getItems()) {
            String value = item.value != null ? " = " + item.value : "";
            lines.add(element.prefix + item.name + value);
        }
        return String.join(",\n", lines);
    }

    @Override
    public String code(Indentation indentation) {
        StringBuilder code = new StringBuilder("enum ").append(element.name);
        try (BraceStrategy block = options.braceStyle.open(code, orNew(indentation), ";")) {
            block.writeLines(body());
        }
        return code.toString();
    }
}

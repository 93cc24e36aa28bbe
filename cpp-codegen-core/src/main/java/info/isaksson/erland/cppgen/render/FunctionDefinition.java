package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppFunction;
import info.isaksson.erland.cppgen.model.Qualifier;
import info.isaksson.erland.cppgen.model.QualifierKind;
import info.isaksson.erland.cppgen.style.BraceStrategy;
import info.isaksson.erland.cppgen.style.Indentation;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Function definition. Prefix qualifiers and argument defaults stay at the declaration; the name
 * is scope-qualified and the body comes from the function's implementation callable.
 *
 * <pre>
 * int Foo::factorial(int n) {
 *     return n &lt; 1 ? 1 : (n * factorial(n - 1));
 * }
 * </pre>
 */
public class FunctionDefinition extends CppDefinition<CppFunction> {

    public FunctionDefinition(CppFunction element, RenderOptions options) {
        super(element, options);
    }

    protected String returnType() {
        String rt = element.getReturnType();
        return (rt == null || rt.isEmpty()) ? FunctionDeclaration.VOID : rt;
    }

    public String prototype() {
        String rt = returnType();
        StringBuilder sb = new StringBuilder();
        if (rt != null) sb.append(rt).append(' ');
        sb.append(Scopes.qualifiedName(element));
        List<String> args = new ArrayList<>();
        for (CppFunction.Arg arg : element.getArgs()) {
            args.add(arg.text);
        }
        sb.append('(').append(String.join(", ", args)).append(')');
        Qualifier postfix = Qualifier.reduce(element.getPostfixQualifier(), EnumSet.of(QualifierKind.PURE));
        if (postfix != null) {
            sb.append(' ').append(postfix.render());
        }
        return sb.toString();
    }

    /** Text written between prototype and body; empty for plain functions. */
    protected String beforeBody() {
        return "";
    }

    @Override
    public String code(Indentation indentation) {
        StringBuilder code = new StringBuilder();
        code.append(prototype()).append(beforeBody());
        try (BraceStrategy block = options.braceStyle.open(code, orNew(indentation))) {
            block.writeLines(element.implement());
        }
        return code.toString();
    }
}

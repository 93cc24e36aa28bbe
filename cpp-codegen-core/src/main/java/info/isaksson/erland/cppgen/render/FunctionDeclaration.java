package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppFunction;
import info.isaksson.erland.cppgen.style.Indentation;

import java.util.ArrayList;
import java.util.List;

/**
 * Function declaration, e.g. {@code virtual int Foo(int a, int b = 0) const;}.
 */
public class FunctionDeclaration extends CppDeclaration<CppFunction> {

    public static final String VOID = "void";

    public FunctionDeclaration(CppFunction element, RenderOptions options) {
        super(element, options);
    }

    /** Null when no return type is written. */
    protected String returnType() {
        String rt = element.getReturnType();
        return (rt == null || rt.isEmpty()) ? VOID : rt;
    }

    protected String arguments() {
        List<String> args = new ArrayList<>();
        for (CppFunction.Arg arg : element.getArgs()) {
            boolean hasDefault = arg.defaultValue != null && !arg.defaultValue.isEmpty();
            args.add(hasDefault ? arg.text + " = " + arg.defaultValue : arg.text);
        }
        return String.join(", ", args);
    }

    @Override
    public String code(Indentation indentation) {
        String rt = returnType();
        StringBuilder sb = new StringBuilder();
        sb.append(Scopes.prefix(element.getQualifier()));
        if (rt != null) sb.append(rt).append(' ');
        sb.append(element.name).append('(').append(arguments()).append(')');
        if (element.getPostfixQualifier() != null) {
            sb.append(' ').append(element.getPostfixQualifier().render());
        }
        return sb.append(';').toString();
    }
}

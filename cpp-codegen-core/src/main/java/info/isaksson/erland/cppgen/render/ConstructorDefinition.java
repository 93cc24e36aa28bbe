package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppClass;
import info.isaksson.erland.cppgen.model.CppFunction;
import info.isaksson.erland.cppgen.model.CppLanguageElement;
import info.isaksson.erland.cppgen.model.CppVariable;
import info.isaksson.erland.cppgen.model.Qualifier;

import java.util.ArrayList;
import java.util.List;

/**
 * Constructor definition with an initializer list built from the owning class's non-static,
 * non-constexpr variables, in member order.
 *
 * <pre>
 * Foo::Foo() :
 * x(0),
 * y(0) {
 * }
 * </pre>
 */
public class ConstructorDefinition extends FunctionDefinition {

    private final ConstructorInitializerFactory initializerFactory;

    public ConstructorDefinition(CppFunction element, RenderOptions options) {
        super(element, options);
        this.initializerFactory = new ConstructorInitializerFactory(this.options);
    }

    @Override
    protected String returnType() {
        return null;
    }

    static boolean isInitializable(CppLanguageElement e) {
        if (!(e instanceof CppVariable)) return false;
        Qualifier q = ((CppVariable) e).getQualifier();
        return !Qualifier.isStatic(q) && !Qualifier.isConstexpr(q);
    }

    public List<String> initializerList() {
        List<String> items = new ArrayList<>();
        if (element.getParent() instanceof CppClass) {
            for (CppClass.Member m : ((CppClass) element.getParent()).getElements()) {
                if (isInitializable(m.element)) {
                    items.add(initializerFactory.build((CppVariable) m.element).code());
                }
            }
        }
        return items;
    }

    @Override
    protected String beforeBody() {
        List<String> items = initializerList();
        if (items.isEmpty()) return "";
        return " :\n" + String.join(",\n", items);
    }
}

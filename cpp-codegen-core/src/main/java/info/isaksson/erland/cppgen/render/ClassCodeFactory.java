package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppArray;
import info.isaksson.erland.cppgen.model.CppClass;
import info.isaksson.erland.cppgen.model.CppEnum;
import info.isaksson.erland.cppgen.model.CppFunction;
import info.isaksson.erland.cppgen.model.CppLanguageElement;
import info.isaksson.erland.cppgen.model.CppStruct;
import info.isaksson.erland.cppgen.model.CppVariable;

/**
 * Chooses the declaration/definition renderer for a member of the class named {@code className}.
 * A function carrying the class's name is its constructor. Array members are declared as
 * {@code std::array} from C++11 on.
 */
public final class ClassCodeFactory {

    /** Owning class name; null for elements outside any class. */
    private final String className;
    private final RenderOptions options;

    public ClassCodeFactory(String className, RenderOptions options) {
        this.className = className;
        this.options = options == null ? RenderOptions.defaults() : options;
    }

    /** Factory for the class that owns {@code element}, if any. */
    public static ClassCodeFactory forOwnerOf(CppLanguageElement element, RenderOptions options) {
        CppLanguageElement parent = element.getParent();
        return new ClassCodeFactory(parent instanceof CppClass ? parent.name : null, options);
    }

    private boolean isConstructor(CppFunction f) {
        return className != null && className.equals(f.name);
    }

    public CppDeclaration<?> buildDeclaration(CppLanguageElement element) {
        if (element instanceof CppVariable) {
            if (element instanceof CppArray) {
                CppArray array = (CppArray) element;
                return className != null && options.cppStandard.isAtLeast(CppStandard.CPP_11)
                        ? new StdArrayDeclaration(array, options)
                        : new ArrayDeclaration(array, options);
            }
            return new VariableDeclaration((CppVariable) element, options);
        } else if (element instanceof CppFunction) {
            CppFunction f = (CppFunction) element;
            return isConstructor(f) ? new ConstructorDeclaration(f, options) : new FunctionDeclaration(f, options);
        } else if (element instanceof CppClass) {
            if (element instanceof CppStruct) {
                return new StructDeclaration((CppStruct) element, options);
            }
            return new ClassDeclaration((CppClass) element, options);
        } else if (element instanceof CppEnum) {
            return new EnumDeclaration((CppEnum) element, options);
        }
        throw new IllegalArgumentException("Unsupported declaration for element '" + element.name + "' (" + element.kind() + ")");
    }

    public CppDefinition<?> buildDefinition(CppLanguageElement element) {
        if (element instanceof CppVariable) {
            if (element instanceof CppArray) {
                return new ArrayDefinition((CppArray) element, options);
            }
            return new VariableDefinition((CppVariable) element, options);
        } else if (element instanceof CppFunction) {
            CppFunction f = (CppFunction) element;
            return isConstructor(f) ? new ConstructorDefinition(f, options) : new FunctionDefinition(f, options);
        } else if (element instanceof CppClass) {
            if (element instanceof CppStruct) {
                return new StructDefinition((CppStruct) element, options);
            }
            return new ClassDefinition((CppClass) element, options);
        }
        throw new IllegalArgumentException("Unsupported definition for element '" + element.name + "' (" + element.kind() + ")");
    }
}

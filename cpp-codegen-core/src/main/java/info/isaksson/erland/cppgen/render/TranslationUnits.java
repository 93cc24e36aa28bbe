package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppClass;
import info.isaksson.erland.cppgen.model.CppFunction;
import info.isaksson.erland.cppgen.model.CppLanguageElement;
import info.isaksson.erland.cppgen.model.CppVariable;
import info.isaksson.erland.cppgen.model.Qualifier;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects the class members that need an out-of-class definition: every function, and static
 * variables that are neither constexpr nor const integral.
 */
public final class TranslationUnits {

    private TranslationUnits() {}

    public static boolean isTranslationUnitElement(CppLanguageElement e) {
        if (e instanceof CppVariable) {
            CppVariable v = (CppVariable) e;
            Qualifier q = v.getQualifier();
            if (!Qualifier.isStatic(q)) return false;
            if (Qualifier.isConstexpr(q)) return false;
            return !(Qualifier.isConst(q) && DefaultValueFactory.isIntegral(v.type));
        }
        return e instanceof CppFunction;
    }

    /** Nested classes' elements come first, then the class's own, each in member order. */
    public static List<CppLanguageElement> of(CppClass cls) {
        List<CppLanguageElement> units = new ArrayList<>();
        for (CppClass.Member m : cls.getElements()) {
            if (m.element instanceof CppClass) {
                units.addAll(of((CppClass) m.element));
            }
        }
        for (CppClass.Member m : cls.getElements()) {
            if (isTranslationUnitElement(m.element)) {
                units.add(m.element);
            }
        }
        return units;
    }
}

package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppLanguageElement;
import info.isaksson.erland.cppgen.model.CppVariable;
import info.isaksson.erland.cppgen.model.Qualifier;
import info.isaksson.erland.cppgen.model.QualifierKind;

import java.util.EnumSet;
import java.util.Set;

/** Scope-name construction and the shared variable prototype. */
public final class Scopes {

    private Scopes() {}

    /**
     * Names of all enclosing scopes, outermost first, each followed by {@code ::}.
     * Empty for an element without a parent.
     */
    public static String scopeOf(CppLanguageElement element) {
        CppLanguageElement parent = element.getParent();
        if (parent == null) return "";
        return scopeOf(parent) + parent.name + "::";
    }

    public static String qualifiedName(CppLanguageElement element) {
        return scopeOf(element) + element.name;
    }

    public static String prefix(Qualifier qualifier) {
        return qualifier == null ? "" : qualifier.render() + " ";
    }

    /**
     * {@code [qualifiers ]type name}, optionally scope-qualified and with some qualifier kinds left out.
     */
    public static String variablePrototype(CppVariable variable, boolean qualifyName, Set<QualifierKind> excluded) {
        Qualifier qualifier = excluded == null ? variable.getQualifier() : Qualifier.reduce(variable.getQualifier(), excluded);
        String name = qualifyName ? qualifiedName(variable) : variable.name;
        return prefix(qualifier) + variable.type + " " + name;
    }

    public static String variablePrototype(CppVariable variable) {
        return variablePrototype(variable, false, null);
    }

    /** Prototype used at the out-of-class definition site: scoped, without {@code static}. */
    public static String definitionPrototype(CppVariable variable) {
        return variablePrototype(variable, true, EnumSet.of(QualifierKind.STATIC));
    }
}

package info.isaksson.erland.cppgen.cli;

import info.isaksson.erland.cppgen.model.CppClass;
import info.isaksson.erland.cppgen.model.CppFunction;
import info.isaksson.erland.cppgen.model.CppVariable;
import info.isaksson.erland.cppgen.model.QualifierKind;
import info.isaksson.erland.cppgen.model.Visibility;

import java.util.Map;

/** Builds the class holding one {@code static const char *} member per i18n key. */
public final class ConfigClassBuilder {

    static final String STRING_TYPE = "char *";

    private ConfigClassBuilder() {}

    public static CppClass build(String className, Map<String, String> strings) {
        CppClass cls = new CppClass(className).withDocs("/// Localized strings.");
        cls.add(new CppFunction(className), Visibility.PUBLIC);
        for (Map.Entry<String, String> e : strings.entrySet()) {
            CppVariable v = new CppVariable(e.getKey(), STRING_TYPE)
                    .withQualifier(QualifierKind.STATIC, QualifierKind.CONST)
                    .withInitValue(I18nStrings.toLiteral(e.getValue()));
            cls.add(v, Visibility.PUBLIC);
        }
        return cls;
    }
}

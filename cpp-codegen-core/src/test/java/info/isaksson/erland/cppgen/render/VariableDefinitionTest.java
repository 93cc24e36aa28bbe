package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppClass;
import info.isaksson.erland.cppgen.model.CppNamespace;
import info.isaksson.erland.cppgen.model.CppVariable;
import info.isaksson.erland.cppgen.model.QualifierKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class VariableDefinitionTest {

    private static String def(CppVariable v) {
        return new VariableDefinition(v, RenderOptions.defaults()).code();
    }

    @Test
    void defaultValueIsSynthesized() {
        assertEquals("int a = 0;", def(new CppVariable("a", "int")));
        assertEquals("const int a = 0;", def(new CppVariable("a", "int").withQualifier(QualifierKind.CONST)));
        assertEquals("std::string s = \"\";", def(new CppVariable("s", "std::string")));
        assertEquals("double d = 0.0;", def(new CppVariable("d", "double")));
    }

    @Test
    void initValueIsUsedVerbatim() {
        assertEquals("int a = MY_CONSTANT;", def(new CppVariable("a", "int").withInitValue("MY_CONSTANT")));
    }

    @Test
    void nameIsScopeQualified() {
        CppVariable a = new CppVariable("a", "int");
        new CppNamespace("MyClass").add(a);
        assertEquals("int MyClass::a = 0;", def(a));
    }

    @Test
    void staticIsDroppedAtDefinitionSite() {
        CppVariable x = new CppVariable("x", "int").withQualifier(QualifierKind.STATIC, QualifierKind.CONST)
                .withInitValue("1");
        new CppClass("A").add(x);
        assertEquals("const int A::x = 1;", def(x));
    }

    @Test
    void unknownTypeWithoutInitValueFails() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> def(new CppVariable("x", "UnknownType")));
        assertEquals("Cannot determine default init value for 'x' of type: UnknownType", ex.getMessage());
    }

    @Test
    void constructorInitializerEntry() {
        RenderOptions o = RenderOptions.defaults();
        assertEquals("a()", new VariableConstructorDefinition(new CppVariable("a", "int"), o).code());
        assertEquals("a(0)", new VariableConstructorDefinition(new CppVariable("a", "int").withInitValue("0"), o).code());
    }
}

package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppArray;
import info.isaksson.erland.cppgen.model.CppClass;
import info.isaksson.erland.cppgen.model.CppEnum;
import info.isaksson.erland.cppgen.model.CppFunction;
import info.isaksson.erland.cppgen.model.CppStruct;
import info.isaksson.erland.cppgen.model.CppVariable;
import info.isaksson.erland.cppgen.model.QualifierKind;
import info.isaksson.erland.cppgen.model.Visibility;
import info.isaksson.erland.cppgen.style.BraceStyle;
import info.isaksson.erland.cppgen.style.DocsStyle;
import info.isaksson.erland.cppgen.style.Indentation;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ClassDeclarationTest {

    private static String decl(CppClass c) {
        return decl(c, RenderOptions.defaults());
    }

    private static String decl(CppClass c, RenderOptions options) {
        return CppRenderer.declaration(c, options);
    }

    @Test
    void emptyClass() {
        assertEquals("class A {\n};", decl(new CppClass("A")));
    }

    @Test
    void privateConstructorNeedsNoLabel() {
        CppClass a = new CppClass("A").add(new CppFunction("A"));
        assertEquals("class A {\n\tA();\n};", decl(a));
    }

    @Test
    void publicMemberGetsLabel() {
        CppClass a = new CppClass("A")
                .add(new CppVariable("x", "int").withQualifier(QualifierKind.STATIC), Visibility.PUBLIC);
        assertEquals("class A {\npublic:\n\tstatic int x;\n};", decl(a));
    }

    @Test
    void staticMemberInitializerIsLeftToDefinition() {
        CppVariable x = new CppVariable("x", "int").withQualifier(QualifierKind.STATIC).withInitValue("1");
        CppClass a = new CppClass("A").add(x, Visibility.PUBLIC);
        assertEquals("class A {\npublic:\n\tstatic int x;\n};", decl(a));
        assertEquals("int A::x = 1;", CppRenderer.definition(a, RenderOptions.defaults()));
    }

    @Test
    void labelOnlyWhenVisibilityChanges() {
        CppClass a = new CppClass("A")
                .add(new CppVariable("x", "int"))
                .add(new CppFunction("Foo"), Visibility.PUBLIC)
                .add(new CppVariable("y", "float"), Visibility.PRIVATE);
        assertEquals("class A {\n\tint x;\npublic:\n\tvoid Foo();\nprivate:\n\tfloat y;\n};", decl(a));
    }

    @Test
    void labelCountMatchesVisibilityRuns() {
        CppClass a = new CppClass("A")
                .add(new CppVariable("a", "int"), Visibility.PUBLIC)
                .add(new CppVariable("b", "int"), Visibility.PUBLIC)
                .add(new CppVariable("c", "int"), Visibility.PROTECTED)
                .add(new CppVariable("d", "int"), Visibility.PUBLIC)
                .add(new CppVariable("e", "int"), Visibility.PUBLIC);
        String code = decl(a);
        assertEquals(2, count(code, "public:"));
        assertEquals(1, count(code, "protected:"));
        assertEquals(0, count(code, "private:"));
    }

    @Test
    void nestedEnumIsIndented() {
        CppClass a = new CppClass("A").add(new CppEnum("Color").add("RED"));
        assertEquals("class A {\n\tenum Color {\n\t\tRED\n\t};\n};", decl(a));
    }

    @Test
    void nestedClassIsIndented() {
        CppClass inner = new CppClass("B").add(new CppVariable("y", "int"), Visibility.PUBLIC);
        CppClass a = new CppClass("A").add(inner, Visibility.PUBLIC);
        assertEquals("class A {\npublic:\n\tclass B {\n\tpublic:\n\t\tint y;\n\t};\n};", decl(a));
    }

    @Test
    void inheritance() {
        CppClass dog = new CppClass("Dog")
                .withParent("Animal", Visibility.PUBLIC)
                .withParent("Mammal", Visibility.PRIVATE);
        assertEquals("class Dog : public Animal, private Mammal {\n};", decl(dog));
    }

    @Test
    void structPrivateMemberGetsLabel() {
        CppStruct s = new CppStruct("A").add(new CppVariable("x", "int"), Visibility.PRIVATE);
        assertEquals("struct A {\nprivate:\n\tint x;\n};", decl(s));
    }

    @Test
    void structPublicMemberNeedsNoLabel() {
        CppStruct s = new CppStruct("P").add(new CppVariable("x", "int"));
        assertEquals("struct P {\n\tint x;\n};", decl(s));
    }

    @Test
    void memberArrayUsesStdArrayFromCpp11() {
        CppClass a = new CppClass("A").add(new CppArray("x", "int").add("1").add("2"));
        assertEquals("class A {\n\tstd::array<int, 2> x;\n};", decl(a));
        assertEquals("class A {\n\tint x[2];\n};",
                decl(a, RenderOptions.defaults().withCppStandard(CppStandard.CPP_03)));
    }

    @Test
    void docsAboveMember() {
        CppClass a = new CppClass("A").add(new CppVariable("x", "int").withDocs("/// The x."));
        assertEquals("class A {\n\t/// The x.\n\tint x;\n};", decl(a));
    }

    @Test
    void docsOnSameLine() {
        CppClass a = new CppClass("A").add(new CppVariable("x", "int").withDocs(" // The x."));
        assertEquals("class A {\n\tint x; // The x.\n};",
                decl(a, RenderOptions.defaults().withDocsStyle(DocsStyle.SAME_LINE)));
    }

    @Test
    void allmanWithSpaces() {
        CppClass a = new CppClass("A").add(new CppFunction("Foo"), Visibility.PUBLIC);
        RenderOptions o = RenderOptions.defaults()
                .withBraceStyle(BraceStyle.ALLMAN)
                .withIndentUnit(Indentation.spaces(2));
        assertEquals("class A\n{\npublic:\n  void Foo();\n};", decl(a, o));
    }

    @Test
    void singleLineLabelsDoNotShiftMemberDepth() {
        CppClass a = new CppClass("A")
                .add(new CppVariable("p", "int"))
                .add(new CppVariable("x", "int"), Visibility.PUBLIC)
                .add(new CppVariable("y", "int"), Visibility.PRIVATE);
        RenderOptions o = RenderOptions.defaults().withBraceStyle(BraceStyle.SINGLE_LINE);
        assertEquals("class A{int p;\npublic:\nint x;\nprivate:\nint y;\n};", decl(a, o));

        Indentation shared = o.newIndentation();
        new ClassDeclaration(a, o).code(shared);
        assertEquals(0, shared.level());
    }

    @Test
    void classDocsAreAttachedByRenderer() {
        CppClass a = new CppClass("A").withDocs("/// An A.");
        assertEquals("/// An A.\nclass A {\n};", CppRenderer.declarationWithDocs(a, RenderOptions.defaults()));
    }

    @Test
    void renderingIsRepeatable() {
        CppClass a = new CppClass("A")
                .add(new CppVariable("x", "int"))
                .add(new CppFunction("A"), Visibility.PUBLIC);
        ClassDeclaration d = new ClassDeclaration(a, RenderOptions.defaults());
        assertEquals(d.code(), d.code());
        assertEquals(decl(a), decl(a));
    }

    private static int count(String haystack, String needle) {
        int n = 0;
        for (int i = haystack.indexOf(needle); i >= 0; i = haystack.indexOf(needle, i + 1)) {
            n++;
        }
        return n;
    }
}

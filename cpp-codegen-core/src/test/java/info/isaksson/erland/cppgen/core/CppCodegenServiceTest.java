package info.isaksson.erland.cppgen.core;

import info.isaksson.erland.cppgen.model.CppClass;
import info.isaksson.erland.cppgen.model.CppEnum;
import info.isaksson.erland.cppgen.model.CppFunction;
import info.isaksson.erland.cppgen.model.CppVariable;
import info.isaksson.erland.cppgen.model.QualifierKind;
import info.isaksson.erland.cppgen.model.Visibility;
import info.isaksson.erland.cppgen.style.BraceStyle;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CppCodegenServiceTest {

    private final CppCodegenService service = new CppCodegenService();

    private static CppClass counter() {
        return new CppClass("Counter")
                .add(new CppVariable("value", "int").withInitValue("0"))
                .add(new CppFunction("Counter"), Visibility.PUBLIC)
                .add(new CppVariable("instances", "int").withQualifier(QualifierKind.STATIC), Visibility.PUBLIC)
                .add(new CppFunction("increment").withImplementation(() -> "value++;"), Visibility.PUBLIC);
    }

    @Test
    void generatesHeaderAndSource() {
        CppCodegenResult res = service.generate("Counter", List.of(counter()), new CppCodegenOptions());

        assertEquals("Counter.h", res.header.fileName);
        assertEquals("Counter.cpp", res.source.fileName);
        assertEquals(
                "#ifndef COUNTER_H\n" +
                "#define COUNTER_H\n" +
                "\n" +
                "class Counter {\n" +
                "\tint value;\n" +
                "public:\n" +
                "\tCounter();\n" +
                "\tstatic int instances;\n" +
                "\tvoid increment();\n" +
                "};\n" +
                "\n" +
                "#endif\n",
                res.headerText);
        assertEquals(
                "#include \"Counter.h\"\n" +
                "\n" +
                "Counter::Counter() :\n" +
                "value(0) {\n" +
                "}\n" +
                "int Counter::instances = 0;\n" +
                "void Counter::increment() {\n" +
                "\tvalue++;\n" +
                "}\n",
                res.sourceText);
    }

    @Test
    void optionsDriveFormatting() {
        CppCodegenOptions o = new CppCodegenOptions();
        o.braceStyle = BraceStyle.ALLMAN;
        o.includeGuard = false;
        o.headerIncludes.add("string");

        CppCodegenResult res = service.generate("E", List.of(new CppEnum("E").add("A")), o);
        assertEquals("#include <string>\n\nenum E\n{\n\tA\n};\n", res.headerText);
        assertEquals("#include \"E.h\"\n", res.sourceText);
    }

    @Test
    void blankBaseNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.generate("", List.of(), null));
    }
}

package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppEnum;
import info.isaksson.erland.cppgen.model.CppFunction;
import info.isaksson.erland.cppgen.model.CppNamespace;
import info.isaksson.erland.cppgen.model.CppStruct;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ClassCodeFactoryTest {

    private final ClassCodeFactory factory = new ClassCodeFactory("A", RenderOptions.defaults());

    @Test
    void namespaceHasNoDeclaration() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> factory.buildDeclaration(new CppNamespace("N")));
        assertEquals("Unsupported declaration for element 'N' (CppNamespace)", ex.getMessage());
    }

    @Test
    void enumHasNoDefinition() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> factory.buildDefinition(new CppEnum("E")));
        assertEquals("Unsupported definition for element 'E' (CppEnum)", ex.getMessage());
    }

    @Test
    void picksRendererByKind() {
        assertTrue(factory.buildDeclaration(new CppFunction("A")) instanceof ConstructorDeclaration);
        assertFalse(factory.buildDeclaration(new CppFunction("B")) instanceof ConstructorDeclaration);
        assertTrue(factory.buildDefinition(new CppFunction("A")) instanceof ConstructorDefinition);
        assertTrue(factory.buildDeclaration(new CppStruct("S")) instanceof StructDeclaration);
        assertTrue(factory.buildDefinition(new CppStruct("S")) instanceof StructDefinition);
    }

    @Test
    void freeFunctionIsNeverAConstructor() {
        ClassCodeFactory free = new ClassCodeFactory(null, RenderOptions.defaults());
        assertEquals("void A();", free.buildDeclaration(new CppFunction("A")).code());
    }
}

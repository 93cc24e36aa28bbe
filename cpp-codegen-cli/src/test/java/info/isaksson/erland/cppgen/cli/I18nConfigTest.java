package info.isaksson.erland.cppgen.cli;

import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class I18nConfigTest {

    @Test
    void readsAllProperties() throws Exception {
        I18nConfig c = I18nConfig.readFromString("{\"strings\":[\"en.txt\"],\"className\":\"Texts\",\"fileName\":\"texts\"}");
        assertEquals(List.of("en.txt"), c.strings);
        assertEquals("Texts", c.className);
        assertEquals("texts", c.fileName);
    }

    @Test
    void namesDefaultToConfig() throws Exception {
        I18nConfig c = I18nConfig.readFromString("{\"strings\":[\"en.txt\"]}");
        assertEquals("Config", c.className);
        assertEquals("Config", c.fileName);

        I18nConfig named = I18nConfig.readFromString("{\"strings\":[\"en.txt\"],\"className\":\"Texts\"}");
        assertEquals("Texts", named.fileName);
    }

    @Test
    void unknownPropertiesAreRejected() {
        assertThrows(UnrecognizedPropertyException.class,
                () -> I18nConfig.readFromString("{\"strings\":[\"en.txt\"],\"colour\":\"red\"}"));
    }

    @Test
    void missingStringsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> I18nConfig.readFromString("{\"className\":\"A\"}"));
    }

    @Test
    void classNameMustBeIdentifier() {
        assertThrows(IllegalArgumentException.class,
                () -> I18nConfig.readFromString("{\"strings\":[\"a\"],\"className\":\"my class\"}"));
    }

    @Test
    void stringsResolveAgainstConfigFolder() throws Exception {
        I18nConfig c = I18nConfig.readFromString("{\"strings\":[\"lang/en.txt\"]}");
        Path config = Paths.get("/work/i18n/config.json");
        assertEquals(Paths.get("/work/i18n/lang/en.txt").toAbsolutePath(), c.resolveStrings(config).get(0));
    }
}

package info.isaksson.erland.cppgen.style;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BraceStrategyTest {

    private static String block(BraceStyle style, String prototype, String body, String postfix) {
        StringBuilder out = new StringBuilder(prototype);
        try (BraceStrategy b = style.open(out, new Indentation(), postfix)) {
            b.writeLines(body);
        }
        return out.toString();
    }

    @Test
    void knrOpensOnPrototypeLine() {
        assertEquals("void foo() {\n\tbar();\n}", block(BraceStyle.KNR, "void foo()", "bar();", null));
    }

    @Test
    void allmanPutsBracesOnOwnLines() {
        assertEquals("void foo()\n{\n\tbar();\n}", block(BraceStyle.ALLMAN, "void foo()", "bar();", null));
    }

    @Test
    void singleLineKeepsEverythingOnOneLine() {
        StringBuilder out = new StringBuilder("x");
        try (BraceStrategy b = BraceStyle.SINGLE_LINE.open(out, new Indentation())) {
            b.write("1,2");
        }
        assertEquals("x{1,2}", out.toString());
    }

    @Test
    void emptyBodyStillClosesBlock() {
        assertEquals("class A {\n};", block(BraceStyle.KNR, "class A", null, ";"));
        assertEquals("class A\n{\n};", block(BraceStyle.ALLMAN, "class A", "", ";"));
    }

    @Test
    void multiLineBodyIsIndentedPerLine() {
        assertEquals("enum E {\n\tA,\n\tB\n};", block(BraceStyle.KNR, "enum E", "A,\nB", ";"));
    }

    @Test
    void nestedBlocksIndentDeeper() {
        Indentation ind = new Indentation();
        StringBuilder out = new StringBuilder("namespace n");
        try (BraceStrategy outer = BraceStyle.KNR.open(out, ind)) {
            StringBuilder inner = new StringBuilder("void f()");
            try (BraceStrategy b = BraceStyle.KNR.open(inner, ind)) {
                b.writeLines("g();");
            }
            outer.writeLine(inner.toString());
        }
        assertEquals("namespace n {\n\tvoid f() {\n\t\tg();\n\t}\n}", out.toString());
        assertEquals(0, ind.level());
    }

    @Test
    void customIndentUnitIsUsed() {
        StringBuilder out = new StringBuilder("void foo()");
        try (BraceStrategy b = BraceStyle.KNR.open(out, new Indentation(0, Indentation.spaces(4)))) {
            b.writeLines("bar();");
        }
        assertEquals("void foo() {\n    bar();\n}", out.toString());
    }

    @Test
    void openingTwiceFails() {
        BraceStrategy b = BraceStyle.KNR.open(new StringBuilder(), new Indentation());
        assertThrows(IllegalStateException.class, b::open);
    }

    @Test
    void closingBeforeOpeningFails() {
        BraceStrategy b = BraceStyle.KNR.create(new StringBuilder(), new Indentation(), null);
        assertEquals(BraceStrategy.State.NOT_ENTERED, b.state());
        assertThrows(IllegalStateException.class, b::close);
    }

    @Test
    void closingTwiceFails() {
        BraceStrategy b = BraceStyle.KNR.open(new StringBuilder(), new Indentation());
        b.close();
        assertEquals(BraceStrategy.State.CLOSED, b.state());
        assertThrows(IllegalStateException.class, b::close);
    }

    @Test
    void closingBraceIsWrittenWhenBodyThrows() {
        StringBuilder out = new StringBuilder("void f()");
        assertThrows(IllegalArgumentException.class, () -> {
            try (BraceStrategy b = BraceStyle.KNR.open(out, new Indentation())) {
                throw new IllegalArgumentException("boom");
            }
        });
        assertEquals("void f() {\n}", out.toString());
    }

    @Test
    void parseCliAcceptsKnownSpellings() {
        assertEquals(BraceStyle.ALLMAN, BraceStyle.parseCli("allman"));
        assertEquals(BraceStyle.KNR, BraceStyle.parseCli("K&R"));
        assertEquals(BraceStyle.SINGLE_LINE, BraceStyle.parseCli("single-line"));
        assertEquals(BraceStyle.KNR, BraceStyle.parseCli(null));
        assertThrows(IllegalArgumentException.class, () -> BraceStyle.parseCli("gnu"));
    }
}

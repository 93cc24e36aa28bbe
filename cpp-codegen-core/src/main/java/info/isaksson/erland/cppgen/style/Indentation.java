package info.isaksson.erland.cppgen.style;

/**
 * Current nesting depth plus the whitespace unit written once per level.
 *
 * <p>Mutable and shared by the renderers taking part in one render call.</p>
 */
public final class Indentation {

    public static final String TAB = "\t";

    private int level;
    private final String whitespace;

    public Indentation() {
        this(0, TAB);
    }

    public Indentation(int level, String whitespace) {
        if (level < 0) throw new IllegalArgumentException("level must not be negative: " + level);
        this.level = level;
        this.whitespace = whitespace == null ? TAB : whitespace;
    }

    /** Whitespace unit of {@code n} spaces. */
    public static String spaces(int n) {
        if (n < 1) throw new IllegalArgumentException("number of spaces must be positive: " + n);
        return " ".repeat(n);
    }

    public int level() {
        return level;
    }

    public String whitespace() {
        return whitespace;
    }

    public void increment() {
        level++;
    }

    public void decrement() {
        if (level > 0) level--;
    }

    public String indent(String text) {
        if (level < 1) return text;
        return whitespace.repeat(level) + text;
    }
}

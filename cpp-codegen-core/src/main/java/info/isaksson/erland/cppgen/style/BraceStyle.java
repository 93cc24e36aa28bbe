package info.isaksson.erland.cppgen.style;

/** Selectable brace styles; creates the matching {@link BraceStrategy}. */
public enum BraceStyle {
    ALLMAN("allman"),
    KNR("knr"),
    SINGLE_LINE("single-line");

    public final String cliValue;

    BraceStyle(String cliValue) {
        this.cliValue = cliValue;
    }

    /** Creates an unopened strategy writing into {@code out}. */
    public BraceStrategy create(StringBuilder out, Indentation indentation, String postfix) {
        switch (this) {
            case ALLMAN:
                return new AllmanStyle(out, indentation, postfix);
            case SINGLE_LINE:
                return new SingleLineStyle(out, indentation, postfix);
            case KNR:
            default:
                return new KnRStyle(out, indentation, postfix);
        }
    }

    /** Creates and opens a strategy. */
    public BraceStrategy open(StringBuilder out, Indentation indentation, String postfix) {
        return create(out, indentation, postfix).open();
    }

    public BraceStrategy open(StringBuilder out, Indentation indentation) {
        return open(out, indentation, null);
    }

    public static BraceStyle parseCli(String v) {
        if (v == null) return KNR;
        String s = v.trim().toLowerCase();
        switch (s) {
            case "allman":
                return ALLMAN;
            case "knr":
            case "k&r":
                return KNR;
            case "single-line":
            case "single_line":
            case "singleline":
                return SINGLE_LINE;
            default:
                throw new IllegalArgumentException("Invalid value for --brace-style: " + v + " (expected one of: allman|knr|single-line)");
        }
    }
}

package info.isaksson.erland.cppgen.style;

import info.isaksson.erland.cppgen.model.CppLanguageElement;

/**
 * How an element's verbatim documentation is attached to its code.
 */
public enum DocsStyle {
    /**
     * Documentation on the line(s) above the code.
     * <pre>
     * /// Number of retries.
     * int retries;
     * </pre>
     */
    ABOVE("above"),

    /**
     * Documentation appended to the code line.
     * <pre>
     * int retries; // Number of retries.
     * </pre>
     */
    SAME_LINE("same-line");

    public final String cliValue;

    DocsStyle(String cliValue) {
        this.cliValue = cliValue;
    }

    /**
     * Combines the element's docs with {@code code}. Either part may be missing; with no code the
     * docs alone are returned, with no docs the code alone.
     */
    public String attach(CppLanguageElement element, String code) {
        String docs = element == null || element.getDocs() == null ? "" : element.getDocs();
        String attachment = code == null ? "" : code;
        if (this == SAME_LINE) {
            return attachment + docs;
        }
        String newline = !docs.isEmpty() && !attachment.isEmpty() ? "\n" : "";
        return docs + newline + attachment;
    }

    public static DocsStyle parseCli(String v) {
        if (v == null) return ABOVE;
        String s = v.trim().toLowerCase();
        for (DocsStyle d : values()) {
            if (d.cliValue.equals(s)) return d;
        }
        throw new IllegalArgumentException("Invalid value for --docs: " + v + " (expected one of: above|same-line)");
    }
}

package info.isaksson.erland.cppgen.style;

/**
 * Both braces on the same line, e.g. {@code {0, "", 2}}. Indentation is left alone.
 */
public final class SingleLineStyle extends BraceStrategy {

    public SingleLineStyle(StringBuilder out, Indentation indentation, String postfix) {
        super(out, indentation, postfix);
    }

    @Override
    protected void writeOpening() {
        out.append('{');
    }

    @Override
    protected void writeClosing() {
        out.append('}').append(postfix);
    }
}

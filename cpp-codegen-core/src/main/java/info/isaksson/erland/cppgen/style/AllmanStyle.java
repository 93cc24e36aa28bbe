package info.isaksson.erland.cppgen.style;

/**
 * Braces on their own lines.
 *
 * <pre>
 * void foo()
 * {
 *     bar();
 * }
 * </pre>
 */
public final class AllmanStyle extends BraceStrategy {

    public AllmanStyle(StringBuilder out, Indentation indentation, String postfix) {
        super(out, indentation, postfix);
    }

    @Override
    protected void writeOpening() {
        // brace is written at the outer level, body goes one deeper
        out.append('\n').append(indentation.indent("{")).append('\n');
        indentation.increment();
        markEndedWithNewline(true);
    }
}

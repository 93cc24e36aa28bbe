package info.isaksson.erland.cppgen.style;

/**
 * Opening brace on the same line as the prototype.
 *
 * <pre>
 * void foo() {
 *     bar();
 * }
 * </pre>
 */
public final class KnRStyle extends BraceStrategy {

    public KnRStyle(StringBuilder out, Indentation indentation, String postfix) {
        super(out, indentation, postfix);
    }

    @Override
    protected void writeOpening() {
        indentation.increment();
        out.append(" {\n");
        markEndedWithNewline(true);
    }
}

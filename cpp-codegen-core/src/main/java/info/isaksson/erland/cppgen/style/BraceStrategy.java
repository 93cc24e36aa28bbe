package info.isaksson.erland.cppgen.style;

/**
 * Writes a brace-delimited block into a shared buffer.
 *
 * <p>A strategy is opened once and closed once. Use it with try-with-resources so that the closing
 * brace is written on every exit path:</p>
 *
 * <pre>{@code
 * try (BraceStrategy block = BraceStyle.KNR.open(out, indentation, ";")) {
 *     block.writeLines(body);
 * }
 * }</pre>
 */
public abstract class BraceStrategy implements AutoCloseable {

    public enum State {
        NOT_ENTERED,
        OPEN,
        CLOSED
    }

    protected final StringBuilder out;
    protected final Indentation indentation;
    protected final String postfix;

    private State state = State.NOT_ENTERED;
    private boolean endedWithNewline;

    protected BraceStrategy(StringBuilder out, Indentation indentation, String postfix) {
        this.out = out == null ? new StringBuilder() : out;
        this.indentation = indentation == null ? new Indentation() : indentation;
        this.postfix = postfix == null ? "" : postfix;
    }

    public State state() {
        return state;
    }

    public Indentation indentation() {
        return indentation;
    }

    /** Writes the opening delimiter; returns this for use in try-with-resources. */
    public final BraceStrategy open() {
        if (state != State.NOT_ENTERED) {
            throw new IllegalStateException("Block already " + state.name().toLowerCase());
        }
        writeOpening();
        state = State.OPEN;
        return this;
    }

    @Override
    public final void close() {
        if (state != State.OPEN) {
            throw new IllegalStateException("Block cannot be closed in state " + state);
        }
        writeClosing();
        state = State.CLOSED;
    }

    protected abstract void writeOpening();

    /** Default closing: dedent, force a line break, then the brace and postfix. */
    protected void writeClosing() {
        indentation.decrement();
        if (!endedWithNewline) {
            out.append('\n');
        }
        out.append(indentation.indent("}" + postfix));
    }

    /** Writes one indented line, terminated by a newline if it is not already. */
    public void writeLine(String line) {
        if (line == null || line.isEmpty()) return;
        out.append(indentation.indent(line));
        if (line.charAt(line.length() - 1) != '\n') {
            out.append('\n');
        }
        endedWithNewline = true;
    }

    /** Splits multi-line text and writes every line indented and newline-terminated. */
    public void writeLines(String lines) {
        if (lines == null || lines.isEmpty()) return;
        for (String line : lines.split("\n", -1)) {
            out.append(indentation.indent(line)).append('\n');
        }
        endedWithNewline = true;
    }

    /** Writes text as is, without indentation. */
    public void write(String data) {
        if (data == null || data.isEmpty()) return;
        out.append(data);
        endedWithNewline = data.charAt(data.length() - 1) == '\n';
    }

    protected void markEndedWithNewline(boolean value) {
        this.endedWithNewline = value;
    }
}

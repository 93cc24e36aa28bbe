package info.isaksson.erland.cppgen.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Warnings raised while reading generator input, e.g. malformed lines in a strings file.
 * Reported in code, message, context order so the CLI prints the same list on every run.
 */
public final class GenerationWarnings {

    private static final Comparator<GenerationWarning> REPORT_ORDER = Comparator
            .comparing((GenerationWarning w) -> w.code)
            .thenComparing(w -> w.message)
            .thenComparing(w -> w.context.isEmpty() ? "" : new TreeMap<>(w.context).toString());

    private final List<GenerationWarning> raised = new ArrayList<>();

    /**
     * Records a warning. {@code context} alternates keys and values,
     * e.g. {@code warn(code, message, "file", "en.txt", "line", "3")}.
     */
    public void warn(String code, String message, String... context) {
        if (context.length % 2 != 0) {
            throw new IllegalArgumentException("Warning context must be key/value pairs, got " + context.length + " values");
        }
        Map<String, String> ctx = new LinkedHashMap<>();
        for (int i = 0; i < context.length; i += 2) {
            ctx.put(context[i], context[i + 1]);
        }
        raised.add(new GenerationWarning(code, message, ctx));
    }

    public int size() {
        return raised.size();
    }

    public List<GenerationWarning> sorted() {
        List<GenerationWarning> out = new ArrayList<>(raised);
        out.sort(REPORT_ORDER);
        return Collections.unmodifiableList(out);
    }
}

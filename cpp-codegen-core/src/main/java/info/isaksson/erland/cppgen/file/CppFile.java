package info.isaksson.erland.cppgen.file;

import info.isaksson.erland.cppgen.model.CppLanguageElement;
import info.isaksson.erland.cppgen.render.RenderOptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Text of a generated C++ file: include directives followed by items.
 *
 * <p>Sections (include guard aside) are separated by one empty line; every line ends with a newline.</p>
 */
public abstract class CppFile {

    /** Either a language element or verbatim text. */
    protected static final class Item {
        final CppLanguageElement element;
        final String raw;

        Item(CppLanguageElement element, String raw) {
            this.element = element;
            this.raw = raw;
        }
    }

    public final String fileName;

    private final List<String> includes = new ArrayList<>();
    private final List<String> localIncludes = new ArrayList<>();
    private final List<Item> items = new ArrayList<>();

    protected CppFile(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("fileName must not be blank");
        }
        this.fileName = fileName;
    }

    /** {@code #include <header>} */
    public CppFile include(String header) {
        includes.add(Objects.requireNonNull(header, "header must not be null"));
        return this;
    }

    /** {@code #include "header"} */
    public CppFile includeLocal(String header) {
        localIncludes.add(Objects.requireNonNull(header, "header must not be null"));
        return this;
    }

    public CppFile add(CppLanguageElement element) {
        items.add(new Item(Objects.requireNonNull(element, "element must not be null"), null));
        return this;
    }

    /** Adds text that is written as is. */
    public CppFile addRaw(String text) {
        items.add(new Item(null, Objects.requireNonNull(text, "text must not be null")));
        return this;
    }

    public List<String> getIncludes() {
        return Collections.unmodifiableList(includes);
    }

    public List<String> getLocalIncludes() {
        return Collections.unmodifiableList(localIncludes);
    }

    public int itemCount() {
        return items.size();
    }

    /** Rendered text of one element item; empty text is skipped. */
    protected abstract String renderElement(CppLanguageElement element, RenderOptions options);

    protected String renderBody(RenderOptions options) {
        List<String> sections = new ArrayList<>();

        StringBuilder inc = new StringBuilder();
        for (String h : includes) {
            inc.append("#include <").append(h).append(">\n");
        }
        for (String h : localIncludes) {
            inc.append("#include \"").append(h).append("\"\n");
        }
        if (inc.length() > 0) sections.add(inc.toString());

        List<String> rendered = new ArrayList<>();
        for (Item item : items) {
            String text = item.element != null ? renderElement(item.element, options) : item.raw;
            if (text == null || text.isEmpty()) continue;
            rendered.add(text.endsWith("\n") ? text : text + "\n");
        }
        if (!rendered.isEmpty()) sections.add(String.join("\n", rendered));

        return String.join("\n", sections);
    }

    public abstract String render(RenderOptions options);

    public String render() {
        return render(RenderOptions.defaults());
    }
}

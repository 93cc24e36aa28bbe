package info.isaksson.erland.cppgen.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** A C++ (unscoped) enum. */
public final class CppEnum extends CppLanguageElement {

    public static final class Item {
        public final String name;
        /** Explicit value, or null. */
        public final String value;

        public Item(String name, String value) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.value = value;
        }
    }

    /** Prepended to every item name at render time. */
    public final String prefix;

    private final List<Item> items = new ArrayList<>();

    public CppEnum(String name) {
        this(name, "");
    }

    public CppEnum(String name, String prefix) {
        super(name);
        this.prefix = prefix == null ? "" : prefix;
    }

    public CppEnum add(String item) {
        return add(item, null);
    }

    public CppEnum add(String item, String value) {
        items.add(new Item(item, value));
        return this;
    }

    public CppEnum add(String item, int value) {
        return add(item, String.valueOf(value));
    }

    public List<Item> getItems() {
        return Collections.unmodifiableList(items);
    }

    public CppEnum withDocs(String docs) {
        setDocs(docs);
        return this;
    }
}

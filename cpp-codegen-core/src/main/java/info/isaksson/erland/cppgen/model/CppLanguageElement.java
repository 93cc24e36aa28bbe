package info.isaksson.erland.cppgen.model;

/**
 * Base class for all C++ language elements.
 *
 * <p>The parent link is a back-reference to the enclosing scope and is only used to build
 * qualified names. The scope owns its members through its member list, not the other way round.</p>
 */
public abstract class CppLanguageElement {

    public final String name;

    private String docs;
    private CppLanguageElement parent;

    protected CppLanguageElement(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException(getClass().getSimpleName() + ".name cannot be empty");
        }
        this.name = name;
    }

    /** Verbatim comment text, e.g. {@code "/// Number of retries."}. */
    public String getDocs() {
        return docs;
    }

    public CppLanguageElement getParent() {
        return parent;
    }

    protected void setDocs(String docs) {
        this.docs = docs;
    }

    /** Called by the enclosing scope when this element is added to it. */
    final void attachTo(CppLanguageElement scope) {
        if (scope == this) {
            throw new IllegalArgumentException("Element '" + name + "' cannot be added to itself");
        }
        if (parent == scope) {
            throw new IllegalArgumentException("Element '" + name + "' was already added to '" + scope.name + "'");
        }
        if (parent != null) {
            throw new IllegalArgumentException("Element '" + name + "' already belongs to '" + parent.name
                    + "' and cannot be added to '" + scope.name + "'");
        }
        for (CppLanguageElement p = scope; p != null; p = p.parent) {
            if (p == this) {
                throw new IllegalArgumentException("Element '" + name + "' cannot be added to its own member '" + scope.name + "'");
            }
        }
        this.parent = scope;
    }

    /** Human readable kind, used in error messages. */
    public String kind() {
        return getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return name;
    }
}

package info.isaksson.erland.cppgen.model;

/** A C++ variable or data member. */
public class CppVariable extends CppLanguageElement {

    public final String type;

    private Qualifier qualifier;
    private String initValue;

    public CppVariable(String name, String type) {
        super(name);
        if (type == null || type.isEmpty()) {
            throw new IllegalArgumentException(getClass().getSimpleName() + ".type cannot be empty (name: " + name + ")");
        }
        this.type = type;
    }

    public Qualifier getQualifier() {
        return qualifier;
    }

    /** Literal initializer text, or null. */
    public String getInitValue() {
        return initValue;
    }

    public boolean hasInitValue() {
        return initValue != null && !initValue.isEmpty();
    }

    public CppVariable withQualifier(Qualifier qualifier) {
        this.qualifier = qualifier;
        return this;
    }

    public CppVariable withQualifier(QualifierKind... kinds) {
        return withQualifier(Qualifier.chain(kinds));
    }

    public CppVariable withInitValue(String initValue) {
        this.initValue = initValue;
        return this;
    }

    public CppVariable withDocs(String docs) {
        setDocs(docs);
        return this;
    }
}

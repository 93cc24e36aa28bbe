package info.isaksson.erland.cppgen.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A C++ array variable.
 *
 * <p>Contents come either from the added items or, when no items were added, from the init value
 * which is then used verbatim as the brace body.</p>
 */
public final class CppArray extends CppVariable {

    private final List<String> items = new ArrayList<>();
    private CppVariable sizeRef;

    public CppArray(String name, String type) {
        super(name, type);
    }

    public CppArray add(String item) {
        items.add(item);
        return this;
    }

    public List<String> getItems() {
        return Collections.unmodifiableList(items);
    }

    /** Variable whose name is used as the array size, or null. */
    public CppVariable getSizeRef() {
        return sizeRef;
    }

    public CppArray withSizeRef(CppVariable sizeRef) {
        this.sizeRef = sizeRef;
        return this;
    }

    /** Size expression: the size reference's name, else the item count ({@code 0} when empty). */
    public String sizeExpression() {
        return sizeRef != null ? sizeRef.name : String.valueOf(items.size());
    }

    @Override
    public CppArray withQualifier(Qualifier qualifier) {
        super.withQualifier(qualifier);
        return this;
    }

    @Override
    public CppArray withQualifier(QualifierKind... kinds) {
        super.withQualifier(kinds);
        return this;
    }

    @Override
    public CppArray withInitValue(String initValue) {
        super.withInitValue(initValue);
        return this;
    }

    @Override
    public CppArray withDocs(String docs) {
        super.withDocs(docs);
        return this;
    }
}

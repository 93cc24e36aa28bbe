package info.isaksson.erland.cppgen.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A named scope; contributes its name to the qualified names of its members. */
public final class CppNamespace extends CppLanguageElement {

    private final List<CppLanguageElement> elements = new ArrayList<>();

    public CppNamespace(String name) {
        super(name);
    }

    public CppNamespace add(CppLanguageElement element) {
        element.attachTo(this);
        elements.add(element);
        return this;
    }

    public List<CppLanguageElement> getElements() {
        return Collections.unmodifiableList(elements);
    }

    public CppNamespace withDocs(String docs) {
        setDocs(docs);
        return this;
    }
}

package info.isaksson.erland.cppgen.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A C++ class. Members keep their insertion order, which drives both the visibility grouping of
 * the declaration and the emission order of the definitions.
 */
public class CppClass extends CppLanguageElement {

    /** A member together with its access specifier. */
    public static final class Member {
        public final CppLanguageElement element;
        public final Visibility visibility;

        Member(CppLanguageElement element, Visibility visibility) {
            this.element = element;
            this.visibility = visibility;
        }
    }

    /** A base class together with the inheritance access specifier. */
    public static final class Parent {
        public final String name;
        public final Visibility visibility;

        public Parent(String name, Visibility visibility) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.visibility = visibility == null ? Visibility.PRIVATE : visibility;
        }
    }

    private final List<Member> elements = new ArrayList<>();
    private final List<Parent> parents = new ArrayList<>();

    public CppClass(String name) {
        super(name);
    }

    /** Access level assumed before the first access specifier. */
    public Visibility defaultVisibility() {
        return Visibility.PRIVATE;
    }

    /** Adds a member with the default visibility of this kind. */
    public CppClass add(CppLanguageElement element) {
        return add(element, defaultVisibility());
    }

    public CppClass add(CppLanguageElement element, Visibility visibility) {
        Objects.requireNonNull(element, "element must not be null");
        element.attachTo(this);
        elements.add(new Member(element, visibility == null ? defaultVisibility() : visibility));
        return this;
    }

    public CppClass withParent(String baseName, Visibility visibility) {
        parents.add(new Parent(baseName, visibility));
        return this;
    }

    public CppClass withDocs(String docs) {
        setDocs(docs);
        return this;
    }

    public List<Member> getElements() {
        return Collections.unmodifiableList(elements);
    }

    public List<Parent> getParents() {
        return Collections.unmodifiableList(parents);
    }
}

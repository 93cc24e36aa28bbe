package info.isaksson.erland.cppgen.model;

/** A C++ struct: a class whose members are public unless stated otherwise. */
public class CppStruct extends CppClass {

    public CppStruct(String name) {
        super(name);
    }

    @Override
    public Visibility defaultVisibility() {
        return Visibility.PUBLIC;
    }

    @Override
    public CppStruct add(CppLanguageElement element) {
        super.add(element);
        return this;
    }

    @Override
    public CppStruct add(CppLanguageElement element, Visibility visibility) {
        super.add(element, visibility);
        return this;
    }

    @Override
    public CppStruct withParent(String baseName, Visibility visibility) {
        super.withParent(baseName, visibility);
        return this;
    }

    @Override
    public CppStruct withDocs(String docs) {
        super.withDocs(docs);
        return this;
    }
}

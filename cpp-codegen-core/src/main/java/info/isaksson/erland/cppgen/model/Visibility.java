package info.isaksson.erland.cppgen.model;

/** C++ access specifiers. */
public enum Visibility {
    PUBLIC("public"),
    PRIVATE("private"),
    PROTECTED("protected");

    public final String keyword;

    Visibility(String keyword) {
        this.keyword = keyword;
    }
}

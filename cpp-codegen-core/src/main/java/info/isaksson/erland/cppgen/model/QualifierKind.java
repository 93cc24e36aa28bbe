package info.isaksson.erland.cppgen.model;

/**
 * C++ keyword modifiers that can be chained into a {@link Qualifier}.
 */
public enum QualifierKind {
    STATIC("static"),
    INLINE("inline"),
    VOLATILE("volatile"),
    VIRTUAL("virtual"),
    CONST("const"),
    CONSTEXPR("constexpr"),
    EXTERN("extern"),
    /** Pure-virtual marker, used as a function postfix qualifier. */
    PURE("= 0");

    public final String keyword;

    QualifierKind(String keyword) {
        this.keyword = keyword;
    }
}

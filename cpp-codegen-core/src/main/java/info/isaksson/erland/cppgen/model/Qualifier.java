package info.isaksson.erland.cppgen.model;

import java.util.Objects;
import java.util.Set;

/**
 * A C++ qualifier keyword, optionally decorating an inner qualifier.
 *
 * <p>Chains render outer-to-inner, e.g. {@code static} wrapping {@code const} renders as
 * {@code "static const"}. No deduplication or reordering is done: the caller owns the order.
 * Instances are immutable.</p>
 */
public final class Qualifier {

    public final QualifierKind kind;

    /** Inner link of the chain, or null for the last link. */
    public final Qualifier decorator;

    public Qualifier(QualifierKind kind, Qualifier decorator) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.decorator = decorator;
    }

    public static Qualifier of(QualifierKind kind) {
        return new Qualifier(kind, null);
    }

    public static Qualifier of(QualifierKind kind, Qualifier decorator) {
        return new Qualifier(kind, decorator);
    }

    /** Build a chain from outermost to innermost kind. */
    public static Qualifier chain(QualifierKind... kinds) {
        if (kinds == null || kinds.length == 0) {
            throw new IllegalArgumentException("at least one qualifier kind is required");
        }
        Qualifier q = null;
        for (int i = kinds.length - 1; i >= 0; i--) {
            q = new Qualifier(kinds[i], q);
        }
        return q;
    }

    /** Keywords of the whole chain joined by single spaces. */
    public String render() {
        return decorator == null ? kind.keyword : kind.keyword + " " + decorator.render();
    }

    public boolean contains(QualifierKind target) {
        if (kind == target) return true;
        return decorator != null && decorator.contains(target);
    }

    public static boolean isConst(Qualifier q) {
        return q != null && q.contains(QualifierKind.CONST);
    }

    public static boolean isConstexpr(Qualifier q) {
        return q != null && q.contains(QualifierKind.CONSTEXPR);
    }

    public static boolean isStatic(Qualifier q) {
        return q != null && q.contains(QualifierKind.STATIC);
    }

    /**
     * Returns a chain without the links whose kind is excluded, keeping the relative order of the rest.
     * The given chain is left untouched; null is returned when nothing remains.
     */
    public static Qualifier reduce(Qualifier q, Set<QualifierKind> excluded) {
        if (q == null) return null;
        Qualifier inner = reduce(q.decorator, excluded);
        if (excluded != null && excluded.contains(q.kind)) {
            return inner;
        }
        return inner == q.decorator ? q : new Qualifier(q.kind, inner);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Qualifier)) return false;
        Qualifier that = (Qualifier) o;
        return kind == that.kind && Objects.equals(decorator, that.decorator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, decorator);
    }

    @Override
    public String toString() {
        return render();
    }
}

package info.isaksson.erland.cppgen.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A C++ free function or method.
 *
 * <p>Arguments are plain text ({@code "int n"}) with an optional default value. The body is
 * produced at render time by the implementation callable, which receives the context object
 * (null when none was given).</p>
 */
public final class CppFunction extends CppLanguageElement {

    /** One function argument. */
    public static final class Arg {
        public final String text;
        /** Default value, or null. */
        public final String defaultValue;

        public Arg(String text, String defaultValue) {
            this.text = Objects.requireNonNull(text, "text must not be null");
            this.defaultValue = defaultValue;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Arg)) return false;
            Arg that = (Arg) o;
            return text.equals(that.text) && Objects.equals(defaultValue, that.defaultValue);
        }

        @Override
        public int hashCode() {
            return Objects.hash(text, defaultValue);
        }
    }

    private String returnType;
    private Qualifier qualifier;
    private Qualifier postfixQualifier;
    private final List<Arg> args = new ArrayList<>();
    private Function<Object, String> implementation;
    private Object context;

    public CppFunction(String name) {
        super(name);
    }

    /** Return type, or null for the void default. */
    public String getReturnType() {
        return returnType;
    }

    public Qualifier getQualifier() {
        return qualifier;
    }

    public Qualifier getPostfixQualifier() {
        return postfixQualifier;
    }

    public List<Arg> getArgs() {
        return Collections.unmodifiableList(args);
    }

    public Object getContext() {
        return context;
    }

    public boolean hasImplementation() {
        return implementation != null;
    }

    /** Invokes the implementation callable; null when there is none. */
    public String implement() {
        return implementation == null ? null : implementation.apply(context);
    }

    public CppFunction withReturnType(String returnType) {
        this.returnType = returnType;
        return this;
    }

    public CppFunction withQualifier(Qualifier qualifier) {
        this.qualifier = qualifier;
        return this;
    }

    public CppFunction withQualifier(QualifierKind... kinds) {
        return withQualifier(Qualifier.chain(kinds));
    }

    public CppFunction withPostfixQualifier(Qualifier postfixQualifier) {
        this.postfixQualifier = postfixQualifier;
        return this;
    }

    public CppFunction withPostfixQualifier(QualifierKind... kinds) {
        return withPostfixQualifier(Qualifier.chain(kinds));
    }

    public CppFunction withArg(String argument) {
        return withArg(argument, null);
    }

    public CppFunction withArg(String argument, String defaultValue) {
        args.add(new Arg(argument, defaultValue));
        return this;
    }

    public CppFunction withImplementation(Supplier<String> implementation) {
        Objects.requireNonNull(implementation, "implementation must not be null");
        this.implementation = ignored -> implementation.get();
        this.context = null;
        return this;
    }

    @SuppressWarnings("unchecked")
    public <C> CppFunction withImplementation(Function<? super C, String> implementation, C context) {
        Objects.requireNonNull(implementation, "implementation must not be null");
        this.implementation = ctx -> implementation.apply((C) ctx);
        this.context = context;
        return this;
    }

    public CppFunction withDocs(String docs) {
        setDocs(docs);
        return this;
    }
}

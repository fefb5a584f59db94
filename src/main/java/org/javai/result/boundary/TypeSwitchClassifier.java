package org.javai.result.boundary;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Classifies exceptions by their runtime type.
 *
 * <p>Cases are tried in registration order and the first whose type matches the
 * exception wins, so register subtypes before their supertypes. Exceptions matching
 * no case go to the fallback.
 *
 * <pre>{@code
 * ExceptionClassifier<String> classifier = TypeSwitchClassifier.<String>builder()
 *     .on(JsonParseException.class, e -> "Invalid JSON: " + e.getOriginalMessage())
 *     .on(IOException.class, e -> "Read failed: " + e.getMessage())
 *     .otherwise(e -> "Unexpected: " + e.getMessage())
 *     .build();
 * }</pre>
 *
 * @param <E> The error type produced
 */
public final class TypeSwitchClassifier<E> implements ExceptionClassifier<E> {

    private record Case<X extends Exception, E>(Class<X> type, Function<? super X, ? extends E> mapping) {

        boolean matches(Exception exception) {
            return type.isInstance(exception);
        }

        E apply(Exception exception) {
            return mapping.apply(type.cast(exception));
        }
    }

    private final List<Case<?, E>> cases;
    private final ExceptionClassifier<? extends E> fallback;

    private TypeSwitchClassifier(List<Case<?, E>> cases, ExceptionClassifier<? extends E> fallback) {
        this.cases = List.copyOf(cases);
        this.fallback = fallback;
    }

    public static <E> Builder<E> builder() {
        return new Builder<>();
    }

    @Override
    public E classify(Exception exception) {
        Objects.requireNonNull(exception, "exception must not be null");
        for (Case<?, E> c : cases) {
            if (c.matches(exception)) {
                return Objects.requireNonNull(c.apply(exception),
                        "mapping for " + c.type().getName() + " must not return null");
            }
        }
        return Objects.requireNonNull(fallback.classify(exception), "fallback must not return null");
    }

    /**
     * Returns the number of registered cases, excluding the fallback.
     */
    public int size() {
        return cases.size();
    }

    public static final class Builder<E> {

        private final List<Case<?, E>> cases = new ArrayList<>();
        private ExceptionClassifier<? extends E> fallback;

        private Builder() {}

        public <X extends Exception> Builder<E> on(Class<X> type, Function<? super X, ? extends E> mapping) {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(mapping, "mapping must not be null");
            cases.add(new Case<>(type, mapping));
            return this;
        }

        public Builder<E> otherwise(ExceptionClassifier<? extends E> fallback) {
            this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
            return this;
        }

        public TypeSwitchClassifier<E> build() {
            Objects.requireNonNull(fallback, "fallback must be set");
            return new TypeSwitchClassifier<>(cases, fallback);
        }
    }
}

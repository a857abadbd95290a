package FA.Model;

import java.util.Objects;

/**
 * Transition label: a concrete input symbol, or epsilon.
 * @param <I> - Input symbol type
 */
public final class Label<I> {
    private static final Label<?> EPSILON = new Label<>(null);

    private final I symbol;

    private Label(I symbol) {
        this.symbol = symbol;
    }

    public static <I> Label<I> symbol(I symbol) {
        return new Label<>(Objects.requireNonNull(symbol, "symbol"));
    }

    @SuppressWarnings("unchecked")
    public static <I> Label<I> epsilon() {
        return (Label<I>) EPSILON;
    }

    public boolean isEpsilon() {
        return this == EPSILON;
    }

    /**
     * @return the symbol, or null for epsilon
     */
    public I getSymbol() {
        return symbol;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Label)) {
            return false;
        }
        return Objects.equals(symbol, ((Label<?>) o).symbol);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(symbol);
    }

    @Override
    public String toString() {
        return isEpsilon() ? "ε" : String.valueOf(symbol);
    }
}

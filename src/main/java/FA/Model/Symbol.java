package FA.Model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Textual input symbol, used by the JSON and command-line front ends.
 */
public record Symbol(String value) {
    public Symbol {
        Objects.requireNonNull(value, "value");
    }

    public static Symbol of(String value) {
        return new Symbol(value);
    }

    /**
     * Split a string into one symbol per character (code point).
     * @param text - input text; the empty string is the empty word
     * @return symbols in order
     */
    public static List<Symbol> word(String text) {
        final List<Symbol> result = new ArrayList<>(text.length());
        text.codePoints().forEach(cp -> result.add(new Symbol(new String(Character.toChars(cp)))));
        return result;
    }

    @Override
    public String toString() {
        return value;
    }
}

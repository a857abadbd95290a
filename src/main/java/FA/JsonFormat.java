package FA;

import FA.Model.DFA;
import FA.Model.FSM;
import FA.Model.FSMException;
import FA.Model.Label;
import FA.Model.NFA;
import FA.Model.NFAe;
import FA.Model.State;
import FA.Model.Symbol;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.automatalib.exception.FormatException;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Reads automata from JSON documents of the form
 * <pre>
 * {
 *   "states":   ["q_0", "q_1"],
 *   "alphabet": ["a", "b"],
 *   "ends":     ["q_1"],
 *   "starts":   ["q_0"],
 *   "delta":    [ {"state": "q_0", "symbol": "a", "images": ["q_1"]} ]
 * }
 * </pre>
 * A single start may be given as {@code "start": "q_0"} and a single target as {@code "image": "q_1"}.
 * The symbol {@value #EPSILON} labels an epsilon transition.
 */
public class JsonFormat {
    public static final String EPSILON = "ε";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonFormat() {}

    /**
     * Read the most specific automaton for the document: a DFA if it has one start and is deterministic,
     * otherwise an NFA if it has no epsilon transitions, otherwise an NFAe.
     */
    public static FSM<Symbol> read(InputStream is) throws IOException, FormatException {
        final Document doc = parse(is);
        if (doc.hasEpsilon) {
            return doc.build(NFAe::new);
        }
        if (doc.starts.size() == 1 && doc.isDeterministic()) {
            return doc.build(DFA::new);
        }
        return doc.build(NFA::new);
    }

    public static DFA<Symbol> readDFA(InputStream is) throws IOException, FormatException {
        return parse(is).build(DFA::new);
    }

    /**
     * @throws FormatException if the document has epsilon transitions
     */
    public static NFA<Symbol> readNFA(InputStream is) throws IOException, FormatException {
        return parse(is).build(NFA::new);
    }

    public static NFAe<Symbol> readNFAe(InputStream is) throws IOException, FormatException {
        return parse(is).build(NFAe::new);
    }

    static FSM<Symbol> getJsonFile(String filePath) {
        try (InputStream is = new FileInputStream(filePath)) {
            return read(is);
        } catch (Exception ex) {
            throw new RuntimeException(ex);
        }
    }

    private static Document parse(InputStream is) throws IOException, FormatException {
        final JsonNode root;
        try {
            root = MAPPER.readTree(is);
        } catch (JsonProcessingException e) {
            throw formatError("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new FormatException("Expected a JSON object");
        }

        final Document doc = new Document();
        for (String name : strings(root, "states")) {
            doc.states.add(name);
        }
        for (String sym : strings(root, "alphabet")) {
            if (!EPSILON.equals(sym)) {
                doc.alphabet.add(sym);
            }
        }
        doc.ends.addAll(knownStates(doc, strings(root, "ends")));
        if (root.has("start")) {
            doc.starts.addAll(knownStates(doc, List.of(text(root.get("start"), "start"))));
        }
        if (root.has("starts")) {
            doc.starts.addAll(knownStates(doc, strings(root, "starts")));
        }

        final JsonNode delta = root.get("delta");
        if (delta != null) {
            if (!delta.isArray()) {
                throw new FormatException("'delta' must be an array");
            }
            for (JsonNode entry : delta) {
                final String source = knownStates(doc, List.of(text(entry.get("state"), "state"))).get(0);
                final String symbol = text(entry.get("symbol"), "symbol");
                if (!EPSILON.equals(symbol) && !doc.alphabet.contains(symbol)) {
                    throw new FormatException("Symbol '" + symbol + "' is not in the alphabet");
                }
                final List<String> images = new ArrayList<>();
                if (entry.has("image")) {
                    images.add(text(entry.get("image"), "image"));
                }
                if (entry.has("images")) {
                    images.addAll(strings(entry, "images"));
                }
                doc.hasEpsilon |= EPSILON.equals(symbol);
                doc.delta.add(new Edge(source, symbol, knownStates(doc, images)));
            }
        }
        return doc;
    }

    private static List<String> strings(JsonNode node, String field) throws FormatException {
        final JsonNode array = node.get(field);
        if (array == null || !array.isArray()) {
            throw new FormatException("Missing array field '" + field + "'");
        }
        final List<String> result = new ArrayList<>(array.size());
        for (JsonNode elt : array) {
            result.add(text(elt, field));
        }
        return result;
    }

    private static String text(JsonNode node, String field) throws FormatException {
        if (node == null || !node.isTextual()) {
            throw new FormatException("Field '" + field + "' must be a string");
        }
        return node.asText();
    }

    private static List<String> knownStates(Document doc, List<String> names) throws FormatException {
        for (String name : names) {
            if (!doc.states.contains(name)) {
                throw new FormatException("Unknown state '" + name + "'");
            }
        }
        return names;
    }

    private static FormatException formatError(String message, Throwable cause) {
        final FormatException ex = new FormatException(message);
        ex.initCause(cause);
        return ex;
    }

    private record Edge(String source, String symbol, List<String> images) { }

    private static final class Document {
        final Set<String> states = new LinkedHashSet<>();
        final Set<String> alphabet = new LinkedHashSet<>();
        final Set<String> ends = new LinkedHashSet<>();
        final Set<String> starts = new LinkedHashSet<>();
        final List<Edge> delta = new ArrayList<>();
        boolean hasEpsilon;

        boolean isDeterministic() {
            final Map<List<String>, String> seen = new LinkedHashMap<>();
            for (Edge e : delta) {
                for (String image : e.images()) {
                    final String previous = seen.putIfAbsent(List.of(e.source(), e.symbol()), image);
                    if (previous != null && !previous.equals(image)) {
                        return false;
                    }
                }
            }
            return true;
        }

        <A extends FSM<Symbol>> A build(Supplier<A> creator) throws FormatException {
            final A out = creator.get();
            final Map<String, State> byName = new LinkedHashMap<>();
            try {
                for (String sym : alphabet) {
                    out.addSymbol(Symbol.of(sym));
                }
                for (String name : states) {
                    byName.put(name, out.addState(starts.contains(name), ends.contains(name)));
                }
                for (Edge e : delta) {
                    final Label<Symbol> label = EPSILON.equals(e.symbol()) ? Label.epsilon()
                                                                          : Label.symbol(Symbol.of(e.symbol()));
                    for (String image : e.images()) {
                        out.addTransition(byName.get(e.source()), label, byName.get(image));
                    }
                }
            } catch (FSMException | IllegalArgumentException e) {
                throw formatError(e.getMessage(), e);
            }
            if (out instanceof DFA && starts.size() != 1) {
                throw new FormatException("A DFA needs exactly one start state, found " + starts.size());
            }
            return out;
        }
    }
}

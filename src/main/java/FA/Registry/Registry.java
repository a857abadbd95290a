package FA.Registry;

import java.util.BitSet;

/**
 * Maps configurations (sets of source states) to the DFA states built for them during subset construction.
 * Lookups use set equality, never identity.
 */
public interface Registry {
    int MISSING_ELEMENT = -1;

    /**
     * Get DFA state ID for a configuration.
     * @param configuration set of source state IDs
     * @return state ID or MISSING_ELEMENT if the configuration was not registered.
     */
    int get(BitSet configuration);

    /**
     * Register a configuration. The bit set must not be modified afterwards.
     * @param configuration set of source state IDs
     * @param stateID DFA state ID
     */
    void put(BitSet configuration, int stateID);

    /**
     * @return number of registered configurations
     */
    int size();
}

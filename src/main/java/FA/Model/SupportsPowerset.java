package FA.Model;

import java.util.BitSet;

import net.automatalib.ts.AcceptorPowersetViewTS;

/**
 * Automata that are simulated over sets of states (configurations).
 */
public interface SupportsPowerset<I> extends FSM<I> {

    /**
     * Deterministic view whose states are configurations, encoded as bit sets of state ids.
     * A symbol without any successor leads to {@code null} rather than to the empty set.
     */
    AcceptorPowersetViewTS<BitSet, I, State> powersetView();

    /**
     * @return the configuration reached from config by reading symbol
     */
    BitSet step(BitSet config, I symbol);
}

package FA.Registry;

import java.util.BitSet;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

public class ConfigurationRegistry implements Registry {
    private final Object2IntMap<BitSet> config2State;

    public ConfigurationRegistry() {
        this.config2State = new Object2IntOpenHashMap<>();
        this.config2State.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
    }

    @Override
    public int get(BitSet configuration) {
        return config2State.getInt(configuration);
    }

    @Override
    public void put(BitSet configuration, int stateID) {
        if (stateID < 0) {
            throw new IllegalArgumentException("Negative state ID: " + stateID);
        }
        this.config2State.put(configuration, stateID);
    }

    @Override
    public int size() {
        return config2State.size();
    }

    @Override
    public String toString() {
        return "Configurations" + config2State;
    }
}

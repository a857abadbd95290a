package FA.Model;

import java.util.BitSet;

public record DeterminizeRecord(BitSet inputState, int outputAddress) {

  @Override
  public String toString() {
    return outputAddress + ": " + inputState;
  }
}

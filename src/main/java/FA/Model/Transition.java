package FA.Model;

public record Transition<I>(State source, Label<I> label, State destination) {

  @Override
  public String toString() {
    return source.getId() + " --" + label + "--> " + destination.getId();
  }
}

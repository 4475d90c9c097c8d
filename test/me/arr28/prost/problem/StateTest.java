package me.arr28.prost.problem;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

class StateTest
{
  @Test
  void applyDeletesThenAdds()
  {
    State lState = State.of("a", "b", "c");
    Effect lEffect = new Effect(Set.of("a", "b"), Set.of("b", "d"), 1);

    State lNext = lState.apply(lEffect);

    assertEquals(State.of("b", "c", "d"), lNext);
    assertEquals(State.of("a", "b", "c"), lState);
  }

  @Test
  void statesAreValues()
  {
    assertEquals(State.of("x", "y"), new State(List.of("y", "x", "y")));
    assertEquals(State.of("x", "y").hashCode(), State.of("y", "x").hashCode());
    assertNotEquals(State.of("x"), State.of("x", "y"));
    assertThrows(UnsupportedOperationException.class, () -> State.of("x").getAtoms().add("y"));
  }

  @Test
  void conditionsNeedPositivesAndNoNegatives()
  {
    Condition lCondition = new Condition(Set.of("guns"), Set.of("house", "yacht"));

    assertTrue(lCondition.isSatisfiedBy(State.of("house", "yacht")));
    assertTrue(lCondition.isSatisfiedBy(State.of("house", "yacht", "riches")));
    assertFalse(lCondition.isSatisfiedBy(State.of("house", "yacht", "guns")));
    assertFalse(lCondition.isSatisfiedBy(State.of("house")));
    assertTrue(Condition.always().isSatisfiedBy(State.of()));
  }
}

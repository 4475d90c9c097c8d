package me.arr28.prost.problem;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;

class ActionTest
{
  private static double totalProbability(Action xiAction)
  {
    double lTotal = 0;
    for (Effect lEffect : xiAction.getEffects())
    {
      lTotal += lEffect.getProbability();
    }
    return lTotal;
  }

  @Test
  void addsNoOpForMissingProbability()
  {
    Effect lGain = new Effect(Set.of(), Set.of("gold"), 0.3, 5);
    Action lAction = new Action("dig", null, List.of(lGain));

    assertEquals(2, lAction.getEffects().size());
    assertEquals(1.0, totalProbability(lAction), 1e-12);

    Effect lNoOp = lAction.getEffects().get(0);
    assertEquals(0.7, lNoOp.getProbability(), 1e-12);
    assertTrue(lNoOp.getAdd().isEmpty());
    assertTrue(lNoOp.getDelete().isEmpty());
    assertEquals(0, lNoOp.getReward());
    assertSame(lGain, lAction.getEffects().get(1));
  }

  @Test
  void ordersEffectsMostProbableFirst()
  {
    Effect lRare = new Effect(Set.of(), Set.of("a"), 0.2);
    Effect lCommon = new Effect(Set.of(), Set.of("b"), 0.7);
    Action lAction = new Action("act", null, List.of(lRare, lCommon));

    List<Effect> lEffects = lAction.getEffects();
    assertEquals(3, lEffects.size());
    assertSame(lCommon, lEffects.get(0));
    assertSame(lRare, lEffects.get(1));
    assertEquals(0.1, lEffects.get(2).getProbability(), 1e-12);
    assertSame(lCommon, lAction.getMostProbableOutcome());
  }

  @Test
  void toleratesRoundingInCompleteDistribution()
  {
    // 0.1 + 0.2 + 0.7 is a little over 1 in floating point.
    Action lAction = new Action("act",
                                null,
                                List.of(new Effect(Set.of(), Set.of("a"), 0.1),
                                        new Effect(Set.of(), Set.of("b"), 0.2),
                                        new Effect(Set.of(), Set.of("c"), 0.7)));
    assertEquals(3, lAction.getEffects().size());
    assertEquals(1.0, totalProbability(lAction), 1e-9);
  }

  @Test
  void rejectsEffectsSummingToMoreThanOne()
  {
    assertThrows(InvalidEffectProbabilitiesException.class,
                 () -> new Action("greedy",
                                  null,
                                  List.of(new Effect(Set.of(), Set.of("a"), 0.6),
                                          new Effect(Set.of(), Set.of("b"), 0.6))));
  }

  @Test
  void actionWithoutEffectsDoesNothing()
  {
    Action lAction = new Action("wait", null, null);
    assertEquals(1, lAction.getEffects().size());
    assertEquals(1.0, lAction.getMostProbableOutcome().getProbability());
    assertEquals(State.of("x"), State.of("x").apply(lAction.outcome()));
  }

  @Test
  void applicableIfAnyPreconditionHolds()
  {
    Action lAction = new Action("act",
                                List.of(Condition.allOf("a"), new Condition(Set.of("b"), Set.of())),
                                List.of(Effect.noOp(1)));

    assertTrue(lAction.isApplicable(State.of("a")));
    assertTrue(lAction.isApplicable(State.of()));
    assertTrue(lAction.isApplicable(State.of("a", "b")));
    assertFalse(lAction.isApplicable(State.of("b")));
  }

  @Test
  void noPreconditionsMeansAlwaysApplicable()
  {
    Action lAction = new Action("act", List.of(), List.of(Effect.noOp(1)));
    assertTrue(lAction.isApplicable(State.of()));
    assertTrue(lAction.isApplicable(State.of("anything")));
  }

  @Test
  void outcomesComeFromOwnEffects()
  {
    Action lAction = new Action("act",
                                null,
                                List.of(new Effect(Set.of(), Set.of("a"), 0.5),
                                        new Effect(Set.of(), Set.of("b"), 0.25)));
    Random lRandom = new Random(3);
    int lNoOps = 0;
    for (int lii = 0; lii < 20_000; lii++)
    {
      Effect lEffect = lAction.outcome(lRandom);
      assertTrue(lAction.getEffects().contains(lEffect));
      if (lEffect.getAdd().isEmpty())
      {
        lNoOps++;
      }
    }
    assertEquals(0.25, lNoOps / 20_000.0, 0.02);
  }

  @Test
  void rejectsInvalidEffects()
  {
    assertThrows(IllegalArgumentException.class, () -> new Effect(Set.of(), Set.of(), 0));
    assertThrows(IllegalArgumentException.class, () -> new Effect(Set.of(), Set.of(), 1.5));
    assertThrows(IllegalArgumentException.class, () -> new Effect(Set.of(), Set.of(), 0.5, Double.NaN));
  }

  @Test
  void describesPreconditionsAndEffects()
  {
    Action lAction = new Action("traffic",
                                List.of(Condition.allOf("riches")),
                                List.of(new Effect(Set.of("riches"), Set.of("house"), 0.9),
                                        new Effect(Set.of("riches"), Set.of(), 0.1, -1)));

    assertEquals("name: traffic\n" +
                 "  preconditions:\n" +
                 "    -> riches\n" +
                 "  effects:\n" +
                 "    0.90 house -riches (+0.00)\n" +
                 "    0.10 -riches (-1.00)\n",
                 lAction.describe());
    assertEquals("traffic", lAction.toString());
  }
}

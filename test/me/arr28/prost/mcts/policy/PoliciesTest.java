package me.arr28.prost.mcts.policy;

import static me.arr28.prost.ExampleProblems.action;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;

import me.arr28.prost.ExampleProblems;
import me.arr28.prost.mcts.ActionInfo;
import me.arr28.prost.mcts.MCTSTree;
import me.arr28.prost.mcts.ScoreBoard;
import me.arr28.prost.mcts.TreeNode;
import me.arr28.prost.mcts.policy.best.MaxAverageRewardPolicy;
import me.arr28.prost.mcts.policy.best.MostVisitedPolicy;
import me.arr28.prost.mcts.policy.rollout.RandomRolloutPolicy;
import me.arr28.prost.mcts.policy.tree.RandomExpandPolicy;
import me.arr28.prost.mcts.policy.tree.RandomSelectPolicy;
import me.arr28.prost.mcts.policy.tree.UCB1SelectPolicy;
import me.arr28.prost.pool.Arena;
import me.arr28.prost.problem.Action;
import me.arr28.prost.problem.Problem;

class PoliciesTest
{
  private static TreeNode root(Problem xiProblem)
  {
    Random lRandom = new Random(21);
    return new MCTSTree(xiProblem,
                        xiProblem.getInitialState(),
                        SearchPolicies.defaults(lRandom),
                        5,
                        1,
                        lRandom,
                        Arena.UNLIMITED).getRoot();
  }

  @Test
  void ucb1Score()
  {
    UCB1SelectPolicy lPolicy = new UCB1SelectPolicy(2);
    ScoreBoard lScores = new ScoreBoard();
    assertEquals(Double.POSITIVE_INFINITY, lPolicy.calculateUCB1(10, lScores));

    lScores.record(0.25);
    lScores.record(0.75);
    assertEquals(2 * Math.sqrt(Math.log(10) / 2) + 0.5, lPolicy.calculateUCB1(10, lScores), 1e-12);

    assertEquals(0.5, new UCB1SelectPolicy(0).calculateUCB1(10, lScores), 1e-12);
    assertThrows(IllegalArgumentException.class, () -> new UCB1SelectPolicy(-1));
    assertThrows(IllegalArgumentException.class, () -> new UCB1SelectPolicy(Double.NaN));
  }

  @Test
  void ucb1PrefersUnvisitedThenBetter()
  {
    Problem lProblem = ExampleProblems.choice();
    Action lBad = action(lProblem, "bad");
    Action lGood = action(lProblem, "good");
    TreeNode lRoot = root(lProblem);
    UCB1SelectPolicy lPolicy = new UCB1SelectPolicy();

    TreeNode lBadChild = lRoot.performAction(lBad);
    TreeNode lGoodChild = lRoot.performAction(lGood);

    // Both unvisited: the first tried wins.
    assertSame(lBad, lPolicy.select(lRoot));

    lBadChild.update(1);
    assertSame(lGood, lPolicy.select(lRoot));

    lGoodChild.update(1);
    assertSame(lGood, lPolicy.select(lRoot));
  }

  @Test
  void ucb1TieGoesToFirstTried()
  {
    Problem lProblem = ExampleProblems.choice();
    Action lBad = action(lProblem, "bad");
    Action lGood = action(lProblem, "good");
    TreeNode lRoot = root(lProblem);

    lRoot.performAction(lGood).update(1);
    lRoot.performAction(lBad).update(1);

    // With no exploration term only the averages count, and those differ.
    assertSame(lGood, new UCB1SelectPolicy(0).select(lRoot));

    // Equal scores: the order actions were first tried decides.
    TreeNode lOther = root(lProblem);
    lOther.performAction(lGood);
    lOther.performAction(lBad);
    assertSame(lGood, new UCB1SelectPolicy().select(lOther));
  }

  @Test
  void randomSelectPicksTriedActions()
  {
    Problem lProblem = ExampleProblems.maffia();
    TreeNode lRoot = root(lProblem);
    lRoot.performAction(action(lProblem, "raid"));
    lRoot.performAction(action(lProblem, "beg"));

    RandomSelectPolicy lPolicy = new RandomSelectPolicy(new Random(4));
    Set<Action> lSeen = new HashSet<>();
    for (int lii = 0; lii < 200; lii++)
    {
      lSeen.add(lPolicy.select(lRoot));
    }
    assertEquals(Set.of(action(lProblem, "raid"), action(lProblem, "beg")), lSeen);
  }

  @Test
  void randomExpandPicksUntriedActions()
  {
    Problem lProblem = ExampleProblems.maffia();
    TreeNode lRoot = root(lProblem);
    lRoot.performAction(action(lProblem, "traffic"));

    RandomExpandPolicy lPolicy = new RandomExpandPolicy(new Random(6));
    Set<Action> lSeen = new HashSet<>();
    for (int lii = 0; lii < 200; lii++)
    {
      lSeen.add(lPolicy.expand(lRoot));
    }
    assertEquals(Set.of(action(lProblem, "raid"), action(lProblem, "beg")), lSeen);
  }

  @Test
  void randomRolloutPicksApplicableActions()
  {
    Problem lProblem = ExampleProblems.maffia();
    TreeNode lRoot = root(lProblem);
    // Trying an action doesn't stop rollouts from using it.
    lRoot.performAction(action(lProblem, "traffic"));

    RandomRolloutPolicy lPolicy = new RandomRolloutPolicy(new Random(8));
    Set<Action> lSeen = new HashSet<>();
    for (int lii = 0; lii < 200; lii++)
    {
      lSeen.add(lPolicy.rollout(lRoot));
    }
    assertEquals(new HashSet<>(lRoot.getApplicableActions()), lSeen);
    assertEquals(3, lSeen.size());
  }

  @Test
  void maxAverageReward()
  {
    Action lA = new Action("a", null, null);
    Action lB = new Action("b", null, null);
    Action lC = new Action("c", null, null);
    MaxAverageRewardPolicy lPolicy = new MaxAverageRewardPolicy();

    assertSame(lB, lPolicy.choose(List.of(new ActionInfo(lA, 10, 10),
                                          new ActionInfo(lB, 4, 2),
                                          new ActionInfo(lC, 30, 20))));
    assertSame(lA, lPolicy.choose(List.of(new ActionInfo(lA, 2, 1), new ActionInfo(lB, 4, 2))));
    assertNull(lPolicy.choose(List.of()));
  }

  @Test
  void mostVisited()
  {
    Action lA = new Action("a", null, null);
    Action lB = new Action("b", null, null);
    Action lC = new Action("c", null, null);
    MostVisitedPolicy lPolicy = new MostVisitedPolicy();

    assertSame(lC, lPolicy.choose(List.of(new ActionInfo(lA, 10, 10),
                                          new ActionInfo(lB, 4, 2),
                                          new ActionInfo(lC, 30, 20))));
    assertSame(lB, lPolicy.choose(List.of(new ActionInfo(lA, 10, 10), new ActionInfo(lB, 20, 10))));
    assertSame(lA, lPolicy.choose(List.of(new ActionInfo(lA, 10, 10), new ActionInfo(lB, 10, 10))));
    assertNull(lPolicy.choose(List.of()));
  }

  @Test
  void unvisitedActionsAreNeverBest()
  {
    Action lA = new Action("a", null, null);
    Action lB = new Action("b", null, null);
    List<ActionInfo> lInfo = List.of(new ActionInfo(lA, 0, 0), new ActionInfo(lB, -3, 1));

    assertSame(lB, new MaxAverageRewardPolicy().choose(lInfo));
    assertSame(lB, new MostVisitedPolicy().choose(lInfo));

    List<ActionInfo> lNoVisits = List.of(new ActionInfo(lA, 0, 0), new ActionInfo(lB, 0, 0));
    assertNull(new MaxAverageRewardPolicy().choose(lNoVisits));
    assertNull(new MostVisitedPolicy().choose(lNoVisits));
  }

  @Test
  void policiesAreReplacedByCopy()
  {
    SearchPolicies lDefaults = SearchPolicies.defaults(new Random(1));
    assertTrue(lDefaults.getSelectPolicy() instanceof UCB1SelectPolicy);
    assertTrue(lDefaults.getExpandPolicy() instanceof RandomExpandPolicy);
    assertTrue(lDefaults.getRolloutPolicy() instanceof RandomRolloutPolicy);
    assertTrue(lDefaults.getBestActionPolicy() instanceof MaxAverageRewardPolicy);

    MostVisitedPolicy lBest = new MostVisitedPolicy();
    SearchPolicies lCustom = lDefaults.withBestActionPolicy(lBest);
    assertSame(lBest, lCustom.getBestActionPolicy());
    assertSame(lDefaults.getSelectPolicy(), lCustom.getSelectPolicy());
    assertTrue(lDefaults.getBestActionPolicy() instanceof MaxAverageRewardPolicy);

    assertThrows(NullPointerException.class, () -> lDefaults.withSelectPolicy(null));
  }
}

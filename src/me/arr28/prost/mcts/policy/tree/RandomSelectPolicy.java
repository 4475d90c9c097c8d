package me.arr28.prost.mcts.policy.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import me.arr28.prost.mcts.TreeNode;
import me.arr28.prost.mcts.policy.SelectPolicy;
import me.arr28.prost.problem.Action;

/**
 * Select policy that picks at (uniform) random from the tried actions.
 *
 * @author Andrew Rose
 */
public class RandomSelectPolicy implements SelectPolicy
{
  private final Random mRandom;

  /**
   * Create a policy.
   *
   * @param xiRandom - the source of randomness.
   */
  public RandomSelectPolicy(Random xiRandom)
  {
    mRandom = xiRandom;
  }

  @Override
  public Action select(TreeNode xiNode)
  {
    List<Action> lTried = new ArrayList<>(xiNode.getTriedActions().keySet());
    return lTried.get(mRandom.nextInt(lTried.size()));
  }
}

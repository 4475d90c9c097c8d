package me.arr28.prost.mcts.policy.tree;

import java.util.List;
import java.util.Random;

import me.arr28.prost.mcts.TreeNode;
import me.arr28.prost.mcts.policy.ExpandPolicy;
import me.arr28.prost.problem.Action;

/**
 * A simple expansion policy that expands an untried action at random.
 *
 * @author Andrew Rose
 */
public class RandomExpandPolicy implements ExpandPolicy
{
  private final Random mRandom;

  /**
   * Create a policy.
   *
   * @param xiRandom - the source of randomness.
   */
  public RandomExpandPolicy(Random xiRandom)
  {
    mRandom = xiRandom;
  }

  @Override
  public Action expand(TreeNode xiLeaf)
  {
    List<Action> lUntried = xiLeaf.getUntriedActions();
    return lUntried.get(mRandom.nextInt(lUntried.size()));
  }
}

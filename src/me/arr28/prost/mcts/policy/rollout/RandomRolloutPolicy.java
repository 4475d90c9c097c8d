package me.arr28.prost.mcts.policy.rollout;

import java.util.List;
import java.util.Random;

import me.arr28.prost.mcts.TreeNode;
import me.arr28.prost.mcts.policy.RolloutPolicy;
import me.arr28.prost.problem.Action;

/**
 * A simple random rollout policy: any applicable action, uniformly.
 *
 * @author Andrew Rose
 */
public class RandomRolloutPolicy implements RolloutPolicy
{
  private final Random mRandom;

  /**
   * Create a policy.
   *
   * @param xiRandom - the source of randomness.
   */
  public RandomRolloutPolicy(Random xiRandom)
  {
    mRandom = xiRandom;
  }

  @Override
  public Action rollout(TreeNode xiNode)
  {
    List<Action> lActions = xiNode.getApplicableActions();
    return lActions.get(mRandom.nextInt(lActions.size()));
  }
}

package me.arr28.prost.mcts.policy;

import me.arr28.prost.mcts.TreeNode;
import me.arr28.prost.problem.Action;

/**
 * An MCTS rollout policy.
 *
 * @author Andrew Rose
 */
public interface RolloutPolicy
{
  /**
   * @return the action to simulate next during a rollout.
   *
   * @param xiNode - the node reached so far, guaranteed to have at least one applicable action.
   */
  public Action rollout(TreeNode xiNode);
}

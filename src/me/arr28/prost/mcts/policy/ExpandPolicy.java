package me.arr28.prost.mcts.policy;

import me.arr28.prost.mcts.TreeNode;
import me.arr28.prost.problem.Action;

/**
 * An MCTS node expansion policy.
 *
 * @author Andrew Rose
 */
public interface ExpandPolicy
{
  /**
   * @return the untried action to expand next.
   *
   * @param xiLeaf - the node to expand, guaranteed to have at least one untried action.
   */
  public Action expand(TreeNode xiLeaf);
}

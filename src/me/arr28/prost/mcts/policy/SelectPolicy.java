package me.arr28.prost.mcts.policy;

import me.arr28.prost.mcts.TreeNode;
import me.arr28.prost.problem.Action;

/**
 * An MCTS selection policy, used to descend through the part of the tree that has already been expanded.
 *
 * @author Andrew Rose
 */
public interface SelectPolicy
{
  /**
   * @return the action to follow from the specified node - one of its tried actions.
   *
   * @param xiNode - the node, guaranteed to have no untried actions and at least one tried action.
   */
  public Action select(TreeNode xiNode);
}

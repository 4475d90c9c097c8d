package me.arr28.prost.mcts.policy;

import java.util.List;

import me.arr28.prost.mcts.ActionInfo;
import me.arr28.prost.problem.Action;

/**
 * Policy for picking the action to report once the search is over.
 *
 * @author Andrew Rose
 */
public interface BestActionPolicy
{
  /**
   * @return the best action, or null if none of them has been visited.
   *
   * @param xiActions - the statistics of every action tried from the root, in the order first tried.  Never empty.
   */
  public Action choose(List<ActionInfo> xiActions);
}

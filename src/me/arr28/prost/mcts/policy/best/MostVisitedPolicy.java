package me.arr28.prost.mcts.policy.best;

import java.util.List;

import me.arr28.prost.mcts.ActionInfo;
import me.arr28.prost.mcts.policy.BestActionPolicy;
import me.arr28.prost.problem.Action;

/**
 * Choose the most visited action (the "robust child"), breaking ties on average reward and then on the order tried.
 * Actions that have never been visited are never chosen.
 *
 * @author Andrew Rose
 */
public class MostVisitedPolicy implements BestActionPolicy
{
  @Override
  public Action choose(List<ActionInfo> xiActions)
  {
    ActionInfo lBest = null;
    for (ActionInfo lInfo : xiActions)
    {
      if (lInfo.getVisits() == 0)
      {
        continue;
      }
      if ((lBest == null) ||
          (lInfo.getVisits() > lBest.getVisits()) ||
          ((lInfo.getVisits() == lBest.getVisits()) && (lInfo.getAverageReward() > lBest.getAverageReward())))
      {
        lBest = lInfo;
      }
    }
    return (lBest == null) ? null : lBest.getAction();
  }
}

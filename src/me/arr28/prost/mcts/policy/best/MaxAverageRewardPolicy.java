package me.arr28.prost.mcts.policy.best;

import java.util.List;

import me.arr28.prost.mcts.ActionInfo;
import me.arr28.prost.mcts.policy.BestActionPolicy;
import me.arr28.prost.problem.Action;

/**
 * Choose the action with the highest average reward.  Ties go to the action tried first.  Actions that have never
 * been visited have no average and are never chosen.
 *
 * @author Andrew Rose
 */
public class MaxAverageRewardPolicy implements BestActionPolicy
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
      if ((lBest == null) || (lInfo.getAverageReward() > lBest.getAverageReward()))
      {
        lBest = lInfo;
      }
    }
    return (lBest == null) ? null : lBest.getAction();
  }
}

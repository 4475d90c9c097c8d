package me.arr28.prost.mcts;

import java.util.Locale;

import me.arr28.prost.problem.Action;

/**
 * The statistics of one action tried from the root, as used to choose the action to report.
 *
 * @author Andrew Rose
 */
public final class ActionInfo
{
  private final Action mAction;
  private final double mReward;
  private final long mVisits;

  /**
   * Create action info.
   *
   * @param xiAction - the action.
   * @param xiReward - the total reward of iterations that started with the action.
   * @param xiVisits - the number of such iterations.
   */
  public ActionInfo(Action xiAction, double xiReward, long xiVisits)
  {
    mAction = xiAction;
    mReward = xiReward;
    mVisits = xiVisits;
  }

  public Action getAction()
  {
    return mAction;
  }

  public double getReward()
  {
    return mReward;
  }

  public long getVisits()
  {
    return mVisits;
  }

  /**
   * @return the average reward per visit.
   */
  public double getAverageReward()
  {
    return mReward / mVisits;
  }

  @Override
  public String toString()
  {
    return String.format(Locale.ROOT, "%s (%.3f over %d)", mAction.getName(), mReward, mVisits);
  }
}

package me.arr28.prost.mcts;

import java.util.Locale;

/**
 * A score board keeping track of the results of performing a particular action in a particular state (or of passing
 * through a particular node).
 *
 * A tree is only ever used by one thread, so there's no synchronisation.
 *
 * @author Andrew Rose
 */
public class ScoreBoard
{
  /**
   * The number of times that the action or node associated with this score board has been visited.
   */
  private long mVisitCount;

  /**
   * The total (discounted) reward from all iterations through this action or node.
   */
  private double mTotalReward;

  /**
   * Record the result of one iteration.
   *
   * @param xiReward - the observed reward.
   */
  public void record(double xiReward)
  {
    mVisitCount++;
    mTotalReward += xiReward;
  }

  /**
   * @return the number of times that this action or node has been visited.
   */
  public long getVisitCount()
  {
    return mVisitCount;
  }

  /**
   * @return the total reward from all visits.
   */
  public double getTotalReward()
  {
    return mTotalReward;
  }

  /**
   * @return the average reward per visit.  NaN if there haven't been any visits.
   */
  public double getAverageReward()
  {
    return mTotalReward / mVisitCount;
  }

  @Override
  public String toString()
  {
    return String.format(Locale.ROOT, "%.2f,%d", mTotalReward, mVisitCount);
  }
}

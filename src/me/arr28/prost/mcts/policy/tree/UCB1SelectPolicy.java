package me.arr28.prost.mcts.policy.tree;

import java.util.Map;

import me.arr28.prost.mcts.ScoreBoard;
import me.arr28.prost.mcts.TreeNode;
import me.arr28.prost.mcts.policy.SelectPolicy;
import me.arr28.prost.problem.Action;

/**
 * Select the tried action with the maximum UCB1 score.
 *
 * The score of an action is c * sqrt(ln(N) / n) + average reward, where N is the number of visits to the node and n
 * the number of times the action has been tried from it.  Ties go to the action tried first.
 *
 * @author Andrew Rose
 */
public class UCB1SelectPolicy implements SelectPolicy
{
  /**
   * The default exploration constant, 1 / sqrt(2).
   */
  public static final double DEFAULT_EXPLORATION = 1 / Math.sqrt(2);

  private final double mExploration;

  /**
   * Create a policy with the default exploration constant.
   */
  public UCB1SelectPolicy()
  {
    this(DEFAULT_EXPLORATION);
  }

  /**
   * Create a policy.
   *
   * @param xiExploration - the exploration constant, c.
   */
  public UCB1SelectPolicy(double xiExploration)
  {
    if (!(xiExploration >= 0) || Double.isInfinite(xiExploration))
    {
      throw new IllegalArgumentException("Exploration constant must be finite and >= 0 but got " + xiExploration);
    }
    mExploration = xiExploration;
  }

  @Override
  public Action select(TreeNode xiNode)
  {
    // Scan the tried actions and record the best.
    double lBestScore = Double.NEGATIVE_INFINITY;
    Action lBestAction = null;
    for (Map.Entry<Action, ScoreBoard> lEntry : xiNode.getTriedActions().entrySet())
    {
      double lScore = calculateUCB1(xiNode.getVisitCount(), lEntry.getValue());
      if ((lBestAction == null) || (lScore > lBestScore))
      {
        lBestAction = lEntry.getKey();
        lBestScore = lScore;
      }
    }
    return lBestAction;
  }

  /**
   * @return the UCB1 score of an action.  Actions that have never been visited score infinity.
   *
   * @param xiParentVisits - the number of visits to the node.
   * @param xiScores - the scores of the action.
   */
  public double calculateUCB1(long xiParentVisits, ScoreBoard xiScores)
  {
    if (xiScores.getVisitCount() == 0)
    {
      return Double.POSITIVE_INFINITY;
    }
    return mExploration * Math.sqrt(Math.log(xiParentVisits) / xiScores.getVisitCount()) +
           xiScores.getAverageReward();
  }
}

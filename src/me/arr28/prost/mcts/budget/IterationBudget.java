package me.arr28.prost.mcts.budget;

/**
 * A budget of a fixed number of iterations.
 *
 * @author Andrew Rose
 */
public class IterationBudget implements Budget
{
  private final int mMaxIterations;

  /**
   * Create a budget.
   *
   * @param xiMaxIterations - the number of iterations allowed.
   */
  public IterationBudget(int xiMaxIterations)
  {
    if (xiMaxIterations < 0)
    {
      throw new IllegalArgumentException("Iteration budget must be >= 0 but got " + xiMaxIterations);
    }
    mMaxIterations = xiMaxIterations;
  }

  @Override
  public boolean shouldContinue(int xiIterations)
  {
    return xiIterations < mMaxIterations;
  }

  public int getMaxIterations()
  {
    return mMaxIterations;
  }
}

package me.arr28.prost.mcts.budget;

/**
 * A computational budget for a search.  Asked before each iteration whether to carry on.
 *
 * @author Andrew Rose
 */
public interface Budget
{
  /**
   * @return whether to perform another iteration.
   *
   * @param xiIterations - the number of iterations completed so far in this search.
   */
  public boolean shouldContinue(int xiIterations);
}

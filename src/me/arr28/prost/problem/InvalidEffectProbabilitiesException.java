package me.arr28.prost.problem;

/**
 * Thrown when the effects of an action have probabilities summing to more than 1.
 *
 * @author Andrew Rose
 */
public class InvalidEffectProbabilitiesException extends IllegalArgumentException
{
  private static final long serialVersionUID = 1L;

  /**
   * Create an exception.
   *
   * @param xiAction - the name of the offending action.
   * @param xiTotal - the total probability of its effects.
   */
  public InvalidEffectProbabilitiesException(String xiAction, double xiTotal)
  {
    super("Effects of action " + xiAction + " have total probability " + xiTotal + " (must be <= 1)");
  }
}

package me.arr28.prost.util;

/**
 * Thrown when a weighted distribution can't be sampled - because it is empty, has a negative (or non-finite) weight
 * or has no positive weight at all.
 *
 * @author Andrew Rose
 */
public class InvalidDistributionException extends IllegalArgumentException
{
  private static final long serialVersionUID = 1L;

  /**
   * Create an exception.
   *
   * @param xiMessage - description of the problem with the distribution.
   */
  public InvalidDistributionException(String xiMessage)
  {
    super(xiMessage);
  }
}

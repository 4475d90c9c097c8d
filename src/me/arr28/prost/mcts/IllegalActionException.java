package me.arr28.prost.mcts;

/**
 * Thrown when asked to expand an action that isn't an untried action of the node - either because it has already
 * been tried or because it isn't applicable in the node's state.
 *
 * @author Andrew Rose
 */
public class IllegalActionException extends IllegalStateException
{
  private static final long serialVersionUID = 1L;

  /**
   * Create an exception.
   *
   * @param xiMessage - description of the problem.
   */
  public IllegalActionException(String xiMessage)
  {
    super(xiMessage);
  }
}

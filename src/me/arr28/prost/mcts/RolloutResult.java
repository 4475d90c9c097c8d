package me.arr28.prost.mcts;

/**
 * Where a rollout ended.
 *
 * @author Andrew Rose
 */
public final class RolloutResult
{
  private final TreeNode mNode;
  private final int mDepth;

  RolloutResult(TreeNode xiNode, int xiDepth)
  {
    mNode = xiNode;
    mDepth = xiDepth;
  }

  /**
   * @return the node at which the rollout stopped.
   */
  public TreeNode getNode()
  {
    return mNode;
  }

  /**
   * @return the depth at which the rollout stopped.
   */
  public int getDepth()
  {
    return mDepth;
  }
}

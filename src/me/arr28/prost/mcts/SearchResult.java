package me.arr28.prost.mcts;

import java.util.List;

import me.arr28.prost.problem.Action;

/**
 * The outcome of a search: the chosen action and the statistics behind it.
 *
 * @author Andrew Rose
 */
public final class SearchResult
{
  private final Action mBestAction;
  private final List<ActionInfo> mActionInfo;
  private final int mIterations;
  private final MCTSTree mTree;

  SearchResult(MCTSTree xiTree, int xiIterations)
  {
    mTree = xiTree;
    mIterations = xiIterations;
    mActionInfo = xiTree.getRootActionInfo();
    mBestAction = xiTree.getBestAction();
  }

  /**
   * @return the chosen action, or null if no action was tried and visited from the root (because it is a goal or a
   * dead end).
   */
  public Action getBestAction()
  {
    return mBestAction;
  }

  /**
   * @return the statistics of every action tried from the root, in the order first tried.
   */
  public List<ActionInfo> getActionInfo()
  {
    return mActionInfo;
  }

  /**
   * @return the statistics of the specified root action, or null if it wasn't tried.
   *
   * @param xiActionName - the name of the action.
   */
  public ActionInfo getActionInfo(String xiActionName)
  {
    for (ActionInfo lInfo : mActionInfo)
    {
      if (lInfo.getAction().getName().equals(xiActionName))
      {
        return lInfo;
      }
    }
    return null;
  }

  /**
   * @return the number of iterations performed.
   */
  public int getIterations()
  {
    return mIterations;
  }

  /**
   * @return the number of nodes in the search tree.
   */
  public int getNumNodes()
  {
    return mTree.getNumNodes();
  }

  /**
   * @return the root of the search tree, for inspection or export.
   */
  public TreeNode getRoot()
  {
    return mTree.getRoot();
  }
}

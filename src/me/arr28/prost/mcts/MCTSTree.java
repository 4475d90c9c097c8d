package me.arr28.prost.mcts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import me.arr28.prost.mcts.budget.Budget;
import me.arr28.prost.mcts.policy.SearchPolicies;
import me.arr28.prost.pool.Arena;
import me.arr28.prost.problem.Action;
import me.arr28.prost.problem.Effect;
import me.arr28.prost.problem.Problem;
import me.arr28.prost.problem.State;

/**
 * A Monte Carlo Search Tree for a single decision.
 *
 * Each iteration selects a path through the tried actions, expands one untried action, rolls out along most probable
 * effects to the horizon (or a goal) and propagates the discounted reward back to the root.
 *
 * @author Andrew Rose
 */
public class MCTSTree
{
  private static final Logger LOGGER = LogManager.getLogger(MCTSTree.class);

  private final Problem mProblem;
  private final SearchPolicies mPolicies;
  private final int mHorizon;
  private final double mDiscounting;
  private final Random mRandom;
  private final Arena<TreeNode> mNodes;
  private final TreeNode mRoot;

  private int mIterations;

  /**
   * Create a Monte Carlo Tree Searcher.
   *
   * @param xiProblem - the problem being solved.
   * @param xiRootState - the state to choose an action for.
   * @param xiPolicies - the policies for each phase of the search.
   * @param xiHorizon - the maximum depth of each iteration (the root being at depth 1).
   * @param xiDiscounting - the factor by which rewards are discounted per step, in (0, 1].
   * @param xiRandom - the source of randomness for drawing effects.
   * @param xiMaxNodes - the maximum number of nodes in the tree, or Arena.UNLIMITED.
   */
  public MCTSTree(Problem xiProblem,
                  State xiRootState,
                  SearchPolicies xiPolicies,
                  int xiHorizon,
                  double xiDiscounting,
                  Random xiRandom,
                  int xiMaxNodes)
  {
    if (xiHorizon < 1)
    {
      throw new IllegalArgumentException("Horizon must be >= 1 but got " + xiHorizon);
    }
    if (!(xiDiscounting > 0 && xiDiscounting <= 1))
    {
      throw new IllegalArgumentException("Discounting must be in (0, 1] but got " + xiDiscounting);
    }
    if ((xiMaxNodes != Arena.UNLIMITED) && (xiMaxNodes <= xiHorizon + 2))
    {
      throw new IllegalArgumentException("Tree must allow more than " + (xiHorizon + 2) + " nodes but got " +
                                         xiMaxNodes);
    }

    mProblem = Objects.requireNonNull(xiProblem, "problem");
    mPolicies = Objects.requireNonNull(xiPolicies, "policies");
    mHorizon = xiHorizon;
    mDiscounting = xiDiscounting;
    mRandom = Objects.requireNonNull(xiRandom, "random");

    // An iteration creates at most one node per level below the root, so keep enough room for a whole iteration.
    mNodes = new Arena<>(xiMaxNodes);
    mNodes.setNonFreeThreshold(xiHorizon + 2);

    mRoot = createNode(TreeNode.NO_PARENT, null, null, Objects.requireNonNull(xiRootState, "root state"));
  }

  /**
   * Perform iterations until the budget is exhausted (or the tree is full).
   *
   * @param xiBudget - the budget, asked before each iteration.
   *
   * @return the number of iterations performed.
   */
  public int iterate(Budget xiBudget)
  {
    int lStart = mIterations;
    while (xiBudget.shouldContinue(mIterations - lStart))
    {
      if (mNodes.isFull())
      {
        LOGGER.warn("Stopping search after {} iterations: tree is full ({} nodes)",
                    mIterations - lStart,
                    mNodes.getNumItemsInUse());
        break;
      }
      iterate();
    }
    return mIterations - lStart;
  }

  /**
   * Perform a single MCTS iteration.
   */
  public void iterate()
  {
    TreeNode lNode = mRoot;
    int lDepth = 1;
    LOGGER.trace("Iteration {} from {}", mIterations, lNode.getState());

    // SELECT
    while (!lNode.hasUntriedActions() && lNode.hasChildren() && (lDepth <= mHorizon))
    {
      Action lAction = mPolicies.getSelectPolicy().select(lNode);
      lNode = lNode.simulateAction(lAction, false);
      lDepth++;
      LOGGER.trace("  select {} -> {}", lAction, lNode.getState());
    }

    // EXPAND
    if (lNode.hasUntriedActions() && (lDepth <= mHorizon) && !lNode.isGoal())
    {
      Action lAction = mPolicies.getExpandPolicy().expand(lNode);
      lNode = lNode.performAction(lAction);
      lDepth++;
      LOGGER.trace("  expand {} -> {}", lAction, lNode.getState());
    }

    // ROLLOUT
    RolloutResult lResult = lNode.rollout(mPolicies.getRolloutPolicy(), lDepth, mHorizon);
    LOGGER.trace("  rollout ended at depth {} in {}{}",
                 lResult.getDepth(),
                 lResult.getNode().getState(),
                 lResult.getNode().isGoal() ? " (goal)" : "");

    // UPDATE
    lResult.getNode().update(mDiscounting);
    mIterations++;
  }

  /**
   * @return the statistics of every action tried from the root, in the order first tried.
   */
  public List<ActionInfo> getRootActionInfo()
  {
    List<ActionInfo> lInfo = new ArrayList<>();
    for (Map.Entry<Action, ScoreBoard> lEntry : mRoot.getTriedActions().entrySet())
    {
      ScoreBoard lScores = lEntry.getValue();
      lInfo.add(new ActionInfo(lEntry.getKey(), lScores.getTotalReward(), lScores.getVisitCount()));
    }
    return Collections.unmodifiableList(lInfo);
  }

  /**
   * @return the best action from the root according to the best-action policy, or null if no action has been tried
   * (because the root is a goal or a dead end, or no iterations have been done).
   */
  public Action getBestAction()
  {
    List<ActionInfo> lInfo = getRootActionInfo();
    return lInfo.isEmpty() ? null : mPolicies.getBestActionPolicy().choose(lInfo);
  }

  /**
   * Create a node and add it to the arena.
   */
  TreeNode createNode(int xiParentIndex, Action xiAction, Effect xiEffect, State xiState)
  {
    TreeNode lNode = new TreeNode(this, mNodes.nextIndex(), xiParentIndex, xiAction, xiEffect, xiState);
    mNodes.add(lNode);
    return lNode;
  }

  /**
   * @return the node with the specified arena index.
   *
   * @param xiIndex - the index.
   */
  public TreeNode getNode(int xiIndex)
  {
    return mNodes.get(xiIndex);
  }

  /**
   * @return the root node of the tree.
   */
  public TreeNode getRoot()
  {
    return mRoot;
  }

  public Problem getProblem()
  {
    return mProblem;
  }

  /**
   * @return the source of randomness used for drawing effects.
   */
  public Random getRandom()
  {
    return mRandom;
  }

  /**
   * @return the number of nodes in the tree.
   */
  public int getNumNodes()
  {
    return mNodes.getNumItemsInUse();
  }

  /**
   * @return the total number of iterations performed on this tree.
   */
  public int getIterations()
  {
    return mIterations;
  }
}

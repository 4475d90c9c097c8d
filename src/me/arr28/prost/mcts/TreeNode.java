package me.arr28.prost.mcts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import me.arr28.prost.mcts.policy.RolloutPolicy;
import me.arr28.prost.problem.Action;
import me.arr28.prost.problem.Effect;
import me.arr28.prost.problem.State;

/**
 * A node in an MCTS tree, representing one reachable state.
 *
 * A node has one child per distinct (action, effect) pair seen so far, so performing an action with several possible
 * effects can lead to several children.  Nodes refer to their parent and children by index into the tree's arena.
 *
 * Statistics are kept both for the node itself and for each action that has been tried from it.  Actions that have
 * only been simulated (during selection or rollouts) are not tried and have no statistics.
 *
 * @author Andrew Rose
 */
public class TreeNode
{
  /**
   * Parent index of the root node.
   */
  public static final int NO_PARENT = -1;

  private final MCTSTree mTree;
  private final int mIndex;
  private final int mParentIndex;
  private final Action mAction;
  private final Effect mEffect;
  private final State mState;
  private final boolean mGoal;
  private final List<Action> mApplicableActions;

  // Children by (action, effect) pair.  Values are arena indices.
  private final Map<ChildKey, Integer> mChildren = new LinkedHashMap<>();

  /**
   * A record of the rewards when iterations have passed through this node.
   */
  public final ScoreBoard mScoreBoard = new ScoreBoard();

  private final List<Action> mUntriedActions;
  private final Map<Action, ScoreBoard> mTriedActions = new LinkedHashMap<>();

  /**
   * Key for the child map.  Actions and effects are matched by identity.
   */
  private static final class ChildKey
  {
    private final Action mAction;
    private final Effect mEffect;

    ChildKey(Action xiAction, Effect xiEffect)
    {
      mAction = xiAction;
      mEffect = xiEffect;
    }

    @Override
    public boolean equals(Object xiOther)
    {
      if (!(xiOther instanceof ChildKey))
      {
        return false;
      }
      ChildKey lOther = (ChildKey)xiOther;
      return (mAction == lOther.mAction) && (mEffect == lOther.mEffect);
    }

    @Override
    public int hashCode()
    {
      return 31 * System.identityHashCode(mAction) + System.identityHashCode(mEffect);
    }
  }

  /**
   * Create a tree node.  This should only be called by the tree.
   *
   * @param xiTree - the tree that the node belongs to.
   * @param xiIndex - the arena index of the node.
   * @param xiParentIndex - the arena index of the parent, or NO_PARENT for the root.
   * @param xiAction - the action that led from the parent, or null for the root.
   * @param xiEffect - the effect of that action, or null for the root.
   * @param xiState - the state.
   */
  TreeNode(MCTSTree xiTree, int xiIndex, int xiParentIndex, Action xiAction, Effect xiEffect, State xiState)
  {
    mTree = xiTree;
    mIndex = xiIndex;
    mParentIndex = xiParentIndex;
    mAction = xiAction;
    mEffect = xiEffect;
    mState = xiState;
    mGoal = xiTree.getProblem().isGoal(xiState);
    mApplicableActions = xiTree.getProblem().getApplicableActions(xiState);
    mUntriedActions = new ArrayList<>(mApplicableActions);
  }

  /**
   * @return the arena index of this node.
   */
  public int getIndex()
  {
    return mIndex;
  }

  /**
   * @return the parent of this node, or null for the root.
   */
  public TreeNode getParent()
  {
    return (mParentIndex == NO_PARENT) ? null : mTree.getNode(mParentIndex);
  }

  /**
   * @return the action that led to this node from its parent, or null for the root.
   */
  public Action getAction()
  {
    return mAction;
  }

  /**
   * @return the effect that led to this node from its parent, or null for the root.
   */
  public Effect getEffect()
  {
    return mEffect;
  }

  public State getState()
  {
    return mState;
  }

  /**
   * @return whether the state in this node satisfies the problem's goal.
   */
  public boolean isGoal()
  {
    return mGoal;
  }

  /**
   * @return whether the search can go no further from this node - because it's a goal or a dead end.
   */
  public boolean isTerminal()
  {
    return mGoal || mApplicableActions.isEmpty();
  }

  /**
   * @return the actions applicable in this node's state, in problem order.
   */
  public List<Action> getApplicableActions()
  {
    return mApplicableActions;
  }

  /**
   * @return the applicable actions that haven't been tried yet.  The list should be treated as read-only.
   */
  public List<Action> getUntriedActions()
  {
    return Collections.unmodifiableList(mUntriedActions);
  }

  public boolean hasUntriedActions()
  {
    return !mUntriedActions.isEmpty();
  }

  /**
   * @return the score board of each action tried from this node, in the order first tried.
   */
  public Map<Action, ScoreBoard> getTriedActions()
  {
    return Collections.unmodifiableMap(mTriedActions);
  }

  /**
   * @return whether the specified action has been tried from this node.
   *
   * @param xiAction - the action.
   */
  public boolean isTried(Action xiAction)
  {
    return mTriedActions.containsKey(xiAction);
  }

  public boolean hasChildren()
  {
    return !mChildren.isEmpty();
  }

  /**
   * @return the children of this node, in the order they were created.
   */
  public List<TreeNode> getChildren()
  {
    List<TreeNode> lChildren = new ArrayList<>(mChildren.size());
    for (int lIndex : mChildren.values())
    {
      lChildren.add(mTree.getNode(lIndex));
    }
    return lChildren;
  }

  /**
   * @return the child reached by the specified action and effect, or null if it hasn't been created.
   *
   * @param xiAction - the action.
   * @param xiEffect - the effect.
   */
  public TreeNode getChild(Action xiAction, Effect xiEffect)
  {
    Integer lIndex = mChildren.get(new ChildKey(xiAction, xiEffect));
    return (lIndex == null) ? null : mTree.getNode(lIndex);
  }

  public long getVisitCount()
  {
    return mScoreBoard.getVisitCount();
  }

  /**
   * @return the total reward of all iterations through this node.
   */
  public double getUtility()
  {
    return mScoreBoard.getTotalReward();
  }

  /**
   * Simulate an action with a randomly drawn effect.
   *
   * @param xiAction - the action.
   *
   * @return the child node reached.
   */
  public TreeNode simulateAction(Action xiAction)
  {
    return simulateAction(xiAction, false);
  }

  /**
   * Simulate an action, without treating it as tried.
   *
   * @param xiAction - the action.
   * @param xiMostProbable - whether to use the action's most probable effect rather than drawing one at random.
   *
   * @return the child node reached - an existing one if this action and effect have been seen before.
   */
  public TreeNode simulateAction(Action xiAction, boolean xiMostProbable)
  {
    Effect lEffect = xiMostProbable ? xiAction.getMostProbableOutcome() : xiAction.outcome(mTree.getRandom());

    ChildKey lKey = new ChildKey(xiAction, lEffect);
    Integer lIndex = mChildren.get(lKey);
    if (lIndex != null)
    {
      return mTree.getNode(lIndex);
    }

    TreeNode lChild = mTree.createNode(mIndex, xiAction, lEffect, mState.apply(lEffect));
    mChildren.put(lKey, lChild.getIndex());
    return lChild;
  }

  /**
   * Try an action for the first time, with a randomly drawn effect.  This is how the tree is expanded.
   *
   * @param xiAction - the action, which must be untried.
   *
   * @return the child node reached.
   *
   * @throws IllegalActionException if the action isn't one of the untried actions.
   */
  public TreeNode performAction(Action xiAction)
  {
    if (!mUntriedActions.remove(xiAction))
    {
      throw new IllegalActionException("Action " + xiAction.getName() + " is not an untried action in state " +
                                       mState + (isTried(xiAction) ? " (already tried)" : " (not applicable)"));
    }
    mTriedActions.put(xiAction, new ScoreBoard());
    return simulateAction(xiAction, false);
  }

  /**
   * Roll out from this node, following the most probable effect of each action chosen by the policy.  No actions are
   * treated as tried.
   *
   * @param xiPolicy - the policy for choosing actions.
   * @param xiDepth - the depth of this node.
   * @param xiHorizon - the depth at which to stop.
   *
   * @return the node where the rollout stopped (a goal, a dead end or a node at the horizon) and its depth.
   */
  public RolloutResult rollout(RolloutPolicy xiPolicy, int xiDepth, int xiHorizon)
  {
    TreeNode lNode = this;
    int lDepth = xiDepth;
    while (!lNode.isTerminal() && (lDepth < xiHorizon))
    {
      lNode = lNode.simulateAction(xiPolicy.rollout(lNode), true);
      lDepth++;
    }
    return new RolloutResult(lNode, lDepth);
  }

  /**
   * Propagate the rewards on the path from the root to this node back up the tree.
   *
   * Rewards collected further from a node are discounted once per step.  The statistics of a node, and of the action
   * leading to it, are only updated if that action has been tried from the parent.  Nodes reached by simulation alone
   * pass their reward on but keep no statistics.
   *
   * @param xiDiscounting - the discount factor, in (0, 1].
   */
  public void update(double xiDiscounting)
  {
    double lReward = 0;
    TreeNode lNode = this;
    while (lNode != null)
    {
      lReward *= xiDiscounting;
      if (lNode.mGoal)
      {
        lReward += mTree.getProblem().getGoalReward();
      }
      if (lNode.mEffect != null)
      {
        lReward += lNode.mEffect.getReward();
      }

      TreeNode lParent = lNode.getParent();
      if (lParent == null)
      {
        lNode.mScoreBoard.record(lReward);
      }
      else
      {
        ScoreBoard lActionScores = lParent.mTriedActions.get(lNode.mAction);
        if (lActionScores != null)
        {
          lActionScores.record(lReward);
          lNode.mScoreBoard.record(lReward);
        }
      }
      lNode = lParent;
    }
  }

  @Override
  public String toString()
  {
    return "Node " + mIndex + " " + mState + " (" + mScoreBoard + ")";
  }
}

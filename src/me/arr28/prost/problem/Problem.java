package me.arr28.prost.problem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A planning problem: where to start, what counts as success and what can be done along the way.
 *
 * @author Andrew Rose
 */
public final class Problem
{
  private final String mName;
  private final State mInitialState;
  private final List<Condition> mGoals;
  private final double mGoalReward;
  private final List<Action> mActions;

  /**
   * Create a problem.
   *
   * @param xiName - the name of the problem.
   * @param xiInitialState - the initial state.
   * @param xiGoals - the alternative goal conditions.  A state satisfying any one of them is a goal state.
   * @param xiGoalReward - the reward for reaching a goal state.
   * @param xiActions - the actions.  Names must be unique.
   */
  public Problem(String xiName,
                 State xiInitialState,
                 List<Condition> xiGoals,
                 double xiGoalReward,
                 List<Action> xiActions)
  {
    mName = Objects.requireNonNull(xiName, "name");
    mInitialState = Objects.requireNonNull(xiInitialState, "initial state");
    mGoals = List.copyOf(xiGoals);
    if (!Double.isFinite(xiGoalReward))
    {
      throw new IllegalArgumentException("Goal reward must be finite but got " + xiGoalReward);
    }
    mGoalReward = xiGoalReward;

    Set<String> lNames = new HashSet<>();
    for (Action lAction : xiActions)
    {
      if (!lNames.add(lAction.getName()))
      {
        throw new IllegalArgumentException("Problem " + xiName + " has more than one action called " +
                                           lAction.getName());
      }
    }
    mActions = List.copyOf(xiActions);
  }

  public String getName()
  {
    return mName;
  }

  public State getInitialState()
  {
    return mInitialState;
  }

  public List<Condition> getGoals()
  {
    return mGoals;
  }

  public double getGoalReward()
  {
    return mGoalReward;
  }

  public List<Action> getActions()
  {
    return mActions;
  }

  /**
   * @return whether the state satisfies at least one of the goal conditions.
   *
   * @param xiState - the state.
   */
  public boolean isGoal(State xiState)
  {
    for (Condition lGoal : mGoals)
    {
      if (lGoal.isSatisfiedBy(xiState))
      {
        return true;
      }
    }
    return false;
  }

  /**
   * @return the actions that can be performed in the specified state, in problem order.
   *
   * @param xiState - the state.
   */
  public List<Action> getApplicableActions(State xiState)
  {
    List<Action> lApplicable = new ArrayList<>(mActions.size());
    for (Action lAction : mActions)
    {
      if (lAction.isApplicable(xiState))
      {
        lApplicable.add(lAction);
      }
    }
    return Collections.unmodifiableList(lApplicable);
  }

  /**
   * @return a multi-line description of the whole problem: initial state, goals and every action.
   */
  public String describe()
  {
    StringBuilder lBuilder = new StringBuilder("Problem description of ").append(mName).append(":\n");
    lBuilder.append(" init conditions:\n");
    lBuilder.append("  ").append(String.join(", ", mInitialState.getAtoms())).append("\n\n");

    lBuilder.append(" goal conditions:\n");
    for (Condition lGoal : mGoals)
    {
      lBuilder.append("  -> ").append(lGoal).append('\n');
    }

    lBuilder.append("\n ").append(mActions.size()).append(" actions:\n");
    for (Action lAction : mActions)
    {
      for (String lLine : lAction.describe().split("\n"))
      {
        lBuilder.append("  ").append(lLine).append('\n');
      }
    }
    return lBuilder.toString();
  }

  @Override
  public String toString()
  {
    return "Problem " + mName + " (" + mActions.size() + " actions, init " + mInitialState + ", goals " + mGoals + ")";
  }
}

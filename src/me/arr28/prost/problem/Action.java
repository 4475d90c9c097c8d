package me.arr28.prost.problem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Random;

import me.arr28.prost.util.AliasSampler;

/**
 * An action with probabilistic effects.
 *
 * The action is applicable in a state if any one of its preconditions holds (or if it has no preconditions).  Its
 * effects always form a complete distribution: if the given effects have a total probability of less than 1, a no-op
 * effect carrying the remainder is added.  Effects are held most probable first.
 *
 * @author Andrew Rose
 */
public final class Action
{
  /**
   * Allowance for rounding error when summing effect probabilities.
   */
  public static final double PROBABILITY_TOLERANCE = 1e-9;

  private final String mName;
  private final List<Condition> mPreconditions;
  private final List<Effect> mEffects;
  private final AliasSampler<Effect> mSampler;

  /**
   * Create an action.
   *
   * @param xiName - the name of the action.
   * @param xiPreconditions - the alternative preconditions.  Null or empty means always applicable.
   * @param xiEffects - the effects.  Null or empty means the action does nothing.
   *
   * @throws InvalidEffectProbabilitiesException if the effect probabilities sum to more than 1.
   */
  public Action(String xiName, List<Condition> xiPreconditions, List<Effect> xiEffects)
  {
    mName = Objects.requireNonNull(xiName, "name");
    mPreconditions = (xiPreconditions == null) ? Collections.emptyList() : List.copyOf(xiPreconditions);

    List<Effect> lEffects = (xiEffects == null) ? new ArrayList<>() : new ArrayList<>(xiEffects);
    double lTotal = 0;
    for (Effect lEffect : lEffects)
    {
      lTotal += Objects.requireNonNull(lEffect, "effect").getProbability();
    }
    if (lTotal > 1 + PROBABILITY_TOLERANCE)
    {
      throw new InvalidEffectProbabilitiesException(xiName, lTotal);
    }
    if (lTotal < 1 - PROBABILITY_TOLERANCE)
    {
      lEffects.add(Effect.noOp(1 - lTotal));
    }

    // Stable sort, so equally likely effects keep their order.
    lEffects.sort(Comparator.comparingDouble(Effect::getProbability).reversed());
    mEffects = Collections.unmodifiableList(lEffects);

    double[] lWeights = new double[mEffects.size()];
    for (int lii = 0; lii < lWeights.length; lii++)
    {
      lWeights[lii] = mEffects.get(lii).getProbability();
    }
    mSampler = new AliasSampler<>(lWeights, mEffects);
  }

  public String getName()
  {
    return mName;
  }

  /**
   * @return the effects, most probable first.
   */
  public List<Effect> getEffects()
  {
    return mEffects;
  }

  /**
   * @return whether the action can be performed in the specified state.
   *
   * @param xiState - the state.
   */
  public boolean isApplicable(State xiState)
  {
    if (mPreconditions.isEmpty())
    {
      return true;
    }
    for (Condition lCondition : mPreconditions)
    {
      if (lCondition.isSatisfiedBy(xiState))
      {
        return true;
      }
    }
    return false;
  }

  /**
   * @return a randomly chosen effect, drawn according to the effect probabilities.
   *
   * @param xiRandom - the source of randomness.
   */
  public Effect outcome(Random xiRandom)
  {
    return mSampler.sample(xiRandom);
  }

  /**
   * @return a randomly chosen effect, using the thread's own random number generator.
   */
  public Effect outcome()
  {
    return mSampler.sample();
  }

  /**
   * @return the most probable effect.
   */
  public Effect getMostProbableOutcome()
  {
    return mEffects.get(0);
  }

  /**
   * @return a multi-line description of the action: its name, preconditions and effects.
   */
  public String describe()
  {
    StringBuilder lBuilder = new StringBuilder("name: ").append(mName).append('\n');
    lBuilder.append("  preconditions:\n");
    if (mPreconditions.isEmpty())
    {
      lBuilder.append("    (none)\n");
    }
    for (Condition lCondition : mPreconditions)
    {
      lBuilder.append("    -> ").append(lCondition).append('\n');
    }
    lBuilder.append("  effects:\n");
    for (Effect lEffect : mEffects)
    {
      lBuilder.append("    ").append(lEffect).append('\n');
    }
    return lBuilder.toString();
  }

  @Override
  public String toString()
  {
    return mName;
  }
}

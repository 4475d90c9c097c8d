package me.arr28.prost.problem;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * One possible outcome of an action: the atoms it deletes, the atoms it adds, how likely it is and the reward for
 * getting it.
 *
 * Effects are immutable and compare by identity.  Two effects with the same contents are still different outcomes.
 *
 * @author Andrew Rose
 */
public final class Effect
{
  private final Set<String> mDelete;
  private final Set<String> mAdd;
  private final double mProbability;
  private final double mReward;

  /**
   * Create an effect.
   *
   * @param xiDelete - the atoms made false.
   * @param xiAdd - the atoms made true.  These win over the deleted atoms.
   * @param xiProbability - the probability of the effect, in (0, 1].
   * @param xiReward - the reward for the effect.
   */
  public Effect(Collection<String> xiDelete, Collection<String> xiAdd, double xiProbability, double xiReward)
  {
    if (!(xiProbability > 0 && xiProbability <= 1))
    {
      throw new IllegalArgumentException("Effect probability must be in (0, 1] but got " + xiProbability);
    }
    if (!Double.isFinite(xiReward))
    {
      throw new IllegalArgumentException("Effect reward must be finite but got " + xiReward);
    }

    mDelete = Collections.unmodifiableSet(new TreeSet<>(xiDelete));
    mAdd = Collections.unmodifiableSet(new TreeSet<>(xiAdd));
    mProbability = xiProbability;
    mReward = xiReward;
  }

  /**
   * Create an effect with no reward.
   */
  public Effect(Collection<String> xiDelete, Collection<String> xiAdd, double xiProbability)
  {
    this(xiDelete, xiAdd, xiProbability, 0);
  }

  /**
   * @return an effect that changes nothing.
   *
   * @param xiProbability - the probability of the effect.
   */
  public static Effect noOp(double xiProbability)
  {
    return new Effect(Collections.emptySet(), Collections.emptySet(), xiProbability, 0);
  }

  public Set<String> getDelete()
  {
    return mDelete;
  }

  public Set<String> getAdd()
  {
    return mAdd;
  }

  public double getProbability()
  {
    return mProbability;
  }

  public double getReward()
  {
    return mReward;
  }

  @Override
  public String toString()
  {
    StringBuilder lBuilder = new StringBuilder(String.format(Locale.ROOT, "%.2f", mProbability));
    for (String lAtom : mAdd)
    {
      lBuilder.append(' ').append(lAtom);
    }
    for (String lAtom : mDelete)
    {
      lBuilder.append(" -").append(lAtom);
    }
    lBuilder.append(String.format(Locale.ROOT, " (%+.2f)", mReward));
    return lBuilder.toString();
  }
}

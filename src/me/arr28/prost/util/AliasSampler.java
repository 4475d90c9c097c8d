package me.arr28.prost.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Draws outcomes from a weighted list in constant time, using an alias table built with Vose's method.
 *
 * Construction is O(n) in the number of outcomes.  Every draw uses exactly two uniform random numbers: one to pick a
 * slot and one to pick between the slot's primary outcome and its alias.
 *
 * @param <T> the type of outcome.
 *
 * @author Andrew Rose
 */
public class AliasSampler<T>
{
  // Probability of returning the primary (rather than the alias) outcome of each slot.
  private final double[] mProbability;

  // The two outcomes sharing each slot.
  private final List<T> mPrimary;
  private final List<T> mAlias;

  /**
   * A weighted outcome, waiting to be placed in the table.
   */
  private static final class Entry<T>
  {
    final double mWeight;
    final T mOutcome;

    Entry(double xiWeight, T xiOutcome)
    {
      mWeight = xiWeight;
      mOutcome = xiOutcome;
    }
  }

  /**
   * Build an alias table.
   *
   * @param xiWeights - the (relative) weight of each outcome.  Weights need not sum to 1.
   * @param xiOutcomes - the outcomes, in the same order as the weights.
   *
   * @throws InvalidDistributionException if the lists are empty or of different lengths, if any weight is negative or
   * not finite, or if the weights don't sum to more than 0.
   */
  public AliasSampler(double[] xiWeights, List<? extends T> xiOutcomes)
  {
    if ((xiWeights == null) || (xiOutcomes == null) || (xiWeights.length == 0))
    {
      throw new InvalidDistributionException("Can't sample from an empty distribution");
    }
    if (xiWeights.length != xiOutcomes.size())
    {
      throw new InvalidDistributionException("Got " + xiWeights.length + " weights for " + xiOutcomes.size() +
                                             " outcomes");
    }

    double lTotal = 0;
    for (double lWeight : xiWeights)
    {
      if (!Double.isFinite(lWeight) || (lWeight < 0))
      {
        throw new InvalidDistributionException("Weights must be finite and >= 0 but got " + lWeight);
      }
      lTotal += lWeight;
    }
    if (!(lTotal > 0))
    {
      throw new InvalidDistributionException("Weights must sum to more than 0");
    }

    int lSize = xiWeights.length;
    mProbability = new double[lSize];
    List<T> lPrimary = new ArrayList<>(lSize);
    List<T> lAlias = new ArrayList<>(lSize);

    // Scale the weights so that the average is 1 and split them into those that under-fill a slot and those that
    // (over-)fill one.
    Deque<Entry<T>> lSmall = new ArrayDeque<>(lSize);
    Deque<Entry<T>> lLarge = new ArrayDeque<>(lSize);
    for (int lii = 0; lii < lSize; lii++)
    {
      Entry<T> lEntry = new Entry<>(xiWeights[lii] * lSize / lTotal, xiOutcomes.get(lii));
      if (lEntry.mWeight < 1)
      {
        lSmall.push(lEntry);
      }
      else
      {
        lLarge.push(lEntry);
      }
    }

    // Top up each small entry from a large one.
    int lSlot = 0;
    while (!lSmall.isEmpty() && !lLarge.isEmpty())
    {
      Entry<T> lLess = lSmall.pop();
      Entry<T> lMore = lLarge.pop();

      mProbability[lSlot++] = lLess.mWeight;
      lPrimary.add(lLess.mOutcome);
      lAlias.add(lMore.mOutcome);

      Entry<T> lRemainder = new Entry<>(lMore.mWeight + lLess.mWeight - 1, lMore.mOutcome);
      if (lRemainder.mWeight < 1)
      {
        lSmall.push(lRemainder);
      }
      else
      {
        lLarge.push(lRemainder);
      }
    }

    // Whatever is left fills its slot entirely (up to rounding error).
    while (!lLarge.isEmpty() || !lSmall.isEmpty())
    {
      Entry<T> lEntry = lLarge.isEmpty() ? lSmall.pop() : lLarge.pop();
      mProbability[lSlot++] = 1;
      lPrimary.add(lEntry.mOutcome);
      lAlias.add(lEntry.mOutcome);
    }

    mPrimary = Collections.unmodifiableList(lPrimary);
    mAlias = Collections.unmodifiableList(lAlias);
  }

  /**
   * @return a randomly drawn outcome, using the thread's own random number generator.
   */
  public T sample()
  {
    return sample(ThreadLocalRandom.current());
  }

  /**
   * @return a randomly drawn outcome, with probability proportional to its weight.
   *
   * @param xiRandom - the source of randomness.
   */
  public T sample(Random xiRandom)
  {
    int lSlot = Math.min((int)(xiRandom.nextDouble() * mProbability.length), mProbability.length - 1);
    return (mProbability[lSlot] >= xiRandom.nextDouble()) ? mPrimary.get(lSlot) : mAlias.get(lSlot);
  }

  /**
   * @return the number of slots in the table (which is the number of outcomes it was built from).
   */
  public int size()
  {
    return mProbability.length;
  }

  /**
   * @return the probability of drawing the primary outcome once the specified slot has been chosen.
   *
   * @param xiSlot - the slot.
   */
  public double getProbability(int xiSlot)
  {
    return mProbability[xiSlot];
  }

  /**
   * @return the primary outcome of the specified slot.
   *
   * @param xiSlot - the slot.
   */
  public T getPrimary(int xiSlot)
  {
    return mPrimary.get(xiSlot);
  }

  /**
   * @return the alias outcome of the specified slot.
   *
   * @param xiSlot - the slot.
   */
  public T getAlias(int xiSlot)
  {
    return mAlias.get(xiSlot);
  }
}

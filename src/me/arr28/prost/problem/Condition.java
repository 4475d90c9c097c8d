package me.arr28.prost.problem;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * A conjunction of literals: some atoms that must be true and some that must be false.
 *
 * Preconditions and goals are both expressed as lists of conditions, where any one condition is enough.
 *
 * @author Andrew Rose
 */
public final class Condition
{
  private static final Condition ALWAYS = new Condition(Collections.emptySet(), Collections.emptySet());

  private final Set<String> mNegative;
  private final Set<String> mPositive;

  /**
   * Create a condition.
   *
   * @param xiNegative - the atoms that must be false.
   * @param xiPositive - the atoms that must be true.
   */
  public Condition(Collection<String> xiNegative, Collection<String> xiPositive)
  {
    mNegative = Collections.unmodifiableSet(new TreeSet<>(xiNegative));
    mPositive = Collections.unmodifiableSet(new TreeSet<>(xiPositive));
  }

  /**
   * @return a condition with only positive literals.
   *
   * @param xiAtoms - the atoms that must be true.
   */
  public static Condition allOf(String... xiAtoms)
  {
    return new Condition(Collections.emptySet(), Arrays.asList(xiAtoms));
  }

  /**
   * @return a condition that every state satisfies.
   */
  public static Condition always()
  {
    return ALWAYS;
  }

  /**
   * @return whether the state satisfies this condition.
   *
   * @param xiState - the state.
   */
  public boolean isSatisfiedBy(State xiState)
  {
    return xiState.containsAll(mPositive) && !xiState.containsAny(mNegative);
  }

  @Override
  public String toString()
  {
    StringBuilder lBuilder = new StringBuilder();
    for (String lAtom : mPositive)
    {
      if (lBuilder.length() > 0) lBuilder.append(", ");
      lBuilder.append(lAtom);
    }
    for (String lAtom : mNegative)
    {
      if (lBuilder.length() > 0) lBuilder.append(", ");
      lBuilder.append('-').append(lAtom);
    }
    return lBuilder.length() == 0 ? "(none)" : lBuilder.toString();
  }
}

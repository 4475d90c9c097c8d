package me.arr28.prost.problem;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A world state: the set of atoms that are true.  Every other atom is false.
 *
 * States are immutable.  Applying an effect creates a new state.
 *
 * @author Andrew Rose
 */
public final class State
{
  private final SortedSet<String> mAtoms;

  /**
   * Create a state.
   *
   * @param xiAtoms - the atoms that are true.
   */
  public State(Collection<String> xiAtoms)
  {
    mAtoms = Collections.unmodifiableSortedSet(new TreeSet<>(xiAtoms));
  }

  /**
   * @return a state in which exactly the specified atoms are true.
   *
   * @param xiAtoms - the atoms.
   */
  public static State of(String... xiAtoms)
  {
    return new State(Arrays.asList(xiAtoms));
  }

  /**
   * @return the true atoms, in sorted order.
   */
  public Set<String> getAtoms()
  {
    return mAtoms;
  }

  /**
   * @return whether all the specified atoms are true.
   *
   * @param xiAtoms - the atoms.
   */
  public boolean containsAll(Collection<String> xiAtoms)
  {
    return mAtoms.containsAll(xiAtoms);
  }

  /**
   * @return whether any of the specified atoms is true.
   *
   * @param xiAtoms - the atoms.
   */
  public boolean containsAny(Collection<String> xiAtoms)
  {
    for (String lAtom : xiAtoms)
    {
      if (mAtoms.contains(lAtom))
      {
        return true;
      }
    }
    return false;
  }

  /**
   * Apply an effect.  The delete set is removed before the add set is added, so an atom in both ends up true.
   *
   * @param xiEffect - the effect.
   *
   * @return the resulting state.
   */
  public State apply(Effect xiEffect)
  {
    TreeSet<String> lAtoms = new TreeSet<>(mAtoms);
    lAtoms.removeAll(xiEffect.getDelete());
    lAtoms.addAll(xiEffect.getAdd());
    return new State(lAtoms);
  }

  @Override
  public boolean equals(Object xiOther)
  {
    return (xiOther instanceof State) && mAtoms.equals(((State)xiOther).mAtoms);
  }

  @Override
  public int hashCode()
  {
    return mAtoms.hashCode();
  }

  @Override
  public String toString()
  {
    return mAtoms.toString();
  }
}

package me.arr28.prost.pool;

import java.util.ArrayList;
import java.util.List;

/**
 * An arena of items addressed by index.
 *
 * Items are only ever added, never freed, and go when the arena itself is discarded.  This lets items refer to one
 * another by index rather than by reference.
 *
 * @param <ItemType> the type of item to be kept in the arena.
 *
 * @author Andrew Rose
 */
public class Arena<ItemType>
{
  /**
   * Capacity of an arena with no maximum size.
   */
  public static final int UNLIMITED = 0;

  // Maximum number of items to allocate, or UNLIMITED.
  private final int mCapacity;

  // Number of free entries required for isFull() to return false.
  private int mFreeThresholdForNonFull;

  // The items, by index.
  private final List<ItemType> mItems = new ArrayList<>();

  /**
   * Create an arena.
   *
   * @param xiCapacity - the maximum number of items, or UNLIMITED.
   */
  public Arena(int xiCapacity)
  {
    if (xiCapacity < 0)
    {
      throw new IllegalArgumentException("Arena capacity must be >= 0 but got " + xiCapacity);
    }
    mCapacity = xiCapacity;
  }

  /**
   * Set a minimum free item requirement to report non-full.
   *
   * @param xiThreshold - the threshold.
   */
  public void setNonFreeThreshold(int xiThreshold)
  {
    if (mFreeThresholdForNonFull < xiThreshold)
    {
      mFreeThresholdForNonFull = xiThreshold;
    }
  }

  /**
   * Add an item to the arena.
   *
   * @param xiItem - the item.
   *
   * @return the index of the item.
   *
   * @throws IllegalStateException if the arena is at capacity.
   */
  public int add(ItemType xiItem)
  {
    if ((mCapacity != UNLIMITED) && (mItems.size() >= mCapacity))
    {
      throw new IllegalStateException("Arena full (" + mCapacity + " items)");
    }
    mItems.add(xiItem);
    return mItems.size() - 1;
  }

  /**
   * @return the index that the next item added will get.
   */
  public int nextIndex()
  {
    return mItems.size();
  }

  /**
   * @return the item with the specified index.
   *
   * @param xiIndex - the index of the item to retrieve.
   */
  public ItemType get(int xiIndex)
  {
    return mItems.get(xiIndex);
  }

  /**
   * @return the capacity of the arena, or UNLIMITED.
   */
  public int getCapacity()
  {
    return mCapacity;
  }

  /**
   * @return the number of items currently in the arena.
   */
  public int getNumItemsInUse()
  {
    return mItems.size();
  }

  /**
   * @return whether the arena is (nearly) full.
   *
   * When full, the caller should stop adding items.  An arena with no maximum size is never full.
   */
  public boolean isFull()
  {
    return (mCapacity != UNLIMITED) && (mItems.size() > mCapacity - mFreeThresholdForNonFull);
  }
}

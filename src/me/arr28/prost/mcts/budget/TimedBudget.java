package me.arr28.prost.mcts.budget;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * A wall-clock budget.
 *
 * The clock starts at the first call.  Once the time is up, the budget says so and then resets, so the same budget
 * can be used for the next search.
 *
 * @author Andrew Rose
 */
public class TimedBudget implements Budget
{
  private static final long NOT_STARTED = Long.MIN_VALUE;

  private final long mLimitNanos;
  private final LongSupplier mClock;
  private long mStartNanos = NOT_STARTED;

  /**
   * Create a budget using the system clock.
   *
   * @param xiLimitMillis - the time allowed for each search, in milliseconds.
   */
  public TimedBudget(long xiLimitMillis)
  {
    this(xiLimitMillis, System::nanoTime);
  }

  /**
   * Create a budget.
   *
   * @param xiLimitMillis - the time allowed for each search, in milliseconds.
   * @param xiClock - the clock, in nanoseconds.
   */
  public TimedBudget(long xiLimitMillis, LongSupplier xiClock)
  {
    if (xiLimitMillis < 0)
    {
      throw new IllegalArgumentException("Time budget must be >= 0 but got " + xiLimitMillis);
    }
    mLimitNanos = TimeUnit.MILLISECONDS.toNanos(xiLimitMillis);
    mClock = xiClock;
  }

  @Override
  public boolean shouldContinue(int xiIterations)
  {
    long lNow = mClock.getAsLong();
    if (mStartNanos == NOT_STARTED)
    {
      mStartNanos = lNow;
    }
    if (lNow - mStartNanos > mLimitNanos)
    {
      mStartNanos = NOT_STARTED;
      return false;
    }
    return true;
  }
}

package me.arr28.prost.mcts.policy;

import java.util.Objects;
import java.util.Random;

import me.arr28.prost.mcts.policy.best.MaxAverageRewardPolicy;
import me.arr28.prost.mcts.policy.rollout.RandomRolloutPolicy;
import me.arr28.prost.mcts.policy.tree.RandomExpandPolicy;
import me.arr28.prost.mcts.policy.tree.UCB1SelectPolicy;

/**
 * The policies for each phase of the search.  Immutable - the with...() methods return a modified copy.
 *
 * @author Andrew Rose
 */
public final class SearchPolicies
{
  private final SelectPolicy mSelectPolicy;
  private final ExpandPolicy mExpandPolicy;
  private final RolloutPolicy mRolloutPolicy;
  private final BestActionPolicy mBestActionPolicy;

  /**
   * Create a set of policies.
   *
   * @param xiSelectPolicy - the policy to use when descending through tried actions.
   * @param xiExpandPolicy - the policy to use when choosing an untried action to expand.
   * @param xiRolloutPolicy - the policy to use during the rollout.
   * @param xiBestActionPolicy - the policy to use for choosing the action to report.
   */
  public SearchPolicies(SelectPolicy xiSelectPolicy,
                        ExpandPolicy xiExpandPolicy,
                        RolloutPolicy xiRolloutPolicy,
                        BestActionPolicy xiBestActionPolicy)
  {
    mSelectPolicy = Objects.requireNonNull(xiSelectPolicy, "select policy");
    mExpandPolicy = Objects.requireNonNull(xiExpandPolicy, "expand policy");
    mRolloutPolicy = Objects.requireNonNull(xiRolloutPolicy, "rollout policy");
    mBestActionPolicy = Objects.requireNonNull(xiBestActionPolicy, "best action policy");
  }

  /**
   * @return the default policies: UCB1 selection, random expansion and rollouts, best average reward.
   *
   * @param xiRandom - the source of randomness for the random policies.
   */
  public static SearchPolicies defaults(Random xiRandom)
  {
    return defaults(xiRandom, UCB1SelectPolicy.DEFAULT_EXPLORATION);
  }

  /**
   * @return the default policies, with a specific UCB1 exploration constant.
   *
   * @param xiRandom - the source of randomness for the random policies.
   * @param xiExploration - the UCB1 exploration constant.
   */
  public static SearchPolicies defaults(Random xiRandom, double xiExploration)
  {
    return new SearchPolicies(new UCB1SelectPolicy(xiExploration),
                              new RandomExpandPolicy(xiRandom),
                              new RandomRolloutPolicy(xiRandom),
                              new MaxAverageRewardPolicy());
  }

  public SelectPolicy getSelectPolicy()
  {
    return mSelectPolicy;
  }

  public ExpandPolicy getExpandPolicy()
  {
    return mExpandPolicy;
  }

  public RolloutPolicy getRolloutPolicy()
  {
    return mRolloutPolicy;
  }

  public BestActionPolicy getBestActionPolicy()
  {
    return mBestActionPolicy;
  }

  public SearchPolicies withSelectPolicy(SelectPolicy xiPolicy)
  {
    return new SearchPolicies(xiPolicy, mExpandPolicy, mRolloutPolicy, mBestActionPolicy);
  }

  public SearchPolicies withExpandPolicy(ExpandPolicy xiPolicy)
  {
    return new SearchPolicies(mSelectPolicy, xiPolicy, mRolloutPolicy, mBestActionPolicy);
  }

  public SearchPolicies withRolloutPolicy(RolloutPolicy xiPolicy)
  {
    return new SearchPolicies(mSelectPolicy, mExpandPolicy, xiPolicy, mBestActionPolicy);
  }

  public SearchPolicies withBestActionPolicy(BestActionPolicy xiPolicy)
  {
    return new SearchPolicies(mSelectPolicy, mExpandPolicy, mRolloutPolicy, xiPolicy);
  }
}

package me.arr28.prost.mcts;

import java.util.Objects;
import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import me.arr28.prost.config.SearchConfig;
import me.arr28.prost.mcts.budget.Budget;
import me.arr28.prost.mcts.policy.SearchPolicies;
import me.arr28.prost.problem.Problem;
import me.arr28.prost.problem.State;

/**
 * Chooses the next action for a state by Monte Carlo Tree Search.
 *
 * Every search builds a fresh tree, which is discarded (apart from what the result refers to) once the action has
 * been chosen.  A searcher is not thread-safe; use one per thread.
 *
 * @author Andrew Rose
 */
public class MCTSSearch
{
  private static final Logger LOGGER = LogManager.getLogger(MCTSSearch.class);

  private final SearchConfig mConfig;
  private final SearchPolicies mPolicies;
  private final Random mRandom;

  /**
   * Create a searcher with the default policies.
   *
   * @param xiConfig - the search settings.
   */
  public MCTSSearch(SearchConfig xiConfig)
  {
    this(xiConfig, xiConfig.createRandom());
  }

  private MCTSSearch(SearchConfig xiConfig, Random xiRandom)
  {
    this(xiConfig, SearchPolicies.defaults(xiRandom, xiConfig.getExplorationConstant()), xiRandom);
  }

  /**
   * Create a searcher.
   *
   * @param xiConfig - the search settings.
   * @param xiPolicies - the policies for each phase of the search.
   * @param xiRandom - the source of randomness for drawing effects.
   */
  public MCTSSearch(SearchConfig xiConfig, SearchPolicies xiPolicies, Random xiRandom)
  {
    xiConfig.validate();
    mConfig = xiConfig;
    mPolicies = Objects.requireNonNull(xiPolicies, "policies");
    mRandom = Objects.requireNonNull(xiRandom, "random");
  }

  /**
   * Search with a budget created from the settings.
   *
   * @param xiProblem - the problem.
   * @param xiState - the state to choose an action for.
   *
   * @return the result.
   */
  public SearchResult search(Problem xiProblem, State xiState)
  {
    return search(xiProblem, xiState, mConfig.createBudget());
  }

  /**
   * Search.
   *
   * @param xiProblem - the problem.
   * @param xiState - the state to choose an action for.
   * @param xiBudget - the budget.
   *
   * @return the result.
   */
  public SearchResult search(Problem xiProblem, State xiState, Budget xiBudget)
  {
    LOGGER.debug("Searching {} from {}", xiProblem.getName(), xiState);
    MCTSTree lTree = new MCTSTree(xiProblem,
                                  xiState,
                                  mPolicies,
                                  mConfig.getHorizon(),
                                  mConfig.getDiscounting(),
                                  mRandom,
                                  mConfig.getMaxNodes());
    int lIterations = lTree.iterate(xiBudget);

    SearchResult lResult = new SearchResult(lTree, lIterations);
    if (lResult.getBestAction() == null)
    {
      LOGGER.warn("No action chosen for {} after {} iterations{}",
                  xiState,
                  lIterations,
                  lTree.getRoot().isGoal() ? " (already a goal)" : "");
    }
    else
    {
      LOGGER.debug("Chose {} after {} iterations ({} nodes): {}",
                   lResult.getBestAction(),
                   lIterations,
                   lResult.getNumNodes(),
                   lResult.getActionInfo());
    }
    return lResult;
  }

  public SearchPolicies getPolicies()
  {
    return mPolicies;
  }
}

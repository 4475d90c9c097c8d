package me.arr28.prost.scripts;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import me.arr28.prost.ExampleProblems;
import me.arr28.prost.config.SearchConfig;
import me.arr28.prost.mcts.MCTSSearch;
import me.arr28.prost.mcts.SearchResult;
import me.arr28.prost.mcts.export.DotExporter;
import me.arr28.prost.problem.Action;
import me.arr28.prost.problem.Effect;
import me.arr28.prost.problem.Problem;
import me.arr28.prost.problem.State;

/**
 * Plays one episode of the gangster problem, searching afresh before every step.
 *
 * Usage: MaffiaPlanner [config.json [tree-dir]].  If a directory is given, the tree behind each decision is written
 * there in DOT format.
 */
public class MaffiaPlanner
{
  private static final int MAX_STEPS = 20;

  public static void main(String[] xiArgs) throws IOException
  {
    SearchConfig lConfig = (xiArgs.length > 0) ? SearchConfig.load(Paths.get(xiArgs[0])) : SearchConfig.loadDefault();
    Path lTreeDir = (xiArgs.length > 1) ? Paths.get(xiArgs[1]) : null;

    Problem lProblem = ExampleProblems.maffia();
    MCTSSearch lSearch = new MCTSSearch(lConfig);
    DotExporter lExporter = new DotExporter();
    System.out.println(lProblem.describe());

    State lState = lProblem.getInitialState();
    double lTotalReward = 0;
    int lStep;
    for (lStep = 0; (lStep < MAX_STEPS) && !lProblem.isGoal(lState); lStep++)
    {
      long lStartTime = System.nanoTime();
      SearchResult lResult = lSearch.search(lProblem, lState);
      long lElapsed = (System.nanoTime() - lStartTime) / 1_000_000;

      Action lAction = lResult.getBestAction();
      if (lAction == null)
      {
        System.out.println("No applicable action in " + lState);
        break;
      }

      if (lTreeDir != null)
      {
        lExporter.write(lResult.getRoot(), lTreeDir.resolve("step" + lStep + ".dot"));
      }

      Effect lEffect = lAction.outcome();
      lTotalReward += lEffect.getReward();
      State lNext = lState.apply(lEffect);
      System.out.println(lState + " --" + lAction + "--> " + lNext + "  [" + lResult.getActionInfo() + ", " +
                         lResult.getIterations() + " iterations in " + lElapsed + "ms]");
      lState = lNext;
    }

    if (lProblem.isGoal(lState))
    {
      lTotalReward += lProblem.getGoalReward();
      System.out.println("Reached goal " + lState + " after " + lStep + " steps, total reward " + lTotalReward);
    }
    else
    {
      System.out.println("Gave up in " + lState + " after " + lStep + " steps, total reward " + lTotalReward);
    }
  }
}

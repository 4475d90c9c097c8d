package me.arr28.prost.mcts.export;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

import me.arr28.prost.mcts.ScoreBoard;
import me.arr28.prost.mcts.TreeNode;
import me.arr28.prost.problem.Action;

/**
 * Renders a search tree as a Graphviz DOT graph.
 *
 * States are drawn as decision nodes labelled with their atoms and "utility,visits".  Each tried action is a box
 * joined to its state by an edge labelled "reward,visits" (thicker for more visits), with dashed edges to the states
 * its effects led to.  Actions that were only simulated aren't drawn.
 *
 * @author Andrew Rose
 */
public class DotExporter
{
  /**
   * @return the DOT graph of the tree below (and including) the specified node.
   *
   * @param xiRoot - the node to start from.
   */
  public String export(TreeNode xiRoot)
  {
    StringBuilder lBuilder = new StringBuilder("graph search {\n");
    appendNode(lBuilder, xiRoot, "0");
    lBuilder.append("}\n");
    return lBuilder.toString();
  }

  /**
   * Write the DOT graph of a tree to a file.
   *
   * @param xiRoot - the node to start from.
   * @param xiFile - the file.
   *
   * @return the file.
   *
   * @throws IOException if the file can't be written.
   */
  public Path write(TreeNode xiRoot, Path xiFile) throws IOException
  {
    Files.writeString(xiFile, export(xiRoot), StandardCharsets.UTF_8);
    return xiFile;
  }

  private void appendNode(StringBuilder xiBuilder, TreeNode xiNode, String xiName)
  {
    String lDecision = "decision_node" + xiName;
    xiBuilder.append("  ").append(lDecision)
             .append(" [label=\"").append(escape(String.join(", ", xiNode.getState().getAtoms())))
             .append("\\n").append(format("%.2f", xiNode.getUtility())).append(',').append(xiNode.getVisitCount())
             .append("\"]\n");

    Map<Action, ScoreBoard> lTried = xiNode.getTriedActions();
    for (Action lAction : lTried.keySet())
    {
      xiBuilder.append("  ").append(actionNode(xiName, lAction))
               .append(" [label=\"").append(escape(lAction.getName())).append("\", shape=box]\n");
    }

    int lNextId = 0;
    for (TreeNode lChild : xiNode.getChildren())
    {
      if (lTried.containsKey(lChild.getAction()))
      {
        String lChildName = xiName + "_" + lNextId++;
        appendNode(xiBuilder, lChild, lChildName);
        xiBuilder.append("  ").append(actionNode(xiName, lChild.getAction()))
                 .append(" -- decision_node").append(lChildName)
                 .append(" [style=dashed, label=\"").append(escape(lChild.getEffect().toString())).append("\"]\n");
      }
    }

    for (Map.Entry<Action, ScoreBoard> lEntry : lTried.entrySet())
    {
      ScoreBoard lScores = lEntry.getValue();
      xiBuilder.append("  ").append(lDecision).append(" -- ").append(actionNode(xiName, lEntry.getKey()))
               .append(" [label=\"").append(format("%.2f", lScores.getTotalReward())).append(',')
               .append(lScores.getVisitCount())
               .append("\", penwidth=\"").append(format("%.3f", Math.pow(lScores.getVisitCount(), 0.25)))
               .append("\"]\n");
    }
  }

  private static String actionNode(String xiName, Action xiAction)
  {
    return "\"action_node" + xiName + "_" + escape(xiAction.getName()) + "\"";
  }

  private static String format(String xiFormat, double xiValue)
  {
    return String.format(Locale.ROOT, xiFormat, xiValue);
  }

  private static String escape(String xiText)
  {
    return xiText.replace("\\", "\\\\").replace("\"", "\\\"");
  }
}

package me.arr28.prost.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import me.arr28.prost.mcts.budget.Budget;
import me.arr28.prost.mcts.budget.IterationBudget;
import me.arr28.prost.mcts.budget.TimedBudget;
import me.arr28.prost.mcts.policy.tree.UCB1SelectPolicy;
import me.arr28.prost.pool.Arena;

/**
 * Search settings, bound from JSON.  Missing keys keep their defaults; unknown keys are ignored.
 *
 * <pre>
 * {
 *   "horizon": 50,
 *   "discounting": 0.9,
 *   "iterations": 1000,
 *   "timeLimitMillis": 0,
 *   "seed": null,
 *   "explorationConstant": 0.7071,
 *   "maxNodes": 0
 * }
 * </pre>
 *
 * @author Andrew Rose
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchConfig
{
  private static final Logger LOGGER = LogManager.getLogger(SearchConfig.class);

  // Leave callers' streams open and refuse fractions for whole-number settings.
  private static final ObjectMapper MAPPER = new ObjectMapper()
                                                 .configure(JsonParser.Feature.AUTO_CLOSE_SOURCE, false)
                                                 .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false);

  /**
   * Classpath resource read by loadDefault().
   */
  public static final String DEFAULT_RESOURCE = "/prost-search.json";

  @JsonProperty("horizon")
  private int mHorizon = 50;

  @JsonProperty("discounting")
  private double mDiscounting = 0.9;

  @JsonProperty("iterations")
  private int mIterations = 1000;

  // 0 to use the iteration budget instead.
  @JsonProperty("timeLimitMillis")
  private long mTimeLimitMillis = 0;

  // null for an unseeded generator.
  @JsonProperty("seed")
  private Long mSeed;

  @JsonProperty("explorationConstant")
  private double mExplorationConstant = UCB1SelectPolicy.DEFAULT_EXPLORATION;

  @JsonProperty("maxNodes")
  private int mMaxNodes = Arena.UNLIMITED;

  /**
   * Load settings from a JSON file.
   *
   * @param xiFile - the file.
   *
   * @return the validated settings.
   *
   * @throws IOException if the file can't be read or parsed.
   */
  public static SearchConfig load(Path xiFile) throws IOException
  {
    try (InputStream lStream = Files.newInputStream(xiFile))
    {
      SearchConfig lConfig = load(lStream);
      LOGGER.info("Loaded search config from {}: {}", xiFile, lConfig);
      return lConfig;
    }
  }

  /**
   * Load settings from a JSON stream.  The stream isn't closed.
   *
   * @param xiStream - the stream.
   *
   * @return the validated settings.
   *
   * @throws IOException if the stream can't be read or parsed, or a whole-number setting has a fractional value.
   */
  public static SearchConfig load(InputStream xiStream) throws IOException
  {
    SearchConfig lConfig = MAPPER.readValue(xiStream, SearchConfig.class);
    if (lConfig == null)
    {
      lConfig = new SearchConfig();
    }
    lConfig.validate();
    return lConfig;
  }

  /**
   * Load settings from a classpath resource.
   *
   * @param xiResource - the resource name.
   *
   * @return the validated settings.
   *
   * @throws IOException if the resource doesn't exist or can't be parsed.
   */
  public static SearchConfig fromResource(String xiResource) throws IOException
  {
    try (InputStream lStream = SearchConfig.class.getResourceAsStream(xiResource))
    {
      if (lStream == null)
      {
        throw new IOException("No such resource: " + xiResource);
      }
      SearchConfig lConfig = load(lStream);
      LOGGER.info("Loaded search config from resource {}: {}", xiResource, lConfig);
      return lConfig;
    }
  }

  /**
   * @return the settings in DEFAULT_RESOURCE, or the built-in defaults if there is no such resource.
   *
   * @throws IOException if the resource exists but can't be parsed.
   */
  public static SearchConfig loadDefault() throws IOException
  {
    if (SearchConfig.class.getResource(DEFAULT_RESOURCE) == null)
    {
      LOGGER.info("No {} on the classpath, using built-in search defaults", DEFAULT_RESOURCE);
      return new SearchConfig();
    }
    return fromResource(DEFAULT_RESOURCE);
  }

  /**
   * Check that every setting is in range.
   *
   * @throws IllegalArgumentException if not.
   */
  public void validate()
  {
    if (mHorizon < 1)
    {
      throw new IllegalArgumentException("horizon must be >= 1 but got " + mHorizon);
    }
    if (!(mDiscounting > 0 && mDiscounting <= 1))
    {
      throw new IllegalArgumentException("discounting must be in (0, 1] but got " + mDiscounting);
    }
    if (mIterations < 1)
    {
      throw new IllegalArgumentException("iterations must be >= 1 but got " + mIterations);
    }
    if (mTimeLimitMillis < 0)
    {
      throw new IllegalArgumentException("timeLimitMillis must be >= 0 but got " + mTimeLimitMillis);
    }
    if (!(mExplorationConstant >= 0) || Double.isInfinite(mExplorationConstant))
    {
      throw new IllegalArgumentException("explorationConstant must be finite and >= 0 but got " +
                                         mExplorationConstant);
    }
    if ((mMaxNodes < 0) || ((mMaxNodes != Arena.UNLIMITED) && (mMaxNodes <= mHorizon + 2)))
    {
      throw new IllegalArgumentException("maxNodes must be 0 (unlimited) or more than horizon + 2 but got " +
                                         mMaxNodes);
    }
  }

  /**
   * @return a new budget: timed if there is a time limit, otherwise a fixed number of iterations.
   */
  public Budget createBudget()
  {
    return (mTimeLimitMillis > 0) ? new TimedBudget(mTimeLimitMillis) : new IterationBudget(mIterations);
  }

  /**
   * @return a new random number generator, seeded if there is a seed.
   */
  public Random createRandom()
  {
    return (mSeed == null) ? new Random() : new Random(mSeed);
  }

  public int getHorizon()
  {
    return mHorizon;
  }

  public SearchConfig setHorizon(int xiHorizon)
  {
    mHorizon = xiHorizon;
    return this;
  }

  public double getDiscounting()
  {
    return mDiscounting;
  }

  public SearchConfig setDiscounting(double xiDiscounting)
  {
    mDiscounting = xiDiscounting;
    return this;
  }

  public int getIterations()
  {
    return mIterations;
  }

  public SearchConfig setIterations(int xiIterations)
  {
    mIterations = xiIterations;
    return this;
  }

  public long getTimeLimitMillis()
  {
    return mTimeLimitMillis;
  }

  public SearchConfig setTimeLimitMillis(long xiTimeLimitMillis)
  {
    mTimeLimitMillis = xiTimeLimitMillis;
    return this;
  }

  public Long getSeed()
  {
    return mSeed;
  }

  public SearchConfig setSeed(Long xiSeed)
  {
    mSeed = xiSeed;
    return this;
  }

  public double getExplorationConstant()
  {
    return mExplorationConstant;
  }

  public SearchConfig setExplorationConstant(double xiExplorationConstant)
  {
    mExplorationConstant = xiExplorationConstant;
    return this;
  }

  public int getMaxNodes()
  {
    return mMaxNodes;
  }

  public SearchConfig setMaxNodes(int xiMaxNodes)
  {
    mMaxNodes = xiMaxNodes;
    return this;
  }

  @Override
  public String toString()
  {
    return "horizon=" + mHorizon + ", discounting=" + mDiscounting + ", iterations=" + mIterations +
           ", timeLimitMillis=" + mTimeLimitMillis + ", seed=" + mSeed + ", explorationConstant=" +
           mExplorationConstant + ", maxNodes=" + mMaxNodes;
  }
}

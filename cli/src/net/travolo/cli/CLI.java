/*
 * Copyright Travolo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package net.travolo.cli;

import java.io.File;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.google.common.base.Splitter;
import com.google.common.collect.Lists;
import com.lexicalscope.jewel.cli.ArgumentValidationException;
import com.lexicalscope.jewel.cli.CliFactory;
import org.apache.mahout.cf.taste.common.TasteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.travolo.common.LangUtils;
import net.travolo.common.log.LogUtils;
import net.travolo.online.DestinationRecommender;
import net.travolo.online.HybridRanker;
import net.travolo.online.RankedDestination;
import net.travolo.online.RecommendationResult;
import net.travolo.online.RecommenderConfiguration;
import net.travolo.online.SimilarityProviderFactory;
import net.travolo.online.content.ContentFactor;
import net.travolo.online.content.ContentScorer;
import net.travolo.online.content.LoggingScoreDiagnostics;
import net.travolo.online.content.NullScoreDiagnostics;
import net.travolo.online.content.ScoreDiagnostics;
import net.travolo.online.content.ScoreRecord;
import net.travolo.online.feedback.FeedbackAdjuster;
import net.travolo.online.feedback.ProfileAdjustment;
import net.travolo.online.io.CatalogFileReader;
import net.travolo.online.io.RatingsFileReader;
import net.travolo.online.model.CatalogItem;
import net.travolo.online.model.GeoPoint;
import net.travolo.online.model.PreferenceProfile;
import net.travolo.online.model.Rating;
import net.travolo.online.model.Theme;
import net.travolo.online.similarity.CollaborativeScorer;
import net.travolo.online.similarity.SimilarityCache;

/**
 * <p>A basic command-line interface to {@link DestinationRecommender}. It is run like so:</p>
 *
 * <p>{@code java -jar travolo-cli-X.Y.jar [options] command}</p>
 *
 * <p>"options" name the input files:</p>
 *
 * <ul>
 *   <li>{@code --catalogFile}: destination catalog CSV. Required.</li>
 *   <li>{@code --climateFile}: monthly temperatures CSV. Optional.</li>
 *   <li>{@code --similarityFile}: item-item similarity CSV. Optional; without it (or
 *     {@code --similarityProviderClass}) collaborative scores are empty.</li>
 *   <li>{@code --ratingsFile}: the user's like/dislike ratings. Optional.</li>
 * </ul>
 *
 * <p>describe the user's preferences:</p>
 *
 * <ul>
 *   <li>{@code --themes}, {@code --temperatureRange}, {@code --travelMonths}, {@code --travelDuration},
 *     {@code --preferredRegions}, {@code --origin}, {@code --travelBudget}</li>
 * </ul>
 *
 * <p>and tune the ranking: {@code --howMany}, {@code --contentWeight}, {@code --collabWeight},
 * {@code --verbose}.</p>
 *
 * <p>"command" may be any value of {@link CLICommand}, in lower case if you like. Output is CSV:</p>
 *
 * <ul>
 *   <li>{@code recommend}: {@code itemID,confidence,hybridScore}, best first</li>
 *   <li>{@code adjust}: {@code theme,adjustment,adjustedScore}, one line per theme</li>
 *   <li>{@code score}: {@code itemID} followed by each content sub-score (empty when absent) and the
 *     content score, in catalog order</li>
 *   <li>{@code collaborative}: {@code itemID,collaborativeScore}</li>
 * </ul>
 *
 * <p>For example:</p>
 *
 * <p>{@code java -jar travolo-cli-X.Y.jar --catalogFile catalog.csv --climateFile climate.csv
 *   --themes culture=5,cuisine=4 --travelMonths July --temperatureRange 20,28 recommend}</p>
 */
public final class CLI {

  private static final Logger log = LoggerFactory.getLogger(CLI.class);

  private static final Splitter COMMA = Splitter.on(',').trimResults().omitEmptyStrings();

  private CLI() {
  }

  public static void main(String[] args) throws Exception {
    doMain(args, System.out);
  }

  /**
   * @return true if the command ran, false if usage help was printed instead
   */
  static boolean doMain(String[] args, PrintStream out) throws TasteException {

    CLIArgs cliArgs;
    try {
      cliArgs = CliFactory.parseArguments(CLIArgs.class, args);
    } catch (ArgumentValidationException ave) {
      printHelp(out, ave.getMessage());
      return false;
    }

    List<String> programArgsList = cliArgs.getCommands();
    if (programArgsList == null || programArgsList.size() != 1) {
      printHelp(out, "Specify exactly one command");
      return false;
    }

    CLICommand command;
    try {
      command = CLICommand.valueOf(programArgsList.get(0).toUpperCase(Locale.ENGLISH));
    } catch (IllegalArgumentException iae) {
      printHelp(out, iae.getMessage());
      return false;
    }

    ScoreDiagnostics diagnostics = NullScoreDiagnostics.getInstance();
    if (cliArgs.isVerbose()) {
      LogUtils.setSensibleLogFormat();
      LogUtils.enableDebugLoggingIn(CLI.class,
                                    DestinationRecommender.class,
                                    FeedbackAdjuster.class,
                                    ContentScorer.class,
                                    CollaborativeScorer.class,
                                    HybridRanker.class,
                                    LoggingScoreDiagnostics.class);
      log.debug("{}", cliArgs);
      diagnostics = new LoggingScoreDiagnostics();
    }

    try {
      RecommenderConfiguration config = buildConfiguration(cliArgs);
      PreferenceProfile profile = buildProfile(cliArgs);

      CatalogFileReader catalogReader = new CatalogFileReader(cliArgs.getCatalogFile(), cliArgs.getClimateFile());
      List<CatalogItem> catalog = catalogReader.getCatalog();
      log.info("Loaded {} destinations", catalog.size());

      SimilarityCache similarityCache =
          new SimilarityCache(SimilarityProviderFactory.buildSimilarityProvider(config));
      DestinationRecommender recommender =
          new DestinationRecommender(catalogReader, similarityCache, config, diagnostics);

      switch (command) {
        case RECOMMEND:
          doRecommend(profile, catalog, recommender, out);
          break;
        case ADJUST:
          doAdjust(profile, catalog, recommender, out);
          break;
        case SCORE:
          doScore(profile, catalog, recommender, out);
          break;
        case COLLABORATIVE:
          doCollaborative(profile, catalog, recommender, out);
          break;
      }
    } catch (ArgumentValidationException ave) {
      printHelp(out, ave.getMessage());
      return false;
    }
    return true;
  }

  private static void doRecommend(PreferenceProfile profile,
                                  List<CatalogItem> catalog,
                                  DestinationRecommender recommender,
                                  PrintStream out) {
    RecommendationResult result = recommender.recommend(profile, catalog);
    ProfileAdjustment adjustment = result.getAdjustment();
    if (adjustment != null && adjustment.isAdjusted()) {
      log.info("Profile adjusted from feedback: {}", adjustment);
    }
    for (RankedDestination destination : result.getDestinations()) {
      out.println(destination.getItemID() + ',' + destination.getConfidence() + ',' + destination.getHybridScore());
    }
  }

  private static void doAdjust(PreferenceProfile profile,
                               List<CatalogItem> catalog,
                               DestinationRecommender recommender,
                               PrintStream out) {
    ProfileAdjustment adjustment = recommender.adjustProfile(profile, catalog);
    PreferenceProfile adjusted = adjustment.getAdjustedProfile();
    for (Theme theme : Theme.values()) {
      out.println(theme.label() + ',' + adjustment.getThemeAdjustment(theme) + ',' + adjusted.getThemeScore(theme));
    }
  }

  private static void doScore(PreferenceProfile profile,
                              List<CatalogItem> catalog,
                              DestinationRecommender recommender,
                              PrintStream out) {
    PreferenceProfile adjusted = recommender.adjustProfile(profile, catalog).getAdjustedProfile();
    Map<String,ScoreRecord> scores = recommender.scoreContent(adjusted, catalog);
    for (ScoreRecord record : scores.values()) {
      StringBuilder line = new StringBuilder(record.getItemID());
      for (ContentFactor factor : ContentFactor.values()) {
        line.append(',');
        if (record.hasFactorScore(factor)) {
          line.append(record.getFactorScore(factor));
        }
      }
      line.append(',').append(record.getContentScore());
      out.println(line);
    }
  }

  private static void doCollaborative(PreferenceProfile profile,
                                      List<CatalogItem> catalog,
                                      DestinationRecommender recommender,
                                      PrintStream out) {
    PreferenceProfile adjusted = recommender.adjustProfile(profile, catalog).getAdjustedProfile();
    Map<String,Double> scores = recommender.scoreCollaborative(adjusted, catalog);
    for (Map.Entry<String,Double> entry : scores.entrySet()) {
      out.println(entry.getKey() + ',' + entry.getValue());
    }
  }

  static RecommenderConfiguration buildConfiguration(CLIArgs cliArgs) {
    RecommenderConfiguration config = new RecommenderConfiguration();
    try {
      config.setHowMany(cliArgs.getHowMany());
      config.setContentWeight(cliArgs.getContentWeight());
      config.setCollabWeight(cliArgs.getCollabWeight());
    } catch (IllegalArgumentException iae) {
      throw new ArgumentValidationException(iae.getMessage());
    }
    File similarityFile = cliArgs.getSimilarityFile();
    if (similarityFile != null) {
      config.setSimilarityFile(similarityFile.getAbsolutePath());
    }
    config.setSimilarityProviderClass(cliArgs.getSimilarityProviderClass());
    return config;
  }

  static PreferenceProfile buildProfile(CLIArgs cliArgs) throws TasteException {
    PreferenceProfile.Builder builder = PreferenceProfile.builder();

    String themes = cliArgs.getThemes();
    if (themes != null) {
      parseThemes(themes, builder);
    }

    String temperatureRange = cliArgs.getTemperatureRange();
    if (temperatureRange != null) {
      List<String> bounds = COMMA.splitToList(temperatureRange);
      if (bounds.size() != 2) {
        throw new ArgumentValidationException("temperatureRange is min,max");
      }
      builder.temperatureRange(parseDouble(bounds.get(0)), parseDouble(bounds.get(1)));
    }

    builder.travelMonths(splitList(cliArgs.getTravelMonths()));
    builder.travelDurations(splitList(cliArgs.getTravelDuration()));
    builder.preferredRegions(splitList(cliArgs.getPreferredRegions()));
    builder.travelBudgets(splitList(cliArgs.getTravelBudget()));

    String origin = cliArgs.getOrigin();
    if (origin != null) {
      builder.origin(parseOrigin(origin));
    }

    File ratingsFile = cliArgs.getRatingsFile();
    if (ratingsFile != null) {
      Map<String,Rating> ratings = new RatingsFileReader(ratingsFile).read();
      log.info("Read {} ratings from {}", ratings.size(), ratingsFile);
      builder.ratings(ratings);
    }

    return builder.build();
  }

  /**
   * Accepts either nine scores in {@link Theme} order or {@code name=score} pairs; themes not named
   * in the pair form are left at 0, which the feedback step raises to {@link Theme#MIN_SCORE}.
   */
  static void parseThemes(String value, PreferenceProfile.Builder builder) {
    List<String> tokens = COMMA.splitToList(value);
    if (tokens.isEmpty()) {
      return;
    }
    if (tokens.get(0).indexOf('=') >= 0) {
      for (String token : tokens) {
        int equals = token.indexOf('=');
        if (equals <= 0) {
          throw new ArgumentValidationException("Expected theme=score but got " + token);
        }
        Theme theme;
        try {
          theme = Theme.valueOf(token.substring(0, equals).trim().toUpperCase(Locale.ENGLISH));
        } catch (IllegalArgumentException iae) {
          throw new ArgumentValidationException("Unknown theme in " + token);
        }
        builder.themeScore(theme, parseInt(token.substring(equals + 1).trim()));
      }
    } else {
      if (tokens.size() != Theme.COUNT) {
        throw new ArgumentValidationException(
            "Expected " + Theme.COUNT + " theme scores but got " + tokens.size());
      }
      int[] scores = new int[Theme.COUNT];
      for (int i = 0; i < scores.length; i++) {
        scores[i] = parseInt(tokens.get(i));
      }
      builder.themeScores(scores);
    }
  }

  static GeoPoint parseOrigin(String value) {
    List<String> tokens = COMMA.splitToList(value);
    if (tokens.size() != 2 && tokens.size() != 3) {
      throw new ArgumentValidationException("origin is lat,lon[,name]");
    }
    double latitude = parseDouble(tokens.get(0));
    double longitude = parseDouble(tokens.get(1));
    return tokens.size() == 3 ?
        new GeoPoint(tokens.get(2), latitude, longitude) :
        new GeoPoint(latitude, longitude);
  }

  private static List<String> splitList(String value) {
    return value == null ? Lists.<String>newArrayList() : COMMA.splitToList(value);
  }

  private static int parseInt(String s) {
    try {
      return Integer.parseInt(s);
    } catch (NumberFormatException nfe) {
      throw new ArgumentValidationException("Bad integer: " + s);
    }
  }

  private static double parseDouble(String s) {
    try {
      return LangUtils.parseDouble(s);
    } catch (IllegalArgumentException iae) {
      // also covers NumberFormatException
      throw new ArgumentValidationException("Bad number: " + s);
    }
  }

  private static void printHelp(PrintStream out, String message) {
    out.println();
    out.println("Travolo destination recommender command line interface.");
    out.println();
    if (message != null) {
      out.println(message);
      out.println();
    }
  }

}

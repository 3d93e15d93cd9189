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
import java.util.List;

import com.lexicalscope.jewel.cli.Option;
import com.lexicalscope.jewel.cli.Unparsed;

/**
 * Command line argument object for {@link CLI}. List-valued profile options are given as one
 * comma-separated argument so that they never swallow the command that follows them.
 */
public interface CLIArgs {

  @Option(description = "Verbose logging")
  boolean isVerbose();

  @Option(description = "Destination catalog CSV file")
  File getCatalogFile();

  @Option(defaultToNull = true, description = "Monthly climate CSV file: id,month,avg[,min,max]")
  File getClimateFile();

  @Option(defaultToNull = true, description = "Item similarity CSV file: itemID,neighborID,similarity")
  File getSimilarityFile();

  @Option(defaultToNull = true, description = "Custom SimilarityProvider implementation class")
  String getSimilarityProviderClass();

  @Option(defaultToNull = true, description = "Destination ratings CSV file: itemID,like|dislike")
  File getRatingsFile();

  @Option(defaultToNull = true,
          description = "Nine theme scores in order culture,adventure,nature,beaches,nightlife,cuisine," +
                        "wellness,urban,seclusion, or name=score pairs like adventure=5,nature=4")
  String getThemes();

  @Option(defaultToNull = true, description = "Desired temperature range in Celsius, as min,max")
  String getTemperatureRange();

  @Option(defaultToNull = true, description = "Travel months, comma-separated, like July,August")
  String getTravelMonths();

  @Option(defaultToNull = true, description = "Travel durations, comma-separated, like weekend,one-week")
  String getTravelDuration();

  @Option(defaultToNull = true, description = "Preferred regions, comma-separated")
  String getPreferredRegions();

  @Option(defaultToNull = true, description = "Origin location as lat,lon[,name]")
  String getOrigin();

  @Option(defaultToNull = true, description = "Acceptable budget levels, comma-separated, like budget,mid-range")
  String getTravelBudget();

  @Option(defaultValue = "3", description = "How many destinations to recommend")
  int getHowMany();

  @Option(defaultValue = "0.7", description = "Weight of the content score when ratings are present")
  double getContentWeight();

  @Option(defaultValue = "0.3", description = "Weight of the collaborative score when ratings are present")
  double getCollabWeight();

  @Option(helpRequest = true)
  boolean getHelp();

  @Unparsed
  List<String> getCommands();

}

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

package net.travolo.online.io;

import java.io.File;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import org.apache.mahout.cf.taste.common.TasteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.travolo.common.LangUtils;
import net.travolo.online.CatalogProvider;
import net.travolo.online.model.CatalogItem;
import net.travolo.online.model.MonthlyTemperature;
import net.travolo.online.model.Theme;

/**
 * <p>Reads the catalog from a file with one item per line:</p>
 *
 * <p>{@code id,city,country,region,budgetLevel,latitude,longitude,idealDurations,culture,adventure,nature,
 * beaches,nightlife,cuisine,wellness,urban,seclusion}</p>
 *
 * <p>{@code idealDurations} separates labels with {@code ;}. Any field but {@code id} may be empty;
 * an empty theme score counts as 0. Optionally, monthly temperatures come from a second file with lines
 * {@code id,month,avg[,min,max]}, month being 1-12.</p>
 *
 * <p>Both files are read again on each {@link #getCatalog()}.</p>
 */
public final class CatalogFileReader implements CatalogProvider {

  private static final Logger log = LoggerFactory.getLogger(CatalogFileReader.class);

  private static final Splitter DURATION_DELIMITER = Splitter.on(';').trimResults().omitEmptyStrings();
  private static final int FIRST_THEME_FIELD = 8;
  private static final int FIELD_COUNT = FIRST_THEME_FIELD + Theme.COUNT;

  private final File catalogFile;
  private final File climateFile;

  public CatalogFileReader(File catalogFile) {
    this(catalogFile, null);
  }

  /**
   * @param catalogFile items file
   * @param climateFile monthly temperatures file, or {@code null} if there is none
   */
  public CatalogFileReader(File catalogFile, File climateFile) {
    Preconditions.checkNotNull(catalogFile);
    this.catalogFile = catalogFile;
    this.climateFile = climateFile;
  }

  @Override
  public List<CatalogItem> getCatalog() throws TasteException {
    final Map<String,Map<Integer,MonthlyTemperature>> climate =
        climateFile == null ? Maps.<String,Map<Integer,MonthlyTemperature>>newHashMap() : readClimate(climateFile);

    final Map<String,CatalogItem> items = Maps.newLinkedHashMap();
    DelimitedLineProcessor.process(catalogFile, new DelimitedLineProcessor<Void>(catalogFile.toString()) {
      @Override
      void processTokens(List<String> tokens) {
        CatalogItem item = parseItem(tokens, climate);
        if (items.put(item.getID(), item) != null) {
          log.warn("Duplicate catalog item {} in {}; later line replaces earlier one", item.getID(), catalogFile);
        }
      }
      @Override
      public Void getResult() {
        return null;
      }
    });

    for (String itemID : climate.keySet()) {
      if (!items.containsKey(itemID)) {
        log.warn("Temperatures given for unknown catalog item {}", itemID);
      }
    }
    log.info("Read {} catalog items from {}", items.size(), catalogFile);
    return ImmutableList.copyOf(items.values());
  }

  private static CatalogItem parseItem(List<String> tokens, Map<String,Map<Integer,MonthlyTemperature>> climate) {
    Preconditions.checkArgument(tokens.size() == FIELD_COUNT,
                                "Expected %s fields but got %s", FIELD_COUNT, tokens.size());
    String id = tokens.get(0);
    Preconditions.checkArgument(!id.isEmpty(), "Missing item ID");
    CatalogItem.Builder builder = CatalogItem.builder(id)
        .city(Strings.emptyToNull(tokens.get(1)))
        .country(Strings.emptyToNull(tokens.get(2)))
        .region(Strings.emptyToNull(tokens.get(3)))
        .budgetLevel(Strings.emptyToNull(tokens.get(4)))
        .idealDurations(DURATION_DELIMITER.splitToList(tokens.get(7)));

    double latitude = DelimitedLineProcessor.optionalDouble(tokens, 5);
    double longitude = DelimitedLineProcessor.optionalDouble(tokens, 6);
    Preconditions.checkArgument(Double.isNaN(latitude) == Double.isNaN(longitude),
                                "Latitude and longitude must both be given or both be empty");
    if (!Double.isNaN(latitude)) {
      builder.coordinates(latitude, longitude);
    }

    Theme[] themes = Theme.values();
    for (int i = 0; i < themes.length; i++) {
      String token = tokens.get(FIRST_THEME_FIELD + i);
      if (!token.isEmpty()) {
        builder.themeScore(themes[i], Integer.parseInt(token));
      }
    }

    Map<Integer,MonthlyTemperature> temperatures = climate.get(id);
    if (temperatures != null) {
      for (Map.Entry<Integer,MonthlyTemperature> entry : temperatures.entrySet()) {
        builder.monthlyTemperature(entry.getKey(), entry.getValue());
      }
    }
    return builder.build();
  }

  private static Map<String,Map<Integer,MonthlyTemperature>> readClimate(File file) throws TasteException {
    final Map<String,Map<Integer,MonthlyTemperature>> climate = Maps.newHashMap();
    DelimitedLineProcessor.process(file, new DelimitedLineProcessor<Void>(file.toString()) {
      @Override
      void processTokens(List<String> tokens) {
        Preconditions.checkArgument(tokens.size() == 3 || tokens.size() == 5,
                                    "Expected 3 or 5 fields but got %s", tokens.size());
        String id = tokens.get(0);
        Preconditions.checkArgument(!id.isEmpty(), "Missing item ID");
        int month = Integer.parseInt(tokens.get(1));
        Preconditions.checkArgument(month >= 1 && month <= 12, "Bad month: %s", month);
        double avg = LangUtils.parseDouble(tokens.get(2));
        double min = optionalDouble(tokens, 3);
        double max = optionalDouble(tokens, 4);
        Map<Integer,MonthlyTemperature> months = climate.get(id);
        if (months == null) {
          months = Maps.newTreeMap();
          climate.put(id, months);
        }
        months.put(month, new MonthlyTemperature(avg, min, max));
      }
      @Override
      public Void getResult() {
        return null;
      }
    });
    return climate;
  }

}

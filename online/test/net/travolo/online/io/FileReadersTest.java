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
import java.net.URISyntaxException;
import java.util.List;
import java.util.Map;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.io.Files;
import com.google.common.io.Resources;
import org.apache.mahout.cf.taste.common.TasteException;
import org.junit.Test;

import net.travolo.common.TravoloTest;
import net.travolo.online.model.CatalogItem;
import net.travolo.online.model.MonthlyTemperature;
import net.travolo.online.model.Rating;
import net.travolo.online.model.Theme;
import net.travolo.online.similarity.SimilarityMatrix;

public final class FileReadersTest extends TravoloTest {

  private static File resource(String name) throws URISyntaxException {
    return new File(Resources.getResource(name).toURI());
  }

  @Test
  public void testCatalog() throws Exception {
    List<CatalogItem> catalog = new CatalogFileReader(resource("catalog.csv"), resource("climate.csv")).getCatalog();
    List<String> ids = Lists.newArrayList();
    for (CatalogItem item : catalog) {
      ids.add(item.getID());
    }
    assertEquals(ImmutableList.of("boston", "toulouse", "vientiane", "reykjavik"), ids);

    CatalogItem boston = catalog.get(0);
    assertEquals("Boston", boston.getCity());
    assertEquals("United States", boston.getCountry());
    assertEquals("North America", boston.getRegion());
    assertEquals("Luxury", boston.getBudgetLevel());
    assertEquals(42.3601, boston.getLatitude());
    assertEquals(-71.0589, boston.getLongitude());
    assertEquals(ImmutableList.of("Weekend", "One week", "Short trip"),
                 ImmutableList.copyOf(boston.getIdealDurations()));
    assertEquals(5, boston.getThemeScore(Theme.CULTURE));
    assertEquals(2, boston.getThemeScore(Theme.SECLUSION));
    MonthlyTemperature january = boston.getMonthlyTemperature(1);
    assertEquals(-0.1, january.getAvg());
    assertEquals(-3.8, january.getMin());
    assertEquals(3.6, january.getMax());
    assertNull(boston.getMonthlyTemperature(2));

    MonthlyTemperature august = catalog.get(1).getMonthlyTemperature(8);
    assertEquals(23.5, august.getAvg());
    assertNaN(august.getMin());

    assertTrue(catalog.get(2).getAvgTempMonthly().isEmpty());

    CatalogItem reykjavik = catalog.get(3);
    assertFalse(reykjavik.hasCoordinates());
    assertTrue(reykjavik.getIdealDurations().isEmpty());
    assertEquals(0, reykjavik.getThemeScore(Theme.CULTURE));
    assertEquals(5, reykjavik.getThemeScore(Theme.ADVENTURE));
  }

  @Test
  public void testCatalogWithoutClimate() throws Exception {
    List<CatalogItem> catalog = new CatalogFileReader(resource("catalog.csv")).getCatalog();
    assertEquals(4, catalog.size());
    assertTrue(catalog.get(0).getAvgTempMonthly().isEmpty());
  }

  @Test
  public void testDuplicateCatalogItems() throws Exception {
    File file = new File(getTestTempDir(), "dupes.csv");
    Files.asCharSink(file, Charsets.UTF_8).write(
        "x,First,,,,,,,1,1,1,1,1,1,1,1,1\n" +
        "y,Other,,,,,,,1,1,1,1,1,1,1,1,1\n" +
        "x,Second,,,,,,,2,2,2,2,2,2,2,2,2\n");
    List<CatalogItem> catalog = new CatalogFileReader(file).getCatalog();
    assertEquals(2, catalog.size());
    assertEquals("x", catalog.get(0).getID());
    assertEquals("Second", catalog.get(0).getCity());
  }

  @Test(expected = TasteException.class)
  public void testMissingCatalog() throws Exception {
    new CatalogFileReader(new File(getTestTempDir(), "absent.csv")).getCatalog();
  }

  @Test(expected = TasteException.class)
  public void testTooManyBadLines() throws Exception {
    File file = new File(getTestTempDir(), "garbage.csv");
    StringBuilder garbage = new StringBuilder();
    for (int i = 0; i <= DelimitedLineProcessor.MAX_BAD_LINES; i++) {
      garbage.append("not,a,catalog,line\n");
    }
    Files.asCharSink(file, Charsets.UTF_8).write(garbage);
    new CatalogFileReader(file).getCatalog();
  }

  @Test
  public void testSimilarities() throws Exception {
    SimilarityMatrix matrix = new FileSimilarityProvider(resource("similarity.csv")).load();
    assertEquals(2, matrix.size());
    assertEquals(0.6, matrix.getSimilarity("boston", "toulouse"));
    assertEquals(0.2, matrix.getSimilarity("boston", "vientiane"));
    assertEquals(0.6, matrix.getSimilarity("toulouse", "boston"));
    assertEquals(0.0, matrix.getSimilarity("toulouse", "vientiane"));
    assertTrue(matrix.getNeighbors("vientiane").isEmpty());
  }

  @Test(expected = TasteException.class)
  public void testMissingSimilarities() throws Exception {
    new FileSimilarityProvider(new File(getTestTempDir(), "absent.csv")).load();
  }

  @Test
  public void testRatings() throws Exception {
    Map<String,Rating> ratings = new RatingsFileReader(resource("ratings.csv")).read();
    assertEquals(ImmutableMap.of("boston", Rating.LIKE, "vientiane", Rating.DISLIKE), ratings);
  }

}

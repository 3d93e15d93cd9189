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

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.net.URISyntaxException;
import java.util.List;

import com.google.common.base.Splitter;
import com.google.common.collect.Lists;
import com.google.common.io.Resources;
import org.apache.mahout.cf.taste.common.TasteException;
import org.junit.Before;
import org.junit.Test;

import net.travolo.common.TravoloTest;

public final class CLITest extends TravoloTest {

  private static final Splitter LINES = Splitter.on('\n').trimResults().omitEmptyStrings();

  private String catalog;
  private String climate;
  private String similarity;
  private String ratings;
  private ByteArrayOutputStream bytes;
  private PrintStream out;

  @Before
  public void setUp() throws Exception {
    catalog = resource("catalog.csv");
    climate = resource("climate.csv");
    similarity = resource("similarity.csv");
    ratings = resource("ratings.csv");
    bytes = new ByteArrayOutputStream();
    out = new PrintStream(bytes, true, "UTF-8");
  }

  @Test
  public void testRecommendWithoutRatings() throws Exception {
    assertTrue(CLI.doMain(new String[] {
        "--catalogFile", catalog, "--themes", "3,3,3,3,3,3,3,3,3", "--howMany", "2", "recommend"}, out));
    List<String> lines = output();
    assertEquals(2, lines.size());
    assertTrue(lines.get(0), lines.get(0).startsWith("gamma,100,"));
    // alpha and beta tie; catalog order decides
    assertTrue(lines.get(1), lines.get(1).startsWith("alpha,"));
  }

  @Test
  public void testAdjust() throws Exception {
    assertTrue(CLI.doMain(new String[] {
        "--catalogFile", catalog, "--ratingsFile", ratings, "--themes", "3,3,3,3,3,3,3,3,3", "adjust"}, out));
    List<String> lines = output();
    assertEquals(9, lines.size());
    assertEquals("culture,4,5", lines.get(0));
    assertEquals("adventure,-4,1", lines.get(1));
    assertEquals("nature,0,3", lines.get(2));
    assertEquals("seclusion,0,3", lines.get(8));
  }

  @Test
  public void testCollaborative() throws Exception {
    assertTrue(CLI.doMain(new String[] {
        "--catalogFile", catalog, "--similarityFile", similarity, "--ratingsFile", ratings, "COLLABORATIVE"}, out));
    assertEquals(Lists.newArrayList("gamma,0.5"), output());
  }

  @Test
  public void testCollaborativeWithoutSimilarities() throws Exception {
    assertTrue(CLI.doMain(new String[] {
        "--catalogFile", catalog, "--ratingsFile", ratings, "collaborative"}, out));
    assertTrue(output().isEmpty());
  }

  @Test
  public void testScore() throws Exception {
    assertTrue(CLI.doMain(new String[] {
        "--catalogFile", catalog, "--climateFile", climate,
        "--themes", "culture=3,adventure=3,nature=3,beaches=3,nightlife=3,cuisine=3,wellness=3,urban=3,seclusion=3",
        "--travelMonths", "July", "--temperatureRange", "20,28", "score"}, out));
    List<String> lines = output();
    assertEquals(3, lines.size());
    assertTrue(lines.get(0).startsWith("alpha,"));
    assertTrue(lines.get(1).startsWith("beta,"));
    List<String> gamma = Splitter.on(',').splitToList(lines.get(2));
    assertEquals(8, gamma.size());
    assertEquals("gamma", gamma.get(0));
    assertEquals(1.0, Double.parseDouble(gamma.get(1)));
    assertEquals(1.0, Double.parseDouble(gamma.get(2)));
    for (int i = 3; i < 7; i++) {
      assertEquals("", gamma.get(i));
    }
    assertEquals(1.0, Double.parseDouble(gamma.get(7)));
  }

  @Test
  public void testRecommendBlendsCollaborativeScores() throws Exception {
    assertTrue(CLI.doMain(new String[] {
        "--catalogFile", catalog, "--similarityFile", similarity, "--ratingsFile", ratings,
        "--themes", "3,3,3,3,3,3,3,3,3", "--origin", "48.8566,2.3522,Paris", "--howMany", "1", "recommend"}, out));
    List<String> lines = output();
    assertEquals(1, lines.size());
    assertTrue(lines.get(0), lines.get(0).startsWith("gamma,"));
  }

  @Test
  public void testNoCommand() throws TasteException {
    assertFalse(CLI.doMain(new String[] {"--catalogFile", catalog}, out));
  }

  @Test
  public void testUnknownCommand() throws TasteException {
    assertFalse(CLI.doMain(new String[] {"--catalogFile", catalog, "ingest"}, out));
  }

  @Test
  public void testMissingCatalog() throws TasteException {
    assertFalse(CLI.doMain(new String[] {"recommend"}, out));
  }

  @Test
  public void testBadThemes() throws TasteException {
    assertFalse(CLI.doMain(new String[] {"--catalogFile", catalog, "--themes", "1,2,3", "recommend"}, out));
    assertFalse(CLI.doMain(new String[] {"--catalogFile", catalog, "--themes", "sunshine=5", "recommend"}, out));
    assertFalse(CLI.doMain(new String[] {"--catalogFile", catalog, "--themes", "culture=lots", "recommend"}, out));
  }

  @Test
  public void testBadWeights() throws TasteException {
    assertFalse(CLI.doMain(new String[] {"--catalogFile", catalog, "--howMany", "0", "recommend"}, out));
    assertFalse(CLI.doMain(new String[] {"--catalogFile", catalog, "--temperatureRange", "20", "recommend"}, out));
    assertFalse(CLI.doMain(new String[] {"--catalogFile", catalog, "--origin", "north,south", "recommend"}, out));
  }

  @Test
  public void testParseOrigin() {
    assertEquals("Paris", CLI.parseOrigin("48.8566, 2.3522, Paris").getName());
    assertNull(CLI.parseOrigin("48.8566,2.3522").getName());
    assertEquals(2.3522, CLI.parseOrigin("48.8566,2.3522").getLongitude());
  }

  @Test(expected = TasteException.class)
  public void testMissingRatingsFile() throws TasteException {
    CLI.doMain(new String[] {
        "--catalogFile", catalog, "--ratingsFile", new File(getTestTempDir(), "absent.csv").toString(), "adjust"}, out);
  }

  private List<String> output() throws UnsupportedEncodingException {
    return LINES.splitToList(bytes.toString("UTF-8"));
  }

  private static String resource(String name) throws URISyntaxException {
    return new File(Resources.getResource(name).toURI()).getAbsolutePath();
  }

}

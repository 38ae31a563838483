package com.github.finiteautomaton.cli;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests for the checkstring command line.
 */
public class FiniteAutomatonCliTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Rule
  public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();

  @Test
  public void testSentenceOutput() throws Exception {
    assertEquals(0, execute("checkstring", fixture("b-star-a.json"), "bba"));
    assertEquals("The string is accepted by the automaton.", out().trim());

    out.reset();
    assertEquals(0, execute("checkstring", fixture("b-star-a.json"), "ab"));
    assertEquals("The string is not accepted by the automaton.", out().trim());
    assertEquals("", err().trim());
  }

  @Test
  public void testBooleanOutput() throws Exception {
    assertEquals(0, execute("checkstring", "-b", fixture("b-star-a.json"), "a"));
    assertEquals("true", out().trim());

    out.reset();
    assertEquals(0, execute("checkstring", "--boolean", fixture("b-star-a.json"), ""));
    assertEquals("false", out().trim());
  }

  @Test
  public void testMissingFile() throws Exception {
    final String missing = new File(temporaryFolder.getRoot(), "missing.json").getPath();
    assertEquals(1, execute("checkstring", missing, "a"));
    assertTrue(err().startsWith("Error while reading file: "));
    assertEquals("", out());
  }

  @Test
  public void testDirectoryIsNotAFile() throws Exception {
    assertEquals(1, execute("checkstring", temporaryFolder.getRoot().getPath(), "a"));
    assertTrue(err().startsWith("Error while reading file: "));
  }

  @Test
  public void testMalformedAutomaton() throws Exception {
    assertEquals(1, execute("checkstring", fixture("malformed.json"), "a"));
    assertTrue(err().startsWith("Error while parsing automaton: "));
  }

  @Test
  public void testInvalidAutomaton() throws Exception {
    final File file = temporaryFolder.newFile("invalid.json");
    Files.write(file.toPath(), ("{\"alphabet\": \"a\", \"forceDeterminism\": false, "
        + "\"states\": [{\"name\": \"s\"}], \"transitions\": [{\"startState\": \"s\", "
        + "\"targetState\": \"s\", \"inputCharacters\": \"b\"}]}").getBytes(StandardCharsets.UTF_8));
    assertEquals(1, execute("checkstring", file.getPath(), "a"));
    assertTrue(err().startsWith("Error while parsing automaton: "));
  }

  @Test
  public void testNonDeterministicAutomaton() throws Exception {
    assertEquals(1, execute("checkstring", fixture("overlapping.json"), "a"));
    assertTrue(err().startsWith("Error while checking string: "));
    assertEquals("", out());
  }

  @Test
  public void testNoInitialState() throws Exception {
    assertEquals(1, execute("checkstring", fixture("no-initial.json"), "a"));
    assertTrue(err().startsWith("Error while checking string: "));
  }

  @Test
  public void testUsageErrors() throws Exception {
    assertEquals(2, execute());
    assertEquals(2, execute("frobnicate"));
    assertEquals(2, execute("checkstring", fixture("b-star-a.json")));
    assertEquals(2, execute("checkstring", "--nope", fixture("b-star-a.json"), "a"));
    assertTrue(err().contains("checkstring"));
    assertEquals("", out());
  }

  @Test
  public void testHelp() throws Exception {
    assertEquals(0, execute("--help"));
    assertTrue(out().contains("checkstring"));

    out.reset();
    assertEquals(0, execute("checkstring", "-h"));
    assertTrue(out().contains("--boolean"));
  }

  private int execute(final String... args) {
    return new FiniteAutomatonCli(new PrintStream(out, true), new PrintStream(err, true))
        .execute(args);
  }

  private String out() {
    return new String(out.toByteArray(), StandardCharsets.UTF_8);
  }

  private String err() {
    return new String(err.toByteArray(), StandardCharsets.UTF_8);
  }

  private static String fixture(final String name) throws URISyntaxException {
    return Paths.get(FiniteAutomatonCliTest.class.getResource("/automatons/" + name).toURI())
        .toString();
  }
}

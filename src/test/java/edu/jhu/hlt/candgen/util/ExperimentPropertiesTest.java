package edu.jhu.hlt.candgen.util;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import edu.jhu.hlt.candgen.ConfigurationException;

public class ExperimentPropertiesTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void commandLineOverridesFile() throws IOException {
    File f = tmp.newFile("run.properties");
    Files.write(f.toPath(), "parallelism=2\nsplit=1\n".getBytes(StandardCharsets.UTF_8));
    ExperimentProperties config = ExperimentProperties.init(
        new String[] {"config", f.getPath(), "parallelism", "8"});
    assertEquals(8, config.getInt("parallelism"));
    assertEquals(1, config.getInt("split", 0));
  }

  @Test
  public void defaultsAreRecorded() {
    ExperimentProperties config = new ExperimentProperties();
    assertFalse(config.getBoolean("clear", false));
    assertEquals("false", config.getProperty("clear"));
    assertEquals("x", config.getString("name", "x"));
  }

  @Test
  public void lists() {
    ExperimentProperties config = new ExperimentProperties();
    config.putAll(new String[] {"mention.types", " Part, Temp,,Volt "});
    assertEquals(Arrays.asList("Part", "Temp", "Volt"), config.getList("mention.types"));
  }

  @Test(expected = ConfigurationException.class)
  public void missingKey() {
    new ExperimentProperties().getString("relations");
  }

  @Test(expected = ConfigurationException.class)
  public void notAnInt() {
    ExperimentProperties config = new ExperimentProperties();
    config.putAll(new String[] {"parallelism", "many"});
    config.getInt("parallelism");
  }

  @Test(expected = ConfigurationException.class)
  public void oddArguments() {
    new ExperimentProperties().putAll(new String[] {"parallelism"});
  }

  @Test(expected = ConfigurationException.class)
  public void duplicateArguments() {
    new ExperimentProperties().putAll(new String[] {"split", "1", "split", "2"});
  }
}

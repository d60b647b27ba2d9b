package edu.jhu.hlt.candgen.util;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import com.google.common.base.Splitter;

import edu.jhu.hlt.candgen.ConfigurationException;

/**
 * Configuration for a run: "key value" pairs from the command line, optionally
 * on top of a properties file named by the "config" key.
 *
 * Methods with defaults will return the default if the key is not in this map,
 * and also add the (key, defaultValue) pair to this map, so that logging the
 * properties after a run shows everything that was used.
 */
public class ExperimentProperties extends java.util.Properties {
  private static final long serialVersionUID = 1L;

  private static final Splitter LIST = Splitter.on(',').trimResults().omitEmptyStrings();

  /**
   * Command line pairs override values in the file named by "config" (if any).
   */
  public static ExperimentProperties init(String[] mainArgs) {
    ExperimentProperties cli = new ExperimentProperties();
    cli.putAll(mainArgs);
    ExperimentProperties config = new ExperimentProperties();
    String file = cli.getProperty("config");
    if (file != null)
      config.load(new File(file));
    config.putAll(cli);
    return config;
  }

  public void load(File f) {
    try (Reader r = Files.newBufferedReader(f.toPath(), StandardCharsets.UTF_8)) {
      load(r);
    } catch (IOException e) {
      throw new ConfigurationException("could not read config file " + f.getPath(), e);
    }
  }

  public void putAll(String[] mainArgs) {
    putAll(mainArgs, false);
  }

  public void putAll(String[] mainArgs, boolean allowOverwrites) {
    if (mainArgs.length % 2 != 0)
      throw new ConfigurationException("expected key value pairs, got an odd number of arguments: " + mainArgs.length);
    for (int i = 0; i < mainArgs.length; i += 2) {
      Object old = put(mainArgs[i], mainArgs[i+1]);
      if (!allowOverwrites && old != null) {
        throw new ConfigurationException(mainArgs[i] + " has two values: "
            + mainArgs[i+1] + " and " + old);
      }
    }
  }

  public int getInt(String key, int defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      put(key, String.valueOf(defaultValue));
      return defaultValue;
    }
    return parseInt(key, value);
  }

  public int getInt(String key) {
    return parseInt(key, getString(key));
  }

  private static int parseInt(String key, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException(key + " is not an integer: " + value, e);
    }
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      put(key, String.valueOf(defaultValue));
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  public boolean getBoolean(String key) {
    return Boolean.parseBoolean(getString(key).trim());
  }

  public File getFile(String key) {
    return new File(getString(key));
  }

  public String getString(String key, String defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      put(key, defaultValue);
      return defaultValue;
    }
    return value;
  }

  public String getString(String key) {
    String value = getProperty(key);
    if (value == null)
      throw new ConfigurationException("missing required key: " + key);
    return value;
  }

  /** Comma separated, trimmed, empty items dropped. */
  public List<String> getList(String key) {
    return LIST.splitToList(getString(key));
  }
}

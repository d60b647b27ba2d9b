package edu.jhu.hlt.candgen.store;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.log4j.Logger;

import edu.jhu.hlt.candgen.ConfigurationException;
import edu.jhu.hlt.candgen.util.ExperimentProperties;

/**
 * Where the extraction tables live. This is the only thing workers share:
 * each of them calls {@link #open()} to get a connection of its own.
 */
public class StoreConfig {
  public static final Logger LOG = Logger.getLogger(StoreConfig.class);

  public static final String DEFAULT_URL = "jdbc:h2:mem:candgen;DB_CLOSE_DELAY=-1";

  // jdbc:<subprotocol>:<rest>
  private static final Pattern JDBC_URL = Pattern.compile("^jdbc:([a-zA-Z0-9]+):(.+)$");
  // //host[:port]/database[?params]
  private static final Pattern NETWORK = Pattern.compile("^//([^/:?;]+)(:\\d+)?/([^/?;]+).*$");

  private final String url;
  private final String user;
  private final String password;
  private final String databaseName;

  public StoreConfig(String url, String user, String password) {
    this.databaseName = validate(url);
    this.url = url;
    this.user = user;
    this.password = password;
  }

  public StoreConfig(String url) {
    this(url, "sa", "");
  }

  public static StoreConfig fromConfig(ExperimentProperties config) {
    return new StoreConfig(
        config.getString("store.url", DEFAULT_URL),
        config.getString("store.user", "sa"),
        config.getString("store.password", ""));
  }

  /**
   * Checks that url is a JDBC URL naming a database, and returns that name.
   */
  static String validate(String url) {
    if (url == null)
      throw new ConfigurationException("no store url");
    Matcher m = JDBC_URL.matcher(url);
    if (!m.matches())
      throw new ConfigurationException("not a jdbc url: " + url);
    String sub = m.group(1);
    String rest = m.group(2);
    if (rest.startsWith("//")) {
      Matcher n = NETWORK.matcher(rest);
      if (!n.matches())
        throw new ConfigurationException("no database name in " + url);
      return n.group(3);
    }
    if ("h2".equals(sub)) {
      // mem:name, file:path or a plain path, optionally followed by ;settings
      String db = rest;
      int semi = db.indexOf(';');
      if (semi >= 0)
        db = db.substring(0, semi);
      if (db.startsWith("mem:"))
        db = db.substring("mem:".length());
      else if (db.startsWith("file:"))
        db = db.substring("file:".length());
      if (db.trim().isEmpty())
        throw new ConfigurationException("no database name in " + url);
      return db;
    }
    return rest;
  }

  public String getUrl() {
    return url;
  }

  public String getDatabaseName() {
    return databaseName;
  }

  /**
   * Opens a new connection. Callers own the returned store and must close it.
   */
  public ExtractionStore open() {
    try {
      Connection conn = DriverManager.getConnection(url, user, password);
      if (LOG.isDebugEnabled())
        LOG.debug("[open] " + databaseName + " on " + Thread.currentThread().getName());
      return wrap(conn);
    } catch (SQLException e) {
      throw new StoreException("could not connect to " + url, e);
    }
  }

  /** Hands conn to a new store, closing it if that fails. */
  static ExtractionStore wrap(Connection conn) {
    try {
      return new ExtractionStore(conn);
    } catch (RuntimeException e) {
      try {
        conn.close();
      } catch (SQLException ce) {
        e.addSuppressed(ce);
      }
      throw e;
    }
  }

  @Override
  public String toString() {
    return "(StoreConfig " + url + " user=" + user + ")";
  }
}

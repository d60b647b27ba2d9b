package edu.jhu.hlt.candgen.store;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import edu.jhu.hlt.candgen.datatypes.RelationSchema;

/**
 * DDL for the extraction tables. Every statement is idempotent, so any number
 * of extractors may call these on startup.
 *
 * <pre>
 * document(id, name)
 * sentence(id, document_id, idx, text, char_start, words, char_offsets)
 * mention(id, type, document_id, sentence_id, sentence_idx, char_start, char_end, text)
 * relation_schema(name, roles)
 * cand_&lt;relation&gt;(id, split, document_id, &lt;role&gt;_id...)
 * </pre>
 *
 * Every cand_ table has one column per role, each a foreign key to mention
 * with ON DELETE CASCADE, and a unique constraint on (split, role columns).
 */
public final class StoreSchema {

  private StoreSchema() {}

  static final String[] BASE_TABLES = {
    "CREATE TABLE IF NOT EXISTS document ("
        + " id BIGINT PRIMARY KEY,"
        + " name VARCHAR(255) NOT NULL)",
    "CREATE TABLE IF NOT EXISTS sentence ("
        + " id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
        + " document_id BIGINT NOT NULL REFERENCES document(id) ON DELETE CASCADE,"
        + " idx INT NOT NULL,"
        + " text VARCHAR NOT NULL,"
        + " char_start INT NOT NULL,"
        + " words VARCHAR NOT NULL,"
        + " char_offsets VARCHAR NOT NULL,"
        + " UNIQUE (document_id, idx))",
    "CREATE TABLE IF NOT EXISTS mention ("
        + " id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
        + " type VARCHAR(255) NOT NULL,"
        + " document_id BIGINT NOT NULL REFERENCES document(id) ON DELETE CASCADE,"
        + " sentence_id BIGINT NOT NULL,"
        + " sentence_idx INT NOT NULL,"
        + " char_start INT NOT NULL,"
        + " char_end INT NOT NULL,"
        + " text VARCHAR NOT NULL,"
        + " UNIQUE (type, document_id, char_start, char_end))",
    "CREATE INDEX IF NOT EXISTS mention_by_doc ON mention (document_id, type, id)",
    "CREATE TABLE IF NOT EXISTS relation_schema ("
        + " name VARCHAR(255) PRIMARY KEY,"
        + " roles VARCHAR NOT NULL)",
  };

  public static String tableName(RelationSchema schema) {
    return "cand_" + schema.getName().toLowerCase(Locale.ROOT);
  }

  public static String roleColumn(String role) {
    return role.toLowerCase(Locale.ROOT) + "_id";
  }

  public static List<String> roleColumns(RelationSchema schema) {
    List<String> cols = new ArrayList<>();
    for (String role : schema.getRoles())
      cols.add(roleColumn(role));
    return cols;
  }

  static List<String> relationTableDdl(RelationSchema schema) {
    String table = tableName(schema);
    List<String> cols = roleColumns(schema);
    StringBuilder sb = new StringBuilder();
    sb.append("CREATE TABLE IF NOT EXISTS ").append(table).append(" (");
    sb.append(" id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,");
    sb.append(" split INT NOT NULL,");
    sb.append(" document_id BIGINT NOT NULL REFERENCES document(id) ON DELETE CASCADE,");
    for (String c : cols)
      sb.append(' ').append(c).append(" BIGINT NOT NULL REFERENCES mention(id) ON DELETE CASCADE,");
    sb.append(" UNIQUE (split, ").append(String.join(", ", cols)).append("))");
    List<String> ddl = new ArrayList<>();
    ddl.add(sb.toString());
    ddl.add("CREATE INDEX IF NOT EXISTS " + table + "_by_doc ON " + table + " (split, document_id)");
    return ddl;
  }

  public static void createBaseTables(Connection conn) throws SQLException {
    execute(conn, BASE_TABLES);
  }

  public static void createRelationTable(Connection conn, RelationSchema schema) throws SQLException {
    List<String> ddl = relationTableDdl(schema);
    execute(conn, ddl.toArray(new String[ddl.size()]));
  }

  private static void execute(Connection conn, String... statements) throws SQLException {
    try (Statement st = conn.createStatement()) {
      for (String sql : statements)
        st.execute(sql);
    }
  }
}

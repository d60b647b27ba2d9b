package edu.jhu.hlt.candgen.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

import edu.jhu.hlt.candgen.ConfigurationException;
import edu.jhu.hlt.candgen.datatypes.Candidate;
import edu.jhu.hlt.candgen.datatypes.Document;
import edu.jhu.hlt.candgen.datatypes.Mention;
import edu.jhu.hlt.candgen.datatypes.MentionType;
import edu.jhu.hlt.candgen.datatypes.RelationSchema;
import edu.jhu.hlt.candgen.datatypes.Sentence;
import edu.jhu.hlt.candgen.datatypes.Span;

/**
 * One transactional connection to the extraction tables. Not thread safe:
 * every worker opens its own through {@link StoreConfig#open()}.
 *
 * Auto-commit is off; nothing is visible to other connections until
 * {@link #commit()}. Inserts are insert-if-absent: a row that collides with a
 * unique constraint (including one inserted concurrently by another
 * connection) is reported as already present instead of failing the
 * transaction.
 */
public class ExtractionStore implements AutoCloseable {
  public static final Logger LOG = Logger.getLogger(ExtractionStore.class);

  /** SQLState for unique constraint violations (H2 and PostgreSQL agree). */
  static final String UNIQUE_VIOLATION = "23505";

  private static final Joiner WORDS = Joiner.on('\t');
  private static final Splitter WORDS_SPLIT = Splitter.on('\t');
  private static final Joiner OFFSETS = Joiner.on(',');
  private static final Splitter OFFSETS_SPLIT = Splitter.on(',');

  private final Connection conn;

  public ExtractionStore(Connection conn) {
    this.conn = conn;
    try {
      conn.setAutoCommit(false);
    } catch (SQLException e) {
      throw new StoreException("could not disable auto-commit", e);
    }
  }

  // ---------------------------------------------------------------------------
  // schema

  public void createBaseTables() {
    try {
      StoreSchema.createBaseTables(conn);
    } catch (SQLException e) {
      throw new StoreException("could not create tables", e);
    }
  }

  /**
   * Creates the candidate table for schema and records the schema in the
   * registry. A schema registered earlier under the same name must have the
   * same roles.
   */
  public void registerRelation(RelationSchema schema) {
    String roles = Joiner.on(',').join(schema.getRoles());
    try {
      String existing = registeredRoles(schema.getName());
      if (existing == null) {
        try (PreparedStatement ps = conn.prepareStatement(
            "INSERT INTO relation_schema (name, roles) VALUES (?, ?)")) {
          ps.setString(1, schema.getName());
          ps.setString(2, roles);
          ps.executeUpdate();
        }
      } else if (!existing.equalsIgnoreCase(roles)) {
        throw new ConfigurationException(schema.getName() + " is already registered with roles "
            + existing + ", not " + roles);
      }
      StoreSchema.createRelationTable(conn, schema);
    } catch (SQLException e) {
      throw new StoreException("could not register " + schema, e);
    }
  }

  private String registeredRoles(String name) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(
        "SELECT roles FROM relation_schema WHERE LOWER(name) = LOWER(?)")) {
      ps.setString(1, name);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? rs.getString(1) : null;
      }
    }
  }

  public List<RelationSchema> registeredRelations() {
    List<RelationSchema> schemas = new ArrayList<>();
    try (PreparedStatement ps = conn.prepareStatement(
        "SELECT name, roles FROM relation_schema ORDER BY name");
        ResultSet rs = ps.executeQuery()) {
      while (rs.next())
        schemas.add(new RelationSchema(rs.getString(1), Splitter.on(',').splitToList(rs.getString(2))));
      return schemas;
    } catch (SQLException e) {
      throw new StoreException("could not list relations", e);
    }
  }

  // ---------------------------------------------------------------------------
  // documents and sentences (written by ingestion, read by mention extraction)

  /**
   * Stores a document and its sentences, returning the sentences with their
   * store ids.
   */
  public List<Sentence> insertDocument(Document doc, List<Sentence> sentences) {
    List<Sentence> stored = new ArrayList<>();
    try {
      try (PreparedStatement ps = conn.prepareStatement(
          "INSERT INTO document (id, name) VALUES (?, ?)")) {
        ps.setLong(1, doc.getId());
        ps.setString(2, doc.getName());
        ps.executeUpdate();
      }
      try (PreparedStatement ps = conn.prepareStatement(
          "INSERT INTO sentence (document_id, idx, text, char_start, words, char_offsets)"
          + " VALUES (?, ?, ?, ?, ?, ?)", Statement.RETURN_GENERATED_KEYS)) {
        for (Sentence s : sentences) {
          if (s.getDocumentId() != doc.getId())
            throw new IllegalArgumentException(s + " does not belong to " + doc);
          ps.setLong(1, doc.getId());
          ps.setInt(2, s.getPosition());
          ps.setString(3, s.getText());
          ps.setInt(4, s.getCharStart());
          ps.setString(5, WORDS.join(s.getWords()));
          ps.setString(6, joinOffsets(s.getCharOffsets()));
          ps.executeUpdate();
          stored.add(s.withId(generatedId(ps)));
        }
      }
      return stored;
    } catch (SQLException e) {
      throw new StoreException("could not insert " + doc, e);
    }
  }

  private static String joinOffsets(int[] offsets) {
    List<Integer> l = new ArrayList<>(offsets.length);
    for (int o : offsets)
      l.add(o);
    return OFFSETS.join(l);
  }

  public List<Document> documents() {
    List<Document> docs = new ArrayList<>();
    try (PreparedStatement ps = conn.prepareStatement(
        "SELECT id, name FROM document ORDER BY id");
        ResultSet rs = ps.executeQuery()) {
      while (rs.next())
        docs.add(new Document(rs.getLong(1), rs.getString(2)));
      return docs;
    } catch (SQLException e) {
      throw new StoreException("could not list documents", e);
    }
  }

  /** Sentences of a document in document order. */
  public List<Sentence> sentences(long documentId) {
    List<Sentence> sentences = new ArrayList<>();
    try (PreparedStatement ps = conn.prepareStatement(
        "SELECT id, idx, text, char_start, words, char_offsets FROM sentence"
        + " WHERE document_id = ? ORDER BY idx")) {
      ps.setLong(1, documentId);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          String w = rs.getString(5);
          String[] words = w.isEmpty()
              ? new String[0]
              : WORDS_SPLIT.splitToList(w).toArray(new String[0]);
          String o = rs.getString(6);
          int[] offsets = new int[words.length];
          if (!o.isEmpty()) {
            List<String> os = OFFSETS_SPLIT.splitToList(o);
            if (os.size() != words.length) {
              throw new StoreException("sentence " + rs.getLong(1) + " has "
                  + words.length + " words but " + os.size() + " offsets");
            }
            for (int i = 0; i < offsets.length; i++)
              offsets[i] = Integer.parseInt(os.get(i));
          }
          sentences.add(new Sentence(rs.getLong(1), documentId, rs.getInt(2),
              rs.getString(3), rs.getInt(4), words, offsets));
        }
      }
      return sentences;
    } catch (SQLException e) {
      throw new StoreException("could not read sentences of document " + documentId, e);
    }
  }

  // ---------------------------------------------------------------------------
  // mentions

  private static final String MENTION_COLS =
      "id, document_id, sentence_id, sentence_idx, char_start, char_end, text";

  /** Mentions of one type in one document, ordered by id. */
  public List<Mention> mentions(long documentId, MentionType type) {
    try (PreparedStatement ps = conn.prepareStatement(
        "SELECT " + MENTION_COLS + " FROM mention WHERE type = ? AND document_id = ? ORDER BY id")) {
      ps.setString(1, type.getName());
      ps.setLong(2, documentId);
      return readMentions(ps, type);
    } catch (SQLException e) {
      throw new StoreException("could not read " + type + " mentions of document " + documentId, e);
    }
  }

  /** All mentions of one type, ordered by id. */
  public List<Mention> mentions(MentionType type) {
    try (PreparedStatement ps = conn.prepareStatement(
        "SELECT " + MENTION_COLS + " FROM mention WHERE type = ? ORDER BY id")) {
      ps.setString(1, type.getName());
      return readMentions(ps, type);
    } catch (SQLException e) {
      throw new StoreException("could not read " + type + " mentions", e);
    }
  }

  private static List<Mention> readMentions(PreparedStatement ps, MentionType type) throws SQLException {
    List<Mention> mentions = new ArrayList<>();
    try (ResultSet rs = ps.executeQuery()) {
      while (rs.next()) {
        Span span = Span.getSpan(rs.getInt(5), rs.getInt(6));
        mentions.add(new Mention(rs.getLong(1), type, rs.getLong(2), rs.getLong(3),
            rs.getInt(4), span, rs.getString(7)));
      }
    }
    return mentions;
  }

  public boolean mentionExists(MentionType type, long documentId, Span span) {
    try (PreparedStatement ps = conn.prepareStatement(
        "SELECT 1 FROM mention WHERE type = ? AND document_id = ? AND char_start = ? AND char_end = ?")) {
      ps.setString(1, type.getName());
      ps.setLong(2, documentId);
      ps.setInt(3, span.start);
      ps.setInt(4, span.end);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next();
      }
    } catch (SQLException e) {
      throw new StoreException("could not look up " + type + " " + span, e);
    }
  }

  /**
   * Inserts a mention unless one with the same type, document and span is
   * already stored.
   *
   * @return the new mention's id, or -1 if it was already present.
   */
  public long insertMention(Mention m) {
    String sql = "INSERT INTO mention (type, document_id, sentence_id, sentence_idx, char_start, char_end, text)"
        + " VALUES (?, ?, ?, ?, ?, ?, ?)";
    return insertIfAbsent(sql, m, ps -> {
      ps.setString(1, m.getType().getName());
      ps.setLong(2, m.getDocumentId());
      ps.setLong(3, m.getSentenceId());
      ps.setInt(4, m.getSentencePosition());
      ps.setInt(5, m.getSpan().start);
      ps.setInt(6, m.getSpan().end);
      ps.setString(7, m.getText());
    });
  }

  /**
   * Deletes mentions of a type, in one document or (documentId == null)
   * everywhere. Candidates using them are deleted by the store.
   */
  public int deleteMentions(MentionType type, Long documentId) {
    String sql = "DELETE FROM mention WHERE type = ?"
        + (documentId == null ? "" : " AND document_id = ?");
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, type.getName());
      if (documentId != null)
        ps.setLong(2, documentId);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new StoreException("could not delete " + type + " mentions", e);
    }
  }

  public int countMentions(MentionType type) {
    return count("SELECT COUNT(*) FROM mention WHERE type = ?", type.getName());
  }

  // ---------------------------------------------------------------------------
  // candidates

  private static String argWhere(RelationSchema schema) {
    StringBuilder sb = new StringBuilder("split = ?");
    for (String c : StoreSchema.roleColumns(schema))
      sb.append(" AND ").append(c).append(" = ?");
    return sb.toString();
  }

  public boolean candidateExists(RelationSchema schema, int split, long[] argIds) {
    checkArity(schema, argIds);
    String sql = "SELECT 1 FROM " + StoreSchema.tableName(schema) + " WHERE " + argWhere(schema);
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setInt(1, split);
      for (int i = 0; i < argIds.length; i++)
        ps.setLong(2 + i, argIds[i]);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next();
      }
    } catch (SQLException e) {
      throw new StoreException("could not look up " + schema.getName() + " candidate", e);
    }
  }

  /**
   * Inserts a candidate unless an identical one (same split and arguments)
   * exists.
   *
   * @return the new candidate's id, or -1 if it was already present.
   */
  public long insertCandidate(RelationSchema schema, Candidate c) {
    long[] args = c.getArgIds();
    checkArity(schema, args);
    List<String> cols = StoreSchema.roleColumns(schema);
    StringBuilder sql = new StringBuilder("INSERT INTO ")
        .append(StoreSchema.tableName(schema))
        .append(" (split, document_id, ").append(String.join(", ", cols)).append(") VALUES (?, ?");
    for (int i = 0; i < cols.size(); i++)
      sql.append(", ?");
    sql.append(')');
    return insertIfAbsent(sql.toString(), c, ps -> {
      ps.setInt(1, c.getSplit());
      ps.setLong(2, c.getDocumentId());
      for (int i = 0; i < args.length; i++)
        ps.setLong(3 + i, args[i]);
    });
  }

  /**
   * Deletes candidates of schema in split, in one document or
   * (documentId == null) in all of them. Mentions are not touched.
   */
  public int deleteCandidates(RelationSchema schema, int split, Long documentId) {
    String sql = "DELETE FROM " + StoreSchema.tableName(schema) + " WHERE split = ?"
        + (documentId == null ? "" : " AND document_id = ?");
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setInt(1, split);
      if (documentId != null)
        ps.setLong(2, documentId);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new StoreException("could not delete " + schema.getName() + " candidates", e);
    }
  }

  /** Candidates of schema in split, ordered by id. */
  public List<Candidate> candidates(RelationSchema schema, int split) {
    List<String> cols = StoreSchema.roleColumns(schema);
    String sql = "SELECT id, document_id, " + String.join(", ", cols)
        + " FROM " + StoreSchema.tableName(schema) + " WHERE split = ? ORDER BY id";
    List<Candidate> cands = new ArrayList<>();
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setInt(1, split);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          long[] args = new long[cols.size()];
          for (int i = 0; i < args.length; i++)
            args[i] = rs.getLong(3 + i);
          cands.add(new Candidate(rs.getLong(1), schema.getName(), split, rs.getLong(2), args));
        }
      }
      return cands;
    } catch (SQLException e) {
      throw new StoreException("could not read " + schema.getName() + " candidates", e);
    }
  }

  public int countCandidates(RelationSchema schema, int split) {
    return count("SELECT COUNT(*) FROM " + StoreSchema.tableName(schema) + " WHERE split = ?", split);
  }

  public int countCandidates(RelationSchema schema) {
    return count("SELECT COUNT(*) FROM " + StoreSchema.tableName(schema));
  }

  private static void checkArity(RelationSchema schema, long[] argIds) {
    if (argIds.length != schema.getArity()) {
      throw new IllegalArgumentException(schema.getName() + " has arity "
          + schema.getArity() + " but got " + argIds.length + " arguments");
    }
  }

  // ---------------------------------------------------------------------------
  // transactions

  public void commit() {
    try {
      conn.commit();
    } catch (SQLException e) {
      throw new StoreException("commit failed", e);
    }
  }

  public void rollback() {
    try {
      conn.rollback();
    } catch (SQLException e) {
      throw new StoreException("rollback failed", e);
    }
  }

  @Override
  public void close() {
    try {
      if (!conn.isClosed()) {
        conn.rollback();
        conn.close();
      }
    } catch (SQLException e) {
      throw new StoreException("could not close connection", e);
    }
  }

  // ---------------------------------------------------------------------------
  // helpers

  interface Binder {
    void bind(PreparedStatement ps) throws SQLException;
  }

  /**
   * Runs an INSERT inside a savepoint. A unique violation rolls back to the
   * savepoint (so the surrounding transaction survives on stores that would
   * otherwise abort it) and is reported as -1.
   */
  private long insertIfAbsent(String sql, Object what, Binder binder) {
    Savepoint sp = null;
    try {
      sp = conn.setSavepoint();
      try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
        binder.bind(ps);
        ps.executeUpdate();
        long id = generatedId(ps);
        conn.releaseSavepoint(sp);
        return id;
      }
    } catch (SQLException e) {
      if (sp != null && UNIQUE_VIOLATION.equals(e.getSQLState())) {
        try {
          conn.rollback(sp);
        } catch (SQLException e2) {
          throw new StoreException("could not roll back to savepoint after a duplicate " + what, e2);
        }
        if (LOG.isDebugEnabled())
          LOG.debug("[insert] already present: " + what);
        return -1;
      }
      throw new StoreException("could not insert " + what, e);
    }
  }

  private static long generatedId(PreparedStatement ps) throws SQLException {
    try (ResultSet keys = ps.getGeneratedKeys()) {
      if (!keys.next())
        throw new SQLException("no generated key returned");
      return keys.getLong(1);
    }
  }

  private int count(String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      for (int i = 0; i < params.length; i++)
        ps.setObject(i + 1, params[i]);
      try (ResultSet rs = ps.executeQuery()) {
        rs.next();
        return rs.getInt(1);
      }
    } catch (SQLException e) {
      throw new StoreException("count failed: " + sql, e);
    }
  }
}

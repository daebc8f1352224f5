package com.flamingo.ai.scriptrag.search.query;

import com.flamingo.ai.scriptrag.search.model.SearchQuery;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * SQLite query builder for scripts, scenes, dialogues, actions and bible chunks.
 *
 * <p>Row and count queries share the same FROM and WHERE construction so that pagination totals
 * always agree with the rows returned.
 */
@Component
public class ScreenplayQueryBuilder implements QueryBuilder {

  private static final String SCENE_COLUMNS =
      String.join(
          ", ",
          "DISTINCT s.id AS script_id",
          "s.title AS script_title",
          "s.author AS script_author",
          "s.metadata AS script_metadata",
          "sc.id AS scene_id",
          "sc.scene_number",
          "sc.heading AS scene_heading",
          "sc.location AS scene_location",
          "sc.time_of_day AS scene_time",
          "sc.content AS scene_content");

  private static final String BIBLE_COLUMNS =
      String.join(
          ", ",
          "s.id AS script_id",
          "s.title AS script_title",
          "sb.id AS bible_id",
          "sb.title AS bible_title",
          "bc.id AS chunk_id",
          "bc.heading AS chunk_heading",
          "bc.level AS chunk_level",
          "bc.content AS chunk_content");

  private static final String BIBLE_FROM =
      "bible_chunks bc"
          + " JOIN script_bibles sb ON bc.bible_id = sb.id"
          + " JOIN scripts s ON sb.script_id = s.id";

  private static final String SCENE_HAS_CHARACTER =
      "EXISTS (SELECT 1 FROM dialogues %1$s"
          + " INNER JOIN characters %2$s ON %1$s.character_id = %2$s.id"
          + " WHERE %1$s.scene_id = sc.id AND %2$s.name = ?)";

  @Override
  public SqlQuery buildSearchQuery(SearchQuery query) {
    Clauses clauses = sceneClauses(query);
    StringBuilder sql =
        new StringBuilder("SELECT ")
            .append(SCENE_COLUMNS)
            .append(" FROM ")
            .append(String.join(" ", clauses.from));
    appendWhere(sql, clauses.where);
    sql.append(" ORDER BY s.id, sc.scene_number LIMIT ? OFFSET ?");
    clauses.params.add(query.getLimit());
    clauses.params.add(query.getOffset());
    return new SqlQuery(sql.toString(), clauses.params);
  }

  @Override
  public SqlQuery buildCountQuery(SearchQuery query) {
    Clauses clauses = sceneClauses(query);
    StringBuilder sql =
        new StringBuilder("SELECT COUNT(DISTINCT sc.id) AS total FROM ")
            .append(String.join(" ", clauses.from));
    appendWhere(sql, clauses.where);
    return new SqlQuery(sql.toString(), clauses.params);
  }

  @Override
  public SqlQuery buildBibleSearchQuery(SearchQuery query) {
    Clauses clauses = bibleClauses(query);
    StringBuilder sql =
        new StringBuilder("SELECT ").append(BIBLE_COLUMNS).append(" FROM ").append(BIBLE_FROM);
    appendWhere(sql, clauses.where);
    sql.append(" ORDER BY bc.bible_id, bc.chunk_number LIMIT ? OFFSET ?");
    clauses.params.add(query.getLimit());
    clauses.params.add(query.getOffset());
    return new SqlQuery(sql.toString(), clauses.params);
  }

  @Override
  public SqlQuery buildBibleCountQuery(SearchQuery query) {
    Clauses clauses = bibleClauses(query);
    StringBuilder sql = new StringBuilder("SELECT COUNT(*) AS total FROM ").append(BIBLE_FROM);
    appendWhere(sql, clauses.where);
    return new SqlQuery(sql.toString(), clauses.params);
  }

  private Clauses sceneClauses(SearchQuery query) {
    Clauses c = new Clauses();
    c.from.add("scripts s");
    c.from.add("INNER JOIN scenes sc ON s.id = sc.script_id");

    if (hasText(query.getProject())) {
      c.where.add("s.title LIKE ?");
      c.params.add(like(query.getProject()));
    }
    addSeasonEpisode(c, query);

    String textQuery = hasText(query.getAction()) ? query.getAction() : query.getTextQuery();
    if (hasText(query.getDialogue())) {
      addDialogue(c, query);
    } else if (hasText(textQuery)) {
      c.where.add(
          "(sc.content LIKE ? OR EXISTS (SELECT 1 FROM actions a"
              + " WHERE a.scene_id = sc.id AND a.action_text LIKE ?))");
      c.params.add(like(textQuery));
      c.params.add(like(textQuery));
      addAnyCharacter(c, query.getCharacters(), "d2", "c2");
    }

    if (!query.getLocations().isEmpty()) {
      List<String> conditions = new ArrayList<>();
      for (String location : query.getLocations()) {
        conditions.add("sc.location LIKE ?");
        c.params.add(like(location));
      }
      c.where.add(or(conditions));
    }

    boolean hasTextFilter = hasText(query.getDialogue()) || hasText(textQuery);
    if (!hasTextFilter) {
      addAnyCharacter(c, query.getCharacters(), "d3", "c3");
    }
    return c;
  }

  private void addDialogue(Clauses c, SearchQuery query) {
    c.from.add("INNER JOIN dialogues d ON sc.id = d.scene_id");
    c.where.add("d.dialogue_text LIKE ?");
    c.params.add(like(query.getDialogue()));

    if (!query.getCharacters().isEmpty()) {
      c.from.add("INNER JOIN characters c ON d.character_id = c.id");
      List<String> conditions = new ArrayList<>();
      for (String character : query.getCharacters()) {
        conditions.add("c.name = ?");
        c.params.add(character);
      }
      c.where.add(or(conditions));
    }
    if (hasText(query.getParenthetical())) {
      c.where.add("json_extract(d.metadata, '$.parenthetical') LIKE ?");
      c.params.add(like(query.getParenthetical()));
    }
  }

  private void addAnyCharacter(
      Clauses c, List<String> characters, String dialogueAlias, String characterAlias) {
    if (characters.isEmpty()) {
      return;
    }
    List<String> conditions = new ArrayList<>();
    for (String character : characters) {
      conditions.add(String.format(SCENE_HAS_CHARACTER, dialogueAlias, characterAlias));
      c.params.add(character);
    }
    c.where.add(or(conditions));
  }

  private void addSeasonEpisode(Clauses c, SearchQuery query) {
    if (query.getSeasonStart() == null) {
      return;
    }
    if (query.getSeasonEnd() != null) {
      c.where.add(
          "(json_extract(s.metadata, '$.season') >= ?"
              + " AND json_extract(s.metadata, '$.season') <= ?"
              + " AND json_extract(s.metadata, '$.episode') >= ?"
              + " AND json_extract(s.metadata, '$.episode') <= ?)");
      c.params.add(query.getSeasonStart());
      c.params.add(query.getSeasonEnd());
      c.params.add(query.getEpisodeStart());
      c.params.add(query.getEpisodeEnd());
    } else {
      c.where.add(
          "(json_extract(s.metadata, '$.season') = ?"
              + " AND json_extract(s.metadata, '$.episode') = ?)");
      c.params.add(query.getSeasonStart());
      c.params.add(query.getEpisodeStart());
    }
  }

  private Clauses bibleClauses(SearchQuery query) {
    Clauses c = new Clauses();
    if (hasText(query.getTextQuery())) {
      c.where.add("(bc.content LIKE ? OR bc.heading LIKE ?)");
      c.params.add(like(query.getTextQuery()));
      c.params.add(like(query.getTextQuery()));
    }
    if (hasText(query.getProject())) {
      c.where.add("s.title = ?");
      c.params.add(query.getProject());
    }
    return c;
  }

  private static void appendWhere(StringBuilder sql, List<String> where) {
    if (!where.isEmpty()) {
      sql.append(" WHERE ").append(String.join(" AND ", where));
    }
  }

  private static String or(List<String> conditions) {
    return "(" + String.join(" OR ", conditions) + ")";
  }

  private static String like(String value) {
    return "%" + value + "%";
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  private static final class Clauses {
    private final List<String> from = new ArrayList<>();
    private final List<String> where = new ArrayList<>();
    private final List<Object> params = new ArrayList<>();
  }
}

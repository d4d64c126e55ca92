package ch.so.arp.scenesearch.search;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;

/**
 * PostgreSQL backed {@link CandidateRetriever}. Every active channel runs its
 * own top-k query against {@code video_scenes}: pgvector cosine distance for
 * the transcript, summary and visual embeddings and {@code ts_rank_cd} over
 * tags, summary and transcript for the lexical channel. The per-channel hits
 * are merged and fused in memory.
 */
class PostgresCandidateRetriever implements CandidateRetriever {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresCandidateRetriever.class);

    private static final String SCENE_COLUMNS = """
              s.id::text AS scene_id,
              s.video_id::text AS video_id,
              s.index AS scene_index,
              COALESCE(s.start_s, 0) AS start_s,
              COALESCE(s.end_s, 0) AS end_s,
              COALESCE(s.transcript_segment, '') AS transcript_segment,
              COALESCE(s.visual_summary, '') AS visual_summary,
              COALESCE(s.thumbnail_url, '') AS thumbnail_url,
              COALESCE(array_to_string(s.tags, '|'), '') AS tags
            """;

    private static final String DENSE_SQL = """
            SELECT
            %1$s,
              (1.0 - (s.%2$s <=> :embedding::vector)) AS score
            FROM video_scenes s
            WHERE s.%2$s IS NOT NULL
            ORDER BY s.%2$s <=> :embedding::vector
            LIMIT :limit;
            """;

    private static final String LEXICAL_SQL = """
            WITH q AS (
              SELECT websearch_to_tsquery('simple', :query) AS tsq
            ),
            docs AS (
              SELECT
            %s,
                setweight(to_tsvector('simple', COALESCE(array_to_string(s.tags, ' '), '')), 'A') ||
                setweight(to_tsvector('simple', COALESCE(s.visual_summary, '')), 'B') ||
                setweight(to_tsvector('simple', COALESCE(s.transcript_segment, '')), 'C') AS doc
              FROM video_scenes s
            )
            SELECT d.scene_id, d.video_id, d.scene_index, d.start_s, d.end_s, d.transcript_segment,
                   d.visual_summary, d.thumbnail_url, d.tags,
                   ts_rank_cd(d.doc, q.tsq, 32) AS score
            FROM docs d, q
            WHERE d.doc @@ q.tsq
            ORDER BY score DESC
            LIMIT :limit;
            """.formatted(SCENE_COLUMNS);

    private static final Map<String, String> EMBEDDING_COLUMNS = Map.of(
            Channels.TRANSCRIPT, "embedding_transcript",
            Channels.SUMMARY, "embedding_summary",
            Channels.VISUAL, "embedding_visual_clip");

    private final JdbcClient jdbcClient;
    private final ScoreFusionEngine fusion;

    PostgresCandidateRetriever(JdbcClient jdbcClient, ScoreFusionEngine fusion) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.fusion = Objects.requireNonNull(fusion, "fusion");
    }

    @Override
    public CandidatePool retrieve(RetrievalQuery query) {
        CandidateAccumulator accumulator = new CandidateAccumulator();
        for (String channel : query.activeChannels()) {
            List<SceneRow> rows = Channels.LEXICAL.equals(channel)
                    ? lexical(query.text(), query.poolSize())
                    : dense(EMBEDDING_COLUMNS.get(channel), embeddingFor(channel, query), query.poolSize());
            rows.forEach(row -> accumulator.add(channel, row.scene(), row.score()));
            LOGGER.debug("Channel {} returned {} rows", channel, rows.size());
        }
        CandidatePool pool = accumulator.toPool(fusion, query);
        LOGGER.debug("Retrieval over {} produced {} candidates (pool size {})", query.activeChannels(), pool.size(),
                query.poolSize());
        return pool;
    }

    private List<SceneRow> dense(String column, float[] embedding, int limit) {
        return jdbcClient.sql(String.format(DENSE_SQL, SCENE_COLUMNS, column))
                .param("embedding", toPgVectorLiteral(embedding))
                .param("limit", limit)
                .query(SceneRowMapper.INSTANCE)
                .list();
    }

    private List<SceneRow> lexical(String text, int limit) {
        return jdbcClient.sql(LEXICAL_SQL)
                .param("query", text)
                .param("limit", limit)
                .query(SceneRowMapper.INSTANCE)
                .list();
    }

    private static float[] embeddingFor(String channel, RetrievalQuery query) {
        return Channels.VISUAL.equals(channel) ? query.visualEmbedding() : query.textEmbedding();
    }

    static String toPgVectorLiteral(float[] embedding) {
        StringBuilder builder = new StringBuilder();
        builder.append('[');
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(String.format(Locale.ROOT, "%f", embedding[i]));
        }
        builder.append(']');
        return builder.toString();
    }

    private enum SceneRowMapper implements RowMapper<SceneRow> {
        INSTANCE;

        @Override
        public SceneRow mapRow(ResultSet rs, int rowNum) throws SQLException {
            String tags = rs.getString("tags");
            SceneSummary scene = new SceneSummary(
                    rs.getString("scene_id"),
                    rs.getString("video_id"),
                    rs.getInt("scene_index"),
                    rs.getDouble("start_s"),
                    rs.getDouble("end_s"),
                    rs.getString("transcript_segment"),
                    rs.getString("visual_summary"),
                    rs.getString("thumbnail_url"),
                    tags == null || tags.isEmpty() ? List.of() : Arrays.asList(tags.split("\\|")));
            return new SceneRow(scene, rs.getDouble("score"));
        }
    }

    private record SceneRow(SceneSummary scene, double score) {
    }
}

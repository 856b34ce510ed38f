package com.example.RagFlow.repository;

import com.example.RagFlow.model.RetrievedChunk;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * Chunk embeddings in the {@code document_chunks} pgvector table.
 */
@Repository
@RequiredArgsConstructor
public class DocumentChunkVectorRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Nearest chunks of one document by cosine distance ({@code <=>}),
     * with score = 1 - distance.
     */
    public List<RetrievedChunk> findNearest(float[] embedding, int limit, Long documentId) {
        PGvector queryVector = new PGvector(embedding);

        String sql = """
                SELECT document_id,
                       chunk_index,
                       content,
                       1 - (embedding <=> ?) AS score
                FROM document_chunks
                WHERE document_id = ?
                ORDER BY embedding <=> ?
                LIMIT ?
                """;

        return jdbcTemplate.query(sql, ps -> {
            ps.setObject(1, queryVector);
            ps.setLong(2, documentId);
            ps.setObject(3, queryVector);
            ps.setInt(4, limit);
        }, new RetrievedChunkRowMapper());
    }

    public int insertChunks(Long documentId, List<String> chunks, List<float[]> embeddings, String metadataJson) {
        String sql = """
                INSERT INTO document_chunks (document_id, chunk_index, content, metadata, embedding)
                VALUES (?, ?, ?, CAST(? AS jsonb), ?)
                """;

        int[] written = jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                ps.setLong(1, documentId);
                ps.setInt(2, i);
                ps.setString(3, chunks.get(i));
                ps.setString(4, metadataJson);
                ps.setObject(5, new PGvector(embeddings.get(i)));
            }

            @Override
            public int getBatchSize() {
                return chunks.size();
            }
        });
        return written.length;
    }

    public int deleteByDocument(Long documentId) {
        return jdbcTemplate.update("DELETE FROM document_chunks WHERE document_id = ?", documentId);
    }

    private static class RetrievedChunkRowMapper implements RowMapper<RetrievedChunk> {
        @Override
        public RetrievedChunk mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new RetrievedChunk(
                    rs.getLong("document_id"),
                    rs.getInt("chunk_index"),
                    rs.getString("content"),
                    rs.getDouble("score")
            );
        }
    }
}

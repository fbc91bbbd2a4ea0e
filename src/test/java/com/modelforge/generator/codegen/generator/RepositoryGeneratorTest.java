package com.modelforge.generator.codegen.generator;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.modelforge.generator.TestModels;
import com.modelforge.generator.codegen.model.core.context.DatabaseEngine;
import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.input.ModelMetadata;

/**
 * Unit tests for RepositoryGenerator.
 */
class RepositoryGeneratorTest {

    private final RepositoryGenerator generator = new RepositoryGenerator();

    @Test
    void testPostgreSqlMapsColumnsAndTouchesUpdatedAt() {
        String contents = generator.generate(TestModels.post(), DatabaseEngine.POSTGRESQL).getContents();

        assertThat(contents)
                .contains("  authorId: 'author_id',")
                .contains("private tableName = 'posts';")
                .contains("setClause.push('updated_at = NOW()');")
                .contains("ORDER BY created_at DESC")
                .contains("      authorId: row.author_id,\n      createdAt: row.created_at,\n");
    }

    @Test
    void testWithoutTimestampsNothingReadsOrWritesThem() {
        Model post = TestModels.post().toBuilder()
                .metadata(ModelMetadata.builder().timestamps(false).build())
                .build();

        String postgres = generator.generate(post, DatabaseEngine.POSTGRESQL).getContents();
        String mysql = generator.generate(post, DatabaseEngine.MYSQL).getContents();
        String mongo = generator.generate(post, DatabaseEngine.MONGODB).getContents();

        assertThat(postgres).doesNotContain("created_at", "updated_at", "createdAt").contains("ORDER BY id");
        assertThat(mysql).doesNotContain("created_at", "updated_at", "createdAt").contains("ORDER BY id");
        assertThat(mongo).doesNotContain("createdAt", "updatedAt").contains(".sort({ _id: -1 })");
    }

    @Test
    void testSoftDeleteMarksInsteadOfRemoving() {
        Model post = TestModels.post().toBuilder()
                .metadata(ModelMetadata.builder().softDelete(true).build())
                .build();

        String contents = generator.generate(post, DatabaseEngine.POSTGRESQL).getContents();

        assertThat(contents)
                .contains("UPDATE ${this.tableName} SET deleted_at = NOW() WHERE id = $1")
                .contains(" WHERE deleted_at IS NULL")
                .doesNotContain("DELETE FROM");
    }
}

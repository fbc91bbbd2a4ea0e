package com.modelforge.generator.codegen.generator;

import java.util.stream.Collectors;

import com.modelforge.generator.codegen.model.core.context.DatabaseEngine;
import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.output.ContentLanguage;
import com.modelforge.generator.codegen.model.output.GeneratedFile;
import com.modelforge.generator.codegen.util.NamingUtil;

/**
 * Generates the data access class of a model for the selected database engine.
 *
 * Relational repositories translate between camelCase properties and snake_case columns through a fixed column
 * map, so request bodies can never name arbitrary columns. Soft-deleting models are filtered on
 * {@code deleted_at} and marked instead of removed. Without timestamps, listings fall back to id order.
 */
public class RepositoryGenerator {

    public GeneratedFile generate(Model model, DatabaseEngine database) {
        String contents = switch (database) {
            case POSTGRESQL -> generatePostgreSql(model);
            case MYSQL -> generateMySql(model);
            case MONGODB -> generateMongoDb(model);
        };
        return GeneratedFile.source("src/repositories/" + model.getName() + "Repository.ts", contents,
                ContentLanguage.TYPESCRIPT);
    }

    private String generatePostgreSql(Model model) {
        boolean softDelete = model.getMetadata().isSoftDelete();
        String active = softDelete ? " AND deleted_at IS NULL" : "";
        String activeOnly = softDelete ? " WHERE deleted_at IS NULL" : "";
        String delete = softDelete
                ? "UPDATE ${this.tableName} SET deleted_at = NOW() WHERE id = $1"
                : "DELETE FROM ${this.tableName} WHERE id = $1";

        return """
                import { query } from '../database/connection';
                import { %1$s, Create%1$sRequest, Update%1$sRequest } from '../models/%1$s';

                const COLUMNS: Record<string, string> = {
                %3$s};

                export class %1$sRepository {
                  private tableName = '%2$s';

                  async create(data: Create%1$sRequest): Promise<%1$s> {
                    const entries = Object.entries(data).filter(([key]) => key in COLUMNS);
                    const columns = entries.map(([key]) => COLUMNS[key]).join(', ');
                    const placeholders = entries.map((_, index) => `$${index + 1}`).join(', ');
                    const sql = entries.length > 0
                      ? `INSERT INTO ${this.tableName} (${columns}) VALUES (${placeholders}) RETURNING *`
                      : `INSERT INTO ${this.tableName} DEFAULT VALUES RETURNING *`;
                    const result = await query(sql, entries.map(([, value]) => value));
                    return this.mapRow(result.rows[0]);
                  }

                  async findById(id: string): Promise<%1$s | null> {
                    const result = await query(`SELECT * FROM ${this.tableName} WHERE id = $1%4$s`, [id]);
                    return result.rows.length > 0 ? this.mapRow(result.rows[0]) : null;
                  }

                  async findMany(limit: number, offset: number): Promise<%1$s[]> {
                    const result = await query(
                      `SELECT * FROM ${this.tableName}%5$s ORDER BY %10$s LIMIT $1 OFFSET $2`,
                      [limit, offset]
                    );
                    return result.rows.map((row) => this.mapRow(row));
                  }

                  async count(): Promise<number> {
                    const result = await query(`SELECT COUNT(*) FROM ${this.tableName}%5$s`);
                    return parseInt(result.rows[0].count, 10);
                  }

                  async update(id: string, data: Update%1$sRequest): Promise<%1$s> {
                    const entries = Object.entries(data).filter(([key]) => key in COLUMNS);
                    const setClause = entries.map(([key], index) => `${COLUMNS[key]} = $${index + 2}`);
                %9$s    if (setClause.length === 0) {
                      return (await this.findById(id)) as %1$s;
                    }
                    const result = await query(
                      `UPDATE ${this.tableName} SET ${setClause.join(', ')} WHERE id = $1 RETURNING *`,
                      [id, ...entries.map(([, value]) => value)]
                    );
                    return this.mapRow(result.rows[0]);
                  }

                  async delete(id: string): Promise<void> {
                    await query(`%6$s`, [id]);
                  }

                  private mapRow(row: any): %1$s {
                    return {
                      id: row.id,
                %7$s%8$s    };
                  }
                }
                """.formatted(model.getName(), NamingUtil.tableName(model), columnMap(model), active, activeOnly,
                delete, rowMapping(model), timestampMapping(model),
                model.getMetadata().isTimestamps() ? "    setClause.push('updated_at = NOW()');\n" : "",
                newestFirst(model));
    }

    private String generateMySql(Model model) {
        boolean softDelete = model.getMetadata().isSoftDelete();
        String active = softDelete ? " AND deleted_at IS NULL" : "";
        String activeOnly = softDelete ? " WHERE deleted_at IS NULL" : "";
        String delete = softDelete
                ? "UPDATE ${this.tableName} SET deleted_at = CURRENT_TIMESTAMP WHERE id = ?"
                : "DELETE FROM ${this.tableName} WHERE id = ?";

        return """
                import { randomUUID } from 'crypto';
                import { query } from '../database/connection';
                import { %1$s, Create%1$sRequest, Update%1$sRequest } from '../models/%1$s';

                const COLUMNS: Record<string, string> = {
                %3$s};

                export class %1$sRepository {
                  private tableName = '%2$s';

                  async create(data: Create%1$sRequest): Promise<%1$s> {
                    const id = randomUUID();
                    const entries = Object.entries(data).filter(([key]) => key in COLUMNS);
                    const columns = ['id', ...entries.map(([key]) => COLUMNS[key])].join(', ');
                    const placeholders = ['?', ...entries.map(() => '?')].join(', ');
                    await query(
                      `INSERT INTO ${this.tableName} (${columns}) VALUES (${placeholders})`,
                      [id, ...entries.map(([, value]) => value)]
                    );
                    return (await this.findById(id)) as %1$s;
                  }

                  async findById(id: string): Promise<%1$s | null> {
                    const rows = await query(`SELECT * FROM ${this.tableName} WHERE id = ?%4$s`, [id]);
                    return rows.length > 0 ? this.mapRow(rows[0]) : null;
                  }

                  async findMany(limit: number, offset: number): Promise<%1$s[]> {
                    const rows = await query(
                      `SELECT * FROM ${this.tableName}%5$s ORDER BY %10$s LIMIT ? OFFSET ?`,
                      [limit, offset]
                    );
                    return rows.map((row) => this.mapRow(row));
                  }

                  async count(): Promise<number> {
                    const rows = await query(`SELECT COUNT(*) AS count FROM ${this.tableName}%5$s`);
                    return Number(rows[0].count);
                  }

                  async update(id: string, data: Update%1$sRequest): Promise<%1$s> {
                    const entries = Object.entries(data).filter(([key]) => key in COLUMNS);
                    if (entries.length > 0) {
                      const setClause = entries.map(([key]) => `${COLUMNS[key]} = ?`).join(', ');
                      await query(
                        `UPDATE ${this.tableName} SET ${setClause} WHERE id = ?`,
                        [...entries.map(([, value]) => value), id]
                      );
                    }
                    return (await this.findById(id)) as %1$s;
                  }

                  async delete(id: string): Promise<void> {
                    await query(`%6$s`, [id]);
                  }

                  private mapRow(row: any): %1$s {
                    return {
                      id: row.id,
                %7$s%8$s    };
                  }
                }
                """.formatted(model.getName(), NamingUtil.tableName(model), columnMap(model), active, activeOnly,
                delete, rowMapping(model), timestampMapping(model), "", newestFirst(model));
    }

    private String generateMongoDb(Model model) {
        boolean softDelete = model.getMetadata().isSoftDelete();
        boolean timestamps = model.getMetadata().isTimestamps();
        String activeFilter = softDelete ? "{ deletedAt: { $exists: false } }" : "{}";
        String delete = softDelete
                ? "await collection.updateOne({ id }, { $set: { deletedAt: new Date() } });"
                : "await collection.deleteOne({ id });";

        return """
                import { randomUUID } from 'crypto';
                import { Collection } from 'mongodb';
                import { getDb } from '../database/connection';
                import { %1$s, Create%1$sRequest, Update%1$sRequest } from '../models/%1$s';

                const ACTIVE = %3$s;

                export class %1$sRepository {
                  private collectionName = '%2$s';

                  private async collection(): Promise<Collection> {
                    return (await getDb()).collection(this.collectionName);
                  }

                  async create(data: Create%1$sRequest): Promise<%1$s> {
                %5$s    const document = { ...data, id: randomUUID()%6$s };
                    const collection = await this.collection();
                    await collection.insertOne({ ...document });
                    return document as %1$s;
                  }

                  async findById(id: string): Promise<%1$s | null> {
                    const collection = await this.collection();
                    const document = await collection.findOne({ id, ...ACTIVE });
                    return document ? this.mapDocument(document) : null;
                  }

                  async findMany(limit: number, offset: number): Promise<%1$s[]> {
                    const collection = await this.collection();
                    const documents = await collection.find(ACTIVE)
                      .sort(%7$s)
                      .skip(offset)
                      .limit(limit)
                      .toArray();
                    return documents.map((document) => this.mapDocument(document));
                  }

                  async count(): Promise<number> {
                    const collection = await this.collection();
                    return collection.countDocuments(ACTIVE);
                  }

                  async update(id: string, data: Update%1$sRequest): Promise<%1$s> {
                    const collection = await this.collection();
                    const changes = { ...data%8$s };
                    if (Object.keys(changes).length > 0) {
                      await collection.updateOne({ id }, { $set: changes });
                    }
                    return (await this.findById(id)) as %1$s;
                  }

                  async delete(id: string): Promise<void> {
                    const collection = await this.collection();
                    %4$s
                  }

                  private mapDocument(document: any): %1$s {
                    const { _id, ...record } = document;
                    return record as %1$s;
                  }
                }
                """.formatted(model.getName(), NamingUtil.tableName(model), activeFilter, delete,
                timestamps ? "    const now = new Date();\n" : "",
                timestamps ? ", createdAt: now, updatedAt: now" : "",
                timestamps ? "{ createdAt: -1 }" : "{ _id: -1 }",
                timestamps ? ", updatedAt: new Date()" : "");
    }

    private static String timestampMapping(Model model) {
        return model.getMetadata().isTimestamps()
                ? "      createdAt: row.created_at,\n      updatedAt: row.updated_at\n"
                : "";
    }

    private static String newestFirst(Model model) {
        return model.getMetadata().isTimestamps() ? "created_at DESC" : "id";
    }

    private static String columnMap(Model model) {
        return model.dataFields().stream()
                .map(f -> "  " + f.getName() + ": '" + NamingUtil.toSnakeCase(f.getName()) + "',\n")
                .collect(Collectors.joining());
    }

    private static String rowMapping(Model model) {
        return model.dataFields().stream()
                .map(f -> "      " + f.getName() + ": row." + NamingUtil.toSnakeCase(f.getName()) + ",\n")
                .collect(Collectors.joining());
    }
}

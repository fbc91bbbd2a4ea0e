package com.modelforge.generator.codegen.template;

import java.util.Map;

import lombok.experimental.UtilityClass;

/**
 * Templates every {@link TemplateEngine} starts with.
 */
@UtilityClass
public class BuiltinTemplates {

    public final String MODEL_INTERFACE = "model-interface";
    public final String EXPRESS_CONTROLLER = "express-controller";
    public final String POSTGRESQL_SCHEMA = "postgresql-schema";

    /**
     * Context: {@code modelName}, {@code timestamps}, {@code fields}, {@code createFields}, {@code updateFields};
     * each field carries {@code name}, {@code tsType} and {@code optionalMarker} ("" or "?").
     */
    private final String MODEL_INTERFACE_TEXT = """
            export interface {{modelName}} {
              id: string;
            {{#each fields}}  {{name}}{{optionalMarker}}: {{tsType}};
            {{/each}}{{#if timestamps}}  createdAt: Date;
              updatedAt: Date;
            {{/if}}}

            export interface Create{{modelName}}Request {
            {{#each createFields}}  {{name}}{{optionalMarker}}: {{tsType}};
            {{/each}}}

            export interface Update{{modelName}}Request {
            {{#each updateFields}}  {{name}}?: {{tsType}};
            {{/each}}}
            """;

    /**
     * Context: {@code modelName}, {@code serviceField}.
     */
    private final String EXPRESS_CONTROLLER_TEXT = """
            import { Request, Response, NextFunction } from 'express';
            import { {{modelName}}Service } from '../services/{{modelName}}Service';
            import { Create{{modelName}}Request, Update{{modelName}}Request } from '../models/{{modelName}}';

            export class {{modelName}}Controller {
              private {{serviceField}}: {{modelName}}Service;

              constructor() {
                this.{{serviceField}} = new {{modelName}}Service();
              }

              create = async (req: Request, res: Response, next: NextFunction): Promise<void> => {
                try {
                  const data: Create{{modelName}}Request = req.body;
                  const result = await this.{{serviceField}}.create(data);
                  res.status(201).json({ success: true, data: result });
                } catch (error) {
                  next(error);
                }
              };

              getById = async (req: Request, res: Response, next: NextFunction): Promise<void> => {
                try {
                  const result = await this.{{serviceField}}.getById(req.params.id);
                  if (!result) {
                    res.status(404).json({ success: false, message: '{{modelName}} not found' });
                    return;
                  }
                  res.json({ success: true, data: result });
                } catch (error) {
                  next(error);
                }
              };

              getAll = async (req: Request, res: Response, next: NextFunction): Promise<void> => {
                try {
                  const page = Number(req.query.page ?? 1);
                  const limit = Number(req.query.limit ?? 10);
                  const result = await this.{{serviceField}}.getAll(page, limit);
                  res.json({
                    success: true,
                    data: result.items,
                    pagination: { page, limit, total: result.total, pages: Math.ceil(result.total / limit) }
                  });
                } catch (error) {
                  next(error);
                }
              };

              update = async (req: Request, res: Response, next: NextFunction): Promise<void> => {
                try {
                  const data: Update{{modelName}}Request = req.body;
                  const result = await this.{{serviceField}}.update(req.params.id, data);
                  if (!result) {
                    res.status(404).json({ success: false, message: '{{modelName}} not found' });
                    return;
                  }
                  res.json({ success: true, data: result });
                } catch (error) {
                  next(error);
                }
              };

              delete = async (req: Request, res: Response, next: NextFunction): Promise<void> => {
                try {
                  const deleted = await this.{{serviceField}}.delete(req.params.id);
                  if (!deleted) {
                    res.status(404).json({ success: false, message: '{{modelName}} not found' });
                    return;
                  }
                  res.status(204).send();
                } catch (error) {
                  next(error);
                }
              };
            }
            """;

    /**
     * Context: {@code tableName}, {@code columns} (each with a complete {@code definition}), {@code timestamps},
     * {@code softDelete}. The {@code updated_at} trigger is only emitted with timestamps.
     */
    private final String POSTGRESQL_SCHEMA_TEXT = """
            CREATE TABLE IF NOT EXISTS {{tableName}} (
              id UUID PRIMARY KEY DEFAULT gen_random_uuid(){{#each columns}},
              {{definition}}{{/each}}{{#if timestamps}},
              created_at TIMESTAMP WITH TIME ZONE DEFAULT NOW(),
              updated_at TIMESTAMP WITH TIME ZONE DEFAULT NOW(){{/if}}{{#if softDelete}},
              deleted_at TIMESTAMP WITH TIME ZONE{{/if}}
            );
            {{#if timestamps}}
            CREATE OR REPLACE FUNCTION update_updated_at_column()
            RETURNS TRIGGER AS $$
            BEGIN
              NEW.updated_at = NOW();
              RETURN NEW;
            END;
            $$ LANGUAGE plpgsql;

            DROP TRIGGER IF EXISTS update_{{tableName}}_updated_at ON {{tableName}};
            CREATE TRIGGER update_{{tableName}}_updated_at
              BEFORE UPDATE ON {{tableName}}
              FOR EACH ROW
              EXECUTE FUNCTION update_updated_at_column();
            {{/if}}""";

    public Map<String, String> all() {
        return Map.of(
                MODEL_INTERFACE, MODEL_INTERFACE_TEXT,
                EXPRESS_CONTROLLER, EXPRESS_CONTROLLER_TEXT,
                POSTGRESQL_SCHEMA, POSTGRESQL_SCHEMA_TEXT);
    }
}

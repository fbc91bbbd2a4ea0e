package com.modelforge.generator.codegen.generator;

import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.output.ContentLanguage;
import com.modelforge.generator.codegen.model.output.GeneratedFile;
import com.modelforge.generator.codegen.util.NamingUtil;

/**
 * Generates the business layer of a model, sitting between handler and repository.
 */
public class ServiceGenerator {

    public GeneratedFile generate(Model model) {
        String name = model.getName();
        String repository = NamingUtil.toCamelCase(name) + "Repository";

        String contents = """
                import { %1$sRepository } from '../repositories/%1$sRepository';
                import { %1$s, Create%1$sRequest, Update%1$sRequest } from '../models/%1$s';

                export class %1$sService {
                  private %2$s: %1$sRepository;

                  constructor() {
                    this.%2$s = new %1$sRepository();
                  }

                  async create(data: Create%1$sRequest): Promise<%1$s> {
                    return this.%2$s.create(data);
                  }

                  async getById(id: string): Promise<%1$s | null> {
                    return this.%2$s.findById(id);
                  }

                  async getAll(page: number = 1, limit: number = 10): Promise<{ items: %1$s[]; total: number }> {
                    const offset = (page - 1) * limit;
                    const [items, total] = await Promise.all([
                      this.%2$s.findMany(limit, offset),
                      this.%2$s.count()
                    ]);
                    return { items, total };
                  }

                  async update(id: string, data: Update%1$sRequest): Promise<%1$s | null> {
                    const existing = await this.%2$s.findById(id);
                    if (!existing) {
                      return null;
                    }
                    return this.%2$s.update(id, data);
                  }

                  async delete(id: string): Promise<boolean> {
                    const existing = await this.%2$s.findById(id);
                    if (!existing) {
                      return false;
                    }
                    await this.%2$s.delete(id);
                    return true;
                  }
                }
                """.formatted(name, repository);

        return GeneratedFile.source("src/services/" + name + "Service.ts", contents, ContentLanguage.TYPESCRIPT);
    }
}

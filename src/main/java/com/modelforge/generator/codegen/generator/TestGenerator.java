package com.modelforge.generator.codegen.generator;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.modelforge.generator.codegen.mapper.SampleData;
import com.modelforge.generator.codegen.model.input.Field;
import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.output.Endpoint;
import com.modelforge.generator.codegen.model.output.GeneratedFile;
import com.modelforge.generator.codegen.util.NamingUtil;

/**
 * Generates the HTTP-level test suite of a model, walking the full lifecycle: create, list, read, update and
 * delete. Sample values are fixed per field type so regenerated suites are identical, then bent to the field's
 * length, range and pattern rules.
 */
public class TestGenerator {

    public GeneratedFile generate(Model model, List<Endpoint> endpoints) {
        String name = model.getName();
        String route = "/" + NamingUtil.routeSegment(model);
        List<Field> fields = model.dataFields();
        boolean guarded = endpoints.stream().anyMatch(Endpoint::isAuthenticated);

        Map<String, String> created = samples(fields, SampleData::created);
        Map<String, String> updated = samples(fields, SampleData::updated);
        String testData = entries(created);
        String updateData = entries(updated);
        String createdAssertions = assertions(created.keySet(), "testData");
        String updatedAssertions = assertions(updated.keySet(), "updateData");
        boolean hasRequired = fields.stream().anyMatch(Field::isRequired);

        String authSetup = guarded ? """
                import jwt from 'jsonwebtoken';

                process.env.JWT_SECRET = process.env.JWT_SECRET || 'test-secret';
                const authHeader = `Bearer ${jwt.sign(
                  { userId: 'test-user', email: 'admin@example.com', role: 'admin' },
                  process.env.JWT_SECRET as string
                )}`;
                """ : "";
        String auth = guarded ? "\n        .set('Authorization', authHeader)" : "";

        String invalidDataCase = hasRequired ? """

                    it('should return 400 for invalid data', async () => {
                      const response = await request(app)
                        .post('%1$s')%2$s
                        .send({})
                        .expect(400);

                      expect(response.body.success).toBe(false);
                      expect(response.body.message).toBe('Validation failed');
                    });
                """.formatted(route, auth) : "";

        String contents = """
                import request from 'supertest';
                import app from '../app';
                %3$s
                describe('%1$sController', () => {
                  const testData = {
                %4$s  };

                  const updateData = {
                %5$s  };

                  let createdId: string;

                  describe('POST %2$s', () => {
                    it('should create a new %1$s', async () => {
                      const response = await request(app)
                        .post('%2$s')%8$s
                        .send(testData)
                        .expect(201);

                      expect(response.body.success).toBe(true);
                      expect(response.body.data).toHaveProperty('id');
                %6$s
                      createdId = response.body.data.id;
                    });
                %9$s  });

                  describe('GET %2$s', () => {
                    it('should return a page of %1$s records', async () => {
                      const response = await request(app)
                        .get('%2$s')
                        .expect(200);

                      expect(response.body.success).toBe(true);
                      expect(Array.isArray(response.body.data)).toBe(true);
                      expect(response.body).toHaveProperty('pagination');
                    });
                  });

                  describe('GET %2$s/:id', () => {
                    it('should return a %1$s by ID', async () => {
                      const response = await request(app)
                        .get(`%2$s/${createdId}`)
                        .expect(200);

                      expect(response.body.success).toBe(true);
                      expect(response.body.data.id).toBe(createdId);
                    });

                    it('should return 404 for non-existent %1$s', async () => {
                      const response = await request(app)
                        .get('%2$s/00000000-0000-0000-0000-000000000000')
                        .expect(404);

                      expect(response.body.success).toBe(false);
                      expect(response.body.message).toBe('%1$s not found');
                    });
                  });

                  describe('PUT %2$s/:id', () => {
                    it('should update an existing %1$s', async () => {
                      const response = await request(app)
                        .put(`%2$s/${createdId}`)%8$s
                        .send(updateData)
                        .expect(200);

                      expect(response.body.success).toBe(true);
                %7$s    });
                  });

                  describe('DELETE %2$s/:id', () => {
                    it('should delete an existing %1$s', async () => {
                      await request(app)
                        .delete(`%2$s/${createdId}`)%8$s
                        .expect(204);

                      await request(app)
                        .get(`%2$s/${createdId}`)
                        .expect(404);
                    });
                  });
                });
                """.formatted(name, route, authSetup, testData, updateData, createdAssertions, updatedAssertions,
                auth, invalidDataCase);

        return GeneratedFile.test("src/tests/" + name + "Controller.test.ts", contents);
    }

    /**
     * Sample literal per field name, in field order; fields without a conforming value are left out.
     */
    private static Map<String, String> samples(List<Field> fields, Function<Field, Optional<String>> sample) {
        Map<String, String> samples = new LinkedHashMap<>();
        fields.forEach(f -> sample.apply(f).ifPresent(literal -> samples.put(f.getName(), literal)));
        return samples;
    }

    private static String entries(Map<String, String> samples) {
        return samples.entrySet().stream()
                .map(e -> "    " + e.getKey() + ": " + e.getValue() + ",\n")
                .collect(Collectors.joining());
    }

    private static String assertions(Collection<String> names, String source) {
        return names.stream()
                .map(n -> "      expect(response.body.data." + n + ").toEqual(" + source + "." + n + ");\n")
                .collect(Collectors.joining());
    }
}

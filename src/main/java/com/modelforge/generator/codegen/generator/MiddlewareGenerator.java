package com.modelforge.generator.codegen.generator;

import java.util.List;

import com.modelforge.generator.codegen.model.output.ContentLanguage;
import com.modelforge.generator.codegen.model.output.GeneratedFile;

/**
 * Generates the cross-cutting middleware every project gets: CORS headers, request logging, validation error
 * responses and the error handler.
 */
public class MiddlewareGenerator {

    public List<GeneratedFile> generate() {
        return List.of(
                GeneratedFile.source("src/middleware/cors.ts", generateCorsMiddleware(), ContentLanguage.TYPESCRIPT),
                GeneratedFile.source("src/middleware/logging.ts", generateLoggingMiddleware(),
                        ContentLanguage.TYPESCRIPT),
                GeneratedFile.source("src/middleware/validation.ts", generateValidationMiddleware(),
                        ContentLanguage.TYPESCRIPT));
    }

    private String generateCorsMiddleware() {
        return """
                import { Request, Response, NextFunction } from 'express';

                export const corsMiddleware = (req: Request, res: Response, next: NextFunction): void => {
                  res.header('Access-Control-Allow-Origin', process.env.CORS_ORIGIN || '*');
                  res.header('Access-Control-Allow-Methods', 'GET, POST, PUT, DELETE, OPTIONS');
                  res.header('Access-Control-Allow-Headers', 'Origin, X-Requested-With, Content-Type, Accept, Authorization');

                  if (req.method === 'OPTIONS') {
                    res.sendStatus(204);
                    return;
                  }
                  next();
                };
                """;
    }

    private String generateLoggingMiddleware() {
        return """
                import { Request, Response, NextFunction } from 'express';

                export const loggingMiddleware = (req: Request, res: Response, next: NextFunction): void => {
                  const start = Date.now();

                  res.on('finish', () => {
                    if (process.env.NODE_ENV === 'test') {
                      return;
                    }
                    console.log(JSON.stringify({
                      method: req.method,
                      url: req.originalUrl,
                      status: res.statusCode,
                      duration: `${Date.now() - start}ms`,
                      timestamp: new Date().toISOString()
                    }));
                  });

                  next();
                };
                """;
    }

    private String generateValidationMiddleware() {
        return """
                import { Request, Response, NextFunction } from 'express';
                import { validationResult } from 'express-validator';

                export const handleValidationErrors = (req: Request, res: Response, next: NextFunction): void => {
                  const errors = validationResult(req);

                  if (!errors.isEmpty()) {
                    res.status(400).json({
                      success: false,
                      message: 'Validation failed',
                      errors: errors.array().map((error) => ({
                        field: error.type === 'field' ? error.path : error.type,
                        message: error.msg
                      }))
                    });
                    return;
                  }

                  next();
                };

                export const errorHandler = (error: Error, req: Request, res: Response, next: NextFunction): void => {
                  console.error('Unhandled error:', error);

                  res.status(500).json({
                    success: false,
                    message: process.env.NODE_ENV === 'production' ? 'Internal server error' : error.message
                  });
                };
                """;
    }
}

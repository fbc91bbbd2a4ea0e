package com.modelforge.generator.codegen.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.modelforge.generator.codegen.model.core.context.DatabaseEngine;
import com.modelforge.generator.codegen.model.core.context.GenerationContext;
import com.modelforge.generator.codegen.model.output.AuthConfig;
import com.modelforge.generator.codegen.model.output.ContentLanguage;
import com.modelforge.generator.codegen.model.output.CrudOperation;
import com.modelforge.generator.codegen.model.output.Endpoint;
import com.modelforge.generator.codegen.model.output.GeneratedFile;
import com.modelforge.generator.codegen.model.output.HttpMethod;
import com.modelforge.generator.codegen.model.output.Role;
import com.modelforge.generator.codegen.util.NamingUtil;

/**
 * Generates token authentication: account record and storage, registration and login, token verification and
 * role checks.
 *
 * Everything except the middleware lives under {@code src/auth/}, a directory per-model artifacts never use.
 * Accounts are stored as {@code AuthUser} in {@code auth_users}, so a user-defined {@code User} model never collides
 * with them.
 */
public class AuthGenerator {

    public static final String AUTH_MODEL_NAME = "Auth";

    /** Mount point of the auth router. */
    public static final String ROUTE_SEGMENT = "auth";

    public static final String TABLE_NAME = "auth_users";

    static final String AUTH_DIR = "src/auth/";

    public List<GeneratedFile> generate(GenerationContext context) {
        AuthConfig authConfig = context.getAuthConfig();
        List<GeneratedFile> files = new ArrayList<>();
        files.add(ts(AUTH_DIR + "AuthUser.ts", generateUserModel(authConfig)));
        files.add(ts(AUTH_DIR + "AuthService.ts", generateAuthService(authConfig)));
        files.add(ts(AUTH_DIR + "AuthController.ts", generateAuthController()));
        files.add(ts(AUTH_DIR + "routes.ts", generateAuthRoutes()));
        files.add(ts(AUTH_DIR + "AuthUserRepository.ts", generateUserRepository(context.getDatabase())));
        files.add(ts(AUTH_DIR + "AuthValidation.ts", generateAuthValidation()));
        files.add(ts("src/middleware/auth.ts", generateAuthMiddleware()));
        files.add(ts("src/middleware/authorize.ts", generateAuthorizationMiddleware(authConfig)));
        if (context.getDatabase().isRelational()) {
            files.add(GeneratedFile.source(AUTH_DIR + TABLE_NAME + ".sql",
                    generateUserSchema(context.getDatabase()), ContentLanguage.SQL));
        }
        return files;
    }

    public List<Endpoint> endpoints() {
        return List.of(
                EndpointGenerator.endpoint(AUTH_MODEL_NAME, CrudOperation.CREATE, HttpMethod.POST, "/auth/register",
                        false, List.of(), "User registration"),
                EndpointGenerator.endpoint(AUTH_MODEL_NAME, CrudOperation.CREATE, HttpMethod.POST, "/auth/login",
                        false, List.of(), "User login"));
    }

    private static GeneratedFile ts(String path, String contents) {
        return GeneratedFile.source(path, contents, ContentLanguage.TYPESCRIPT);
    }

    private static String roleType(AuthConfig authConfig) {
        String union = authConfig.getRoles().stream()
                .map(Role::getName)
                .map(NamingUtil::quote)
                .collect(Collectors.joining(" | "));
        return union.isEmpty() ? "string" : union;
    }

    String generateUserModel(AuthConfig authConfig) {
        return """
                export type UserRole = %s;

                export interface AuthUser {
                  id: string;
                  email: string;
                  password: string;
                  name: string;
                  role: UserRole;
                  isActive: boolean;
                  lastLoginAt?: Date;
                  createdAt: Date;
                  updatedAt: Date;
                }

                export interface RegisterRequest {
                  email: string;
                  password: string;
                  name: string;
                }

                export interface LoginRequest {
                  email: string;
                  password: string;
                }

                export interface AuthResponse {
                  token: string;
                  refreshToken: string;
                  user: {
                    id: string;
                    email: string;
                    name: string;
                    role: UserRole;
                  };
                }
                """.formatted(roleType(authConfig));
    }

    String generateAuthService(AuthConfig authConfig) {
        return """
                import jwt from 'jsonwebtoken';
                import bcrypt from 'bcryptjs';
                import { AuthUserRepository } from './AuthUserRepository';
                import { AuthUser, RegisterRequest, LoginRequest, AuthResponse } from './AuthUser';

                export class AuthError extends Error {
                  constructor(message: string, public readonly status: number) {
                    super(message);
                  }
                }

                export class AuthService {
                  private userRepository: AuthUserRepository;

                  constructor() {
                    this.userRepository = new AuthUserRepository();
                  }

                  async register(request: RegisterRequest): Promise<AuthResponse> {
                    const existing = await this.userRepository.findByEmail(request.email);
                    if (existing) {
                      throw new AuthError('User already exists with this email', 409);
                    }

                    const password = await bcrypt.hash(request.password, 12);
                    const user = await this.userRepository.create({
                      email: request.email,
                      name: request.name,
                      password,
                      role: %s,
                    });
                    return this.toResponse(user);
                  }

                  async login(request: LoginRequest): Promise<AuthResponse> {
                    const user = await this.userRepository.findByEmail(request.email);
                    if (!user || !user.isActive) {
                      throw new AuthError('Invalid credentials', 401);
                    }

                    const passwordMatches = await bcrypt.compare(request.password, user.password);
                    if (!passwordMatches) {
                      throw new AuthError('Invalid credentials', 401);
                    }

                    await this.userRepository.updateLastLogin(user.id);
                    return this.toResponse(user);
                  }

                  private toResponse(user: AuthUser): AuthResponse {
                    const token = jwt.sign(
                      { userId: user.id, email: user.email, role: user.role },
                      process.env.JWT_SECRET as string,
                      { expiresIn: process.env.JWT_EXPIRES_IN || '15m' }
                    );
                    const refreshToken = jwt.sign(
                      { userId: user.id },
                      process.env.JWT_REFRESH_SECRET as string,
                      { expiresIn: '7d' }
                    );
                    return {
                      token,
                      refreshToken,
                      user: { id: user.id, email: user.email, name: user.name, role: user.role },
                    };
                  }
                }
                """.formatted(NamingUtil.quote(authConfig.defaultRoleName()));
    }

    String generateAuthController() {
        return """
                import { Request, Response, NextFunction } from 'express';
                import { AuthService, AuthError } from './AuthService';

                export class AuthController {
                  private authService: AuthService;

                  constructor() {
                    this.authService = new AuthService();
                  }

                  register = async (req: Request, res: Response, next: NextFunction): Promise<void> => {
                    try {
                      const result = await this.authService.register(req.body);
                      res.status(201).json({ success: true, data: result });
                    } catch (error) {
                      this.handleError(error, res, next);
                    }
                  };

                  login = async (req: Request, res: Response, next: NextFunction): Promise<void> => {
                    try {
                      const result = await this.authService.login(req.body);
                      res.json({ success: true, data: result });
                    } catch (error) {
                      this.handleError(error, res, next);
                    }
                  };

                  private handleError(error: unknown, res: Response, next: NextFunction): void {
                    if (error instanceof AuthError) {
                      res.status(error.status).json({ success: false, message: error.message });
                      return;
                    }
                    next(error);
                  }
                }
                """;
    }

    String generateAuthMiddleware() {
        return """
                import { Request, Response, NextFunction } from 'express';
                import jwt from 'jsonwebtoken';

                export interface TokenPayload {
                  userId: string;
                  email: string;
                  role: string;
                }

                export interface AuthenticatedRequest extends Request {
                  user?: TokenPayload;
                }

                export const authenticateToken = (req: Request, res: Response, next: NextFunction): void => {
                  const header = req.headers['authorization'];
                  const token = header && header.startsWith('Bearer ') ? header.substring(7) : undefined;

                  if (!token) {
                    res.status(401).json({ success: false, message: 'Access token required' });
                    return;
                  }

                  try {
                    (req as AuthenticatedRequest).user = jwt.verify(token, process.env.JWT_SECRET as string) as TokenPayload;
                    next();
                  } catch (error) {
                    res.status(403).json({ success: false, message: 'Invalid or expired token' });
                  }
                };
                """;
    }

    String generateAuthorizationMiddleware(AuthConfig authConfig) {
        String shortcuts = authConfig.getRoles().stream()
                .map(role -> "export const require" + NamingUtil.toPascalCase(role.getName())
                        + " = authorize(" + NamingUtil.quote(role.getName()) + ");\n")
                .collect(Collectors.joining());

        return """
                import { Request, Response, NextFunction } from 'express';
                import { AuthenticatedRequest } from './auth';

                export const authorize = (...roles: string[]) => {
                  return (req: Request, res: Response, next: NextFunction): void => {
                    const user = (req as AuthenticatedRequest).user;

                    if (!user) {
                      res.status(401).json({ success: false, message: 'Authentication required' });
                      return;
                    }

                    if (roles.length > 0 && !roles.includes(user.role)) {
                      res.status(403).json({ success: false, message: 'Insufficient permissions' });
                      return;
                    }

                    next();
                  };
                };

                %s""".formatted(shortcuts);
    }

    String generateAuthRoutes() {
        return """
                import { Router } from 'express';
                import { AuthController } from './AuthController';
                import { validateAuth } from './AuthValidation';

                const router = Router();
                const authController = new AuthController();

                router.post('/register', validateAuth.register, authController.register);
                router.post('/login', validateAuth.login, authController.login);

                export default router;
                """;
    }

    String generateAuthValidation() {
        return """
                import { body } from 'express-validator';
                import { handleValidationErrors } from '../middleware/validation';

                export const validateAuth = {
                  register: [
                    body('email').isEmail().withMessage('A valid email is required'),
                    body('password').isLength({ min: 8 }).withMessage('Password must be at least 8 characters'),
                    body('name').isString().notEmpty().withMessage('Name is required'),
                    handleValidationErrors
                  ],

                  login: [
                    body('email').isEmail().withMessage('A valid email is required'),
                    body('password').notEmpty().withMessage('Password is required'),
                    handleValidationErrors
                  ]
                };
                """;
    }

    String generateUserRepository(DatabaseEngine database) {
        return switch (database) {
            case POSTGRESQL -> """
                    import { query } from '../database/connection';
                    import { AuthUser } from './AuthUser';

                    type NewUser = Pick<AuthUser, 'email' | 'password' | 'name' | 'role'>;

                    export class AuthUserRepository {
                      async create(user: NewUser): Promise<AuthUser> {
                        const result = await query(
                          'INSERT INTO auth_users (email, password, name, role) VALUES ($1, $2, $3, $4) RETURNING *',
                          [user.email, user.password, user.name, user.role]
                        );
                        return this.mapRow(result.rows[0]);
                      }

                      async findByEmail(email: string): Promise<AuthUser | null> {
                        const result = await query('SELECT * FROM auth_users WHERE email = $1', [email]);
                        return result.rows.length > 0 ? this.mapRow(result.rows[0]) : null;
                      }

                      async updateLastLogin(id: string): Promise<void> {
                        await query('UPDATE auth_users SET last_login_at = NOW() WHERE id = $1', [id]);
                      }

                      private mapRow(row: any): AuthUser {
                        return {
                          id: row.id,
                          email: row.email,
                          password: row.password,
                          name: row.name,
                          role: row.role,
                          isActive: row.is_active,
                          lastLoginAt: row.last_login_at ?? undefined,
                          createdAt: row.created_at,
                          updatedAt: row.updated_at,
                        };
                      }
                    }
                    """;
            case MYSQL -> """
                    import { randomUUID } from 'crypto';
                    import { query } from '../database/connection';
                    import { AuthUser } from './AuthUser';

                    type NewUser = Pick<AuthUser, 'email' | 'password' | 'name' | 'role'>;

                    export class AuthUserRepository {
                      async create(user: NewUser): Promise<AuthUser> {
                        const id = randomUUID();
                        await query(
                          'INSERT INTO auth_users (id, email, password, name, role) VALUES (?, ?, ?, ?, ?)',
                          [id, user.email, user.password, user.name, user.role]
                        );
                        const rows = await query('SELECT * FROM auth_users WHERE id = ?', [id]);
                        return this.mapRow(rows[0]);
                      }

                      async findByEmail(email: string): Promise<AuthUser | null> {
                        const rows = await query('SELECT * FROM auth_users WHERE email = ?', [email]);
                        return rows.length > 0 ? this.mapRow(rows[0]) : null;
                      }

                      async updateLastLogin(id: string): Promise<void> {
                        await query('UPDATE auth_users SET last_login_at = CURRENT_TIMESTAMP WHERE id = ?', [id]);
                      }

                      private mapRow(row: any): AuthUser {
                        return {
                          id: row.id,
                          email: row.email,
                          password: row.password,
                          name: row.name,
                          role: row.role,
                          isActive: Boolean(row.is_active),
                          lastLoginAt: row.last_login_at ?? undefined,
                          createdAt: row.created_at,
                          updatedAt: row.updated_at,
                        };
                      }
                    }
                    """;
            case MONGODB -> """
                    import { randomUUID } from 'crypto';
                    import { getDb } from '../database/connection';
                    import { AuthUser } from './AuthUser';

                    type NewUser = Pick<AuthUser, 'email' | 'password' | 'name' | 'role'>;

                    export class AuthUserRepository {
                      private async collection() {
                        return (await getDb()).collection('auth_users');
                      }

                      async create(user: NewUser): Promise<AuthUser> {
                        const now = new Date();
                        const record: AuthUser = { ...user, id: randomUUID(), isActive: true, createdAt: now, updatedAt: now };
                        await (await this.collection()).insertOne({ ...record });
                        return record;
                      }

                      async findByEmail(email: string): Promise<AuthUser | null> {
                        const document = await (await this.collection()).findOne({ email });
                        if (!document) {
                          return null;
                        }
                        const { _id, ...record } = document;
                        return record as unknown as AuthUser;
                      }

                      async updateLastLogin(id: string): Promise<void> {
                        await (await this.collection()).updateOne({ id }, { $set: { lastLoginAt: new Date() } });
                      }
                    }
                    """;
        };
    }

    String generateUserSchema(DatabaseEngine database) {
        if (database == DatabaseEngine.MYSQL) {
            return """
                    CREATE TABLE IF NOT EXISTS auth_users (
                      id CHAR(36) PRIMARY KEY,
                      email VARCHAR(255) NOT NULL UNIQUE,
                      password VARCHAR(255) NOT NULL,
                      name VARCHAR(255) NOT NULL,
                      role VARCHAR(50) NOT NULL,
                      is_active BOOLEAN NOT NULL DEFAULT TRUE,
                      last_login_at DATETIME NULL,
                      created_at DATETIME DEFAULT CURRENT_TIMESTAMP,
                      updated_at DATETIME DEFAULT CURRENT_TIMESTAMP ON UPDATE CURRENT_TIMESTAMP
                    );
                    """;
        }
        return """
                CREATE TABLE IF NOT EXISTS auth_users (
                  id UUID PRIMARY KEY DEFAULT gen_random_uuid(),
                  email VARCHAR(255) NOT NULL UNIQUE,
                  password VARCHAR(255) NOT NULL,
                  name VARCHAR(255) NOT NULL,
                  role VARCHAR(50) NOT NULL,
                  is_active BOOLEAN NOT NULL DEFAULT TRUE,
                  last_login_at TIMESTAMP WITH TIME ZONE,
                  created_at TIMESTAMP WITH TIME ZONE DEFAULT NOW(),
                  updated_at TIMESTAMP WITH TIME ZONE DEFAULT NOW()
                );

                CREATE INDEX IF NOT EXISTS idx_auth_users_email ON auth_users (email);
                """;
    }
}

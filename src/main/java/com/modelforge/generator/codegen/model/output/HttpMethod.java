package com.modelforge.generator.codegen.model.output;

public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE
}

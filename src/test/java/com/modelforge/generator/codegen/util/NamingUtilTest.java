package com.modelforge.generator.codegen.util;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.model.input.ModelMetadata;

/**
 * Unit tests for NamingUtil.
 */
class NamingUtilTest {

    @ParameterizedTest
    @CsvSource({
            "User, users",
            "OrderItem, order_items",
            "Category, categories",
            "Address, addresses",
            "Day, days",
            "Box, boxes"
    })
    void testTableNames(String modelName, String tableName) {
        assertThat(NamingUtil.tableName(Model.builder().name(modelName).build())).isEqualTo(tableName);
    }

    @Test
    void testTableNameOverride() {
        Model model = Model.builder()
                .name("Person")
                .metadata(ModelMetadata.builder().tableName("people").build())
                .build();

        assertThat(NamingUtil.tableName(model)).isEqualTo("people");
        assertThat(NamingUtil.routeSegment(model)).isEqualTo("person");
    }

    @Test
    void testCaseConversions() {
        assertThat(NamingUtil.toPascalCase("order-item")).isEqualTo("OrderItem");
        assertThat(NamingUtil.toCamelCase("OrderItem")).isEqualTo("orderItem");
        assertThat(NamingUtil.toSnakeCase("lastLoginAt")).isEqualTo("last_login_at");
        assertThat(NamingUtil.toScreamingSnakeCase("jwtSecret")).isEqualTo("JWT_SECRET");
    }

    @Test
    void testQuoteEscapes() {
        assertThat(NamingUtil.quote("it's")).isEqualTo("'it\\'s'");
    }
}

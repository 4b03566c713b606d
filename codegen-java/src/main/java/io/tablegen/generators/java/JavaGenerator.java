package io.tablegen.generators.java;

import com.squareup.javapoet.*;
import io.tablegen.core.MetadataValidator;
import io.tablegen.core.model.ColumnMetadata;
import io.tablegen.core.model.DataType;
import io.tablegen.core.model.TableMetadata;
import io.tablegen.core.query.CompiledQuery;
import io.tablegen.core.query.FilterQueryCompiler;
import io.tablegen.core.query.RowValues;
import io.tablegen.core.query.SqlDialect;
import io.tablegen.core.query.SqlDialects;
import io.tablegen.core.query.SqlExecutor;
import io.tablegen.core.security.IdentifierValidator;
import io.tablegen.generators.java.merge.PreservationMerger;

import javax.lang.model.SourceVersion;
import javax.lang.model.element.Modifier;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Java code generator for relational tables.
 *
 * Turns one {@link TableMetadata} into plain Java sources that sit on top of the
 * schema-core runtime ({@link SqlExecutor}, {@link FilterQueryCompiler}, {@link RowValues}).
 * Nothing is written here: every file is returned as text so the orchestrator can merge
 * it with the copy on disk first.
 *
 * <h3>Type mapping</h3>
 * <ul>
 *   <li>{@code string}, {@code json}, {@code enum} → {@code String}</li>
 *   <li>{@code integer}  → {@code Long}</li>
 *   <li>{@code decimal}  → {@code BigDecimal}</li>
 *   <li>{@code boolean}  → {@code Boolean}</li>
 *   <li>{@code datetime} → {@code Instant}</li>
 *   <li>{@code uuid}     → {@code UUID}</li>
 * </ul>
 *
 * Generates:
 * - Entity POJO ({Entity}.java) with row mapping, Builder and equals/hashCode/toString
 * - SQL constants ({Entity}Queries.java), identifiers validated and quoted for the dialect
 * - Repository ({Entity}Repository.java) over {@link SqlExecutor}, filtered reads through the compiler
 * - Per-entity {Entity}Validator with required, length, range and enum checks
 * - Shared TableValidationException for structured field-level errors
 *
 * Every file carries at least one preserved block for hand-written code.
 */
public class JavaGenerator {

    static final String VALIDATION_EXCEPTION = "TableValidationException";

    private static final ClassName STRING = ClassName.get(String.class);
    private static final ParameterizedTypeName ROW_TYPE = ParameterizedTypeName.get(
        ClassName.get(Map.class), STRING, ClassName.get(Object.class));
    private static final ParameterizedTypeName FILTER_TYPE = ParameterizedTypeName.get(
        ClassName.get(Map.class), STRING, WildcardTypeName.subtypeOf(Object.class));
    private static final ParameterizedTypeName LIST_OF_STRING = ParameterizedTypeName.get(
        ClassName.get(List.class), STRING);

    /**
     * Per-column descriptor shared by every artifact.
     */
    private record PlainField(
        String codeName,
        TypeName type,
        ColumnMetadata column,
        boolean managed,       // stamped by the generated DML (timestamps, soft delete)
        boolean generatedKey   // primary key with a database default
    ) {}

    /**
     * Everything derived from the metadata once per run.
     */
    private record Target(
        TableMetadata table,
        String entityName,
        String pkg,
        SqlDialect dialect,
        List<PlainField> fields,
        PlainField primaryKey
    ) {
        ClassName entity() { return ClassName.get(pkg, entityName); }
        ClassName queries() { return ClassName.get(pkg + ".query", entityName + "Queries"); }
        ClassName validator() { return ClassName.get(pkg + ".validation", entityName + "Validator"); }
        ClassName exception() { return ClassName.get(pkg + ".validation", VALIDATION_EXCEPTION); }
        ClassName fieldError() { return ClassName.get(pkg + ".validation", VALIDATION_EXCEPTION, "FieldError"); }
    }

    /**
     * Generate every file for one table.
     *
     * @param table validated before anything is produced
     * @param pkg base package for the generated code
     * @param dialect decides placeholders, quoting and the compiler the repository uses
     * @return candidate files in a fixed order
     */
    public List<GeneratedFile> generate(TableMetadata table, String pkg, SqlDialect dialect) {
        MetadataValidator.validate(table);
        if (pkg == null || !SourceVersion.isName(pkg)) {
            throw new IllegalArgumentException("Invalid package name: " + pkg);
        }

        Target t = resolveTarget(table, pkg, dialect);

        List<GeneratedFile> files = new ArrayList<>();
        files.add(generateEntity(t));
        files.add(generateQueries(t));
        files.add(generateRepository(t));
        files.add(generateValidationException(pkg));
        files.add(generateValidator(t));
        return files;
    }

    private Target resolveTarget(TableMetadata table, String pkg, SqlDialect dialect) {
        List<PlainField> fields = new ArrayList<>();
        PlainField pk = null;
        for (ColumnMetadata c : table.columns()) {
            boolean isPk = c.name().equals(table.primaryKey());
            PlainField f = new PlainField(resolveCodeName(c.name()), mapType(c.dataType()), c,
                isManaged(table, c.name()), isPk && c.hasDefault());
            fields.add(f);
            if (isPk) pk = f;
        }
        detectCollisions(fields);
        return new Target(table, deriveEntityName(table.table()), pkg, dialect, fields, pk);
    }

    // =========================================================================
    // Name Resolution
    // =========================================================================

    /**
     * Entity name from the table name: singular, PascalCase ({@code line_items} → {@code LineItem}).
     */
    static String deriveEntityName(String tableName) {
        String camel = toJavaCamelCase(singularize(tableName));
        String name = cap(camel);
        return SourceVersion.isName(name) ? name : name + "Entity";
    }

    static String singularize(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        if (lower.endsWith("ies") && word.length() > 3) return word.substring(0, word.length() - 3) + "y";
        if (lower.endsWith("sses") || lower.endsWith("xes") || lower.endsWith("ches") || lower.endsWith("shes")) {
            return word.substring(0, word.length() - 2);
        }
        if (lower.endsWith("s") && !lower.endsWith("ss") && !lower.endsWith("us") && word.length() > 1) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }

    /**
     * Java field name for a column; keywords get a {@code Value} suffix.
     */
    static String resolveCodeName(String columnName) {
        String name = toJavaCamelCase(columnName);
        if (SourceVersion.isKeyword(name)) {
            name = name + "Value";
        }
        return name;
    }

    /**
     * Convert a column name to a valid Java camelCase identifier.
     */
    static String toJavaCamelCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }

        String result;
        if (!name.contains("-") && !name.contains("_")) {
            // Handle all-caps: SKU -> sku, ID -> id
            result = name.equals(name.toUpperCase())
                ? name.toLowerCase()
                : name.substring(0, 1).toLowerCase() + name.substring(1);
        } else {
            StringBuilder sb = new StringBuilder();
            for (String part : name.split("[-_]")) {
                if (part.isEmpty()) continue;
                String lower = part.toLowerCase();
                sb.append(sb.isEmpty() ? lower : cap(lower));
            }
            result = sb.isEmpty() ? "_" : sb.toString();
        }

        if (Character.isDigit(result.charAt(0))) {
            result = "_" + result;
        }

        return result;
    }

    /**
     * Detect collisions in resolved code names across all columns.
     */
    static void detectCollisions(List<PlainField> fields) {
        Map<String, List<String>> codeNameToColumns = new HashMap<>();
        for (PlainField f : fields) {
            codeNameToColumns.computeIfAbsent(f.codeName, k -> new ArrayList<>()).add(f.column.name());
        }

        for (Map.Entry<String, List<String>> entry : codeNameToColumns.entrySet()) {
            if (entry.getValue().size() > 1) {
                throw new IllegalArgumentException(
                    "Name collision: columns " + entry.getValue() +
                    " all resolve to Java identifier '" + entry.getKey() + "'."
                );
            }
        }
    }

    private static boolean isManaged(TableMetadata table, String column) {
        if (table.hasTimestamps()
                && (column.equals(TableMetadata.CREATED_AT) || column.equals(TableMetadata.UPDATED_AT))) {
            return true;
        }
        return table.hasSoftDelete() && column.equals(TableMetadata.DELETED_AT);
    }

    // =========================================================================
    // Type Mapping
    // =========================================================================

    static TypeName mapType(DataType type) {
        return switch (type) {
            case STRING, JSON, ENUM -> STRING;
            case INTEGER -> ClassName.get(Long.class);
            case DECIMAL -> ClassName.get(BigDecimal.class);
            case BOOLEAN -> ClassName.get(Boolean.class);
            case DATETIME -> ClassName.get(Instant.class);
            case UUID -> ClassName.get(java.util.UUID.class);
        };
    }

    /** {@link RowValues} method that coerces a raw driver value to the mapped type. */
    private static String rowReader(DataType type) {
        return switch (type) {
            case STRING, JSON, ENUM -> "asString";
            case INTEGER -> "asLong";
            case DECIMAL -> "asBigDecimal";
            case BOOLEAN -> "asBoolean";
            case DATETIME -> "asInstant";
            case UUID -> "asUuid";
        };
    }

    // =========================================================================
    // Entity Generation
    // =========================================================================

    private GeneratedFile generateEntity(Target t) {
        ClassName entityRef = t.entity();
        TypeSpec.Builder tb = TypeSpec.classBuilder(t.entityName)
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc("Row of $L.\n", t.table.key());

        for (PlainField f : t.fields) {
            FieldSpec.Builder fieldBuilder = FieldSpec.builder(f.type, f.codeName, Modifier.PRIVATE);
            ColumnMetadata c = f.column;
            if (c.description() != null && !c.description().isEmpty()) {
                fieldBuilder.addJavadoc("$L\n", c.description());
            }
            if (t.primaryKey == f) {
                fieldBuilder.addJavadoc("Primary key, column {@code $L}.\n", c.name());
            } else if (!f.codeName.equals(c.name())) {
                fieldBuilder.addJavadoc("Column {@code $L}.\n", c.name());
            }
            if (c.nullable()) {
                fieldBuilder.addJavadoc("Nullable.\n");
            }
            tb.addField(fieldBuilder.build());
        }

        addConstructors(tb, t.fields);

        for (PlainField f : t.fields) {
            tb.addMethod(MethodSpec.methodBuilder("get" + cap(f.codeName))
                .addModifiers(Modifier.PUBLIC)
                .returns(f.type)
                .addStatement("return $L", f.codeName)
                .build());
        }

        addSetters(tb, t.fields);

        MethodSpec.Builder fromRow = MethodSpec.methodBuilder("fromRow")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addJavadoc("Map a result row keyed by column name.\n")
            .addParameter(ROW_TYPE, "row")
            .returns(entityRef)
            .addStatement("$T entity = new $T()", entityRef, entityRef);
        for (PlainField f : t.fields) {
            fromRow.addStatement("entity.$L = $T.$L(row.get($S))",
                f.codeName, RowValues.class, rowReader(f.column.dataType()), f.column.name());
        }
        fromRow.addStatement("return entity");
        tb.addMethod(fromRow.build());

        addBuilderClass(tb, t.entityName, t.fields);
        addEqualsHashCodeToString(tb, t.entityName, t.fields);

        return file(t.pkg, tb.build(), "custom-members", "Custom fields and methods go here.");
    }

    // =========================================================================
    // Query Constants Generation
    // =========================================================================

    private GeneratedFile generateQueries(Target t) {
        SqlDialect d = t.dialect;
        TableMetadata table = t.table;
        String from = d.quoteQualified(
            IdentifierValidator.validateIdentifier(table.schema(), null, "schema name"),
            IdentifierValidator.validateIdentifier(table.table(), null, "table name"));
        String now = d.currentTimestamp();
        String notDeleted = quote(d, TableMetadata.DELETED_AT) + " IS NULL";

        List<String> allColumns = t.fields.stream().map(f -> quote(d, f.column.name())).collect(Collectors.toList());
        String live = table.hasSoftDelete() ? " WHERE " + notDeleted : "";
        String selectAll = "SELECT " + String.join(", ", allColumns) + " FROM " + from + live;
        String countAll = "SELECT COUNT(*) AS " + quote(d, "count") + " FROM " + from + live;

        TypeSpec.Builder tb = TypeSpec.classBuilder(t.entityName + "Queries")
            .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
            .addJavadoc("SQL for $L ($L placeholders).\n", table.key(), d.id())
            .addJavadoc("Identifiers are validated and quoted at generation time; values are always bound.\n");

        tb.addField(constant(STRING, "TABLE", CodeBlock.of("$S", from)));
        tb.addField(constant(LIST_OF_STRING, "COLUMNS", listOf(columnNames(t.fields))));
        tb.addField(constant(LIST_OF_STRING, "FILTERABLE_COLUMNS", listOf(table.filterableColumns())));
        tb.addField(constant(ClassName.get(TableMetadata.class), "METADATA", metadataOf(table))
            .toBuilder()
            .addJavadoc("Column types, enum values and ranges that runtime filters are checked against.\n")
            .build());
        tb.addField(constant(STRING, "SELECT_ALL", CodeBlock.of("$S", selectAll)));
        tb.addField(constant(STRING, "COUNT_ALL", CodeBlock.of("$S", countAll)));

        List<PlainField> insertable = insertableFields(t);
        if (!insertable.isEmpty() || table.hasTimestamps()) {
            List<String> cols = new ArrayList<>();
            List<String> vals = new ArrayList<>();
            int i = 1;
            for (PlainField f : insertable) {
                cols.add(quote(d, f.column.name()));
                vals.add(d.placeholder(i++));
            }
            if (table.hasTimestamps()) {
                cols.add(quote(d, TableMetadata.CREATED_AT));
                vals.add(now);
                cols.add(quote(d, TableMetadata.UPDATED_AT));
                vals.add(now);
            }
            String insert = "INSERT INTO " + from + " (" + String.join(", ", cols) + ") VALUES ("
                + String.join(", ", vals) + ")";
            tb.addField(constant(STRING, "INSERT", CodeBlock.of("$S", insert)));
        }

        if (t.primaryKey != null) {
            String pk = quote(d, t.primaryKey.column.name());
            String liveAnd = table.hasSoftDelete() ? " AND " + notDeleted : "";
            String findById = selectAll + (table.hasSoftDelete() ? " AND " : " WHERE ") + pk + " = " + d.placeholder(1);
            tb.addField(constant(STRING, "FIND_BY_ID", CodeBlock.of("$S", findById)));

            List<PlainField> updatable = updatableFields(t);
            if (!updatable.isEmpty() || table.hasTimestamps()) {
                List<String> sets = new ArrayList<>();
                int i = 1;
                for (PlainField f : updatable) {
                    sets.add(quote(d, f.column.name()) + " = " + d.placeholder(i++));
                }
                if (table.hasTimestamps()) {
                    sets.add(quote(d, TableMetadata.UPDATED_AT) + " = " + now);
                }
                String update = "UPDATE " + from + " SET " + String.join(", ", sets)
                    + " WHERE " + pk + " = " + d.placeholder(i) + liveAnd;
                tb.addField(constant(STRING, "UPDATE", CodeBlock.of("$S", update)));
            }

            String delete = table.hasSoftDelete()
                ? "UPDATE " + from + " SET " + quote(d, TableMetadata.DELETED_AT) + " = " + now
                    + " WHERE " + pk + " = " + d.placeholder(1) + liveAnd
                : "DELETE FROM " + from + " WHERE " + pk + " = " + d.placeholder(1);
            tb.addField(constant(STRING, "DELETE", CodeBlock.of("$S", delete)));
        }

        tb.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PRIVATE)
            .build());

        return file(t.pkg + ".query", tb.build(), "custom-queries", "Custom SQL constants go here.");
    }

    private static String quote(SqlDialect d, String column) {
        return d.quoteIdentifier(IdentifierValidator.validateIdentifier(column, null, "column name"));
    }

    /** Columns bound by INSERT, in placeholder order. */
    private static List<PlainField> insertableFields(Target t) {
        return t.fields.stream()
            .filter(f -> !f.managed && !f.generatedKey)
            .collect(Collectors.toList());
    }

    /** Columns bound by UPDATE before the key placeholder, in placeholder order. */
    private static List<PlainField> updatableFields(Target t) {
        return t.fields.stream()
            .filter(f -> !f.managed && f != t.primaryKey)
            .collect(Collectors.toList());
    }

    private static FieldSpec constant(TypeName type, String name, CodeBlock initializer) {
        return FieldSpec.builder(type, name, Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
            .initializer(initializer)
            .build();
    }

    private static CodeBlock listOf(List<String> values) {
        List<CodeBlock> items = values.stream().map(v -> CodeBlock.of("$S", v)).collect(Collectors.toList());
        return CodeBlock.of("$T.of($L)", List.class, CodeBlock.join(items, ", "));
    }

    /** Literal {@code TableMetadata}; descriptions and unique columns are left out. */
    private static CodeBlock metadataOf(TableMetadata table) {
        List<CodeBlock> columns = new ArrayList<>();
        for (ColumnMetadata c : table.columns()) {
            CodeBlock enumValues = c.enumValues() == null ? CodeBlock.of("null") : listOf(c.enumValues());
            columns.add(CodeBlock.of("new $T($S, $T.$L, $L, $L, $L, $L, $L, $L, $L, $L, $L, null)",
                ColumnMetadata.class, c.name(), DataType.class, c.dataType().name(),
                c.nullable(), c.primaryKey(), c.unique(), c.filterable(), c.hasDefault(),
                c.maxLength(), c.min(), c.max(), enumValues));
        }
        return CodeBlock.builder()
            .add("new $T($S, $S, $T.of(\n", TableMetadata.class, table.schema(), table.table(), List.class)
            .indent().indent()
            .add(CodeBlock.join(columns, ",\n"))
            .unindent().unindent()
            .add("),\n        $S, null, $L, $L)", table.primaryKey(), table.hasTimestamps(), table.hasSoftDelete())
            .build();
    }

    private static List<String> columnNames(List<PlainField> fields) {
        return fields.stream().map(f -> f.column.name()).collect(Collectors.toList());
    }

    // =========================================================================
    // Repository Generation
    // =========================================================================

    /**
     * Generate the repository. Key-based methods only exist when the table has a primary key;
     * create/update only when the matching statement exists.
     */
    private GeneratedFile generateRepository(Target t) {
        ClassName entityClass = t.entity();
        ClassName queries = t.queries();
        ClassName validator = t.validator();
        TableMetadata table = t.table;
        ParameterizedTypeName listOfEntity = ParameterizedTypeName.get(ClassName.get(List.class), entityClass);
        ParameterizedTypeName listOfRows = ParameterizedTypeName.get(ClassName.get(List.class), ROW_TYPE);

        TypeSpec.Builder tb = TypeSpec.classBuilder(t.entityName + "Repository")
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc("Repository for $L rows of $L.\n", t.entityName, table.key())
            .addJavadoc("Filter keys are restricted to {@link $T#FILTERABLE_COLUMNS} and checked against {@link $T#METADATA}.\n",
                queries, queries);
        if (t.primaryKey != null) {
            tb.addJavadoc("Primary key: $L\n", t.primaryKey.column.name());
        } else {
            tb.addJavadoc("No primary key; read-only access.\n");
        }
        if (table.hasSoftDelete()) {
            tb.addJavadoc("Soft delete: deleted rows are hidden from every read.\n");
        }

        tb.addField(FieldSpec.builder(SqlExecutor.class, "executor", Modifier.PRIVATE, Modifier.FINAL).build());
        tb.addField(FieldSpec.builder(FilterQueryCompiler.class, "compiler", Modifier.PRIVATE, Modifier.FINAL).build());

        tb.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PUBLIC)
            .addParameter(SqlExecutor.class, "executor")
            .addStatement("this(executor, new $T($T.of($S)))", FilterQueryCompiler.class, SqlDialects.class, t.dialect.id())
            .build());

        tb.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc("Constructor for dependency injection and testing.\n")
            .addParameter(SqlExecutor.class, "executor")
            .addParameter(FilterQueryCompiler.class, "compiler")
            .addStatement("this.executor = executor")
            .addStatement("this.compiler = compiler")
            .build());

        tb.addMethod(MethodSpec.methodBuilder("findAll")
            .addModifiers(Modifier.PUBLIC)
            .returns(listOfEntity)
            .addStatement("return findAll($T.of())", Map.class)
            .build());

        tb.addMethod(MethodSpec.methodBuilder("findAll")
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc("Find rows matching a filter map ({@code status}, {@code total_gte}, {@code sort}, {@code limit}, ...).\n")
            .addParameter(FILTER_TYPE, "filter")
            .returns(listOfEntity)
            .addStatement("$T q = compiler.compile($T.SELECT_ALL, filter, $T.METADATA)",
                CompiledQuery.class, queries, queries)
            .addStatement("$T out = new $T<>()", listOfEntity, ArrayList.class)
            .beginControlFlow("for ($T row : executor.query(q.text(), q.values()))", ROW_TYPE)
            .addStatement("out.add($T.fromRow(row))", entityClass)
            .endControlFlow()
            .addStatement("return out")
            .build());

        tb.addMethod(MethodSpec.methodBuilder("count")
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc("Count rows matching the conditions of a filter map; sort and pagination keys are ignored.\n")
            .addParameter(FILTER_TYPE, "filter")
            .returns(long.class)
            .addStatement("$T q = compiler.compile($T.COUNT_ALL, $T.withoutControlKeys(filter), $T.METADATA)",
                CompiledQuery.class, queries, FilterQueryCompiler.class, queries)
            .addStatement("$T rows = executor.query(q.text(), q.values())", listOfRows)
            .addStatement("if (rows.isEmpty()) return 0L")
            .addStatement("$T n = $T.asLong(rows.get(0).get($S))", Long.class, RowValues.class, "count")
            .addStatement("return n == null ? 0L : n")
            .build());

        List<PlainField> insertable = insertableFields(t);
        if (!insertable.isEmpty() || table.hasTimestamps()) {
            tb.addMethod(MethodSpec.methodBuilder("create")
                .addModifiers(Modifier.PUBLIC)
                .addJavadoc("Insert a row. Validates constraints before persisting.\n")
                .addJavadoc("@return affected row count\n")
                .addParameter(entityClass, "entity")
                .returns(int.class)
                .addStatement("$T.validate(entity)", validator)
                .addStatement("return executor.update($T.INSERT, $L)", queries, paramList(insertable, null))
                .build());
        }

        if (t.primaryKey != null) {
            PlainField pk = t.primaryKey;
            ParameterizedTypeName optionalEntity = ParameterizedTypeName.get(ClassName.get(Optional.class), entityClass);

            tb.addMethod(MethodSpec.methodBuilder("findById")
                .addModifiers(Modifier.PUBLIC)
                .addParameter(pk.type, pk.codeName)
                .returns(optionalEntity)
                .addStatement("$T rows = executor.query($T.FIND_BY_ID, $T.<Object>singletonList($L))",
                    listOfRows, queries, Collections.class, pk.codeName)
                .addStatement("return rows.isEmpty() ? $T.empty() : $T.of($T.fromRow(rows.get(0)))",
                    Optional.class, Optional.class, entityClass)
                .build());

            List<PlainField> updatable = updatableFields(t);
            if (!updatable.isEmpty() || table.hasTimestamps()) {
                tb.addMethod(MethodSpec.methodBuilder("update")
                    .addModifiers(Modifier.PUBLIC)
                    .addJavadoc("Update every non-key column of the row identified by the entity's key.\n")
                    .addJavadoc("@return affected row count\n")
                    .addParameter(entityClass, "entity")
                    .returns(int.class)
                    .addStatement("$T.validate(entity)", validator)
                    .addStatement("return executor.update($T.UPDATE, $L)", queries, paramList(updatable, pk))
                    .build());
            }

            tb.addMethod(MethodSpec.methodBuilder("delete")
                .addModifiers(Modifier.PUBLIC)
                .addJavadoc(table.hasSoftDelete()
                    ? CodeBlock.of("Soft delete: stamps $L instead of removing the row.\n", TableMetadata.DELETED_AT)
                    : CodeBlock.of("Delete the row by primary key.\n"))
                .addJavadoc("@return affected row count\n")
                .addParameter(pk.type, pk.codeName)
                .returns(int.class)
                .addStatement("return executor.update($T.DELETE, $T.<Object>singletonList($L))",
                    queries, Collections.class, pk.codeName)
                .build());
        }

        return file(t.pkg + ".repository", tb.build(), "custom-methods", "Custom repository methods go here.");
    }

    /** {@code Arrays.<Object>asList(entity.getA(), ...)} in placeholder order, key last when given. */
    private static CodeBlock paramList(List<PlainField> fields, PlainField key) {
        List<CodeBlock> getters = new ArrayList<>();
        for (PlainField f : fields) {
            getters.add(CodeBlock.of("entity.get$L()", cap(f.codeName)));
        }
        if (key != null) {
            getters.add(CodeBlock.of("entity.get$L()", cap(key.codeName)));
        }
        return CodeBlock.of("$T.<Object>asList($L)", Arrays.class, CodeBlock.join(getters, ", "));
    }

    // =========================================================================
    // Validation Generation
    // =========================================================================

    /**
     * Generate the shared TableValidationException class.
     */
    private GeneratedFile generateValidationException(String pkg) {
        ClassName fieldErrorClass = ClassName.get(pkg + ".validation", VALIDATION_EXCEPTION, "FieldError");
        ParameterizedTypeName listOfFieldError = ParameterizedTypeName.get(
            ClassName.get(List.class), fieldErrorClass);

        TypeSpec.Builder fieldErrorBuilder = TypeSpec.classBuilder("FieldError")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addField(FieldSpec.builder(String.class, "column", Modifier.PRIVATE, Modifier.FINAL).build())
            .addField(FieldSpec.builder(String.class, "constraint", Modifier.PRIVATE, Modifier.FINAL).build())
            .addField(FieldSpec.builder(String.class, "message", Modifier.PRIVATE, Modifier.FINAL).build());

        fieldErrorBuilder.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PUBLIC)
            .addParameter(String.class, "column")
            .addParameter(String.class, "constraint")
            .addParameter(String.class, "message")
            .addStatement("this.column = column")
            .addStatement("this.constraint = constraint")
            .addStatement("this.message = message")
            .build());

        for (String name : List.of("column", "constraint", "message")) {
            fieldErrorBuilder.addMethod(MethodSpec.methodBuilder("get" + cap(name))
                .addModifiers(Modifier.PUBLIC)
                .returns(String.class)
                .addStatement("return $L", name)
                .build());
        }

        fieldErrorBuilder.addMethod(MethodSpec.methodBuilder("toString")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(String.class)
            .addStatement("return column + $S + message", ": ")
            .build());

        TypeSpec.Builder tb = TypeSpec.classBuilder(VALIDATION_EXCEPTION)
            .addModifiers(Modifier.PUBLIC)
            .superclass(RuntimeException.class)
            .addJavadoc("Validation exception with structured column-level errors.\n")
            .addJavadoc("Collects all constraint violations before throwing.\n");

        tb.addField(FieldSpec.builder(String.class, "entityName", Modifier.PRIVATE, Modifier.FINAL).build());
        tb.addField(FieldSpec.builder(listOfFieldError, "errors", Modifier.PRIVATE, Modifier.FINAL).build());

        tb.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PUBLIC)
            .addParameter(String.class, "entityName")
            .addParameter(listOfFieldError, "errors")
            .addStatement("super(entityName + $S + errors.size() + $S + errors)", " validation failed: ", " error(s) ")
            .addStatement("this.entityName = entityName")
            .addStatement("this.errors = $T.unmodifiableList(errors)", Collections.class)
            .build());

        tb.addMethod(MethodSpec.methodBuilder("getEntityName")
            .addModifiers(Modifier.PUBLIC)
            .returns(String.class)
            .addStatement("return entityName")
            .build());

        tb.addMethod(MethodSpec.methodBuilder("getErrors")
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc("Get the list of column-level validation errors.\n")
            .returns(listOfFieldError)
            .addStatement("return errors")
            .build());

        tb.addType(fieldErrorBuilder.build());

        return file(pkg + ".validation", tb.build(), "custom-members", "Custom members go here.");
    }

    /**
     * Generate a per-entity Validator class with constraint checks.
     */
    private GeneratedFile generateValidator(Target t) {
        ClassName fieldErrorClass = t.fieldError();
        ParameterizedTypeName listOfFieldError = ParameterizedTypeName.get(ClassName.get(List.class), fieldErrorClass);
        ParameterizedTypeName setOfString = ParameterizedTypeName.get(ClassName.get(Set.class), STRING);

        TypeSpec.Builder tb = TypeSpec.classBuilder(t.entityName + "Validator")
            .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
            .addJavadoc("Validator for $L entity.\n", t.entityName)
            .addJavadoc("Checks required columns, max length, numeric ranges and enum values from the table metadata.\n");

        MethodSpec.Builder validateMethod = MethodSpec.methodBuilder("validate")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .addJavadoc("Validate entity against the column constraints.\n")
            .addJavadoc("@param entity the entity to validate\n")
            .addJavadoc("@throws $L if any validations fail\n", VALIDATION_EXCEPTION)
            .addParameter(t.entity(), "entity")
            .addStatement("$T errors = new $T<>()", listOfFieldError, ArrayList.class);

        for (PlainField f : t.fields) {
            if (f.managed) continue;
            ColumnMetadata c = f.column;
            String getter = "get" + cap(f.codeName);

            if (!c.nullable() && !f.generatedKey) {
                validateMethod.beginControlFlow("if (entity.$L() == null)", getter)
                    .addStatement("errors.add(new $T($S, $S, $S))",
                        fieldErrorClass, c.name(), "required", "is required but was null")
                    .endControlFlow();
            }

            if (c.maxLength() != null && f.type.equals(STRING)) {
                validateMethod.beginControlFlow("if (entity.$L() != null && entity.$L().length() > $L)",
                        getter, getter, c.maxLength())
                    .addStatement("errors.add(new $T($S, $S, $S + entity.$L().length()))",
                        fieldErrorClass, c.name(), "maxLength",
                        "must have maximum length " + c.maxLength() + ", got ", getter)
                    .endControlFlow();
            }

            if (c.dataType().isNumeric()) {
                addNumberConstraintChecks(validateMethod, getter, c, fieldErrorClass);
            }

            if (c.hasEnumValues()) {
                String constant = toConstantCase(f.codeName) + "_VALUES";
                Set<String> distinct = new LinkedHashSet<>(c.enumValues());
                List<CodeBlock> items = distinct.stream().map(v -> CodeBlock.of("$S", v)).collect(Collectors.toList());
                tb.addField(FieldSpec.builder(setOfString, constant, Modifier.PRIVATE, Modifier.STATIC, Modifier.FINAL)
                    .initializer("$T.of($L)", Set.class, CodeBlock.join(items, ", "))
                    .build());
                validateMethod.beginControlFlow("if (entity.$L() != null && !$L.contains(entity.$L()))",
                        getter, constant, getter)
                    .addStatement("errors.add(new $T($S, $S, $S + entity.$L()))",
                        fieldErrorClass, c.name(), "enum", "must be one of " + distinct + ", got ", getter)
                    .endControlFlow();
            }
        }

        validateMethod
            .addComment("$L", PreservationMerger.beginTag("custom-rules"))
            .addComment("Add custom checks here, appending to errors.")
            .addComment("$L", PreservationMerger.endTag("custom-rules"))
            .beginControlFlow("if (!errors.isEmpty())")
            .addStatement("throw new $T($S, errors)", t.exception(), t.entityName)
            .endControlFlow();

        tb.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PRIVATE)
            .build());

        tb.addMethod(validateMethod.build());

        return file(t.pkg + ".validation", tb.build(), null, null);
    }

    /**
     * Add numeric range checks (min, max).
     * {@code decimal} columns use {@code compareTo()} instead of primitive operators.
     */
    private void addNumberConstraintChecks(MethodSpec.Builder method, String getterName,
            ColumnMetadata c, ClassName fieldErrorClass) {
        if (c.min() == null && c.max() == null) return;
        boolean isDecimal = c.dataType() == DataType.DECIMAL;

        method.beginControlFlow("if (entity.$L() != null)", getterName);

        if (c.min() != null) {
            if (isDecimal) {
                method.beginControlFlow("if (entity.$L().compareTo($T.valueOf($L)) < 0)",
                        getterName, BigDecimal.class, c.min());
            } else {
                method.beginControlFlow("if (entity.$L() < $L)", getterName, c.min());
            }
            method.addStatement("errors.add(new $T($S, $S, $S + entity.$L()))",
                    fieldErrorClass, c.name(), "min", "must be >= " + formatBound(c.min()) + ", got ", getterName)
                .endControlFlow();
        }

        if (c.max() != null) {
            if (isDecimal) {
                method.beginControlFlow("if (entity.$L().compareTo($T.valueOf($L)) > 0)",
                        getterName, BigDecimal.class, c.max());
            } else {
                method.beginControlFlow("if (entity.$L() > $L)", getterName, c.max());
            }
            method.addStatement("errors.add(new $T($S, $S, $S + entity.$L()))",
                    fieldErrorClass, c.name(), "max", "must be <= " + formatBound(c.max()) + ", got ", getterName)
                .endControlFlow();
        }

        method.endControlFlow();
    }

    private static String formatBound(double bound) {
        return bound == Math.rint(bound) && !Double.isInfinite(bound)
            ? String.valueOf((long) bound)
            : String.valueOf(bound);
    }

    // =========================================================================
    // Plain-Java Boilerplate Helpers
    // =========================================================================

    private static void addConstructors(TypeSpec.Builder tb, List<PlainField> fields) {
        tb.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PUBLIC)
            .build());

        MethodSpec.Builder allArgs = MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc("All-args constructor.\n");
        for (PlainField f : fields) {
            allArgs.addParameter(f.type, f.codeName);
        }
        for (PlainField f : fields) {
            allArgs.addStatement("this.$L = $L", f.codeName, f.codeName);
        }
        tb.addMethod(allArgs.build());
    }

    private static void addSetters(TypeSpec.Builder tb, List<PlainField> fields) {
        for (PlainField f : fields) {
            tb.addMethod(MethodSpec.methodBuilder("set" + cap(f.codeName))
                .addModifiers(Modifier.PUBLIC)
                .addParameter(f.type, f.codeName)
                .addStatement("this.$L = $L", f.codeName, f.codeName)
                .build());
        }
    }

    /**
     * Emit a static {@code Builder} inner class and a {@code builder()} factory method.
     */
    private static void addBuilderClass(TypeSpec.Builder tb, String className, List<PlainField> fields) {
        ClassName builderRef = ClassName.bestGuess("Builder");
        ClassName entityRef = ClassName.bestGuess(className);

        tb.addMethod(MethodSpec.methodBuilder("builder")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .returns(builderRef)
            .addStatement("return new Builder()")
            .build());

        TypeSpec.Builder builderTb = TypeSpec.classBuilder("Builder")
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC);

        for (PlainField f : fields) {
            builderTb.addField(FieldSpec.builder(f.type, f.codeName, Modifier.PRIVATE).build());
        }

        for (PlainField f : fields) {
            builderTb.addMethod(MethodSpec.methodBuilder(f.codeName)
                .addModifiers(Modifier.PUBLIC)
                .addParameter(f.type, f.codeName)
                .returns(builderRef)
                .addStatement("this.$L = $L", f.codeName, f.codeName)
                .addStatement("return this")
                .build());
        }

        String argList = fields.stream().map(f -> f.codeName).collect(Collectors.joining(", "));
        builderTb.addMethod(MethodSpec.methodBuilder("build")
            .addModifiers(Modifier.PUBLIC)
            .returns(entityRef)
            .addStatement("return new $T($L)", entityRef, argList)
            .build());

        tb.addType(builderTb.build());
    }

    private static void addEqualsHashCodeToString(TypeSpec.Builder tb, String className, List<PlainField> fields) {
        ClassName objectsClass = ClassName.get("java.util", "Objects");
        ClassName entityRef = ClassName.bestGuess(className);

        MethodSpec.Builder equalsMethod = MethodSpec.methodBuilder("equals")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(boolean.class)
            .addParameter(ClassName.get(Object.class), "o");
        equalsMethod.addStatement("if (this == o) return true");
        equalsMethod.addStatement("if (!(o instanceof $T)) return false", entityRef);
        equalsMethod.addStatement("$T that = ($T) o", entityRef, entityRef);
        StringBuilder condExpr = new StringBuilder("return ");
        List<Object> condArgs = new ArrayList<>();
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) condExpr.append("\n    && ");
            condExpr.append("$T.equals($L, that.$L)");
            condArgs.add(objectsClass);
            condArgs.add(fields.get(i).codeName);
            condArgs.add(fields.get(i).codeName);
        }
        equalsMethod.addStatement(condExpr.toString(), condArgs.toArray());
        tb.addMethod(equalsMethod.build());

        String hashArgs = fields.stream().map(f -> f.codeName).collect(Collectors.joining(", "));
        tb.addMethod(MethodSpec.methodBuilder("hashCode")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(int.class)
            .addStatement("return $T.hash($L)", objectsClass, hashArgs)
            .build());

        StringBuilder tsExpr = new StringBuilder("return $S");
        List<Object> tsArgs = new ArrayList<>();
        tsArgs.add(className + "{" + fields.get(0).codeName + "=");
        tsExpr.append(" + $L");
        tsArgs.add(fields.get(0).codeName);
        for (int i = 1; i < fields.size(); i++) {
            tsExpr.append(" + $S + $L");
            tsArgs.add(", " + fields.get(i).codeName + "=");
            tsArgs.add(fields.get(i).codeName);
        }
        tsExpr.append(" + $S");
        tsArgs.add("}");
        tb.addMethod(MethodSpec.methodBuilder("toString")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(ClassName.get(String.class))
            .addStatement(tsExpr.toString(), tsArgs.toArray())
            .build());
    }

    // =========================================================================
    // Output
    // =========================================================================

    /**
     * Render a type and, when {@code blockId} is given, append a class-level preserved block
     * just before the closing brace of the top-level type.
     */
    private static GeneratedFile file(String pkg, TypeSpec type, String blockId, String hint) {
        String text = JavaFile.builder(pkg, type)
            .skipJavaLangImports(true)
            .build()
            .toString();
        if (blockId != null) {
            int close = text.lastIndexOf('}');
            text = text.substring(0, close)
                + "\n"
                + "  " + PreservationMerger.beginMarker(blockId) + "\n"
                + "  // " + hint + "\n"
                + "  " + PreservationMerger.endMarker(blockId) + "\n"
                + text.substring(close);
        }
        return new GeneratedFile(pkg.replace('.', '/') + "/" + type.name + ".java", text);
    }

    // =========================================================================
    // Utility Methods
    // =========================================================================

    /**
     * Convert a camelCase string to UPPER_SNAKE_CASE for constant names.
     */
    static String toConstantCase(String name) {
        if (name == null || name.isEmpty()) return name;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c) && i > 0 && Character.isLowerCase(name.charAt(i - 1))) {
                sb.append('_');
            }
            sb.append(c);
        }
        return sb.toString().toUpperCase(Locale.ROOT);
    }

    private static String cap(String s) {
        if (s == null || s.isEmpty()) return s;
        return s.substring(0, 1).toUpperCase() + s.substring(1);
    }
}

package io.tablegen.generators.java;

import io.tablegen.core.model.DataType;
import io.tablegen.core.model.TableMetadata;
import io.tablegen.core.query.SqlDialects;
import io.tablegen.core.security.InvalidIdentifierException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static io.tablegen.generators.java.TestTables.column;
import static io.tablegen.generators.java.TestTables.literal;
import static org.assertj.core.api.Assertions.*;

public class JavaGeneratorTest {

  private JavaGenerator generator;
  private Map<String, String> orders;

  @BeforeEach
  void setUp() {
    generator = new JavaGenerator();
    orders = byPath(generator.generate(TestTables.orders(), "com.example.shop", SqlDialects.POSTGRES));
  }

  private static Map<String, String> byPath(List<GeneratedFile> files) {
    return files.stream().collect(Collectors.toMap(GeneratedFile::relativePath, GeneratedFile::content));
  }

  @Test
  void generatesFiveFilesInFixedOrder() {
    List<GeneratedFile> files = generator.generate(TestTables.orders(), "com.example.shop", SqlDialects.POSTGRES);

    assertThat(files).extracting(GeneratedFile::relativePath).containsExactly(
        "com/example/shop/Order.java",
        "com/example/shop/query/OrderQueries.java",
        "com/example/shop/repository/OrderRepository.java",
        "com/example/shop/validation/TableValidationException.java",
        "com/example/shop/validation/OrderValidator.java");
  }

  @Test
  void everyFileCarriesAPreservedBlock() {
    for (String content : orders.values()) {
      assertThat(content).containsPattern("// <generator-preserve [a-z-]+>");
      assertThat(content).containsPattern("// </generator-preserve [a-z-]+>");
    }
  }

  @Test
  void generationIsDeterministic() {
    Map<String, String> again = byPath(generator.generate(TestTables.orders(), "com.example.shop", SqlDialects.POSTGRES));

    assertThat(again).isEqualTo(orders);
  }

  @Test
  void generatesEntityWithMappedTypes() {
    String content = orders.get("com/example/shop/Order.java");

    assertThat(content).contains("package com.example.shop;");
    assertThat(content).contains("public class Order {");
    assertThat(content).contains("private Long id;");
    assertThat(content).contains("private UUID customerId;");
    assertThat(content).contains("private String status;");
    assertThat(content).contains("private BigDecimal total;");
    assertThat(content).contains("private Instant createdAt;");
    assertThat(content).contains("Order number");
    assertThat(content).contains("Primary key, column {@code id}.");
    assertThat(content).contains("Column {@code customer_id}.");

    assertThat(content).contains("public Order()");
    assertThat(content).contains("public UUID getCustomerId()");
    assertThat(content).contains("public void setCustomerId(UUID customerId)");
    assertThat(content).contains("public static Builder builder()");
    assertThat(content).contains("public Order build()");
    assertThat(content).contains("public boolean equals(Object o)");
    assertThat(content).contains("public int hashCode()");
    assertThat(content).contains("public String toString()");
  }

  @Test
  void entityMapsRowsByColumnName() {
    String content = orders.get("com/example/shop/Order.java");

    assertThat(content).contains("public static Order fromRow(Map<String, Object> row)");
    assertThat(content).contains("entity.id = RowValues.asLong(row.get(\"id\"));");
    assertThat(content).contains("entity.customerId = RowValues.asUuid(row.get(\"customer_id\"));");
    assertThat(content).contains("entity.total = RowValues.asBigDecimal(row.get(\"total\"));");
    assertThat(content).contains("entity.deletedAt = RowValues.asInstant(row.get(\"deleted_at\"));");
  }

  @Test
  void generatesQueriesWithQuotedIdentifiersAndPlaceholders() {
    String content = orders.get("com/example/shop/query/OrderQueries.java");

    assertThat(content).contains("package com.example.shop.query;");
    assertThat(content).contains("public final class OrderQueries");
    assertThat(content).contains("private OrderQueries()");
    assertThat(content).contains("TABLE = \"" + literal("\"public\".\"orders\"") + "\"");
    assertThat(content).contains(
        "FILTERABLE_COLUMNS = List.of(\"id\", \"customer_id\", \"status\", \"total\")");
    assertThat(content).contains(literal(
        "SELECT \"id\", \"customer_id\", \"status\", \"total\", \"note\", \"created_at\", \"updated_at\", \"deleted_at\""
            + " FROM \"public\".\"orders\" WHERE \"deleted_at\" IS NULL"));
    assertThat(content).contains(literal(
        "SELECT COUNT(*) AS \"count\" FROM \"public\".\"orders\" WHERE \"deleted_at\" IS NULL"));
  }

  @Test
  void queriesCarryFilterMetadata() {
    String content = orders.get("com/example/shop/query/OrderQueries.java");

    assertThat(content).contains("public static final TableMetadata METADATA = new TableMetadata(\"public\", \"orders\"");
    assertThat(content).contains("import io.tablegen.core.model.ColumnMetadata;");
    assertThat(content).contains(
        "new ColumnMetadata(\"status\", DataType.ENUM, false, false, false, true, false, null, null, null,"
            + " List.of(\"pending\", \"paid\", \"shipped\"), null)");
    assertThat(content).contains(
        "new ColumnMetadata(\"total\", DataType.DECIMAL, false, false, false, true, false, null, 0.0, null, null, null)");
    assertThat(content).contains("\"id\", null, true, true)");
    // descriptions stay in the entity javadoc only
    assertThat(content).doesNotContain("Order number");
  }

  @Test
  void insertSkipsGeneratedKeyAndStampsTimestamps() {
    String content = orders.get("com/example/shop/query/OrderQueries.java");

    assertThat(content).contains(literal(
        "INSERT INTO \"public\".\"orders\" (\"customer_id\", \"status\", \"total\", \"note\", \"created_at\", \"updated_at\")"
            + " VALUES ($1, $2, $3, $4, NOW(), NOW())"));
  }

  @Test
  void softDeleteHidesRowsAndStampsDeletedAt() {
    String content = orders.get("com/example/shop/query/OrderQueries.java");

    assertThat(content).contains(literal("WHERE \"deleted_at\" IS NULL AND \"id\" = $1"));
    assertThat(content).contains(literal(
        "UPDATE \"public\".\"orders\" SET \"customer_id\" = $1, \"status\" = $2, \"total\" = $3, \"note\" = $4,"
            + " \"updated_at\" = NOW() WHERE \"id\" = $5 AND \"deleted_at\" IS NULL"));
    assertThat(content).contains(literal(
        "UPDATE \"public\".\"orders\" SET \"deleted_at\" = NOW() WHERE \"id\" = $1 AND \"deleted_at\" IS NULL"));
    assertThat(content).doesNotContain("DELETE FROM");
  }

  @Test
  void hardDeleteWithoutSoftDeleteFlag() {
    Map<String, String> files = byPath(generator.generate(TestTables.users(), "com.example.app", SqlDialects.POSTGRES));
    String content = files.get("com/example/app/query/UserQueries.java");

    assertThat(content).contains(literal("DELETE FROM \"app\".\"users\" WHERE \"id\" = $1"));
    assertThat(content).contains(literal(
        "INSERT INTO \"app\".\"users\" (\"id\", \"email\", \"age\", \"active\") VALUES ($1, $2, $3, $4)"));
    assertThat(content).contains(literal(
        "UPDATE \"app\".\"users\" SET \"email\" = $1, \"age\" = $2, \"active\" = $3 WHERE \"id\" = $4"));
    assertThat(content).doesNotContain("IS NULL");
  }

  @Test
  void mysqlDialectUsesBackticksAndQuestionMarks() {
    Map<String, String> files = byPath(generator.generate(TestTables.users(), "com.example.app", SqlDialects.MYSQL));
    String queries = files.get("com/example/app/query/UserQueries.java");
    String repository = files.get("com/example/app/repository/UserRepository.java");

    assertThat(queries).contains("SELECT `id`, `email`, `age`, `active` FROM `app`.`users`");
    assertThat(queries).contains("DELETE FROM `app`.`users` WHERE `id` = ?");
    assertThat(queries).doesNotContain("$1");
    assertThat(repository).contains("new FilterQueryCompiler(SqlDialects.of(\"mysql\"))");
  }

  @Test
  void generatesRepositoryOverSqlExecutor() {
    String content = orders.get("com/example/shop/repository/OrderRepository.java");

    assertThat(content).contains("package com.example.shop.repository;");
    assertThat(content).contains("public class OrderRepository");
    assertThat(content).contains("public OrderRepository(SqlExecutor executor)");
    assertThat(content).contains("this(executor, new FilterQueryCompiler(SqlDialects.of(\"postgres\")))");
    assertThat(content).contains("public OrderRepository(SqlExecutor executor, FilterQueryCompiler compiler)");
    assertThat(content).contains("public List<Order> findAll()");
    assertThat(content).contains("public List<Order> findAll(Map<String, ?> filter)");
    assertThat(content).contains("compiler.compile(OrderQueries.SELECT_ALL, filter, OrderQueries.METADATA)");
    assertThat(content).contains(
        "compiler.compile(OrderQueries.COUNT_ALL, FilterQueryCompiler.withoutControlKeys(filter), OrderQueries.METADATA)");
    assertThat(content).contains("public long count(Map<String, ?> filter)");
    assertThat(content).contains("FilterQueryCompiler.withoutControlKeys(filter)");
    assertThat(content).contains("public Optional<Order> findById(Long id)");
    assertThat(content).contains("public int delete(Long id)");
    assertThat(content).contains("Soft delete: deleted rows are hidden from every read.");
  }

  @Test
  void repositoryValidatesBeforeWriting() {
    String content = orders.get("com/example/shop/repository/OrderRepository.java");

    assertThat(content).contains("public int create(Order entity)");
    assertThat(content).contains("OrderValidator.validate(entity);");
    assertThat(content).contains("executor.update(OrderQueries.INSERT, Arrays.<Object>asList("
        + "entity.getCustomerId(), entity.getStatus(), entity.getTotal(), entity.getNote()))");
    assertThat(content).contains("public int update(Order entity)");
    assertThat(content).contains("executor.update(OrderQueries.UPDATE, Arrays.<Object>asList("
        + "entity.getCustomerId(), entity.getStatus(), entity.getTotal(), entity.getNote(), entity.getId()))");
  }

  @Test
  void tableWithoutPrimaryKeyGetsReadOnlyRepository() {
    TableMetadata events = TableMetadata.of("audit", "events", List.of(
        column("kind", DataType.STRING, false, true),
        column("payload", DataType.JSON, true, false)));

    Map<String, String> files = byPath(generator.generate(events, "com.example.audit", SqlDialects.POSTGRES));
    String repository = files.get("com/example/audit/repository/EventRepository.java");
    String queries = files.get("com/example/audit/query/EventQueries.java");

    assertThat(repository).contains("No primary key; read-only access.");
    assertThat(repository).contains("public List<Event> findAll(Map<String, ?> filter)");
    assertThat(repository).doesNotContain("findById");
    assertThat(repository).doesNotContain("public int delete(");
    assertThat(queries).doesNotContain("FIND_BY_ID");
    assertThat(queries).doesNotContain("DELETE");
  }

  @Test
  void generatesValidatorFromColumnConstraints() {
    String content = orders.get("com/example/shop/validation/OrderValidator.java");

    assertThat(content).contains("public final class OrderValidator");
    assertThat(content).contains("public static void validate(Order entity)");
    assertThat(content).contains("Set<String> STATUS_VALUES = Set.of(\"pending\", \"paid\", \"shipped\")");
    assertThat(content).contains(
        "new TableValidationException.FieldError(\"customer_id\", \"required\", \"is required but was null\")");
    assertThat(content).contains("entity.getNote().length() > 200");
    assertThat(content).contains("entity.getTotal().compareTo(BigDecimal.valueOf(0.0)) < 0");
    assertThat(content).contains("\"must be >= 0, got \"");
    assertThat(content).contains("throw new TableValidationException(\"Order\", errors)");
  }

  @Test
  void validatorSkipsGeneratedKeyAndManagedColumns() {
    String content = orders.get("com/example/shop/validation/OrderValidator.java");

    assertThat(content).doesNotContain("FieldError(\"id\", \"required\"");
    assertThat(content).doesNotContain("getCreatedAt");
    assertThat(content).doesNotContain("getDeletedAt");
  }

  @Test
  void validatorKeepsCustomRulesBlockInsideValidate() {
    String content = orders.get("com/example/shop/validation/OrderValidator.java");

    int begin = content.indexOf("// <generator-preserve custom-rules>");
    int end = content.indexOf("// </generator-preserve custom-rules>");
    int thrown = content.indexOf("if (!errors.isEmpty())");
    assertThat(begin).isPositive();
    assertThat(end).isGreaterThan(begin);
    assertThat(thrown).isGreaterThan(end);
  }

  @Test
  void integerRangeChecksUsePlainComparison() {
    Map<String, String> files = byPath(generator.generate(TestTables.users(), "com.example.app", SqlDialects.POSTGRES));
    String content = files.get("com/example/app/validation/UserValidator.java");

    assertThat(content).contains("entity.getAge() < 0.0");
    assertThat(content).contains("entity.getAge() > 150.0");
    assertThat(content).contains("\"must be <= 150, got \"");
    assertThat(content).contains("entity.getEmail().length() > 120");
  }

  @Test
  void generatesSharedValidationException() {
    String content = orders.get("com/example/shop/validation/TableValidationException.java");

    assertThat(content).contains("public class TableValidationException extends RuntimeException");
    assertThat(content).contains("public static class FieldError");
    assertThat(content).contains("public List<FieldError> getErrors()");
    assertThat(content).contains("public String getEntityName()");
    assertThat(content).contains("// <generator-preserve custom-members>");
  }

  @Test
  void keywordColumnGetsValueSuffix() {
    TableMetadata t = TableMetadata.of("app", "settings", List.of(
        column("class", DataType.STRING, false, true),
        column("default", DataType.BOOLEAN, true, false)));

    String entity = byPath(generator.generate(t, "com.example.app", SqlDialects.POSTGRES))
        .get("com/example/app/Setting.java");

    assertThat(entity).contains("private String classValue;");
    assertThat(entity).contains("private Boolean defaultValue;");
    assertThat(entity).contains("public String getClassValue()");
  }

  @Test
  void collidingCodeNamesAreRejected() {
    TableMetadata t = TableMetadata.of("app", "things", List.of(
        column("user_id", DataType.STRING, false, true),
        column("userId", DataType.STRING, false, true)));

    assertThatThrownBy(() -> generator.generate(t, "com.example.app", SqlDialects.POSTGRES))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Name collision")
        .hasMessageContaining("userId");
  }

  @Test
  void rejectsInvalidPackage() {
    assertThatThrownBy(() -> generator.generate(TestTables.orders(), "com.example.1bad", SqlDialects.POSTGRES))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Invalid package name");
  }

  @Test
  void rejectsUnsafeIdentifiersBeforeGenerating() {
    TableMetadata t = TableMetadata.of("app", "users; DROP TABLE users", List.of(
        column("id", DataType.INTEGER, false, true)));

    assertThatThrownBy(() -> generator.generate(t, "com.example.app", SqlDialects.POSTGRES))
        .isInstanceOf(InvalidIdentifierException.class);
  }

  @ParameterizedTest
  @CsvSource({
      "orders, Order",
      "line_items, LineItem",
      "categories, Category",
      "addresses, Address",
      "boxes, Box",
      "status, Status",
      "person, Person",
      "USER_ACCOUNTS, UserAccount"
  })
  void derivesSingularEntityNames(String table, String expected) {
    assertThat(JavaGenerator.deriveEntityName(table)).isEqualTo(expected);
  }

  @ParameterizedTest
  @CsvSource({
      "customer_id, customerId",
      "USER_ID, userId",
      "SKU, sku",
      "createdAt, createdAt",
      "order-total, orderTotal",
      "2fa_code, _2faCode"
  })
  void convertsColumnNamesToCamelCase(String column, String expected) {
    assertThat(JavaGenerator.toJavaCamelCase(column)).isEqualTo(expected);
  }

  @ParameterizedTest
  @CsvSource({
      "customerId, CUSTOMER_ID",
      "status, STATUS",
      "classValue, CLASS_VALUE"
  })
  void convertsCodeNamesToConstantCase(String codeName, String expected) {
    assertThat(JavaGenerator.toConstantCase(codeName)).isEqualTo(expected);
  }
}

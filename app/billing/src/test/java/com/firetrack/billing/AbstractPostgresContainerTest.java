/*
 * どこで: Billing テスト基盤
 * 何を: billing スキーマを持つ共有 Postgres コンテナと DataSource/Flyway 設定を提供する
 * なぜ: jsonb・部分ユニークインデックス・CAS 更新を本番と同じ DB と migration で検証するため
 */
package com.firetrack.billing;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractPostgresContainerTest {

  protected static final String SCHEMA = "billing";

  // コンテキストキャッシュ越しに同じ接続先を使うため、@Container ではなく JVM で 1 つだけ起動する。
  static final PostgreSQLContainer<?> POSTGRES =
      new PostgreSQLContainer<>("postgres:16-alpine")
          .withDatabaseName("firetrack")
          .withUsername("billing")
          .withPassword("billing");

  static {
    POSTGRES.start();
  }

  @DynamicPropertySource
  static void registerProperties(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
    registry.add("spring.datasource.hikari.schema", () -> SCHEMA);
    // 並行 CAS テストが接続待ちで詰まらないよう、プールを少し広げる。
    registry.add("spring.datasource.hikari.maximum-pool-size", () -> "16");

    registry.add("spring.flyway.enabled", () -> "true");
    registry.add("spring.flyway.default-schema", () -> SCHEMA);
    registry.add("spring.flyway.schemas", () -> SCHEMA);
    registry.add("spring.flyway.create-schemas", () -> "true");
    registry.add("spring.flyway.table", () -> "flyway_schema_history_" + SCHEMA);
  }
}

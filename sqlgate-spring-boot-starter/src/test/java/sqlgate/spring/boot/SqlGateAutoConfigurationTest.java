package sqlgate.spring.boot;

import sqlgate.SqlGate;
import sqlgate.jdbc.DataSourceConnectionPool;
import sqlgate.jdbc.JdbcConnector;
import sqlgate.jdbc.JdbcStatementExecutor;
import sqlgate.jdbc.tx.JdbcTransactionControl;
import sqlgate.spi.ConnectionPool;
import sqlgate.spi.Connector;
import sqlgate.spi.StatementExecutor;
import sqlgate.spi.TransactionControl;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SqlGateAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlGateAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:sqlgate_auto_test;DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver");

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("connectionPool"));
      assertTrue(ctx.containsBean("connector"));
      assertTrue(ctx.containsBean("statementExecutor"));
      assertTrue(ctx.containsBean("transactionControl"));
      assertTrue(ctx.containsBean("sqlGate"));

      assertInstanceOf(DataSourceConnectionPool.class, ctx.getBean(ConnectionPool.class));
      assertInstanceOf(JdbcConnector.class, ctx.getBean(Connector.class));
      assertInstanceOf(JdbcStatementExecutor.class, ctx.getBean(StatementExecutor.class));
      assertInstanceOf(JdbcTransactionControl.class, ctx.getBean(TransactionControl.class));
    });
  }

  @Test
  void gateRunsAgainstDataSourcePool() {
    runner.run(ctx -> {
      SqlGate gate = ctx.getBean(SqlGate.class);
      ConnectionPool pool = ctx.getBean(ConnectionPool.class);

      List<Map<String, Object>> rows = gate.withTransaction(pool, conn ->
          gate.execute(conn, List.of("select 1 as one")));

      assertEquals(List.of(Map.of("one", 1)), rows);
    });
  }

  @Test
  void upperCaseLabelsWhenDisabled() {
    runner.withPropertyValues("sqlgate.lower-case-labels=false").run(ctx -> {
      SqlGate gate = ctx.getBean(SqlGate.class);
      ConnectionPool pool = ctx.getBean(ConnectionPool.class);

      Map<String, Object> row = gate.withConnection(pool, conn ->
          gate.executeOne(conn, List.of("select 1 as one")));

      assertTrue(row.containsKey("ONE"));
    });
  }

  @Test
  void bindsProperties() {
    runner.withPropertyValues(
        "sqlgate.url-template=jdbc:mysql://%s:%d/%s",
        "sqlgate.metrics.name-prefix=billing.sqlgate").run(ctx -> {
          SqlGateProperties props = ctx.getBean(SqlGateProperties.class);
          assertEquals("jdbc:mysql://%s:%d/%s", props.getUrlTemplate());
          assertEquals("billing.sqlgate", props.getMetrics().getNamePrefix());
          assertTrue(props.isLowerCaseLabels());
        });
  }

  @Test
  void backsOffWhenCustomBeansPresent() {
    runner.withUserConfiguration(CustomExecutorConfig.class).run(ctx -> {
      assertSame(CustomExecutorConfig.EXECUTOR, ctx.getBean(StatementExecutor.class));
      assertFalse(ctx.containsBean("statementExecutor"));
    });
  }

  @Test
  void skippedWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(SqlGateAutoConfiguration.class))
        .run(ctx -> assertFalse(ctx.containsBean("sqlGate")));
  }

  @Configuration
  static class CustomExecutorConfig {
    static final JdbcStatementExecutor EXECUTOR = new JdbcStatementExecutor(false);

    @Bean
    StatementExecutor customStatementExecutor() {
      return EXECUTOR;
    }
  }
}

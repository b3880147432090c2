package sqlgate.spring.boot;

import sqlgate.SqlGate;
import sqlgate.jdbc.DataSourceConnectionPool;
import sqlgate.jdbc.JdbcConnector;
import sqlgate.jdbc.JdbcStatementExecutor;
import sqlgate.jdbc.tx.JdbcTransactionControl;
import sqlgate.spi.ConnectionPool;
import sqlgate.spi.Connector;
import sqlgate.spi.MetricsExporter;
import sqlgate.spi.StatementExecutor;
import sqlgate.spi.TransactionControl;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for sqlgate.
 *
 * <p>Wires a {@link SqlGate} with the JDBC primitives and exposes the
 * application's {@link DataSource} as a {@link ConnectionPool} source.
 *
 * @see SqlGateProperties
 * @see SqlGateMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(SqlGate.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(SqlGateProperties.class)
public class SqlGateAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ConnectionPool.class)
  public DataSourceConnectionPool connectionPool(DataSource dataSource) {
    return new DataSourceConnectionPool(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(Connector.class)
  public JdbcConnector connector(SqlGateProperties props) {
    return new JdbcConnector(props.getUrlTemplate());
  }

  @Bean
  @ConditionalOnMissingBean(StatementExecutor.class)
  public JdbcStatementExecutor statementExecutor(SqlGateProperties props) {
    return new JdbcStatementExecutor(props.isLowerCaseLabels());
  }

  @Bean
  @ConditionalOnMissingBean(TransactionControl.class)
  public JdbcTransactionControl transactionControl() {
    return new JdbcTransactionControl();
  }

  @Bean
  @ConditionalOnMissingBean
  public SqlGate sqlGate(Connector connector,
      StatementExecutor statementExecutor,
      TransactionControl transactionControl,
      ObjectProvider<MetricsExporter> metricsProvider) {
    SqlGate.Builder builder = SqlGate.builder()
        .connector(connector)
        .statementExecutor(statementExecutor)
        .transactionControl(transactionControl);
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }
}

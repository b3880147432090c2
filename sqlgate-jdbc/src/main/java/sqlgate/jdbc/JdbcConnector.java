package sqlgate.jdbc;

import sqlgate.ConnectionConfig;
import sqlgate.spi.Connector;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * {@link Connector} that opens connections through {@link DriverManager}.
 *
 * <p>The URL is {@link ConnectionConfig#getJdbcUrl()} when set. Otherwise it
 * is built from a {@link String#format} template taking host, port and
 * database, {@value #DEFAULT_URL_TEMPLATE} by default. User, password and the
 * extra config properties are passed as driver properties.
 */
public final class JdbcConnector implements Connector {
  public static final String DEFAULT_URL_TEMPLATE = "jdbc:postgresql://%s:%d/%s";

  private final String urlTemplate;

  public JdbcConnector() {
    this(DEFAULT_URL_TEMPLATE);
  }

  public JdbcConnector(String urlTemplate) {
    this.urlTemplate = Objects.requireNonNull(urlTemplate, "urlTemplate");
  }

  @Override
  public Connection open(ConnectionConfig config) throws SQLException {
    Objects.requireNonNull(config, "config");
    return DriverManager.getConnection(urlFor(config), propertiesFor(config));
  }

  String urlFor(ConnectionConfig config) {
    if (config.getJdbcUrl() != null) {
      return config.getJdbcUrl();
    }
    String database = config.getDatabase() != null ? config.getDatabase() : "";
    return String.format(urlTemplate, config.getHost(), config.getPort(), database);
  }

  static Properties propertiesFor(ConnectionConfig config) {
    Properties props = new Properties();
    for (Map.Entry<String, String> entry : config.getProperties().entrySet()) {
      props.setProperty(entry.getKey(), entry.getValue());
    }
    if (config.getUser() != null) {
      props.setProperty("user", config.getUser());
    }
    if (config.getPassword() != null) {
      props.setProperty("password", config.getPassword());
    }
    return props;
  }
}

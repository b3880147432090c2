package sqlgate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Parameters for opening a new connection.
 *
 * <p>Either {@link #getJdbcUrl() jdbcUrl} is set, or the URL is derived by the
 * connector from host, port and database. Any extra entries in
 * {@link #getProperties()} are handed to the driver as-is.
 */
public final class ConnectionConfig {
  public static final String HOST = "host";
  public static final String PORT = "port";
  public static final String DATABASE = "database";
  public static final String USER = "user";
  public static final String PASSWORD = "password";
  public static final String JDBC_URL = "jdbc-url";

  private String host = "127.0.0.1";
  private int port = 5432;
  private String database;
  private String user;
  private String password;
  private String jdbcUrl;
  private final Map<String, String> properties = new LinkedHashMap<>();

  /**
   * Builds a config from a {@link ConnectionConfig} (returned as-is) or a map.
   *
   * <p>Map keys are read by their string form. {@code host}, {@code port},
   * {@code database}, {@code user}, {@code password} and {@code jdbc-url} fill
   * the matching fields; every other non-null entry becomes a driver property.
   *
   * @throws IllegalArgumentException if {@code port} is not a number
   */
  public static ConnectionConfig from(Object source) {
    Objects.requireNonNull(source, "source");
    if (source instanceof ConnectionConfig config) {
      return config;
    }
    if (!(source instanceof Map<?, ?> map)) {
      throw new UnsupportedSourceException(source);
    }
    ConnectionConfig config = new ConnectionConfig();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (entry.getKey() == null || entry.getValue() == null) {
        continue;
      }
      String key = entry.getKey().toString();
      Object value = entry.getValue();
      switch (key) {
        case HOST -> config.setHost(value.toString());
        case PORT -> config.setPort(toPort(value));
        case DATABASE -> config.setDatabase(value.toString());
        case USER -> config.setUser(value.toString());
        case PASSWORD -> config.setPassword(value.toString());
        case JDBC_URL -> config.setJdbcUrl(value.toString());
        default -> config.setProperty(key, value.toString());
      }
    }
    return config;
  }

  private static int toPort(Object value) {
    if (value instanceof Number n) {
      if (n.longValue() != n.intValue()) {
        throw new IllegalArgumentException("port out of range: " + value);
      }
      return n.intValue();
    }
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("port must be a number: " + value, e);
    }
  }

  public String getHost() {
    return host;
  }

  public ConnectionConfig setHost(String host) {
    this.host = host;
    return this;
  }

  public int getPort() {
    return port;
  }

  public ConnectionConfig setPort(int port) {
    this.port = port;
    return this;
  }

  public String getDatabase() {
    return database;
  }

  public ConnectionConfig setDatabase(String database) {
    this.database = database;
    return this;
  }

  public String getUser() {
    return user;
  }

  public ConnectionConfig setUser(String user) {
    this.user = user;
    return this;
  }

  public String getPassword() {
    return password;
  }

  public ConnectionConfig setPassword(String password) {
    this.password = password;
    return this;
  }

  public String getJdbcUrl() {
    return jdbcUrl;
  }

  public ConnectionConfig setJdbcUrl(String jdbcUrl) {
    this.jdbcUrl = jdbcUrl;
    return this;
  }

  public Map<String, String> getProperties() {
    return properties;
  }

  public ConnectionConfig setProperty(String name, String value) {
    properties.put(name, value);
    return this;
  }

  @Override
  public String toString() {
    // no password
    return "ConnectionConfig{host=" + host + ", port=" + port + ", database=" + database
        + ", user=" + user + ", jdbcUrl=" + jdbcUrl + "}";
  }
}

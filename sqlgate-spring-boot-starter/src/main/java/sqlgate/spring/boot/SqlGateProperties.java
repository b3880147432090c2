package sqlgate.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import sqlgate.jdbc.JdbcConnector;

/**
 * Configuration properties for sqlgate.
 *
 * @see SqlGateAutoConfiguration
 */
@ConfigurationProperties(prefix = "sqlgate")
public class SqlGateProperties {

  /**
   * Lower-case column labels in result rows.
   */
  private boolean lowerCaseLabels = true;

  /**
   * {@link String#format} template taking host, port and database, used when a
   * configuration source has no {@code jdbc-url}.
   */
  private String urlTemplate = JdbcConnector.DEFAULT_URL_TEMPLATE;

  private final Metrics metrics = new Metrics();

  public boolean isLowerCaseLabels() {
    return lowerCaseLabels;
  }

  public void setLowerCaseLabels(boolean lowerCaseLabels) {
    this.lowerCaseLabels = lowerCaseLabels;
  }

  public String getUrlTemplate() {
    return urlTemplate;
  }

  public void setUrlTemplate(String urlTemplate) {
    this.urlTemplate = urlTemplate;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "sqlgate";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}

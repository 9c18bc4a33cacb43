package org.budgetanalyzer.ratesync.config;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "rate-sync")
@Validated
public class RateSyncProperties {

  private static final String CURRENCY_CODE_PATTERN = "^[A-Z]{3}$";

  /** Currency every persisted rate is expressed against. */
  @NotBlank
  @Pattern(regexp = CURRENCY_CODE_PATTERN)
  private String referenceCurrency = "USD";

  /** Base currency used by queries that don't specify one. */
  @NotBlank
  @Pattern(regexp = CURRENCY_CODE_PATTERN)
  private String defaultQueryBase = "USD";

  /**
   * Provider ids in priority order. The first provider serving a currency code wins when several
   * providers publish the same code for the same date.
   */
  @NotEmpty private List<String> providerPriority = new ArrayList<>(List.of("ecb", "nbu"));

  /** Version reported by the health endpoint. */
  private String version = "1.0.0";

  @Valid private Api api = new Api();
  @Valid private Sync sync = new Sync();
  @Valid private Bootstrap bootstrap = new Bootstrap();
  @Valid private Providers providers = new Providers();

  public String getReferenceCurrency() {
    return referenceCurrency;
  }

  public void setReferenceCurrency(String referenceCurrency) {
    this.referenceCurrency = referenceCurrency;
  }

  public String getDefaultQueryBase() {
    return defaultQueryBase;
  }

  public void setDefaultQueryBase(String defaultQueryBase) {
    this.defaultQueryBase = defaultQueryBase;
  }

  public List<String> getProviderPriority() {
    return providerPriority;
  }

  public void setProviderPriority(List<String> providerPriority) {
    this.providerPriority = providerPriority;
  }

  public String getVersion() {
    return version;
  }

  public void setVersion(String version) {
    this.version = version;
  }

  public Api getApi() {
    return api;
  }

  public void setApi(Api api) {
    this.api = api;
  }

  public Sync getSync() {
    return sync;
  }

  public void setSync(Sync sync) {
    this.sync = sync;
  }

  public Bootstrap getBootstrap() {
    return bootstrap;
  }

  public void setBootstrap(Bootstrap bootstrap) {
    this.bootstrap = bootstrap;
  }

  public Providers getProviders() {
    return providers;
  }

  public void setProviders(Providers providers) {
    this.providers = providers;
  }

  /**
   * NBU quotes every currency against UAH, so the reference currency has to be one of the fetched
   * codes for any of its snapshots to normalize.
   *
   * @return true when NBU is disabled or its currency list contains the reference currency
   */
  @AssertTrue(message = "rate-sync.providers.nbu.currencies must include the reference currency")
  public boolean isNbuCurrenciesIncludeReference() {
    var nbu = providers.getNbu();
    if (!nbu.isEnabled() || referenceCurrency == null || nbu.getCurrencies() == null) {
      return true;
    }
    return nbu.getCurrencies().stream().anyMatch(referenceCurrency::equalsIgnoreCase);
  }

  public static class Api {

    /** Number of decimals rates are rounded to in API responses. */
    @Min(0)
    @Max(12)
    private int displayScale = 6;

    public int getDisplayScale() {
      return displayScale;
    }

    public void setDisplayScale(int displayScale) {
      this.displayScale = displayScale;
    }
  }

  public static class Sync {

    /** Cron expression for the scheduled sync of all providers. */
    private String cron = "0 0 16 * * *";

    /** Whether to sync all providers once the application is ready. */
    private boolean syncOnStartup = true;

    /** Number of snapshot days written per store transaction. */
    @Min(1)
    @Max(366)
    private int upsertBatchDays = 31;

    @Valid private Retry retry = new Retry();

    public String getCron() {
      return cron;
    }

    public void setCron(String cron) {
      this.cron = cron;
    }

    public boolean isSyncOnStartup() {
      return syncOnStartup;
    }

    public void setSyncOnStartup(boolean syncOnStartup) {
      this.syncOnStartup = syncOnStartup;
    }

    public int getUpsertBatchDays() {
      return upsertBatchDays;
    }

    public void setUpsertBatchDays(int upsertBatchDays) {
      this.upsertBatchDays = upsertBatchDays;
    }

    public Retry getRetry() {
      return retry;
    }

    public void setRetry(Retry retry) {
      this.retry = retry;
    }
  }

  public static class Retry {
    /**
     * Maximum number of attempts for a failed scheduled provider sync, including the initial one.
     */
    @Min(1)
    @Max(10)
    private int maxAttempts = 3;

    /** Delay between retries in minutes. */
    @Min(1)
    @Max(60)
    private long delayMinutes = 5;

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public long getDelayMinutes() {
      return delayMinutes;
    }

    public void setDelayMinutes(long delayMinutes) {
      this.delayMinutes = delayMinutes;
    }
  }

  public static class Bootstrap {

    /** Whether bundled history is loaded on startup when the store is empty. */
    private boolean enabled = true;

    /** Bundled history location per provider id, as Spring resource locations. */
    private Map<String, String> bundles = new LinkedHashMap<>();

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Map<String, String> getBundles() {
      return bundles;
    }

    public void setBundles(Map<String, String> bundles) {
      this.bundles = bundles;
    }
  }

  public static class Providers {

    @Valid private Ecb ecb = new Ecb();
    @Valid private Nbu nbu = new Nbu();

    public Ecb getEcb() {
      return ecb;
    }

    public void setEcb(Ecb ecb) {
      this.ecb = ecb;
    }

    public Nbu getNbu() {
      return nbu;
    }

    public void setNbu(Nbu nbu) {
      this.nbu = nbu;
    }
  }

  public abstract static class ProviderClient {

    private boolean enabled = true;

    /** Timeout in seconds for a single provider request. */
    @Min(1)
    @Max(600)
    private int timeoutSeconds = 60;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getTimeoutSeconds() {
      return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
      this.timeoutSeconds = timeoutSeconds;
    }
  }

  public static class Ecb extends ProviderClient {

    /** Base URL of the ECB euro foreign exchange reference rate files. */
    @NotBlank private String baseUrl = "https://www.ecb.europa.eu/stats/eurofxref";

    /** Ranges starting within this many days are served from the short history file. */
    @Min(1)
    @Max(90)
    private int recentWindowDays = 90;

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public int getRecentWindowDays() {
      return recentWindowDays;
    }

    public void setRecentWindowDays(int recentWindowDays) {
      this.recentWindowDays = recentWindowDays;
    }
  }

  public static class Nbu extends ProviderClient {

    /** Base URL of the National Bank of Ukraine site. */
    @NotBlank private String baseUrl = "https://bank.gov.ua";

    /** Currency codes fetched from the NBU batch endpoint, one request per code. */
    @NotEmpty
    private List<String> currencies =
        new ArrayList<>(List.of("USD", "KZT", "LBP", "MDL", "SAR", "VND", "EGP", "GEL"));

    /** First date requested on a full history fetch. */
    @NotNull private LocalDate historyStart = LocalDate.of(1999, 1, 4);

    /** Pause between consecutive per-currency requests. */
    @Min(0)
    @Max(10_000)
    private long requestDelayMillis = 50;

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public List<String> getCurrencies() {
      return currencies;
    }

    public void setCurrencies(List<String> currencies) {
      this.currencies = currencies;
    }

    public LocalDate getHistoryStart() {
      return historyStart;
    }

    public void setHistoryStart(LocalDate historyStart) {
      this.historyStart = historyStart;
    }

    public long getRequestDelayMillis() {
      return requestDelayMillis;
    }

    public void setRequestDelayMillis(long requestDelayMillis) {
      this.requestDelayMillis = requestDelayMillis;
    }
  }
}

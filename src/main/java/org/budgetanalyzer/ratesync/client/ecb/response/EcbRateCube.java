package org.budgetanalyzer.ratesync.client.ecb.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

/** Units of {@code currency} per one euro. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EcbRateCube {

  @JacksonXmlProperty(isAttribute = true)
  private String currency;

  @JacksonXmlProperty(isAttribute = true)
  private String rate;

  public String getCurrency() {
    return currency;
  }

  public void setCurrency(String currency) {
    this.currency = currency;
  }

  public String getRate() {
    return rate;
  }

  public void setRate(String rate) {
    this.rate = rate;
  }
}

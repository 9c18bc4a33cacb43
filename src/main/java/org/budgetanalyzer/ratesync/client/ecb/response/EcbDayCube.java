package org.budgetanalyzer.ratesync.client.ecb.response;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class EcbDayCube {

  /** Publication date, ISO format. */
  @JacksonXmlProperty(isAttribute = true)
  private String time;

  @JacksonXmlElementWrapper(useWrapping = false)
  @JacksonXmlProperty(localName = "Cube")
  private List<EcbRateCube> rates = new ArrayList<>();

  public String getTime() {
    return time;
  }

  public void setTime(String time) {
    this.time = time;
  }

  public List<EcbRateCube> getRates() {
    return rates;
  }

  public void setRates(List<EcbRateCube> rates) {
    this.rates = rates;
  }
}

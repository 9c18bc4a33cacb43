package org.budgetanalyzer.ratesync.client.ecb.response;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

/** Outer cube holding one cube per publication day, newest first. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EcbCube {

  @JacksonXmlElementWrapper(useWrapping = false)
  @JacksonXmlProperty(localName = "Cube")
  private List<EcbDayCube> days = new ArrayList<>();

  public List<EcbDayCube> getDays() {
    return days;
  }

  public void setDays(List<EcbDayCube> days) {
    this.days = days;
  }
}

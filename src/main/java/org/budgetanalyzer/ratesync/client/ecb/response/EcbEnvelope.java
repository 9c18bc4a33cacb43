package org.budgetanalyzer.ratesync.client.ecb.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

/**
 * Root of the ECB euro foreign exchange reference rates file.
 *
 * <pre>{@code
 * <gesmes:Envelope>
 *   <Cube>
 *     <Cube time="2025-11-27">
 *       <Cube currency="USD" rate="1.0586"/>
 * }</pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EcbEnvelope {

  @JacksonXmlProperty(localName = "Cube")
  private EcbCube cube;

  public EcbCube getCube() {
    return cube;
  }

  public void setCube(EcbCube cube) {
    this.cube = cube;
  }
}

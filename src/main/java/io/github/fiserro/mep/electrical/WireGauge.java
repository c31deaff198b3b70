package io.github.fiserro.mep.electrical;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Conductor sizes from 14 AWG to 1000 kcmil, smallest first, with the 75 °C copper ampacity in
 * conduit (NEC Table 310.16).
 */
@Getter
@Accessors(fluent = true)
public enum WireGauge {
  AWG_14("14", "AWG", 20),
  AWG_12("12", "AWG", 25),
  AWG_10("10", "AWG", 35),
  AWG_8("8", "AWG", 50),
  AWG_6("6", "AWG", 65),
  AWG_4("4", "AWG", 85),
  AWG_3("3", "AWG", 100),
  AWG_2("2", "AWG", 115),
  AWG_1("1", "AWG", 130),
  AWG_1_0("1/0", "AWG", 150),
  AWG_2_0("2/0", "AWG", 175),
  AWG_3_0("3/0", "AWG", 200),
  AWG_4_0("4/0", "AWG", 230),
  KCMIL_250("250", "kcmil", 255),
  KCMIL_300("300", "kcmil", 285),
  KCMIL_350("350", "kcmil", 310),
  KCMIL_400("400", "kcmil", 335),
  KCMIL_500("500", "kcmil", 380),
  KCMIL_600("600", "kcmil", 420),
  KCMIL_750("750", "kcmil", 475),
  KCMIL_1000("1000", "kcmil", 545),
  ;

  private final String size;
  private final String unit;
  private final int copperAmpacity;

  WireGauge(String size, String unit, int copperAmpacity) {
    this.size = size;
    this.unit = unit;
    this.copperAmpacity = copperAmpacity;
  }

  /** Label such as {@code "4/0 AWG"} or {@code "500 kcmil"}. */
  public String label() {
    return size + " " + unit;
  }
}

package org.redlist.maps.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Locale;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class FormatTest {

  @ParameterizedTest
  @CsvSource({
    "999,999,en",
    "1000,1k,en",
    "9999,9.9k,en",
    "245760,245k,en",
    "5.5e9,5.5G,en",
    "5.5e9,'5,5G',fr",
    "-1,-,en",
  })
  void testFormatStorage(Double number, String expected, Locale locale) {
    assertEquals(expected, Format.forLocale(locale).storage(number));
  }

  @ParameterizedTest
  @CsvSource({
    "1.25,1.2,en",
    "1.25,'1,2',fr",
    "3,3,en",
  })
  void testDecimal(double number, String expected, Locale locale) {
    assertEquals(expected, Format.forLocale(locale).decimal(number));
  }
}

package ca.gc.cra.sift.application.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sift.domain.table.Delimiter;
import org.junit.jupiter.api.Test;

class DelimiterSnifferTest {
  private final DelimiterSniffer sniffer = new DelimiterSniffer();

  @Test
  void consistentCommaWins() {
    assertEquals(Delimiter.COMMA, sniffer.choose("src_ip,dst_ip,label\n1.1.1.1,2.2.2.2,dos"));
  }

  @Test
  void tabAndPipeAreDetected() {
    assertEquals(Delimiter.TAB, sniffer.choose("a\tb\n1\t2\n3\t4"));
    assertEquals(new Delimiter.Single('|'), sniffer.choose("a|b\nc|d"));
  }

  @Test
  void quotedSeparatorsAreNotCounted() {
    assertEquals(Delimiter.COMMA, sniffer.choose("\"Smith, J\",1.1.1.1\n\"Doe, A\",2.2.2.2"));
  }

  @Test
  void inconsistentCountsSkipCandidate() {
    assertEquals(Delimiter.SEMICOLON, sniffer.choose("a,b;c\nd;e"));
  }

  @Test
  void fallbackPrefersTabThenSemicolonThenComma() {
    assertTrue(sniffer.detect("a  b\nc d e").isEmpty());
    assertEquals(Delimiter.WHITESPACE, sniffer.choose("a  b\nc d e"));
    assertEquals(Delimiter.TAB, sniffer.fallback("a\tb;c,d"));
    assertEquals(Delimiter.SEMICOLON, sniffer.fallback("a;b,c"));
    assertEquals(Delimiter.COMMA, sniffer.choose("a,b,c\nd"));
  }

  @Test
  void emptySampleFallsBackToWhitespace() {
    assertTrue(sniffer.detect("").isEmpty());
    assertEquals(Delimiter.WHITESPACE, sniffer.choose(""));
  }
}

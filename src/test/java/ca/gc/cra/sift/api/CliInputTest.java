package ca.gc.cra.sift.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"in=a.log", "--DRY-RUN", "-v", "workers=2"});

    assertArrayEquals(new String[] {"in=a.log", "workers=2"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void helpAliasesAreRecognised() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
  }

  @Test
  void emptyArgsHaveNoFlags() {
    CliInput input = CliInput.parse(null);

    assertTrue(input.flags().isEmpty());
    assertFalse(input.hasFlag(" "));
  }
}

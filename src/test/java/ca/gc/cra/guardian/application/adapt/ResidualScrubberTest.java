package ca.gc.cra.guardian.application.adapt;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ResidualScrubberTest {
  private final ResidualScrubber scrubber = new ResidualScrubber();

  @Test
  void replacesContactDetails() {
    String scrubbed = scrubber.scrub("Call 555-123-4567 or write to a@b.org, see www.example.com.", 0);

    assertEquals("Call [phone] or write to [email], see [link].", scrubbed);
    assertEquals(scrubbed, scrubber.scrub(scrubbed, 0));
  }

  @Test
  void replacesNumbersAboveCeiling() {
    assertEquals("About many stars and 12 planets and 999.5 moons",
        scrubber.scrub("About 1,500 stars and 12 planets and 999.5 moons", 1000));
  }

  @Test
  void zeroCeilingKeepsNumbers() {
    assertEquals("About 1,500 stars", scrubber.scrub("About 1,500 stars", 0));
  }

  @Test
  void longDottedAddressCollapsesToOnePlaceholder() {
    String text = "Write to a@b" + ".c".repeat(5000) + " today";

    assertEquals("Write to [email] today", scrubber.scrub(text, 100));
  }
}

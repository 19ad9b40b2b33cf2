package ca.gc.cra.guardian.application.adapt;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class LengthLimiterTest {
  private final LengthLimiter limiter = new LengthLimiter();

  @Test
  void textWithinBudgetIsUntouched() {
    assertEquals("Short and sweet.", limiter.limit("Short and sweet.", 3));
  }

  @Test
  void keepsWholeSentencesWhenTheyCoverTheBudget() {
    assertEquals("One two three. Four five six.",
        limiter.limit("One two three. Four five six. Seven eight nine.", 7));
  }

  @Test
  void cutsMidSentenceWithContinuationPrompt() {
    assertEquals("alpha beta gamma delta… Want to hear more?",
        limiter.limit("alpha beta gamma delta epsilon zeta eta theta iota kappa.", 8));
    assertEquals("One, two… Want to hear more?",
        limiter.limit("One, two, three, four, five, six, seven", 6));
  }

  @Test
  void budgetTooSmallForPromptCutsPlainly() {
    assertEquals("alpha beta gamma", limiter.limit("alpha beta gamma delta epsilon", 3));
  }
}

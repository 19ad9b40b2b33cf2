package ca.gc.cra.guardian.application.port;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Chooses one phrasing among several equivalent options (follow-up questions, educational redirects).
 *
 * <p>Randomization is isolated here so tests can pin it. {@link #DETERMINISTIC} derives the choice from the
 * seed text and always yields the same phrase for the same input.</p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface PhraseSelector {
  /**
   * Selects one option.
   *
   * @param options non-empty candidate phrases
   * @param seed text the choice may be derived from
   * @return one element of {@code options}
   */
  String select(List<String> options, String seed);

  /** Picks by seed hash; stable across runs. */
  PhraseSelector DETERMINISTIC = (options, seed) ->
      options.get(Math.floorMod(Objects.hashCode(seed), options.size()));

  /** Always picks the first option. */
  PhraseSelector FIRST = (options, seed) -> options.get(0);

  /**
   * Creates a selector drawing from {@code random}; the seed text is ignored.
   *
   * @param random source of randomness; pass a seeded instance for reproducible runs
   * @return random selector
   */
  static PhraseSelector random(Random random) {
    Objects.requireNonNull(random, "random");
    return (options, seed) -> options.get(random.nextInt(options.size()));
  }
}

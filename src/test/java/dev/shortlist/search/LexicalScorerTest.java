package dev.shortlist.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import dev.shortlist.fixture.PassageBuilder;
import org.junit.jupiter.api.Test;

class LexicalScorerTest {

  private static final Corpus CORPUS =
      Corpus.of(
          "docs",
          PassageBuilder.passages(
              "Reciprocal rank fusion merges lexical and semantic rankings",
              "The weather today is sunny with a light wind",
              "Cross encoders rerank a shortlist of passages",
              "Rank fusion with reciprocal ranks is robust to score scales",
              "Bananas are rich in potassium"));

  private final LexicalScorer scorer = new LexicalScorer(CORPUS);

  @Test
  void passagesContainingQueryTermsRankStrictlyAboveUnrelatedOnes() {
    ScoreVector scores = scorer.score("reciprocal rank fusion");

    assertThat(scores.size()).isEqualTo(5);
    double weakestMatch = Math.min(scores.get(0), scores.get(3));
    assertThat(weakestMatch).isGreaterThan(0.0);
    assertThat(scores.get(1)).isZero();
    assertThat(scores.get(2)).isZero();
    assertThat(scores.get(4)).isZero();
    assertThat(scores.top(2)).extracting(ScoredIndex::index).containsExactlyInAnyOrder(0, 3);
  }

  @Test
  void emptyQueryYieldsZeroVectorOfCorpusSize() {
    ScoreVector scores = scorer.score("");

    assertThat(scores.size()).isEqualTo(5);
    assertThat(scores.isAllZero()).isTrue();
  }

  @Test
  void punctuationOnlyQueryYieldsZeroVector() {
    assertThat(scorer.score("  ?!, ").isAllZero()).isTrue();
  }

  @Test
  void queryTermsAbsentFromCorpusScoreZero() {
    assertThat(scorer.score("quantum chromodynamics").isAllZero()).isTrue();
  }

  @Test
  void matchingIgnoresCaseAndPunctuation() {
    assertThat(scorer.score("RECIPROCAL, Rank!")).isEqualTo(scorer.score("reciprocal rank"));
  }

  @Test
  void singleTermScoreMatchesBm25Formula() {
    LexicalScorer small =
        new LexicalScorer(Corpus.of("small", PassageBuilder.passages("a b", "c d")));

    // N=2, df=1: idf = ln(1 + 1.5 / 1.5); tf=1 and length equals the average, so the tf part is 1
    ScoreVector scores = small.score("a");

    assertThat(scores.get(0)).isCloseTo(Math.log(2.0), within(1e-12));
    assertThat(scores.get(1)).isZero();
  }

  @Test
  void shorterPassageWinsForSameTermFrequency() {
    LexicalScorer small =
        new LexicalScorer(
            Corpus.of("small", PassageBuilder.passages("apple", "apple banana cherry date")));

    ScoreVector scores = small.score("apple");

    assertThat(scores.get(0)).isGreaterThan(scores.get(1));
  }

  @Test
  void rareTermsWeighMoreThanCommonTerms() {
    LexicalScorer small =
        new LexicalScorer(
            Corpus.of("small", PassageBuilder.passages("common rare", "common", "common")));

    assertThat(small.score("rare").get(0)).isGreaterThan(small.score("common").get(0));
  }

  @Test
  void termPresentInEveryPassageStillScoresPositive() {
    LexicalScorer small =
        new LexicalScorer(Corpus.of("small", PassageBuilder.passages("shared", "shared")));

    assertThat(small.score("shared").get(0)).isPositive();
  }

  @Test
  void bZeroDisablesLengthNormalisation() {
    LexicalScorer noLengthNorm =
        new LexicalScorer(
            Corpus.of("small", PassageBuilder.passages("apple", "apple banana cherry date")),
            1.2,
            0.0);

    ScoreVector scores = noLengthNorm.score("apple");

    assertThat(scores.get(0)).isEqualTo(scores.get(1));
  }

  @Test
  void corpusOfEmptyPassagesScoresZero() {
    LexicalScorer blank = new LexicalScorer(Corpus.of("blank", PassageBuilder.passages("", "")));

    assertThat(blank.score("anything").isAllZero()).isTrue();
  }

  @Test
  void rejectsNegativeK1() {
    assertThatThrownBy(() -> new LexicalScorer(CORPUS, -0.1, 0.75))
        .isInstanceOf(InvalidConfigException.class)
        .hasMessageContaining("k1");
  }

  @Test
  void rejectsBOutsideUnitInterval() {
    assertThatThrownBy(() -> new LexicalScorer(CORPUS, 1.2, 1.5))
        .isInstanceOf(InvalidConfigException.class)
        .hasMessageContaining("b must be in");
  }
}

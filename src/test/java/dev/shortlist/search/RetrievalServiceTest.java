package dev.shortlist.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;

import dev.langchain4j.model.scoring.ScoringModel;
import dev.shortlist.corpus.DocumentStore;
import dev.shortlist.fixture.PassageBuilder;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RetrievalServiceTest {

  @Mock DocumentStore documentStore;

  @Mock ScoringModel scoringModel;

  private final ExecutorService executor = Executors.newSingleThreadExecutor();
  private RetrievalProperties properties;
  private RetrievalService retrievalService;

  @BeforeEach
  void setUp() {
    properties = new RetrievalProperties();
    retrievalService = new RetrievalService(documentStore, scoringModel, executor, properties);
  }

  @AfterEach
  void shutDown() {
    executor.shutdownNow();
  }

  @Test
  void opensSessionWithConfiguredParameters() {
    properties.setAlpha(0.25);
    properties.setRrfK(30);
    properties.setFusionTopK(7);
    properties.setRerankEnabled(false);
    given(documentStore.passages("docs")).willReturn(PassageBuilder.passages("a", "b", "c"));

    RetrievalPipeline pipeline = retrievalService.open("docs");

    RetrievalSession session = pipeline.session();
    assertThat(session.corpus().corpusId()).isEqualTo("docs");
    assertThat(session.corpus().size()).isEqualTo(3);
    assertThat(session.fusionConfig()).isEqualTo(new FusionConfig(0.25, 30, 7));
    assertThat(session.rerankConfig().enabled()).isFalse();
  }

  @Test
  void shortlistMultiplierIsApplied() {
    properties.setShortlistMultiplier(4);
    given(documentStore.passages("docs")).willReturn(PassageBuilder.passages("a", "b"));

    RetrievalPipeline pipeline = retrievalService.open("docs");

    assertThat(pipeline.shortlistSize(5)).isEqualTo(20);
  }

  @Test
  void emptyCorpusCannotBeOpened() {
    given(documentStore.passages("empty")).willReturn(List.of());

    assertThatThrownBy(() -> retrievalService.open("empty"))
        .isInstanceOf(CorpusEmptyException.class)
        .hasMessageContaining("'empty'");
  }

  @Test
  void storeFailureIsSurfacedAsExternalServiceException() {
    given(documentStore.passages(anyString())).willThrow(new IllegalStateException("down"));

    assertThatThrownBy(() -> retrievalService.open("docs"))
        .isInstanceOf(ExternalServiceException.class)
        .hasMessageContaining("docs")
        .hasRootCauseMessage("down");
  }

  @Test
  void sessionsAreIndependentPerCorpus() {
    given(documentStore.passages("one")).willReturn(PassageBuilder.passages("alpha"));
    given(documentStore.passages("two")).willReturn(PassageBuilder.passages("beta", "gamma"));

    RetrievalPipeline one = retrievalService.open("one");
    RetrievalPipeline two = retrievalService.open("two");

    assertThat(one.session().corpus().size()).isEqualTo(1);
    assertThat(two.session().corpus().size()).isEqualTo(2);
  }
}

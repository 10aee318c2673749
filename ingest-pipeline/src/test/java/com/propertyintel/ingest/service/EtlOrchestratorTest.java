package com.propertyintel.ingest.service;

import com.propertyintel.ingest.config.IngestProperties;
import com.propertyintel.ingest.exception.ExtractionException;
import com.propertyintel.ingest.extract.ExtractionContext;
import com.propertyintel.ingest.extract.ExtractionDriver;
import com.propertyintel.ingest.extract.RunCounters;
import com.propertyintel.ingest.extract.SourceExtractor;
import com.propertyintel.ingest.model.ExtractionResult;
import com.propertyintel.ingest.model.OrchestrationSummary;
import com.propertyintel.ingest.model.RunStatus;
import com.propertyintel.ingest.model.SourceRunResult;
import com.propertyintel.ingest.model.SourceType;
import com.propertyintel.ingest.model.UnifiedRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EtlOrchestratorTest {

    @Mock
    private ExtractionDriver driver;

    private IngestProperties properties;
    private StubExtractor api;
    private StubExtractor file;
    private StubExtractor feed;
    private EtlOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = new IngestProperties();
        api = new StubExtractor(SourceType.API);
        file = new StubExtractor(SourceType.FILE);
        feed = new StubExtractor(SourceType.FEED);
        orchestrator = new EtlOrchestrator(driver, List.of(api, file, feed), properties);
    }

    @Test
    void sequentialRunKeepsGoingPastAFailure() {
        when(driver.run(api)).thenReturn(result(SourceType.API, RunStatus.SUCCESS, 4));
        when(driver.run(file)).thenThrow(new ExtractionException("disk on fire"));
        when(driver.run(feed)).thenReturn(result(SourceType.FEED, RunStatus.PARTIAL, 2));

        OrchestrationSummary summary = orchestrator.run(List.of(api, file, feed), false, false);

        assertThat(summary.sourcesProcessed()).isEqualTo(3);
        assertThat(summary.successful()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.hasFailures()).isTrue();
        assertThat(summary.results()).extracting(SourceRunResult::status)
                .containsExactly("success", "failed", "partial");
        SourceRunResult failed = summary.results().get(1);
        assertThat(failed.sourceType()).isEqualTo(SourceType.FILE);
        assertThat(failed.error()).isEqualTo("disk on fire");
        assertThat(failed.result()).isNull();
    }

    @Test
    void failOnErrorStopsAtFirstFailure() {
        when(driver.run(api)).thenThrow(new ExtractionException("boom"));

        assertThatThrownBy(() -> orchestrator.run(List.of(api, file), false, true))
                .isInstanceOf(ExtractionException.class)
                .hasMessage("boom");
        verify(driver, never()).run(file);
    }

    @Test
    void parallelRunReportsEverySource() {
        when(driver.run(api)).thenReturn(result(SourceType.API, RunStatus.SUCCESS, 1));
        when(driver.run(file)).thenReturn(result(SourceType.FILE, RunStatus.SUCCESS, 2));
        when(driver.run(feed)).thenThrow(new ExtractionException("feed down"));

        OrchestrationSummary summary = orchestrator.run(List.of(api, file, feed), true, false);

        assertThat(summary.results()).extracting(SourceRunResult::sourceType)
                .containsExactlyInAnyOrder(SourceType.API, SourceType.FILE, SourceType.FEED);
        assertThat(summary.successful()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(1);
    }

    @Test
    void parallelFailOnErrorRethrows() {
        when(driver.run(any())).thenThrow(new ExtractionException("all broken"));

        assertThatThrownBy(() -> orchestrator.run(List.of(api, file), true, true))
                .isInstanceOf(ExtractionException.class)
                .hasMessage("all broken");
    }

    @Test
    void emptyParallelRunIsEmpty() {
        OrchestrationSummary summary = orchestrator.run(List.of(), true, false);

        assertThat(summary.sourcesProcessed()).isZero();
        assertThat(summary.hasFailures()).isFalse();
    }

    @Test
    void disabledSourcesAreLeftOut() {
        properties.getFile().setEnabled(false);
        when(driver.run(any())).thenAnswer(inv ->
                result(((SourceExtractor) inv.getArgument(0)).sourceType(), RunStatus.SUCCESS, 0));

        OrchestrationSummary summary = orchestrator.runAll();

        assertThat(summary.results()).extracting(SourceRunResult::sourceType)
                .containsExactly(SourceType.API, SourceType.FEED);
    }

    @Test
    void singleSourceRunIgnoresEnabledFlag() {
        properties.getApi().setEnabled(false);
        when(driver.run(api)).thenReturn(result(SourceType.API, RunStatus.SUCCESS, 3));

        SourceRunResult result = orchestrator.runSource(SourceType.API);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.result().recordsLoaded()).isEqualTo(3);
    }

    @Test
    void injectedFailureReportsRecordsBeforeIt() {
        api.records = 10;
        when(driver.run(argThat(e -> e != null && e.sourceType() == SourceType.API))).thenAnswer(inv -> {
            SourceExtractor wrapped = inv.getArgument(0);
            Iterator<Map<String, Object>> it =
                    wrapped.extract(new ExtractionContext("run", null, new RunCounters())).iterator();
            while (it.hasNext()) {
                it.next();
            }
            return result(SourceType.API, RunStatus.SUCCESS, 10);
        });

        SourceRunResult result = orchestrator.runWithFailureInjection(SourceType.API, 5);

        assertThat(result.status()).isEqualTo(SourceRunResult.STATUS_FAILED_INJECTION);
        assertThat(result.recordsBeforeFailure()).isEqualTo(4);
        assertThat(result.error()).isEqualTo("Injected failure at record 5");
        assertThat(result.isFailed()).isTrue();
    }

    @Test
    void injectionPastTheEndCompletesNormally() {
        api.records = 3;
        when(driver.run(any())).thenAnswer(inv -> {
            SourceExtractor wrapped = inv.getArgument(0);
            wrapped.extract(new ExtractionContext("run", null, new RunCounters())).forEach(r -> { });
            return result(SourceType.API, RunStatus.SUCCESS, 3);
        });

        SourceRunResult result = orchestrator.runWithFailureInjection(SourceType.API, 50);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.recordsBeforeFailure()).isNull();
    }

    @Test
    void unknownExtractorIsRejected() {
        EtlOrchestrator onlyApi = new EtlOrchestrator(driver, List.of(api), properties);

        assertThatThrownBy(() -> onlyApi.runSource(SourceType.FEED))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> onlyApi.runWithFailureInjection(SourceType.FEED, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static ExtractionResult result(SourceType type, RunStatus status, int loaded) {
        return new ExtractionResult("run-" + type.value(), type, status, loaded, loaded, loaded, 0, 0);
    }

    private static final class StubExtractor implements SourceExtractor {

        private final SourceType type;
        private int records;

        StubExtractor(SourceType type) {
            this.type = type;
        }

        @Override
        public SourceType sourceType() {
            return type;
        }

        @Override
        public String name() {
            return type.value() + "-stub";
        }

        @Override
        public Stream<Map<String, Object>> extract(ExtractionContext context) {
            return IntStream.rangeClosed(1, records).mapToObj(i -> Map.<String, Object>of("id", i));
        }

        @Override
        public String sourceId(Map<String, Object> raw) {
            return String.valueOf(raw.get("id"));
        }

        @Override
        public UnifiedRecord transform(Map<String, Object> raw) {
            return UnifiedRecord.builder().title(sourceId(raw)).extraData(Map.of()).build();
        }
    }
}

package co.fanki.codegraph.analysis.application;

import co.fanki.codegraph.graph.domain.GraphBackend;

import org.easymock.IMocksControl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.createStrictControl;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for AnalysisCoordinator.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AnalysisCoordinatorTest {

    private static final Path ROOT = Path.of("/work/shop");

    private AnalysisReport report;

    @BeforeEach
    void setUp() {
        report = new AnalysisReport(ROOT.toString(), 0, 0, List.of(),
                List.of(), Map.of(), Map.of(), List.of(), 0L);
    }

    @Test
    void whenAnalyzing_givenForce_shouldClearGraphBeforeAnalyzing() {
        final IMocksControl control = createStrictControl();
        final GraphBackend backend = control.createMock(GraphBackend.class);
        final ProjectAnalysisService service = control.createMock(
                ProjectAnalysisService.class);
        backend.clear();
        expectLastCall();
        expect(service.analyze(ROOT)).andReturn(report);
        control.replay();

        final AnalysisReport result = new AnalysisCoordinator(service,
                backend, 5).analyze(ROOT, true);

        control.verify();
        assertSame(report, result);
    }

    @Test
    void whenAnalyzing_givenNoForce_shouldKeepGraph() {
        final GraphBackend backend = createMock(GraphBackend.class);
        final ProjectAnalysisService service = createMock(
                ProjectAnalysisService.class);
        expect(service.analyze(ROOT)).andReturn(report);
        replay(backend, service);

        final AnalysisCoordinator coordinator = new AnalysisCoordinator(
                service, backend, 5);
        coordinator.analyze(ROOT, false);

        verify(backend, service);
        final AnalysisStatus status = coordinator.status();
        assertFalse(status.running());
        assertNull(status.currentProject());
        assertSame(report, status.lastReport());
    }

    @Test
    void whenAnalyzing_givenServiceFailure_shouldReleaseLock() {
        final GraphBackend backend = createMock(GraphBackend.class);
        final ProjectAnalysisService service = createMock(
                ProjectAnalysisService.class);
        expect(service.analyze(ROOT)).andThrow(
                new IllegalArgumentException("not a directory"));
        expect(service.analyze(ROOT)).andReturn(report);
        replay(backend, service);

        final AnalysisCoordinator coordinator = new AnalysisCoordinator(
                service, backend, 5);

        assertThrows(IllegalArgumentException.class,
                () -> coordinator.analyze(ROOT, false));
        assertFalse(coordinator.status().running());
        assertSame(report, coordinator.analyze(ROOT, false));
        verify(backend, service);
    }

    @Test
    void whenAnalyzing_givenRunningBatch_shouldRejectForceAndTimeOutWait()
            throws Exception {
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final GraphBackend backend = createMock(GraphBackend.class);
        final ProjectAnalysisService service = createMock(
                ProjectAnalysisService.class);
        expect(service.analyze(ROOT)).andAnswer(() -> {
            started.countDown();
            release.await(10, TimeUnit.SECONDS);
            return report;
        });
        replay(backend, service);

        final AnalysisCoordinator coordinator = new AnalysisCoordinator(
                service, backend, 1);
        final ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            final Future<AnalysisReport> running = executor.submit(
                    () -> coordinator.analyze(ROOT, false));
            assertTrue(started.await(10, TimeUnit.SECONDS));

            final AnalysisStatus status = coordinator.status();
            assertTrue(status.running());
            assertEquals(ROOT.toString(), status.currentProject());

            final AnalysisConflictException forced = assertThrows(
                    AnalysisConflictException.class,
                    () -> coordinator.analyze(Path.of("/work/other"), true));
            assertEquals(AnalysisConflictException.IN_PROGRESS,
                    forced.getErrorCode());
            assertTrue(forced.getMessage().contains(ROOT.toString()));

            final AnalysisConflictException waited = assertThrows(
                    AnalysisConflictException.class,
                    () -> coordinator.analyze(Path.of("/work/other"), false));
            assertEquals(AnalysisConflictException.LOCK_TIMEOUT,
                    waited.getErrorCode());

            release.countDown();
            assertSame(report, running.get(10, TimeUnit.SECONDS));
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
        verify(backend, service);
    }

    @Test
    void whenCreating_givenNonPositiveTimeout_shouldFail() {
        assertThrows(IllegalArgumentException.class,
                () -> new AnalysisCoordinator(
                        createMock(ProjectAnalysisService.class),
                        createMock(GraphBackend.class), 0));
    }

}

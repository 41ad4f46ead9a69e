package co.fanki.codegraph.analysis.application;

import co.fanki.codegraph.shared.DomainException;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Unit tests for AnalysisController error mapping.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AnalysisControllerTest {

    private static final Path ROOT = Path.of("/work/shop");

    @Test
    void whenAnalyzing_givenSuccess_shouldReturnReport() {
        final AnalysisReport report = new AnalysisReport(ROOT.toString(), 1, 1,
                List.of(), List.of(), Map.of(), Map.of(), List.of(), 5L);
        final AnalysisCoordinator coordinator = createMock(
                AnalysisCoordinator.class);
        expect(coordinator.analyze(ROOT, false)).andReturn(report);
        replay(coordinator);

        final ResponseEntity<?> response = new AnalysisController(coordinator)
                .analyze(new AnalysisController.AnalyzeRequest(
                        ROOT.toString(), false));

        verify(coordinator);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertSame(report, response.getBody());
    }

    @Test
    void whenAnalyzing_givenRunningBatch_shouldReturnConflict() {
        final AnalysisCoordinator coordinator = createMock(
                AnalysisCoordinator.class);
        expect(coordinator.analyze(ROOT, true)).andThrow(
                AnalysisConflictException.inProgress("/work/other"));
        replay(coordinator);

        final ResponseEntity<?> response = new AnalysisController(coordinator)
                .analyze(new AnalysisController.AnalyzeRequest(
                        ROOT.toString(), true));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals(AnalysisConflictException.IN_PROGRESS,
                errorBody(response).get("errorCode"));
    }

    @Test
    void whenAnalyzing_givenBlankPath_shouldReturnBadRequest() {
        final AnalysisCoordinator coordinator = createMock(
                AnalysisCoordinator.class);
        replay(coordinator);

        final ResponseEntity<?> response = new AnalysisController(coordinator)
                .analyze(new AnalysisController.AnalyzeRequest(" ", false));

        verify(coordinator);
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("INVALID_REQUEST", errorBody(response).get("errorCode"));
    }

    @Test
    void whenAnalyzing_givenUnreadableProject_shouldReturnServerError() {
        final AnalysisCoordinator coordinator = createMock(
                AnalysisCoordinator.class);
        expect(coordinator.analyze(ROOT, false)).andThrow(new DomainException(
                "Failed to list files", "PROJECT_READ_FAILURE"));
        replay(coordinator);

        final ResponseEntity<?> response = new AnalysisController(coordinator)
                .analyze(new AnalysisController.AnalyzeRequest(
                        ROOT.toString(), false));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR,
                response.getStatusCode());
        assertEquals("PROJECT_READ_FAILURE",
                errorBody(response).get("errorCode"));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, String> errorBody(
            final ResponseEntity<?> response) {
        return (Map<String, String>) response.getBody();
    }

}

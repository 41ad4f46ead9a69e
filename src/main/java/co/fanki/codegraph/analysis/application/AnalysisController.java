package co.fanki.codegraph.analysis.application;

import co.fanki.codegraph.shared.DomainException;
import co.fanki.codegraph.shared.Preconditions;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.Map;

/**
 * REST controller that triggers analysis batches.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/analysis")
@Tag(name = "Analysis",
        description = "Analyze a JavaScript/TypeScript project into the graph")
public class AnalysisController {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalysisController.class);

    private final AnalysisCoordinator coordinator;

    /**
     * Creates a new AnalysisController.
     *
     * @param theCoordinator the analysis coordinator
     */
    public AnalysisController(final AnalysisCoordinator theCoordinator) {
        this.coordinator = theCoordinator;
    }

    /**
     * Analyzes a project directory.
     *
     * <p>Waits for a running batch unless {@code force} is set, in which
     * case the graph is cleared first and a running batch is a
     * conflict.</p>
     *
     * @param request the analysis request
     * @return the batch report, or an error body
     */
    @Operation(
            summary = "Analyze a project directory",
            description = "Parses every supported source file under the path,"
                    + " builds the graph and runs the enrichment passes."
                    + " With force=true the graph is cleared first and the"
                    + " request fails if another analysis is running."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Analysis completed",
                    content = @Content(schema = @Schema(
                            implementation = AnalysisReport.class))),
            @ApiResponse(responseCode = "400", description = "Invalid path"),
            @ApiResponse(responseCode = "409",
                    description = "Another analysis holds the graph")
    })
    @PostMapping
    public ResponseEntity<?> analyze(
            @RequestBody final AnalyzeRequest request) {

        LOG.info("Received analysis request for: {} (force: {})",
                request.path(), request.force());

        try {
            Preconditions.requireNonBlank(request.path(), "Path is required");
            final AnalysisReport report = coordinator.analyze(
                    Path.of(request.path()), request.force());
            return ResponseEntity.ok(report);
        } catch (final AnalysisConflictException e) {
            LOG.warn("Analysis rejected: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(
                    error(e.getMessage(), e.getErrorCode()));
        } catch (final IllegalArgumentException e) {
            LOG.warn("Invalid analysis request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(
                    error(e.getMessage(), "INVALID_REQUEST"));
        } catch (final DomainException e) {
            LOG.error("Analysis failed: {}", e.getMessage());
            return ResponseEntity.internalServerError().body(
                    error(e.getMessage(), e.getErrorCode()));
        }
    }

    /**
     * Reports whether an analysis is running and the last report.
     *
     * @return the coordinator status
     */
    @Operation(summary = "Get the analysis status")
    @GetMapping("/status")
    public ResponseEntity<AnalysisStatus> status() {
        return ResponseEntity.ok(coordinator.status());
    }

    private static Map<String, String> error(final String message,
            final String errorCode) {
        return Map.of("error", String.valueOf(message),
                "errorCode", errorCode);
    }

    /**
     * Request body for an analysis.
     *
     * @param path the project directory on the server's file system
     * @param force whether to clear the graph and fail on a running batch
     */
    public record AnalyzeRequest(String path, boolean force) {}

}

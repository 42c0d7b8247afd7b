package org.neuralchilli.marshal.api;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.jboss.resteasy.reactive.RestResponse;
import org.neuralchilli.marshal.domain.LedgerEvent;
import org.neuralchilli.marshal.domain.Run;
import org.neuralchilli.marshal.ledger.LedgerVerification;
import org.neuralchilli.marshal.replay.ReplayOptions;
import org.neuralchilli.marshal.replay.ReplayResult;
import org.neuralchilli.marshal.service.ConfigurationException;
import org.neuralchilli.marshal.service.OrchestratorService;
import org.neuralchilli.marshal.service.RunReport;
import org.neuralchilli.marshal.service.RunRequest;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

@Path("/runs")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class RunResource {

    @Inject
    OrchestratorService orchestrator;

    /**
     * Start a run. With {@code wait=true} the call blocks until the run ends and
     * returns the full report.
     */
    @POST
    public RestResponse<Object> start(RunRequest request, @QueryParam("wait") @DefaultValue("false") boolean wait) {
        if (wait) {
            return RestResponse.ok(orchestrator.run(request));
        }
        return RestResponse.accepted(orchestrator.start(request));
    }

    @GET
    public List<Run> list() {
        return orchestrator.listRuns();
    }

    @GET
    @Path("/{runId}")
    public RunReport get(@PathParam("runId") String runId) {
        return orchestrator.report(runId);
    }

    @GET
    @Path("/{runId}/events")
    public List<LedgerEvent> events(@PathParam("runId") String runId) {
        return orchestrator.events(runId);
    }

    @GET
    @Path("/{runId}/verify")
    public LedgerVerification verify(@PathParam("runId") String runId) {
        return orchestrator.verify(runId);
    }

    @POST
    @Path("/{runId}/cancel")
    public Run cancel(@PathParam("runId") String runId) {
        return orchestrator.cancel(runId);
    }

    @POST
    @Path("/{runId}/resume")
    public RunReport resume(@PathParam("runId") String runId) {
        return orchestrator.resume(runId);
    }

    @POST
    @Path("/{runId}/replay")
    public ReplayResult replay(
            @PathParam("runId") String runId,
            @QueryParam("from") String fromStep,
            @QueryParam("to") String toStep,
            @QueryParam("override") @DefaultValue("false") boolean override
    ) {
        return orchestrator.replay(runId, new ReplayOptions(fromStep, toStep, override));
    }

    @POST
    @Path("/{runId}/export")
    public Map<String, String> export(@PathParam("runId") String runId) {
        return Map.of("path", orchestrator.export(runId).toString());
    }

    /**
     * Retention: remove finished runs older than {@code olderThan} (ISO-8601 duration).
     */
    @DELETE
    public Map<String, Integer> cleanup(@QueryParam("olderThan") @DefaultValue("P30D") String olderThan) {
        Instant cutoff;
        try {
            cutoff = Instant.now().minus(Duration.parse(olderThan));
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("olderThan must be an ISO-8601 duration, got: " + olderThan, e);
        }
        return Map.of("removed", orchestrator.cleanup(cutoff));
    }
}

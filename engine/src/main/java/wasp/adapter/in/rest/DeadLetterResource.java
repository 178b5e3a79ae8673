package wasp.adapter.in.rest;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import wasp.adapter.in.dto.DeadLetterResponse;
import wasp.core.port.out.DeadLetterRepository;

/**
 * Lists verdict events the ingestion pipeline gave up on, newest first.
 */
@Path("/admin/dead-letters")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class DeadLetterResource {

    private final DeadLetterRepository deadLetters;

    public DeadLetterResource(DeadLetterRepository deadLetters) {
        this.deadLetters = deadLetters;
    }

    @GET
    public Response listDeadLetters(@QueryParam("limit") Integer limit) {
        final var effectiveLimit = limit != null && limit > 0 ? limit : 100;
        final var response = deadLetters.findRecent(effectiveLimit).stream()
                .map(DeadLetterResponse::fromModel)
                .toList();
        return Response.ok(Map.of("dead_letters", response, "count", response.size(), "total", deadLetters.count()))
                .build();
    }
}

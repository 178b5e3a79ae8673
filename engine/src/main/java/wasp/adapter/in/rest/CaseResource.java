package wasp.adapter.in.rest;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import wasp.adapter.in.dto.CaseResponse;
import wasp.core.model.evidence.CaseKey;
import wasp.core.model.evidence.CaseRecord;
import wasp.core.port.out.CaseRepository;

/**
 * Read-only administration of cases.
 *
 * <ul>
 *   <li>{@code GET /admin/cases?limit=N} - most recently seen cases</li>
 *   <li>{@code GET /admin/cases/{id}} - one case by id</li>
 *   <li>{@code GET /admin/cases/lookup?zone=&ip=&asn=} - one case by key</li>
 * </ul>
 */
@Path("/admin/cases")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class CaseResource {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 1000;

    private final CaseRepository repository;

    public CaseResource(CaseRepository repository) {
        this.repository = repository;
    }

    @GET
    public Uni<Response> listCases(@QueryParam("limit") Integer limit) {
        final var effectiveLimit = limit != null && limit > 0 ? Math.min(limit, MAX_LIMIT) : DEFAULT_LIMIT;
        return repository.findRecent(effectiveLimit).map(cases -> {
            final var response = cases.stream().map(CaseResponse::fromModel).toList();
            return Response.ok(Map.of("cases", response, "count", response.size(), "limit", effectiveLimit))
                    .build();
        });
    }

    @GET
    @Path("/lookup")
    public Uni<Response> lookupCase(
            @QueryParam("zone") String zone, @QueryParam("ip") String ip, @QueryParam("asn") Long asn) {
        if (zone == null || ip == null || ip.isBlank() || asn == null) {
            return Uni.createFrom()
                    .item(Response.status(Response.Status.BAD_REQUEST)
                            .entity(Map.of("error", "zone, ip and asn are required"))
                            .build());
        }
        final var key = new CaseKey(zone, ip, asn);
        return repository.findByKey(key).map(found -> found.map(CaseResource::ok)
                .orElseGet(() -> notFound("No case for key " + key.value())));
    }

    @GET
    @Path("/{id}")
    public Uni<Response> getCase(@PathParam("id") String id) {
        return repository.findById(id).map(found -> found.map(CaseResource::ok)
                .orElseGet(() -> notFound("Case not found: " + id)));
    }

    private static Response ok(CaseRecord record) {
        return Response.ok(CaseResponse.fromModel(record)).build();
    }

    private static Response notFound(String message) {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(Map.of("error", message))
                .build();
    }
}

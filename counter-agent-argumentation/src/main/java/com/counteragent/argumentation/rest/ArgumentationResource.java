package com.counteragent.argumentation.rest;

import com.counteragent.argumentation.rest.dto.AttackGraphPayload;
import com.counteragent.argumentation.rest.dto.AttackGraphRequest;
import com.counteragent.argumentation.rest.dto.StrengthPayload;
import com.counteragent.argumentation.rest.dto.ValidationPayload;
import com.counteragent.argumentation.rest.dto.ValidationRequest;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

@Path("/argumentation")
@Tag(name = "argumentation", description = "Counter-argument validation and attack-graph evaluation")
public class ArgumentationResource {

    private final ArgumentationService service;

    @Inject
    public ArgumentationResource(ArgumentationService service) {
        this.service = service;
    }

    @POST
    @Path("/validate")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public ValidationPayload validate(ValidationRequest request) {
        return service.validate(request);
    }

    @POST
    @Path("/strength")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public StrengthPayload strength(AttackGraphRequest request) {
        return service.assess(request);
    }

    @POST
    @Path("/attack-graph")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public AttackGraphPayload attackGraph(AttackGraphRequest request) {
        return service.attackGraph(request);
    }

    @POST
    @Path("/attack-graph/text")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.TEXT_PLAIN)
    public String attackGraphText(AttackGraphRequest request) {
        return service.attackGraphText(request);
    }
}
